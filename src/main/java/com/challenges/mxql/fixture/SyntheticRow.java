package com.challenges.mxql.fixture;

import com.challenges.mxql.payload.PayloadNode;
import org.eclipse.collections.api.map.MutableMap;

/**
 * One generated record, field name to value, in field order.
 */
public record SyntheticRow(MutableMap<String, PayloadNode> values) {

    public PayloadNode.PayloadObject toPayload() {
        PayloadNode.PayloadObject row = PayloadNode.PayloadObject.empty();
        for (var entry : values.keyValuesView()) {
            row = row.with(entry.getOne(), entry.getTwo());
        }
        return row;
    }
}
