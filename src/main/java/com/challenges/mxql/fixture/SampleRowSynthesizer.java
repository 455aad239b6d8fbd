package com.challenges.mxql.fixture;

import com.challenges.mxql.payload.PayloadNode;
import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandFields;
import com.challenges.mxql.query.CommandKind;
import com.challenges.mxql.query.Durations;
import com.challenges.mxql.query.Query;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Generates plausible rows covering every field a query refers to.
 * <p>
 * Numeric fields vary monotonically from row to row, string fields get labelled values
 * such as {@code sample-1}, and a strictly increasing {@code time} column is added when
 * the query buckets by time. Every row carries the {@code oid} and {@code oname} object
 * columns that loaded data always has.
 */
public class SampleRowSynthesizer {
    public static final int DEFAULT_ROWS = 3;
    public static final String TIME_FIELD = "time";
    static final ImmutableList<String> OBJECT_FIELDS = Lists.immutable.with("oid", "oname");
    static final long BASE_TIMESTAMP = 1_700_000_000_000L;
    static final long DEFAULT_STEP = 60_000L;

    private final FieldReferenceExtractor extractor = new FieldReferenceExtractor();

    public ImmutableList<SyntheticRow> synthesize(Query query) {
        return synthesize(query, DEFAULT_ROWS);
    }

    public ImmutableList<SyntheticRow> synthesize(Query query, int rowCount) {
        if (rowCount < 1) {
            throw new IllegalArgumentException("rowCount must be at least 1: " + rowCount);
        }
        ImmutableList<FieldReference> references = extractor.extract(query);
        ImmutableSet<String> numeric = extractor.numericFields(query);
        OptionalLong bucket = timeBucket(query);

        MutableMap<String, FieldType> types = MapAdapter.adapt(new LinkedHashMap<>());
        if (bucket.isPresent()) {
            types.put(TIME_FIELD, FieldType.TIMESTAMP);
        }
        OBJECT_FIELDS.forEach(field -> types.put(field, typeOf(field, numeric)));
        references.forEach(reference -> types.getIfAbsentPut(reference.field(), () -> typeOf(reference.field(), numeric)));

        long step = bucket.orElse(DEFAULT_STEP);
        MutableList<SyntheticRow> rows = Lists.mutable.empty();
        for (int row = 0; row < rowCount; row++) {
            MutableMap<String, PayloadNode> values = MapAdapter.adapt(new LinkedHashMap<>());
            for (var entry : types.keyValuesView()) {
                values.put(entry.getOne(), valueFor(entry.getOne(), entry.getTwo(), row, step));
            }
            rows.add(new SyntheticRow(values));
        }
        return rows.toImmutable();
    }

    // finest GROUP timeunit, in millis
    static OptionalLong timeBucket(Query query) {
        long finest = Long.MAX_VALUE;
        for (Command command : query.allCommands()) {
            if (!command.is(CommandKind.GROUP)) {
                continue;
            }
            OptionalLong unit = CommandFields.groupTimeUnit(command).map(Durations::toMillis).orElse(OptionalLong.empty());
            if (unit.isPresent() && unit.getAsLong() > 0) {
                finest = Math.min(finest, unit.getAsLong());
            }
        }
        return finest == Long.MAX_VALUE ? OptionalLong.empty() : OptionalLong.of(finest);
    }

    static FieldType typeOf(String field, ImmutableSet<String> numeric) {
        String lower = field.toLowerCase(Locale.ROOT);
        if (lower.equals(TIME_FIELD) || lower.endsWith("_time")) {
            return FieldType.TIMESTAMP;
        }
        if (numeric.contains(field) || lower.equals("oid") || lower.equals("id")) {
            return FieldType.NUMERIC;
        }
        return FieldType.STRING;
    }

    static PayloadNode valueFor(String field, FieldType type, int row, long step) {
        String lower = field.toLowerCase(Locale.ROOT);
        return switch (type) {
            case TIMESTAMP -> PayloadNode.PayloadNumber.of(BASE_TIMESTAMP + row * step);
            case NUMERIC -> PayloadNode.PayloadNumber.of(numericValue(lower, row));
            case STRING -> new PayloadNode.PayloadString(lower.contains("name") ? "instance-" + (row + 1) : "sample-" + (row + 1));
        };
    }

    private static long numericValue(String lower, int row) {
        if (lower.equals("oid") || lower.equals("id")) {
            return 1000L + row;
        }
        if (lower.contains("cpu")) {
            return 50L + row * 10L;
        }
        if (lower.contains("mem")) {
            return 60L + row * 5L;
        }
        if (lower.contains("count")) {
            return 100L + row * 10L;
        }
        if (lower.contains("pct") || lower.contains("percent")) {
            return 70L + row;
        }
        return 10L * (row + 1);
    }
}
