package com.challenges.mxql.query;

import com.challenges.mxql.payload.ParsedPayload;
import com.challenges.mxql.payload.PayloadNode;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * One pipeline stage.
 *
 * @param index      document-order position across every scope, starting at 0
 * @param name       keyword as written
 * @param kind       role selected by the keyword
 * @param rawPayload payload text as written, {@code null} when absent
 * @param parsed     parsed payload, {@code null} when absent or unreadable
 * @param parseError reason the payload could not be read, {@code null} otherwise
 * @param line       1-based source line
 * @param column     1-based source column
 * @param balanced   {@code false} when the payload's delimiters were never closed
 * @param scope      qualified subquery name, {@code null} for the top level
 */
public record Command(int index, String name, CommandKind kind, String rawPayload, ParsedPayload parsed,
                      String parseError, int line, int column, boolean balanced, String scope) {

    public static Command synthetic(CommandKind kind, PayloadNode payload) {
        ParsedPayload parsed = payload == null ? null
            : new ParsedPayload(payload, 0, Lists.immutable.empty());
        return new Command(-1, kind.keyword(), kind, null, parsed, null, 0, 0, true, null);
    }

    public boolean hasPayload() {
        return rawPayload != null || parsed != null;
    }

    public boolean isSynthetic() {
        return index < 0;
    }

    public Optional<PayloadNode> payload() {
        return parsed == null ? Optional.empty() : Optional.of(parsed.value());
    }

    public Optional<PayloadNode.PayloadObject> payloadObject() {
        return payload()
            .filter(PayloadNode.PayloadObject.class::isInstance)
            .map(PayloadNode.PayloadObject.class::cast);
    }

    /**
     * The payload value, or the value under the first of {@code keys} present when the
     * payload is an object, as text.
     */
    public Optional<String> argument(String... keys) {
        Optional<PayloadNode> value = payload();
        if (value.isPresent() && value.get() instanceof PayloadNode.PayloadObject object) {
            value = object.getAny(keys);
        }
        return value.flatMap(node -> node instanceof PayloadNode.PayloadNumber number
            ? Optional.of(number.toLiteral())
            : node.text());
    }

    public boolean is(CommandKind other) {
        return kind == other;
    }
}
