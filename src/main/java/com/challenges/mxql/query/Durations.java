package com.challenges.mxql.query;

import com.challenges.mxql.payload.PayloadNode;

import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads duration literals such as {@code 5m}, {@code 1h} or {@code 300000} (millis).
 */
public final class Durations {
    private static final Pattern LITERAL = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h|d|w)?");

    private Durations() {
    }

    public static OptionalLong toMillis(PayloadNode node) {
        if (node instanceof PayloadNode.PayloadNumber number) {
            return OptionalLong.of(number.numberValue().longValue());
        }
        return node.text().map(Durations::toMillis).orElse(OptionalLong.empty());
    }

    public static OptionalLong toMillis(String literal) {
        Matcher matcher = LITERAL.matcher(literal.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return OptionalLong.empty();
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        long factor = switch (unit) {
            case "s" -> 1_000L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            case "d" -> 86_400_000L;
            case "w" -> 604_800_000L;
            default -> 1L;
        };
        return OptionalLong.of((long) (amount * factor));
    }
}
