package com.challenges.mxql.query;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Locale;

/**
 * Pipeline roles and the keywords that select them. Keywords are matched case-insensitively.
 */
public enum CommandKind {
    SOURCE(PayloadRule.REQUIRED, "CATEGORY", "SOURCE"),
    LOAD(PayloadRule.OPTIONAL, "TAGLOAD", "FLEX-LOAD", "LOAD"),
    LITERAL_ROW(PayloadRule.REQUIRED, "ADDROW"),
    PROJECT(PayloadRule.REQUIRED, "SELECT", "PROJECT"),
    FILTER(PayloadRule.REQUIRED, "FILTER"),
    GROUP(PayloadRule.REQUIRED, "GROUP"),
    AGGREGATE(PayloadRule.REQUIRED, "UPDATE", "AGGREGATE"),
    ORDER(PayloadRule.REQUIRED, "ORDER", "SORT"),
    BOUND(PayloadRule.REQUIRED, "LIMIT", "BOUND"),
    TIME_RANGE(PayloadRule.REQUIRED, "TIMEPAST"),
    BLOCK_OPEN(PayloadRule.REQUIRED, "SUB"),
    BLOCK_CLOSE(PayloadRule.FORBIDDEN, "END"),
    REFERENCE(PayloadRule.REQUIRED, "APPEND", "JOIN"),
    TRANSFORM(PayloadRule.REQUIRED, "OID", "CREATE", "DELETE", "RENAME", "FORMAT", "UNFOLD", "TIMEADD", "HVTEXT"),
    UNKNOWN(PayloadRule.OPTIONAL);

    public enum PayloadRule {
        REQUIRED,
        OPTIONAL,
        FORBIDDEN
    }

    private static final ImmutableMap<String, CommandKind> BY_KEYWORD;

    static {
        MutableMap<String, CommandKind> keywords = Maps.mutable.empty();
        for (CommandKind kind : values()) {
            for (String keyword : kind.keywords) {
                keywords.put(keyword, kind);
            }
        }
        BY_KEYWORD = keywords.toImmutable();
    }

    private final PayloadRule payloadRule;
    private final String[] keywords;

    CommandKind(PayloadRule payloadRule, String... keywords) {
        this.payloadRule = payloadRule;
        this.keywords = keywords;
    }

    public PayloadRule payloadRule() {
        return payloadRule;
    }

    public String keyword() {
        return keywords.length > 0 ? keywords[0] : name();
    }

    public static CommandKind of(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return BY_KEYWORD.getIfAbsentValue(name.toUpperCase(Locale.ROOT), UNKNOWN);
    }

    public static boolean isKeyword(String name) {
        return name != null && BY_KEYWORD.containsKey(name.toUpperCase(Locale.ROOT));
    }
}
