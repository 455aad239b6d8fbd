package com.challenges.mxql.report;

import java.util.Objects;

/**
 * A single finding attached to a command of the analysed text.
 *
 * @param code         stable identifier, also fixes severity and category
 * @param message      human-readable description
 * @param commandIndex document-order index of the command, or {@code -1} for query-level findings
 * @param line         1-based source line, or {@code 0} when not tied to a line
 * @param scope        subquery name the command belongs to, {@code null} for the top level
 * @param suggestion   optional remedy, may be {@code null}
 */
public record Issue(IssueCode code, String message, int commandIndex, int line, String scope, String suggestion) {
    public static final int QUERY_LEVEL = -1;

    public Issue {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public Severity severity() {
        return code.severity();
    }

    public IssueCategory category() {
        return code.category();
    }

    public Issue withSuggestion(String text) {
        return new Issue(code, message, commandIndex, line, scope, text);
    }
}
