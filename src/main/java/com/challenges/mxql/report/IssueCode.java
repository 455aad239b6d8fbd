package com.challenges.mxql.report;

/**
 * Stable identifiers for every finding the analyser can report, together with
 * the severity and category each one is always reported under.
 */
public enum IssueCode {
    // structural
    UNBALANCED_DELIMITERS(Severity.CRITICAL, IssueCategory.STRUCTURAL),
    MALFORMED_PAYLOAD(Severity.CRITICAL, IssueCategory.STRUCTURAL),
    MISSING_PAYLOAD(Severity.CRITICAL, IssueCategory.STRUCTURAL),
    UNEXPECTED_PAYLOAD(Severity.CRITICAL, IssueCategory.STRUCTURAL),
    UNEXPECTED_TEXT(Severity.CRITICAL, IssueCategory.STRUCTURAL),
    UNMATCHED_BLOCK_CLOSE(Severity.CRITICAL, IssueCategory.STRUCTURAL),
    UNCLOSED_BLOCK(Severity.CRITICAL, IssueCategory.STRUCTURAL),
    NESTED_SUBQUERY(Severity.CRITICAL, IssueCategory.STRUCTURAL),

    // semantic
    LOADER_WITHOUT_SOURCE(Severity.CRITICAL, IssueCategory.SEMANTIC),
    AGGREGATE_WITHOUT_GROUPING(Severity.CRITICAL, IssueCategory.SEMANTIC),
    UNDEFINED_SUBQUERY(Severity.CRITICAL, IssueCategory.SEMANTIC),
    GROUP_INVALID_PARAMETER(Severity.CRITICAL, IssueCategory.SEMANTIC),
    INVALID_BOUND(Severity.CRITICAL, IssueCategory.SEMANTIC),
    BOUND_WITHOUT_ORDER(Severity.WARNING, IssueCategory.SEMANTIC),
    DUPLICATE_SUBQUERY(Severity.WARNING, IssueCategory.SEMANTIC),
    MISSING_LOADER(Severity.WARNING, IssueCategory.SEMANTIC),
    UNKNOWN_COMMAND(Severity.WARNING, IssueCategory.SEMANTIC),
    REDUNDANT_PROJECTION(Severity.INFO, IssueCategory.SEMANTIC),

    // performance
    LATE_FILTER(Severity.WARNING, IssueCategory.PERFORMANCE),
    WILDCARD_PROJECTION(Severity.WARNING, IssueCategory.PERFORMANCE),
    EXCESSIVE_GRANULARITY(Severity.WARNING, IssueCategory.PERFORMANCE),
    UNBOUNDED_RESULT(Severity.INFO, IssueCategory.PERFORMANCE),
    COMBINABLE_AGGREGATES(Severity.INFO, IssueCategory.PERFORMANCE),

    // style
    TRAILING_SEPARATOR(Severity.INFO, IssueCategory.STYLE),
    UNQUOTED_KEY(Severity.INFO, IssueCategory.STYLE),

    // metadata
    UNKNOWN_FIELD(Severity.WARNING, IssueCategory.METADATA),
    CATEGORY_METADATA_UNAVAILABLE(Severity.INFO, IssueCategory.METADATA);

    private final Severity severity;
    private final IssueCategory category;

    IssueCode(Severity severity, IssueCategory category) {
        this.severity = severity;
        this.category = category;
    }

    public Severity severity() {
        return severity;
    }

    public IssueCategory category() {
        return category;
    }
}
