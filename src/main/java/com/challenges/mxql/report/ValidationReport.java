package com.challenges.mxql.report;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Outcome of validating one query text.
 */
public record ValidationReport(ImmutableList<Issue> issues) {

    public static ValidationReport of(IssueAggregator aggregator) {
        return new ValidationReport(aggregator.aggregate());
    }

    public boolean valid() {
        return count(Severity.CRITICAL) == 0;
    }

    public int count(Severity severity) {
        return issues.count(issue -> issue.severity() == severity);
    }

    public ImmutableList<Issue> withSeverity(Severity severity) {
        return issues.select(issue -> issue.severity() == severity);
    }

    public ImmutableList<Issue> withCode(IssueCode code) {
        return issues.select(issue -> issue.code() == code);
    }

    public String summary() {
        String verdict = valid() ? "Query is valid" : "Query has critical issues";
        return String.format("%s (%d critical, %d warnings, %d info)",
            verdict, count(Severity.CRITICAL), count(Severity.WARNING), count(Severity.INFO));
    }
}
