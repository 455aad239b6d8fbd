package com.challenges.mxql.report;

public enum IssueCategory {
    STRUCTURAL,
    SEMANTIC,
    PERFORMANCE,
    STYLE,
    METADATA
}
