package com.challenges.mxql.report;

public enum Severity {
    CRITICAL(0, "critical"),
    WARNING(1, "warning"),
    INFO(2, "info");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    /**
     * Lower rank sorts first: Critical before Warning before Info.
     */
    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }
}
