package com.challenges.mxql.output;

import com.challenges.mxql.payload.PayloadNode;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.Severity;
import com.challenges.mxql.report.ValidationReport;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Locale;

/**
 * Renders validation reports as readable text or as JSON.
 */
public class ReportFormatter {
    public enum Format {
        TEXT,
        JSON
    }

    private final Format format;
    private final OutputFormatter json;

    public ReportFormatter(Format format, boolean compact, boolean sortKeys) {
        this.format = format;
        this.json = new OutputFormatter(!compact, sortKeys, OutputFormatter.Style.JSON);
    }

    public String format(ValidationReport report) {
        return format == Format.JSON ? json.format(toPayload(report)) : toText(report);
    }

    String toText(ValidationReport report) {
        if (report.valid() && report.issues().isEmpty()) {
            return "Query is valid!\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(report.summary()).append("\n\n");
        appendSection(sb, "Critical Issues:", report.withSeverity(Severity.CRITICAL));
        appendSection(sb, "Warnings:", report.withSeverity(Severity.WARNING));
        appendSection(sb, "Suggestions:", report.withSeverity(Severity.INFO));
        return sb.toString();
    }

    private void appendSection(StringBuilder sb, String title, ImmutableList<Issue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        sb.append(title).append('\n');
        for (Issue issue : issues) {
            sb.append("  ").append(location(issue)).append(": [").append(issue.code()).append("] ")
                .append(issue.message()).append('\n');
            if (issue.suggestion() != null) {
                sb.append("    -> ").append(issue.suggestion()).append('\n');
            }
        }
        sb.append('\n');
    }

    private static String location(Issue issue) {
        if (issue.commandIndex() == Issue.QUERY_LEVEL) {
            return "Query";
        }
        String where = issue.line() > 0 ? "Line " + issue.line() : "Command " + issue.commandIndex();
        return issue.scope() == null ? where : where + " (in " + issue.scope() + ")";
    }

    PayloadNode toPayload(ValidationReport report) {
        PayloadNode.PayloadArray issues = PayloadNode.PayloadArray.empty();
        for (Issue issue : report.issues()) {
            PayloadNode.PayloadObject entry = PayloadNode.PayloadObject.empty()
                .with("severity", new PayloadNode.PayloadString(issue.severity().label()))
                .with("code", new PayloadNode.PayloadString(issue.code().name()))
                .with("category", new PayloadNode.PayloadString(issue.category().name().toLowerCase(Locale.ROOT)))
                .with("message", new PayloadNode.PayloadString(issue.message()))
                .with("commandIndex", PayloadNode.PayloadNumber.of(issue.commandIndex()))
                .with("line", PayloadNode.PayloadNumber.of(issue.line()))
                .with("scope", issue.scope() == null ? new PayloadNode.PayloadNull() : new PayloadNode.PayloadString(issue.scope()));
            if (issue.suggestion() != null) {
                entry = entry.with("suggestion", new PayloadNode.PayloadString(issue.suggestion()));
            }
            issues = issues.with(entry);
        }

        PayloadNode.PayloadObject summary = PayloadNode.PayloadObject.empty()
            .with("critical", PayloadNode.PayloadNumber.of(report.count(Severity.CRITICAL)))
            .with("warning", PayloadNode.PayloadNumber.of(report.count(Severity.WARNING)))
            .with("info", PayloadNode.PayloadNumber.of(report.count(Severity.INFO)));

        return PayloadNode.PayloadObject.empty()
            .with("valid", new PayloadNode.PayloadBoolean(report.valid()))
            .with("summary", summary)
            .with("issues", issues);
    }
}
