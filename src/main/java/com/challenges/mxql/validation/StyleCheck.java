package com.challenges.mxql.validation;

import com.challenges.mxql.payload.ParsedPayload;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Readability notes gathered while parsing payloads.
 */
public class StyleCheck {

    public MutableList<Issue> check(Query query) {
        MutableList<Issue> issues = Lists.mutable.empty();
        query.allCommands().forEach(command -> {
            ParsedPayload parsed = command.parsed();
            if (parsed == null) {
                return;
            }
            if (parsed.trailingSeparators() > 0) {
                issues.add(StructuralValidator.issue(command, IssueCode.TRAILING_SEPARATOR,
                    command.name() + " payload has a trailing separator before a closing bracket",
                    "Remove the ',' before the closing bracket"));
            }
            if (parsed.unquotedKeys().notEmpty()) {
                issues.add(StructuralValidator.issue(command, IssueCode.UNQUOTED_KEY,
                    "Field names without quotes (valid but not recommended for readability)",
                    "Consider using quotes: " + parsed.unquotedKeys().makeString(", ")));
            }
        });
        return issues;
    }
}
