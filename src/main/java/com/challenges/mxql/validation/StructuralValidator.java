package com.challenges.mxql.validation;

import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandKind;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Per-command well-formedness. Reports at most one structural issue per command and
 * never looks at relationships between commands.
 */
public class StructuralValidator {

    public MutableList<Issue> check(Query query) {
        MutableList<Issue> issues = Lists.mutable.empty();
        query.allCommands().forEach(command -> checkCommand(command, issues));
        return issues;
    }

    private void checkCommand(Command command, MutableList<Issue> issues) {
        if (!command.balanced()) {
            issues.add(issue(command, IssueCode.UNBALANCED_DELIMITERS,
                command.name() + " payload has unbalanced brackets or braces",
                "Close every '{' and '[' opened in the payload"));
        } else if (command.parseError() != null) {
            issues.add(issue(command, IssueCode.MALFORMED_PAYLOAD,
                command.name() + " payload is malformed: " + command.parseError(),
                "Check separators and quotes in the payload"));
        } else if (!command.hasPayload() && command.kind().payloadRule() == CommandKind.PayloadRule.REQUIRED) {
            issues.add(issue(command, IssueCode.MISSING_PAYLOAD,
                command.name() + " requires a payload", null));
        } else if (command.hasPayload() && command.kind().payloadRule() == CommandKind.PayloadRule.FORBIDDEN) {
            issues.add(issue(command, IssueCode.UNEXPECTED_PAYLOAD,
                command.name() + " takes no payload", "Remove the text after " + command.name()));
        }

        if (command.is(CommandKind.UNKNOWN)) {
            issues.add(issue(command, IssueCode.UNKNOWN_COMMAND,
                "Unknown command '" + command.name() + "'", "Check the command name for typos"));
        }
    }

    static Issue issue(Command command, IssueCode code, String message, String suggestion) {
        return new Issue(code, message, command.index(), command.line(), command.scope(), suggestion);
    }
}
