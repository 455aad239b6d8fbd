package com.challenges.mxql.validation;

import com.challenges.mxql.payload.PayloadNode;
import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandKind;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.query.SubqueryDefinition;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

import static com.challenges.mxql.validation.StructuralValidator.issue;

/**
 * Ordering and dependency rules, checked in one forward pass per scope.
 * <p>
 * A subquery block is checked when its opener is reached, seeing the subquery names
 * defined before it. Its own name becomes visible to the enclosing scope once its END
 * has been passed.
 */
public class SemanticRuleEngine {
    static final String[] REFERENCE_NAME_KEYS = {"query", "id", "name"};

    public MutableList<Issue> check(Query query, ValidationContext context) {
        MutableList<Issue> issues = Lists.mutable.empty();
        checkScope(query, context.enterTopLevel(), context, issues);

        boolean loads = query.commands().anySatisfy(command -> command.is(CommandKind.LOAD)
            || command.is(CommandKind.LITERAL_ROW) || command.is(CommandKind.REFERENCE));
        if (!loads && query.subqueries().isEmpty()) {
            issues.add(new Issue(IssueCode.MISSING_LOADER,
                "Missing data loader command (TAGLOAD, FLEX-LOAD, ADDROW or APPEND)",
                Issue.QUERY_LEVEL, 0, null, "Add TAGLOAD after the CATEGORY command"));
        }
        return issues;
    }

    private void checkScope(Query scope, ValidationContext.ScopeState state, ValidationContext context,
                            MutableList<Issue> issues) {
        for (Command command : scope.commands()) {
            switch (command.kind()) {
                case SOURCE -> state.sawSource = true;
                case LOAD -> {
                    if (!state.sawSource) {
                        issues.add(issue(command, IssueCode.LOADER_WITHOUT_SOURCE,
                            command.name() + " loads data before any CATEGORY selects a source",
                            "Move the CATEGORY command before " + command.name()));
                    }
                    state.sawLoader = true;
                }
                case GROUP -> {
                    checkGroupParameters(command, issues);
                    state.sawGroup = true;
                }
                case AGGREGATE -> {
                    if (!state.sawGroup) {
                        issues.add(issue(command, IssueCode.AGGREGATE_WITHOUT_GROUPING,
                            command.name() + " command without preceding GROUP (aggregate without grouping)",
                            "Add a GROUP command before " + command.name()));
                    }
                }
                case ORDER -> state.sawOrder = true;
                case BOUND -> {
                    checkBoundValue(command, issues);
                    if (!state.sawOrder && !state.sawBound) {
                        issues.add(issue(command, IssueCode.BOUND_WITHOUT_ORDER,
                            command.name() + " without ORDER - result set is non-deterministic",
                            "Add an ORDER command before " + command.name() + " for predictable Top-N results"));
                    }
                    state.sawBound = true;
                }
                case PROJECT -> {
                    state.projections++;
                    if (state.projections > 1) {
                        issues.add(issue(command, IssueCode.REDUNDANT_PROJECTION,
                            "Redundant projection; only the final one before aggregation affects output",
                            "Merge the SELECT commands of this scope"));
                    }
                }
                case REFERENCE -> checkReference(command, state, issues);
                case BLOCK_OPEN -> definitionOpenedBy(scope, command).ifPresent(definition ->
                    checkScope(definition.query(), context.enterScope(state.visibleSubqueries()), context, issues));
                case BLOCK_CLOSE -> definitionClosedBy(scope, command)
                    .ifPresent(definition -> state.define(definition.name()));
                default -> {
                    // no ordering constraints
                }
            }
        }
    }

    private void checkReference(Command command, ValidationContext.ScopeState state, MutableList<Issue> issues) {
        if (!command.hasPayload() || command.parsed() == null) {
            return; // reported as structural
        }
        Optional<String> name = command.argument(REFERENCE_NAME_KEYS);
        if (name.isEmpty()) {
            issues.add(issue(command, IssueCode.UNDEFINED_SUBQUERY,
                command.name() + " does not name a subquery (reference to undefined subquery)",
                "Use " + command.name() + " {query: <sub id>}"));
        } else if (!state.isVisible(name.get())) {
            issues.add(issue(command, IssueCode.UNDEFINED_SUBQUERY,
                "Reference to undefined subquery '" + name.get() + "'",
                "Define SUB {id: " + name.get() + "} ... END before " + command.name()));
        }
    }

    private void checkGroupParameters(Command command, MutableList<Issue> issues) {
        command.payloadObject().ifPresent(object -> {
            if (object.has("key")) {
                issues.add(issue(command, IssueCode.GROUP_INVALID_PARAMETER,
                    "GROUP uses 'key' parameter - should use 'pk' instead",
                    "Use GROUP {pk: \"field\"} or GROUP {timeunit: \"5m\", pk: \"field\"}"));
            }
            if (object.has("value")) {
                issues.add(issue(command, IssueCode.GROUP_INVALID_PARAMETER,
                    "GROUP uses 'value' parameter - this is UPDATE syntax, not GROUP",
                    "GROUP uses keywords such as pk, timeunit, first, last or merge"));
            }
        });
    }

    private void checkBoundValue(Command command, MutableList<Issue> issues) {
        Optional<PayloadNode> value = command.payload();
        if (value.isEmpty()) {
            return;
        }
        boolean positive = value.get() instanceof PayloadNode.PayloadNumber.PayloadLong count && count.value() > 0;
        if (!positive) {
            issues.add(issue(command, IssueCode.INVALID_BOUND,
                command.name() + " expects a positive whole number but got '" + command.rawPayload() + "'", null));
        }
    }

    private static Optional<SubqueryDefinition> definitionOpenedBy(Query scope, Command opener) {
        return Optional.ofNullable(scope.subqueries().detect(definition -> definition.opener().equals(opener)));
    }

    private static Optional<SubqueryDefinition> definitionClosedBy(Query scope, Command closer) {
        return Optional.ofNullable(scope.subqueries().detect(definition -> closer.equals(definition.closer())));
    }
}
