package com.challenges.mxql.validation;

import com.challenges.mxql.payload.PayloadNode;
import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandFields;
import com.challenges.mxql.query.CommandKind;
import com.challenges.mxql.query.Durations;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.OptionalLong;

import static com.challenges.mxql.validation.StructuralValidator.issue;

/**
 * Advisory findings about filter placement, projection breadth, bucket granularity and
 * result size. Never reports anything Critical.
 */
public class PerformanceAnalyzer {

    public MutableList<Issue> check(Query query, ValidatorSettings settings) {
        MutableList<Issue> issues = Lists.mutable.empty();
        OptionalLong topRange = declaredRange(query);
        query.scopes().forEach(scope -> {
            OptionalLong range = declaredRange(scope);
            checkScope(scope, range.isPresent() ? range : topRange, settings, issues);
        });

        if (query.commands().notEmpty()
            && !query.contains(CommandKind.BOUND)
            && !query.contains(CommandKind.AGGREGATE)) {
            Command last = query.commands().getLast();
            issues.add(issue(last, IssueCode.UNBOUNDED_RESULT,
                "No LIMIT and no aggregation - the query may return a large result set",
                "Add LIMIT, or GROUP and UPDATE to summarise the rows"));
        }
        return issues;
    }

    private void checkScope(Query scope, OptionalLong range, ValidatorSettings settings, MutableList<Issue> issues) {
        boolean sawGroup = false;
        MutableMap<String, String> functionByTarget = Maps.mutable.empty();

        for (Command command : scope.commands()) {
            switch (command.kind()) {
                case GROUP -> {
                    sawGroup = true;
                    checkGranularity(command, range, settings, issues);
                }
                case FILTER -> {
                    if (sawGroup) {
                        issues.add(issue(command, IssueCode.LATE_FILTER,
                            "FILTER after GROUP (late filter - processes larger-than-necessary dataset)",
                            "Move FILTER before GROUP for better performance"));
                    }
                }
                case PROJECT -> {
                    if (CommandFields.isWildcardProjection(command)) {
                        issues.add(issue(command, IssueCode.WILDCARD_PROJECTION,
                            command.name() + " [*] includes all fields - may impact performance",
                            "Select only needed fields explicitly"));
                    }
                }
                case AGGREGATE -> CommandFields.aggregateFunction(command).ifPresent(fn ->
                    CommandFields.aggregateTargets(command).forEach(target -> {
                        String earlier = functionByTarget.getIfAbsentPut(target, fn);
                        if (!earlier.equals(fn)) {
                            issues.add(issue(command, IssueCode.COMBINABLE_AGGREGATES,
                                "'" + target + "' is aggregated with both " + earlier + " and " + fn
                                    + " in this scope - consider combining",
                                "Compute both functions in a single " + command.name() + " command"));
                        }
                    }));
                default -> {
                    // nothing to score
                }
            }
        }
    }

    private void checkGranularity(Command group, OptionalLong range, ValidatorSettings settings,
                                  MutableList<Issue> issues) {
        if (range.isEmpty()) {
            return;
        }
        CommandFields.groupTimeUnit(group).map(Durations::toMillis).ifPresent(unit -> {
            if (unit.isEmpty() || unit.getAsLong() <= 0) {
                return;
            }
            double buckets = (double) range.getAsLong() / unit.getAsLong();
            if (buckets > settings.granularityRatio()) {
                issues.add(issue(group, IssueCode.EXCESSIVE_GRANULARITY,
                    String.format("Time bucket of %d ms over a %d ms range creates about %.0f buckets (excessive granularity)",
                        unit.getAsLong(), range.getAsLong(), buckets),
                    "Use a coarser timeunit or a shorter time range"));
            }
        });
    }

    /**
     * Time range declared in this scope by TIMEPAST, or by stime/etime, duration or
     * timepast on a loader.
     */
    static OptionalLong declaredRange(Query scope) {
        for (Command command : scope.commands()) {
            if (command.is(CommandKind.TIME_RANGE) && command.payload().isPresent()) {
                OptionalLong range = Durations.toMillis(command.payload().get());
                if (range.isPresent()) {
                    return range;
                }
            }
            if (command.is(CommandKind.LOAD) && command.payloadObject().isPresent()) {
                PayloadNode.PayloadObject object = command.payloadObject().get();
                OptionalLong start = object.get("stime").map(Durations::toMillis).orElse(OptionalLong.empty());
                OptionalLong end = object.get("etime").map(Durations::toMillis).orElse(OptionalLong.empty());
                if (start.isPresent() && end.isPresent() && end.getAsLong() > start.getAsLong()) {
                    return OptionalLong.of(end.getAsLong() - start.getAsLong());
                }
                OptionalLong duration = object.getAny("duration", "timepast")
                    .map(Durations::toMillis).orElse(OptionalLong.empty());
                if (duration.isPresent()) {
                    return duration;
                }
            }
        }
        return OptionalLong.empty();
    }
}
