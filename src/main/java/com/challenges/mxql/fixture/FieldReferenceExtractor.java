package com.challenges.mxql.fixture;

import com.challenges.mxql.payload.PayloadNode;
import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandFields;
import com.challenges.mxql.query.Query;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Collects the field names a query refers to in projection, filter, group, aggregate and
 * order positions, across every scope, in document order.
 */
public class FieldReferenceExtractor {
    private static final ImmutableSet<String> ORDERING_COMPARATORS =
        Sets.immutable.with("gt", "gte", "ge", "lt", "lte", "le", ">", ">=", "<", "<=");
    private static final ImmutableSet<String> NUMERIC_FUNCTIONS =
        Sets.immutable.with("sum", "avg", "min", "max", "count", "rate", "stddev", "median", "pct", "percentile");
    private static final Pattern NUMERIC_TEXT = Pattern.compile("[-+]?\\d+(\\.\\d+)?");

    public ImmutableList<FieldReference> extract(Query query) {
        MutableMap<String, FieldReference> firstSeen = MapAdapter.adapt(new LinkedHashMap<>());
        for (Command command : query.allCommands()) {
            roleOf(command).ifPresent(role -> fieldsOf(command).forEach(field ->
                firstSeen.getIfAbsentPut(field, () -> new FieldReference(field, role, command.index(), command.line()))));
        }
        return firstSeen.valuesView().toList().toImmutable();
    }

    /**
     * Fields compared with a numeric literal or passed to a numeric aggregation function.
     */
    public ImmutableSet<String> numericFields(Query query) {
        MutableSet<String> numeric = Sets.mutable.empty();
        for (Command command : query.allCommands()) {
            switch (command.kind()) {
                case FILTER -> CommandFields.filterKey(command).ifPresent(key -> {
                    if (comparesNumerically(command)) {
                        numeric.add(key);
                    }
                });
                case AGGREGATE -> CommandFields.aggregateFunction(command).ifPresent(fn -> {
                    if (isNumericFunction(fn)) {
                        numeric.addAllIterable(CommandFields.aggregateTargets(command));
                    }
                });
                case PROJECT -> CommandFields.projection(command).forEach(entry -> {
                    int open = entry.indexOf('(');
                    if (open > 0 && isNumericFunction(entry.substring(0, open))) {
                        numeric.add(CommandFields.baseField(entry));
                    }
                });
                default -> {
                    // no type evidence
                }
            }
        }
        return numeric.toImmutable();
    }

    private static boolean comparesNumerically(Command filter) {
        Optional<PayloadNode> value = CommandFields.filterValue(filter);
        if (value.isEmpty()) {
            return false;
        }
        if (value.get() instanceof PayloadNode.PayloadNumber) {
            return true;
        }
        boolean ordering = CommandFields.filterComparator(filter).map(ORDERING_COMPARATORS::contains).orElse(false);
        return ordering && value.get().text().map(text -> NUMERIC_TEXT.matcher(text).matches()).orElse(false);
    }

    private static boolean isNumericFunction(String fn) {
        String lower = fn.toLowerCase(Locale.ROOT);
        return NUMERIC_FUNCTIONS.contains(lower) || lower.startsWith("pct");
    }

    private static Optional<FieldRole> roleOf(Command command) {
        return switch (command.kind()) {
            case PROJECT -> Optional.of(FieldRole.SELECT);
            case FILTER -> Optional.of(FieldRole.FILTER);
            case GROUP -> Optional.of(FieldRole.GROUP);
            case AGGREGATE -> Optional.of(FieldRole.UPDATE);
            case ORDER -> Optional.of(FieldRole.ORDER);
            default -> Optional.empty();
        };
    }

    private static ImmutableList<String> fieldsOf(Command command) {
        MutableList<String> fields = Lists.mutable.empty();
        switch (command.kind()) {
            case PROJECT -> CommandFields.projection(command)
                .reject(CommandFields.WILDCARD::equals)
                .collect(CommandFields::baseField)
                .forEach(fields::add);
            case FILTER -> CommandFields.filterKey(command).ifPresent(fields::add);
            case GROUP -> fields.addAllIterable(CommandFields.groupKeys(command));
            case AGGREGATE -> fields.addAllIterable(CommandFields.aggregateTargets(command));
            case ORDER -> fields.addAllIterable(CommandFields.orderKeys(command));
            default -> {
                // no field positions
            }
        }
        return fields.toImmutable();
    }
}
