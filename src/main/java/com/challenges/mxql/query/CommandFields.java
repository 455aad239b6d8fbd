package com.challenges.mxql.query;

import com.challenges.mxql.payload.PayloadNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Locale;
import java.util.Optional;

/**
 * Where each command kind keeps its field names and options inside the payload.
 */
public final class CommandFields {
    public static final String WILDCARD = "*";

    static final String[] FILTER_KEY = {"key"};
    static final String[] FILTER_CMP = {"cmp"};
    static final String[] FILTER_VALUE = {"value"};
    static final String[] GROUP_KEYS = {"pk"};
    static final String[] GROUP_TIMEUNIT = {"timeunit"};
    static final String[] AGGREGATE_TARGET = {"target", "key"};
    static final String[] AGGREGATE_FUNCTION = {"fn", "value", "function"};
    static final String[] ORDER_KEYS = {"key", "by"};
    static final String[] CREATED_FIELD = {"key", "field", "to", "new"};

    private CommandFields() {
    }

    /**
     * Entries of a projection, with function projections such as {@code avg(cpu)} kept whole.
     */
    public static ImmutableList<String> projection(Command command) {
        return command.payload().map(CommandFields::names).orElse(Lists.immutable.empty());
    }

    public static boolean isWildcardProjection(Command command) {
        return projection(command).contains(WILDCARD);
    }

    public static Optional<String> filterKey(Command command) {
        return command.payloadObject().flatMap(object -> object.getAny(FILTER_KEY)).flatMap(PayloadNode::text);
    }

    public static Optional<String> filterComparator(Command command) {
        return command.payloadObject().flatMap(object -> object.getAny(FILTER_CMP)).flatMap(PayloadNode::text)
            .map(cmp -> cmp.toLowerCase(Locale.ROOT));
    }

    public static Optional<PayloadNode> filterValue(Command command) {
        return command.payloadObject().flatMap(object -> object.getAny(FILTER_VALUE));
    }

    public static ImmutableList<String> groupKeys(Command command) {
        return listAt(command, GROUP_KEYS);
    }

    public static Optional<PayloadNode> groupTimeUnit(Command command) {
        return command.payloadObject().flatMap(object -> object.getAny(GROUP_TIMEUNIT));
    }

    public static ImmutableList<String> aggregateTargets(Command command) {
        return listAt(command, AGGREGATE_TARGET);
    }

    public static Optional<String> aggregateFunction(Command command) {
        return command.payloadObject().flatMap(object -> object.getAny(AGGREGATE_FUNCTION)).flatMap(PayloadNode::text)
            .map(fn -> fn.toLowerCase(Locale.ROOT));
    }

    public static ImmutableList<String> orderKeys(Command command) {
        return listAt(command, ORDER_KEYS);
    }

    public static Optional<String> createdField(Command command) {
        return command.payloadObject().flatMap(object -> object.getAny(CREATED_FIELD)).flatMap(PayloadNode::text);
    }

    /**
     * The field inside a function projection ({@code avg(cpu)} gives {@code cpu}), or the name itself.
     */
    public static String baseField(String entry) {
        int open = entry.indexOf('(');
        int close = entry.lastIndexOf(')');
        if (open > 0 && close > open + 1) {
            return entry.substring(open + 1, close).trim();
        }
        return entry;
    }

    private static ImmutableList<String> listAt(Command command, String[] keys) {
        return command.payloadObject()
            .flatMap(object -> object.getAny(keys))
            .map(CommandFields::names)
            .orElse(Lists.immutable.empty());
    }

    private static ImmutableList<String> names(PayloadNode node) {
        MutableList<String> result = Lists.mutable.empty();
        if (node instanceof PayloadNode.PayloadArray array) {
            array.elements().forEach(element -> element.text().ifPresent(result::add));
        } else {
            node.text().ifPresent(result::add);
        }
        return result.toImmutable();
    }
}
