package com.challenges.mxql.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Comparator;
import java.util.Optional;

/**
 * An ordered, read-only sequence of commands forming one scope, with the subquery
 * blocks defined directly inside it.
 * <p>
 * The opener and closer of a subquery block belong to the enclosing scope; the commands
 * between them belong to the block's own {@code Query}.
 */
public final class Query {
    private final String name;
    private final ImmutableList<Command> commands;
    private final ImmutableList<SubqueryDefinition> subqueries;

    public Query(String name, ImmutableList<Command> commands, ImmutableList<SubqueryDefinition> subqueries) {
        this.name = name;
        this.commands = commands;
        this.subqueries = subqueries;
    }

    public String name() {
        return name;
    }

    public ImmutableList<Command> commands() {
        return commands;
    }

    public ImmutableList<SubqueryDefinition> subqueries() {
        return subqueries;
    }

    /**
     * Latest definition registered under {@code subqueryName}.
     */
    public Optional<SubqueryDefinition> subquery(String subqueryName) {
        return Optional.ofNullable(subqueries.asReversed().detect(definition -> definition.name().equals(subqueryName)));
    }

    /**
     * This scope and every nested scope, depth first, parents before children.
     */
    public ImmutableList<Query> scopes() {
        MutableList<Query> result = Lists.mutable.with(this);
        subqueries.forEach(definition -> result.addAllIterable(definition.query().scopes()));
        return result.toImmutable();
    }

    public ImmutableList<Command> allCommands() {
        return scopes()
            .flatCollect(Query::commands)
            .toSortedList(Comparator.comparingInt(Command::index))
            .toImmutable();
    }

    public boolean contains(CommandKind kind) {
        return commands.anySatisfy(command -> command.is(kind));
    }

    @Override
    public String toString() {
        return "Query{" + (name == null ? "<top>" : name) + ", " + commands.size() + " commands, "
            + subqueries.size() + " subqueries}";
    }
}
