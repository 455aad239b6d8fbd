package com.challenges.mxql.fixture;

import com.challenges.mxql.output.OutputFormatter;
import com.challenges.mxql.payload.PayloadNode;
import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandKind;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.query.QueryAssembler;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Rewrites a query so it can run without a live data source.
 * <p>
 * A {@code SUB} block of {@code ADDROW} commands is inserted on the line before the first
 * top-level source command, and an {@code APPEND} of that block right after the first
 * loader (or after the source when there is no loader). Every original line is kept as written.
 */
public class FixtureGenerator {
    private static final Logger log = LoggerFactory.getLogger(FixtureGenerator.class);
    static final String DEFAULT_BLOCK_NAME = "test_data";

    private final QueryAssembler assembler = new QueryAssembler();
    private final SampleRowSynthesizer synthesizer = new SampleRowSynthesizer();
    private final OutputFormatter literals = OutputFormatter.queryLiteral();

    public TestFixture generate(String text) {
        return generate(text, SampleRowSynthesizer.DEFAULT_ROWS, null);
    }

    public TestFixture generate(String text, int rowCount, String description) {
        Objects.requireNonNull(text, "text");
        Query original = assembler.assemble(text).query();
        ImmutableList<SyntheticRow> rows = synthesizer.synthesize(original, rowCount);
        String blockName = freeBlockName(original);

        MutableList<String> block = Lists.mutable.empty();
        block.add(CommandKind.BLOCK_OPEN.keyword() + " " + literals.format(
            PayloadNode.PayloadObject.empty().with("id", new PayloadNode.PayloadIdentifier(blockName))));
        rows.forEach(row -> block.add(CommandKind.LITERAL_ROW.keyword() + " " + literals.format(row.toPayload())));
        block.add(CommandKind.BLOCK_CLOSE.keyword());
        String append = CommandKind.REFERENCE.keyword() + " " + literals.format(
            PayloadNode.PayloadObject.empty().with("query", new PayloadNode.PayloadIdentifier(blockName)));

        MutableList<String> lines = Lists.mutable.with(text.split("\r?\n", -1));
        Command source = original.commands().detect(command -> command.is(CommandKind.SOURCE));
        Command loader = original.commands().detect(command -> command.is(CommandKind.LOAD)
            && (source == null || command.index() > source.index()));

        // line indices are 0-based; insert the later position first so the earlier one stays valid
        int blockAt = source == null ? 0 : source.line() - 1;
        int appendAt;
        if (loader != null) {
            appendAt = lastLineOf(loader);
        } else if (source != null) {
            appendAt = lastLineOf(source);
        } else {
            appendAt = 0;
        }
        lines.add(appendAt, append);
        lines.addAll(blockAt, block);

        MutableList<String> output = Lists.mutable.empty();
        if (description != null && !description.isBlank()) {
            output.add("# Test: " + description);
        }
        output.add("# This query uses ADDROW to inject test data");
        output.add("");
        output.addAll(lines);

        String fixtureText = output.makeString("\n");
        log.debug("Generated fixture with {} rows in block '{}'", rows.size(), blockName);
        return new TestFixture(fixtureText, assembler.assemble(fixtureText).query(), rows, blockName);
    }

    private static int lastLineOf(Command command) {
        String raw = command.rawPayload();
        int extraLines = raw == null ? 0 : (int) raw.chars().filter(c -> c == '\n').count();
        return command.line() + extraLines;
    }

    private static String freeBlockName(Query query) {
        MutableSet<String> taken = Sets.mutable.empty();
        query.scopes().forEach(scope -> scope.subqueries().forEach(definition -> taken.add(definition.name())));
        String name = DEFAULT_BLOCK_NAME;
        for (int suffix = 2; taken.contains(name); suffix++) {
            name = DEFAULT_BLOCK_NAME + "_" + suffix;
        }
        return name;
    }
}
