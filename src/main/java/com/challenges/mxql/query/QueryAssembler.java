package com.challenges.mxql.query;

import com.challenges.mxql.payload.ParsedPayload;
import com.challenges.mxql.payload.PayloadParser;
import com.challenges.mxql.payload.PayloadSyntaxException;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Turns query text into a {@link Query}: tokenizes, parses every payload and pairs
 * {@code SUB}/{@code END} blocks into nested scopes.
 * <p>
 * Assembly always completes. An {@code END} without opener is kept in the command list
 * but has no effect on scoping; a block still open at end of input is closed there.
 */
public class QueryAssembler {
    private static final Logger log = LoggerFactory.getLogger(QueryAssembler.class);

    static final String[] BLOCK_NAME_KEYS = {"id", "name"};

    private final Tokenizer tokenizer = new Tokenizer();
    private final PayloadParser payloadParser = new PayloadParser();

    public ParsedQuery assemble(String text) {
        Objects.requireNonNull(text, "text");
        TokenizedText tokenized = tokenizer.tokenize(text);
        MutableList<Issue> issues = Lists.mutable.empty();

        int lastIndex = tokenized.tokens().size() - 1;
        tokenized.strays().forEach(stray -> issues.add(new Issue(IssueCode.UNEXPECTED_TEXT,
            "Unexpected text '" + abbreviate(stray.text()) + "' is not a command",
            Math.min(stray.beforeToken(), lastIndex), stray.line(), null,
            "Remove the text or start the line with a command name")));

        Deque<ScopeBuilder> scopes = new ArrayDeque<>();
        scopes.push(new ScopeBuilder(null, null, null));
        int anonymous = 0;

        for (int index = 0; index < tokenized.tokens().size(); index++) {
            Token token = tokenized.tokens().get(index);
            ScopeBuilder current = scopes.peek();
            Command command = toCommand(index, token, current.name);

            switch (command.kind()) {
                case BLOCK_OPEN -> {
                    current.commands.add(command);
                    if (scopes.size() > 1) {
                        issues.add(new Issue(IssueCode.NESTED_SUBQUERY,
                            "SUB block opened inside block '" + current.name + "'; nested blocks are not supported",
                            command.index(), command.line(), current.name,
                            "Close the enclosing block with END before opening another"));
                    }
                    String blockName = command.argument(BLOCK_NAME_KEYS).orElse("<anonymous-" + (++anonymous) + ">");
                    String qualified = current.name == null ? blockName : current.name + "/" + blockName;
                    scopes.push(new ScopeBuilder(qualified, blockName, command));
                }
                case BLOCK_CLOSE -> {
                    if (scopes.size() == 1) {
                        current.commands.add(command);
                        issues.add(new Issue(IssueCode.UNMATCHED_BLOCK_CLOSE,
                            "END without a matching SUB", command.index(), command.line(), null,
                            "Remove the END or add a SUB block opener before it"));
                    } else {
                        ScopeBuilder closed = scopes.pop();
                        ScopeBuilder parent = scopes.peek();
                        Command closer = relabel(command, parent.name);
                        parent.commands.add(closer);
                        register(parent, closed, closer, issues);
                    }
                }
                default -> current.commands.add(command);
            }
        }

        while (scopes.size() > 1) {
            ScopeBuilder unclosed = scopes.pop();
            Command opener = unclosed.opener;
            issues.add(new Issue(IssueCode.UNCLOSED_BLOCK,
                "SUB block '" + unclosed.simpleName + "' is never closed", opener.index(), opener.line(),
                opener.scope(), "Add END after the last command of the block"));
            register(scopes.peek(), unclosed, null, issues);
        }

        Query query = scopes.pop().build();
        log.debug("Assembled {} with {} parse issues", query, issues.size());
        return new ParsedQuery(query, issues.toImmutable());
    }

    private Command toCommand(int index, Token token, String scope) {
        CommandKind kind = CommandKind.of(token.name());
        ParsedPayload parsed = null;
        String parseError = null;
        if (token.rawPayload() != null && token.balanced()) {
            try {
                parsed = payloadParser.parse(token.rawPayload());
            } catch (PayloadSyntaxException e) {
                parseError = e.getMessage();
                log.debug("Payload of {} at line {} is unreadable: {}", token.name(), token.line(), parseError);
            }
        }
        return new Command(index, token.name(), kind, token.rawPayload(), parsed, parseError,
            token.line(), token.column(), token.balanced(), scope);
    }

    private void register(ScopeBuilder parent, ScopeBuilder block, Command closer, MutableList<Issue> issues) {
        String blockName = block.simpleName;
        if (parent.subqueries.anySatisfy(definition -> definition.name().equals(blockName))) {
            Command opener = block.opener;
            issues.add(new Issue(IssueCode.DUPLICATE_SUBQUERY,
                "Subquery '" + blockName + "' is defined more than once; the later definition wins",
                opener.index(), opener.line(), parent.name, "Give each SUB block a distinct id"));
        }
        parent.subqueries.add(new SubqueryDefinition(blockName, block.build(), block.opener, closer));
    }

    /**
     * An END is tokenized inside the block it closes but belongs to the enclosing scope.
     */
    private static Command relabel(Command command, String scope) {
        return new Command(command.index(), command.name(), command.kind(), command.rawPayload(), command.parsed(),
            command.parseError(), command.line(), command.column(), command.balanced(), scope);
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 37) + "...";
    }

    private static final class ScopeBuilder {
        private final String name;
        private final Command opener;
        private final MutableList<Command> commands = Lists.mutable.empty();
        private final MutableList<SubqueryDefinition> subqueries = Lists.mutable.empty();
        private final String simpleName;

        private ScopeBuilder(String name, String simpleName, Command opener) {
            this.name = name;
            this.simpleName = simpleName;
            this.opener = opener;
        }

        Query build() {
            return new Query(name, commands.toImmutable(), subqueries.toImmutable());
        }
    }
}
