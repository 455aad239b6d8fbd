package com.challenges.mxql.query;

/**
 * A command name with its raw payload text, as cut from the query text.
 * {@code rawPayload} is {@code null} for a bare command.
 */
public record Token(String name, String rawPayload, int line, int column, boolean balanced) {
}
