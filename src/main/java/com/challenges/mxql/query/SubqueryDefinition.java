package com.challenges.mxql.query;

/**
 * A named block of commands opened by {@code opener} and closed by {@code closer}.
 * {@code closer} is {@code null} when the block ran to the end of input.
 */
public record SubqueryDefinition(String name, Query query, Command opener, Command closer) {
}
