package com.challenges.mxql.query;

/**
 * Text that could not start a command, skipped up to the end of its line.
 *
 * @param text        the skipped text
 * @param line        1-based line
 * @param column      1-based column
 * @param beforeToken number of tokens emitted before this text
 */
public record StrayText(String text, int line, int column, int beforeToken) {
}
