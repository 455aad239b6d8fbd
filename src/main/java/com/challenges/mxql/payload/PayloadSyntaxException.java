package com.challenges.mxql.payload;

/**
 * Raised when a payload cannot be read even under the relaxed grammar.
 */
public class PayloadSyntaxException extends IllegalArgumentException {
    private final int offset;

    public PayloadSyntaxException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
