package com.challenges.mxql.fixture;

/**
 * First occurrence of a field name in the query.
 */
public record FieldReference(String field, FieldRole role, int commandIndex, int line) {
}
