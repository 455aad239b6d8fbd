package com.challenges.mxql.fixture;

public enum FieldType {
    NUMERIC,
    STRING,
    TIMESTAMP
}
