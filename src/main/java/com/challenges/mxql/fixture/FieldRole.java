package com.challenges.mxql.fixture;

public enum FieldRole {
    SELECT,
    FILTER,
    GROUP,
    UPDATE,
    ORDER
}
