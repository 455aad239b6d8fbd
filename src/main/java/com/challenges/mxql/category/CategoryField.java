package com.challenges.mxql.category;

public record CategoryField(String fieldName, String unit, String type, String description) {
}
