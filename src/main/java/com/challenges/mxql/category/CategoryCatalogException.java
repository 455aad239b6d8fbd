package com.challenges.mxql.category;

public class CategoryCatalogException extends RuntimeException {
    public CategoryCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
