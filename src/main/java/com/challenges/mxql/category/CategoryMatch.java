package com.challenges.mxql.category;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * A search hit with its relevance score; higher is better.
 */
public record CategoryMatch(String categoryName, String title, ImmutableList<String> platforms,
                            double relevance, ImmutableList<String> languages) {
}
