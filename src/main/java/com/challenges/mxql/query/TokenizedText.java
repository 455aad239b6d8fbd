package com.challenges.mxql.query;

import org.eclipse.collections.api.list.ImmutableList;

public record TokenizedText(ImmutableList<Token> tokens, ImmutableList<StrayText> strays) {
}
