package com.challenges.mxql.fixture;

import com.challenges.mxql.query.Query;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * A query rewritten to read injected sample rows from block {@code subqueryName}.
 */
public record TestFixture(String text, Query query, ImmutableList<SyntheticRow> rows, String subqueryName) {
}
