package com.challenges.mxql.query;

import com.challenges.mxql.report.Issue;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * An assembled query with the issues found while cutting and pairing its commands.
 */
public record ParsedQuery(Query query, ImmutableList<Issue> issues) {
}
