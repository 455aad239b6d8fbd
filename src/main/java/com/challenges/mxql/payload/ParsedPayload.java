package com.challenges.mxql.payload;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * A parsed payload together with the style observations made while reading it.
 *
 * @param value              the value tree
 * @param trailingSeparators number of separators found directly before a closing delimiter
 * @param unquotedKeys       object keys written as bare words, in source order
 */
public record ParsedPayload(PayloadNode value, int trailingSeparators, ImmutableList<String> unquotedKeys) {
}
