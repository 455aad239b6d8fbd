package com.challenges.mxql.report;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Comparator;

/**
 * Merges the issue lists of every pass into one ordered, de-duplicated list.
 * <p>
 * Ordering is by command index, then severity rank, then the order issues were added,
 * so identical input always produces an identical report.
 */
public class IssueAggregator {
    private static final Comparator<Issue> ORDER = Comparator
        .comparingInt(Issue::commandIndex)
        .thenComparingInt(issue -> issue.severity().rank());

    private final MutableList<Issue> issues = Lists.mutable.empty();

    public IssueAggregator addAll(Iterable<Issue> pass) {
        pass.forEach(issues::add);
        return this;
    }

    public ImmutableList<Issue> aggregate() {
        MutableSet<DedupKey> seen = Sets.mutable.empty();
        MutableList<Issue> distinct = issues.select(issue -> seen.add(DedupKey.of(issue)));
        // sortThis is stable, ties keep insertion order
        return distinct.sortThis(ORDER).toImmutable();
    }

    private record DedupKey(IssueCode code, int commandIndex, String scope, String message) {
        static DedupKey of(Issue issue) {
            return new DedupKey(issue.code(), issue.commandIndex(), issue.scope(), issue.message());
        }
    }
}
