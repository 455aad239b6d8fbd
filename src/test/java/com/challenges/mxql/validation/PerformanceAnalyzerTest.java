package com.challenges.mxql.validation;

import com.challenges.mxql.query.Query;
import com.challenges.mxql.query.QueryAssembler;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import com.challenges.mxql.report.Severity;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class PerformanceAnalyzerTest {
    private final QueryAssembler assembler = new QueryAssembler();
    private final PerformanceAnalyzer analyzer = new PerformanceAnalyzer();

    private MutableList<Issue> check(String text) {
        return check(text, ValidatorSettings.defaults());
    }

    private MutableList<Issue> check(String text, ValidatorSettings settings) {
        return analyzer.check(assembler.assemble(text).query(), settings);
    }

    private MutableList<Issue> withCode(MutableList<Issue> issues, IssueCode code) {
        return issues.select(issue -> issue.code() == code);
    }

    @Test
    public void testLateFilter() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nGROUP {pk: oid}\nFILTER {key: cpu, cmp: gt, value: 1}\n"
            + "UPDATE {key: cpu, value: avg}");

        Issue issue = issues.getOnly();
        assertEquals(IssueCode.LATE_FILTER, issue.code());
        assertEquals(Severity.WARNING, issue.severity());
        assertEquals(3, issue.commandIndex());
    }

    @Test
    public void testEarlyFilterIsFine() {
        assertTrue(check("CATEGORY x\nTAGLOAD\nFILTER {key: cpu, cmp: gt, value: 1}\nGROUP {pk: oid}\n"
            + "UPDATE {key: cpu, value: avg}").isEmpty());
    }

    @Test
    public void testWildcardProjection() {
        Issue issue = withCode(check("CATEGORY x\nTAGLOAD\nSELECT [*]\nLIMIT 5"), IssueCode.WILDCARD_PROJECTION).getOnly();

        assertEquals("SELECT [*] includes all fields - may impact performance", issue.message());
        assertEquals(2, issue.commandIndex());
    }

    @Test
    public void testExcessiveGranularityFromTimeRange() {
        MutableList<Issue> issues = withCode(
            check("CATEGORY x\nTAGLOAD\nTIMEPAST 1d\nGROUP {timeunit: 1m, pk: oid}\nUPDATE {key: cpu, value: avg}"),
            IssueCode.EXCESSIVE_GRANULARITY);

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).message().contains("1440 buckets"));
    }

    @Test
    public void testReasonableGranularity() {
        assertTrue(withCode(check("CATEGORY x\nTAGLOAD\nTIMEPAST 1h\nGROUP {timeunit: 1m, pk: oid}"),
            IssueCode.EXCESSIVE_GRANULARITY).isEmpty());
    }

    @Test
    public void testGranularityRatioIsConfigurable() {
        String text = "CATEGORY x\nTAGLOAD\nTIMEPAST 1d\nGROUP {timeunit: 1m, pk: oid}";

        assertTrue(withCode(check(text, ValidatorSettings.defaults().withGranularityRatio(2000)),
            IssueCode.EXCESSIVE_GRANULARITY).isEmpty());
        assertEquals(1, withCode(check(text, ValidatorSettings.defaults().withGranularityRatio(100)),
            IssueCode.EXCESSIVE_GRANULARITY).size());
    }

    @Test
    public void testRangeFromLoaderTimes() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD {stime: 0, etime: 86400000}\nGROUP {timeunit: 1s, pk: oid}");

        assertEquals(1, withCode(issues, IssueCode.EXCESSIVE_GRANULARITY).size());
    }

    @Test
    public void testNoRangeNoGranularityCheck() {
        assertTrue(withCode(check("CATEGORY x\nTAGLOAD\nGROUP {timeunit: 1s, pk: oid}"),
            IssueCode.EXCESSIVE_GRANULARITY).isEmpty());
    }

    @Test
    public void testBlockUsesEnclosingRange() {
        Query query = assembler.assemble("TIMEPAST 1w\nSUB {id: a}\nCATEGORY x\nTAGLOAD\nGROUP {timeunit: 5m}\nEND\n"
            + "APPEND {query: a}\nLIMIT 1").query();

        assertEquals(OptionalLong.of(604_800_000L), PerformanceAnalyzer.declaredRange(query));
        Issue issue = withCode(analyzer.check(query, ValidatorSettings.defaults()), IssueCode.EXCESSIVE_GRANULARITY).getOnly();
        assertEquals("a", issue.scope());
    }

    @Test
    public void testUnboundedResultOnLastTopLevelCommand() {
        Issue issue = check("CATEGORY x\nTAGLOAD\nSELECT [cpu]").getOnly();

        assertEquals(IssueCode.UNBOUNDED_RESULT, issue.code());
        assertEquals(Severity.INFO, issue.severity());
        assertEquals(2, issue.commandIndex());
    }

    @Test
    public void testBoundedResult() {
        assertTrue(check("CATEGORY x\nTAGLOAD\nSELECT [cpu]\nLIMIT 10").isEmpty());
    }

    @Test
    public void testCombinableAggregates() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nGROUP {pk: oid}\nUPDATE {key: cpu, value: avg}\n"
            + "UPDATE {key: cpu, value: max}\nUPDATE {key: mem, value: max}");

        Issue issue = issues.getOnly();
        assertEquals(IssueCode.COMBINABLE_AGGREGATES, issue.code());
        assertEquals(4, issue.commandIndex());
    }

    @Test
    public void testNeverCritical() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nTIMEPAST 1d\nGROUP {timeunit: 1s}\nFILTER {key: a}\n"
            + "SELECT [*]\nUPDATE {key: a, value: sum}\nUPDATE {key: a, value: avg}");

        assertTrue(issues.notEmpty());
        assertTrue(issues.noneSatisfy(issue -> issue.severity() == Severity.CRITICAL));
    }
}
