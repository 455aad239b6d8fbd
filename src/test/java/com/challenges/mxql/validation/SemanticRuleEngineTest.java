package com.challenges.mxql.validation;

import com.challenges.mxql.query.QueryAssembler;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import com.challenges.mxql.report.Severity;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticRuleEngineTest {
    private final QueryAssembler assembler = new QueryAssembler();
    private final SemanticRuleEngine engine = new SemanticRuleEngine();

    private MutableList<Issue> check(String text) {
        return engine.check(assembler.assemble(text).query(), new ValidationContext(ValidatorSettings.defaults()));
    }

    private MutableList<IssueCode> codes(String text) {
        return check(text).collect(Issue::code);
    }

    @Test
    public void testWellOrderedQueryHasNoFindings() {
        String text = "CATEGORY db_postgresql_counter\nTAGLOAD\nGROUP {pk: oid}\nUPDATE {key: cpu, value: avg}\n"
            + "ORDER {key: [cpu]}\nLIMIT 10";

        assertTrue(check(text).isEmpty(), () -> "Unexpected " + check(text));
    }

    @Test
    public void testAggregateWithoutGrouping() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nUPDATE {key: cpu, value: avg}");

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(IssueCode.AGGREGATE_WITHOUT_GROUPING, issue.code());
        assertEquals(Severity.CRITICAL, issue.severity());
        assertEquals(2, issue.commandIndex());
        assertEquals(3, issue.line());
        assertTrue(issue.message().contains("aggregate without grouping"));
    }

    @Test
    public void testLoaderBeforeSource() {
        MutableList<Issue> issues = check("TAGLOAD\nCATEGORY x");

        assertEquals(IssueCode.LOADER_WITHOUT_SOURCE, issues.getOnly().code());
        assertEquals(0, issues.getOnly().commandIndex());
    }

    @Test
    public void testBoundWithoutOrderIsReportedOnce() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nLIMIT 10\nLIMIT 5");

        assertEquals(1, issues.size());
        assertEquals(IssueCode.BOUND_WITHOUT_ORDER, issues.get(0).code());
        assertEquals(Severity.WARNING, issues.get(0).severity());
        assertEquals(2, issues.get(0).commandIndex());
    }

    @Test
    public void testScopeFlagsAreNeverReset() {
        String text = "CATEGORY x\nTAGLOAD\nORDER {key: [cpu]}\nGROUP {pk: oid}\nUPDATE {key: cpu, value: sum}\n"
            + "GROUP {pk: oname}\nUPDATE {key: cpu, value: max}\nLIMIT 3";

        assertTrue(codes(text).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-3", "abc", "2.5"})
    public void testInvalidBound(String bound) {
        MutableList<IssueCode> codes = codes("CATEGORY x\nTAGLOAD\nORDER {key: cpu}\nLIMIT " + bound);

        assertEquals(1, codes.size());
        assertEquals(IssueCode.INVALID_BOUND, codes.get(0));
    }

    @Test
    public void testGroupWithAggregateParameters() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nGROUP {key: oid, value: sum}");

        assertEquals(2, issues.size());
        assertTrue(issues.allSatisfy(issue -> issue.code() == IssueCode.GROUP_INVALID_PARAMETER));
        assertTrue(issues.get(0).message().contains("'pk'"));
    }

    @Test
    public void testRedundantProjection() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nSELECT [cpu, mem]\nSELECT [cpu]");

        assertEquals(IssueCode.REDUNDANT_PROJECTION, issues.getOnly().code());
        assertEquals(Severity.INFO, issues.getOnly().severity());
        assertEquals(3, issues.getOnly().commandIndex());
    }

    @Test
    public void testReferenceToUndefinedSubquery() {
        MutableList<Issue> issues = check("CATEGORY x\nTAGLOAD\nAPPEND {query: missing}");

        assertEquals(IssueCode.UNDEFINED_SUBQUERY, issues.getOnly().code());
        assertTrue(issues.getOnly().message().contains("'missing'"));
    }

    @Test
    public void testReferenceBeforeDefinition() {
        MutableList<IssueCode> codes = codes("CATEGORY x\nTAGLOAD\nAPPEND {query: a}\nSUB {id: a}\nADDROW {cpu: 1}\nEND");

        assertEquals(1, codes.size());
        assertEquals(IssueCode.UNDEFINED_SUBQUERY, codes.get(0));
    }

    @Test
    public void testReferenceAfterDefinition() {
        String text = "SUB {id: a}\nADDROW {cpu: 1}\nEND\nCATEGORY x\nTAGLOAD\nAPPEND {query: a}";

        assertTrue(codes(text).isEmpty());
    }

    @Test
    public void testLaterBlockSeesEarlierSibling() {
        String text = "SUB {id: a}\nADDROW {cpu: 1}\nEND\nSUB {id: b}\nAPPEND {query: a}\nEND\nAPPEND {query: b}";

        assertTrue(codes(text).isEmpty());
    }

    @Test
    public void testBlockCannotReferenceItself() {
        MutableList<Issue> issues = check("SUB {id: a}\nAPPEND {query: a}\nEND");

        assertEquals(IssueCode.UNDEFINED_SUBQUERY, issues.getOnly().code());
        assertEquals("a", issues.getOnly().scope());
    }

    @Test
    public void testReferenceWithoutName() {
        assertEquals(IssueCode.UNDEFINED_SUBQUERY, codes("CATEGORY x\nTAGLOAD\nJOIN {type: inner}").getOnly());
    }

    @Test
    public void testGroupingInBlockDoesNotCoverParent() {
        MutableList<Issue> issues = check(
            "SUB {id: a}\nCATEGORY x\nTAGLOAD\nGROUP {pk: oid}\nEND\nAPPEND {query: a}\nUPDATE {key: cpu, value: avg}");

        assertEquals(IssueCode.AGGREGATE_WITHOUT_GROUPING, issues.getOnly().code());
        assertNull(issues.getOnly().scope());
    }

    @Test
    public void testGroupingInParentDoesNotCoverBlock() {
        MutableList<Issue> issues = check(
            "CATEGORY x\nTAGLOAD\nGROUP {pk: oid}\nSUB {id: a}\nADDROW {cpu: 1}\nUPDATE {key: cpu, value: avg}\nEND");

        assertEquals(IssueCode.AGGREGATE_WITHOUT_GROUPING, issues.getOnly().code());
        assertEquals("a", issues.getOnly().scope());
    }

    @Test
    public void testMissingLoader() {
        MutableList<Issue> issues = check("CATEGORY x\nSELECT [cpu]");

        Issue issue = issues.getOnly();
        assertEquals(IssueCode.MISSING_LOADER, issue.code());
        assertEquals(Severity.WARNING, issue.severity());
        assertEquals(Issue.QUERY_LEVEL, issue.commandIndex());
    }

    @Test
    public void testLiteralRowsCountAsLoader() {
        assertTrue(codes("ADDROW {cpu: 1}\nADDROW {cpu: 2}").isEmpty());
    }
}
