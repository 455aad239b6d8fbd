package com.challenges.mxql.validation;

import com.challenges.mxql.query.QueryAssembler;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import com.challenges.mxql.report.IssueCategory;
import com.challenges.mxql.report.Severity;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StructuralValidatorTest {
    private final QueryAssembler assembler = new QueryAssembler();
    private final StructuralValidator validator = new StructuralValidator();
    private final StyleCheck style = new StyleCheck();

    private MutableList<Issue> check(String text) {
        return validator.check(assembler.assemble(text).query());
    }

    @Test
    public void testWellFormedCommands() {
        assertTrue(check("CATEGORY x\nTAGLOAD\nSELECT [cpu]\nSUB {id: a}\nADDROW {cpu: 1}\nEND").isEmpty());
    }

    @Test
    public void testUnbalancedPayload() {
        MutableList<Issue> issues = check("FILTER {key: \"cpu\"\nSELECT [name]");

        Issue issue = issues.getOnly();
        assertEquals(IssueCode.UNBALANCED_DELIMITERS, issue.code());
        assertEquals(Severity.CRITICAL, issue.severity());
        assertEquals(IssueCategory.STRUCTURAL, issue.category());
        assertEquals(0, issue.commandIndex());
    }

    @Test
    public void testMalformedPayload() {
        Issue issue = check("FILTER {key: cpu cmp: gt}").getOnly();

        assertEquals(IssueCode.MALFORMED_PAYLOAD, issue.code());
        assertTrue(issue.message().startsWith("FILTER payload is malformed"));
    }

    @Test
    public void testMissingPayload() {
        Issue issue = check("CATEGORY x\nTAGLOAD\nFILTER").getOnly();

        assertEquals(IssueCode.MISSING_PAYLOAD, issue.code());
        assertEquals(2, issue.commandIndex());
    }

    @Test
    public void testOptionalPayload() {
        assertTrue(check("TAGLOAD {stime: 0, etime: 60000}").isEmpty());
    }

    @Test
    public void testUnexpectedPayload() {
        Issue issue = check("SUB {id: a}\nTAGLOAD\nEND now").getOnly();

        assertEquals(IssueCode.UNEXPECTED_PAYLOAD, issue.code());
        assertNull(issue.scope());
    }

    @Test
    public void testUnknownCommand() {
        Issue issue = check("CATEGORY x\nFROBNICATE {a: 1}").getOnly();

        assertEquals(IssueCode.UNKNOWN_COMMAND, issue.code());
        assertEquals(Severity.WARNING, issue.severity());
    }

    @Test
    public void testAtMostOneStructuralIssuePerCommand() {
        MutableList<Issue> issues = check("SELECT [a,\nFILTER {key cpu}\nLIMIT");

        assertEquals(3, issues.size());
        assertEquals(IssueCode.UNBALANCED_DELIMITERS, issues.get(0).code());
        assertEquals(IssueCode.MALFORMED_PAYLOAD, issues.get(1).code());
        assertEquals(IssueCode.MISSING_PAYLOAD, issues.get(2).code());
    }

    @Test
    public void testIssuesInsideBlocksCarryScope() {
        Issue issue = check("SUB {id: rows}\nADDROW\nEND").getOnly();

        assertEquals("rows", issue.scope());
        assertEquals(2, issue.line());
    }

    @Test
    public void testStyleFindings() {
        MutableList<Issue> issues = style.check(assembler.assemble("GROUP {pk: [oid,], 'timeunit': '5m'}").query());

        assertEquals(2, issues.size());
        assertEquals(IssueCode.TRAILING_SEPARATOR, issues.get(0).code());
        assertEquals(IssueCode.UNQUOTED_KEY, issues.get(1).code());
        assertEquals("Field names without quotes (valid but not recommended for readability)", issues.get(1).message());
        assertEquals("Consider using quotes: pk", issues.get(1).suggestion());
        assertTrue(issues.allSatisfy(issue -> issue.severity() == Severity.INFO));
    }
}
