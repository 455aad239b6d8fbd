package com.challenges.mxql.fixture;

import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandKind;
import com.challenges.mxql.query.SubqueryDefinition;
import com.challenges.mxql.report.ValidationReport;
import com.challenges.mxql.validation.QueryValidator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FixtureGeneratorTest {
    private final FixtureGenerator generator = new FixtureGenerator();

    @Test
    public void testBlockBeforeSourceAndAppendAfterLoader() {
        TestFixture fixture = generator.generate("CATEGORY x\nTAGLOAD\nSELECT [cpu]", 2, null);

        String expected = String.join("\n",
            "# This query uses ADDROW to inject test data",
            "",
            "SUB {'id':test_data}",
            "ADDROW {'oid':1000,'oname':'instance-1','cpu':'sample-1'}",
            "ADDROW {'oid':1001,'oname':'instance-2','cpu':'sample-2'}",
            "END",
            "CATEGORY x",
            "TAGLOAD",
            "APPEND {'query':test_data}",
            "SELECT [cpu]");
        assertEquals(expected, fixture.text());
        assertEquals("test_data", fixture.subqueryName());
        assertEquals(2, fixture.rows().size());
    }

    @Test
    public void testDescriptionHeader() {
        TestFixture fixture = generator.generate("CATEGORY x\nTAGLOAD", 1, "top cpu");

        assertTrue(fixture.text().startsWith("# Test: top cpu\n# This query uses ADDROW to inject test data\n\n"));
    }

    @Test
    public void testRewrittenQueryReadsTheBlock() {
        TestFixture fixture = generator.generate(
            "CATEGORY db_postgresql_counter\nTAGLOAD\nFILTER {key: cpu, cmp: gt, value: 80}\nORDER {key: [cpu]}\nLIMIT 5");

        SubqueryDefinition block = fixture.query().subquery("test_data").orElseThrow();
        assertEquals(3, block.query().commands().size());
        assertTrue(block.query().commands().allSatisfy(command -> command.is(CommandKind.LITERAL_ROW)));

        Command append = fixture.query().commands().detect(command -> command.is(CommandKind.REFERENCE));
        Command loader = fixture.query().commands().detect(command -> command.is(CommandKind.LOAD));
        assertEquals(loader.index() + 1, append.index());

        ValidationReport report = new QueryValidator().validate(fixture.text());
        assertTrue(report.valid(), report::toString);
    }

    @Test
    public void testMultiLineLoaderKeepsPayloadTogether() {
        TestFixture fixture = generator.generate("CATEGORY x\nTAGLOAD {\n  stime: 0,\n  etime: 60000\n}\nSELECT [cpu]", 1, null);

        assertTrue(fixture.text().contains("  etime: 60000\n}\nAPPEND {'query':test_data}\nSELECT [cpu]"));
    }

    @Test
    public void testAppendAfterSourceWithoutLoader() {
        TestFixture fixture = generator.generate("CATEGORY x\nSELECT [cpu]", 1, null);

        assertTrue(fixture.text().endsWith("END\nCATEGORY x\nAPPEND {'query':test_data}\nSELECT [cpu]"));
    }

    @Test
    public void testNoSourceInsertsAtTop() {
        TestFixture fixture = generator.generate("SELECT [cpu]", 1, null);

        assertTrue(fixture.text().endsWith("END\nAPPEND {'query':test_data}\nSELECT [cpu]"));
    }

    @Test
    public void testBlockNameAvoidsExistingBlocks() {
        TestFixture fixture = generator.generate("SUB {id: test_data}\nADDROW {a: 1}\nEND\nCATEGORY x\nTAGLOAD", 1, null);

        assertEquals("test_data_2", fixture.subqueryName());
        assertTrue(fixture.text().contains("SUB {'id':test_data_2}"));
    }

    @Test
    public void testInvalidRowCount() {
        assertThrows(IllegalArgumentException.class, () -> generator.generate("CATEGORY x", 0, null));
    }
}
