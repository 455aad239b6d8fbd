package com.challenges.mxql.fixture;

import com.challenges.mxql.payload.PayloadNode;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.query.QueryAssembler;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class SampleRowSynthesizerTest {
    private static final String TOP_CPU = "CATEGORY db_postgresql_counter\nTAGLOAD\nSELECT [oname, cpu]\n"
        + "FILTER {key: cpu, cmp: gt, value: 80}\nGROUP {timeunit: 5m, pk: oname}\nUPDATE {key: mem, value: avg}";

    private final QueryAssembler assembler = new QueryAssembler();
    private final SampleRowSynthesizer synthesizer = new SampleRowSynthesizer();

    private Query query(String text) {
        return assembler.assemble(text).query();
    }

    private long longValue(SyntheticRow row, String field) {
        PayloadNode value = row.values().get(field);
        assertTrue(value instanceof PayloadNode.PayloadNumber, "Expected number for " + field + " but got " + value);
        return ((PayloadNode.PayloadNumber) value).numberValue().longValue();
    }

    @Test
    public void testDefaultRowCountAndFieldOrder() {
        ImmutableList<SyntheticRow> rows = synthesizer.synthesize(query(TOP_CPU));

        assertEquals(SampleRowSynthesizer.DEFAULT_ROWS, rows.size());
        assertEquals("time,oid,oname,cpu,mem", rows.get(0).values().keysView().makeString(","));
    }

    @Test
    public void testTimeColumnFollowsFinestBucket() {
        ImmutableList<SyntheticRow> rows = synthesizer.synthesize(query(TOP_CPU), 4);

        assertEquals(OptionalLong.of(300_000L), SampleRowSynthesizer.timeBucket(query(TOP_CPU)));
        for (int i = 1; i < rows.size(); i++) {
            assertEquals(300_000L, longValue(rows.get(i), "time") - longValue(rows.get(i - 1), "time"));
        }
        assertEquals(SampleRowSynthesizer.BASE_TIMESTAMP, longValue(rows.get(0), "time"));
    }

    @Test
    public void testNumericValuesIncrease() {
        ImmutableList<SyntheticRow> rows = synthesizer.synthesize(query(TOP_CPU), 3);

        assertEquals(50L, longValue(rows.get(0), "cpu"));
        assertEquals(60L, longValue(rows.get(1), "cpu"));
        assertEquals(60L, longValue(rows.get(0), "mem"));
        assertEquals(70L, longValue(rows.get(2), "mem"));
    }

    @Test
    public void testStringValuesAreLabelled() {
        ImmutableList<SyntheticRow> rows = synthesizer.synthesize(query("SELECT [oname, status]"), 2);

        assertEquals(new PayloadNode.PayloadString("instance-1"), rows.get(0).values().get("oname"));
        assertEquals(new PayloadNode.PayloadString("sample-2"), rows.get(1).values().get("status"));
    }

    @Test
    public void testNoTimeColumnWithoutTimeBucket() {
        ImmutableList<SyntheticRow> rows = synthesizer.synthesize(query("SELECT [oid, cpu]\nGROUP {pk: oid}"), 1);

        assertFalse(rows.get(0).values().containsKey(SampleRowSynthesizer.TIME_FIELD));
        assertEquals(1000L, longValue(rows.get(0), "oid"));
    }

    @Test
    public void testObjectColumnsAlwaysPresent() {
        SyntheticRow row = synthesizer.synthesize(query("UPDATE {key: count, value: sum}"), 1).getOnly();

        assertEquals("oid,oname,count", row.values().keysView().makeString(","));
        assertEquals(1000L, longValue(row, "oid"));
        assertEquals(new PayloadNode.PayloadString("instance-1"), row.values().get("oname"));
    }

    @Test
    public void testRowCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(query(TOP_CPU), 0));
    }

    @Test
    public void testRowAsPayload() {
        SyntheticRow row = synthesizer.synthesize(query("UPDATE {key: count, value: sum}"), 1).getOnly();

        PayloadNode.PayloadObject payload = row.toPayload();
        assertEquals(PayloadNode.PayloadNumber.of(100L), payload.get("count").orElseThrow());
    }
}
