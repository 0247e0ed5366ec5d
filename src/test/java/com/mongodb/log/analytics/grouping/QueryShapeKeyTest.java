package com.mongodb.log.analytics.grouping;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mongodb.log.analytics.record.OpType;
import com.mongodb.log.analytics.record.ParsedRecord;
import com.mongodb.log.analytics.record.ParserConfig;
import com.mongodb.log.analytics.record.RecordParser;

public class QueryShapeKeyTest {

    private final RecordParser parser = new RecordParser(ParserConfig.forYear(2013));

    @Test
    public void testSameShapeDifferentValues() {
        ParsedRecord first = parser.parse("Mon Aug  5 20:26:32 [conn1] query test.docs query: { a: 1, b: \"x\" } "
                + "ntoreturn:0 nscanned:10 nreturned:1 reslen:20 120ms");
        ParsedRecord second = parser.parse("Mon Aug  5 20:26:33 [conn2] query test.docs query: { b: \"y\", a: 7 } "
                + "ntoreturn:0 nscanned:12 nreturned:1 reslen:20 140ms");

        QueryShapeKey key = QueryShapeKey.of(first);
        assertEquals(key, QueryShapeKey.of(second));
        assertEquals(key.hashCode(), QueryShapeKey.of(second).hashCode());
        assertEquals(OpType.QUERY, key.getOperation());
        assertEquals("test.docs query {\"a\": 1, \"b\": 1}", key.toString());
    }

    @Test
    public void testDifferentNamespaces() {
        QueryShapeKey a = new QueryShapeKey("test.a", OpType.QUERY, "{\"x\": 1}");
        QueryShapeKey b = new QueryShapeKey("test.b", OpType.QUERY, "{\"x\": 1}");
        QueryShapeKey c = new QueryShapeKey("test.a", OpType.UPDATE, "{\"x\": 1}");

        assertNotEquals(a, b);
        assertNotEquals(a, c);
        assertEquals("- - -", new QueryShapeKey(null, null, null).toString());
        assertEquals(new QueryShapeKey(null, null, null), new QueryShapeKey(null, null, null));
    }

    @Test
    public void testGroupByName() {
        Grouping<ParsedRecord, Object> grouping = new Grouping<ParsedRecord, Object>(GroupKeys.byName("ns"));
        grouping.addAll(List.of(
                parser.parse("Mon Aug  5 20:26:32 [conn1] query test.a query: { a: 1 } 10ms"),
                parser.parse("Mon Aug  5 20:26:33 [conn1] update test.b query: { a: 1 } 20ms"),
                parser.parse("Mon Aug  5 20:26:34 [conn2] query test.a query: { b: 1 } 30ms")));

        assertEquals(2, grouping.get("test.a").size());

        grouping.regroup(GroupKeys.byName("op"));
        assertEquals(2, grouping.get("query").size());
        assertEquals(1, grouping.get("update").size());

        grouping.regroup(GroupKeys.byName("thread"));
        assertEquals(2, grouping.get("conn1").size());

        assertThrows(IllegalArgumentException.class, () -> GroupKeys.byName("color"));
    }
}
