package com.pipeline.cachingdb.core.impl;

import com.pipeline.cachingdb.core.CachingDbException;
import com.pipeline.cachingdb.core.ErrorKind;
import com.pipeline.cachingdb.model.Row;
import com.pipeline.cachingdb.model.TableSchema;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultAccumulatorTest {

    private static final TableSchema OST_SCHEMA = TableSchema.of(
            Arrays.asList("OST_ID", "TS_ID", "READ_BYTES"), Arrays.asList("OST_ID", "TS_ID"));

    @Test
    void appendKeepsInsertionOrderAndDuplicates() {
        ResultAccumulator acc = new ResultAccumulator();
        acc.append("OST_DATA", OST_SCHEMA, Arrays.asList(Row.of(1, 101, 60), Row.of(1, 100, 50)));
        acc.append("OST_DATA", null, Collections.singletonList(Row.of(1, 101, 60)));

        List<Row> rows = acc.rows("OST_DATA");
        assertEquals(3, rows.size());
        assertEquals(Row.of(1, 101, 60), rows.get(0));
        assertEquals(Row.of(1, 100, 50), rows.get(1));
        assertEquals(Row.of(1, 101, 60), rows.get(2));
        assertEquals(OST_SCHEMA, acc.schema("OST_DATA"));
    }

    @Test
    void tableIsCreatedByFirstAppendEvenWhenEmpty() {
        ResultAccumulator acc = new ResultAccumulator();
        acc.append("EMPTY", null, Collections.emptyList());
        assertTrue(acc.contains("EMPTY"));
        assertEquals(0, acc.rowCount("EMPTY"));
        assertNull(acc.schema("EMPTY"));
    }

    @Test
    void latestNonNullSchemaIsRetained() {
        TableSchema wider = TableSchema.of(
                Arrays.asList("OST_ID", "TS_ID", "READ_BYTES", "WRITE_BYTES"), Arrays.asList("OST_ID", "TS_ID"));
        ResultAccumulator acc = new ResultAccumulator();
        acc.append("OST_DATA", OST_SCHEMA, Collections.emptyList());
        acc.append("OST_DATA", wider, Collections.emptyList());
        acc.append("OST_DATA", null, Collections.emptyList());
        assertEquals(wider, acc.schema("OST_DATA"));
    }

    @Test
    void rowsNotMatchingDeclaredSchemaAreRejectedWithoutSideEffects() {
        ResultAccumulator acc = new ResultAccumulator();
        acc.append("OST_DATA", OST_SCHEMA, Collections.singletonList(Row.of(1, 100, 50)));

        CachingDbException e = assertThrows(CachingDbException.class, () ->
                acc.append("OST_DATA", null, Arrays.asList(Row.of(1, 101, 60), Row.of(1, 102))));
        assertEquals(ErrorKind.NON_UNIFORM_ROWS, e.getKind());
        assertEquals(1, acc.rowCount("OST_DATA"));
    }

    @Test
    void invalidTableNamesAreRejected() {
        ResultAccumulator acc = new ResultAccumulator();
        assertThrows(IllegalArgumentException.class,
                () -> acc.append("OST_DATA; DROP TABLE X", null, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> acc.append(null, null, Collections.emptyList()));
    }

    @Test
    void dropRemovesOnlyTheNamedTable() {
        ResultAccumulator acc = new ResultAccumulator();
        acc.append("A", null, Collections.singletonList(Row.of(1)));
        acc.append("B", null, Arrays.asList(Row.of(2), Row.of(3)));

        assertTrue(acc.drop("A"));
        assertFalse(acc.drop("A"));
        assertFalse(acc.contains("A"));
        assertEquals(2, acc.totalRowCount());

        acc.dropAll();
        assertTrue(acc.tableNames().isEmpty());
    }
}
