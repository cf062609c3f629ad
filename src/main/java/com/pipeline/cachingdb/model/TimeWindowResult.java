package com.pipeline.cachingdb.model;

import java.util.Collections;
import java.util.List;

/**
 * 一次时间窗口抓取的结果：本次新追加到内存累积区的行（增量），
 * 行对应的列名，以及实际发出的分块查询数。
 */
public class TimeWindowResult {
    private final String tableName;
    private final List<String> columns;
    private final List<Row> rows;
    private final int chunkCount;

    public TimeWindowResult(String tableName, List<String> columns, List<Row> rows, int chunkCount) {
        this.tableName = tableName;
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
        this.chunkCount = chunkCount;
    }

    public String getTableName() { return tableName; }
    public List<String> getColumns() { return columns; }
    public List<Row> getRows() { return rows; }
    public int getChunkCount() { return chunkCount; }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
