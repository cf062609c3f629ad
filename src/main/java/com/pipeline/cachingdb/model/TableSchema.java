package com.pipeline.cachingdb.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 逻辑表描述：有序列声明 + 有序主键列。
 *
 * 列声明是语义字符串，可以只写列名（"OST_ID"），也可以带类型（"OST_ID INTEGER"），
 * 列名取第一个空白分隔的词。列的顺序即行元组的字段顺序。
 * 主键不能为空，且必须是列名的子集。
 */
public final class TableSchema implements Serializable {
    private final List<String> columns;
    private final List<String> primaryKey;
    private final List<String> columnNames;

    public TableSchema(List<String> columns, List<String> primaryKey) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Table schema must declare at least one column");
        }
        if (primaryKey == null || primaryKey.isEmpty()) {
            throw new IllegalArgumentException("Table schema must declare a primary key");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.primaryKey = Collections.unmodifiableList(new ArrayList<>(primaryKey));

        List<String> names = new ArrayList<>(columns.size());
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("Column declaration must not be blank");
            }
            names.add(column.trim().split("\\s+")[0]);
        }
        this.columnNames = Collections.unmodifiableList(names);

        for (String key : primaryKey) {
            if (indexOf(key) < 0) {
                throw new IllegalArgumentException(
                        "Primary key column '" + key + "' is not one of " + columnNames);
            }
        }
    }

    public static TableSchema of(List<String> columns, List<String> primaryKey) {
        return new TableSchema(columns, primaryKey);
    }

    public List<String> getColumns() { return columns; }
    public List<String> getPrimaryKey() { return primaryKey; }
    public List<String> getColumnNames() { return columnNames; }
    public int size() { return columns.size(); }

    /** 列名位置（不区分大小写），不存在返回-1 */
    public int indexOf(String columnName) {
        for (int i = 0; i < columnNames.size(); i++) {
            if (columnNames.get(i).equalsIgnoreCase(columnName)) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasColumn(String columnName) {
        return indexOf(columnName) >= 0;
    }

    /** 含TS_ID列的表按时间索引 */
    public boolean isTimeIndexed() {
        return hasColumn("TS_ID");
    }

    public String createTableSql(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + tableName + " ("
                + String.join(", ", columns)
                + ", PRIMARY KEY (" + String.join(", ", primaryKey) + "))";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableSchema)) return false;
        TableSchema other = (TableSchema) o;
        return columns.equals(other.columns) && primaryKey.equals(other.primaryKey);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + primaryKey.hashCode();
    }

    @Override
    public String toString() {
        return "TableSchema{columns=" + columns + ", primaryKey=" + primaryKey + "}";
    }
}
