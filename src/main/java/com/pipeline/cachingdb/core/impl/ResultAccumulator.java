package com.pipeline.cachingdb.core.impl;

import com.pipeline.cachingdb.core.CachingDbException;
import com.pipeline.cachingdb.core.ErrorKind;
import com.pipeline.cachingdb.model.Row;
import com.pipeline.cachingdb.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 内存结果累积区。
 *
 * 按逻辑表名保存查询结果：
 * 1. 只追加，保留插入顺序，追加时不去重、不排序
 * 2. 同一主键在多次查询中重复出现是允许的，持久化时由 INSERT OR REPLACE 收敛
 * 3. 表描述可以在任意一次追加时声明或重新声明，只保留最近一次非null的描述
 * 4. 声明描述后，追加的每一行字段数必须与描述的列数一致
 *
 * 非线程安全，由所属的缓存层实例独占。
 */
public class ResultAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ResultAccumulator.class);

    /** 表名同时会拼入SQL，只接受普通标识符 */
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** 表名 -> 累积状态，按首次出现顺序 */
    private final Map<String, TableBuffer> tables = new LinkedHashMap<>();

    /**
     * 追加一批行。整批校验通过后才修改状态，校验失败时累积区保持原样。
     *
     * @throws CachingDbException NON_UNIFORM_ROWS 行宽与已声明的描述不一致
     */
    public void append(String table, TableSchema schema, List<Row> rows) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }

        TableBuffer existing = tables.get(table);
        TableSchema effective = schema != null ? schema : (existing != null ? existing.schema : null);
        if (effective != null) {
            for (Row row : rows) {
                if (row.size() != effective.size()) {
                    throw new CachingDbException(ErrorKind.NON_UNIFORM_ROWS, String.format(
                            "Row with %d fields does not match the %d columns declared for table %s",
                            row.size(), effective.size(), table));
                }
            }
        }

        TableBuffer buffer = tables.computeIfAbsent(table, k -> new TableBuffer());
        if (schema != null) {
            if (buffer.schema != null && !buffer.schema.equals(schema)) {
                log.debug("Table {} schema re-declared: {} -> {}", table, buffer.schema, schema);
            }
            buffer.schema = schema;
        }
        buffer.rows.addAll(rows);
    }

    public Set<String> tableNames() {
        return Collections.unmodifiableSet(tables.keySet());
    }

    public boolean contains(String table) {
        return tables.containsKey(table);
    }

    public List<Row> rows(String table) {
        TableBuffer buffer = tables.get(table);
        if (buffer == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(buffer.rows);
    }

    public int rowCount(String table) {
        TableBuffer buffer = tables.get(table);
        return buffer == null ? 0 : buffer.rows.size();
    }

    public TableSchema schema(String table) {
        TableBuffer buffer = tables.get(table);
        return buffer == null ? null : buffer.schema;
    }

    /**
     * 移除一张表的累积状态
     *
     * @return 该表原先是否存在
     */
    public boolean drop(String table) {
        return tables.remove(table) != null;
    }

    public void dropAll() {
        tables.clear();
    }

    public int totalRowCount() {
        int total = 0;
        for (TableBuffer buffer : tables.values()) {
            total += buffer.rows.size();
        }
        return total;
    }

    /**
     * 单张表的累积状态
     */
    static class TableBuffer {
        final List<Row> rows = new ArrayList<>();
        TableSchema schema;
    }
}
