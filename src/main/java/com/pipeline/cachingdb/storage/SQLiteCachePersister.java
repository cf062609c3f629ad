package com.pipeline.cachingdb.storage;

import com.pipeline.cachingdb.core.ErrorKind;
import com.pipeline.cachingdb.core.impl.ResultAccumulator;
import com.pipeline.cachingdb.model.PersistResult;
import com.pipeline.cachingdb.model.Row;
import com.pipeline.cachingdb.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把内存累积区写入SQLite缓存文件。
 *
 * 核心设计：
 * - 每张表独立处理，单表失败不影响其余表
 * - 有表描述时先 CREATE TABLE IF NOT EXISTS
 * - INSERT OR REPLACE 批量写入，同一主键重复写入覆盖自身，保证幂等
 * - 写入成功后才从内存移除该表，失败时保留供重试
 * - 目标不是当前缓存库时，另开一个限定作用域的连接，用完即关，当前缓存库连接不受影响
 */
public class SQLiteCachePersister {

    private static final Logger log = LoggerFactory.getLogger(SQLiteCachePersister.class);

    /**
     * @param accumulator     内存累积区
     * @param destinationFile 目标缓存文件
     * @param openCacheFile   当前打开的缓存文件，可为null
     * @param openCacheDb     当前打开的缓存库连接，可为null
     */
    public PersistResult persist(ResultAccumulator accumulator, String destinationFile,
                                 String openCacheFile, Connection openCacheDb) {
        if (openCacheDb != null && SQLiteConnections.samePath(destinationFile, openCacheFile)) {
            log.info("Persisting {} buffered rows into the open cache file {}",
                    accumulator.totalRowCount(), destinationFile);
            return writeAll(accumulator, openCacheDb, destinationFile);
        }

        Connection destination;
        try {
            destination = SQLiteConnections.open(destinationFile);
        } catch (SQLException e) {
            log.error("Failed to open cache file '{}': {}", destinationFile, e.getMessage(), e);
            PersistResult result = new PersistResult(destinationFile);
            result.addError("Failed to open cache file " + destinationFile + ": " + e.getMessage());
            return result;
        }

        log.info("Persisting {} buffered rows into {}", accumulator.totalRowCount(), destinationFile);
        try {
            return writeAll(accumulator, destination, destinationFile);
        } finally {
            SQLiteConnections.closeQuietly(destination, destinationFile);
        }
    }

    private PersistResult writeAll(ResultAccumulator accumulator, Connection conn, String destinationFile) {
        PersistResult result = new PersistResult(destinationFile);

        // 遍历过程中会移除已写入的表，先复制表名
        List<String> tables = new ArrayList<>(accumulator.tableNames());
        for (String table : tables) {
            List<Row> rows = accumulator.rows(table);
            if (rows.isEmpty()) {
                continue;
            }

            int numFields = rows.get(0).size();
            int mismatch = firstMismatch(rows, numFields);
            if (mismatch >= 0) {
                String msg = String.format("Table %s contains non-uniform rows (%d, %d); skipping table",
                        table, rows.get(mismatch).size(), numFields);
                log.warn(msg);
                result.addFailure(table, ErrorKind.NON_UNIFORM_ROWS, msg);
                continue;
            }

            TableSchema schema = accumulator.schema(table);
            if (schema != null) {
                if (schema.size() != numFields) {
                    String msg = String.format("Table %s rows have %d fields but %d columns are declared; skipping table",
                            table, numFields, schema.size());
                    log.warn(msg);
                    result.addFailure(table, ErrorKind.NON_UNIFORM_ROWS, msg);
                    continue;
                }
                try {
                    createTable(conn, table, schema);
                } catch (SQLException e) {
                    String msg = String.format("Failed to create table %s in %s: %s",
                            table, destinationFile, e.getMessage());
                    log.error(msg, e);
                    result.addFailure(table, ErrorKind.SCHEMA_CREATION_FAILED, msg);
                    continue;
                }
            }

            try {
                insertOrReplace(conn, table, rows, numFields);
            } catch (SQLException e) {
                String msg = String.format("Failed to write %d rows into table %s of %s: %s",
                        rows.size(), table, destinationFile, e.getMessage());
                log.warn(msg, e);
                result.addFailure(table, ErrorKind.CACHE_WRITE_FAILED, msg);
                continue;
            }

            result.addPersisted(table, rows.size());
            accumulator.drop(table);
            log.debug("Table {}: {} rows committed to {}", table, rows.size(), destinationFile);
        }

        log.info("Persist to {} finished: {} tables written, {} tables failed",
                destinationFile, result.getPersistedTables().size(), result.getFailures().size());
        return result;
    }

    private void createTable(Connection conn, String table, TableSchema schema) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(schema.createTableSql(table));
        }
    }

    /**
     * 单事务批量写入；失败回滚，目标表保持写入前的状态
     */
    void insertOrReplace(Connection conn, String table, List<Row> rows, int numFields) throws SQLException {
        String sql = "INSERT OR REPLACE INTO " + table + " VALUES ("
                + String.join(", ", Collections.nCopies(numFields, "?")) + ")";

        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (Row row : rows) {
                for (int i = 0; i < numFields; i++) {
                    stmt.setObject(i + 1, SQLiteConnections.toStorageValue(row.get(i)));
                }
                stmt.addBatch();
            }
            stmt.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    /** 第一个字段数不等于numFields的行下标，全部一致返回-1 */
    private static int firstMismatch(List<Row> rows, int numFields) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).size() != numFields) {
                return i;
            }
        }
        return -1;
    }
}
