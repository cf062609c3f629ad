package com.pipeline.cachingdb.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * SQLite缓存文件连接工具
 */
public final class SQLiteConnections {

    private static final Logger log = LoggerFactory.getLogger(SQLiteConnections.class);

    public static final String JDBC_PREFIX = "jdbc:sqlite:";

    /** sqlite3驱动的占位符风格 */
    public static final String PARAM_STYLE = "qmark";

    /** 时间值在缓存文件中的文本格式，与MySQL DATETIME的字面量一致，可按字典序比较 */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private SQLiteConnections() {}

    public static Connection open(String cacheFile) throws SQLException {
        Connection conn = DriverManager.getConnection(JDBC_PREFIX + cacheFile);
        conn.setAutoCommit(true);
        log.debug("Opened SQLite cache file {}", cacheFile);
        return conn;
    }

    /**
     * 关闭连接；关闭失败只记录告警，不影响调用方已完成的工作
     */
    public static void closeQuietly(Connection conn, String cacheFile) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close SQLite cache file {}: {}", cacheFile, e.getMessage(), e);
        }
    }

    /** 两个路径是否指向同一个缓存文件 */
    public static boolean samePath(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        Path pa = Paths.get(a).toAbsolutePath().normalize();
        Path pb = Paths.get(b).toAbsolutePath().normalize();
        return pa.equals(pb);
    }

    /**
     * 转换为写入SQLite的值。
     * 远程驱动返回的时间类型（LocalDateTime、Timestamp、Date）统一转为 {@link #TIMESTAMP_FORMAT} 文本，
     * 否则sqlite-jdbc会写入ISO文本或毫秒整数，与查询绑定的时间文本无法比较。
     */
    public static Object toStorageValue(Object value) {
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(TIMESTAMP_FORMAT);
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneId.systemDefault()).format(TIMESTAMP_FORMAT);
        }
        return value;
    }
}
