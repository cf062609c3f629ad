package com.pipeline.cachingdb.core.impl;

import com.pipeline.cachingdb.core.CachingDb;
import com.pipeline.cachingdb.core.CachingDbException;
import com.pipeline.cachingdb.core.ErrorKind;
import com.pipeline.cachingdb.core.ParamStyle;
import com.pipeline.cachingdb.core.RemoteConnector;
import com.pipeline.cachingdb.model.PersistResult;
import com.pipeline.cachingdb.model.QueryOutcome;
import com.pipeline.cachingdb.model.RemoteCredentials;
import com.pipeline.cachingdb.model.Row;
import com.pipeline.cachingdb.model.TableSchema;
import com.pipeline.cachingdb.storage.SQLiteCachePersister;
import com.pipeline.cachingdb.storage.SQLiteConnections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 缓存查询层的默认实现。
 *
 * 连接上下文：零或一个缓存库连接 + 零或一个远程连接，各自带解析好的占位符。
 * 每次查询只由一个后端应答，缓存库优先。
 */
public class DefaultCachingDb implements CachingDb {

    private static final Logger log = LoggerFactory.getLogger(DefaultCachingDb.class);

    private final RemoteConnector remoteConnector;
    private final ResultAccumulator accumulator = new ResultAccumulator();
    private final SQLiteCachePersister persister = new SQLiteCachePersister();

    // ---- 缓存库 ----
    private String cacheFile;
    private Connection cacheDb;
    private String cacheDbPs;

    // ---- 远程库 ----
    private Connection remoteDb;
    private String remoteDbPs;

    private QueryOutcome lastHit;

    /** 远程库被缓存库取代的告警次数，最多为1 */
    private int remoteSupersededWarnings;

    public DefaultCachingDb() {
        this(new MysqlRemoteConnector());
    }

    public DefaultCachingDb(RemoteConnector remoteConnector) {
        this.remoteConnector = Objects.requireNonNull(remoteConnector, "remoteConnector");
    }

    /**
     * 按给定参数打开后端：有缓存文件则打开缓存库，凭据完整则连接远程库。
     *
     * @param cacheFile   缓存文件，可为null
     * @param credentials 远程凭据，可为null或不完整（此时不连接远程）
     */
    public DefaultCachingDb(String cacheFile, RemoteCredentials credentials,
                            RemoteConnector remoteConnector) throws SQLException {
        this(remoteConnector);
        if (cacheFile != null) {
            connectCache(cacheFile);
        }
        if (credentials != null && credentials.isComplete()) {
            connect(credentials);
        }
    }

    // ==================== 连接管理 ====================

    @Override
    public void connect(RemoteCredentials credentials) throws SQLException {
        if (credentials == null || !credentials.isComplete()) {
            throw new IllegalArgumentException("Incomplete remote credentials: " + credentials);
        }
        String ps = ParamStyle.resolveSymbol(remoteConnector.paramStyle());
        Connection conn = remoteConnector.open(credentials);

        if (cacheDb != null) {
            // 两个后端同时生效会让查询路由含糊不清，缓存库保持权威
            conn.close();
            warnRemoteSuperseded();
            return;
        }

        close();
        remoteDb = conn;
        remoteDbPs = ps;
        log.info("Remote database connected: {}", credentials);
    }

    @Override
    public void close() {
        if (remoteDb != null) {
            try {
                remoteDb.close();
            } catch (SQLException e) {
                log.warn("Failed to close remote connection: {}", e.getMessage(), e);
            }
            log.info("Remote database connection released.");
        }
        remoteDb = null;
        remoteDbPs = null;
    }

    @Override
    public void connectCache(String cacheFile) throws SQLException {
        Objects.requireNonNull(cacheFile, "cacheFile");
        String ps = ParamStyle.resolveSymbol(SQLiteConnections.PARAM_STYLE);
        Connection conn = SQLiteConnections.open(cacheFile);

        closeCache();
        this.cacheDb = conn;
        this.cacheFile = cacheFile;
        this.cacheDbPs = ps;
        log.info("Cache database opened: {}", cacheFile);

        if (remoteDb != null) {
            warnRemoteSuperseded();
        }
    }

    @Override
    public void closeCache() {
        if (cacheDb != null) {
            SQLiteConnections.closeQuietly(cacheDb, cacheFile);
            log.info("Cache database closed: {}", cacheFile);
        }
        cacheDb = null;
        cacheFile = null;
        cacheDbPs = null;
    }

    private void warnRemoteSuperseded() {
        if (remoteSupersededWarnings == 0) {
            log.warn("Both remote and cache databases requested; all queries will be served by cache {}",
                    cacheFile);
            remoteSupersededWarnings++;
        }
    }

    int getRemoteSupersededWarnings() {
        return remoteSupersededWarnings;
    }

    public String getCacheFile() { return cacheFile; }
    public boolean isCacheOpen() { return cacheDb != null; }
    public boolean isRemoteOpen() { return remoteDb != null; }

    // ==================== 查询路由 ====================

    @Override
    public List<Row> query(String queryTemplate, List<?> params) throws SQLException {
        return query(queryTemplate, params, null, null);
    }

    @Override
    public List<Row> query(String queryTemplate, List<?> params, String table, TableSchema schema)
            throws SQLException {
        String collapsed = collapseWhitespace(queryTemplate);
        List<?> variables = params == null ? Collections.emptyList() : params;

        List<Row> rows;
        if (cacheDb != null) {
            rows = execute(cacheDb, ParamStyle.substitute(collapsed, cacheDbPs), variables);
            lastHit = QueryOutcome.SATISFIED_BY_CACHE;
        } else if (remoteDb != null) {
            rows = execute(remoteDb, ParamStyle.substitute(collapsed, remoteDbPs), variables);
            lastHit = QueryOutcome.SATISFIED_BY_REMOTE;
        } else {
            throw new CachingDbException(ErrorKind.NO_BACKEND_AVAILABLE, "No databases available to query");
        }

        if (table != null) {
            accumulator.append(table, schema, rows);
        }
        return rows;
    }

    private List<Row> execute(Connection conn, String sql, List<?> params) throws SQLException {
        log.debug("Executing [{}] with {}", sql, params);
        List<Row> rows = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            if (stmt.execute()) {
                try (ResultSet rs = stmt.getResultSet()) {
                    int columnCount = rs.getMetaData().getColumnCount();
                    while (rs.next()) {
                        Object[] values = new Object[columnCount];
                        for (int c = 0; c < columnCount; c++) {
                            values[c] = rs.getObject(c + 1);
                        }
                        rows.add(Row.of(values));
                    }
                }
            }
        }
        return Collections.unmodifiableList(rows);
    }

    static String collapseWhitespace(String queryTemplate) {
        return String.join(" ", queryTemplate.trim().split("\\s+"));
    }

    // ==================== 内存累积区 ====================

    @Override
    public void appendRows(String table, TableSchema schema, List<Row> rows) {
        accumulator.append(table, schema, rows);
    }

    @Override
    public void dropCache() {
        accumulator.dropAll();
    }

    @Override
    public void dropCache(Collection<String> tables) {
        for (String table : tables) {
            accumulator.drop(table);
        }
    }

    @Override
    public List<Row> bufferedRows(String table) {
        return accumulator.rows(table);
    }

    @Override
    public int bufferedRowCount(String table) {
        return accumulator.rowCount(table);
    }

    @Override
    public TableSchema bufferedSchema(String table) {
        return accumulator.schema(table);
    }

    // ==================== 持久化 ====================

    @Override
    public PersistResult persist(String destinationFile) {
        Objects.requireNonNull(destinationFile, "destinationFile");
        return persister.persist(accumulator, destinationFile, cacheFile, cacheDb);
    }

    @Override
    public QueryOutcome getLastHit() {
        return lastHit;
    }

    @Override
    public void shutdown() {
        close();
        closeCache();
        log.info("CachingDb shut down, {} buffered rows discarded.", accumulator.totalRowCount());
        accumulator.dropAll();
    }
}
