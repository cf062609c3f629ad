package com.pipeline.cachingdb.lmt;

import com.pipeline.cachingdb.CacheConfig;
import com.pipeline.cachingdb.core.RemoteConnector;
import com.pipeline.cachingdb.core.impl.DefaultCachingDb;
import com.pipeline.cachingdb.core.impl.MysqlRemoteConnector;
import com.pipeline.cachingdb.model.RemoteCredentials;
import com.pipeline.cachingdb.model.Row;
import com.pipeline.cachingdb.model.TableSchema;
import com.pipeline.cachingdb.model.TimeChunk;
import com.pipeline.cachingdb.model.TimeWindowResult;
import com.pipeline.cachingdb.model.TsIdRange;
import com.pipeline.cachingdb.storage.SQLiteConnections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * LMT数据库的缓存查询封装。
 *
 * 时间序列表（OST_DATA等）需要与 TIMESTAMP_INFO 连接才能按时间过滤，
 * 连接代价随两侧匹配行数的乘积增长。这里先把整个时间窗口一次性解析为TS_ID区间，
 * 再按固定宽度（默认1小时）分块查询，每块以同一个逻辑表名累积到内存，
 * 最后只返回本次抓取新增的行。
 */
public class LmtDb extends DefaultCachingDb {

    private static final Logger log = LoggerFactory.getLogger(LmtDb.class);

    public static final Duration DEFAULT_CHUNK_WIDTH = Duration.ofHours(1);

    /** TIMESTAMP列的文本格式，与MySQL DATETIME的字面量一致 */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = SQLiteConnections.TIMESTAMP_FORMAT;

    private static final String TS_ID_BOUNDS_QUERY =
            "SELECT MIN(TIMESTAMP_INFO.TS_ID), MAX(TIMESTAMP_INFO.TS_ID) FROM TIMESTAMP_INFO "
                    + "WHERE TIMESTAMP_INFO.TIMESTAMP >= {ps} AND TIMESTAMP_INFO.TIMESTAMP <= {ps}";

    private final Duration defaultChunkWidth;

    // ---- ID到名称的映射，数据库属性不可变，首次使用时加载一次 ----
    private Map<Long, String> ostNames;
    private Map<Long, String> ossNames;
    private Map<Long, String> mdsNames;
    private Map<Long, String> mdsOpNames;

    public LmtDb(String cacheFile) throws SQLException {
        this(cacheFile, null, new MysqlRemoteConnector(), DEFAULT_CHUNK_WIDTH);
    }

    public LmtDb(CacheConfig config) throws SQLException {
        this(config.getCacheFile(), config.getRemoteCredentials(), new MysqlRemoteConnector(),
                config.getChunkWidth());
    }

    public LmtDb(String cacheFile, RemoteCredentials credentials, RemoteConnector connector) throws SQLException {
        this(cacheFile, credentials, connector, DEFAULT_CHUNK_WIDTH);
    }

    public LmtDb(String cacheFile, RemoteCredentials credentials, RemoteConnector connector,
                 Duration defaultChunkWidth) throws SQLException {
        super(cacheFile, credentials, connector);
        this.defaultChunkWidth = defaultChunkWidth;
    }

    // ==================== 时间窗口抓取 ====================

    /**
     * 把时间窗口解析为TS_ID闭区间。
     *
     * @param start 起始时刻，包含
     * @param end   结束时刻，包含
     * @return 窗口内没有任何采样时刻时为空
     */
    public Optional<TsIdRange> getTsIds(LocalDateTime start, LocalDateTime end) throws SQLException {
        List<Row> result = query(TS_ID_BOUNDS_QUERY, Arrays.asList(format(start), format(end)));
        if (result.isEmpty() || result.get(0).get(0) == null) {
            return Optional.empty();
        }
        Row row = result.get(0);
        return Optional.of(new TsIdRange(row.getLong(0), row.getLong(1)));
    }

    public TimeWindowResult getTimeWindow(String table, LocalDateTime start, LocalDateTime end)
            throws SQLException {
        return getTimeWindow(table, start, end, defaultChunkWidth);
    }

    /**
     * 分块抓取一张时间序列表在 [start, end) 内的数据。
     *
     * @param table      LMT表名，不区分大小写
     * @param start      起始时刻，包含；不足整秒的部分向上取整
     * @param end        结束时刻，不包含；不足整秒的部分向上取整
     * @param chunkWidth 每块查询覆盖的时间宽度
     * @return 本次抓取新追加到内存累积区的行，不含之前已累积的行
     * @throws com.pipeline.cachingdb.core.CachingDbException INVALID_TIME_RANGE 区间为空或倒置（在任何查询之前）；
     *                                                        UNKNOWN_TABLE 表不在注册表中
     */
    public TimeWindowResult getTimeWindow(String table, LocalDateTime start, LocalDateTime end,
                                          Duration chunkWidth) throws SQLException {
        // 采样时刻与绑定的时间文本都是整秒
        start = TimeChunker.ceilToSecond(start);
        end = TimeChunker.ceilToSecond(end);
        TableSchema schema = LmtTables.get(table);
        String name = LmtTables.canonicalName(table);
        if (!schema.isTimeIndexed() || name.equals(LmtTables.TIMESTAMP_INFO)) {
            throw new IllegalArgumentException("Table " + name + " is not a time series table");
        }
        List<TimeChunk> chunks = TimeChunker.plan(start, end, chunkWidth);

        Optional<TsIdRange> bounds = getTsIds(start, end);
        if (bounds.isEmpty()) {
            log.info("No TS_IDs between {} and {}; nothing to fetch from {}", start, end, name);
            return new TimeWindowResult(name, schema.getColumnNames(), Collections.emptyList(), 0);
        }
        TsIdRange tsIds = bounds.get();

        int index0 = bufferedRowCount(name);
        String queryStr = chunkQuery(name, schema);
        for (TimeChunk chunk : chunks) {
            log.debug("Fetching {} for {} (TS_ID {} - {})", name, chunk, tsIds.getMin(), tsIds.getMax());
            query(queryStr,
                    Arrays.asList(format(chunk.getStart()), format(chunk.getEnd()), tsIds.getMin(), tsIds.getMax()),
                    name, schema);
        }

        List<Row> buffered = bufferedRows(name);
        List<Row> delta = new ArrayList<>(buffered.subList(index0, buffered.size()));
        log.info("Fetched {} rows of {} between {} and {} in {} chunks", delta.size(), name, start, end, chunks.size());
        return new TimeWindowResult(name, schema.getColumnNames(), delta, chunks.size());
    }

    /**
     * 单块查询：事实表连接 TIMESTAMP_INFO，按块的时间边界过滤，
     * 同时把事实表的TS_ID限定在整个窗口解析出的区间内，让事实表一侧走主键范围扫描。
     */
    static String chunkQuery(String table, TableSchema schema) {
        List<String> qualified = new ArrayList<>();
        for (String column : schema.getColumnNames()) {
            qualified.add(table + "." + column);
        }
        return "SELECT " + String.join(", ", qualified)
                + " FROM " + table
                + " INNER JOIN TIMESTAMP_INFO ON TIMESTAMP_INFO.TS_ID = " + table + ".TS_ID"
                + " WHERE TIMESTAMP_INFO.TIMESTAMP >= {ps}"
                + " AND TIMESTAMP_INFO.TIMESTAMP < {ps}"
                + " AND " + table + ".TS_ID >= {ps}"
                + " AND " + table + ".TS_ID <= {ps}"
                + " ORDER BY " + table + ".TS_ID";
    }

    public TimeWindowResult getOstData(LocalDateTime start, LocalDateTime end) throws SQLException {
        return getTimeWindow(LmtTables.OST_DATA, start, end);
    }

    public TimeWindowResult getOssData(LocalDateTime start, LocalDateTime end) throws SQLException {
        return getTimeWindow(LmtTables.OSS_DATA, start, end);
    }

    public TimeWindowResult getMdsData(LocalDateTime start, LocalDateTime end) throws SQLException {
        return getTimeWindow(LmtTables.MDS_DATA, start, end);
    }

    public TimeWindowResult getMdsOpsData(LocalDateTime start, LocalDateTime end) throws SQLException {
        return getTimeWindow(LmtTables.MDS_OPS_DATA, start, end);
    }

    // ==================== 整库缓存 ====================

    /**
     * 把注册表中所有表的相关内容累积到内存，随后persist即可得到自包含的缓存文件。
     * 按时间索引的表限定在窗口的TS_ID区间内，其余表整表读取。
     *
     * @param limit 每张表最多读取的行数，null表示不限
     * @return 本次累积的总行数
     */
    public int cacheTables(LocalDateTime start, LocalDateTime end, Integer limit) throws SQLException {
        start = TimeChunker.ceilToSecond(start);
        end = TimeChunker.ceilToSecond(end);
        TimeChunker.validate(start, end);
        Optional<TsIdRange> bounds = getTsIds(start, end);

        int total = 0;
        for (Map.Entry<String, TableSchema> entry : LmtTables.all().entrySet()) {
            String table = entry.getKey();
            TableSchema schema = entry.getValue();

            StringBuilder queryStr = new StringBuilder("SELECT ")
                    .append(String.join(", ", schema.getColumnNames()))
                    .append(" FROM ").append(table);
            List<Object> params = new ArrayList<>();
            if (schema.isTimeIndexed()) {
                if (bounds.isEmpty()) {
                    log.debug("Skipping {}: no TS_IDs in window", table);
                    continue;
                }
                queryStr.append(" WHERE TS_ID >= {ps} AND TS_ID <= {ps}");
                params.add(bounds.get().getMin());
                params.add(bounds.get().getMax());
            }
            if (limit != null) {
                queryStr.append(" LIMIT ").append(limit.intValue());
            }

            total += query(queryStr.toString(), params, table, schema).size();
        }
        log.info("Cached {} rows from {} tables between {} and {}", total, LmtTables.names().size(), start, end);
        return total;
    }

    // ==================== 名称映射 ====================

    public Map<Long, String> getOstNames() throws SQLException {
        if (ostNames == null) {
            ostNames = loadIdMap("SELECT OST_ID, OST_NAME FROM OST_INFO");
        }
        return ostNames;
    }

    public Map<Long, String> getOssNames() throws SQLException {
        if (ossNames == null) {
            ossNames = loadIdMap("SELECT OSS_ID, HOSTNAME FROM OSS_INFO");
        }
        return ossNames;
    }

    public Map<Long, String> getMdsNames() throws SQLException {
        if (mdsNames == null) {
            mdsNames = loadIdMap("SELECT MDS_ID, HOSTNAME FROM MDS_INFO");
        }
        return mdsNames;
    }

    public Map<Long, String> getMdsOpNames() throws SQLException {
        if (mdsOpNames == null) {
            mdsOpNames = loadIdMap("SELECT OPERATION_ID, OPERATION_NAME FROM OPERATION_INFO");
        }
        return mdsOpNames;
    }

    private Map<Long, String> loadIdMap(String queryStr) throws SQLException {
        Map<Long, String> map = new LinkedHashMap<>();
        for (Row row : query(queryStr, Collections.emptyList())) {
            map.put(row.getLong(0), row.getString(1));
        }
        return Collections.unmodifiableMap(map);
    }

    static String format(LocalDateTime time) {
        return time.format(TIMESTAMP_FORMAT);
    }
}
