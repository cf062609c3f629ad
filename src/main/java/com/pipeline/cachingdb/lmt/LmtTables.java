package com.pipeline.cachingdb.lmt;

import com.pipeline.cachingdb.core.CachingDbException;
import com.pipeline.cachingdb.core.ErrorKind;
import com.pipeline.cachingdb.model.TableSchema;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * LMT（Lustre Monitoring Tool）数据库中值得缓存的表及其模式。
 *
 * 静态配置数据：表名 -> 有序列名 + 有序主键。含TS_ID列的表按时间索引，
 * 通过 TIMESTAMP_INFO 把 TS_ID 映射到采样时刻。
 */
public final class LmtTables {

    public static final String TIMESTAMP_INFO = "TIMESTAMP_INFO";
    public static final String OST_DATA = "OST_DATA";
    public static final String OSS_DATA = "OSS_DATA";
    public static final String MDS_DATA = "MDS_DATA";
    public static final String MDS_OPS_DATA = "MDS_OPS_DATA";

    private static final Map<String, TableSchema> TABLES;

    static {
        Map<String, TableSchema> tables = new LinkedHashMap<>();
        tables.put("FILESYSTEM_INFO", schema(
                cols("FILESYSTEM_ID", "FILESYSTEM_NAME", "FILESYSTEM_MOUNT_NAME", "SCHEMA_VERSION"),
                cols("FILESYSTEM_ID")));
        tables.put(MDS_DATA, schema(
                cols("MDS_ID", "TS_ID", "PCT_CPU", "KBYTES_FREE", "KBYTES_USED", "INODES_FREE", "INODES_USED"),
                cols("MDS_ID", "TS_ID")));
        tables.put("MDS_INFO", schema(
                cols("MDS_ID", "FILESYSTEM_ID", "MDS_NAME", "HOSTNAME", "DEVICE_NAME"),
                cols("MDS_ID")));
        tables.put(MDS_OPS_DATA, schema(
                cols("MDS_ID", "TS_ID", "OPERATION_ID", "SAMPLES", "SUM", "SUMSQUARES"),
                cols("MDS_ID", "TS_ID", "OPERATION_ID")));
        tables.put("MDS_VARIABLE_INFO", schema(
                cols("VARIABLE_ID", "VARIABLE_NAME", "VARIABLE_LABEL", "THRESH_TYPE", "THRESH_VAL1", "THRESH_VAL2"),
                cols("VARIABLE_ID")));
        tables.put("OPERATION_INFO", schema(
                cols("OPERATION_ID", "OPERATION_NAME", "UNITS"),
                cols("OPERATION_ID")));
        tables.put(OSS_DATA, schema(
                cols("OSS_ID", "TS_ID", "PCT_CPU", "PCT_MEMORY"),
                cols("OSS_ID", "TS_ID")));
        tables.put("OSS_INFO", schema(
                cols("OSS_ID", "FILESYSTEM_ID", "HOSTNAME", "FAILOVERHOST"),
                cols("OSS_ID", "HOSTNAME")));
        tables.put(OST_DATA, schema(
                cols("OST_ID", "TS_ID", "READ_BYTES", "WRITE_BYTES", "PCT_CPU",
                        "KBYTES_FREE", "KBYTES_USED", "INODES_FREE", "INODES_USED"),
                cols("OST_ID", "TS_ID")));
        tables.put("OST_INFO", schema(
                cols("OST_ID", "OSS_ID", "OST_NAME", "HOSTNAME", "OFFLINE", "DEVICE_NAME"),
                cols("OST_ID")));
        tables.put("OST_VARIABLE_INFO", schema(
                cols("VARIABLE_ID", "VARIABLE_NAME", "VARIABLE_LABEL", "THRESH_TYPE", "THRESH_VAL1", "THRESH_VAL2"),
                cols("VARIABLE_ID")));
        tables.put(TIMESTAMP_INFO, schema(
                cols("TS_ID", "TIMESTAMP"),
                cols("TS_ID")));
        TABLES = Collections.unmodifiableMap(tables);
    }

    private LmtTables() {}

    /**
     * 按表名查找模式，不区分大小写
     *
     * @throws CachingDbException UNKNOWN_TABLE
     */
    public static TableSchema get(String table) {
        TableSchema schema = table == null ? null : TABLES.get(canonicalName(table));
        if (schema == null) {
            throw new CachingDbException(ErrorKind.UNKNOWN_TABLE, "Table '" + table + "' is not valid");
        }
        return schema;
    }

    public static boolean contains(String table) {
        return table != null && TABLES.containsKey(canonicalName(table));
    }

    public static String canonicalName(String table) {
        return table.toUpperCase(Locale.ROOT);
    }

    public static Set<String> names() {
        return TABLES.keySet();
    }

    public static Map<String, TableSchema> all() {
        return TABLES;
    }

    private static TableSchema schema(List<String> columns, List<String> primaryKey) {
        return new TableSchema(columns, primaryKey);
    }

    private static List<String> cols(String... names) {
        return Arrays.asList(names);
    }
}
