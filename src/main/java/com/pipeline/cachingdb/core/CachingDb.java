package com.pipeline.cachingdb.core;

import com.pipeline.cachingdb.model.PersistResult;
import com.pipeline.cachingdb.model.QueryOutcome;
import com.pipeline.cachingdb.model.RemoteCredentials;
import com.pipeline.cachingdb.model.Row;
import com.pipeline.cachingdb.model.TableSchema;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * 缓存查询层接口 —— 位于分析代码与不可变、按时间索引的关系型数据源之间。
 *
 * 提供分层查询路由、内存结果累积和幂等持久化能力：
 * - 本地缓存库（SQLite文件）与远程库同时配置时，始终由缓存库应答
 * - 指定了表名的查询，其结果按表名追加到内存累积区（只追加，不去重）
 * - 持久化时以 INSERT OR REPLACE 写入目标缓存文件，重复写入同一主键不产生重复行
 *
 * 单线程、单写者使用，不提供内部加锁。
 */
public interface CachingDb {

    /**
     * 打开远程连接。
     * 若缓存库已打开，远程连接打开后立即关闭并记录一次告警，缓存库继续应答所有查询。
     *
     * @param credentials 完整的远程凭据
     * @throws SQLException 驱动报告的连接错误
     */
    void connect(RemoteCredentials credentials) throws SQLException;

    /**
     * 释放远程连接。不影响缓存库连接和内存累积区。
     */
    void close();

    /**
     * 打开本地缓存库。
     *
     * @param cacheFile SQLite文件路径
     * @throws SQLException 文件无法打开
     */
    void connectCache(String cacheFile) throws SQLException;

    /**
     * 关闭本地缓存库连接。
     */
    void closeCache();

    /**
     * 执行查询，不累积结果。
     *
     * @see #query(String, List, String, TableSchema)
     */
    List<Row> query(String queryTemplate, List<?> params) throws SQLException;

    /**
     * 在当前生效的后端上执行查询。
     *
     * 模板中的空白先被折叠，{@value ParamStyle#MARKER} 替换为后端的占位符。
     * 本层不做SQL校验，语法错误由后端报告并原样抛出。
     *
     * @param queryTemplate 查询模板
     * @param params        按位置绑定的参数
     * @param table         逻辑表名；非空时结果追加到该表的内存累积区
     * @param schema        表描述，可为null；非空时替换之前保存的描述
     * @return 有序结果行
     * @throws CachingDbException NO_BACKEND_AVAILABLE 两个后端都未打开
     * @throws SQLException       后端查询错误
     */
    List<Row> query(String queryTemplate, List<?> params, String table, TableSchema schema) throws SQLException;

    /**
     * 不经查询直接向内存累积区追加行（供解析器等外部来源使用），校验规则与查询结果相同。
     */
    void appendRows(String table, TableSchema schema, List<Row> rows);

    /**
     * 把内存累积区写入目标缓存文件。
     *
     * 每张表独立处理：行宽不一致的表被跳过，建表或写入失败的表保留内存数据，
     * 写入成功的表从内存中移除。目标不是当前缓存库时，当前缓存库连接不受影响。
     *
     * @param destinationFile 目标SQLite文件
     * @return 汇总结果，含成功标志、告警和错误
     */
    PersistResult persist(String destinationFile);

    /**
     * 丢弃全部表的内存累积数据。
     */
    void dropCache();

    /**
     * 仅丢弃指定表的内存累积数据。
     */
    void dropCache(Collection<String> tables);

    /**
     * @return 内存累积区中该表的行（只读视图）；表不存在返回空列表
     */
    List<Row> bufferedRows(String table);

    /**
     * @return 内存累积区中该表的行数
     */
    int bufferedRowCount(String table);

    /**
     * @return 内存累积区中该表的描述，未声明返回null
     */
    TableSchema bufferedSchema(String table);

    /**
     * @return 最近一次成功查询由哪个后端应答；尚未查询返回null
     */
    QueryOutcome getLastHit();

    /**
     * 关闭全部连接。
     */
    void shutdown();
}
