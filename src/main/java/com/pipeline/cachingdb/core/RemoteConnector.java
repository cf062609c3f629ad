package com.pipeline.cachingdb.core;

import com.pipeline.cachingdb.model.RemoteCredentials;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 远程数据源连接器。缓存层只依赖JDBC的执行/取全部结果约定，不依赖具体驱动。
 */
public interface RemoteConnector {

    /**
     * 打开远程连接。
     *
     * @param credentials 完整的连接凭据
     * @return 已打开的JDBC连接
     * @throws SQLException 驱动报告的连接错误，原样抛出
     */
    Connection open(RemoteCredentials credentials) throws SQLException;

    /**
     * 驱动的占位符风格名。JDBC驱动统一使用问号。
     */
    default String paramStyle() {
        return ParamStyle.QMARK.getConventionName();
    }
}
