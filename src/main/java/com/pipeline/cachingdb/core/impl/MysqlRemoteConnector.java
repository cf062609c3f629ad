package com.pipeline.cachingdb.core.impl;

import com.pipeline.cachingdb.core.RemoteConnector;
import com.pipeline.cachingdb.model.RemoteCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * 默认远程连接器：通过JDBC连接MySQL（LMT数据库所在的后端）
 */
public class MysqlRemoteConnector implements RemoteConnector {

    private static final Logger log = LoggerFactory.getLogger(MysqlRemoteConnector.class);

    @Override
    public Connection open(RemoteCredentials credentials) throws SQLException {
        String url = jdbcUrl(credentials);
        log.info("Connecting to remote database {} as {}", url, credentials.getUser());
        return DriverManager.getConnection(url, credentials.getUser(), credentials.getPassword());
    }

    static String jdbcUrl(RemoteCredentials credentials) {
        return "jdbc:mysql://" + credentials.getHost() + "/" + credentials.getDatabase();
    }
}
