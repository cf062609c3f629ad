package com.pipeline.cachingdb.core.impl;

import com.pipeline.cachingdb.core.RemoteConnector;
import com.pipeline.cachingdb.model.RemoteCredentials;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用远程连接器：把凭据中的数据库名当作SQLite文件路径
 */
public class SqliteRemoteConnector implements RemoteConnector {

    private final AtomicInteger opened = new AtomicInteger();

    @Override
    public Connection open(RemoteCredentials credentials) throws SQLException {
        opened.incrementAndGet();
        return DriverManager.getConnection("jdbc:sqlite:" + credentials.getDatabase());
    }

    public int getOpenCount() {
        return opened.get();
    }

    public static RemoteCredentials credentialsFor(String sqliteFile) {
        return new RemoteCredentials("localhost", "lmt", "secret", sqliteFile);
    }
}
