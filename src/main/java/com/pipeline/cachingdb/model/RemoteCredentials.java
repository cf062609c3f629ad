package com.pipeline.cachingdb.model;

import java.io.Serializable;

/**
 * 远程数据库连接凭据。四项全部给出才视为完整。
 */
public class RemoteCredentials implements Serializable {
    private final String host;
    private final String user;
    private final String password;
    private final String database;

    public RemoteCredentials(String host, String user, String password, String database) {
        this.host = host;
        this.user = user;
        this.password = password;
        this.database = database;
    }

    public boolean isComplete() {
        return host != null && user != null && password != null && database != null;
    }

    public String getHost() { return host; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public String getDatabase() { return database; }

    @Override
    public String toString() {
        return "RemoteCredentials{host='" + host + "', user='" + user
                + "', database='" + database + "'}";
    }
}
