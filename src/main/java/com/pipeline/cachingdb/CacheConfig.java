package com.pipeline.cachingdb;

import com.pipeline.cachingdb.model.RemoteCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * 缓存层配置。
 * 对应配置文件中的远程库凭据、缓存文件和分块宽度。
 */
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    public static final String ENV_HOST = "PYTOKIO_LMT_HOST";
    public static final String ENV_USER = "PYTOKIO_LMT_USER";
    public static final String ENV_PASSWORD = "PYTOKIO_LMT_PASSWORD";
    public static final String ENV_DATABASE = "PYTOKIO_LMT_DB";

    // ---- 远程库 ----
    private String host;
    private String user;
    private String password;
    private String database;

    // ---- 缓存库 ----
    private String cacheFile;

    // ---- 分块抓取 ----
    private long chunkSeconds = 3600;

    public static CacheConfig load(String configPath) {
        CacheConfig config = new CacheConfig();
        try (InputStream in = new FileInputStream(configPath)) {
            Properties props = new Properties();
            props.load(in);
            config.apply(props);
        } catch (IOException | NumberFormatException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
        }
        return config;
    }

    public static CacheConfig fromProperties(Properties props) {
        CacheConfig config = new CacheConfig();
        config.apply(props);
        return config;
    }

    private void apply(Properties props) {
        host = props.getProperty("lmtdb.host");
        user = props.getProperty("lmtdb.user");
        password = props.getProperty("lmtdb.password");
        database = props.getProperty("lmtdb.database");
        cacheFile = props.getProperty("cache.file");
        chunkSeconds = Long.parseLong(props.getProperty("fetch.chunk.seconds", "3600"));
    }

    /**
     * 用进程环境变量补齐未设置的远程凭据
     */
    public CacheConfig withEnvironmentDefaults() {
        return withEnvironmentDefaults(System.getenv());
    }

    public CacheConfig withEnvironmentDefaults(Map<String, String> env) {
        if (host == null) host = env.get(ENV_HOST);
        if (user == null) user = env.get(ENV_USER);
        if (password == null) password = env.get(ENV_PASSWORD);
        if (database == null) database = env.get(ENV_DATABASE);
        return this;
    }

    public CacheConfig setCacheFile(String cacheFile) {
        this.cacheFile = cacheFile;
        return this;
    }

    public CacheConfig setChunkSeconds(long chunkSeconds) {
        this.chunkSeconds = chunkSeconds;
        return this;
    }

    // ---- Getters ----
    public String getHost() { return host; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public String getDatabase() { return database; }
    public String getCacheFile() { return cacheFile; }
    public long getChunkSeconds() { return chunkSeconds; }

    public Duration getChunkWidth() {
        return Duration.ofSeconds(chunkSeconds);
    }

    /**
     * @return 凭据不完整时返回null，表示不连接远程库
     */
    public RemoteCredentials getRemoteCredentials() {
        RemoteCredentials credentials = new RemoteCredentials(host, user, password, database);
        return credentials.isComplete() ? credentials : null;
    }

    @Override
    public String toString() {
        return "CacheConfig{host='" + host + "'"
                + ", user='" + user + "'"
                + ", database='" + database + "'"
                + ", cacheFile='" + cacheFile + "'"
                + ", chunkSeconds=" + chunkSeconds + "}";
    }
}
