package com.pipeline.cachingdb.core.impl;

import com.pipeline.cachingdb.core.CachingDbException;
import com.pipeline.cachingdb.core.ErrorKind;
import com.pipeline.cachingdb.model.QueryOutcome;
import com.pipeline.cachingdb.model.RemoteCredentials;
import com.pipeline.cachingdb.model.Row;
import com.pipeline.cachingdb.model.TableSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCachingDbTest {

    private static final TableSchema SAMPLE_SCHEMA = TableSchema.of(
            Arrays.asList("ID", "NAME"), Collections.singletonList("ID"));

    @TempDir
    Path tempDir;

    private String cacheFile;
    private String remoteFile;
    private SqliteRemoteConnector connector;
    private DefaultCachingDb db;

    @BeforeEach
    void setup() throws SQLException {
        cacheFile = tempDir.resolve("cache.sqlite").toString();
        remoteFile = tempDir.resolve("remote.sqlite").toString();
        createSample(cacheFile, "cache");
        createSample(remoteFile, "remote");
        connector = new SqliteRemoteConnector();
    }

    @AfterEach
    void teardown() {
        if (db != null) {
            db.shutdown();
        }
    }

    private static void createSample(String file, String label) throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + file);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE SAMPLE (ID, NAME, PRIMARY KEY (ID))");
            stmt.execute("INSERT INTO SAMPLE VALUES (1, '" + label + "-1')");
            stmt.execute("INSERT INTO SAMPLE VALUES (2, '" + label + "-2')");
        }
    }

    @Test
    void queryWithoutBackendFails() {
        db = new DefaultCachingDb(connector);
        CachingDbException e = assertThrows(CachingDbException.class,
                () -> db.query("SELECT 1", Collections.emptyList()));
        assertEquals(ErrorKind.NO_BACKEND_AVAILABLE, e.getKind());
        assertNull(db.getLastHit());
    }

    @Test
    void cacheQueryIsTaggedAsCacheHit() throws SQLException {
        db = new DefaultCachingDb(cacheFile, null, connector);
        List<Row> rows = db.query("SELECT NAME FROM SAMPLE WHERE ID = {ps}", Collections.singletonList(2));

        assertEquals(Collections.singletonList(Row.of("cache-2")), rows);
        assertEquals(QueryOutcome.SATISFIED_BY_CACHE, db.getLastHit());
        assertEquals(0, connector.getOpenCount());
    }

    @Test
    void remoteQueryIsTaggedAsRemoteHit() throws SQLException {
        db = new DefaultCachingDb(null, SqliteRemoteConnector.credentialsFor(remoteFile), connector);
        List<Row> rows = db.query("SELECT NAME FROM SAMPLE ORDER BY ID", null);

        assertEquals(Arrays.asList(Row.of("remote-1"), Row.of("remote-2")), rows);
        assertEquals(QueryOutcome.SATISFIED_BY_REMOTE, db.getLastHit());
        assertTrue(db.isRemoteOpen());
    }

    @Test
    void cacheTakesPrecedenceWhenBothAreConfigured() throws SQLException {
        db = new DefaultCachingDb(cacheFile, SqliteRemoteConnector.credentialsFor(remoteFile), connector);

        // 远程连接被尝试打开后立即关闭
        assertEquals(1, connector.getOpenCount());
        assertFalse(db.isRemoteOpen());
        assertEquals(1, db.getRemoteSupersededWarnings());

        for (int id = 1; id <= 2; id++) {
            List<Row> rows = db.query("SELECT NAME FROM SAMPLE WHERE ID = {ps}", Collections.singletonList(id));
            assertEquals("cache-" + id, rows.get(0).getString(0));
            assertEquals(QueryOutcome.SATISFIED_BY_CACHE, db.getLastHit());
        }
    }

    @Test
    void cacheOpenedAfterRemoteSupersedesIt() throws SQLException {
        db = new DefaultCachingDb(null, SqliteRemoteConnector.credentialsFor(remoteFile), connector);
        db.connectCache(cacheFile);

        assertTrue(db.isRemoteOpen());
        assertEquals("cache-1", db.query("SELECT NAME FROM SAMPLE WHERE ID = 1", null).get(0).getString(0));
        assertEquals(QueryOutcome.SATISFIED_BY_CACHE, db.getLastHit());

        // 关闭缓存库后回落到远程库
        db.closeCache();
        assertEquals("remote-1", db.query("SELECT NAME FROM SAMPLE WHERE ID = 1", null).get(0).getString(0));
        assertEquals(QueryOutcome.SATISFIED_BY_REMOTE, db.getLastHit());
    }

    @Test
    void supersededRemoteIsWarnedOnlyOnce() throws SQLException {
        db = new DefaultCachingDb(connector);
        db.connectCache(cacheFile);
        assertEquals(0, db.getRemoteSupersededWarnings());

        db.connect(SqliteRemoteConnector.credentialsFor(remoteFile));
        db.connect(SqliteRemoteConnector.credentialsFor(remoteFile));
        db.connectCache(cacheFile);

        assertEquals(2, connector.getOpenCount());
        assertFalse(db.isRemoteOpen());
        assertEquals(1, db.getRemoteSupersededWarnings());
    }

    @Test
    void cacheOpenedTwiceOverRemoteWarnsOnce() throws SQLException {
        db = new DefaultCachingDb(null, SqliteRemoteConnector.credentialsFor(remoteFile), connector);
        assertEquals(0, db.getRemoteSupersededWarnings());

        db.connectCache(cacheFile);
        db.connectCache(cacheFile);
        db.connect(SqliteRemoteConnector.credentialsFor(remoteFile));

        assertEquals(1, db.getRemoteSupersededWarnings());
        assertEquals(QueryOutcome.SATISFIED_BY_CACHE, queryOnce());
    }

    private QueryOutcome queryOnce() throws SQLException {
        db.query("SELECT NAME FROM SAMPLE WHERE ID = 1", null);
        return db.getLastHit();
    }

    @Test
    void closeReleasesRemoteOnly() throws SQLException {
        db = new DefaultCachingDb(null, SqliteRemoteConnector.credentialsFor(remoteFile), connector);
        db.connectCache(cacheFile);
        db.appendRows("SAMPLE", SAMPLE_SCHEMA, Collections.singletonList(Row.of(3, "memory-3")));

        db.close();
        assertFalse(db.isRemoteOpen());
        assertTrue(db.isCacheOpen());
        assertEquals(1, db.bufferedRowCount("SAMPLE"));
        assertEquals(2, db.query("SELECT * FROM SAMPLE", null).size());
    }

    @Test
    void incompleteCredentialsDoNotConnect() throws SQLException {
        db = new DefaultCachingDb(cacheFile,
                new RemoteCredentials("localhost", null, "pw", remoteFile), connector);
        assertEquals(0, connector.getOpenCount());
        assertThrows(IllegalArgumentException.class,
                () -> db.connect(new RemoteCredentials(null, null, null, null)));
    }

    @Test
    void namedQueriesAccumulateResults() throws SQLException {
        db = new DefaultCachingDb(cacheFile, null, connector);
        db.query("SELECT ID, NAME FROM SAMPLE WHERE ID = 1", null, "SAMPLE", SAMPLE_SCHEMA);
        db.query("SELECT ID, NAME FROM SAMPLE", null, "SAMPLE", null);
        db.query("SELECT ID, NAME FROM SAMPLE", null);

        List<Row> buffered = db.bufferedRows("SAMPLE");
        assertEquals(3, buffered.size());
        assertEquals(1L, buffered.get(0).getLong(0));
        assertEquals(SAMPLE_SCHEMA, db.bufferedSchema("SAMPLE"));
    }

    @Test
    void templateWhitespaceIsCollapsed() throws SQLException {
        db = new DefaultCachingDb(cacheFile, null, connector);
        List<Row> rows = db.query("  SELECT NAME\n\t  FROM SAMPLE\n   WHERE ID >= {ps}\n ORDER BY ID  ",
                Collections.singletonList(2));
        assertEquals(1, rows.size());
        assertEquals("SELECT NAME FROM SAMPLE WHERE ID >= {ps} ORDER BY ID",
                DefaultCachingDb.collapseWhitespace("  SELECT NAME\n\t  FROM SAMPLE\n   WHERE ID >= {ps}\n ORDER BY ID  "));
    }

    @Test
    void backendErrorsPropagateUnwrapped() throws SQLException {
        db = new DefaultCachingDb(cacheFile, null, connector);
        assertThrows(SQLException.class, () -> db.query("SELEC NAME FROM SAMPLE", null, "SAMPLE", null));
        assertEquals(0, db.bufferedRowCount("SAMPLE"));
        assertNull(db.getLastHit());
    }

    @Test
    void dropCacheClearsSelectedTables() {
        db = new DefaultCachingDb(connector);
        db.appendRows("A", null, Collections.singletonList(Row.of(1)));
        db.appendRows("B", null, Collections.singletonList(Row.of(2)));

        db.dropCache(Collections.singletonList("A"));
        assertEquals(0, db.bufferedRowCount("A"));
        assertEquals(1, db.bufferedRowCount("B"));

        db.dropCache();
        assertEquals(0, db.bufferedRowCount("B"));
    }
}
