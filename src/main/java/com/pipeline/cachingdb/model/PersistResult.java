package com.pipeline.cachingdb.model;

import com.pipeline.cachingdb.core.ErrorKind;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次持久化的汇总结果。
 *
 * 单表失败互相隔离：失败的表记录在failures中（其内存数据保留，可重试），
 * 可恢复的问题同时记为warning，建表失败记为error。
 * 只要有一张表失败，success即为false。
 */
public class PersistResult implements Serializable {
    private final String destination;
    private final Map<String, Integer> persistedTables = new LinkedHashMap<>();
    private final Map<String, ErrorKind> failures = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public PersistResult(String destination) {
        this.destination = destination;
    }

    public void addPersisted(String table, int rowCount) {
        persistedTables.put(table, rowCount);
    }

    public void addFailure(String table, ErrorKind kind, String message) {
        failures.put(table, kind);
        if (kind.isRecoverable()) {
            warnings.add(message);
        } else {
            errors.add(message);
        }
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean isSuccess() {
        return failures.isEmpty() && errors.isEmpty();
    }

    public String getDestination() { return destination; }
    public Map<String, Integer> getPersistedTables() { return Collections.unmodifiableMap(persistedTables); }
    public Map<String, ErrorKind> getFailures() { return Collections.unmodifiableMap(failures); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    @Override
    public String toString() {
        return "PersistResult{destination='" + destination + "', persisted=" + persistedTables
                + ", failures=" + failures + "}";
    }
}
