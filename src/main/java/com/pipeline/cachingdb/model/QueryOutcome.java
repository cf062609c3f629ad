package com.pipeline.cachingdb.model;

/**
 * 最近一次查询由哪个后端满足，仅用于诊断，不持久化
 */
public enum QueryOutcome {
    /** 本地SQLite缓存库 */
    SATISFIED_BY_CACHE,
    /** 远程数据源 */
    SATISFIED_BY_REMOTE
}
