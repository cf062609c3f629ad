package com.pipeline.cachingdb.core;

/**
 * 错误类别。调用方据此区分可恢复的单表问题与致命的配置/调用错误。
 */
public enum ErrorKind {
    /** 缓存库与远程库都未打开时发出查询 */
    NO_BACKEND_AVAILABLE(false),
    /** 驱动占位符风格无法识别 */
    UNSUPPORTED_PARAM_STYLE(false),
    /** 时间区间为空或倒置，在任何I/O之前检查 */
    INVALID_TIME_RANGE(false),
    /** 同一表内的行宽不一致；持久化时跳过该表，继续其余表 */
    NON_UNIFORM_ROWS(true),
    /** 目标库建表失败，仅对该表致命 */
    SCHEMA_CREATION_FAILED(false),
    /** 表不在模式注册表中 */
    UNKNOWN_TABLE(false),
    /** 目标缓存文件无法打开或写入 */
    CACHE_WRITE_FAILED(true);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
