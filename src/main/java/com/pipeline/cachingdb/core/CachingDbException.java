package com.pipeline.cachingdb.core;

/**
 * 缓存层自身的错误，携带错误类别。
 * 后端查询产生的 {@link java.sql.SQLException} 不经包装，原样抛给调用方。
 */
public class CachingDbException extends RuntimeException {

    private final ErrorKind kind;

    public CachingDbException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CachingDbException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
