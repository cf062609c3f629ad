package com.pipeline.cachingdb.storage;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 缓存文件命名
 */
public final class CacheFiles {

    public static final String NAME_TEMPLATE = "lmtdb-%d.sqlite";

    private CacheFiles() {}

    /**
     * @return 目录下第一个尚不存在的 lmtdb-N.sqlite
     */
    public static Path nextAvailable(Path directory) {
        int i = 0;
        Path candidate = directory.resolve(String.format(NAME_TEMPLATE, i));
        while (Files.exists(candidate)) {
            i++;
            candidate = directory.resolve(String.format(NAME_TEMPLATE, i));
        }
        return candidate;
    }
}
