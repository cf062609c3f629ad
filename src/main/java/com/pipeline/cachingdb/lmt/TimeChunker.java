package com.pipeline.cachingdb.lmt;

import com.pipeline.cachingdb.core.CachingDbException;
import com.pipeline.cachingdb.core.ErrorKind;
import com.pipeline.cachingdb.model.TimeChunk;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 把 [start, end) 切分为宽度不超过chunkWidth的连续子区间，最后一块截断到end
 */
public final class TimeChunker {

    private TimeChunker() {}

    /**
     * @throws CachingDbException INVALID_TIME_RANGE 区间为空或倒置
     * @throws IllegalArgumentException chunkWidth非正或不是整秒
     */
    public static List<TimeChunk> plan(LocalDateTime start, LocalDateTime end, Duration chunkWidth) {
        validate(start, end);
        if (chunkWidth == null || chunkWidth.isZero() || chunkWidth.isNegative()) {
            throw new IllegalArgumentException("Chunk width must be positive: " + chunkWidth);
        }
        if (chunkWidth.getNano() != 0) {
            throw new IllegalArgumentException("Chunk width must be whole seconds: " + chunkWidth);
        }

        List<TimeChunk> chunks = new ArrayList<>();
        LocalDateTime chunkStart = start;
        while (chunkStart.isBefore(end)) {
            LocalDateTime chunkEnd = chunkStart.plus(chunkWidth);
            if (chunkEnd.isAfter(end)) {
                chunkEnd = end;
            }
            chunks.add(new TimeChunk(chunkStart, chunkEnd));
            chunkStart = chunkEnd;
        }
        return chunks;
    }

    /** 不足整秒的部分向上取整到下一秒，null原样返回 */
    public static LocalDateTime ceilToSecond(LocalDateTime time) {
        if (time == null || time.getNano() == 0) {
            return time;
        }
        return time.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
    }

    public static void validate(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new CachingDbException(ErrorKind.INVALID_TIME_RANGE,
                    "Invalid time range [" + start + ", " + end + ")");
        }
    }
}
