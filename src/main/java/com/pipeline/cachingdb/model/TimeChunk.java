package com.pipeline.cachingdb.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 一个查询子区间 [start, end)
 */
public final class TimeChunk {
    private final LocalDateTime start;
    private final LocalDateTime end;

    public TimeChunk(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    public LocalDateTime getStart() { return start; }
    public LocalDateTime getEnd() { return end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeChunk)) return false;
        TimeChunk other = (TimeChunk) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
