package com.pipeline.cachingdb.model;

/**
 * 时间窗口解析出的TS_ID闭区间 [min, max]
 */
public final class TsIdRange {
    private final long min;
    private final long max;

    public TsIdRange(long min, long max) {
        if (min > max) {
            throw new IllegalArgumentException("min TS_ID " + min + " exceeds max TS_ID " + max);
        }
        this.min = min;
        this.max = max;
    }

    public long getMin() { return min; }
    public long getMax() { return max; }

    @Override
    public String toString() {
        return "TsIdRange[" + min + ", " + max + "]";
    }
}
