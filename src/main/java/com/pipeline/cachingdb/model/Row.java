package com.pipeline.cachingdb.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一行查询结果：定长、有序、不可变的标量值序列（数值、字符串或null），
 * 与所属表声明的列一一对应。
 */
public final class Row implements Serializable {
    private final List<Object> values;

    private Row(Object[] values) {
        this.values = Collections.unmodifiableList(Arrays.asList(values));
    }

    public static Row of(Object... values) {
        Objects.requireNonNull(values, "values");
        return new Row(values.clone());
    }

    public static Row of(List<?> values) {
        Objects.requireNonNull(values, "values");
        return new Row(values.toArray());
    }

    public int size() { return values.size(); }
    public Object get(int index) { return values.get(index); }
    public List<Object> getValues() { return values; }

    /**
     * 按long读取数值列；SQLite驱动会按数值大小返回Integer或Long，这里统一转换
     */
    public Long getLong(int index) {
        Object value = values.get(index);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    public String getString(int index) {
        Object value = values.get(index);
        return value == null ? null : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
