package com.mini.csvtools.schema;

import java.util.Arrays;

/**
 * 数据行
 * 按位置与 Schema 对齐的字段值数组，值为 String、Long、Double 或 null
 *
 * 类型推断得到的数值同时保留源文本（如 "1.50"、"1e3"），写出时原样输出。
 * 相等性只比较值，不比较源文本。
 */
public class Row {
    /** 每个字段的固定估算开销（字节） */
    private static final int FIELD_OVERHEAD = 16;

    /** 字段值数组 */
    private final Object[] values;

    /** 数值字段的源文本，没有任何推断字段时为 null */
    private final String[] sourceTexts;

    public Row(Object[] values) {
        this(values, null);
    }

    /**
     * @param values 字段值
     * @param sourceTexts 与 values 等长的源文本数组，非数值位置为 null；整体可为 null
     */
    public Row(Object[] values, String[] sourceTexts) {
        this.values = values != null ? values.clone() : new Object[0];
        if (sourceTexts != null && sourceTexts.length != this.values.length) {
            throw new IllegalArgumentException("Source texts length " + sourceTexts.length
                    + " does not match field count " + this.values.length);
        }
        this.sourceTexts = hasAny(sourceTexts) ? sourceTexts.clone() : null;
    }

    private static boolean hasAny(String[] texts) {
        if (texts == null) {
            return false;
        }
        for (String text : texts) {
            if (text != null) {
                return true;
            }
        }
        return false;
    }

    public static Row of(Object... values) {
        return new Row(values);
    }

    /**
     * 获取字段值数组
     *
     * @return 字段值数组的副本
     */
    public Object[] getValues() {
        return values.clone();
    }

    /**
     * 获取指定下标的字段值，越界返回 null
     */
    public Object getValue(int index) {
        if (index < 0 || index >= values.length) {
            return null;
        }
        return values[index];
    }

    /**
     * 获取数值字段的源文本
     *
     * @return 源文本；该字段不是推断出的数值（或值已被替换）时返回 null
     */
    public String getSourceText(int index) {
        if (sourceTexts == null || index < 0 || index >= sourceTexts.length) {
            return null;
        }
        return sourceTexts[index];
    }

    /**
     * @return 源文本数组的副本，没有源文本时返回 null
     */
    public String[] getSourceTexts() {
        return sourceTexts != null ? sourceTexts.clone() : null;
    }

    /**
     * 按列名取值
     *
     * @param schema 该行所属的 Schema
     * @param column 列名
     * @return 字段值；列不存在时返回 null
     */
    public Object get(Schema schema, String column) {
        return getValue(schema.indexOf(column));
    }

    public int getFieldCount() {
        return values.length;
    }

    /**
     * 估算该行在内存中的字节数，用于 chunk 的字节预算
     */
    public long estimateSize() {
        long size = FIELD_OVERHEAD;
        for (Object value : values) {
            size += FIELD_OVERHEAD;
            if (value instanceof String) {
                size += 2L * ((String) value).length();
            } else if (value != null) {
                size += 8;
            }
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Row row = (Row) o;
        return Arrays.equals(values, row.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Row{" + "values=" + Arrays.toString(values) + '}';
    }
}
