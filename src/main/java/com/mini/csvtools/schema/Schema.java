package com.mini.csvtools.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema 类
 * 表示一个分隔文本文件的表头：有序、唯一的列名列表
 */
public class Schema {
    /** 列名列表 */
    private final List<String> columns;

    /** 列名到下标的索引 */
    private final Map<String, Integer> positions;

    public Schema(List<String> columns) {
        this.columns = new ArrayList<>(Objects.requireNonNull(columns, "Columns cannot be null"));
        this.positions = new HashMap<>();
        validate();
    }

    public static Schema of(String... columns) {
        List<String> list = new ArrayList<>();
        Collections.addAll(list, columns);
        return new Schema(list);
    }

    /**
     * 验证 Schema 的有效性
     */
    private void validate() {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Schema must have at least one column");
        }
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i);
            if (name == null) {
                throw new IllegalArgumentException("Column name cannot be null (position " + i + ")");
            }
            if (positions.put(name, i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + name);
            }
        }
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public String getColumn(int index) {
        return columns.get(index);
    }

    public int size() {
        return columns.size();
    }

    /**
     * 获取列下标，不存在时返回 -1
     */
    public int indexOf(String name) {
        Integer index = positions.get(name);
        return index == null ? -1 : index;
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    /**
     * 按列名列表选出子 Schema，顺序与参数一致
     */
    public Schema select(List<String> names) {
        for (String name : names) {
            if (!contains(name)) {
                throw new IllegalArgumentException("Column not found: " + name);
            }
        }
        return new Schema(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema schema = (Schema) o;
        return columns.equals(schema.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "Schema{" + "columns=" + columns + '}';
    }
}
