package com.mini.csvtools.schema;

/**
 * 字段值类型
 * 只用于合并时的列类型冲突检测
 */
public enum DataType {
    LONG,
    DOUBLE,
    STRING;

    /**
     * 获取值的类型，null 没有类型
     */
    public static DataType of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer) {
            return LONG;
        }
        if (value instanceof Number) {
            return DOUBLE;
        }
        return STRING;
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    /**
     * 与另一类型合并
     *
     * @return 兼容时返回合并后的类型（LONG 与 DOUBLE 提升为 DOUBLE），不兼容时返回 null
     */
    public DataType widen(DataType other) {
        if (other == null || other == this) {
            return this;
        }
        if (isNumeric() && other.isNumeric()) {
            return DOUBLE;
        }
        return null;
    }

    /**
     * 判断值是否与该类型的列冲突（数值与文本互不兼容）
     */
    public boolean conflictsWith(Object value) {
        DataType type = of(value);
        return type != null && widen(type) == null;
    }
}
