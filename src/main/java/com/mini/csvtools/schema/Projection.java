package com.mini.csvtools.schema;

import java.util.Arrays;

/**
 * Projection
 * 把一个 Schema 下的行映射到另一个 Schema：
 * 目标列在源中不存在时填 null，源中多出的列被丢弃
 */
public class Projection {
    private final Schema source;
    private final Schema target;

    /** 目标列在源 Schema 中的下标，-1 表示缺失 */
    private final int[] sourceIndices;

    private final boolean identity;

    private Projection(Schema source, Schema target) {
        this.source = source;
        this.target = target;
        this.sourceIndices = new int[target.size()];
        for (int i = 0; i < target.size(); i++) {
            sourceIndices[i] = source.indexOf(target.getColumn(i));
        }
        this.identity = source.equals(target);
    }

    /**
     * 创建从 source 到 target 的投影
     */
    public static Projection between(Schema source, Schema target) {
        return new Projection(source, target);
    }

    public Schema getSource() {
        return source;
    }

    public Schema getTarget() {
        return target;
    }

    public boolean isIdentity() {
        return identity;
    }

    /**
     * 对行进行投影
     */
    public Row project(Row row) {
        if (identity) {
            return row;
        }
        Object[] projected = new Object[sourceIndices.length];
        String[] texts = new String[sourceIndices.length];
        for (int i = 0; i < sourceIndices.length; i++) {
            int index = sourceIndices[i];
            projected[i] = index < 0 ? null : row.getValue(index);
            texts[i] = index < 0 ? null : row.getSourceText(index);
        }
        return new Row(projected, texts);
    }

    @Override
    public String toString() {
        return "Projection{" + source.getColumns() + " -> " + target.getColumns()
                + ", indices=" + Arrays.toString(sourceIndices) + '}';
    }
}
