package com.mini.csvtools.sort;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import com.mini.csvtools.utils.AlphanumericComparator;

import java.util.Comparator;
import java.util.List;

/**
 * 按排序列比较两行
 *
 * 比较规则：
 * 1. null 总是排在最后（与升降序无关）
 * 2. 数值之间按数值比较
 * 3. 文本之间按自然顺序比较（数字片段按数值）
 * 4. 数值排在文本之前
 */
public class RowComparator implements Comparator<Row> {

    private final int[] indices;
    private final boolean[] ascending;

    private RowComparator(int[] indices, boolean[] ascending) {
        this.indices = indices;
        this.ascending = ascending;
    }

    /**
     * 根据排序键和 Schema 创建比较器
     *
     * @throws ConfigurationException 排序列不在 Schema 中，或排序键是随机模式
     */
    public static RowComparator of(SortKey sortKey, Schema schema) {
        if (sortKey.isRandom()) {
            throw new ConfigurationException("Random sort key has no column comparator");
        }
        List<SortKey.Column> columns = sortKey.getColumns();
        int[] indices = new int[columns.size()];
        boolean[] ascending = new boolean[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            SortKey.Column column = columns.get(i);
            indices[i] = schema.indexOf(column.getName());
            if (indices[i] < 0) {
                throw new ConfigurationException(
                        "Sort column '" + column.getName() + "' not found in " + schema.getColumns());
            }
            ascending[i] = column.isAscending();
        }
        return new RowComparator(indices, ascending);
    }

    @Override
    public int compare(Row a, Row b) {
        for (int i = 0; i < indices.length; i++) {
            Object va = a.getValue(indices[i]);
            Object vb = b.getValue(indices[i]);
            if (va == null && vb == null) {
                continue;
            }
            if (va == null) {
                return 1;
            }
            if (vb == null) {
                return -1;
            }
            int result = compareValues(va, vb);
            if (result != 0) {
                return ascending[i] ? result : -result;
            }
        }
        return 0;
    }

    /**
     * 比较两个非 null 的值
     */
    public static int compareValues(Object a, Object b) {
        boolean numberA = a instanceof Number;
        boolean numberB = b instanceof Number;
        if (numberA && numberB) {
            if (a instanceof Long && b instanceof Long) {
                return Long.compare((Long) a, (Long) b);
            }
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (numberA) {
            return -1;
        }
        if (numberB) {
            return 1;
        }
        return AlphanumericComparator.INSTANCE.compare(a.toString(), b.toString());
    }
}
