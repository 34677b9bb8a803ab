package com.mini.csvtools.sort;

import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;

import java.util.Comparator;

/**
 * 溢写记录：数据行加上随机模式下分配的随机秩（非随机模式为 0）
 */
public final class SortRecord {
    private final long rank;
    private final Row row;

    public SortRecord(long rank, Row row) {
        this.rank = rank;
        this.row = row;
    }

    public long getRank() {
        return rank;
    }

    public Row getRow() {
        return row;
    }

    /**
     * 创建记录比较器：随机模式按随机秩，否则按排序列
     */
    public static Comparator<SortRecord> comparator(SortKey sortKey, Schema schema) {
        if (sortKey.isRandom()) {
            return Comparator.comparingLong(SortRecord::getRank);
        }
        RowComparator rowComparator = RowComparator.of(sortKey, schema);
        return (a, b) -> rowComparator.compare(a.row, b.row);
    }

    @Override
    public String toString() {
        return "SortRecord{rank=" + rank + ", row=" + row + '}';
    }
}
