package com.mini.csvtools.reader;

import com.mini.csvtools.schema.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 数据块
 * 有界的内存行批次，是排序、溢写和并行分发的基本单位。行顺序与源文件一致。
 */
public class Chunk {
    /** 块序号（从 0 开始） */
    private final int index;

    /** 第一行在源文件中的数据行下标（从 0 开始，不含表头） */
    private final long firstRowIndex;

    private final List<Row> rows;

    private final long estimatedBytes;

    public Chunk(int index, long firstRowIndex, List<Row> rows, long estimatedBytes) {
        this.index = index;
        this.firstRowIndex = firstRowIndex;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.estimatedBytes = estimatedBytes;
    }

    public Chunk(int index, long firstRowIndex, List<Row> rows) {
        this(index, firstRowIndex, rows, estimate(rows));
    }

    private static long estimate(List<Row> rows) {
        long bytes = 0;
        for (Row row : rows) {
            bytes += row.estimateSize();
        }
        return bytes;
    }

    public int getIndex() {
        return index;
    }

    public long getFirstRowIndex() {
        return firstRowIndex;
    }

    /**
     * 块内第 i 行在源文件中的数据行下标
     */
    public long rowIndexOf(int i) {
        return firstRowIndex + i;
    }

    public List<Row> getRows() {
        return rows;
    }

    public Row get(int i) {
        return rows.get(i);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public long getEstimatedBytes() {
        return estimatedBytes;
    }

    @Override
    public String toString() {
        return "Chunk{index=" + index + ", firstRowIndex=" + firstRowIndex
                + ", rows=" + rows.size() + ", estimatedBytes=" + estimatedBytes + '}';
    }
}
