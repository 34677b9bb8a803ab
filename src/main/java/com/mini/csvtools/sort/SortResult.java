package com.mini.csvtools.sort;

/**
 * 一次外部排序的结果统计
 */
public class SortResult {
    private final long rowsWritten;
    private final int segmentsCreated;
    private final int mergePasses;
    private final long durationMillis;

    public SortResult(long rowsWritten, int segmentsCreated, int mergePasses, long durationMillis) {
        this.rowsWritten = rowsWritten;
        this.segmentsCreated = segmentsCreated;
        this.mergePasses = mergePasses;
        this.durationMillis = durationMillis;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    /**
     * 写出的段总数（含中间归并段），未溢写时为 0
     */
    public int getSegmentsCreated() {
        return segmentsCreated;
    }

    /**
     * 归并趟数，包括最终归并；纯内存排序时为 0
     */
    public int getMergePasses() {
        return mergePasses;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return "SortResult{" +
                "rowsWritten=" + rowsWritten +
                ", segmentsCreated=" + segmentsCreated +
                ", mergePasses=" + mergePasses +
                ", durationMillis=" + durationMillis +
                '}';
    }
}
