package com.mini.csvtools.transform;

/**
 * 一次转换失败记录
 */
public final class RowFailure {
    private final int chunkIndex;

    /** 源文件中的数据行下标，整块失败时为 -1 */
    private final long rowIndex;

    private final Throwable cause;

    public RowFailure(int chunkIndex, long rowIndex, Throwable cause) {
        this.chunkIndex = chunkIndex;
        this.rowIndex = rowIndex;
        this.cause = cause;
    }

    public static RowFailure wholeChunk(int chunkIndex, Throwable cause) {
        return new RowFailure(chunkIndex, -1, cause);
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public long getRowIndex() {
        return rowIndex;
    }

    public boolean isWholeChunk() {
        return rowIndex < 0;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "RowFailure{chunk=" + chunkIndex + ", row=" + rowIndex + ", cause=" + cause + '}';
    }
}
