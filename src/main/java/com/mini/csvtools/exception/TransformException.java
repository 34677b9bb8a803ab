package com.mini.csvtools.exception;

/**
 * 转换异常
 * 用户的转换函数在某个 chunk（或其中某一行）上失败
 */
public class TransformException extends CsvToolsException {
    private static final long serialVersionUID = 1L;

    private final long chunkIndex;

    /** 出错行在源文件中的数据行下标，整块失败时为 -1 */
    private final long rowIndex;

    public TransformException(long chunkIndex, long rowIndex, Throwable cause) {
        super(describe(chunkIndex, rowIndex, cause), cause);
        this.chunkIndex = chunkIndex;
        this.rowIndex = rowIndex;
    }

    private static String describe(long chunkIndex, long rowIndex, Throwable cause) {
        String location = rowIndex >= 0
                ? "chunk " + chunkIndex + ", row " + rowIndex
                : "chunk " + chunkIndex;
        return "Transform failed at " + location + ": " + cause;
    }

    public long getChunkIndex() {
        return chunkIndex;
    }

    public long getRowIndex() {
        return rowIndex;
    }
}
