package com.mini.csvtools.exception;

/**
 * 行格式异常
 * 严格模式下，某行的字段数与表头不一致时抛出
 */
public class MalformedRowException extends CsvToolsException {
    private static final long serialVersionUID = 1L;

    /** 文件中的行号（从 1 开始，表头为第 1 行），未知时为 -1 */
    private final long lineNumber;

    /** 数据行下标（从 0 开始，不含表头），未知时为 -1 */
    private final long rowIndex;

    public MalformedRowException(String message) {
        this(message, -1, -1);
    }

    public MalformedRowException(String message, long lineNumber, long rowIndex) {
        super(message);
        this.lineNumber = lineNumber;
        this.rowIndex = rowIndex;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public long getRowIndex() {
        return rowIndex;
    }
}
