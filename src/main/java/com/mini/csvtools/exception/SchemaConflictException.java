package com.mini.csvtools.exception;

/**
 * Schema 冲突异常
 * 严格模式下，同名列在不同文件中的类型不兼容时抛出
 */
public class SchemaConflictException extends CsvToolsException {
    private static final long serialVersionUID = 1L;

    private final String column;

    public SchemaConflictException(String column, String message) {
        super(message);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
