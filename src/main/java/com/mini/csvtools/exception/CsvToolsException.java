package com.mini.csvtools.exception;

/**
 * CsvTools 基础异常类
 * 所有处理过程中的错误都从这里派生
 */
public class CsvToolsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public CsvToolsException(String message) {
        super(message);
    }

    public CsvToolsException(String message, Throwable cause) {
        super(message, cause);
    }

    public CsvToolsException(Throwable cause) {
        super(cause);
    }
}
