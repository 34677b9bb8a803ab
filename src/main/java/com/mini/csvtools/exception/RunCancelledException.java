package com.mini.csvtools.exception;

/**
 * 调用方请求取消任务
 */
public class RunCancelledException extends CsvToolsException {
    private static final long serialVersionUID = 1L;

    public RunCancelledException(String message) {
        super(message);
    }

    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
