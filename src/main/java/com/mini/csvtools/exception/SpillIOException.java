package com.mini.csvtools.exception;

import java.io.IOException;

/**
 * 溢写段文件读写失败
 * 对当前排序任务是致命错误
 */
public class SpillIOException extends CsvToolsException {
    private static final long serialVersionUID = 1L;

    public SpillIOException(String message) {
        super(message);
    }

    public SpillIOException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
