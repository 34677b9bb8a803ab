package com.mini.csvtools.exception;

/**
 * 配置异常
 * 在任何 I/O 开始之前发现的非法配置（预算、线程数、排序列等）
 */
public class ConfigurationException extends CsvToolsException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
