package com.mini.csvtools.merge;

import com.mini.csvtools.exception.ConfigurationException;

/**
 * 合并方式
 */
public enum MergeMode {
    /** 依次输出每个输入的全部行 */
    CONCATENATE,

    /** 按键交错：输入必须已按键排序，输出整体按键有序 */
    INTERLEAVE_BY_KEY;

    /**
     * 解析配置值，大小写和连字符不敏感（concatenate / interleave-by-key）
     */
    public static MergeMode parse(String value) {
        if (value == null) {
            throw new ConfigurationException("Merge mode cannot be null");
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (MergeMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new ConfigurationException("Unknown merge mode: " + value);
    }
}
