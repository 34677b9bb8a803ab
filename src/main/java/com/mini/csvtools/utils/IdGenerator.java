package com.mini.csvtools.utils;

import java.util.UUID;

/**
 * ID Generator
 * 生成运行 ID，用于区分并发任务的临时目录
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    /**
     * 生成运行 ID（UUID 去掉连字符后的前 12 位）
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
