package com.mini.csvtools.options;

import com.mini.csvtools.exception.ConfigurationException;

/**
 * Chunk 内存预算
 * 以最大行数和/或最大估算字节数限制单个 chunk 的大小，0 表示该维度不限制
 */
public class ChunkBudget {
    public static final int DEFAULT_MAX_ROWS = 10000;

    private final int maxRows;
    private final long maxBytes;

    private ChunkBudget(int maxRows, long maxBytes) {
        if (maxRows < 0 || maxBytes < 0) {
            throw new ConfigurationException(
                    "Chunk budget cannot be negative: maxRows=" + maxRows + ", maxBytes=" + maxBytes);
        }
        if (maxRows == 0 && maxBytes == 0) {
            throw new ConfigurationException("Chunk budget needs a row or byte bound");
        }
        this.maxRows = maxRows;
        this.maxBytes = maxBytes;
    }

    public static ChunkBudget rows(int maxRows) {
        return new ChunkBudget(maxRows, 0);
    }

    public static ChunkBudget bytes(long maxBytes) {
        return new ChunkBudget(0, maxBytes);
    }

    public static ChunkBudget of(int maxRows, long maxBytes) {
        return new ChunkBudget(maxRows, maxBytes);
    }

    public static ChunkBudget defaults() {
        return rows(DEFAULT_MAX_ROWS);
    }

    public int getMaxRows() {
        return maxRows;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    /**
     * 判断 chunk 是否已满。chunk 至少容纳一行，避免单行超过字节预算时死循环
     */
    public boolean isFull(int rowCount, long estimatedBytes) {
        if (rowCount == 0) {
            return false;
        }
        if (maxRows > 0 && rowCount >= maxRows) {
            return true;
        }
        return maxBytes > 0 && estimatedBytes >= maxBytes;
    }

    @Override
    public String toString() {
        return "ChunkBudget{maxRows=" + maxRows + ", maxBytes=" + maxBytes + '}';
    }
}
