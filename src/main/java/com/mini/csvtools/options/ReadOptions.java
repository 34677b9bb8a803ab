package com.mini.csvtools.options;

import com.mini.csvtools.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 读取范围选项：列选择、跳过行/块、行数上限
 */
public class ReadOptions {
    private static final ReadOptions ALL = new ReadOptions(null, 0, 0, -1);

    /** 需要读取的列，null 表示全部列 */
    private final List<String> columns;

    private final long skipRows;

    /** 跳过的 chunk 数，按行预算换算为行数，优先于 skipRows */
    private final int skipChunks;

    /** 最多读取的行数，-1 表示不限制 */
    private final long limitRows;

    private ReadOptions(List<String> columns, long skipRows, int skipChunks, long limitRows) {
        this.columns = columns == null ? null : Collections.unmodifiableList(new ArrayList<>(columns));
        this.skipRows = skipRows;
        this.skipChunks = skipChunks;
        this.limitRows = limitRows;
    }

    public static ReadOptions all() {
        return ALL;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean selectsColumns() {
        return columns != null;
    }

    public long getSkipRows() {
        return skipRows;
    }

    public int getSkipChunks() {
        return skipChunks;
    }

    public long getLimitRows() {
        return limitRows;
    }

    /**
     * 结合行预算计算实际需要跳过的行数
     */
    public long resolveSkipRows(ChunkBudget budget) {
        if (skipChunks == 0) {
            return skipRows;
        }
        if (budget.getMaxRows() == 0) {
            throw new ConfigurationException("Skipping chunks requires a row-bounded chunk budget");
        }
        return (long) skipChunks * budget.getMaxRows();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> columns;
        private long skipRows = 0;
        private int skipChunks = 0;
        private long limitRows = -1;

        public Builder columns(List<String> columns) {
            this.columns = columns;
            return this;
        }

        public Builder columns(String... columns) {
            List<String> list = new ArrayList<>();
            Collections.addAll(list, columns);
            this.columns = list;
            return this;
        }

        public Builder skipRows(long skipRows) {
            this.skipRows = skipRows;
            return this;
        }

        public Builder skipChunks(int skipChunks) {
            this.skipChunks = skipChunks;
            return this;
        }

        public Builder limitRows(long limitRows) {
            this.limitRows = limitRows;
            return this;
        }

        public ReadOptions build() {
            if (columns != null && columns.isEmpty()) {
                throw new ConfigurationException("Column selection cannot be empty");
            }
            if (skipRows < 0 || skipChunks < 0) {
                throw new ConfigurationException("Rows or chunks to skip cannot be negative");
            }
            if (limitRows < -1) {
                throw new ConfigurationException("Row limit must be -1 (unlimited) or non-negative: " + limitRows);
            }
            return new ReadOptions(columns, skipRows, skipChunks, limitRows);
        }
    }
}
