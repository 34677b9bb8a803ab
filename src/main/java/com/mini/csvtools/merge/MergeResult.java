package com.mini.csvtools.merge;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.mini.csvtools.schema.DataType;
import com.mini.csvtools.schema.Schema;

import java.util.List;
import java.util.Map;

/**
 * 一次合并的结果
 */
public class MergeResult {
    private final Schema schema;
    private final Map<String, DataType> columnTypes;
    private final List<Long> rowsPerInput;
    private final long rowsWritten;
    private final long durationMillis;

    public MergeResult(Schema schema, Map<String, DataType> columnTypes, List<Long> rowsPerInput,
                       long rowsWritten, long durationMillis) {
        this.schema = schema;
        this.columnTypes = ImmutableMap.copyOf(columnTypes);
        this.rowsPerInput = ImmutableList.copyOf(rowsPerInput);
        this.rowsWritten = rowsWritten;
        this.durationMillis = durationMillis;
    }

    /**
     * 统一后的 Schema
     */
    public Schema getSchema() {
        return schema;
    }

    /**
     * 统一后的列类型，未开启类型推断时为空
     */
    public Map<String, DataType> getColumnTypes() {
        return columnTypes;
    }

    public List<Long> getRowsPerInput() {
        return rowsPerInput;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return "MergeResult{" +
                "schema=" + schema +
                ", rowsPerInput=" + rowsPerInput +
                ", rowsWritten=" + rowsWritten +
                ", durationMillis=" + durationMillis +
                '}';
    }
}
