package com.mini.csvtools.writer;

import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内存写入器
 * 把行收集到列表中，适合结果集较小的调用方直接消费
 */
public class ListRowWriter implements RowWriter {

    private Schema schema;
    private final List<Row> rows = new ArrayList<>();
    private int flushCount = 0;
    private boolean closed = false;

    @Override
    public void writeHeader(Schema schema) {
        if (this.schema != null) {
            throw new IllegalStateException("Header already written");
        }
        this.schema = schema;
    }

    @Override
    public void writeRow(Row row) {
        if (schema == null) {
            throw new IllegalStateException("Header must be written before rows");
        }
        if (closed) {
            throw new IllegalStateException("Writer is closed");
        }
        rows.add(row);
    }

    @Override
    public void flush() {
        flushCount++;
    }

    @Override
    public void close() {
        closed = true;
    }

    public Schema getSchema() {
        return schema;
    }

    public List<Row> getRows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * 按列名取出所有行的值
     */
    public List<Object> column(String name) {
        int index = schema.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.getValue(index));
        }
        return values;
    }

    public int getFlushCount() {
        return flushCount;
    }

    public boolean isClosed() {
        return closed;
    }
}
