package com.mini.csvtools.reader;

import java.util.ArrayList;
import java.util.List;

/**
 * List Record Reader
 * 从内存列表中读取记录的简单实现
 */
public class ListRecordReader<T> implements RecordReader<T> {

    private final List<T> records;
    private int currentIndex = 0;

    public ListRecordReader(List<T> records) {
        this.records = records != null ? records : new ArrayList<>();
    }

    @Override
    public T readRecord() {
        if (currentIndex < records.size()) {
            return records.get(currentIndex++);
        }
        return null;
    }

    @Override
    public void close() {
        // Nothing to close
    }
}
