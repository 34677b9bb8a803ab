package com.mini.csvtools.transform;

import com.google.common.collect.ImmutableList;
import com.mini.csvtools.schema.Row;

import java.util.Collections;
import java.util.List;

/**
 * 一个 chunk 的转换输出：成功的行和逐行失败
 */
public final class ChunkOutput {
    private final List<Row> rows;
    private final List<RowFailure> failures;

    public ChunkOutput(List<Row> rows, List<RowFailure> failures) {
        this.rows = Collections.unmodifiableList(rows);
        this.failures = ImmutableList.copyOf(failures);
    }

    public static ChunkOutput of(List<Row> rows) {
        return new ChunkOutput(rows, Collections.emptyList());
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<RowFailure> getFailures() {
        return failures;
    }
}
