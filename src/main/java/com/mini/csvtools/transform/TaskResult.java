package com.mini.csvtools.transform;

import com.mini.csvtools.reader.Chunk;
import com.mini.csvtools.schema.Row;

import java.util.Collections;
import java.util.List;

/**
 * 任务结果：转换后的行和逐行失败，或者整块失败
 */
public final class TaskResult {
    private final int chunkIndex;
    private final int rowsIn;
    private final List<Row> rows;
    private final List<RowFailure> rowFailures;
    private final Throwable failure;

    private TaskResult(int chunkIndex, int rowsIn, List<Row> rows, List<RowFailure> rowFailures,
                       Throwable failure) {
        this.chunkIndex = chunkIndex;
        this.rowsIn = rowsIn;
        this.rows = rows;
        this.rowFailures = rowFailures;
        this.failure = failure;
    }

    static TaskResult success(Chunk chunk, ChunkOutput output) {
        return new TaskResult(chunk.getIndex(), chunk.size(), output.getRows(), output.getFailures(), null);
    }

    static TaskResult failure(Chunk chunk, Throwable failure) {
        return new TaskResult(chunk.getIndex(), chunk.size(), Collections.emptyList(),
                Collections.emptyList(), failure);
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public int getRowsIn() {
        return rowsIn;
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<RowFailure> getRowFailures() {
        return rowFailures;
    }

    /**
     * 整块失败的原因，成功时为 null
     */
    public Throwable getFailure() {
        return failure;
    }

    public boolean isFailed() {
        return failure != null;
    }

    @Override
    public String toString() {
        return "TaskResult{chunk=" + chunkIndex + ", rowsIn=" + rowsIn + ", rowsOut=" + rows.size()
                + ", rowFailures=" + rowFailures.size() + ", failed=" + isFailed() + '}';
    }
}
