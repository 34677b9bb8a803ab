package com.mini.csvtools.transform;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * 并行转换报告
 */
public class TransformReport {
    private final RunState state;
    private final int chunks;
    private final long rowsRead;
    private final long rowsWritten;
    private final List<RowFailure> failures;
    private final long durationMillis;

    public TransformReport(RunState state, int chunks, long rowsRead, long rowsWritten,
                           List<RowFailure> failures, long durationMillis) {
        this.state = state;
        this.chunks = chunks;
        this.rowsRead = rowsRead;
        this.rowsWritten = rowsWritten;
        this.failures = ImmutableList.copyOf(failures);
        this.durationMillis = durationMillis;
    }

    public RunState getState() {
        return state;
    }

    public int getChunks() {
        return chunks;
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    /**
     * 非 fail-fast 模式下收集的失败，按处理顺序
     */
    public List<RowFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return "TransformReport{" +
                "state=" + state +
                ", chunks=" + chunks +
                ", rowsRead=" + rowsRead +
                ", rowsWritten=" + rowsWritten +
                ", failures=" + failures.size() +
                ", durationMillis=" + durationMillis +
                '}';
    }
}
