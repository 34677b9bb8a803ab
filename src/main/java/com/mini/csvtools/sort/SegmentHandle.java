package com.mini.csvtools.sort;

import java.nio.file.Path;

/**
 * 段文件句柄
 * 由 SpillStore 创建并独占，release 之后不能再 reopen
 */
public final class SegmentHandle {
    private final long id;
    private final Path path;
    private final long rowCount;
    private volatile boolean released;

    SegmentHandle(long id, Path path, long rowCount) {
        this.id = id;
        this.path = path;
        this.rowCount = rowCount;
    }

    public long getId() {
        return id;
    }

    public Path getPath() {
        return path;
    }

    public long getRowCount() {
        return rowCount;
    }

    public boolean isReleased() {
        return released;
    }

    void markReleased() {
        this.released = true;
    }

    @Override
    public String toString() {
        return "SegmentHandle{id=" + id + ", rows=" + rowCount + ", path=" + path + '}';
    }
}
