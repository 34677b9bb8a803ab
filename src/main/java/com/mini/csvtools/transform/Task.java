package com.mini.csvtools.transform;

import com.mini.csvtools.reader.Chunk;

/**
 * 分发给工作线程的任务：一个 chunk 加上转换函数
 */
public final class Task {

    /** 停止工作线程的毒丸 */
    static final Task POISON = new Task(null, null);

    private final Chunk chunk;
    private final ChunkTransform transform;

    public Task(Chunk chunk, ChunkTransform transform) {
        this.chunk = chunk;
        this.transform = transform;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public ChunkTransform getTransform() {
        return transform;
    }

    /**
     * 在当前线程执行任务，异常被封装进结果而不是抛出；Error 直接向上传播，结束工作线程
     */
    TaskResult run() {
        try {
            ChunkOutput output = transform.transform(chunk);
            return TaskResult.success(chunk, output);
        } catch (Exception e) {
            return TaskResult.failure(chunk, e);
        }
    }
}
