package com.mini.csvtools.transform;

import com.mini.csvtools.exception.RunCancelledException;
import com.mini.csvtools.exception.TransformException;
import com.mini.csvtools.options.TransformOptions;
import com.mini.csvtools.reader.Chunk;
import com.mini.csvtools.reader.ChunkedCsvReader;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import com.mini.csvtools.utils.CancellationSignal;
import com.mini.csvtools.writer.RowWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 并行块转换器
 *
 * 协调线程负责读取、分发和写出，转换在 WorkerPool 上执行：
 * 1. DISPATCHING：逐块读取并提交任务，在途 chunk 数不超过 workers + queueDepth
 * 2. DRAINING：输入读完后收集剩余结果
 * 3. DONE：所有结果写出且 writer 已 flush；任何失败、取消都进入 ABORTED
 *
 * 保序模式下乱序完成的结果先缓存，等前一块写出后再写。
 */
public class ParallelTransformer {
    private static final Logger logger = LoggerFactory.getLogger(ParallelTransformer.class);

    private static final long POLL_INTERVAL_MILLIS = 100;

    private final TransformOptions options;
    private volatile RunState state = RunState.IDLE;

    public ParallelTransformer(TransformOptions options) {
        this.options = options;
    }

    /**
     * 对输入文件执行转换并写入 writer
     *
     * @throws TransformException fail-fast 模式下的第一个失败
     * @throws RunCancelledException 运行被取消
     */
    public TransformReport transform(Path input, ChunkTransform transform, RowWriter writer) throws IOException {
        if (state != RunState.IDLE) {
            throw new IllegalStateException("ParallelTransformer can only run once, current state " + state);
        }
        long startTime = System.currentTimeMillis();
        CancellationSignal cancellation = options.getCancellation();
        logger.info("Starting parallel transform of {} with {}", input, options);

        WorkerPool pool = null;
        Run run = null;
        try (ChunkedCsvReader reader = ChunkedCsvReader.open(input, options.getCsvOptions(),
                options.getChunkBudget(), options.getReadOptions())) {
            cancellation.throwIfCancelled("transform start");
            Schema outputSchema = transform.outputSchema(reader.getSchema());
            writer.writeHeader(outputSchema);

            pool = WorkerPool.start(options.getWorkers(), options.getQueueDepth());
            run = new Run(pool, writer);
            state = RunState.DISPATCHING;

            Chunk chunk;
            while ((chunk = reader.readChunk()) != null) {
                cancellation.throwIfCancelled("dispatch of chunk " + chunk.getIndex());
                while (run.inFlight >= options.getMaxInFlight()) {
                    run.handle(run.await());
                }
                pool.submit(new Task(chunk, transform));
                run.inFlight++;
                run.chunks++;
                run.rowsRead += chunk.size();

                TaskResult done;
                while ((done = pool.pollResult()) != null) {
                    run.handle(done);
                }
            }

            state = RunState.DRAINING;
            logger.debug("Dispatched {} chunks, draining {} in flight", run.chunks, run.inFlight);
            while (run.inFlight > 0) {
                run.handle(run.await());
            }
            writer.flush();
            pool.shutdown();
            state = RunState.DONE;

            long duration = System.currentTimeMillis() - startTime;
            if (!run.failures.isEmpty()) {
                logger.warn("Parallel transform of {} finished with {} failures", input, run.failures.size());
            }
            logger.info("Parallel transform of {} completed: {} chunks, {} rows read, {} rows written in {}ms",
                    input, run.chunks, run.rowsRead, run.rowsWritten, duration);
            return new TransformReport(state, run.chunks, run.rowsRead, run.rowsWritten, run.failures, duration);
        } catch (InterruptedException e) {
            RunCancelledException cancelled = new RunCancelledException(
                    "Parallel transform of " + input + " interrupted", e);
            abort(pool, input, startTime, cancelled);
            Thread.currentThread().interrupt();
            throw cancelled;
        } catch (IOException | RuntimeException | Error e) {
            abort(pool, input, startTime, e);
            throw e;
        }
    }

    private void abort(WorkerPool pool, Path input, long startTime, Throwable cause) {
        state = RunState.ABORTED;
        if (pool != null) {
            pool.abort();
        }
        logger.error("Parallel transform of {} aborted after {}ms", input,
                System.currentTimeMillis() - startTime, cause);
    }

    public RunState getState() {
        return state;
    }

    /**
     * 一次运行的协调状态，只在协调线程上访问
     */
    private final class Run {
        private final WorkerPool pool;
        private final RowWriter writer;

        /** 保序模式下等待写出的结果 */
        private final Map<Integer, TaskResult> pending = new HashMap<>();
        private final List<RowFailure> failures = new ArrayList<>();

        private int nextToWrite = 0;
        private int inFlight = 0;
        private int chunks = 0;
        private long rowsRead = 0;
        private long rowsWritten = 0;

        Run(WorkerPool pool, RowWriter writer) {
            this.pool = pool;
            this.writer = writer;
        }

        /**
         * 等待下一个结果，期间定期检查取消信号和工作线程是否因 Error 退出
         */
        TaskResult await() throws InterruptedException {
            while (true) {
                options.getCancellation().throwIfCancelled("drain");
                Error fatal = pool.getFatalError();
                if (fatal != null) {
                    throw fatal;
                }
                TaskResult result = pool.pollResult(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                if (result != null) {
                    return result;
                }
            }
        }

        void handle(TaskResult result) throws IOException {
            inFlight--;
            if (options.isFailFast()) {
                if (result.isFailed()) {
                    throw new TransformException(result.getChunkIndex(), -1, result.getFailure());
                }
                if (!result.getRowFailures().isEmpty()) {
                    RowFailure first = result.getRowFailures().get(0);
                    throw new TransformException(first.getChunkIndex(), first.getRowIndex(), first.getCause());
                }
            }
            if (!options.isPreserveOrder()) {
                emit(result);
                return;
            }
            pending.put(result.getChunkIndex(), result);
            TaskResult next;
            while ((next = pending.remove(nextToWrite)) != null) {
                emit(next);
                nextToWrite++;
            }
        }

        private void emit(TaskResult result) throws IOException {
            if (result.isFailed()) {
                failures.add(RowFailure.wholeChunk(result.getChunkIndex(), result.getFailure()));
                logger.warn("Chunk {} failed, its {} rows are not written", result.getChunkIndex(),
                        result.getRowsIn(), result.getFailure());
                return;
            }
            for (RowFailure failure : result.getRowFailures()) {
                failures.add(failure);
                logger.warn("Row {} of chunk {} failed: {}", failure.getRowIndex(), failure.getChunkIndex(),
                        failure.getCause().toString());
            }
            for (Row row : result.getRows()) {
                writer.writeRow(row);
            }
            rowsWritten += result.getRows().size();
        }
    }
}
