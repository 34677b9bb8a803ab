package com.mini.csvtools.transform;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.exception.RunCancelledException;
import com.mini.csvtools.exception.TransformException;
import com.mini.csvtools.options.ChunkBudget;
import com.mini.csvtools.options.CsvOptions;
import com.mini.csvtools.options.ReadOptions;
import com.mini.csvtools.options.TransformOptions;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import com.mini.csvtools.utils.CancellationSignal;
import com.mini.csvtools.writer.CsvRowWriter;
import com.mini.csvtools.writer.ListRowWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 并行转换测试
 * 验证：
 * 1. 保序模式下多线程输出与单线程完全一致
 * 2. 非保序模式下输出是同一个多重集
 * 3. fail-fast 与收集失败两种模式
 * 4. 取消和中断后运行进入 ABORTED
 */
public class ParallelTransformerTest {

    private static final int ROWS = 1000;

    @TempDir
    Path tempDir;

    private Path input;
    private final CsvOptions typed = CsvOptions.builder().inferTypes(true).build();

    @BeforeEach
    void setUp() throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("id,value");
        for (int i = 0; i < ROWS; i++) {
            lines.add(i + "," + (i * 3));
        }
        input = tempDir.resolve("input.csv");
        Files.write(input, lines, StandardCharsets.UTF_8);
    }

    private TransformOptions.Builder options(int workers) {
        return TransformOptions.builder()
                .workers(workers)
                .queueDepth(2)
                .chunkBudget(ChunkBudget.rows(7))
                .csvOptions(typed);
    }

    private static Row doubled(Row row) {
        return Row.of(row.getValue(0), (Long) row.getValue(1) * 2);
    }

    /**
     * 每块随机休眠，打乱完成顺序
     */
    private static ChunkTransform jittered(RowTransform function) {
        ChunkTransform perRow = ChunkTransform.perRow(function);
        return chunk -> {
            Thread.sleep(ThreadLocalRandom.current().nextInt(3));
            return perRow.apply(chunk);
        };
    }

    @Test
    void testParallelOutputMatchesSingleThreaded() throws IOException {
        ListRowWriter single = new ListRowWriter();
        new ParallelTransformer(options(1).build())
                .transform(input, ChunkTransform.perRow(ParallelTransformerTest::doubled), single);
        ListRowWriter parallel = new ListRowWriter();
        ParallelTransformer transformer = new ParallelTransformer(options(4).build());

        TransformReport report = transformer.transform(input, jittered(ParallelTransformerTest::doubled), parallel);

        assertEquals(single.getRows(), parallel.getRows());
        assertEquals(Schema.of("id", "value"), parallel.getSchema());
        assertEquals(Row.of(999L, 5994L), parallel.getRows().get(ROWS - 1));
        assertEquals(RunState.DONE, report.getState());
        assertEquals(RunState.DONE, transformer.getState());
        assertEquals(143, report.getChunks());
        assertEquals(ROWS, report.getRowsRead());
        assertEquals(ROWS, report.getRowsWritten());
        assertFalse(report.hasFailures());
        assertEquals(1, parallel.getFlushCount());
    }

    @Test
    void testUnorderedOutputIsSameMultiset() throws IOException {
        ListRowWriter writer = new ListRowWriter();

        TransformReport report = new ParallelTransformer(options(4).preserveOrder(false).build())
                .transform(input, jittered(ParallelTransformerTest::doubled), writer);

        List<Object> ids = new ArrayList<>(writer.column("id"));
        ids.sort((a, b) -> Long.compare((Long) a, (Long) b));
        List<Object> expected = new ArrayList<>();
        for (long i = 0; i < ROWS; i++) {
            expected.add(i);
        }
        assertEquals(expected, ids);
        assertEquals(ROWS, report.getRowsWritten());
    }

    @Test
    void testOutputSchemaMapping() throws IOException {
        Path output = tempDir.resolve("out.csv");
        ChunkTransform withLabel = ChunkTransform.perRow(
                row -> Row.of(row.getValue(0), row.getValue(1), "n" + row.getValue(0)),
                schema -> Schema.of("id", "value", "label"));

        try (CsvRowWriter writer = new CsvRowWriter(output)) {
            new ParallelTransformer(options(3).build()).transform(input, withLabel, writer);
        }

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(ROWS + 1, lines.size());
        assertEquals("id,value,label", lines.get(0));
        assertEquals("0,0,n0", lines.get(1));
        assertEquals("999,2997,n999", lines.get(ROWS));
    }

    @Test
    void testNullResultFiltersRow() throws IOException {
        ListRowWriter writer = new ListRowWriter();

        TransformReport report = new ParallelTransformer(options(4).build()).transform(input,
                ChunkTransform.perRow(row -> (Long) row.getValue(0) % 2 == 0 ? row : null), writer);

        assertEquals(ROWS / 2, writer.getRows().size());
        assertEquals(ROWS, report.getRowsRead());
        assertEquals(ROWS / 2, report.getRowsWritten());
        assertEquals(Arrays.asList(0L, 2L, 4L), writer.column("id").subList(0, 3));
    }

    @Test
    void testFailFastReportsRowLocation() {
        ParallelTransformer transformer = new ParallelTransformer(options(4).build());
        ChunkTransform failing = ChunkTransform.perRow(row -> {
            if ((Long) row.getValue(0) == 500L) {
                throw new IllegalStateException("row 500");
            }
            return row;
        });

        TransformException e = assertThrows(TransformException.class,
                () -> transformer.transform(input, failing, new ListRowWriter()));

        assertEquals(500 / 7, e.getChunkIndex());
        assertEquals(500, e.getRowIndex());
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals(RunState.ABORTED, transformer.getState());
    }

    @Test
    void testFailFastWholeChunk() {
        ChunkTransform failing = chunk -> {
            if (chunk.getIndex() == 3) {
                throw new IOException("chunk 3");
            }
            return chunk.getRows();
        };

        TransformException e = assertThrows(TransformException.class,
                () -> new ParallelTransformer(options(2).build()).transform(input, failing, new ListRowWriter()));

        assertEquals(3, e.getChunkIndex());
        assertEquals(-1, e.getRowIndex());
    }

    @Test
    void testCollectFailures() throws IOException {
        ChunkTransform rowFailures = ChunkTransform.perRow(row -> {
            if ((Long) row.getValue(0) % 100 == 0) {
                throw new IllegalArgumentException("multiple of 100");
            }
            return row;
        });
        ListRowWriter writer = new ListRowWriter();

        TransformReport report = new ParallelTransformer(options(4).failFast(false).build())
                .transform(input, rowFailures, writer);

        assertEquals(RunState.DONE, report.getState());
        assertTrue(report.hasFailures());
        assertEquals(10, report.getFailures().size());
        assertEquals(ROWS - 10, report.getRowsWritten());
        List<Long> failedRows = new ArrayList<>();
        for (RowFailure failure : report.getFailures()) {
            assertFalse(failure.isWholeChunk());
            failedRows.add(failure.getRowIndex());
        }
        assertEquals(Arrays.asList(0L, 100L, 200L, 300L, 400L, 500L, 600L, 700L, 800L, 900L), failedRows);
    }

    @Test
    void testCollectWholeChunkFailure() throws IOException {
        ChunkTransform failing = chunk -> {
            if (chunk.getIndex() == 2) {
                throw new IllegalStateException("chunk 2");
            }
            return chunk.getRows();
        };
        ListRowWriter writer = new ListRowWriter();

        TransformReport report = new ParallelTransformer(options(2).failFast(false).build())
                .transform(input, failing, writer);

        assertEquals(1, report.getFailures().size());
        RowFailure failure = report.getFailures().get(0);
        assertTrue(failure.isWholeChunk());
        assertEquals(2, failure.getChunkIndex());
        assertEquals(ROWS - 7, writer.getRows().size());
        assertEquals(13L, writer.column("id").get(13));
        assertEquals(21L, writer.column("id").get(14));
    }

    @Test
    void testErrorIsNotCollectedAsFailure() {
        ParallelTransformer transformer = new ParallelTransformer(options(2).failFast(false).build());
        InternalError error = new InternalError("worker broke");
        ChunkTransform broken = chunk -> {
            if (chunk.getIndex() == 4) {
                throw error;
            }
            return chunk.getRows();
        };

        InternalError thrown = assertThrows(InternalError.class,
                () -> transformer.transform(input, broken, new ListRowWriter()));

        assertSame(error, thrown);
        assertEquals(RunState.ABORTED, transformer.getState());
    }

    @Test
    void testCancellationAbortsRun() {
        CancellationSignal cancellation = CancellationSignal.none();
        ParallelTransformer transformer = new ParallelTransformer(options(2).cancellation(cancellation).build());
        ChunkTransform cancelling = chunk -> {
            if (chunk.getIndex() == 5) {
                cancellation.cancel("test");
            }
            return chunk.getRows();
        };
        ListRowWriter writer = new ListRowWriter();

        assertThrows(RunCancelledException.class, () -> transformer.transform(input, cancelling, writer));
        assertEquals(RunState.ABORTED, transformer.getState());
        assertTrue(writer.getRows().size() < ROWS);
    }

    @Test
    void testInterruptBecomesCancellation() throws InterruptedException {
        ParallelTransformer transformer = new ParallelTransformer(options(2).build());
        CountDownLatch started = new CountDownLatch(1);
        ChunkTransform blocking = chunk -> {
            started.countDown();
            new CountDownLatch(1).await(10, TimeUnit.SECONDS);
            return chunk.getRows();
        };
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread coordinator = new Thread(() -> {
            try {
                transformer.transform(input, blocking, new ListRowWriter());
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        coordinator.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        // 等协调线程进入等待结果的状态
        Thread.sleep(200);

        coordinator.interrupt();
        coordinator.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(coordinator.isAlive());
        assertTrue(thrown.get() instanceof RunCancelledException, String.valueOf(thrown.get()));
        assertEquals(RunState.ABORTED, transformer.getState());
    }

    @Test
    void testWorkerThreadsDoTheWork() throws IOException {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        ChunkTransform recording = chunk -> {
            threads.add(Thread.currentThread().getName());
            return chunk.getRows();
        };

        new ParallelTransformer(options(3).build()).transform(input, recording, new ListRowWriter());

        assertFalse(threads.isEmpty());
        for (String name : threads) {
            assertTrue(name.startsWith("csv-transform-worker-"), name);
        }
    }

    @Test
    void testReadOptionsLimitInput() throws IOException {
        ListRowWriter writer = new ListRowWriter();
        TransformOptions options = options(2)
                .readOptions(ReadOptions.builder().columns("value").skipRows(10).limitRows(5).build())
                .build();

        TransformReport report = new ParallelTransformer(options).transform(input, chunk -> chunk.getRows(), writer);

        assertEquals(Schema.of("value"), writer.getSchema());
        assertEquals(Arrays.asList(30L, 33L, 36L, 39L, 42L), writer.column("value"));
        assertEquals(5, report.getRowsRead());
    }

    @Test
    void testHeaderOnlyInput() throws IOException {
        Path empty = tempDir.resolve("empty.csv");
        Files.write(empty, Collections.singletonList("id,value"), StandardCharsets.UTF_8);
        ListRowWriter writer = new ListRowWriter();

        TransformReport report = new ParallelTransformer(options(2).build())
                .transform(empty, chunk -> chunk.getRows(), writer);

        assertEquals(Schema.of("id", "value"), writer.getSchema());
        assertEquals(0, report.getChunks());
        assertEquals(RunState.DONE, report.getState());
    }

    @Test
    void testRunsOnlyOnce() throws IOException {
        ParallelTransformer transformer = new ParallelTransformer(options(1).build());
        transformer.transform(input, chunk -> chunk.getRows(), new ListRowWriter());

        assertThrows(IllegalStateException.class,
                () -> transformer.transform(input, chunk -> chunk.getRows(), new ListRowWriter()));
    }

    @Test
    void testInvalidWorkerCount() {
        assertThrows(ConfigurationException.class, () -> TransformOptions.builder().workers(0).build());
        assertThrows(ConfigurationException.class, () -> TransformOptions.builder().queueDepth(-1).build());
        assertEquals(3, TransformOptions.builder().workers(3).build().getQueueDepth());
    }
}
