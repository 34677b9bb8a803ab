package com.mini.csvtools.sort;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.mini.csvtools.exception.SpillIOException;
import com.mini.csvtools.reader.ListRecordReader;
import com.mini.csvtools.reader.RecordReader;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.utils.IdGenerator;
import com.mini.csvtools.utils.PathFactory;
import com.mini.csvtools.utils.SerializationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 溢写存储
 * 管理一次排序运行的临时段文件
 *
 * 生命周期：
 * 1. create 时创建运行私有目录 csvtools-sort-{runId}
 * 2. persist/persistSorted 各写出一个段文件
 * 3. 归并阶段 reopen 读取，读完后 release 删除
 * 4. close 删除所有未释放的段和运行目录（正常完成与中止都调用）
 */
public class SpillStore implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SpillStore.class);

    private static final String KIND = "sort";

    private final String runId;
    private final Path runDirectory;
    private final PathFactory pathFactory;

    /** 尚未释放的段，按创建顺序 */
    private final Map<Long, SegmentHandle> liveSegments = new LinkedHashMap<>();

    private long nextSegmentId = 0;
    private long spilledRows = 0;
    private boolean closed = false;

    private SpillStore(PathFactory pathFactory, String runId, Path runDirectory) {
        this.pathFactory = pathFactory;
        this.runId = runId;
        this.runDirectory = runDirectory;
    }

    /**
     * 创建溢写存储，并创建运行私有目录
     */
    public static SpillStore create(PathFactory pathFactory) {
        String runId = IdGenerator.generateRunId();
        try {
            Path runDirectory = pathFactory.createRunDirectory(KIND, runId);
            logger.debug("Created spill directory {}", runDirectory);
            return new SpillStore(pathFactory, runId, runDirectory);
        } catch (IOException e) {
            throw new SpillIOException("Failed to create spill directory under " + pathFactory.getTempRoot(), e);
        }
    }

    /**
     * 在内存中稳定排序后写出一个新段
     * 注意：records 会被原地排序
     */
    public SegmentHandle persist(List<SortRecord> records, Comparator<SortRecord> comparator) {
        records.sort(comparator);
        return write(new ListRecordReader<>(records));
    }

    /**
     * 写出一个已经有序的记录流（多趟归并的中间结果）
     */
    public SegmentHandle persistSorted(RecordReader<SortRecord> source) {
        return write(source);
    }

    private SegmentHandle write(RecordReader<SortRecord> source) {
        checkOpen();
        long segmentId = nextSegmentId++;
        Path path = pathFactory.getSegmentPath(runDirectory, segmentId);
        long count = 0;
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
             SequenceWriter writer = SerializationUtils.recordWriter().writeValues(out)) {
            SortRecord record;
            while ((record = source.readRecord()) != null) {
                writer.write(encode(record));
                count++;
            }
        } catch (IOException e) {
            deletePartial(path, e);
            throw new SpillIOException("Failed to write segment " + path, e);
        } catch (RuntimeException e) {
            deletePartial(path, e);
            throw e;
        }

        SegmentHandle handle = new SegmentHandle(segmentId, path, count);
        liveSegments.put(segmentId, handle);
        spilledRows += count;
        logger.debug("Persisted segment {} with {} rows", path.getFileName(), count);
        return handle;
    }

    /**
     * 段文件中的一行：[rank, [v1, v2, ...]]，带源文本时为 [rank, [v1, ...], [t1, ...]]
     */
    private static Object[] encode(SortRecord record) {
        Row row = record.getRow();
        String[] texts = row.getSourceTexts();
        return texts == null
                ? new Object[]{record.getRank(), row.getValues()}
                : new Object[]{record.getRank(), row.getValues(), texts};
    }

    private static void deletePartial(Path path, Exception cause) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * 重新打开段文件，得到只能读一遍的读取器
     */
    public SegmentReader reopen(SegmentHandle handle) {
        checkOpen();
        if (handle.isReleased()) {
            throw new IllegalStateException("Segment already released: " + handle);
        }
        return new SegmentReader(handle);
    }

    /**
     * 删除段文件。同一句柄重复释放不做任何事
     */
    public void release(SegmentHandle handle) {
        if (handle.isReleased()) {
            logger.debug("Segment {} already released", handle.getId());
            return;
        }
        try {
            Files.deleteIfExists(handle.getPath());
        } catch (IOException e) {
            throw new SpillIOException("Failed to delete segment " + handle.getPath(), e);
        }
        handle.markReleased();
        liveSegments.remove(handle.getId());
        logger.debug("Released segment {}", handle.getPath().getFileName());
    }

    /**
     * 释放所有未释放的段并删除运行目录
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<SegmentHandle> remaining = new ArrayList<>(liveSegments.values());
        SpillIOException failure = null;
        for (SegmentHandle handle : remaining) {
            try {
                release(handle);
            } catch (SpillIOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        try {
            PathFactory.deleteDirectory(runDirectory);
        } catch (IOException e) {
            SpillIOException deleteFailure = new SpillIOException(
                    "Failed to delete spill directory " + runDirectory, e);
            if (failure == null) {
                failure = deleteFailure;
            } else {
                failure.addSuppressed(deleteFailure);
            }
        }
        if (!remaining.isEmpty()) {
            logger.debug("Released {} remaining segments of run {}", remaining.size(), runId);
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("SpillStore of run " + runId + " is closed");
        }
    }

    public String getRunId() {
        return runId;
    }

    public Path getRunDirectory() {
        return runDirectory;
    }

    public int getLiveSegmentCount() {
        return liveSegments.size();
    }

    public long getCreatedSegmentCount() {
        return nextSegmentId;
    }

    public long getSpilledRows() {
        return spilledRows;
    }
}
