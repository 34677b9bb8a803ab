package com.mini.csvtools.sort;

import com.mini.csvtools.options.SortOptions;
import com.mini.csvtools.reader.Chunk;
import com.mini.csvtools.reader.ChunkedCsvReader;
import com.mini.csvtools.reader.ListRecordReader;
import com.mini.csvtools.reader.RecordReader;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import com.mini.csvtools.utils.CancellationSignal;
import com.mini.csvtools.writer.RowWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;

/**
 * 外部排序器（两阶段外部归并排序）
 *
 * 1. 切分排序阶段：逐块读取输入，块内稳定排序后写成段文件。
 *    最后一块不落盘，直接作为内存数据源参与最终归并，所以只有一块时完全不溢写。
 * 2. 归并阶段：多路归并所有段，相等元素按段的创建顺序输出，读完的段立即删除。
 *    设置了 maxOpenSegments 时，先把相邻的段分组归并成中间段，直到一趟能归并完。
 *
 * 任何异常（包括取消）都会释放已创建的段和运行目录后再抛出。
 */
public class ExternalSorter {
    private static final Logger logger = LoggerFactory.getLogger(ExternalSorter.class);

    private final SortOptions options;

    public ExternalSorter(SortOptions options) {
        this.options = options;
    }

    /**
     * 排序输入文件并写入 writer
     *
     * @param input 输入文件
     * @param writer 输出，表头在第一行数据之前写出
     * @return 排序统计
     */
    public SortResult sort(Path input, RowWriter writer) throws IOException {
        long startTime = System.currentTimeMillis();
        CancellationSignal cancellation = options.getCancellation();
        cancellation.throwIfCancelled("sort start");
        logger.info("Starting external sort of {} with {}", input, options);

        SpillStore store = null;
        try (ChunkedCsvReader reader = ChunkedCsvReader.open(input, options.getCsvOptions(), options.getChunkBudget())) {
            Schema schema = reader.getSchema();
            SortKey sortKey = options.getSortKey();
            Comparator<SortRecord> comparator = SortRecord.comparator(sortKey, schema);
            SplittableRandom random = sortKey.isRandom() ? new SplittableRandom(sortKey.getSeed()) : null;

            writer.writeHeader(schema);

            // 切分排序阶段
            List<SegmentHandle> segments = new ArrayList<>();
            List<SortRecord> lastChunk = null;
            Chunk chunk;
            while ((chunk = reader.readChunk()) != null) {
                cancellation.throwIfCancelled("split phase");
                if (lastChunk != null) {
                    if (store == null) {
                        store = SpillStore.create(options.getPathFactory());
                    }
                    segments.add(store.persist(lastChunk, comparator));
                }
                lastChunk = toRecords(chunk, random);
                logger.debug("Read chunk {} with {} rows", chunk.getIndex(), chunk.size());
            }

            long rowsWritten = 0;
            int mergePasses = 0;
            if (lastChunk != null) {
                lastChunk.sort(comparator);
                if (segments.isEmpty()) {
                    rowsWritten = writeAll(new ListRecordReader<>(lastChunk), writer, cancellation);
                } else {
                    int maxOpen = options.getMaxOpenSegments();
                    while (maxOpen > 0 && segments.size() > maxOpen) {
                        segments = mergeGroups(store, segments, comparator, maxOpen);
                        mergePasses++;
                    }
                    rowsWritten = mergeToWriter(store, segments, lastChunk, comparator, writer);
                    mergePasses++;
                }
            }
            writer.flush();

            int segmentsCreated = store == null ? 0 : (int) store.getCreatedSegmentCount();
            if (store != null) {
                store.close();
            }

            long duration = System.currentTimeMillis() - startTime;
            logger.info("External sort of {} completed: {} rows, {} segments, {} merge passes in {}ms",
                    input, rowsWritten, segmentsCreated, mergePasses, duration);
            return new SortResult(rowsWritten, segmentsCreated, mergePasses, duration);
        } catch (IOException | RuntimeException e) {
            abort(store, e);
            logger.error("External sort of {} aborted after {}ms", input,
                    System.currentTimeMillis() - startTime, e);
            throw e;
        }
    }

    private static List<SortRecord> toRecords(Chunk chunk, SplittableRandom random) {
        List<SortRecord> records = new ArrayList<>(chunk.size());
        for (Row row : chunk.getRows()) {
            records.add(new SortRecord(random != null ? random.nextLong() : 0L, row));
        }
        return records;
    }

    /**
     * 一趟中间归并：相邻的 maxOpen 个段归并成一个新段
     */
    private List<SegmentHandle> mergeGroups(SpillStore store, List<SegmentHandle> segments,
                                            Comparator<SortRecord> comparator, int maxOpen) throws IOException {
        List<SegmentHandle> merged = new ArrayList<>();
        for (int from = 0; from < segments.size(); from += maxOpen) {
            List<SegmentHandle> group = segments.subList(from, Math.min(from + maxOpen, segments.size()));
            if (group.size() == 1) {
                merged.add(group.get(0));
                continue;
            }
            options.getCancellation().throwIfCancelled("intermediate merge");
            try (MergeSortedReader<SortRecord> reader = openMerge(store, group, null, comparator)) {
                merged.add(store.persistSorted(reader));
            }
        }
        logger.debug("Intermediate merge pass reduced {} segments to {}", segments.size(), merged.size());
        return merged;
    }

    /**
     * 最终归并：所有段加上内存中的最后一块
     */
    private long mergeToWriter(SpillStore store, List<SegmentHandle> segments, List<SortRecord> lastChunk,
                               Comparator<SortRecord> comparator, RowWriter writer) throws IOException {
        try (MergeSortedReader<SortRecord> reader = openMerge(store, segments, lastChunk, comparator)) {
            return writeAll(reader, writer, options.getCancellation());
        }
    }

    private MergeSortedReader<SortRecord> openMerge(SpillStore store, List<SegmentHandle> segments,
                                                    List<SortRecord> inMemory, Comparator<SortRecord> comparator)
            throws IOException {
        List<RecordReader<SortRecord>> sources = new ArrayList<>();
        try {
            for (SegmentHandle handle : segments) {
                sources.add(store.reopen(handle));
            }
        } catch (RuntimeException e) {
            for (RecordReader<SortRecord> source : sources) {
                try {
                    source.close();
                } catch (RuntimeException | IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw e;
        }
        if (inMemory != null) {
            sources.add(new ListRecordReader<>(inMemory));
        }
        List<SegmentHandle> handles = new ArrayList<>(segments);
        return new MergeSortedReader<>(sources, comparator, index -> {
            if (index < handles.size()) {
                store.release(handles.get(index));
            }
        });
    }

    private static long writeAll(RecordReader<SortRecord> source, RowWriter writer,
                                 CancellationSignal cancellation) throws IOException {
        long count = 0;
        SortRecord record;
        while ((record = source.readRecord()) != null) {
            cancellation.throwIfCancelled("merge phase");
            writer.writeRow(record.getRow());
            count++;
        }
        return count;
    }

    private static void abort(SpillStore store, Exception cause) {
        if (store == null) {
            return;
        }
        try {
            store.close();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }
}
