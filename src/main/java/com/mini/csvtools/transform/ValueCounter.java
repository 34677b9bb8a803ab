package com.mini.csvtools.transform;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.options.ReadOptions;
import com.mini.csvtools.options.TransformOptions;
import com.mini.csvtools.reader.Chunk;
import com.mini.csvtools.reader.CsvFiles;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import com.mini.csvtools.sort.RowComparator;
import com.mini.csvtools.writer.RowWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列取值计数
 * 每个 chunk 在工作线程上各自计数，协调线程汇总。null 不计数。
 */
public final class ValueCounter {

    private static final Schema COUNT_SCHEMA = Schema.of("value", "count");

    private ValueCounter() {
    }

    /**
     * 统计某列每个取值出现的次数，按次数降序（次数相同按取值自然顺序）
     */
    public static Map<Object, Long> count(Path input, String column, TransformOptions options) throws IOException {
        return run(input, column, options).counts;
    }

    /**
     * 统计某列每个取值的相对频率：次数除以读取的总行数
     */
    public static Map<Object, Double> frequencies(Path input, String column, TransformOptions options)
            throws IOException {
        Tally tally = run(input, column, options);
        Map<Object, Double> frequencies = new LinkedHashMap<>();
        for (Map.Entry<Object, Long> entry : tally.counts.entrySet()) {
            frequencies.put(entry.getKey(), tally.rowsRead == 0 ? 0.0 : (double) entry.getValue() / tally.rowsRead);
        }
        return frequencies;
    }

    private static Tally run(Path input, String column, TransformOptions options) throws IOException {
        Schema header = CsvFiles.readHeader(input, options.getCsvOptions());
        if (!header.contains(column)) {
            throw new ConfigurationException("Column '" + column + "' not found in " + header.getColumns());
        }
        ReadOptions readOptions = options.getReadOptions();
        TransformOptions countOptions = options.toBuilder()
                .readOptions(ReadOptions.builder()
                        .columns(column)
                        .skipRows(readOptions.getSkipRows())
                        .skipChunks(readOptions.getSkipChunks())
                        .limitRows(readOptions.getLimitRows())
                        .build())
                .build();

        CountingWriter writer = new CountingWriter();
        TransformReport report = new ParallelTransformer(countOptions).transform(input, new ChunkCounter(), writer);
        return new Tally(sortByCount(writer.totals), report.getRowsRead());
    }

    private static Map<Object, Long> sortByCount(Map<Object, Long> totals) {
        List<Map.Entry<Object, Long>> entries = new ArrayList<>(totals.entrySet());
        entries.sort((a, b) -> {
            int byCount = Long.compare(b.getValue(), a.getValue());
            return byCount != 0 ? byCount : RowComparator.compareValues(a.getKey(), b.getKey());
        });
        Map<Object, Long> sorted = new LinkedHashMap<>();
        for (Map.Entry<Object, Long> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    /**
     * 单块计数，输出 (value, count) 行
     */
    private static final class ChunkCounter implements ChunkTransform {
        @Override
        public List<Row> apply(Chunk chunk) {
            Map<Object, Long> counts = new LinkedHashMap<>();
            for (Row row : chunk.getRows()) {
                Object value = row.getValue(0);
                if (value != null) {
                    counts.merge(value, 1L, Long::sum);
                }
            }
            List<Row> rows = new ArrayList<>(counts.size());
            for (Map.Entry<Object, Long> entry : counts.entrySet()) {
                rows.add(Row.of(entry.getKey(), entry.getValue()));
            }
            return rows;
        }

        @Override
        public Schema outputSchema(Schema input) {
            return COUNT_SCHEMA;
        }
    }

    /**
     * 汇总各块计数的 writer
     */
    private static final class CountingWriter implements RowWriter {
        private final Map<Object, Long> totals = new HashMap<>();

        @Override
        public void writeHeader(Schema schema) {
        }

        @Override
        public void writeRow(Row row) {
            totals.merge(row.getValue(0), (Long) row.getValue(1), Long::sum);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }

    private static final class Tally {
        private final Map<Object, Long> counts;
        private final long rowsRead;

        Tally(Map<Object, Long> counts, long rowsRead) {
            this.counts = counts;
            this.rowsRead = rowsRead;
        }
    }
}
