package com.mini.csvtools.merge;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.exception.SchemaConflictException;
import com.mini.csvtools.options.MergeOptions;
import com.mini.csvtools.reader.Chunk;
import com.mini.csvtools.reader.ChunkedCsvReader;
import com.mini.csvtools.reader.CsvFiles;
import com.mini.csvtools.reader.RecordReader;
import com.mini.csvtools.schema.DataType;
import com.mini.csvtools.schema.Projection;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import com.mini.csvtools.schema.SchemaReconciler;
import com.mini.csvtools.sort.MergeSortedReader;
import com.mini.csvtools.sort.RowComparator;
import com.mini.csvtools.writer.RowWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 异构合并器
 * 把列集合不同的多个文件合并成一个统一 Schema 的输出
 *
 * 合并流程：
 * 1. 读取所有表头，计算统一 Schema（列名首次出现顺序）
 * 2. 开启类型推断时，用每个输入的第一块采样列类型并统一，整个运行期间不再改变
 * 3. 写出统一表头，然后按 CONCATENATE 或 INTERLEAVE_BY_KEY 输出所有行
 * 4. 缺失的列填 null
 */
public class HeterogeneousMerger {
    private static final Logger logger = LoggerFactory.getLogger(HeterogeneousMerger.class);

    private final MergeOptions options;

    public HeterogeneousMerger(MergeOptions options) {
        this.options = options;
    }

    /**
     * 合并输入文件并写入 writer
     *
     * @param inputs 输入文件，顺序决定列顺序和相等键的输出顺序
     * @param writer 输出
     */
    public MergeResult merge(List<Path> inputs, RowWriter writer) throws IOException {
        if (inputs == null || inputs.isEmpty()) {
            throw new ConfigurationException("Merge needs at least one input");
        }
        long startTime = System.currentTimeMillis();
        options.getCancellation().throwIfCancelled("merge start");
        logger.info("Starting {} merge of {} inputs with {}", options.getMode(), inputs.size(), options);

        try {
            List<Schema> schemas = new ArrayList<>();
            for (Path input : inputs) {
                schemas.add(CsvFiles.readHeader(input, options.getCsvOptions()));
            }
            Schema unified = SchemaReconciler.reconcile(schemas);
            logger.debug("Unified schema of {} inputs: {}", inputs.size(), unified.getColumns());

            if (options.getMode() == MergeMode.INTERLEAVE_BY_KEY) {
                checkKeyColumns(inputs, schemas);
            }

            Map<String, DataType> columnTypes = options.getCsvOptions().isInferTypes()
                    ? sampleColumnTypes(inputs)
                    : Collections.emptyMap();
            RowConformer conformer = new RowConformer(unified, columnTypes, options.isStrictTypes());

            writer.writeHeader(unified);
            List<Long> rowsPerInput = new ArrayList<>();
            long rowsWritten;
            if (options.getMode() == MergeMode.CONCATENATE) {
                rowsWritten = concatenate(inputs, schemas, unified, conformer, writer, rowsPerInput);
            } else {
                rowsWritten = interleave(inputs, schemas, unified, conformer, writer, rowsPerInput);
            }
            writer.flush();

            if (options.isRemoveMerged()) {
                for (Path input : inputs) {
                    Files.deleteIfExists(input);
                    logger.debug("Removed merged input {}", input);
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            logger.info("Merged {} inputs into {} columns: {} rows in {}ms",
                    inputs.size(), unified.size(), rowsWritten, duration);
            return new MergeResult(unified, columnTypes, rowsPerInput, rowsWritten, duration);
        } catch (IOException | RuntimeException e) {
            logger.error("Merge of {} inputs aborted after {}ms", inputs.size(),
                    System.currentTimeMillis() - startTime, e);
            throw e;
        }
    }

    private void checkKeyColumns(List<Path> inputs, List<Schema> schemas) {
        List<String> keyColumns = options.getKey().getColumnNames();
        for (int i = 0; i < schemas.size(); i++) {
            for (String column : keyColumns) {
                if (!schemas.get(i).contains(column)) {
                    throw new ConfigurationException(
                            "Key column '" + column + "' is missing from input " + inputs.get(i));
                }
            }
        }
    }

    /**
     * 用每个输入的第一块采样列类型
     */
    private Map<String, DataType> sampleColumnTypes(List<Path> inputs) throws IOException {
        List<Map<String, DataType>> perInput = new ArrayList<>();
        for (Path input : inputs) {
            try (ChunkedCsvReader reader = open(input)) {
                Chunk first = reader.readChunk();
                List<Row> sample = first == null ? Collections.emptyList() : first.getRows();
                perInput.add(SchemaReconciler.sampleTypes(reader.getSchema(), sample));
            }
        }
        Map<String, DataType> types = SchemaReconciler.reconcileTypes(perInput, options.isStrictTypes());
        logger.debug("Reconciled column types: {}", types);
        return types;
    }

    private long concatenate(List<Path> inputs, List<Schema> schemas, Schema unified, RowConformer conformer,
                             RowWriter writer, List<Long> rowsPerInput) throws IOException {
        long written = 0;
        for (int i = 0; i < inputs.size(); i++) {
            Projection projection = SchemaReconciler.projection(schemas.get(i), unified);
            try (ProjectingReader reader = new ProjectingReader(i, open(inputs.get(i)), projection, conformer)) {
                Row row;
                while ((row = reader.readRecord()) != null) {
                    options.getCancellation().throwIfCancelled("merge of " + inputs.get(i));
                    writer.writeRow(row);
                    written++;
                }
                rowsPerInput.add(reader.getRowCount());
                logger.debug("Concatenated {} rows from {}", reader.getRowCount(), inputs.get(i));
            }
        }
        return written;
    }

    private long interleave(List<Path> inputs, List<Schema> schemas, Schema unified, RowConformer conformer,
                            RowWriter writer, List<Long> rowsPerInput) throws IOException {
        List<ProjectingReader> readers = new ArrayList<>();
        try {
            for (int i = 0; i < inputs.size(); i++) {
                Projection projection = SchemaReconciler.projection(schemas.get(i), unified);
                readers.add(new ProjectingReader(i, open(inputs.get(i)), projection, conformer));
            }
        } catch (IOException | RuntimeException e) {
            for (ProjectingReader reader : readers) {
                try {
                    reader.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw e;
        }

        long written = 0;
        RowComparator comparator = RowComparator.of(options.getKey(), unified);
        try (MergeSortedReader<Row> merged = new MergeSortedReader<>(readers, comparator)) {
            Row row;
            while ((row = merged.readRecord()) != null) {
                options.getCancellation().throwIfCancelled("interleave merge");
                writer.writeRow(row);
                written++;
            }
        }
        for (ProjectingReader reader : readers) {
            rowsPerInput.add(reader.getRowCount());
        }
        return written;
    }

    private ChunkedCsvReader open(Path input) throws IOException {
        return ChunkedCsvReader.open(input, options.getCsvOptions(), options.getChunkBudget());
    }

    /**
     * 读取一个输入并投影到统一 Schema
     */
    private static final class ProjectingReader implements RecordReader<Row> {
        private final int inputIndex;
        private final ChunkedCsvReader reader;
        private final Projection projection;
        private final RowConformer conformer;

        ProjectingReader(int inputIndex, ChunkedCsvReader reader, Projection projection, RowConformer conformer) {
            this.inputIndex = inputIndex;
            this.reader = reader;
            this.projection = projection;
            this.conformer = conformer;
        }

        @Override
        public Row readRecord() throws IOException {
            Row row = reader.readRecord();
            if (row == null) {
                return null;
            }
            return conformer.conform(projection.project(row), inputIndex, reader.getRowCount() - 1);
        }

        long getRowCount() {
            return reader.getRowCount();
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }

    /**
     * 按统一列类型检查每一行
     * 文本列中的数值按源文本转成文本；数值列中出现文本时，严格模式报错，宽松模式保留文本
     */
    static final class RowConformer {
        private final Schema schema;
        private final DataType[] types;
        private final boolean strict;
        private final Set<String> warnedColumns = new HashSet<>();

        RowConformer(Schema schema, Map<String, DataType> columnTypes, boolean strict) {
            this.schema = schema;
            this.strict = strict;
            this.types = new DataType[schema.size()];
            for (int i = 0; i < schema.size(); i++) {
                types[i] = columnTypes.get(schema.getColumn(i));
            }
        }

        Row conform(Row row, int inputIndex, long rowIndex) {
            Object[] values = null;
            String[] texts = null;
            for (int i = 0; i < types.length; i++) {
                DataType type = types[i];
                Object value = row.getValue(i);
                if (type == null || !type.conflictsWith(value)) {
                    continue;
                }
                String column = schema.getColumn(i);
                if (type == DataType.STRING) {
                    if (values == null) {
                        values = row.getValues();
                        texts = row.getSourceTexts();
                    }
                    String text = row.getSourceText(i);
                    values[i] = text != null ? text : String.valueOf(value);
                    if (texts != null) {
                        texts[i] = null;
                    }
                    continue;
                }
                if (strict) {
                    throw new SchemaConflictException(column, String.format(
                            "Column '%s' is %s but input %d row %d holds text '%s'",
                            column, type, inputIndex, rowIndex, value));
                }
                if (warnedColumns.add(column)) {
                    logger.warn("Column '{}' is {} but input {} row {} holds text, keeping it as text",
                            column, type, inputIndex, rowIndex);
                }
            }
            return values == null ? row : new Row(values, texts);
        }
    }
}
