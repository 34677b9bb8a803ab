package com.mini.csvtools.reader;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.exception.MalformedRowException;
import com.mini.csvtools.options.ChunkBudget;
import com.mini.csvtools.options.CsvOptions;
import com.mini.csvtools.options.ReadOptions;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * 分块 CSV 读取器
 *
 * 把一个分隔文本文件读成有序、有界的 Chunk 序列：
 * 1. 打开时立即解析表头，第一个 chunk 之前即可获取 Schema
 * 2. 每个 chunk 不超过 ChunkBudget 的行数/估算字节数
 * 3. 序列只能向前读一遍，需要重新扫描时必须重新打开
 * 4. 生命周期内只持有一个文件句柄，读完或 close 时释放
 */
public class ChunkedCsvReader implements RecordReader<Row> {
    private static final Logger logger = LoggerFactory.getLogger(ChunkedCsvReader.class);

    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9][0-9]{0,17})");
    private static final Pattern DECIMAL = Pattern.compile(
            "-?(([0-9]+\\.[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?|[0-9]+[eE][+-]?[0-9]+)");

    private final Path filePath;
    private final CsvOptions options;
    private final ChunkBudget budget;
    private final BufferedReader reader;
    private final CsvLineParser parser;

    /** 文件表头 */
    private final Schema fileSchema;

    /** 列选择后的 Schema */
    private final Schema schema;

    /** 选中列在文件表头中的下标，null 表示全部列 */
    private final int[] selectedIndices;

    private final long limitRows;

    /** 下一条数据行在源文件中的下标 */
    private long nextRowIndex = 0;

    private long rowCount = 0;
    private int chunkCount = 0;
    private boolean closed = false;

    private ChunkedCsvReader(Path filePath, CsvOptions options, ChunkBudget budget,
                             ReadOptions readOptions) throws IOException {
        this.filePath = filePath;
        this.options = options;
        this.budget = budget;
        this.limitRows = readOptions.getLimitRows();
        this.reader = Files.newBufferedReader(filePath, options.getCharset());
        this.parser = new CsvLineParser(reader, options.getDelimiter(), options.getQuote());

        try {
            this.fileSchema = readHeader();
            parser.setSkipBlankLines(fileSchema.size() > 1);
            if (readOptions.selectsColumns()) {
                List<String> columns = readOptions.getColumns();
                this.selectedIndices = new int[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    int index = fileSchema.indexOf(columns.get(i));
                    if (index < 0) {
                        throw new ConfigurationException(
                                "Column '" + columns.get(i) + "' not found in " + filePath + " " + fileSchema.getColumns());
                    }
                    selectedIndices[i] = index;
                }
                this.schema = fileSchema.select(columns);
            } else {
                this.selectedIndices = null;
                this.schema = fileSchema;
            }
            skipRows(readOptions.resolveSkipRows(budget));
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }

        logger.debug("Opened {} with schema {} and {}", filePath, schema.getColumns(), budget);
    }

    /**
     * 打开文件，读取全部列
     */
    public static ChunkedCsvReader open(Path filePath, CsvOptions options, ChunkBudget budget) throws IOException {
        return new ChunkedCsvReader(filePath, options, budget, ReadOptions.all());
    }

    /**
     * 打开文件，按 ReadOptions 选择列和行范围
     */
    public static ChunkedCsvReader open(Path filePath, CsvOptions options, ChunkBudget budget,
                                        ReadOptions readOptions) throws IOException {
        return new ChunkedCsvReader(filePath, options, budget, readOptions);
    }

    private Schema readHeader() throws IOException {
        CsvLineParser.Record header = parser.next();
        if (header == null) {
            throw new MalformedRowException("File has no header line: " + filePath, 1, -1);
        }
        List<String> names = new ArrayList<>(header.getFields());
        String first = names.get(0);
        if (!first.isEmpty() && first.charAt(0) == '\uFEFF') {
            names.set(0, first.substring(1));
        }
        try {
            return new Schema(names);
        } catch (IllegalArgumentException e) {
            throw new MalformedRowException(
                    "Invalid header in " + filePath + ": " + e.getMessage(), header.getLineNumber(), -1);
        }
    }

    private void skipRows(long count) throws IOException {
        for (long i = 0; i < count; i++) {
            if (parser.next() == null) {
                break;
            }
            nextRowIndex++;
        }
        if (count > 0) {
            logger.debug("Skipped {} rows of {}", nextRowIndex, filePath);
        }
    }

    /**
     * 获取（列选择后的）Schema
     */
    public Schema getSchema() {
        return schema;
    }

    /**
     * 获取文件原始表头
     */
    public Schema getFileSchema() {
        return fileSchema;
    }

    /**
     * 读取下一行数据
     *
     * @return Row 对象，如果到达文件末尾（或行数上限）返回 null
     */
    @Override
    public Row readRecord() throws IOException {
        if (closed) {
            return null;
        }
        if (limitRows >= 0 && rowCount >= limitRows) {
            close();
            return null;
        }
        CsvLineParser.Record record = parser.next();
        if (record == null) {
            close();
            return null;
        }
        Row row = convertToRow(record, nextRowIndex);
        nextRowIndex++;
        rowCount++;
        return row;
    }

    /**
     * 读取下一个 chunk
     *
     * @return Chunk，没有更多数据时返回 null
     */
    public Chunk readChunk() throws IOException {
        long firstRowIndex = nextRowIndex;
        List<Row> rows = new ArrayList<>();
        long bytes = 0;
        while (!budget.isFull(rows.size(), bytes)) {
            Row row = readRecord();
            if (row == null) {
                break;
            }
            rows.add(row);
            bytes += row.estimateSize();
        }
        if (rows.isEmpty()) {
            return null;
        }
        Chunk chunk = new Chunk(chunkCount++, firstRowIndex, rows, bytes);
        logger.debug("Read {} from {}", chunk, filePath);
        return chunk;
    }

    /**
     * 以迭代器形式遍历剩余的 chunk，I/O 错误包装为 UncheckedIOException
     */
    public Iterator<Chunk> chunks() {
        return new Iterator<Chunk>() {
            private Chunk next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = readChunk();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to read chunk from " + filePath, e);
                    }
                }
                return next != null;
            }

            @Override
            public Chunk next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("No more chunks in " + filePath);
                }
                Chunk current = next;
                next = null;
                return current;
            }
        };
    }

    /**
     * 将解析出的字段转换为 Row：处理字段数不一致、null 表示和类型推断
     */
    private Row convertToRow(CsvLineParser.Record record, long rowIndex) {
        int expected = fileSchema.size();
        if (record.size() != expected) {
            String message = String.format(
                    "Field count mismatch in %s at line %d (row %d): expected %d, got %d",
                    filePath, record.getLineNumber(), rowIndex, expected, record.size());
            if (options.isStrictRows()) {
                throw new MalformedRowException(message, record.getLineNumber(), rowIndex);
            }
            logger.warn("{}; {} the row", message, record.size() < expected ? "padding" : "truncating");
        }

        Object[] values = new Object[expected];
        String[] texts = new String[expected];
        int available = Math.min(expected, record.size());
        for (int i = 0; i < available; i++) {
            String field = record.getField(i);
            values[i] = convertValue(field, record.isQuoted(i));
            if (values[i] instanceof Number) {
                texts[i] = field;
            }
        }

        if (selectedIndices == null) {
            return new Row(values, texts);
        }
        Object[] selected = new Object[selectedIndices.length];
        String[] selectedTexts = new String[selectedIndices.length];
        for (int i = 0; i < selectedIndices.length; i++) {
            selected[i] = values[selectedIndices[i]];
            selectedTexts[i] = texts[selectedIndices[i]];
        }
        return new Row(selected, selectedTexts);
    }

    /**
     * 转换单个字段；推断出的数值由调用方记录源文本
     */
    private Object convertValue(String text, boolean quoted) {
        if (quoted) {
            return text;
        }
        if (text.equals(options.getNullValue())) {
            return null;
        }
        if (options.isInferTypes()) {
            if (INTEGER.matcher(text).matches()) {
                return Long.parseLong(text);
            }
            if (DECIMAL.matcher(text).matches()) {
                double value = Double.parseDouble(text);
                // 溢出为无穷大的小数保留为文本
                return Double.isInfinite(value) ? text : value;
            }
        }
        return text;
    }

    /**
     * 获取已读取的行数
     */
    public long getRowCount() {
        return rowCount;
    }

    public int getChunkCount() {
        return chunkCount;
    }

    public Path getFilePath() {
        return filePath;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        reader.close();
        logger.debug("Closed reader of {} after {} rows in {} chunks", filePath, rowCount, chunkCount);
    }
}
