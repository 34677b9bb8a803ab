package com.mini.csvtools.writer;

import com.mini.csvtools.options.CsvOptions;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * CSV 格式写入器
 * 将数据以分隔文本格式写入文件，写出的文件可以用相同的 CsvOptions 读回
 */
public class CsvRowWriter implements RowWriter {

    private static final Logger logger = LoggerFactory.getLogger(CsvRowWriter.class);

    private static final String LINE_DELIMITER = "\n";

    private final Path filePath;
    private final CsvOptions options;
    private final BufferedWriter writer;
    private final String delimiter;
    private final String quote;

    private Schema schema;
    private long rowCount = 0;
    private boolean closed = false;

    public CsvRowWriter(Path filePath) throws IOException {
        this(filePath, CsvOptions.defaults());
    }

    public CsvRowWriter(Path filePath, CsvOptions options) throws IOException {
        this.filePath = filePath;
        this.options = options;
        this.delimiter = String.valueOf(options.getDelimiter());
        this.quote = String.valueOf(options.getQuote());

        // 创建父目录
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        this.writer = Files.newBufferedWriter(
                filePath,
                options.getCharset(),
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING
        );

        logger.debug("Created CsvRowWriter for file: {}", filePath);
    }

    @Override
    public void writeHeader(Schema schema) throws IOException {
        if (this.schema != null) {
            throw new IllegalStateException("Header already written to " + filePath);
        }
        this.schema = schema;
        StringBuilder header = new StringBuilder();
        for (int i = 0; i < schema.size(); i++) {
            if (i > 0) {
                header.append(delimiter);
            }
            header.append(escapeValue(schema.getColumn(i)));
        }
        writer.write(header.toString());
        writer.write(LINE_DELIMITER);
    }

    @Override
    public void writeRow(Row row) throws IOException {
        if (schema == null) {
            throw new IllegalStateException("Header must be written before rows: " + filePath);
        }
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < schema.size(); i++) {
            if (i > 0) {
                line.append(delimiter);
            }
            Object value = row.getValue(i);
            String sourceText = row.getSourceText(i);
            if (value == null) {
                line.append(options.getNullValue());
            } else if (sourceText != null) {
                // 推断出的数值按源文本写回
                line.append(escapeValue(sourceText));
            } else if (value instanceof String && value.equals(options.getNullValue())) {
                // 与 null 表示相同的文本必须加引号，否则读回时会变成 null
                line.append(quote).append(escapeInner((String) value)).append(quote);
            } else {
                line.append(escapeValue(value.toString()));
            }
        }
        writer.write(line.toString());
        writer.write(LINE_DELIMITER);
        rowCount++;
    }

    /**
     * 转义特殊字符：包含分隔符、引号或换行时用引号包围
     */
    private String escapeValue(String value) {
        if (value.contains(delimiter)
                || value.contains(quote)
                || value.contains("\n")
                || value.contains("\r")) {
            return quote + escapeInner(value) + quote;
        }
        return value;
    }

    private String escapeInner(String value) {
        return value.replace(quote, quote + quote);
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    /**
     * 获取已写入的行数
     */
    public long getRowCount() {
        return rowCount;
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.flush();
        writer.close();
        logger.debug("Closed CsvRowWriter, wrote {} rows to {}", rowCount, filePath);
    }
}
