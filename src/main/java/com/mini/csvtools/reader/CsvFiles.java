package com.mini.csvtools.reader;

import com.mini.csvtools.options.ChunkBudget;
import com.mini.csvtools.options.CsvOptions;
import com.mini.csvtools.schema.Schema;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 文件级工具方法：读取表头、统计行数
 */
public final class CsvFiles {

    private CsvFiles() {
    }

    /**
     * 只读取文件表头
     */
    public static Schema readHeader(Path filePath, CsvOptions options) throws IOException {
        try (ChunkedCsvReader reader = ChunkedCsvReader.open(filePath, options, ChunkBudget.rows(1))) {
            return reader.getSchema();
        }
    }

    /**
     * 统计数据行数（不含表头），引号内的换行不计为新行
     */
    public static long countRows(Path filePath, CsvOptions options) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(filePath, options.getCharset())) {
            CsvLineParser parser = new CsvLineParser(reader, options.getDelimiter(), options.getQuote());
            CsvLineParser.Record header = parser.next();
            if (header == null) {
                return 0;
            }
            parser.setSkipBlankLines(header.size() > 1);
            long rows = 0;
            while (parser.next() != null) {
                rows++;
            }
            return rows;
        }
    }
}
