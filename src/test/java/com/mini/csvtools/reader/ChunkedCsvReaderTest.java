package com.mini.csvtools.reader;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.exception.MalformedRowException;
import com.mini.csvtools.options.ChunkBudget;
import com.mini.csvtools.options.CsvOptions;
import com.mini.csvtools.options.ReadOptions;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 分块读取测试
 * 验证：
 * 1. chunk 不超过预算且保持行顺序
 * 2. 字段数不一致时的严格/宽松处理
 * 3. 引号、null 表示与类型推断
 * 4. 空文件、只有表头的文件
 */
public class ChunkedCsvReaderTest {

    @TempDir
    Path tempDir;

    private Path writeCsv(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testChunksRespectRowBudgetAndOrder() throws IOException {
        Path file = writeCsv("data.csv", "id,name", "1,a", "2,b", "3,c", "4,d", "5,e");

        List<Chunk> chunks = new ArrayList<>();
        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(2))) {
            assertEquals(Schema.of("id", "name"), reader.getSchema());
            Chunk chunk;
            while ((chunk = reader.readChunk()) != null) {
                chunks.add(chunk);
            }
            assertTrue(reader.isClosed(), "Reader should release the file at end of input");
            assertEquals(5, reader.getRowCount());
            assertEquals(3, reader.getChunkCount());
        }

        assertEquals(3, chunks.size());
        assertEquals(Arrays.asList(2, 2, 1), Arrays.asList(chunks.get(0).size(), chunks.get(1).size(), chunks.get(2).size()));
        assertEquals(0, chunks.get(0).getIndex());
        assertEquals(2, chunks.get(1).getFirstRowIndex());
        assertEquals(4, chunks.get(2).rowIndexOf(0));
        assertEquals(Row.of("1", "a"), chunks.get(0).get(0));
        assertEquals(Row.of("5", "e"), chunks.get(2).get(0));
    }

    @Test
    void testByteBudgetAlwaysTakesAtLeastOneRow() throws IOException {
        Path file = writeCsv("wide.csv", "text", "aaaaaaaaaaaaaaaaaaaa", "bbbbbbbbbbbbbbbbbbbb");

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.bytes(1))) {
            assertEquals(1, reader.readChunk().size());
            assertEquals(1, reader.readChunk().size());
            assertNull(reader.readChunk());
        }
    }

    @Test
    void testChunkIterator() throws IOException {
        Path file = writeCsv("data.csv", "id", "1", "2", "3");

        int rows = 0;
        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(2))) {
            Iterator<Chunk> iterator = reader.chunks();
            while (iterator.hasNext()) {
                rows += iterator.next().size();
            }
            assertFalse(iterator.hasNext());
        }
        assertEquals(3, rows);
    }

    @Test
    void testStrictModeRejectsShortRow() throws IOException {
        Path file = writeCsv("bad.csv", "a,b,c", "1,2,3", "4,5");

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(10))) {
            MalformedRowException e = assertThrows(MalformedRowException.class, reader::readChunk);
            assertEquals(3, e.getLineNumber());
            assertEquals(1, e.getRowIndex());
        }
    }

    @Test
    void testLenientModePadsAndTruncates() throws IOException {
        Path file = writeCsv("ragged.csv", "a,b,c", "1,2", "3,4,5,6");
        CsvOptions lenient = CsvOptions.builder().strictRows(false).build();

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, lenient, ChunkBudget.rows(10))) {
            Chunk chunk = reader.readChunk();
            assertEquals(Row.of("1", "2", null), chunk.get(0));
            assertEquals(Row.of("3", "4", "5"), chunk.get(1));
        }
    }

    @Test
    void testQuotedFieldsAndNullRepresentation() throws IOException {
        Path file = writeCsv("quoted.csv",
                "id,text,note",
                "1,\"hello, world\",",
                "2,\"say \"\"hi\"\"\",\"\"",
                "3,\"two",
                "lines\",NA");
        CsvOptions options = CsvOptions.builder().nullValue("").build();

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, options, ChunkBudget.rows(10))) {
            Chunk chunk = reader.readChunk();
            assertEquals(3, chunk.size());
            assertEquals(Row.of("1", "hello, world", null), chunk.get(0));
            assertEquals(Row.of("2", "say \"hi\"", ""), chunk.get(1), "Quoted empty field is text, not null");
            assertEquals(Row.of("3", "two\nlines", "NA"), chunk.get(2));
        }
    }

    @Test
    void testTypeInference() throws IOException {
        Path file = writeCsv("typed.csv", "i,d,s,z,q", "42,3.5,abc,007,\"12\"", "-1,1e3,x1,0,\"\"");
        CsvOptions options = CsvOptions.builder().inferTypes(true).build();

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, options, ChunkBudget.rows(10))) {
            Chunk chunk = reader.readChunk();
            assertEquals(Row.of(42L, 3.5, "abc", "007", "12"), chunk.get(0));
            assertEquals(Row.of(-1L, 1000.0, "x1", 0L, ""), chunk.get(1));
        }
    }

    @Test
    void testInferredNumbersKeepSourceText() throws IOException {
        Path file = writeCsv("texts.csv", "a,b,c,d", "1.50,1e3,-0,\"7\"");
        CsvOptions options = CsvOptions.builder().inferTypes(true).build();

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, options, ChunkBudget.rows(10))) {
            Row row = reader.readChunk().get(0);
            assertEquals(Row.of(1.5, 1000.0, 0L, "7"), row);
            assertEquals("1.50", row.getSourceText(0));
            assertEquals("1e3", row.getSourceText(1));
            assertEquals("-0", row.getSourceText(2));
            assertNull(row.getSourceText(3), "Quoted text has no separate source text");
        }
    }

    @Test
    void testCustomDelimiterAndQuote() throws IOException {
        Path file = writeCsv("semi.csv", "a;b", "'x;y';z");
        CsvOptions options = CsvOptions.builder().delimiter(';').quote('\'').build();

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, options, ChunkBudget.rows(10))) {
            assertEquals(Row.of("x;y", "z"), reader.readRecord());
            assertNull(reader.readRecord());
        }
    }

    @Test
    void testEmptyFileHasNoHeader() throws IOException {
        Path file = tempDir.resolve("empty.csv");
        Files.createFile(file);

        assertThrows(MalformedRowException.class,
                () -> ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(10)));
    }

    @Test
    void testHeaderOnlyFile() throws IOException {
        Path file = writeCsv("header.csv", "id,name");

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(10))) {
            assertEquals(Schema.of("id", "name"), reader.getSchema());
            assertNull(reader.readChunk());
        }
    }

    @Test
    void testBlankLinesSkippedAndBomStripped() throws IOException {
        Path file = writeCsv("bom.csv", "\uFEFFid,name", "", "1,a", "", "2,b");

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(10))) {
            assertEquals("id", reader.getSchema().getColumn(0));
            assertEquals(2, reader.readChunk().size());
        }
    }

    @Test
    void testBlankLineInSingleColumnFileIsNull() throws IOException {
        Path file = writeCsv("single.csv", "value", "a", "", "b");

        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(10))) {
            Chunk chunk = reader.readChunk();
            assertEquals(3, chunk.size());
            assertNull(chunk.get(1).getValue(0));
        }
    }

    @Test
    void testReadOptionsSelectSkipAndLimit() throws IOException {
        Path file = writeCsv("range.csv", "id,name,age", "1,a,10", "2,b,20", "3,c,30", "4,d,40", "5,e,50");
        ReadOptions readOptions = ReadOptions.builder()
                .columns("age", "id")
                .skipChunks(1)
                .limitRows(2)
                .build();

        List<Row> rows = new ArrayList<>();
        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(2),
                readOptions)) {
            assertEquals(Schema.of("age", "id"), reader.getSchema());
            assertEquals(Schema.of("id", "name", "age"), reader.getFileSchema());
            Row row;
            while ((row = reader.readRecord()) != null) {
                rows.add(row);
            }
        }
        assertEquals(Arrays.asList(Row.of("30", "3"), Row.of("40", "4")), rows);
    }

    @Test
    void testUnknownSelectedColumn() throws IOException {
        Path file = writeCsv("data.csv", "id", "1");
        ReadOptions readOptions = ReadOptions.builder().columns("missing").build();

        assertThrows(ConfigurationException.class, () -> ChunkedCsvReader.open(file, CsvOptions.defaults(),
                ChunkBudget.rows(1), readOptions));
    }

    @Test
    void testCloseIsIdempotent() throws IOException {
        Path file = writeCsv("data.csv", "id", "1", "2");

        ChunkedCsvReader reader = ChunkedCsvReader.open(file, CsvOptions.defaults(), ChunkBudget.rows(1));
        reader.readChunk();
        reader.close();
        reader.close();
        assertTrue(reader.isClosed());
        assertNull(reader.readChunk(), "Closed reader yields no more chunks");
    }

    @Test
    void testCsvFilesHelpers() throws IOException {
        Path file = writeCsv("data.csv", "id,text", "1,\"multi", "line\"", "2,x", "", "3,y");

        assertEquals(Schema.of("id", "text"), CsvFiles.readHeader(file, CsvOptions.defaults()));
        assertEquals(3, CsvFiles.countRows(file, CsvOptions.defaults()));
    }
}
