package com.mini.csvtools.writer;

import com.mini.csvtools.reader.Chunk;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;

import java.io.IOException;

/**
 * RowWriter 接口
 *
 * 增量写出行数据的能力接口。调用顺序固定：
 * writeHeader 一次，之后任意次 writeRow / writeChunk，最后 flush 和 close。
 * 核心组件只依赖这个接口，不关心目标格式。
 */
public interface RowWriter extends AutoCloseable {

    /**
     * 写入表头，只能调用一次，且必须在写入任何行之前
     */
    void writeHeader(Schema schema) throws IOException;

    /**
     * 写入单行数据，行的值与表头按位置对齐
     */
    void writeRow(Row row) throws IOException;

    /**
     * 写入一个 chunk 的全部行
     */
    default void writeChunk(Chunk chunk) throws IOException {
        writeRows(chunk.getRows());
    }

    /**
     * 按顺序写入多行
     */
    default void writeRows(Iterable<Row> rows) throws IOException {
        for (Row row : rows) {
            writeRow(row);
        }
    }

    /**
     * 刷写缓冲区
     */
    void flush() throws IOException;

    @Override
    void close() throws IOException;
}
