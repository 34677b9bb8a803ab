package com.mini.csvtools.sort;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.mini.csvtools.exception.SpillIOException;
import com.mini.csvtools.reader.RecordReader;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.utils.SerializationUtils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.List;

/**
 * 段文件读取器
 * 逐行流式读取段文件，每行是一个 JSON 数组 [rank, [v1, v2, ...]]，可带第三个元素 [t1, t2, ...] 保存源文本
 */
public class SegmentReader implements RecordReader<SortRecord> {

    private final SegmentHandle handle;
    private final InputStream input;
    private final JsonParser parser;
    private final MappingIterator<Object[]> iterator;
    private long readCount = 0;
    private boolean closed = false;

    SegmentReader(SegmentHandle handle) {
        this.handle = handle;
        InputStream in = null;
        try {
            in = new BufferedInputStream(Files.newInputStream(handle.getPath()));
            this.input = in;
            // 必须自己创建 parser：直接传 InputStream 时 Jackson 会把首行的根数组展开
            ObjectReader reader = SerializationUtils.recordReader();
            this.parser = reader.createParser(in);
            this.iterator = reader.readValues(parser);
        } catch (IOException e) {
            closeAfterFailure(in, e);
            throw new SpillIOException("Failed to reopen segment " + handle.getPath(), e);
        }
    }

    private static void closeAfterFailure(InputStream in, IOException cause) {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public SortRecord readRecord() {
        if (closed) {
            return null;
        }
        try {
            if (!iterator.hasNextValue()) {
                close();
                return null;
            }
            Object[] encoded = iterator.nextValue();
            readCount++;
            return decode(encoded);
        } catch (IOException e) {
            throw new SpillIOException("Failed to read segment " + handle.getPath()
                    + " at record " + readCount, e);
        }
    }

    private SortRecord decode(Object[] encoded) {
        if (encoded.length < 2 || !(encoded[0] instanceof Number) || !(encoded[1] instanceof List)
                || (encoded.length > 2 && !(encoded[2] instanceof List))) {
            throw new SpillIOException("Corrupt record " + readCount + " in segment " + handle.getPath());
        }
        long rank = ((Number) encoded[0]).longValue();
        Object[] values = ((List<?>) encoded[1]).toArray();
        String[] texts = null;
        if (encoded.length > 2) {
            List<?> textList = (List<?>) encoded[2];
            texts = new String[textList.size()];
            for (int i = 0; i < texts.length; i++) {
                Object text = textList.get(i);
                texts[i] = text == null ? null : text.toString();
            }
        }
        return new SortRecord(rank, new Row(values, texts));
    }

    public SegmentHandle getHandle() {
        return handle;
    }

    public long getReadCount() {
        return readCount;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            iterator.close();
            parser.close();
            input.close();
        } catch (IOException e) {
            throw new SpillIOException("Failed to close segment " + handle.getPath(), e);
        }
    }
}
