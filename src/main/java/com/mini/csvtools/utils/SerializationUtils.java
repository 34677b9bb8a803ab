package com.mini.csvtools.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 序列化工具类
 * 段文件采用按行分隔的 JSON 数组，保留 Long/Double/String/null 的区别
 */
public final class SerializationUtils {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        // 整数统一读成 Long，避免同一列出现 Integer/Long 两种类型
        OBJECT_MAPPER.enable(DeserializationFeature.USE_LONG_FOR_INTS);
        OBJECT_MAPPER.disable(SerializationFeature.INDENT_OUTPUT);
        OBJECT_MAPPER.disable(SerializationFeature.FLUSH_AFTER_WRITE_VALUE);
    }

    private SerializationUtils() {
    }

    /**
     * 按行写出记录数组的 Writer
     */
    public static ObjectWriter recordWriter() {
        return OBJECT_MAPPER.writer().withRootValueSeparator("\n");
    }

    /**
     * 读取记录数组的 Reader
     */
    public static ObjectReader recordReader() {
        return OBJECT_MAPPER.readerFor(Object[].class);
    }
}
