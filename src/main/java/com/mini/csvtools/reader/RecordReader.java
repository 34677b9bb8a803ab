package com.mini.csvtools.reader;

import java.io.Closeable;
import java.io.IOException;

/**
 * Record Reader Interface
 * 单向、只读一遍的记录序列，读完或提前结束时都必须 close 释放底层资源
 */
public interface RecordReader<T> extends Closeable {

    /**
     * 读取下一条记录
     *
     * @return 下一条记录，如果没有更多记录返回 null
     * @throws IOException 读取异常
     */
    T readRecord() throws IOException;

    /**
     * 关闭读取器，释放资源。重复调用无副作用
     */
    @Override
    void close() throws IOException;
}
