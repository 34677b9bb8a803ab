package com.mini.csvtools.sort;

import com.mini.csvtools.reader.RecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 归并排序读取器
 *
 * 核心功能：
 * 1. 多路归并多个各自有序的数据源
 * 2. 比较相等时按数据源下标排序，下标小的先输出，保证稳定
 * 3. 流式读取，每个数据源只缓存一个头元素
 * 4. 数据源读完立即关闭，并通知监听器（用于删除段文件）
 *
 * 应用场景：
 * - 外部排序的最终归并和中间归并
 * - 按键交错合并多个已排序的输入文件
 */
public class MergeSortedReader<T> implements RecordReader<T> {
    private static final Logger logger = LoggerFactory.getLogger(MergeSortedReader.class);

    /**
     * 数据源耗尽监听器
     */
    @FunctionalInterface
    public interface ExhaustedListener {
        void onExhausted(int sourceIndex) throws IOException;
    }

    private final List<RecordReader<T>> sources;
    private final boolean[] finished;
    private final PriorityQueue<MergeElement<T>> mergeHeap;
    private final ExhaustedListener listener;

    private boolean initialized = false;
    private boolean closed = false;
    private long emitted = 0;

    public MergeSortedReader(List<? extends RecordReader<T>> sources, Comparator<? super T> comparator) {
        this(sources, comparator, index -> { });
    }

    /**
     * @param sources 数据源列表，顺序即相等元素的输出顺序
     * @param comparator 元素比较器，每个数据源必须已按它有序
     * @param listener 数据源读完时回调
     */
    public MergeSortedReader(List<? extends RecordReader<T>> sources, Comparator<? super T> comparator,
                             ExhaustedListener listener) {
        this.sources = new ArrayList<>(sources);
        this.finished = new boolean[this.sources.size()];
        this.listener = listener;
        this.mergeHeap = new PriorityQueue<>(Math.max(1, this.sources.size()), (a, b) -> {
            int compare = comparator.compare(a.value, b.value);
            if (compare != 0) {
                return compare;
            }
            return Integer.compare(a.sourceIndex, b.sourceIndex);
        });
    }

    @Override
    public T readRecord() throws IOException {
        if (closed) {
            return null;
        }
        if (!initialized) {
            initialized = true;
            for (int i = 0; i < sources.size(); i++) {
                pull(i);
            }
            logger.debug("Initialized MergeSortedReader with {} sources", sources.size());
        }

        MergeElement<T> current = mergeHeap.poll();
        if (current == null) {
            return null;
        }
        pull(current.sourceIndex);
        emitted++;
        return current.value;
    }

    /**
     * 从数据源读取下一个元素放入堆中，读完则关闭该数据源
     */
    private void pull(int sourceIndex) throws IOException {
        if (finished[sourceIndex]) {
            return;
        }
        RecordReader<T> source = sources.get(sourceIndex);
        T next = source.readRecord();
        if (next != null) {
            mergeHeap.offer(new MergeElement<>(next, sourceIndex));
            return;
        }
        finished[sourceIndex] = true;
        source.close();
        listener.onExhausted(sourceIndex);
    }

    public int getSourceCount() {
        return sources.size();
    }

    public long getEmittedCount() {
        return emitted;
    }

    /**
     * 关闭所有未读完的数据源
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        mergeHeap.clear();
        IOException failure = null;
        for (int i = 0; i < sources.size(); i++) {
            if (finished[i]) {
                continue;
            }
            finished[i] = true;
            try {
                sources.get(i).close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * 归并元素
     */
    private static final class MergeElement<T> {
        final T value;
        final int sourceIndex;

        MergeElement(T value, int sourceIndex) {
            this.value = value;
            this.sourceIndex = sourceIndex;
        }
    }
}
