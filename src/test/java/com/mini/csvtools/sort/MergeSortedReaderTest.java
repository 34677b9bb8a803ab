package com.mini.csvtools.sort;

import com.mini.csvtools.reader.ListRecordReader;
import com.mini.csvtools.reader.RecordReader;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 多路归并测试
 */
public class MergeSortedReaderTest {

    /**
     * 带来源标记的元素
     */
    private static final class Tagged {
        final int key;
        final String source;

        Tagged(int key, String source) {
            this.key = key;
            this.source = source;
        }
    }

    private static List<Tagged> tagged(String source, int... keys) {
        List<Tagged> list = new ArrayList<>();
        for (int key : keys) {
            list.add(new Tagged(key, source));
        }
        return list;
    }

    @Test
    void testMergeOrdersAndBreaksTiesBySourceIndex() throws IOException {
        List<RecordReader<Tagged>> sources = Arrays.asList(
                new ListRecordReader<>(tagged("a", 1, 3, 3, 7)),
                new ListRecordReader<>(tagged("b", 2, 3, 8)),
                new ListRecordReader<>(tagged("c", 3)));

        List<String> order = new ArrayList<>();
        try (MergeSortedReader<Tagged> reader = new MergeSortedReader<>(sources, Comparator.comparingInt((Tagged t) -> t.key))) {
            Tagged next;
            while ((next = reader.readRecord()) != null) {
                order.add(next.key + next.source);
            }
            assertEquals(8, reader.getEmittedCount());
        }

        assertEquals(Arrays.asList("1a", "2b", "3a", "3a", "3b", "3c", "7a", "8b"), order);
    }

    @Test
    void testExhaustedSourcesAreReportedOnce() throws IOException {
        List<Integer> exhausted = new ArrayList<>();
        List<RecordReader<Integer>> sources = Arrays.asList(
                new ListRecordReader<>(Arrays.asList(5, 6)),
                new ListRecordReader<>(Collections.<Integer>emptyList()),
                new ListRecordReader<>(Collections.singletonList(1)));

        try (MergeSortedReader<Integer> reader = new MergeSortedReader<>(sources, Comparator.<Integer>naturalOrder(),
                exhausted::add)) {
            assertEquals(Integer.valueOf(1), reader.readRecord());
            assertEquals(Arrays.asList(1, 2), exhausted);
            assertEquals(Integer.valueOf(5), reader.readRecord());
            assertEquals(Integer.valueOf(6), reader.readRecord());
            assertNull(reader.readRecord());
        }

        assertEquals(3, exhausted.size());
        assertEquals(Integer.valueOf(0), exhausted.get(2));
    }

    @Test
    void testNoSources() throws IOException {
        try (MergeSortedReader<Integer> reader = new MergeSortedReader<>(
                Collections.<RecordReader<Integer>>emptyList(), Comparator.<Integer>naturalOrder())) {
            assertNull(reader.readRecord());
        }
    }
}
