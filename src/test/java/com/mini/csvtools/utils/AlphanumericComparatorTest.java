package com.mini.csvtools.utils;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 自然顺序比较测试
 */
public class AlphanumericComparatorTest {

    private final AlphanumericComparator comparator = AlphanumericComparator.INSTANCE;

    @Test
    void testNumericRunsCompareByValue() {
        List<String> names = new ArrayList<>(Arrays.asList("file10", "file2", "file1", "file20", "file3"));
        names.sort(comparator);

        assertEquals(Arrays.asList("file1", "file2", "file3", "file10", "file20"), names);
    }

    @Test
    void testLeadingZerosAndLongRuns() {
        assertTrue(comparator.compare("a007", "a8") < 0);
        assertTrue(comparator.compare("123456789012345678901234567890", "99") > 0);
        assertNotEquals(0, comparator.compare("a01", "a1"), "Equal values with different text keep a total order");
    }

    @Test
    void testPrefixAndPlainText() {
        assertTrue(comparator.compare("abc", "abd") < 0);
        assertTrue(comparator.compare("ab", "abc") < 0);
        assertEquals(0, comparator.compare("same1", "same1"));
    }
}
