package com.mini.csvtools.transform;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.options.ChunkBudget;
import com.mini.csvtools.options.CsvOptions;
import com.mini.csvtools.options.ReadOptions;
import com.mini.csvtools.options.TransformOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 取值计数测试
 * 验证：
 * 1. 计数按次数降序，次数相同按取值自然顺序
 * 2. null 不计数，但计入频率的分母
 * 3. 多线程多块的结果与单块一致
 */
public class ValueCounterTest {

    @TempDir
    Path tempDir;

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("colors.csv");
        Files.write(input, Arrays.asList("id,color,size",
                "1,red,10", "2,blue,2", "3,red,10", "4,green,3", "5,,2",
                "6,red,10", "7,blue,2", "8,amber,1"), StandardCharsets.UTF_8);
    }

    private TransformOptions options(int workers, int chunkRows) {
        return TransformOptions.builder()
                .workers(workers)
                .chunkBudget(ChunkBudget.rows(chunkRows))
                .build();
    }

    @Test
    void testCountsOrderedByFrequency() throws IOException {
        Map<Object, Long> counts = ValueCounter.count(input, "color", options(1, 100));

        assertEquals(Arrays.asList("red", "blue", "amber", "green"), new ArrayList<>(counts.keySet()));
        assertEquals(Arrays.asList(3L, 2L, 1L, 1L), new ArrayList<>(counts.values()));
    }

    @Test
    void testParallelCountsMatchSingleChunk() throws IOException {
        Map<Object, Long> single = ValueCounter.count(input, "color", options(1, 100));
        Map<Object, Long> parallel = ValueCounter.count(input, "color", options(3, 2));

        assertEquals(new ArrayList<>(single.entrySet()), new ArrayList<>(parallel.entrySet()));
    }

    @Test
    void testFrequenciesIncludeNullRows() throws IOException {
        Map<Object, Double> frequencies = ValueCounter.frequencies(input, "color", options(2, 3));

        assertEquals(3.0 / 8, frequencies.get("red"), 1e-9);
        assertEquals(1.0 / 8, frequencies.get("green"), 1e-9);
        assertFalse(frequencies.containsKey(null));
    }

    @Test
    void testTypedValuesUseNaturalOrder() throws IOException {
        TransformOptions typed = TransformOptions.builder()
                .workers(2)
                .chunkBudget(ChunkBudget.rows(2))
                .csvOptions(CsvOptions.builder().inferTypes(true).build())
                .build();

        Map<Object, Long> counts = ValueCounter.count(input, "size", typed);

        assertEquals(Arrays.asList(2L, 10L, 1L, 3L), new ArrayList<>(counts.keySet()));
        assertEquals(Long.valueOf(3), counts.get(10L));
    }

    @Test
    void testReadOptionsRestrictRows() throws IOException {
        TransformOptions limited = TransformOptions.builder()
                .workers(2)
                .readOptions(ReadOptions.builder().limitRows(3).build())
                .build();

        Map<Object, Long> counts = ValueCounter.count(input, "color", limited);

        assertEquals(Long.valueOf(2), counts.get("red"));
        assertEquals(Long.valueOf(1), counts.get("blue"));
        assertEquals(2, counts.size());
    }

    @Test
    void testMissingColumn() {
        assertThrows(ConfigurationException.class, () -> ValueCounter.count(input, "shape", options(1, 10)));
    }
}
