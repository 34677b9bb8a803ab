package com.mini.csvtools.options;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.merge.MergeMode;
import com.mini.csvtools.sort.SortKey;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * 配置上下文
 * 以字符串键值对描述一次运行的配置，再解析成各个类型化的选项对象。
 * 非法的值在解析时抛出 ConfigurationException，此时还没有任何 I/O 发生。
 */
public class CsvToolsContext {

    public static final String CSV_DELIMITER = "csv.delimiter";
    public static final String CSV_QUOTE = "csv.quote";
    public static final String CSV_NULL_VALUE = "csv.null-value";
    public static final String CSV_CHARSET = "csv.charset";
    public static final String CSV_STRICT_ROWS = "csv.strict-rows";
    public static final String CSV_INFER_TYPES = "csv.infer-types";

    public static final String CHUNK_MAX_ROWS = "chunk.max-rows";
    public static final String CHUNK_MAX_BYTES = "chunk.max-bytes";

    public static final String TEMP_DIRECTORY = "temp.directory";

    public static final String SORT_KEYS = "sort.keys";
    public static final String SORT_RANDOM = "sort.random";
    public static final String SORT_SEED = "sort.seed";
    public static final String SORT_MAX_OPEN_SEGMENTS = "sort.max-open-segments";

    public static final String MERGE_MODE = "merge.mode";
    public static final String MERGE_KEYS = "merge.keys";
    public static final String MERGE_STRICT_TYPES = "merge.strict-types";
    public static final String MERGE_REMOVE_MERGED = "merge.remove-merged";

    public static final String TRANSFORM_WORKERS = "transform.workers";
    public static final String TRANSFORM_QUEUE_DEPTH = "transform.queue-depth";
    public static final String TRANSFORM_PRESERVE_ORDER = "transform.preserve-order";
    public static final String TRANSFORM_FAIL_FAST = "transform.fail-fast";

    private final Map<String, String> options;

    private CsvToolsContext(Map<String, String> options) {
        this.options = new HashMap<>(options);
    }

    public Map<String, String> getOptions() {
        return new HashMap<>(options);
    }

    public String getOption(String key) {
        return options.get(key);
    }

    public String getOption(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    public CsvOptions toCsvOptions() {
        CsvOptions.Builder builder = CsvOptions.builder();
        if (options.containsKey(CSV_DELIMITER)) {
            builder.delimiter(parseChar(CSV_DELIMITER));
        }
        if (options.containsKey(CSV_QUOTE)) {
            builder.quote(parseChar(CSV_QUOTE));
        }
        if (options.containsKey(CSV_NULL_VALUE)) {
            builder.nullValue(options.get(CSV_NULL_VALUE));
        }
        if (options.containsKey(CSV_CHARSET)) {
            String name = options.get(CSV_CHARSET);
            try {
                builder.charset(Charset.forName(name));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                throw new ConfigurationException("Invalid value for " + CSV_CHARSET + ": " + name, e);
            }
        }
        builder.strictRows(parseBoolean(CSV_STRICT_ROWS, true));
        builder.inferTypes(parseBoolean(CSV_INFER_TYPES, false));
        return builder.build();
    }

    public ChunkBudget toChunkBudget() {
        if (!options.containsKey(CHUNK_MAX_ROWS) && !options.containsKey(CHUNK_MAX_BYTES)) {
            return ChunkBudget.defaults();
        }
        return ChunkBudget.of(parseCount(CHUNK_MAX_ROWS, 0), parseLong(CHUNK_MAX_BYTES, 0));
    }

    /**
     * 解析排序选项：sort.keys 与 sort.random 二选一，随机排序必须给出 sort.seed
     */
    public SortOptions toSortOptions() {
        boolean random = parseBoolean(SORT_RANDOM, false);
        String keys = options.get(SORT_KEYS);
        SortKey sortKey;
        if (random) {
            if (keys != null) {
                throw new ConfigurationException(SORT_KEYS + " and " + SORT_RANDOM + " cannot both be set");
            }
            if (!options.containsKey(SORT_SEED)) {
                throw new ConfigurationException("Random sort requires an explicit " + SORT_SEED);
            }
            sortKey = SortKey.random(parseLong(SORT_SEED, 0));
        } else {
            if (keys == null) {
                throw new ConfigurationException("Either " + SORT_KEYS + " or " + SORT_RANDOM + " must be set");
            }
            sortKey = SortKey.parse(keys);
        }

        SortOptions.Builder builder = SortOptions.builder()
                .sortKey(sortKey)
                .chunkBudget(toChunkBudget())
                .csvOptions(toCsvOptions())
                .maxOpenSegments(parseCount(SORT_MAX_OPEN_SEGMENTS, 0));
        if (options.containsKey(TEMP_DIRECTORY)) {
            String directory = options.get(TEMP_DIRECTORY);
            try {
                builder.tempDirectory(Paths.get(directory));
            } catch (InvalidPathException e) {
                throw new ConfigurationException("Invalid value for " + TEMP_DIRECTORY + ": " + directory, e);
            }
        }
        return builder.build();
    }

    public MergeOptions toMergeOptions() {
        MergeOptions.Builder builder = MergeOptions.builder()
                .mode(MergeMode.parse(getOption(MERGE_MODE, "concatenate")))
                .strictTypes(parseBoolean(MERGE_STRICT_TYPES, true))
                .removeMerged(parseBoolean(MERGE_REMOVE_MERGED, false))
                .csvOptions(toCsvOptions())
                .chunkBudget(toChunkBudget());
        if (options.containsKey(MERGE_KEYS)) {
            builder.key(SortKey.parse(options.get(MERGE_KEYS)));
        }
        return builder.build();
    }

    public TransformOptions toTransformOptions() {
        TransformOptions.Builder builder = TransformOptions.builder()
                .preserveOrder(parseBoolean(TRANSFORM_PRESERVE_ORDER, true))
                .failFast(parseBoolean(TRANSFORM_FAIL_FAST, true))
                .queueDepth(parseCount(TRANSFORM_QUEUE_DEPTH, 0))
                .csvOptions(toCsvOptions())
                .chunkBudget(toChunkBudget());
        if (options.containsKey(TRANSFORM_WORKERS)) {
            builder.workers(parseCount(TRANSFORM_WORKERS, 0));
        }
        return builder.build();
    }

    private char parseChar(String key) {
        String value = options.get(key);
        if (value == null || value.length() != 1) {
            throw new ConfigurationException("Invalid value for " + key + ": expected a single character, got '"
                    + value + "'");
        }
        return value.charAt(0);
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        throw new ConfigurationException("Invalid value for " + key + ": expected true or false, got '" + value + "'");
    }

    private long parseLong(String key, long defaultValue) {
        String value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + key + ": expected a number, got '" + value + "'", e);
        }
    }

    private int parseCount(String key, int defaultValue) {
        long parsed = parseLong(key, defaultValue);
        if (parsed < 0 || parsed > Integer.MAX_VALUE) {
            throw new ConfigurationException("Value for " + key + " is out of range: " + parsed);
        }
        return (int) parsed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> options = new HashMap<>();

        public Builder option(String key, String value) {
            this.options.put(key, value);
            return this;
        }

        public Builder options(Map<String, String> options) {
            this.options.putAll(options);
            return this;
        }

        public CsvToolsContext build() {
            for (Map.Entry<String, String> entry : options.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new ConfigurationException("Option keys and values cannot be null: " + entry);
                }
            }
            return new CsvToolsContext(options);
        }
    }

    @Override
    public String toString() {
        return "CsvToolsContext{options=" + options + '}';
    }
}
