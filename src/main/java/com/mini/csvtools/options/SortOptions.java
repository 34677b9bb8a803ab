package com.mini.csvtools.options;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.sort.SortKey;
import com.mini.csvtools.utils.CancellationSignal;
import com.mini.csvtools.utils.PathFactory;

import java.nio.file.Path;

/**
 * 外部排序选项
 *
 * 使用示例：
 * <pre>
 * SortOptions options = SortOptions.builder()
 *     .sortKey(SortKey.ascending("id"))
 *     .chunkBudget(ChunkBudget.rows(50000))
 *     .tempDirectory(Paths.get("/data/tmp"))
 *     .build();
 * </pre>
 */
public class SortOptions {

    private final SortKey sortKey;
    private final ChunkBudget chunkBudget;
    private final CsvOptions csvOptions;
    private final PathFactory pathFactory;

    /** 单趟归并最多同时打开的段数，0 表示不限制 */
    private final int maxOpenSegments;

    private final CancellationSignal cancellation;

    private SortOptions(Builder builder) {
        this.sortKey = builder.sortKey;
        this.chunkBudget = builder.chunkBudget;
        this.csvOptions = builder.csvOptions;
        this.pathFactory = builder.pathFactory;
        this.maxOpenSegments = builder.maxOpenSegments;
        this.cancellation = builder.cancellation;
    }

    public SortKey getSortKey() {
        return sortKey;
    }

    public ChunkBudget getChunkBudget() {
        return chunkBudget;
    }

    public CsvOptions getCsvOptions() {
        return csvOptions;
    }

    public PathFactory getPathFactory() {
        return pathFactory;
    }

    public int getMaxOpenSegments() {
        return maxOpenSegments;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SortKey sortKey;
        private ChunkBudget chunkBudget = ChunkBudget.defaults();
        private CsvOptions csvOptions = CsvOptions.defaults();
        private PathFactory pathFactory = PathFactory.systemTemp();
        private int maxOpenSegments = 0;
        private CancellationSignal cancellation = CancellationSignal.none();

        public Builder sortKey(SortKey sortKey) {
            this.sortKey = sortKey;
            return this;
        }

        public Builder chunkBudget(ChunkBudget chunkBudget) {
            this.chunkBudget = chunkBudget;
            return this;
        }

        public Builder csvOptions(CsvOptions csvOptions) {
            this.csvOptions = csvOptions;
            return this;
        }

        public Builder tempDirectory(Path tempDirectory) {
            this.pathFactory = new PathFactory(tempDirectory);
            return this;
        }

        public Builder pathFactory(PathFactory pathFactory) {
            this.pathFactory = pathFactory;
            return this;
        }

        public Builder maxOpenSegments(int maxOpenSegments) {
            this.maxOpenSegments = maxOpenSegments;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public SortOptions build() {
            if (sortKey == null) {
                throw new ConfigurationException("Sort key is required");
            }
            if (chunkBudget == null || csvOptions == null || pathFactory == null || cancellation == null) {
                throw new ConfigurationException("Sort options cannot contain null settings");
            }
            if (maxOpenSegments < 0 || maxOpenSegments == 1) {
                throw new ConfigurationException(
                        "maxOpenSegments must be 0 (unlimited) or at least 2, got " + maxOpenSegments);
            }
            return new SortOptions(this);
        }
    }

    @Override
    public String toString() {
        return "SortOptions{" +
                "sortKey=" + sortKey +
                ", chunkBudget=" + chunkBudget +
                ", maxOpenSegments=" + maxOpenSegments +
                ", tempRoot=" + pathFactory.getTempRoot() +
                '}';
    }
}
