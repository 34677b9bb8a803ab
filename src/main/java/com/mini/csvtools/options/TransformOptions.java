package com.mini.csvtools.options;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.utils.CancellationSignal;

/**
 * 并行转换选项
 *
 * 默认值：
 * - workers: CPU 核数
 * - queueDepth: 与 workers 相同
 * - preserveOrder: true，输出顺序与单线程运行一致
 * - failFast: true，第一个失败即中止
 */
public class TransformOptions {

    private final int workers;
    private final int queueDepth;
    private final boolean preserveOrder;
    private final boolean failFast;
    private final ChunkBudget chunkBudget;
    private final CsvOptions csvOptions;
    private final ReadOptions readOptions;
    private final CancellationSignal cancellation;

    private TransformOptions(Builder builder) {
        this.workers = builder.workers;
        this.queueDepth = builder.queueDepth > 0 ? builder.queueDepth : builder.workers;
        this.preserveOrder = builder.preserveOrder;
        this.failFast = builder.failFast;
        this.chunkBudget = builder.chunkBudget;
        this.csvOptions = builder.csvOptions;
        this.readOptions = builder.readOptions;
        this.cancellation = builder.cancellation;
    }

    public static TransformOptions defaults() {
        return builder().build();
    }

    public int getWorkers() {
        return workers;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    /**
     * 同时在途（已提交未写出）的 chunk 上限
     */
    public int getMaxInFlight() {
        return workers + queueDepth;
    }

    public boolean isPreserveOrder() {
        return preserveOrder;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public ChunkBudget getChunkBudget() {
        return chunkBudget;
    }

    public CsvOptions getCsvOptions() {
        return csvOptions;
    }

    public ReadOptions getReadOptions() {
        return readOptions;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    public Builder toBuilder() {
        return new Builder()
                .workers(workers)
                .queueDepth(queueDepth)
                .preserveOrder(preserveOrder)
                .failFast(failFast)
                .chunkBudget(chunkBudget)
                .csvOptions(csvOptions)
                .readOptions(readOptions)
                .cancellation(cancellation);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workers = Runtime.getRuntime().availableProcessors();
        private int queueDepth = 0;
        private boolean preserveOrder = true;
        private boolean failFast = true;
        private ChunkBudget chunkBudget = ChunkBudget.defaults();
        private CsvOptions csvOptions = CsvOptions.defaults();
        private ReadOptions readOptions = ReadOptions.all();
        private CancellationSignal cancellation = CancellationSignal.none();

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        /**
         * 任务队列容量，0 表示与 workers 相同
         */
        public Builder queueDepth(int queueDepth) {
            this.queueDepth = queueDepth;
            return this;
        }

        public Builder preserveOrder(boolean preserveOrder) {
            this.preserveOrder = preserveOrder;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
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

        public Builder readOptions(ReadOptions readOptions) {
            this.readOptions = readOptions;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public TransformOptions build() {
            if (workers <= 0) {
                throw new ConfigurationException("Worker count must be positive, got " + workers);
            }
            if (queueDepth < 0) {
                throw new ConfigurationException("Task queue depth cannot be negative, got " + queueDepth);
            }
            if (chunkBudget == null || csvOptions == null || readOptions == null || cancellation == null) {
                throw new ConfigurationException("Transform options cannot contain null settings");
            }
            return new TransformOptions(this);
        }
    }

    @Override
    public String toString() {
        return "TransformOptions{" +
                "workers=" + workers +
                ", queueDepth=" + queueDepth +
                ", preserveOrder=" + preserveOrder +
                ", failFast=" + failFast +
                ", chunkBudget=" + chunkBudget +
                '}';
    }
}
