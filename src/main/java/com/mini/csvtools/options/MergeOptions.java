package com.mini.csvtools.options;

import com.mini.csvtools.exception.ConfigurationException;
import com.mini.csvtools.merge.MergeMode;
import com.mini.csvtools.sort.SortKey;
import com.mini.csvtools.utils.CancellationSignal;

/**
 * 异构合并选项
 */
public class MergeOptions {

    private final MergeMode mode;

    /** 按键交错时使用的键，CONCATENATE 模式忽略 */
    private final SortKey key;

    /** 列类型冲突时是否报错（仅在 CsvOptions.inferTypes 开启时有意义） */
    private final boolean strictTypes;

    private final CsvOptions csvOptions;
    private final ChunkBudget chunkBudget;

    /** 合并成功后删除输入文件 */
    private final boolean removeMerged;

    private final CancellationSignal cancellation;

    private MergeOptions(Builder builder) {
        this.mode = builder.mode;
        this.key = builder.key;
        this.strictTypes = builder.strictTypes;
        this.csvOptions = builder.csvOptions;
        this.chunkBudget = builder.chunkBudget;
        this.removeMerged = builder.removeMerged;
        this.cancellation = builder.cancellation;
    }

    public static MergeOptions defaults() {
        return builder().build();
    }

    public MergeMode getMode() {
        return mode;
    }

    public SortKey getKey() {
        return key;
    }

    public boolean isStrictTypes() {
        return strictTypes;
    }

    public CsvOptions getCsvOptions() {
        return csvOptions;
    }

    public ChunkBudget getChunkBudget() {
        return chunkBudget;
    }

    public boolean isRemoveMerged() {
        return removeMerged;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MergeMode mode = MergeMode.CONCATENATE;
        private SortKey key;
        private boolean strictTypes = true;
        private CsvOptions csvOptions = CsvOptions.defaults();
        private ChunkBudget chunkBudget = ChunkBudget.defaults();
        private boolean removeMerged = false;
        private CancellationSignal cancellation = CancellationSignal.none();

        public Builder mode(MergeMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder key(SortKey key) {
            this.key = key;
            return this;
        }

        public Builder keyColumns(String... columns) {
            this.key = SortKey.ascending(columns);
            return this;
        }

        public Builder strictTypes(boolean strictTypes) {
            this.strictTypes = strictTypes;
            return this;
        }

        public Builder csvOptions(CsvOptions csvOptions) {
            this.csvOptions = csvOptions;
            return this;
        }

        public Builder chunkBudget(ChunkBudget chunkBudget) {
            this.chunkBudget = chunkBudget;
            return this;
        }

        public Builder removeMerged(boolean removeMerged) {
            this.removeMerged = removeMerged;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public MergeOptions build() {
            if (mode == null || csvOptions == null || chunkBudget == null || cancellation == null) {
                throw new ConfigurationException("Merge options cannot contain null settings");
            }
            if (mode == MergeMode.INTERLEAVE_BY_KEY) {
                if (key == null) {
                    throw new ConfigurationException("Interleave-by-key merge needs key columns");
                }
                if (key.isRandom()) {
                    throw new ConfigurationException("Interleave-by-key merge cannot use a random key");
                }
            }
            return new MergeOptions(this);
        }
    }

    @Override
    public String toString() {
        return "MergeOptions{" +
                "mode=" + mode +
                ", key=" + key +
                ", strictTypes=" + strictTypes +
                ", removeMerged=" + removeMerged +
                ", chunkBudget=" + chunkBudget +
                '}';
    }
}
