package com.umitunal.qrunner.config;

/**
 * Tuning for the embedded RocksDB job store.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int writeBufferSizeMB;
    private final int maxWriteBuffers;
    private final int blockCacheSizeMB;
    private final int backgroundThreads;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.writeBufferSizeMB = builder.writeBufferSizeMB;
        this.maxWriteBuffers = builder.maxWriteBuffers;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
        this.backgroundThreads = builder.backgroundThreads;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getWriteBufferSizeMB() { return writeBufferSizeMB; }
    public int getMaxWriteBuffers() { return maxWriteBuffers; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }
    public int getBackgroundThreads() { return backgroundThreads; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int writeBufferSizeMB = 16;
        private int maxWriteBuffers = 2;
        private int blockCacheSizeMB = 32;
        private int backgroundThreads = 2;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync every write and keep the write-ahead log.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Default: 16 MB
         */
        public Builder withWriteBufferSize(int sizeMB) {
            this.writeBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 2
         */
        public Builder withMaxWriteBuffers(int count) {
            this.maxWriteBuffers = count;
            return this;
        }

        /**
         * Default: 32 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        /**
         * Flush and compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must contain a value.");
            }
            if (writeBufferSizeMB < 1 || maxWriteBuffers < 1 || blockCacheSizeMB < 1 || backgroundThreads < 1) {
                throw new IllegalArgumentException("Storage sizes and thread counts must be greater than 0.");
            }
            return new StorageConfig(this);
        }
    }
}
