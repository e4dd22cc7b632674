package com.umitunal.tempo.config;

import java.util.Properties;

/**
 * Configuration for the RocksDB job store.
 */
public class StorageConfig {
    static final String PREFIX = "tempo.storage.";

    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    /**
     * Reads {@code tempo.storage.*} keys. {@code tempo.storage.data-directory}
     * is required.
     */
    public static StorageConfig fromProperties(Properties properties) {
        ConfigProperties props = new ConfigProperties(properties);
        String directory = props.getString(PREFIX + "data-directory", null);
        if (directory == null) {
            throw new IllegalArgumentException("Missing required property " + PREFIX + "data-directory");
        }
        Builder defaults = new Builder(directory);
        return defaults
                .withDurableWrites(props.getBoolean(PREFIX + "durable-writes", defaults.durableWrites))
                .withMemoryBufferSize(props.getInt(PREFIX + "memory-buffer-mb", defaults.memoryBufferSizeMB))
                .withMaxMemoryBuffers(props.getInt(PREFIX + "max-memory-buffers", defaults.maxMemoryBuffers))
                .withBackgroundThreads(props.getInt(PREFIX + "background-threads", defaults.backgroundThreads))
                .withBlockCacheSize(props.getInt(PREFIX + "block-cache-mb", defaults.blockCacheSizeMB))
                .build();
    }

    public static StorageConfig fromClasspath(String resource) {
        return fromProperties(ConfigProperties.loadClasspath(resource));
    }

    @Override
    public String toString() {
        return "StorageConfig{dataDirectory='" + dataDirectory + "', durableWrites=" + durableWrites + "}";
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = false;
        private int memoryBufferSizeMB = 64;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 4;
        private int blockCacheSizeMB = 64;

        private Builder(String dataDirectory) {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be empty");
            }
            this.dataDirectory = dataDirectory;
        }

        /**
         * Fsync the write-ahead log on every commit. The log itself is always
         * on; without this a machine crash may lose the last commits, a
         * process crash does not.
         * Default: false
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Memtable size per column family in MB.
         * Default: 64 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = positive("memoryBufferSizeMB", sizeMB);
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = positive("maxMemoryBuffers", count);
            return this;
        }

        /**
         * Flush and compaction threads.
         * Default: 4
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = positive("backgroundThreads", count);
            return this;
        }

        /**
         * Shared LRU block cache in MB.
         * Default: 64 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = positive("blockCacheSizeMB", sizeMB);
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }

        private static int positive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0, got " + value);
            }
            return value;
        }
    }
}
