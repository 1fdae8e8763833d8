/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.staffbook.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Settings of a {@link FileRecordStore}.
 * <p>
 * Each {@link Setting} not given to the {@link Builder} is looked up as the
 * system property {@code staffbook.<name>}, then the environment variable
 * {@code STAFFBOOK_<SETTING>}, then the same key in {@code staffbook.properties}
 * (classpath first, working directory second). Unset settings take their default.
 * <p>
 * Sizes are byte counts with an optional {@code KB}, {@code MB} or {@code GB}
 * suffix (binary multiples), e.g. {@code staffbook.minFreeSpace=256MB}.
 * A value that does not parse is rejected rather than replaced by the default.
 *
 * <pre>
 * RecordStoreConfig config = RecordStoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/staffbook"))
 *     .maxCollectionSize(RecordStoreConfig.parseSize("16MB"))
 *     .build();
 * </pre>
 */
public final class RecordStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(RecordStoreConfig.class);

    static final String PROPERTIES_FILE = "staffbook.properties";

    private static final long KB = 1024L;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    /**
     * The externally settable keys.
     */
    public enum Setting {
        DATA_DIR("dataDir"),
        SYNC_ENABLED("syncEnabled"),
        VERIFY_WRITES("verifyWrites"),
        MIN_FREE_SPACE("minFreeSpace"),
        MAX_COLLECTION_SIZE("maxCollectionSize");

        private final String shortName;

        Setting(String shortName) {
            this.shortName = shortName;
        }

        /** Key used for system properties and {@code staffbook.properties}. */
        public String propertyKey() {
            return "staffbook." + shortName;
        }

        public String environmentVariable() {
            return "STAFFBOOK_" + name();
        }
    }

    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final long minFreeSpace;
    private final long maxCollectionSize;

    private RecordStoreConfig(Path dataDir, boolean syncEnabled, boolean verifyWrites,
                              long minFreeSpace, long maxCollectionSize) {
        this.dataDir = dataDir;
        this.syncEnabled = syncEnabled;
        this.verifyWrites = verifyWrites;
        this.minFreeSpace = minFreeSpace;
        this.maxCollectionSize = maxCollectionSize;
    }

    /** Directory holding one JSON file per collection. Default {@code ~/.staffbook/data}. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether replaced files and the directory are fsynced. Default true. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether a temp file is read back and parsed before it replaces the live file. Default false. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Bytes that must stay free on the data volume for open and writes to proceed. Default 64 MB. */
    public long minFreeSpace() {
        return minFreeSpace;
    }

    /** Largest serialized collection, in bytes. Default 64 MB. */
    public long maxCollectionSize() {
        return maxCollectionSize;
    }

    @Override
    public String toString() {
        return "RecordStoreConfig{dataDir=" + dataDir
                + ", syncEnabled=" + syncEnabled
                + ", verifyWrites=" + verifyWrites
                + ", minFreeSpace=" + formatSize(minFreeSpace)
                + ", maxCollectionSize=" + formatSize(maxCollectionSize)
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Configuration taken entirely from the external sources and defaults. */
    public static RecordStoreConfig load() {
        return builder().build();
    }

    // ========================================================================
    // Size values
    // ========================================================================

    /**
     * Parses a byte count such as {@code 4096}, {@code 512KB}, {@code 64MB} or {@code 1GB}.
     *
     * @throws IllegalArgumentException if the text is not a non-negative size
     */
    public static long parseSize(String text) {
        String value = text.trim().toUpperCase(Locale.ROOT);
        long multiplier = 1;
        if (value.endsWith("KB")) {
            multiplier = KB;
        } else if (value.endsWith("MB")) {
            multiplier = MB;
        } else if (value.endsWith("GB")) {
            multiplier = GB;
        }
        if (multiplier != 1) {
            value = value.substring(0, value.length() - 2).trim();
        }
        try {
            long amount = Long.parseLong(value);
            if (amount < 0) {
                throw new IllegalArgumentException("Size must not be negative: " + text);
            }
            return Math.multiplyExact(amount, multiplier);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Not a size: '" + text + "'", e);
        }
    }

    static String formatSize(long bytes) {
        if (bytes >= MB && bytes % MB == 0) {
            return bytes / MB + "MB";
        }
        if (bytes >= KB && bytes % KB == 0) {
            return bytes / KB + "KB";
        }
        return bytes + "B";
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Collects explicit values; {@link #build()} fills the rest from the
     * external sources.
     */
    public static final class Builder {

        private final Map<Setting, String> explicit = new EnumMap<>(Setting.class);

        private Builder() {
        }

        public Builder dataDir(Path dataDir) {
            explicit.put(Setting.DATA_DIR, dataDir.toString());
            return this;
        }

        public Builder dataDir(String dataDir) {
            return dataDir(Path.of(dataDir));
        }

        public Builder syncEnabled(boolean syncEnabled) {
            explicit.put(Setting.SYNC_ENABLED, Boolean.toString(syncEnabled));
            return this;
        }

        public Builder verifyWrites(boolean verifyWrites) {
            explicit.put(Setting.VERIFY_WRITES, Boolean.toString(verifyWrites));
            return this;
        }

        /** Minimum free space in bytes. */
        public Builder minFreeSpace(long bytes) {
            explicit.put(Setting.MIN_FREE_SPACE, Long.toString(bytes));
            return this;
        }

        /** Maximum serialized collection size in bytes. */
        public Builder maxCollectionSize(long bytes) {
            explicit.put(Setting.MAX_COLLECTION_SIZE, Long.toString(bytes));
            return this;
        }

        /**
         * @throws IllegalArgumentException if any resolved value is malformed
         */
        public RecordStoreConfig build() {
            Properties file = null;
            Map<Setting, String> resolved = new EnumMap<>(Setting.class);
            for (Setting setting : Setting.values()) {
                String value = explicit.get(setting);
                if (value == null) {
                    if (file == null) {
                        file = loadPropertiesFile();
                    }
                    value = lookup(setting, file);
                }
                if (value != null) {
                    resolved.put(setting, value.trim());
                }
            }

            String dir = resolved.get(Setting.DATA_DIR);
            return new RecordStoreConfig(
                    dir != null ? Path.of(dir) : Path.of(System.getProperty("user.home"), ".staffbook", "data"),
                    flag(Setting.SYNC_ENABLED, resolved.get(Setting.SYNC_ENABLED), true),
                    flag(Setting.VERIFY_WRITES, resolved.get(Setting.VERIFY_WRITES), false),
                    size(Setting.MIN_FREE_SPACE, resolved.get(Setting.MIN_FREE_SPACE), 64 * MB),
                    size(Setting.MAX_COLLECTION_SIZE, resolved.get(Setting.MAX_COLLECTION_SIZE), 64 * MB));
        }

        private static String lookup(Setting setting, Properties file) {
            String[] candidates = {
                    System.getProperty(setting.propertyKey()),
                    System.getenv(setting.environmentVariable()),
                    file.getProperty(setting.propertyKey())
            };
            for (String candidate : candidates) {
                if (candidate != null && !candidate.isBlank()) {
                    return candidate;
                }
            }
            return null;
        }

        private static boolean flag(Setting setting, String value, boolean defaultValue) {
            if (value == null) {
                return defaultValue;
            }
            if (value.equalsIgnoreCase("true")) {
                return true;
            }
            if (value.equalsIgnoreCase("false")) {
                return false;
            }
            throw new IllegalArgumentException(setting.propertyKey() + " must be true or false, got '" + value + "'");
        }

        private static long size(Setting setting, String value, long defaultValue) {
            if (value == null) {
                return defaultValue;
            }
            try {
                return parseSize(value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(setting.propertyKey() + ": " + e.getMessage(), e);
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();
            try (InputStream in = RecordStoreConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
                if (in != null) {
                    props.load(in);
                    LOG.debug("Loaded {} from classpath", PROPERTIES_FILE);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Skipping unreadable classpath {}: {}", PROPERTIES_FILE, e.getMessage());
            }

            Path local = Path.of(PROPERTIES_FILE);
            if (Files.isRegularFile(local)) {
                try (InputStream in = Files.newInputStream(local)) {
                    props.load(in);
                    LOG.debug("Loaded {}", local.toAbsolutePath());
                } catch (IOException e) {
                    LOG.warn("Skipping unreadable {}: {}", local.toAbsolutePath(), e.getMessage());
                }
            }
            return props;
        }
    }
}
