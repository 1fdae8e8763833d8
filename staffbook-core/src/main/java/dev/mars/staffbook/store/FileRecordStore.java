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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * File-based implementation of {@link RecordStore}.
 * <p>
 * Each collection is one JSON array of flat objects. This is the default
 * implementation for a single-process deployment.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ staffbook.lock         // exclusive process lock
 *  ├─ employees.json         // one artifact per collection (atomic replace)
 *  ├─ work_logs.json
 *  ├─ ...
 *  └─ employees.backup_...   // quarantined artifact, kept for manual recovery
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Each collection has its own {@link ReentrantLock}. Writes always take the
 * collection lock, so a write issued outside an exclusive section still
 * cannot interleave with a read-modify-write of the same collection. Reads
 * are unlocked.
 * <p>
 * <b>Durability:</b>
 * Writes go to a temp file, which is fsynced, renamed over the live file
 * ({@code ATOMIC_MOVE}), after which the directory is fsynced.
 * <p>
 * <b>Corruption policy:</b>
 * An artifact that cannot be read or is not a JSON array of objects is renamed
 * to {@code <collection>.backup_<UTC timestamp>} and the collection continues
 * as empty. This trades the contents of one corrupt collection for
 * availability of the service; the backup file is the only copy of that data
 * and must be recovered by hand.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock on {@code staffbook.lock} prevents a second
 *       process from opening the same directory.</li>
 *   <li><b>Disk Space Checking:</b> Pre-flight check on open and before large writes.</li>
 *   <li><b>Read-After-Write Verification:</b> Optional re-parse of the temp file before
 *       it replaces the live artifact.</li>
 *   <li><b>Size Limit:</b> Collections whose serialized form exceeds the configured
 *       maximum are rejected before anything is written.</li>
 * </ul>
 *
 * @see RecordStore
 */
public final class FileRecordStore implements RecordStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileRecordStore.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Lock file name */
    private static final String LOCK_FILE = "staffbook.lock";

    /** Live artifact suffix */
    private static final String DATA_SUFFIX = ".json";

    /** Temp artifact suffix */
    private static final String TMP_SUFFIX = ".tmp";

    /** Quarantined artifact infix */
    private static final String BACKUP_INFIX = ".backup_";

    /** Writes above this size re-check free disk space first */
    private static final int LARGE_WRITE_BYTES = 1024 * 1024;

    private static final Pattern COLLECTION_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private static final DateTimeFormatter BACKUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    // ========================================================================
    // State
    // ========================================================================

    private final RecordStoreConfig config;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final long maxCollectionSize;
    private final long minFreeSpace;
    private final ObjectMapper mapper;

    /**
     * One lock per collection name.
     * <p>
     * <b>INVARIANT:</b> every write of a collection happens while its lock is
     * held by the writing thread.
     */
    private final ConcurrentMap<String, ReentrantLock> collectionLocks = new ConcurrentHashMap<>();

    private volatile Path dataDir;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a new FileRecordStore with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     *
     * @see RecordStoreConfig
     */
    public FileRecordStore() {
        this(RecordStoreConfig.load());
    }

    /**
     * Creates a new FileRecordStore with the specified configuration.
     *
     * @param config the store configuration
     */
    public FileRecordStore(RecordStoreConfig config) {
        this.config = config;
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.maxCollectionSize = config.maxCollectionSize();
        this.minFreeSpace = config.minFreeSpace();
        this.mapper = JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();

        LOG.info("FileRecordStore initialized: syncEnabled={}, verifyWrites={}, maxCollectionSize={}, minFreeSpace={}",
                syncEnabled, verifyWrites, RecordStoreConfig.formatSize(maxCollectionSize),
                RecordStoreConfig.formatSize(minFreeSpace));

        if (!syncEnabled) {
            LOG.warn("FileRecordStore created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * Returns the configuration used by this store instance.
     */
    public RecordStoreConfig config() {
        return config;
    }

    /**
     * Returns the directory this store was opened on, or null before open.
     */
    public Path dataDir() {
        return dataDir;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the store using the data directory from the configuration.
     */
    public void open() {
        open(config.dataDir());
    }

    @Override
    public synchronized void open(Path dataDir) {
        if (closed) {
            throw new StorageException("Record store has been closed");
        }
        if (this.dataDir != null) {
            if (this.dataDir.equals(dataDir)) {
                LOG.debug("Record store already open at {}", dataDir);
                return;
            }
            throw new StorageException("Record store already open at " + this.dataDir);
        }
        try {
            LOG.info("Opening record store at: {}", dataDir);
            Files.createDirectories(dataDir);

            acquireExclusiveLock(dataDir);
            checkDiskSpace(dataDir);
            removeStaleTempFiles(dataDir);

            this.dataDir = dataDir;
            LOG.info("Record store opened successfully: {}", dataDir);
        } catch (IOException e) {
            LOG.error("Failed to open record store at {}: {}", dataDir, e.getMessage(), e);
            releaseExclusiveLock();
            throw new StorageException("Failed to open record store at " + dataDir, e);
        } catch (StorageException e) {
            releaseExclusiveLock();
            throw e;
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing record store at: {}", dataDir);
        releaseExclusiveLock();
        LOG.info("Record store closed");
    }

    // ========================================================================
    // Collection Operations
    // ========================================================================

    @Override
    public List<ObjectNode> read(String collection) {
        Path path = collectionPath(collection);
        try {
            List<ObjectNode> records = parse(path);
            LOG.trace("Read {} records from {}", records.size(), collection);
            return records;
        } catch (CorruptCollectionException e) {
            LOG.warn("Collection {} is unreadable: {}", collection, e.getMessage());
            return quarantine(collection, path);
        }
    }

    @Override
    public void write(String collection, List<ObjectNode> records) {
        Path livePath = collectionPath(collection);
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i) == null) {
                throw new IllegalArgumentException("Null record at position " + i + " in " + collection);
            }
        }

        try (ExclusiveSection section = exclusive(collection)) {
            byte[] bytes = serialize(collection, records);
            if (bytes.length > maxCollectionSize) {
                LOG.error("Collection too large: {} is {} bytes (max: {})", collection, bytes.length, maxCollectionSize);
                throw new StorageException("Collection too large: " + collection + " is " + bytes.length +
                        " bytes (max: " + maxCollectionSize + ")");
            }

            Path tmpPath = null;
            try {
                if (bytes.length > LARGE_WRITE_BYTES) {
                    LOG.debug("Large write detected ({} bytes), checking disk space", bytes.length);
                    checkDiskSpace(dataDir);
                }

                tmpPath = Files.createTempFile(dataDir, collection + ".", TMP_SUFFIX);
                writeFully(tmpPath, bytes);

                if (verifyWrites) {
                    verifyWrittenArtifact(tmpPath, records.size());
                }

                // Atomic rename
                Files.move(tmpPath, livePath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
                LOG.trace("Atomic rename: {} -> {}", tmpPath, livePath);

                // Fsync directory (critical on Linux)
                if (syncEnabled) {
                    syncDirectory(dataDir);
                }

                LOG.debug("Wrote {} records to {} ({} bytes)", records.size(), collection, bytes.length);

            } catch (IOException | RuntimeException e) {
                discardTempFile(tmpPath);
                LOG.error("Failed to write collection {}: {}", collection, e.getMessage(), e);
                if (e instanceof StorageException) {
                    throw (StorageException) e;
                }
                throw new StorageException("Failed to write collection " + collection, e);
            }
        }
    }

    @Override
    public ExclusiveSection exclusive(String collection) {
        validateCollectionName(collection);
        ReentrantLock lock = collectionLocks.computeIfAbsent(collection, name -> new ReentrantLock());
        lock.lock();
        LOG.trace("Exclusive section entered: {} (hold count {})", collection, lock.getHoldCount());
        return new Section(collection, lock);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private Path collectionPath(String collection) {
        validateCollectionName(collection);
        Path dir = dataDir;
        if (dir == null || closed) {
            throw new StorageException("Record store is not open");
        }
        return dir.resolve(collection + DATA_SUFFIX);
    }

    private static void validateCollectionName(String collection) {
        if (collection == null || !COLLECTION_NAME.matcher(collection).matches()) {
            throw new IllegalArgumentException("Invalid collection name: " + collection);
        }
    }

    /**
     * Reads and parses one artifact. A missing or blank artifact is an empty
     * collection; anything else that is not an array of objects is corrupt.
     */
    private List<ObjectNode> parse(Path path) throws CorruptCollectionException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            LOG.trace("No artifact at {}, collection is empty", path);
            return new ArrayList<>();
        } catch (IOException e) {
            throw new CorruptCollectionException("cannot read " + path.getFileName() + ": " + e.getMessage(), e);
        }

        if (new String(bytes, StandardCharsets.UTF_8).isBlank()) {
            return new ArrayList<>();
        }

        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new CorruptCollectionException("malformed JSON in " + path.getFileName() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CorruptCollectionException("cannot parse " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CorruptCollectionException("top level of " + path.getFileName() + " is not an array", null);
        }

        List<ObjectNode> records = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new CorruptCollectionException("element " + i + " of " + path.getFileName() + " is not an object", null);
            }
            records.add((ObjectNode) element);
        }
        return records;
    }

    /**
     * Moves a corrupt artifact aside and reports the collection as empty.
     * <p>
     * Runs under the collection lock and re-parses first: a writer may have
     * replaced the artifact between the failed unlocked read and now, and a
     * good artifact must never be quarantined.
     */
    private List<ObjectNode> quarantine(String collection, Path path) {
        try (ExclusiveSection section = exclusive(collection)) {
            try {
                return parse(path);
            } catch (CorruptCollectionException stillCorrupt) {
                LOG.debug("Collection {} still corrupt under lock: {}", collection, stillCorrupt.getMessage());
            }

            Path backupPath = backupPath(collection);
            try {
                Files.move(path, backupPath);
                LOG.warn("Quarantined corrupt collection {}: moved {} -> {}; continuing with an empty collection",
                        collection, path.getFileName(), backupPath.getFileName());
            } catch (NoSuchFileException e) {
                LOG.debug("Corrupt artifact for {} already gone: {}", collection, e.getMessage());
            } catch (IOException e) {
                LOG.error("Could not quarantine {} to {}: {}", path, backupPath, e.getMessage(), e);
            }
            return new ArrayList<>();
        }
    }

    private Path backupPath(String collection) {
        String base = collection + BACKUP_INFIX + BACKUP_STAMP.format(Instant.now());
        Path candidate = dataDir.resolve(base);
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = dataDir.resolve(base + "_" + suffix++);
        }
        return candidate;
    }

    private byte[] serialize(String collection, List<ObjectNode> records) {
        try {
            return mapper.writeValueAsBytes(records);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize collection {}: {}", collection, e.getMessage(), e);
            throw new StorageException("Failed to serialize collection " + collection, e);
        }
    }

    private void writeFully(Path path, byte[] bytes) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        try (FileChannel ch = FileChannel.open(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (syncEnabled) {
                ch.force(true);
                LOG.trace("Synced temp file {}", path.getFileName());
            }
        }
    }

    /**
     * Re-reads the temp artifact and checks it parses back to the expected
     * number of records.
     * <p>
     * This detects silent filesystem corruption where writes appear to succeed
     * but data is not correctly persisted.
     *
     * @throws StorageException if verification fails
     */
    private void verifyWrittenArtifact(Path tmpPath, int expectedRecords) {
        List<ObjectNode> readBack;
        try {
            readBack = parse(tmpPath);
        } catch (CorruptCollectionException e) {
            LOG.error("Write verification failed for {}: {}", tmpPath.getFileName(), e.getMessage());
            throw new StorageException("Write verification failed: " + e.getMessage(), e);
        }
        if (readBack.size() != expectedRecords) {
            LOG.error("Write verification failed: expected {} records, read {}", expectedRecords, readBack.size());
            throw new StorageException("Write verification failed: expected " + expectedRecords +
                    " records but read " + readBack.size() + ". Possible silent data corruption!");
        }
        LOG.trace("Write verification passed for {}", tmpPath.getFileName());
    }

    private void discardTempFile(Path tmpPath) {
        if (tmpPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmpPath);
        } catch (IOException e) {
            LOG.warn("Could not delete temp file {}: {}", tmpPath, e.getMessage());
        }
    }

    /**
     * Deletes temp artifacts left behind by a writer that died before its rename.
     */
    private void removeStaleTempFiles(Path dir) throws IOException {
        try (DirectoryStream<Path> stale = Files.newDirectoryStream(dir, "*" + TMP_SUFFIX)) {
            for (Path tmp : stale) {
                LOG.warn("Removing stale temp file from an interrupted write: {}", tmp.getFileName());
                Files.deleteIfExists(tmp);
            }
        }
    }

    /**
     * Fsyncs a directory to ensure metadata changes (renames) are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     * On Linux (ext4/xfs), this is critical for durability.
     */
    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Acquires an exclusive lock on the data directory to prevent a second process.
     *
     * @throws StorageException if the lock is held elsewhere
     */
    private void acquireExclusiveLock(Path dir) throws IOException {
        Path lockPath = dir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on data directory: " + dir +
                        ". Another process may be using this store.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    /**
     * Releases the exclusive lock and closes the lock channel.
     */
    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
                LOG.trace("Lock channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below minimum threshold
     */
    private void checkDiskSpace(Path dir) throws IOException {
        FileStore store = Files.getFileStore(dir);
        long usableSpace = store.getUsableSpace();

        LOG.trace("Disk space check: {} bytes available, {} bytes required", usableSpace, minFreeSpace);

        if (usableSpace < minFreeSpace) {
            String available = RecordStoreConfig.formatSize(usableSpace);
            String required = RecordStoreConfig.formatSize(minFreeSpace);
            LOG.error("Insufficient disk space: {} available, need at least {}", available, required);
            throw new StorageException(
                    "Insufficient disk space: " + available + " available, need at least " + required + ".");
        }
    }

    // ========================================================================
    // Exclusive Section
    // ========================================================================

    private static final class Section implements ExclusiveSection {
        private final String collection;
        private final ReentrantLock lock;
        private boolean released;

        private Section(String collection, ReentrantLock lock) {
            this.collection = collection;
            this.lock = lock;
        }

        @Override
        public String collection() {
            return collection;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            lock.unlock();
            LOG.trace("Exclusive section released: {}", collection);
        }
    }

    /**
     * An artifact that exists but cannot be used. Never leaves this class.
     */
    private static final class CorruptCollectionException extends Exception {
        private CorruptCollectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
