/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.tustats.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tustats.domain.exception.StorageOpenException;
import me.golemcore.tustats.domain.exception.StorageReadException;
import me.golemcore.tustats.domain.exception.StorageWriteException;
import me.golemcore.tustats.domain.model.TranslationUnitStats;
import me.golemcore.tustats.port.outbound.StatsStore;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * RocksDB implementation of {@link StatsStore}.
 *
 * <p>
 * Records are stored as JSON in the {@code tu_stats} column family of a
 * RocksDB directory, keyed by
 * {@code <epoch seconds>.<nanos>:<input file>}. The timestamp part is fixed
 * width, so keys iterate in chronological order.
 *
 * <p>
 * Every insert is written with {@code sync=true}: the write-ahead log is
 * fsynced before {@link #insert} returns.
 *
 * <p>
 * RocksDB admits a single read-write opener per directory. A second process
 * calling {@link #open} on a store that is already open fails with
 * {@link StorageOpenException}; {@link #openReadOnly} takes no lock and can
 * run alongside the writer.
 *
 * <p>
 * {@link #insert} and {@link #scan} share a read lock and run concurrently.
 * {@link #close} takes the write lock, so it waits for calls in flight and the
 * native handles are never released under them.
 */
@Slf4j
public final class RocksDbStatsStore implements StatsStore {

    static final String COLUMN_FAMILY = "tu_stats";

    private static final byte[] COLUMN_FAMILY_NAME = COLUMN_FAMILY.getBytes(StandardCharsets.UTF_8);
    private static final String LOG_PREFIX = "[TuStatsStore]";
    private static final String CURRENT_FILE = "CURRENT";
    private static final String KEY_FORMAT = "%020d.%09d:%s";

    static {
        RocksDB.loadLibrary();
    }

    private final Path path;
    private final ObjectMapper objectMapper;
    private final boolean readOnly;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions columnFamilyOptions;
    private final WriteOptions writeOptions;
    private final RocksDB db;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle statsFamily;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();

    private RocksDbStatsStore(Path path, ObjectMapper objectMapper, boolean readOnly, DBOptions dbOptions,
            ColumnFamilyOptions columnFamilyOptions, RocksDB db, List<ColumnFamilyHandle> handles,
            ColumnFamilyHandle statsFamily) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.readOnly = readOnly;
        this.dbOptions = dbOptions;
        this.columnFamilyOptions = columnFamilyOptions;
        this.writeOptions = new WriteOptions().setSync(true);
        this.db = db;
        this.handles = handles;
        this.statsFamily = statsFamily;
    }

    /**
     * Opens the store at {@code path} for reading and writing, creating it if
     * needed.
     *
     * @throws StorageOpenException
     *             if the path is not a usable store directory or another
     *             process holds it open for writing
     */
    public static RocksDbStatsStore open(Path path, ObjectMapper objectMapper) {
        Path root = prepareDirectory(path);
        DBOptions dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        ColumnFamilyOptions columnFamilyOptions = new ColumnFamilyOptions();
        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, columnFamilyOptions),
                new ColumnFamilyDescriptor(COLUMN_FAMILY_NAME, columnFamilyOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOptions, root.toString(), descriptors, handles);
            log.info("{} Opened stats store at {}", LOG_PREFIX, root);
            return new RocksDbStatsStore(root, objectMapper, false, dbOptions, columnFamilyOptions, db, handles,
                    handles.get(1));
        } catch (RocksDBException e) {
            columnFamilyOptions.close();
            dbOptions.close();
            throw new StorageOpenException("Failed to open stats store at " + root, e);
        }
    }

    /**
     * Opens an existing store without taking the writer lock. Inserts through
     * the returned store fail with {@link StorageWriteException}.
     *
     * @throws StorageOpenException
     *             if {@code path} does not hold a store
     */
    public static RocksDbStatsStore openReadOnly(Path path, ObjectMapper objectMapper) {
        Path root = path.toAbsolutePath().normalize();
        if (!exists(root)) {
            throw new StorageOpenException("No stats store found at " + root);
        }
        boolean hasStatsFamily;
        try (Options options = new Options()) {
            hasStatsFamily = RocksDB.listColumnFamilies(options, root.toString()).stream()
                    .anyMatch(name -> Arrays.equals(name, COLUMN_FAMILY_NAME));
        } catch (RocksDBException e) {
            throw new StorageOpenException("Failed to inspect stats store at " + root, e);
        }

        DBOptions dbOptions = new DBOptions();
        ColumnFamilyOptions columnFamilyOptions = new ColumnFamilyOptions();
        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, columnFamilyOptions));
        if (hasStatsFamily) {
            descriptors.add(new ColumnFamilyDescriptor(COLUMN_FAMILY_NAME, columnFamilyOptions));
        }
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.openReadOnly(dbOptions, root.toString(), descriptors, handles);
            log.debug("{} Opened stats store read-only at {}", LOG_PREFIX, root);
            return new RocksDbStatsStore(root, objectMapper, true, dbOptions, columnFamilyOptions, db, handles,
                    hasStatsFamily ? handles.get(1) : null);
        } catch (RocksDBException e) {
            columnFamilyOptions.close();
            dbOptions.close();
            throw new StorageOpenException("Failed to open stats store read-only at " + root, e);
        }
    }

    /**
     * Whether {@code path} already holds a store.
     */
    public static boolean exists(Path path) {
        return Files.isRegularFile(path.resolve(CURRENT_FILE));
    }

    static String keyOf(TranslationUnitStats stats) {
        Instant timestamp = stats.getTimestamp();
        return String.format(Locale.ROOT, KEY_FORMAT,
                timestamp.getEpochSecond(), timestamp.getNano(), stats.getInputFile());
    }

    @Override
    public void insert(TranslationUnitStats stats) {
        if (readOnly) {
            throw new StorageWriteException("Stats store at " + path + " is open read-only");
        }
        validate(stats);

        String key = keyOf(stats);
        byte[] value;
        try {
            value = objectMapper.writeValueAsBytes(stats);
        } catch (JsonProcessingException e) {
            throw new StorageWriteException("Failed to serialize stats for " + stats.getInputFile(), e);
        }

        lifecycleLock.readLock().lock();
        try {
            checkOpen();
            db.put(statsFamily, writeOptions, key.getBytes(StandardCharsets.UTF_8), value);
        } catch (RocksDBException e) {
            throw new StorageWriteException("Failed to insert stats for " + stats.getInputFile(), e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
        log.debug("{} Stored {}", LOG_PREFIX, key);
    }

    @Override
    public List<TranslationUnitStats> scan() {
        lifecycleLock.readLock().lock();
        try {
            checkOpen();
            if (statsFamily == null) {
                return new ArrayList<>();
            }

            List<TranslationUnitStats> records = new ArrayList<>();
            try (RocksIterator iterator = db.newIterator(statsFamily)) {
                for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                    records.add(decode(iterator.key(), iterator.value()));
                }
                iterator.status();
            } catch (RocksDBException e) {
                throw new StorageReadException("Failed to iterate stats store at " + path, e);
            }
            return records;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private static void validate(TranslationUnitStats stats) {
        if (stats.getInputFile() == null || stats.getTimestamp() == null) {
            throw new StorageWriteException("Stats record needs an input file and a timestamp");
        }
        if (stats.getPreprocessedSize() < 0 || stats.getNumIncludes() < 0 || stats.getDistRetryCount() < 0) {
            throw new StorageWriteException("Negative counter in stats for " + stats.getInputFile());
        }
        if (isInvalid(stats.getPreprocessDuration()) || isInvalid(stats.getCompileDuration())) {
            throw new StorageWriteException("Missing or negative duration in stats for " + stats.getInputFile());
        }
        if (stats.getTopIncludesByCount() == null || stats.getTopIncludesBySize() == null) {
            throw new StorageWriteException("Missing include rankings in stats for " + stats.getInputFile());
        }
    }

    private static boolean isInvalid(Duration duration) {
        return duration == null || duration.isNegative();
    }

    private TranslationUnitStats decode(byte[] key, byte[] value) {
        String keyText = new String(key, StandardCharsets.UTF_8);
        TranslationUnitStats stats;
        try {
            stats = objectMapper.readValue(value, TranslationUnitStats.class);
        } catch (IOException e) {
            throw new StorageReadException("Failed to deserialize stats entry " + keyText, e);
        }
        if (stats == null) {
            throw new StorageReadException("Empty stats entry " + keyText);
        }
        return stats;
    }

    @Override
    public Path getPath() {
        return path;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public void close() {
        lifecycleLock.writeLock().lock();
        try {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            for (ColumnFamilyHandle handle : handles) {
                handle.close();
            }
            db.close();
            writeOptions.close();
            columnFamilyOptions.close();
            dbOptions.close();
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        log.debug("{} Closed stats store at {}", LOG_PREFIX, path);
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Stats store at " + path + " is closed");
        }
    }

    private static Path prepareDirectory(Path path) {
        Path root = path.toAbsolutePath().normalize();
        if (Files.exists(root) && !Files.isDirectory(root)) {
            throw new StorageOpenException("Stats store path exists and is not a directory: " + root);
        }
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageOpenException("Failed to create stats store directory " + root, e);
        }
        return root;
    }
}
