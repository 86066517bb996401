package me.golemcore.tustats.recorder;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tustats.adapter.outbound.storage.RocksDbStatsStore;
import me.golemcore.tustats.domain.model.IncludeContribution;
import me.golemcore.tustats.domain.model.IncludeRankings;
import me.golemcore.tustats.domain.model.TranslationUnitStats;
import me.golemcore.tustats.domain.service.IncludeStatsAggregator;
import me.golemcore.tustats.infrastructure.config.StatsFileResolver;
import me.golemcore.tustats.infrastructure.config.TuStatsConfiguration;
import me.golemcore.tustats.infrastructure.config.TuStatsProperties;
import me.golemcore.tustats.port.outbound.StatsStore;
import me.golemcore.tustats.port.outbound.StatsStoreOpener;

import java.nio.file.Path;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide sink for translation-unit statistics.
 *
 * <p>
 * The compiler pipeline calls {@link #record} after each compilation without
 * holding a store handle. Recording is best-effort: when no store is installed
 * the call does nothing, and a failed write is logged and dropped so it never
 * reaches the compilation it describes. A write the store accepts is durable.
 *
 * <p>
 * {@link #init} is meant to run once at process start. Calling it again
 * closes the installed store and replaces it. The installed store is never
 * closed otherwise; it lives until the process exits.
 *
 * <p>
 * The lock guards only the installed reference: concurrent {@link #record}
 * calls share the read lock and reach the store in parallel, {@link #init}
 * takes the write lock.
 */
@Slf4j
public final class TuStatsRecorder {

    private static final String LOG_PREFIX = "[TuStats]";

    private static final ReadWriteLock LOCK = new ReentrantReadWriteLock();
    private static StatsStore sink;
    private static volatile int topIncludes = IncludeStatsAggregator.DEFAULT_TOP_N;

    private TuStatsRecorder() {
    }

    /**
     * Installs a store at the configured location, or does nothing when
     * recording is disabled.
     *
     * @throws me.golemcore.tustats.domain.exception.ConfigResolutionException
     *             if no store location can be resolved
     * @throws me.golemcore.tustats.domain.exception.StorageOpenException
     *             if the store cannot be opened
     */
    public static void init(TuStatsProperties properties) {
        init(properties, path -> RocksDbStatsStore.open(path, TuStatsConfiguration.objectMapper()));
    }

    public static void init(TuStatsProperties properties, StatsStoreOpener opener) {
        topIncludes = properties.getTopIncludes();
        if (!properties.isEnabled()) {
            return;
        }

        Path statsFile = StatsFileResolver.resolve(properties);
        LOCK.writeLock().lock();
        try {
            if (sink != null) {
                log.info("{} Replacing stats store {}", LOG_PREFIX, sink.getPath());
                closeQuietly(sink);
                sink = null;
            }
            sink = opener.open(statsFile);
            log.info("{} Recording translation unit stats to {}", LOG_PREFIX, statsFile);
        } finally {
            LOCK.writeLock().unlock();
        }
    }

    /**
     * Persists {@code stats} if a store is installed. Never throws.
     */
    public static void record(TranslationUnitStats stats) {
        if (stats == null) {
            return;
        }
        LOCK.readLock().lock();
        try {
            if (sink == null) {
                return;
            }
            sink.insert(stats);
        } catch (RuntimeException e) {
            log.warn("{} Failed to record TU stats for {}: {}", LOG_PREFIX, stats.getInputFile(), e.getMessage());
        } finally {
            LOCK.readLock().unlock();
        }
    }

    /**
     * Ranks include contributions using the configured top-N bound.
     */
    public static IncludeRankings rankIncludes(Iterable<IncludeContribution> contributions) {
        return IncludeStatsAggregator.aggregate(contributions, topIncludes);
    }

    public static boolean isInitialized() {
        LOCK.readLock().lock();
        try {
            return sink != null;
        } finally {
            LOCK.readLock().unlock();
        }
    }

    static void reset() {
        LOCK.writeLock().lock();
        try {
            if (sink != null) {
                closeQuietly(sink);
                sink = null;
            }
            topIncludes = IncludeStatsAggregator.DEFAULT_TOP_N;
        } finally {
            LOCK.writeLock().unlock();
        }
    }

    private static void closeQuietly(StatsStore store) {
        try {
            store.close();
        } catch (RuntimeException e) {
            log.warn("{} Failed to close stats store {}: {}", LOG_PREFIX, store.getPath(), e.getMessage());
        }
    }
}
