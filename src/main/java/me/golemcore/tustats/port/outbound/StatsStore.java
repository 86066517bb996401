package me.golemcore.tustats.port.outbound;

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

import me.golemcore.tustats.domain.model.TranslationUnitStats;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for the durable translation-unit statistics log. Records are written
 * under a key derived from their timestamp and input file and read back by a
 * full scan.
 *
 * <p>
 * Implementations must tolerate concurrent {@link #insert} and {@link #scan}
 * calls from any number of threads without external locking, and
 * {@link #close} must not release resources under a call in flight. Calls
 * made after {@link #close} fail with {@link IllegalStateException}.
 */
public interface StatsStore extends AutoCloseable {

    /**
     * Persist a record. Returns only after the write is durable.
     *
     * @param stats
     *            record to store; an existing record with the same timestamp
     *            and input file is replaced
     * @throws me.golemcore.tustats.domain.exception.StorageWriteException
     *             if the record is incomplete, carries a negative counter or
     *             duration, or cannot be serialized or written
     */
    void insert(TranslationUnitStats stats);

    /**
     * Read every stored record. No ordering is guaranteed.
     *
     * @throws me.golemcore.tustats.domain.exception.StorageReadException
     *             if any stored value cannot be decoded
     */
    List<TranslationUnitStats> scan();

    /**
     * Root directory of the store.
     */
    Path getPath();

    @Override
    void close();
}
