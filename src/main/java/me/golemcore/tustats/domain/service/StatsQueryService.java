package me.golemcore.tustats.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tustats.domain.model.TranslationUnitStats;
import me.golemcore.tustats.infrastructure.config.StatsFileResolver;
import me.golemcore.tustats.infrastructure.config.TuStatsProperties;
import me.golemcore.tustats.port.outbound.StatsStore;
import me.golemcore.tustats.port.outbound.StatsStoreOpener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads every stored record back for reporting. Errors from opening or
 * scanning the store propagate to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatsQueryService {

    private final TuStatsProperties properties;
    private final StatsStoreOpener statsStoreOpener;

    /**
     * Query the configured store.
     */
    public List<TranslationUnitStats> query() {
        return query(null);
    }

    /**
     * Query the store at {@code statsFile}, or the configured store when
     * {@code null}. The result is in store order.
     */
    public List<TranslationUnitStats> query(Path statsFile) {
        Path path = statsFile != null ? statsFile : StatsFileResolver.resolve(properties);
        try (StatsStore store = statsStoreOpener.open(path)) {
            List<TranslationUnitStats> records = store.scan();
            log.debug("[TuStats] Read {} records from {}", records.size(), store.getPath());
            return records;
        }
    }
}
