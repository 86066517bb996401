package me.golemcore.tustats;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Translation-unit statistics for a build-caching tool.
 *
 * <p>
 * Each compilation produces one
 * {@link me.golemcore.tustats.domain.model.TranslationUnitStats} record with
 * top-N include rankings. Records go through the process-wide
 * {@link me.golemcore.tustats.recorder.TuStatsRecorder} into a RocksDB store
 * and are read back for CSV or human-readable reports.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → StatsCommandRunner (show, csv)
 * Domain Layer       → IncludeStatsAggregator, StatsQueryService, StatsExportService
 * Infrastructure     → RocksDbStatsStore, TuStatsRecorder
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code tustats.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TuStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TuStatsApplication.class, args);
    }

}
