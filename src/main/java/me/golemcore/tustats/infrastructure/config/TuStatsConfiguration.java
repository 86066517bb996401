package me.golemcore.tustats.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tustats.adapter.outbound.storage.RocksDbStatsStore;
import me.golemcore.tustats.port.outbound.StatsStoreOpener;
import me.golemcore.tustats.recorder.TuStatsRecorder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the statistics store and installs the process-wide recorder on
 * startup.
 *
 * <p>
 * With {@code tustats.enabled=false} (the default) the recorder stays unset
 * and recording is a no-op. Otherwise a failure to open the store aborts
 * startup.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class TuStatsConfiguration {

    private final TuStatsProperties properties;

    /**
     * Mapper used for stored records. Also used outside Spring by the
     * recorder's default store opener.
     */
    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Opener for reporting: an existing store is opened read-only so it can be
     * queried while a build holds it open for writing. A missing store is
     * created empty.
     */
    @Bean
    public StatsStoreOpener statsStoreOpener(ObjectMapper objectMapper) {
        return path -> RocksDbStatsStore.exists(path)
                ? RocksDbStatsStore.openReadOnly(path, objectMapper)
                : RocksDbStatsStore.open(path, objectMapper);
    }

    @PostConstruct
    public void init() {
        log.info("TU stats recording: {}", properties.isEnabled() ? "enabled" : "disabled");
        TuStatsRecorder.init(properties);
    }
}
