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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Translation-unit statistics settings, bound from
 * {@code application.properties} under the {@code tustats.*} prefix.
 *
 * <p>
 * When {@code stats-file} is unset the store lives at
 * {@code <cache-dir>/tu_stats.db}.
 */
@Component
@ConfigurationProperties(prefix = "tustats")
@Data
public class TuStatsProperties {

    private boolean enabled = false;
    private String statsFile;
    private String cacheDir = "${user.home}/.cache/tustats";
    private int topIncludes = 10;
}
