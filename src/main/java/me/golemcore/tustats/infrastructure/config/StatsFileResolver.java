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

import me.golemcore.tustats.domain.exception.ConfigResolutionException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves where the statistics store lives.
 */
public final class StatsFileResolver {

    public static final String DEFAULT_STORE_NAME = "tu_stats.db";

    private static final String USER_HOME_PLACEHOLDER = "${user.home}";

    private StatsFileResolver() {
    }

    /**
     * Returns {@code stats-file} when configured, otherwise
     * {@code <cache-dir>/tu_stats.db}.
     *
     * @throws ConfigResolutionException
     *             if neither yields a usable path
     */
    public static Path resolve(TuStatsProperties properties) {
        String statsFile = properties.getStatsFile();
        if (statsFile != null && !statsFile.isBlank()) {
            return toPath(statsFile.trim());
        }
        return resolveCacheDir(properties.getCacheDir()).resolve(DEFAULT_STORE_NAME);
    }

    static Path resolveCacheDir(String cacheDir) {
        if (cacheDir == null || cacheDir.isBlank()) {
            throw new ConfigResolutionException("No stats file configured and tustats.cache-dir is blank");
        }
        String expanded = cacheDir.trim();
        if (expanded.contains(USER_HOME_PLACEHOLDER)) {
            String userHome = System.getProperty("user.home");
            if (userHome == null || userHome.isBlank()) {
                throw new ConfigResolutionException("Cannot expand " + USER_HOME_PLACEHOLDER
                        + " in cache dir: user.home is not set");
            }
            expanded = expanded.replace(USER_HOME_PLACEHOLDER, userHome);
        }
        return toPath(expanded);
    }

    private static Path toPath(String value) {
        try {
            return Paths.get(value).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ConfigResolutionException("Invalid stats store path: " + value, e);
        }
    }
}
