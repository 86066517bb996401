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

package me.golemcore.tustats.domain.model;

import java.util.List;

/**
 * The two bounded rankings produced for one translation unit.
 *
 * @param byCount
 *            prefixes ordered by number of included files, descending
 * @param bySize
 *            prefixes ordered by cumulative size, descending
 */
public record IncludeRankings(List<IncludeStats> byCount, List<IncludeStats> bySize) {

    public IncludeRankings {
        byCount = List.copyOf(byCount);
        bySize = List.copyOf(bySize);
    }

    public static IncludeRankings empty() {
        return new IncludeRankings(List.of(), List.of());
    }
}
