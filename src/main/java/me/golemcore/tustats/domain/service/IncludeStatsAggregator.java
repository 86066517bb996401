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

import me.golemcore.tustats.domain.model.IncludeContribution;
import me.golemcore.tustats.domain.model.IncludeRankings;
import me.golemcore.tustats.domain.model.IncludeStats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces the include contributions of one translation unit to two top-N
 * rankings of path prefixes: by number of files and by cumulative size.
 *
 * <p>
 * Both rankings sort descending on their key with a stable sort over the
 * prefixes' first-seen order, so equal keys keep input order and the result
 * is deterministic.
 */
public final class IncludeStatsAggregator {

    public static final int DEFAULT_TOP_N = 10;

    private static final Comparator<IncludeStats> BY_COUNT = Comparator.comparingLong(IncludeStats::getCount)
            .reversed();
    private static final Comparator<IncludeStats> BY_SIZE = Comparator.comparingLong(IncludeStats::getLines)
            .reversed();

    private IncludeStatsAggregator() {
    }

    public static IncludeRankings aggregate(Iterable<IncludeContribution> contributions) {
        return aggregate(contributions, DEFAULT_TOP_N);
    }

    public static IncludeRankings aggregate(Iterable<IncludeContribution> contributions, int topN) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0: " + topN);
        }

        Map<String, long[]> groups = new LinkedHashMap<>();
        for (IncludeContribution contribution : contributions) {
            long[] totals = groups.computeIfAbsent(contribution.pathPrefix(), prefix -> new long[2]);
            totals[0]++;
            totals[1] += contribution.sizeBytes();
        }
        if (groups.isEmpty()) {
            return IncludeRankings.empty();
        }

        List<IncludeStats> firstSeen = new ArrayList<>(groups.size());
        for (Map.Entry<String, long[]> entry : groups.entrySet()) {
            long[] totals = entry.getValue();
            firstSeen.add(IncludeStats.of(entry.getKey(), totals[0], totals[1]));
        }

        return new IncludeRankings(topN(firstSeen, BY_COUNT, topN), topN(firstSeen, BY_SIZE, topN));
    }

    private static List<IncludeStats> topN(List<IncludeStats> groups, Comparator<IncludeStats> order, int limit) {
        List<IncludeStats> sorted = new ArrayList<>(groups);
        sorted.sort(order); // List.sort is stable
        return sorted.subList(0, Math.min(limit, sorted.size()));
    }
}
