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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Measurements of one compilation, captured once the compiler pipeline has
 * finished with a translation unit.
 *
 * <p>
 * Instances are immutable and persisted as JSON. Fields may be added over
 * time, never removed: absent properties in older stored records fall back to
 * the builder defaults below.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranslationUnitStats {

    @JsonSerialize(using = ToStringSerializer.class)
    @JsonDeserialize(using = PlainPathDeserializer.class)
    Path inputFile;

    /** Size of the preprocessed translation unit in bytes. */
    long preprocessedSize;

    long numIncludes;

    @Builder.Default
    Duration preprocessDuration = Duration.ZERO;

    @Builder.Default
    Duration compileDuration = Duration.ZERO;

    /** Retry attempts of a distributed compilation, 0 when compiled locally. */
    int distRetryCount;

    boolean distributed;

    @Builder.Default
    List<IncludeStats> topIncludesByCount = List.of();

    @Builder.Default
    List<IncludeStats> topIncludesBySize = List.of();

    @Builder.Default
    Instant timestamp = Instant.now();

    public static class TranslationUnitStatsBuilder {

        public TranslationUnitStatsBuilder rankings(IncludeRankings rankings) {
            return topIncludesByCount(rankings.byCount())
                    .topIncludesBySize(rankings.bySize());
        }
    }
}
