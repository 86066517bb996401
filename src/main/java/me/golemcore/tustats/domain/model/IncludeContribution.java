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

import java.nio.file.Path;
import java.util.Objects;

/**
 * Footprint of a single included file, as reported by the preprocessing step.
 * Contributions sharing a {@code pathPrefix} are grouped before ranking.
 */
public record IncludeContribution(String pathPrefix, long sizeBytes) {

    public IncludeContribution {
        Objects.requireNonNull(pathPrefix, "pathPrefix");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0: " + sizeBytes);
        }
    }

    /**
     * Builds a contribution whose prefix is the directory holding
     * {@code includedFile}.
     */
    public static IncludeContribution ofFile(Path includedFile, long sizeBytes) {
        Objects.requireNonNull(includedFile, "includedFile");
        Path parent = includedFile.getParent();
        String prefix = parent != null ? parent.toString() : includedFile.toString();
        return new IncludeContribution(prefix, sizeBytes);
    }
}
