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

import me.golemcore.tustats.domain.model.IncludeStats;
import me.golemcore.tustats.domain.model.TranslationUnitStats;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Renders statistics records as CSV or as a human-readable report.
 *
 * <p>
 * CSV layout: eight scalar columns, then the first three by-count entries as
 * {@code prefix,count,lines} and the first three by-size entries as
 * {@code prefix,lines,count}. Missing entries leave their three fields empty,
 * so every row has the same number of columns.
 */
@Service
public class StatsExportService {

    static final int CSV_RANKING_ENTRIES = 3;
    static final int REPORT_RANKING_ENTRIES = 5;
    static final String NO_RECORDS = "No translation unit stats found.";

    private static final String SEPARATOR = ",";
    private static final String NEWLINE = "\n";
    private static final String[] SCALAR_COLUMNS = {
            "timestamp", "input_file", "preprocessed_size", "num_includes",
            "preprocess_duration_ms", "compile_duration_ms", "dist_retry_count", "is_distributed"
    };

    public String toCsv(List<TranslationUnitStats> records) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb);
        for (TranslationUnitStats stats : records) {
            sb.append(stats.getTimestamp().getEpochSecond())
                    .append(SEPARATOR).append(csvField(String.valueOf(stats.getInputFile())))
                    .append(SEPARATOR).append(stats.getPreprocessedSize())
                    .append(SEPARATOR).append(stats.getNumIncludes())
                    .append(SEPARATOR).append(stats.getPreprocessDuration().toMillis())
                    .append(SEPARATOR).append(stats.getCompileDuration().toMillis())
                    .append(SEPARATOR).append(stats.getDistRetryCount())
                    .append(SEPARATOR).append(stats.isDistributed());
            appendRanking(sb, stats.getTopIncludesByCount(), IncludeStats::getCount, IncludeStats::getLines);
            appendRanking(sb, stats.getTopIncludesBySize(), IncludeStats::getLines, IncludeStats::getCount);
            sb.append(NEWLINE);
        }
        return sb.toString();
    }

    public String formatHuman(List<TranslationUnitStats> records) {
        if (records.isEmpty()) {
            return NO_RECORDS + NEWLINE;
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Translation unit stats (").append(records.size()).append(" records)").append(NEWLINE);
        for (TranslationUnitStats stats : records) {
            sb.append(NEWLINE).append(stats.getInputFile()).append(NEWLINE);
            sb.append("  Preprocessed size: ").append(stats.getPreprocessedSize()).append(" bytes").append(NEWLINE);
            sb.append("  Includes:          ").append(stats.getNumIncludes()).append(NEWLINE);
            sb.append("  Preprocess time:   ").append(stats.getPreprocessDuration().toMillis()).append(" ms")
                    .append(NEWLINE);
            sb.append("  Compile time:      ").append(stats.getCompileDuration().toMillis()).append(" ms")
                    .append(NEWLINE);
            sb.append("  Distributed:       ").append(stats.isDistributed() ? "yes" : "no").append(NEWLINE);
            sb.append("  Retries:           ").append(stats.getDistRetryCount()).append(NEWLINE);
            appendReportRanking(sb, "Top includes by count:", stats.getTopIncludesByCount());
            appendReportRanking(sb, "Top includes by size:", stats.getTopIncludesBySize());
            sb.append("  Timestamp:         ").append(stats.getTimestamp()).append(NEWLINE);
        }
        return sb.toString();
    }

    public void printHuman(List<TranslationUnitStats> records, PrintStream out) {
        out.print(formatHuman(records));
        out.flush();
    }

    private void appendHeader(StringBuilder sb) {
        sb.append(String.join(SEPARATOR, SCALAR_COLUMNS));
        for (int i = 1; i <= CSV_RANKING_ENTRIES; i++) {
            sb.append(SEPARATOR).append("top_count_").append(i).append("_prefix")
                    .append(SEPARATOR).append("top_count_").append(i).append("_count")
                    .append(SEPARATOR).append("top_count_").append(i).append("_lines");
        }
        for (int i = 1; i <= CSV_RANKING_ENTRIES; i++) {
            sb.append(SEPARATOR).append("top_size_").append(i).append("_prefix")
                    .append(SEPARATOR).append("top_size_").append(i).append("_lines")
                    .append(SEPARATOR).append("top_size_").append(i).append("_count");
        }
        sb.append(NEWLINE);
    }

    private void appendRanking(StringBuilder sb, List<IncludeStats> ranking,
            ToLongFunction<IncludeStats> metric, ToLongFunction<IncludeStats> secondary) {
        for (int i = 0; i < CSV_RANKING_ENTRIES; i++) {
            if (i < ranking.size()) {
                IncludeStats entry = ranking.get(i);
                sb.append(SEPARATOR).append(csvField(entry.getPathPrefix()))
                        .append(SEPARATOR).append(metric.applyAsLong(entry))
                        .append(SEPARATOR).append(secondary.applyAsLong(entry));
            } else {
                sb.append(SEPARATOR).append(SEPARATOR).append(SEPARATOR);
            }
        }
    }

    private void appendReportRanking(StringBuilder sb, String title, List<IncludeStats> ranking) {
        sb.append("  ").append(title).append(NEWLINE);
        if (ranking.isEmpty()) {
            sb.append("    (none)").append(NEWLINE);
            return;
        }
        int shown = Math.min(REPORT_RANKING_ENTRIES, ranking.size());
        for (int i = 0; i < shown; i++) {
            IncludeStats entry = ranking.get(i);
            sb.append("    ").append(entry.getPathPrefix())
                    .append(" (count: ").append(entry.getCount())
                    .append(", lines: ").append(entry.getLines()).append(")").append(NEWLINE);
        }
    }

    static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(SEPARATOR) || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
