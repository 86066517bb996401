package me.golemcore.tustats.domain.service;

import me.golemcore.tustats.domain.model.IncludeStats;
import me.golemcore.tustats.domain.model.TranslationUnitStats;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatsExportServiceTest {

    private static final int CSV_COLUMNS = 26;
    private static final String HEADER = "timestamp,input_file,preprocessed_size,num_includes,"
            + "preprocess_duration_ms,compile_duration_ms,dist_retry_count,is_distributed,"
            + "top_count_1_prefix,top_count_1_count,top_count_1_lines,"
            + "top_count_2_prefix,top_count_2_count,top_count_2_lines,"
            + "top_count_3_prefix,top_count_3_count,top_count_3_lines,"
            + "top_size_1_prefix,top_size_1_lines,top_size_1_count,"
            + "top_size_2_prefix,top_size_2_lines,top_size_2_count,"
            + "top_size_3_prefix,top_size_3_lines,top_size_3_count";

    private final StatsExportService exportService = new StatsExportService();

    @Test
    void csvHasHeaderOnlyForNoRecords() {
        assertEquals(HEADER + "\n", exportService.toCsv(List.of()));
    }

    @Test
    void csvRendersScalarsAndSwappedRankingColumns() {
        TranslationUnitStats stats = TranslationUnitStats.builder()
                .inputFile(Path.of("/src/main.cpp"))
                .preprocessedSize(4096)
                .numIncludes(12)
                .preprocessDuration(Duration.ofMillis(15))
                .compileDuration(Duration.ofMillis(1234))
                .distRetryCount(1)
                .distributed(true)
                .topIncludesByCount(List.of(IncludeStats.of("/usr/include", 8, 300)))
                .topIncludesBySize(List.of(IncludeStats.of("/opt/big", 2, 9000)))
                .timestamp(Instant.ofEpochSecond(1_700_000_000L, 999_000_000))
                .build();

        String[] lines = exportService.toCsv(List.of(stats)).split("\n");

        assertEquals(2, lines.length);
        assertEquals(HEADER, lines[0]);
        assertEquals("1700000000,/src/main.cpp,4096,12,15,1234,1,true,"
                + "/usr/include,8,300,,,,,,,"
                + "/opt/big,9000,2,,,,,,", lines[1]);
    }

    @Test
    void csvColumnCountIsConstant() {
        List<IncludeStats> many = List.of(IncludeStats.of("a", 5, 50), IncludeStats.of("b", 4, 40),
                IncludeStats.of("c", 3, 30), IncludeStats.of("d", 2, 20));
        List<TranslationUnitStats> records = List.of(
                stats("/x.c", 1, List.of()),
                stats("/y.c", 2, many.subList(0, 1)),
                stats("/z.c", 3, many));

        String[] lines = exportService.toCsv(records).split("\n");

        for (String line : lines) {
            assertEquals(CSV_COLUMNS, line.split(",", -1).length, line);
        }
    }

    @Test
    void csvIsStable() {
        List<TranslationUnitStats> records = List.of(
                stats("/x.c", 1, List.of(IncludeStats.of("a", 1, 2))),
                stats("/y.c", 2, List.of()));

        assertEquals(exportService.toCsv(records), exportService.toCsv(new ArrayList<>(records)));
    }

    @Test
    void csvQuotesFieldsWithSeparators() {
        assertEquals("\"/src/a,b.c\"", StatsExportService.csvField("/src/a,b.c"));
        assertEquals("\"say \"\"hi\"\"\"", StatsExportService.csvField("say \"hi\""));
        assertEquals("/plain.c", StatsExportService.csvField("/plain.c"));
    }

    @Test
    void humanReportStatesWhenEmpty() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        exportService.printHuman(List.of(), new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(StatsExportService.NO_RECORDS + "\n", output);
    }

    @Test
    void humanReportShowsFieldsAndAtMostFiveRankingEntries() {
        List<IncludeStats> ranking = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            ranking.add(IncludeStats.of("/inc" + i, 10 - i, 100));
        }
        TranslationUnitStats stats = stats("/src/a.c", 42, ranking).toBuilder()
                .distributed(true)
                .distRetryCount(3)
                .build();

        String report = exportService.formatHuman(List.of(stats));

        assertTrue(report.contains("/src/a.c"));
        assertTrue(report.contains("Preprocessed size: 1000 bytes"));
        assertTrue(report.contains("Distributed:       yes"));
        assertTrue(report.contains("Retries:           3"));
        assertTrue(report.contains("/inc4 (count: 6, lines: 100)"));
        assertFalse(report.contains("/inc5"));
        assertTrue(report.contains("(none)"));
        assertTrue(report.contains(Instant.ofEpochSecond(42).toString()));
        assertTrue(report.indexOf("Top includes by count") < report.indexOf("Timestamp"));
    }

    @Test
    void humanReportShowsRetriesForLocalCompilations() {
        TranslationUnitStats stats = stats("/src/local.c", 7, List.of()).toBuilder()
                .distRetryCount(2)
                .build();

        String report = exportService.formatHuman(List.of(stats));

        assertTrue(report.contains("Distributed:       no"));
        assertTrue(report.contains("Retries:           2"));
    }

    private static TranslationUnitStats stats(String file, long epochSecond, List<IncludeStats> byCount) {
        return TranslationUnitStats.builder()
                .inputFile(Path.of(file))
                .preprocessedSize(1000)
                .numIncludes(byCount.size())
                .preprocessDuration(Duration.ofMillis(3))
                .compileDuration(Duration.ofMillis(30))
                .topIncludesByCount(byCount)
                .timestamp(Instant.ofEpochSecond(epochSecond))
                .build();
    }
}
