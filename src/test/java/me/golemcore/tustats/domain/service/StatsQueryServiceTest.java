package me.golemcore.tustats.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tustats.adapter.outbound.storage.RocksDbStatsStore;
import me.golemcore.tustats.domain.exception.StorageOpenException;
import me.golemcore.tustats.domain.exception.StorageReadException;
import me.golemcore.tustats.domain.model.TranslationUnitStats;
import me.golemcore.tustats.infrastructure.config.TuStatsConfiguration;
import me.golemcore.tustats.infrastructure.config.TuStatsProperties;
import me.golemcore.tustats.port.outbound.StatsStore;
import me.golemcore.tustats.port.outbound.StatsStoreOpener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StatsQueryServiceTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private TuStatsProperties properties;
    private Path storePath;
    private StatsQueryService queryService;

    @BeforeEach
    void setUp() {
        objectMapper = TuStatsConfiguration.objectMapper();
        storePath = tempDir.resolve("tu_stats.db");
        properties = new TuStatsProperties();
        properties.setStatsFile(storePath.toString());
        StatsStoreOpener opener = new TuStatsConfiguration(properties).statsStoreOpener(objectMapper);
        queryService = new StatsQueryService(properties, opener);
    }

    @Test
    void freshStoreQueriesEmpty() {
        RocksDbStatsStore.open(storePath, objectMapper).close();

        assertTrue(queryService.query().isEmpty());
    }

    @Test
    void missingStoreIsCreatedEmpty() {
        assertTrue(queryService.query().isEmpty());
        assertTrue(RocksDbStatsStore.exists(storePath));
    }

    @Test
    void returnsEveryRecordOfRepeatedCompilations() {
        TranslationUnitStats a1 = stats("/src/a.c", Instant.parse("2026-05-01T08:00:00Z"));
        TranslationUnitStats b2 = stats("/src/b.c", Instant.parse("2026-05-01T08:00:01Z"));
        TranslationUnitStats a3 = stats("/src/a.c", Instant.parse("2026-05-01T08:00:02Z"));
        try (RocksDbStatsStore store = RocksDbStatsStore.open(storePath, objectMapper)) {
            store.insert(a1);
            store.insert(b2);
            store.insert(a3);
        }

        List<TranslationUnitStats> records = new ArrayList<>(queryService.query());
        records.sort(Comparator.comparing(TranslationUnitStats::getTimestamp));

        assertEquals(List.of(a1, b2, a3), records);
    }

    @Test
    void queriesWhileWriterHoldsStore() {
        TranslationUnitStats stats = stats("/src/a.c", Instant.parse("2026-05-01T08:00:00Z"));
        try (RocksDbStatsStore writer = RocksDbStatsStore.open(storePath, objectMapper)) {
            writer.insert(stats);

            assertEquals(List.of(stats), queryService.query());
        }
    }

    @Test
    void explicitPathOverridesConfiguredStore() {
        Path other = tempDir.resolve("other.db");
        TranslationUnitStats stats = stats("/src/c.c", Instant.parse("2026-05-02T08:00:00Z"));
        try (RocksDbStatsStore store = RocksDbStatsStore.open(other, objectMapper)) {
            store.insert(stats);
        }

        assertEquals(List.of(stats), queryService.query(other));
        assertTrue(queryService.query().isEmpty());
    }

    @Test
    void propagatesOpenFailure() throws IOException {
        Files.writeString(storePath, "not a store");

        assertThrows(StorageOpenException.class, () -> queryService.query());
    }

    @Test
    void propagatesReadFailureAndClosesStore() {
        StatsStore store = mock(StatsStore.class);
        when(store.scan()).thenThrow(new StorageReadException("corrupt"));
        StatsStoreOpener opener = mock(StatsStoreOpener.class);
        when(opener.open(any())).thenReturn(store);
        StatsQueryService service = new StatsQueryService(properties, opener);

        assertThrows(StorageReadException.class, service::query);
        verify(store).close();
    }

    private static TranslationUnitStats stats(String file, Instant timestamp) {
        return TranslationUnitStats.builder()
                .inputFile(Path.of(file))
                .preprocessedSize(512)
                .numIncludes(3)
                .preprocessDuration(Duration.ofMillis(2))
                .compileDuration(Duration.ofMillis(20))
                .timestamp(timestamp)
                .build();
    }
}
