package me.golemcore.tustats.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tustats.infrastructure.config.TuStatsConfiguration;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranslationUnitStatsTest {

    private final ObjectMapper objectMapper = TuStatsConfiguration.objectMapper();

    @Test
    void serializesWithNamedFields() throws Exception {
        TranslationUnitStats stats = TranslationUnitStats.builder()
                .inputFile(Path.of("/src/a.c"))
                .preprocessedSize(10)
                .distributed(true)
                .topIncludesByCount(List.of(IncludeStats.of("/usr/include", 1, 10)))
                .timestamp(Instant.parse("2026-02-03T04:05:06.123456789Z"))
                .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(stats));

        assertEquals("/src/a.c", json.get("inputFile").asText());
        assertEquals(10, json.get("preprocessedSize").asLong());
        assertTrue(json.get("distributed").asBoolean());
        assertEquals("2026-02-03T04:05:06.123456789Z", json.get("timestamp").asText());
        assertEquals("/usr/include", json.get("topIncludesByCount").get(0).get("pathPrefix").asText());
    }

    @Test
    void missingFieldsTakeDefaults() throws Exception {
        TranslationUnitStats stats = objectMapper.readValue(
                "{\"inputFile\":\"/src/a.c\",\"timestamp\":\"2026-02-03T04:05:06Z\",\"futureField\":1}",
                TranslationUnitStats.class);

        assertEquals(Path.of("/src/a.c"), stats.getInputFile());
        assertEquals(Duration.ZERO, stats.getPreprocessDuration());
        assertEquals(0, stats.getDistRetryCount());
        assertTrue(stats.getTopIncludesBySize().isEmpty());
    }

    @Test
    void inputFileIsReadAsPlainPathEvenWithColons() throws Exception {
        for (String file : List.of("gen/foo:bar.cpp", "file:x.c", "C:relative.c")) {
            TranslationUnitStats stats = TranslationUnitStats.builder()
                    .inputFile(Path.of(file))
                    .timestamp(Instant.ofEpochSecond(1))
                    .build();

            TranslationUnitStats read = objectMapper.readValue(
                    objectMapper.writeValueAsBytes(stats), TranslationUnitStats.class);

            assertEquals(Path.of(file), read.getInputFile());
            assertEquals(stats, read);
        }
    }

    @Test
    void rankingsFillBothLists() {
        IncludeRankings rankings = new IncludeRankings(
                List.of(IncludeStats.of("a", 2, 1)),
                List.of(IncludeStats.of("b", 1, 9)));

        TranslationUnitStats stats = TranslationUnitStats.builder().rankings(rankings).build();

        assertEquals(rankings.byCount(), stats.getTopIncludesByCount());
        assertEquals(rankings.bySize(), stats.getTopIncludesBySize());
    }
}
