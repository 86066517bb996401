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

package me.golemcore.tustats.adapter.inbound.command;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tustats.domain.model.TranslationUnitStats;
import me.golemcore.tustats.domain.service.StatsExportService;
import me.golemcore.tustats.domain.service.StatsQueryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Operator commands for stored translation-unit statistics.
 *
 * <ul>
 * <li>{@code show} (default) - human-readable report on stdout
 * <li>{@code csv} - CSV export on stdout, or to {@code --output=<file>}
 * </ul>
 *
 * <p>
 * {@code --stats-file=<path>} reads a store other than the configured one.
 * Records are printed oldest first.
 */
@Component
@Slf4j
public class StatsCommandRunner implements ApplicationRunner {

    static final String CMD_SHOW = "show";
    static final String CMD_CSV = "csv";
    static final String OPT_STATS_FILE = "stats-file";
    static final String OPT_OUTPUT = "output";

    private final StatsQueryService statsQueryService;
    private final StatsExportService statsExportService;
    private final PrintStream out;

    @Autowired
    public StatsCommandRunner(StatsQueryService statsQueryService, StatsExportService statsExportService) {
        this(statsQueryService, statsExportService, System.out);
    }

    StatsCommandRunner(StatsQueryService statsQueryService, StatsExportService statsExportService,
            PrintStream out) {
        this.statsQueryService = statsQueryService;
        this.statsExportService = statsExportService;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> commands = args.getNonOptionArgs();
        String command = commands.isEmpty() ? CMD_SHOW : commands.get(0).toLowerCase(Locale.ROOT);
        if (!CMD_SHOW.equals(command) && !CMD_CSV.equals(command)) {
            throw new IllegalArgumentException("Unknown command: " + command + " (expected show or csv)");
        }

        Path statsFile = optionPath(args, OPT_STATS_FILE);
        List<TranslationUnitStats> records = new ArrayList<>(statsQueryService.query(statsFile));
        records.sort(Comparator.comparing(TranslationUnitStats::getTimestamp));

        if (CMD_SHOW.equals(command)) {
            statsExportService.printHuman(records, out);
            return;
        }

        String csv = statsExportService.toCsv(records);
        Path output = optionPath(args, OPT_OUTPUT);
        if (output == null) {
            out.print(csv);
            out.flush();
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, csv, StandardCharsets.UTF_8);
        log.info("[TuStats] Exported {} records to {}", records.size(), output);
    }

    private Path optionPath(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return Paths.get(values.get(0));
    }
}
