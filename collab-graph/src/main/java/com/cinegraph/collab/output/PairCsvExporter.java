package com.cinegraph.collab.output;

import com.cinegraph.collab.config.CollabGraphProperties;
import com.cinegraph.collab.model.CollaborationPair;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.store.GraphReader;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Dumps the pair summary table to CSV.
 *
 * Output path pattern: {outputDir}/collaboration_pairs_{yyyyMMdd_HHmmss}.csv
 * List columns (types, years_active) are joined with '|'.
 *
 * Load into PostgreSQL with:
 *   \copy collaboration_pairs_export FROM 'collaboration_pairs_20250101_030000.csv' CSV HEADER
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PairCsvExporter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final String[] HEADERS = {
            "person_low_id", "person_high_id",
            "collaboration_count", "first_year", "last_year",
            "avg_rating", "total_revenue",
            "types", "years_active", "peak_year",
            "genre_diversity", "role_diversity"
    };

    private final GraphReader graphReader;
    private final CollabGraphProperties properties;
    private final Clock clock;

    /**
     * @return the file written
     */
    public Path exportPairs() {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("collaboration_pairs_%s.csv", LocalDateTime.now(clock).format(FILE_STAMP));
        Path outputPath = outputDir.resolve(filename);
        AtomicInteger rows = new AtomicInteger();

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            graphReader.forEachPair(pair -> {
                writer.writeNext(toRow(pair));
                rows.incrementAndGet();
            });

            log.info("Exported {} collaboration pairs to CSV: {}", rows.get(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV export failed", e);
        }
        return outputPath;
    }

    private String[] toRow(CollaborationPair p) {
        return new String[]{
                str(p.getPersonLowId()),
                str(p.getPersonHighId()),
                str(p.getCollaborationCount()),
                str(p.getFirstYear()),
                str(p.getLastYear()),
                str(p.getAvgRating()),
                str(p.getTotalRevenue()),
                joined(p.getTypes() == null ? null
                        : p.getTypes().stream().map(CollaborationType::code).collect(Collectors.toList())),
                joined(p.getYearsActive()),
                str(p.getPeakYear()),
                str(p.getGenreDiversity()),
                str(p.getRoleDiversity())
        };
    }

    private String joined(List<?> values) {
        if (values == null) return "";
        return values.stream().map(String::valueOf).collect(Collectors.joining("|"));
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
