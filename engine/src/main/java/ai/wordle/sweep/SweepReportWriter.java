package ai.wordle.sweep;

import ai.wordle.config.SweepProperties;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes sweep results as CSV, one row per starter in the order given.
 */
@Component
public class SweepReportWriter {
    private static final Logger log = LoggerFactory.getLogger(SweepReportWriter.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    static final String HEADER =
            "starter_word,failed,tries_6,tries_5,tries_4,tries_3,tries_2,tries_1,total_games,success_rate,avg_tries";

    private final SweepProperties properties;

    public SweepReportWriter(SweepProperties properties) {
        this.properties = properties;
    }

    /**
     * File name embedding the sweep settings, e.g.
     * {@code results_final_targets100_seed12345_2024-01-31_12-00-00.csv}.
     */
    public static String fileName(String prefix, int targets, long seed, LocalDateTime time) {
        return prefix + "_targets" + targets + "_seed" + seed + "_" + TIMESTAMP.format(time) + ".csv";
    }

    /**
     * Writes (or overwrites) a report in the configured output directory.
     *
     * @return the written file, or {@code null} if writing failed; failures are logged, since a
     *         lost report must not cost the results still held in memory
     */
    public Path write(String fileName, List<StarterStats> rows) {
        Path path = Paths.get(properties.getOutputDirectory()).resolve(fileName);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writer.write(HEADER);
                writer.newLine();
                for (StarterStats row : rows) {
                    writer.write(toCsv(row));
                    writer.newLine();
                }
            }
            if (log.isDebugEnabled()) {
                log.debug("Wrote {} rows to {}", rows.size(), path);
            }
            return path;
        } catch (IOException e) {
            log.error("Could not write sweep report {}", path, e);
            return null;
        }
    }

    static String toCsv(StarterStats row) {
        return String.format(Locale.ROOT, "%s,%d,%d,%d,%d,%d,%d,%d,%d,%.4f,%.4f",
                row.getStarter(),
                row.getFailed(),
                row.getSolvedIn(6),
                row.getSolvedIn(5),
                row.getSolvedIn(4),
                row.getSolvedIn(3),
                row.getSolvedIn(2),
                row.getSolvedIn(1),
                row.getGames(),
                row.successRate(),
                row.avgTries());
    }
}
