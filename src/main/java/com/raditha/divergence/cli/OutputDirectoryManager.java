package com.raditha.divergence.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Chooses the output directory of a run and removes the results of earlier runs.
 */
public class OutputDirectoryManager {

    private static final Logger logger = LoggerFactory.getLogger(OutputDirectoryManager.class);

    public static final String EXTRACTED_DIR = "extracted";
    public static final String ANALYSIS_DIR = "analysis";
    public static final String LOGS_DIR = "logs";

    private static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final List<String> RESULT_DIRS = List.of(EXTRACTED_DIR, ANALYSIS_DIR, LOGS_DIR);

    private final Path archiveRoot;
    private final Clock clock;

    public OutputDirectoryManager(Path archiveRoot, Clock clock) {
        this.archiveRoot = archiveRoot;
        this.clock = clock;
    }

    /**
     * {@code <archiveRoot>/<archiveName>_<yyyyMMdd_HHmmss>} when an archive name is given,
     * otherwise {@code outputDir}.
     */
    public Path resolve(Path outputDir, String archiveName) {
        if (archiveName == null || archiveName.isBlank()) {
            return outputDir;
        }
        if (archiveName.contains("/") || archiveName.contains("\\")) {
            throw new IllegalArgumentException("Archive name must not contain path separators: " + archiveName);
        }
        return archiveRoot.resolve(archiveName + "_" + LocalDateTime.now(clock).format(ARCHIVE_STAMP));
    }

    /**
     * True when the extracted directory of an earlier run exists and is not empty.
     */
    public boolean hasPreviousResults(Path outputDir) throws IOException {
        Path extracted = outputDir.resolve(EXTRACTED_DIR);
        if (!Files.isDirectory(extracted)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(extracted)) {
            return entries.findAny().isPresent();
        }
    }

    /**
     * Delete the extracted, analysis and logs directories.
     */
    public void cleanup(Path outputDir) throws IOException {
        for (String name : RESULT_DIRS) {
            Path dir = outputDir.resolve(name);
            if (Files.exists(dir)) {
                deleteRecursively(dir);
                logger.debug("Removed {}", dir);
            }
        }
    }

    /**
     * Only "y" or "yes", in any case, counts as consent.
     */
    static boolean isConsent(String answer) {
        if (answer == null) {
            return false;
        }
        String normalized = answer.trim().toLowerCase();
        return normalized.equals("y") || normalized.equals("yes");
    }

    private static void deleteRecursively(Path root) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.delete(path);
        }
    }
}
