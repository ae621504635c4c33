package com.raditha.divergence.cli;

import com.raditha.divergence.alignment.MalformedMappingException;
import com.raditha.divergence.analyzer.AnalysisInputs;
import com.raditha.divergence.analyzer.AnalysisOutcome;
import com.raditha.divergence.analyzer.DivergenceAnalyzer;
import com.raditha.divergence.config.AnalyzerConfig;
import com.raditha.divergence.config.AnalyzerSettings;
import com.raditha.divergence.config.CliOverrides;
import com.raditha.divergence.extraction.FileArtifactStorage;
import com.raditha.divergence.extraction.HeaderDialect;
import com.raditha.divergence.extraction.MissingInputException;
import com.raditha.divergence.extraction.StorageFaultException;
import com.raditha.divergence.logging.ConsoleVerbosity;
import com.raditha.divergence.logging.RunLoggingConfigurator;
import com.raditha.divergence.report.DivergenceReport;
import com.raditha.divergence.report.ReportGenerator;
import com.raditha.divergence.report.SummaryPrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the IR divergence analyzer.
 * <p>
 * Usage:
 * java -jar ir-divergence-analyzer.jar [--legacy <path>] [--npm <path>] [--mapping <path>] [options]
 * <p>
 * Configuration priority: CLI arguments > divergence.yml > defaults
 */
@Command(name = "ir-divergence", mixinStandardHelpOptions = true, version = "ir-divergence v" + ReportGenerator.TOOL_VERSION,
        description = "Finds the first optimization pass where two IR pass pipelines diverge")
@SuppressWarnings("java:S106")
public class DivergenceCLI implements Callable<Integer> {

    static final Path DEFAULT_ARCHIVE_ROOT = Path.of("output", "archive");

    @Option(names = "--legacy", description = "Pipeline A dump (default: ${DEFAULT-VALUE})", paramLabel = "<path>")
    private Path legacyFile = Path.of("data", "legacy.full.txt");

    @Option(names = "--npm", description = "Pipeline B dump (default: ${DEFAULT-VALUE})", paramLabel = "<path>")
    private Path npmFile = Path.of("data", "npm.full.txt");

    @Option(names = "--mapping", description = "Pass name mapping JSON (default: ${DEFAULT-VALUE})", paramLabel = "<path>")
    private Path mappingFile = Path.of("data", "legacy-to-npm-pass-mapping.json");

    @Option(names = "--output-dir", description = "Output directory (default: ${DEFAULT-VALUE})", paramLabel = "<path>")
    private Path outputDir = Path.of("output", "current");

    @Option(names = "--archive", description = "Write results to output/archive/<name>_<timestamp> instead", paramLabel = "<name>")
    private String archiveName;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--no-cleanup", description = "Keep previous results without asking")
    private boolean noCleanup = false;

    @Option(names = "--clean", description = "Clean up previous results and exit")
    private boolean cleanOnly = false;

    @Option(names = "--no-ignore-temp-vars", description = "Compare temporary value names as written")
    private boolean noIgnoreTempVars = false;

    @Option(names = "--no-ignore-labels", description = "Compare block labels as written")
    private boolean noIgnoreLabels = false;

    @Option(names = "--no-ignore-metadata", description = "Keep metadata lines")
    private boolean noIgnoreMetadata = false;

    @Option(names = "--ignore-comments", description = "Strip ; comments before comparing")
    private boolean ignoreComments = false;

    @Option(names = "--dialect-a", description = "Header dialect of pipeline A: legacy or new-pm", paramLabel = "<dialect>", converter = HeaderDialectConverter.class)
    private HeaderDialect dialectA;

    @Option(names = "--dialect-b", description = "Header dialect of pipeline B: legacy or new-pm", paramLabel = "<dialect>", converter = HeaderDialectConverter.class)
    private HeaderDialect dialectB;

    @Option(names = {"-v", "--verbose"}, description = "Show debug output on the console")
    private boolean verbose = false;

    @Option(names = {"-q", "--quiet"}, description = "Only show warnings and errors")
    private boolean quiet = false;

    private final BufferedReader input;
    private final PrintStream out;
    private final OutputDirectoryManager directories;

    public DivergenceCLI() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out,
                new OutputDirectoryManager(DEFAULT_ARCHIVE_ROOT, Clock.systemDefaultZone()));
    }

    DivergenceCLI(BufferedReader input, PrintStream out, OutputDirectoryManager directories) {
        this.input = input;
        this.out = out;
        this.directories = directories;
    }

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 whether or not a divergence was found)
     */
    @Override
    public Integer call() throws Exception {
        ConsoleVerbosity verbosity = ConsoleVerbosity.of(verbose, quiet);
        AnalyzerConfig config = loadConfig();

        Path runDir = directories.resolve(outputDir, archiveName);
        Files.createDirectories(runDir);
        if (!quiet) {
            out.println((archiveName != null ? "Archiving results to: " : "Output directory: ") + runDir);
        }

        handleCleanup(runDir);
        if (cleanOnly) {
            if (!quiet) {
                out.println("Exiting.");
            }
            return 0;
        }

        if (!quiet) {
            out.println("IR Divergence Analyzer");
            out.println("=".repeat(50));
            out.println("Pipeline A dump: " + legacyFile);
            out.println("Pipeline B dump: " + npmFile);
            out.println("Pass mapping:    " + mappingFile);
            out.println("Output dir:      " + runDir);
            out.println();
        }

        RunLoggingConfigurator.configure(runDir.resolve(OutputDirectoryManager.LOGS_DIR), verbosity);
        try {
            Path extracted = runDir.resolve(OutputDirectoryManager.EXTRACTED_DIR);
            DivergenceAnalyzer analyzer = new DivergenceAnalyzer(config,
                    new FileArtifactStorage(extracted.resolve("pipeline-a")),
                    new FileArtifactStorage(extracted.resolve("pipeline-b")));
            AnalysisOutcome outcome = analyzer.analyze(new AnalysisInputs(legacyFile, npmFile, mappingFile));

            DivergenceReport report = new ReportGenerator().generate(outcome, runDir);
            if (!quiet) {
                new SummaryPrinter(out).print(report);
            }
            return 0;
        } finally {
            RunLoggingConfigurator.close();
        }
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine(new DivergenceCLI()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Wire the exit-code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine(DivergenceCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof MalformedMappingException) {
                commandLine.getErr().println("Malformed mapping: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof MissingInputException) {
                commandLine.getErr().println("Missing input: " + ex.getMessage());
                return 3;
            } else if (ex instanceof StorageFaultException) {
                commandLine.getErr().println("Storage error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof IOException || ex instanceof UncheckedIOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    private AnalyzerConfig loadConfig() {
        AnalyzerSettings settings = configFile != null
                ? AnalyzerSettings.load(configFile)
                : AnalyzerSettings.loadDefault(Path.of("").toAbsolutePath());
        CliOverrides overrides = new CliOverrides(noIgnoreTempVars, noIgnoreLabels, noIgnoreMetadata,
                ignoreComments, dialectA, dialectB);
        return settings.toConfig(overrides);
    }

    private void handleCleanup(Path runDir) throws IOException {
        if (!cleanOnly && !directories.hasPreviousResults(runDir)) {
            return;
        }
        boolean cleanup;
        if (cleanOnly) {
            cleanup = true;
        } else if (noCleanup) {
            out.println("Skipping cleanup (--no-cleanup specified)");
            cleanup = false;
        } else {
            out.print("Clean up previous results? (y/N): ");
            out.flush();
            cleanup = OutputDirectoryManager.isConsent(input.readLine());
        }

        if (cleanup) {
            directories.cleanup(runDir);
            out.println("Cleanup completed");
        } else {
            out.println("Keeping previous results");
        }
    }

    /**
     * Custom converter for HeaderDialect enum to handle CLI string values.
     */
    public static class HeaderDialectConverter implements ITypeConverter<HeaderDialect> {
        @Override
        public HeaderDialect convert(String value) throws Exception {
            return HeaderDialect.fromString(value);
        }
    }
}
