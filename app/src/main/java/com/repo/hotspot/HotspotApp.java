package com.repo.hotspot;

import com.repo.hotspot.cli.CliOptions;
import com.repo.hotspot.cli.UsageException;
import com.repo.hotspot.core.*;
import com.repo.hotspot.git.ChangeLogSource;
import com.repo.hotspot.git.GitChangeLogSource;
import com.repo.hotspot.report.MeasurementJson;
import com.repo.hotspot.report.ReportWriter;
import com.repo.hotspot.scoring.ScorerRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Tech Debt Hotspot - ranks files and directories by change frequency
 * against maintainability.
 *
 * <p>Reports go to stdout, progress and diagnostics to stderr.
 */
public class HotspotApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final Supplier<ScorerRegistry> registrySupplier;
    private final ChangeLogSource changeLogSource;
    private final PrintStream out;
    private final PrintStream err;

    public HotspotApp(Supplier<ScorerRegistry> registrySupplier, ChangeLogSource changeLogSource,
            PrintStream out, PrintStream err) {
        this.registrySupplier = registrySupplier;
        this.changeLogSource = changeLogSource;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        HotspotApp app = new HotspotApp(ScorerRegistry::standard, new GitChangeLogSource(), System.out, System.err);
        System.exit(app.execute(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int execute(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            err.print(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        if (options.help()) {
            out.print(CliOptions.USAGE);
            return EXIT_OK;
        }

        try {
            switch (options.command()) {
                case REPORT -> runReport(options);
                case MI -> runMaintainability(options);
                case CHANGES -> runChanges(options);
                case COMBINE -> runCombine(options);
            }
            return EXIT_OK;
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void runReport(CliOptions options) throws IOException {
        err.println("=== Tech Debt Hotspot ===");
        Path directory = resolveDirectory(options.directory());
        HotspotConfig config = options.applyTo(loadConfig(directory), directory);

        ScorerRegistry registry = registrySupplier.get();
        registry.printSummary();

        List<PathMetrics> metrics = new HotspotAnalysis(registry, changeLogSource).run(directory, config);

        new ReportWriter().write(metrics, config.getOutputFormat(), config.getSortField(),
                options.outputPath(), out);
        printSummary(metrics);
    }

    private void runMaintainability(CliOptions options) throws IOException {
        Path directory = resolveDirectory(options.directory());
        HotspotConfig config = options.applyTo(loadConfig(directory), directory);

        List<FileMeasurement> measurements = new HotspotAnalysis(registrySupplier.get(), changeLogSource)
                .measure(directory, config);

        if (options.json()) {
            emit(new MeasurementJson().writeMeasurements(measurements) + "\n", options.outputPath());
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (FileMeasurement m : measurements) {
            sb.append(m.path()).append(" --> ").append(m.score()).append('\n');
        }
        emit(sb.toString(), options.outputPath());
    }

    private void runChanges(CliOptions options) throws IOException {
        Path directory = resolveDirectory(options.directory());
        HotspotConfig config = options.applyTo(loadConfig(directory), directory);

        List<FileChange> changes = new HotspotAnalysis(registrySupplier.get(), changeLogSource)
                .countChanges(directory, config);

        if (options.json()) {
            emit(new MeasurementJson().writeChanges(changes) + "\n", options.outputPath());
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (FileChange c : changes) {
            sb.append(c.path()).append(" --> ").append(c.count()).append('\n');
        }
        emit(sb.toString(), options.outputPath());
    }

    private void runCombine(CliOptions options) throws IOException {
        HotspotConfig config = options.applyTo(HotspotConfig.defaults(), null);
        MeasurementJson json = new MeasurementJson();

        List<FileMeasurement> measurements = json.readMeasurements(readFile(options.maintainabilityFile()));
        List<FileChange> changes = json.readChanges(readFile(options.changesFile()));
        err.printf("Loaded %d scores and %d change counts%n", measurements.size(), changes.size());

        // Saved inputs were produced without exclusions, apply them here
        ExclusionFilter exclusions = config.exclusionFilter();
        measurements = measurements.stream().filter(m -> !exclusions.isExcluded(m.path())).toList();
        changes = changes.stream().filter(c -> !exclusions.isExcluded(c.path())).toList();

        MetricsAggregator aggregator = HotspotAnalysis.aggregate(measurements, changes, config);
        List<PathMetrics> metrics = ResultSelector.select(aggregator.metrics().values(), config.isIncludeDeleted());

        new ReportWriter().write(metrics, config.getOutputFormat(), config.getSortField(),
                options.outputPath(), out);
    }

    private Path resolveDirectory(Path directory) {
        Path resolved = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(resolved) || !Files.isReadable(resolved)) {
            throw new UsageException(directory + " is not a readable directory");
        }
        return resolved;
    }

    private HotspotConfig loadConfig(Path directory) {
        try {
            return HotspotConfig.load(directory);
        } catch (IllegalArgumentException e) {
            throw new UsageException(HotspotConfig.CONFIG_FILE_NAME + ": " + e.getMessage(), e);
        }
    }

    private String readFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new UsageException(file + " is not a readable file");
        }
        return Files.readString(file);
    }

    private void emit(String text, Path outputPath) throws IOException {
        if (outputPath == null) {
            out.print(text);
            out.flush();
        } else {
            Files.writeString(outputPath, text);
            err.println("Output written to: " + outputPath.toAbsolutePath());
        }
    }

    private void printSummary(List<PathMetrics> metrics) {
        List<PathMetrics> topModules = metrics.stream()
                .filter(m -> m.kind() == PathKind.MODULE)
                .filter(m -> m.changes() > 0)
                .sorted((a, b) -> Double.compare(b.hotspotIndex(), a.hotspotIndex()))
                .limit(5)
                .toList();

        if (!topModules.isEmpty()) {
            err.println("\nTop 5 Hotspot Files:");
            for (int i = 0; i < topModules.size(); i++) {
                PathMetrics m = topModules.get(i);
                err.printf("  %d. %s (Hotspot: %.1f, MI: %.1f, Changes: %d)%n",
                        i + 1, m.path(), m.hotspotIndex(), m.maintainability(), m.changes());
            }
        }
    }
}
