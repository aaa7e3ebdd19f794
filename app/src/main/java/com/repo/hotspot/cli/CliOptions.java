package com.repo.hotspot.cli;

import com.repo.hotspot.core.HotspotConfig;
import com.repo.hotspot.report.OutputFormat;
import com.repo.hotspot.report.SortField;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Parsed command line. Options left out stay null so that values from
 * hotspot.yaml are only overridden by what the user actually typed.
 */
public record CliOptions(
        Command command,
        Path directory,
        List<Path> exclusions,
        LocalDate since,
        Boolean includeDeleted,
        SortField sortField,
        OutputFormat outputFormat,
        Path outputPath,
        Integer threads,
        boolean json,
        Path maintainabilityFile,
        Path changesFile,
        boolean help) {

    public enum Command {
        REPORT("report"),
        MI("mi"),
        CHANGES("changes"),
        COMBINE("combine");

        private final String commandName;

        Command(String commandName) {
            this.commandName = commandName;
        }

        public String commandName() {
            return commandName;
        }

        static Command fromName(String name) {
            for (Command command : values()) {
                if (command.commandName.equals(name)) {
                    return command;
                }
            }
            return null;
        }
    }

    public static final String USAGE = """
            Usage: hotspot [report] <directory> [options]
                   hotspot mi <directory> [--json] [--exclude <path>]...
                   hotspot changes <directory> [--json] [--since <date>] [--exclude <path>]...
                   hotspot combine --maintainability <file> --changes <file> [options]

            Commands:
              report          Score, count and rank every file and directory (default)
              mi              Print the maintainability index of every source file
                              (--json adds the structural measures)
              changes         Print the number of changes of every source file
              combine         Rank paths from JSON files saved by 'mi --json' and 'changes --json'

            Options:
              --exclude <path>          Skip a file or directory and everything beneath it (repeatable)
              --since <YYYY-MM-DD>      Only count changes committed on or after this date
              --deleted                 Also report paths that have changes but no surviving file
              --sort <field>            path, path_type (ascending) or halstead_volume,
                                        cyclomatic_complexity, loc, comments_percentage,
                                        maintainability_index, changes_count,
                                        hotspot_index (descending; default)
              --format <table|csv>      Output format (default: table)
              --output <file>           Write the report to a file instead of stdout
              --threads <n>             Worker threads for scoring (default: available processors)
              --json                    JSON output for 'mi' and 'changes'
              --maintainability <file>  Input for 'combine': output of 'mi --json'
              --changes <file>          Input for 'combine': output of 'changes --json'
              --help                    Show this message
            """;

    public static CliOptions parse(String[] args) {
        Command command = Command.REPORT;
        Path directory = null;
        List<Path> exclusions = new ArrayList<>();
        LocalDate since = null;
        Boolean includeDeleted = null;
        SortField sortField = null;
        OutputFormat outputFormat = null;
        Path outputPath = null;
        Integer threads = null;
        boolean json = false;
        Path maintainabilityFile = null;
        Path changesFile = null;
        boolean help = false;

        int start = 0;
        if (args.length > 0 && Command.fromName(args[0]) != null) {
            command = Command.fromName(args[0]);
            start = 1;
        }

        for (int i = start; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--exclude", "-e" -> exclusions.add(Path.of(value(args, ++i, arg)));
                case "--since" -> since = parseSince(value(args, ++i, arg));
                case "--deleted", "-d" -> includeDeleted = true;
                case "--sort", "-s" -> sortField = parse(SortField::fromName, value(args, ++i, arg));
                case "--format", "-f" -> outputFormat = parse(OutputFormat::fromName, value(args, ++i, arg));
                case "--output", "-o" -> outputPath = Path.of(value(args, ++i, arg));
                case "--threads" -> threads = parseThreads(value(args, ++i, arg));
                case "--json", "-j" -> json = true;
                case "--maintainability", "-m" -> maintainabilityFile = Path.of(value(args, ++i, arg));
                case "--changes", "-c" -> changesFile = Path.of(value(args, ++i, arg));
                case "--help", "-h" -> help = true;
                default -> {
                    if (arg.startsWith("-")) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    if (directory != null) {
                        throw new UsageException("Unexpected argument: " + arg);
                    }
                    directory = Path.of(arg);
                }
            }
        }

        if (!help) {
            if (command == Command.COMBINE) {
                if (maintainabilityFile == null || changesFile == null) {
                    throw new UsageException("combine needs both --maintainability and --changes");
                }
            } else if (directory == null) {
                throw new UsageException("Missing <directory> argument");
            }
        }

        return new CliOptions(command, directory, List.copyOf(exclusions), since, includeDeleted, sortField,
                outputFormat, outputPath, threads, json, maintainabilityFile, changesFile, help);
    }

    /**
     * Applies the options the user typed on top of {@code config}.
     */
    public HotspotConfig applyTo(HotspotConfig config, Path resolvedDirectory) {
        config.withExclusions(exclusions.stream()
                .map(p -> relativeTo(resolvedDirectory, p))
                .toList());
        if (since != null)
            config.withSince(since);
        if (includeDeleted != null)
            config.withIncludeDeleted(includeDeleted);
        if (sortField != null)
            config.withSortField(sortField);
        if (outputFormat != null)
            config.withOutputFormat(outputFormat);
        if (threads != null)
            config.withThreads(threads);
        return config;
    }

    /**
     * Exclusions are matched against paths relative to the analyzed directory.
     */
    static Path relativeTo(Path directory, Path exclusion) {
        if (directory == null || !exclusion.isAbsolute()) {
            return exclusion.normalize();
        }
        Path base = directory.toAbsolutePath().normalize();
        Path target = exclusion.normalize();
        return target.startsWith(base) ? base.relativize(target) : target;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException("Option " + option + " needs a value");
        }
        return args[index];
    }

    private static LocalDate parseSince(String value) {
        try {
            return HotspotConfig.parseSince(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage(), e);
        }
    }

    private static Integer parseThreads(String value) {
        try {
            int n = Integer.parseInt(value);
            if (n < 1) {
                throw new UsageException("--threads must be at least 1");
            }
            return n;
        } catch (NumberFormatException e) {
            throw new UsageException("--threads expects a number, got: " + value, e);
        }
    }

    private static <T> T parse(Function<String, T> parser, String value) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage(), e);
        }
    }
}
