package com.repo.hotspot.core;

import com.repo.hotspot.report.OutputFormat;
import com.repo.hotspot.report.SortField;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Configuration for one hotspot run.
 * Loaded from hotspot.yaml in the analyzed directory or uses sensible
 * defaults; command-line options are applied on top with the {@code with*}
 * methods.
 */
public class HotspotConfig {

    public static final String CONFIG_FILE_NAME = "hotspot.yaml";

    public static final Set<String> DEFAULT_SOURCE_EXTENSIONS = Set.of(
            ".java", ".py", ".js", ".jsx", ".ts", ".tsx", ".mjs", ".cjs",
            ".go", ".rs", ".rb", ".php", ".c", ".cpp", ".h", ".hpp",
            ".kt", ".kts", ".swift", ".scala");

    // Filtering
    private Set<Path> exclusions = new LinkedHashSet<>();
    private LocalDate since = null;
    private Set<String> sourceExtensions = DEFAULT_SOURCE_EXTENSIONS;

    // Output
    private boolean includeDeleted = false;
    private SortField sortField = SortField.HOTSPOT_INDEX;
    private OutputFormat outputFormat = OutputFormat.TABLE;

    // Aggregation
    private double minimumMaintainability = MetricsAggregator.DEFAULT_MINIMUM_MAINTAINABILITY;
    private Path rootPath = Path.of(".");

    // Scoring
    private int threads = Runtime.getRuntime().availableProcessors();

    /**
     * Load configuration from YAML file or return defaults.
     *
     * @throws IllegalArgumentException if the file is not valid YAML, is not a
     *                                  mapping, or holds an invalid value
     */
    public static HotspotConfig load(Path projectRoot) {
        HotspotConfig config = new HotspotConfig();
        Path configFile = projectRoot.resolve(CONFIG_FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml(new PlainDatesConstructor());
                Object data = yaml.load(is);
                if (data instanceof Map<?, ?> map) {
                    config.parseYaml(map);
                } else if (data != null) {
                    throw new IllegalArgumentException("expected a mapping of settings at the top level");
                }
                System.err.println("Loaded configuration from: " + configFile);
            } catch (YAMLException e) {
                throw new IllegalArgumentException("malformed YAML: " + e.getMessage(), e);
            } catch (IOException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static HotspotConfig defaults() {
        return new HotspotConfig();
    }

    /**
     * Parse a {@code YYYY-MM-DD} date, rejecting impossible days and months.
     *
     * @return the date, or null when {@code value} is null
     */
    public static LocalDate parseSince(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date format. Use 'YYYY-MM-DD'", e);
        }
    }

    private void parseYaml(Map<?, ?> data) {
        for (Object exclusion : getList(data, "exclude")) {
            exclusions.add(Path.of(String.valueOf(exclusion)));
        }

        Object sinceValue = data.get("since");
        if (sinceValue != null) {
            since = parseSince(sinceValue.toString());
        }

        includeDeleted = getBool(data, "include_deleted", includeDeleted);

        if (data.get("sort") != null) {
            sortField = SortField.fromName(data.get("sort").toString());
        }
        if (data.get("format") != null) {
            outputFormat = OutputFormat.fromName(data.get("format").toString());
        }

        List<Object> extList = getList(data, "extensions");
        if (!extList.isEmpty()) {
            Set<String> extensions = new LinkedHashSet<>();
            for (Object ext : extList) {
                String s = ext.toString();
                extensions.add(s.startsWith(".") ? s : "." + s);
            }
            sourceExtensions = extensions;
        }

        minimumMaintainability = getDouble(data, "minimum_maintainability", minimumMaintainability);
        threads = Math.max(1, getInt(data, "threads", threads));
    }

    // A single scalar is accepted where a list is expected
    @SuppressWarnings("unchecked")
    private List<Object> getList(Map<?, ?> map, String key) {
        Object val = map.get(key);
        if (val instanceof List)
            return (List<Object>) val;
        if (val != null)
            return List.of(val);
        return List.of();
    }

    private int getInt(Map<?, ?> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private double getDouble(Map<?, ?> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    private boolean getBool(Map<?, ?> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    // === Getters ===

    public Set<Path> getExclusions() {
        return exclusions;
    }

    public LocalDate getSince() {
        return since;
    }

    public Set<String> getSourceExtensions() {
        return sourceExtensions;
    }

    public boolean isIncludeDeleted() {
        return includeDeleted;
    }

    public SortField getSortField() {
        return sortField;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public double getMinimumMaintainability() {
        return minimumMaintainability;
    }

    public Path getRootPath() {
        return rootPath;
    }

    public int getThreads() {
        return threads;
    }

    public ExclusionFilter exclusionFilter() {
        return new ExclusionFilter(exclusions);
    }

    public PathClassifier classifier() {
        return new PathClassifier(sourceExtensions);
    }

    // === Overrides ===

    public HotspotConfig withExclusions(Collection<Path> paths) {
        this.exclusions.addAll(paths);
        return this;
    }

    public HotspotConfig withSince(LocalDate since) {
        this.since = since;
        return this;
    }

    public HotspotConfig withIncludeDeleted(boolean includeDeleted) {
        this.includeDeleted = includeDeleted;
        return this;
    }

    public HotspotConfig withSortField(SortField sortField) {
        this.sortField = sortField;
        return this;
    }

    public HotspotConfig withOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
        return this;
    }

    public HotspotConfig withSourceExtensions(Set<String> sourceExtensions) {
        this.sourceExtensions = sourceExtensions;
        return this;
    }

    public HotspotConfig withThreads(int threads) {
        this.threads = Math.max(1, threads);
        return this;
    }

    /**
     * Keeps date-like scalars as plain text so that {@link #parseSince} sees
     * exactly what was written. SnakeYAML's own timestamps roll impossible
     * dates such as {@code 2023-13-01} over into the next year.
     */
    private static final class PlainDatesConstructor extends SafeConstructor {

        PlainDatesConstructor() {
            super(new LoaderOptions());
            this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
        }
    }
}
