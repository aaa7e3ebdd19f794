package com.repo.hotspot.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repo.hotspot.core.FileChange;
import com.repo.hotspot.core.FileMeasurement;
import com.repo.hotspot.core.SourceMetrics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON objects for saving per-file measurements and change counts between
 * the {@code mi}, {@code changes} and {@code combine} commands.
 *
 * <p>Measurements are written as
 * {@code {"pkg/mod.py": {"maintainability_index": 63.2, "halstead_volume": ..., ...}}};
 * a bare number per path ({@code {"pkg/mod.py": 63.2}}) is read as a score
 * without structural measures. Change counts are {@code {"pkg/mod.py": 4}}.
 */
public class MeasurementJson {

    static final String MAINTAINABILITY_INDEX = "maintainability_index";
    static final String HALSTEAD_VOLUME = "halstead_volume";
    static final String CYCLOMATIC_COMPLEXITY = "cyclomatic_complexity";
    static final String LOC = "loc";
    static final String COMMENTS_PERCENTAGE = "comments_percentage";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String writeMeasurements(List<FileMeasurement> measurements) {
        ObjectNode root = objectMapper.createObjectNode();
        for (FileMeasurement measurement : measurements) {
            SourceMetrics metrics = measurement.metrics();
            ObjectNode entry = root.putObject(measurement.path().toString());
            putNumber(entry, MAINTAINABILITY_INDEX, metrics.maintainability());
            putNumber(entry, HALSTEAD_VOLUME, metrics.halsteadVolume());
            entry.put(CYCLOMATIC_COMPLEXITY, metrics.cyclomaticComplexity());
            entry.put(LOC, metrics.loc());
            putNumber(entry, COMMENTS_PERCENTAGE, metrics.commentsPercentage());
        }
        return serialize(root);
    }

    public String writeChanges(List<FileChange> changes) {
        ObjectNode root = objectMapper.createObjectNode();
        for (FileChange change : changes) {
            root.put(change.path().toString(), change.count());
        }
        return serialize(root);
    }

    /**
     * @throws IOException              if the text is not JSON
     * @throws IllegalArgumentException if it is JSON of the wrong shape
     */
    public List<FileMeasurement> readMeasurements(String json) throws IOException {
        List<FileMeasurement> measurements = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = readObject(json).fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = field.getKey();
            JsonNode value = field.getValue();

            if (value.isNumber()) {
                measurements.add(new FileMeasurement(Path.of(path), value.doubleValue()));
            } else if (value.isObject()) {
                measurements.add(new FileMeasurement(Path.of(path), readSourceMetrics(path, value)));
            } else {
                throw new IllegalArgumentException("Score for " + path + " is not a number");
            }
        }
        return measurements;
    }

    /**
     * @throws IOException              if the text is not JSON
     * @throws IllegalArgumentException if a count is not a whole number of zero or more
     */
    public List<FileChange> readChanges(String json) throws IOException {
        List<FileChange> changes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = readObject(json).fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int count = wholeNumber(field.getValue(), "Change count for " + field.getKey());
            changes.add(new FileChange(Path.of(field.getKey()), count));
        }
        return changes;
    }

    private SourceMetrics readSourceMetrics(String path, JsonNode entry) {
        JsonNode maintainability = entry.get(MAINTAINABILITY_INDEX);
        if (maintainability == null || !maintainability.isNumber()) {
            throw new IllegalArgumentException("Score for " + path + " is not a number");
        }
        return new SourceMetrics(
                maintainability.doubleValue(),
                optionalNumber(entry, HALSTEAD_VOLUME, path),
                entry.has(CYCLOMATIC_COMPLEXITY)
                        ? wholeNumber(entry.get(CYCLOMATIC_COMPLEXITY), CYCLOMATIC_COMPLEXITY + " of " + path)
                        : 0,
                entry.has(LOC) ? wholeNumber(entry.get(LOC), LOC + " of " + path) : 0,
                optionalNumber(entry, COMMENTS_PERCENTAGE, path));
    }

    private double optionalNumber(JsonNode entry, String key, String path) {
        JsonNode value = entry.get(key);
        if (value == null) {
            return 0.0;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException(key + " of " + path + " is not a number");
        }
        return value.doubleValue();
    }

    private int wholeNumber(JsonNode value, String what) {
        if (!value.isNumber()) {
            throw new IllegalArgumentException(what + " is not a number");
        }
        double number = value.doubleValue();
        if (number < 0 || number > Integer.MAX_VALUE || number != Math.floor(number)) {
            throw new IllegalArgumentException(what + " must be a whole number of zero or more, got " + value);
        }
        return (int) number;
    }

    private JsonNode readObject(String json) throws IOException {
        if (json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode root = objectMapper.readTree(json);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return objectMapper.createObjectNode();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object mapping paths to values");
        }
        return root;
    }

    // JSON has no literal for non-finite numbers
    private void putNumber(ObjectNode entry, String key, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            entry.putNull(key);
        } else {
            entry.put(key, value);
        }
    }

    private String serialize(ObjectNode root) {
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize measurements", e);
        }
    }
}
