package com.repo.hotspot.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repo.hotspot.core.SourceMetrics;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Python scorer that shells out to radon ({@code radon mi -s -j <file>}).
 * Radon only supplies the maintainability index; the structural measures
 * come from the heuristic text analysis.
 */
public class RadonMaintainabilityScorer implements MaintainabilityScorer {

    private static final Set<String> EXTENSIONS = Set.of(".py");
    private static final long TIMEOUT_SECONDS = 60;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String executable;
    private final HeuristicMaintainabilityScorer structure = new HeuristicMaintainabilityScorer();
    private Boolean radonAvailable;

    public RadonMaintainabilityScorer() {
        this("radon");
    }

    public RadonMaintainabilityScorer(String executable) {
        this.executable = executable;
    }

    @Override
    public String getScorerId() {
        return "radon";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public synchronized boolean isAvailable() {
        if (radonAvailable == null) {
            radonAvailable = checkRadonAvailable();
        }
        return radonAvailable;
    }

    @Override
    public int getPriority() {
        return 10; // High priority for Python files
    }

    @Override
    public double score(Path sourceFile) throws IOException {
        String json = executeRadon(sourceFile);
        return parseScore(json, sourceFile);
    }

    @Override
    public SourceMetrics measure(Path sourceFile) throws IOException {
        String source = new String(Files.readAllBytes(sourceFile), StandardCharsets.UTF_8);
        return structure.measureSource(source).withMaintainability(score(sourceFile));
    }

    private boolean checkRadonAvailable() {
        try {
            ProcessBuilder pb = new ProcessBuilder(executable, "--version");
            pb.redirectErrorStream(true);
            Process process = pb.start();
            process.getInputStream().readAllBytes();
            boolean finished = process.waitFor(5, TimeUnit.SECONDS);
            return finished && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String executeRadon(Path sourceFile) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(
                executable, "mi", "-s", "-j", sourceFile.toAbsolutePath().toString());
        pb.redirectErrorStream(true);

        Process process = pb.start();

        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        try {
            boolean finished = process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("radon timed out on " + sourceFile);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while scoring " + sourceFile);
        }

        if (process.exitValue() != 0) {
            throw new IOException("radon failed on " + sourceFile + ": " + output.trim());
        }
        return output;
    }

    /**
     * Reads the {@code mi} value out of radon's JSON report.
     */
    static double parseScore(String json, Path sourceFile) throws IOException {
        if (json.isBlank()) {
            throw new IOException("radon produced no output for " + sourceFile);
        }

        JsonNode report;
        try {
            report = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException("Unexpected radon output for " + sourceFile + ": " + json.trim(), e);
        }
        if (report == null || !report.isObject() || report.isEmpty()) {
            throw new IOException("Unexpected radon output for " + sourceFile + ": " + json.trim());
        }

        // A single file was passed, so the report holds a single entry
        JsonNode fileReport = report.elements().next();
        if (!fileReport.isObject()) {
            throw new IOException("Unexpected radon output for " + sourceFile + ": " + json.trim());
        }
        if (fileReport.has("error")) {
            throw new IOException("radon could not score " + sourceFile + ": " + fileReport.get("error").asText());
        }

        JsonNode mi = fileReport.get("mi");
        if (mi != null && mi.isNumber()) {
            return mi.doubleValue();
        }
        throw new IOException("radon reported no maintainability index for " + sourceFile);
    }
}
