package com.repo.hotspot.scoring;

import com.repo.hotspot.core.SourceMetrics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Universal fallback scorer using regex heuristics.
 * Estimates lines of code, cyclomatic complexity, Halstead volume and the
 * share of comment lines from the raw text, and combines the first three with
 * the Visual Studio variant of the maintainability index, which is bounded
 * to 0..100.
 */
public class HeuristicMaintainabilityScorer implements MaintainabilityScorer {

    // Branching keywords across languages
    private static final Pattern BRANCH_PATTERN = Pattern.compile(
            "\\b(if|elif|elsif|for|foreach|while|case|catch|except|when|match)\\b|&&|\\|\\|");

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            "\"(?:\\\\.|[^\"\\\\])*\"" // double-quoted string
                    + "|'(?:\\\\.|[^'\\\\])*'" // single-quoted string
                    + "|[A-Za-z_][A-Za-z0-9_]*" // identifier or keyword
                    + "|\\d+(?:\\.\\d+)?" // number
                    + "|==|!=|<=|>=|&&|\\|\\||\\+\\+|--|->|=>|\\*\\*|<<|>>|[-+*/%=<>!&|^~?:.,;(){}\\[\\]@]");

    // Line comments and block comment openers and continuations
    private static final Pattern COMMENT_LINE = Pattern.compile(
            "^(#(?![A-Za-z])|//|/\\*|\\*|--|<!--|\"\"\"|''')");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "elif", "elsif", "for", "foreach", "while", "do", "switch", "case", "default",
            "break", "continue", "return", "try", "catch", "except", "finally", "throw", "raise", "new",
            "and", "or", "not", "in", "is", "def", "fn", "func", "fun", "function", "class", "struct",
            "import", "from", "yield", "await", "async", "lambda", "match", "when", "with", "pass");

    @Override
    public String getScorerId() {
        return "heuristic";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("*"); // Matches anything as fallback
    }

    @Override
    public boolean isAvailable() {
        return true; // Always available
    }

    @Override
    public int getPriority() {
        return Integer.MAX_VALUE; // Lowest priority (fallback)
    }

    @Override
    public double score(Path sourceFile) throws IOException {
        return measure(sourceFile).maintainability();
    }

    @Override
    public SourceMetrics measure(Path sourceFile) throws IOException {
        byte[] bytes = Files.readAllBytes(sourceFile);
        return measureSource(new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Score source text directly.
     */
    public double scoreSource(String source) {
        return measureSource(source).maintainability();
    }

    /**
     * All measures of one source text. Empty text scores 100 with nothing else counted.
     */
    public SourceMetrics measureSource(String source) {
        List<String> lines = source.lines().toList();

        int loc = countNonBlankLines(lines);
        if (loc == 0) {
            return SourceMetrics.scoreOnly(100.0);
        }

        int complexity = 1 + countBranches(lines);
        double volume = halsteadVolume(source);
        double commentsPercentage = countCommentLines(lines) * 100.0 / loc;

        double raw = 171
                - 5.2 * Math.log(Math.max(volume, 1.0))
                - 0.23 * complexity
                - 16.2 * Math.log(loc);
        double index = Math.min(100.0, Math.max(0.0, raw * 100 / 171));

        return new SourceMetrics(index, volume, complexity, loc, commentsPercentage);
    }

    private int countNonBlankLines(List<String> lines) {
        return (int) lines.stream()
                .filter(line -> !line.trim().isEmpty())
                .count();
    }

    int countCommentLines(List<String> lines) {
        return (int) lines.stream()
                .map(String::trim)
                .filter(line -> COMMENT_LINE.matcher(line).find())
                .count();
    }

    private int countBranches(List<String> lines) {
        int count = 0;
        for (String line : lines) {
            Matcher matcher = BRANCH_PATTERN.matcher(line);
            while (matcher.find()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Halstead volume {@code N * log2(n)}: keywords and symbols are operators,
     * everything else is an operand.
     */
    double halsteadVolume(String source) {
        Set<String> distinctOperators = new HashSet<>();
        Set<String> distinctOperands = new HashSet<>();
        int total = 0;

        Matcher matcher = TOKEN_PATTERN.matcher(source);
        while (matcher.find()) {
            String token = matcher.group();
            total++;
            if (isOperator(token)) {
                distinctOperators.add(token);
            } else {
                distinctOperands.add(token);
            }
        }

        int vocabulary = distinctOperators.size() + distinctOperands.size();
        if (vocabulary < 2) {
            return total;
        }
        return total * (Math.log(vocabulary) / Math.log(2));
    }

    private boolean isOperator(String token) {
        if (KEYWORDS.contains(token)) {
            return true;
        }
        char first = token.charAt(0);
        return !(Character.isLetterOrDigit(first) || first == '_' || first == '"' || first == '\'');
    }
}
