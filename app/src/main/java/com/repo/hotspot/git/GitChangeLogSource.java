package com.repo.hotspot.git;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reads changed file names from {@code git log}.
 * Any failure to run git, or a non-zero exit status, is reported as an
 * IOException carrying git's error output.
 */
public class GitChangeLogSource implements ChangeLogSource {

    private final String executable;

    public GitChangeLogSource() {
        this("git");
    }

    public GitChangeLogSource(String executable) {
        this.executable = executable;
    }

    @Override
    public List<String> changedFiles(Path directory, LocalDate since) throws IOException {
        System.err.println("Mining Git history for: " + directory);

        List<String> command = buildCommand(since);
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(directory.toFile());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new IOException("Failed to execute git command: " + e.getMessage(), e);
        }

        // Drain stderr separately so a chatty git cannot block on a full pipe
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readQuietly(process.getErrorStream()));

        String stdout;
        try (InputStream in = process.getInputStream()) {
            stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading git history");
        }

        if (exitCode != 0) {
            throw new IOException("Git command failed with status " + exitCode + ": " + stderr.join().trim());
        }

        List<String> files = parseOutput(stdout);
        System.err.println("Parsed " + files.size() + " file changes.");
        return files;
    }

    /**
     * {@code git -c core.quotepath=off log --name-only --relative --pretty=format: [--since DATE] .}
     */
    public List<String> buildCommand(LocalDate since) {
        // --name-only: Show changed files
        // --relative: Paths relative to the working directory, limited to it
        // --pretty=format:: No commit headers, just file names
        List<String> command = new ArrayList<>(List.of(
                executable, "-c", "core.quotepath=off", "log", "--name-only", "--relative", "--pretty=format:"));
        if (since != null) {
            command.add("--since");
            command.add(since.toString());
        }
        command.add(".");
        return command;
    }

    static List<String> parseOutput(String output) {
        return output.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .map(GitChangeLogSource::unquote)
                .toList();
    }

    /**
     * Undoes git's C-style quoting of unusual names, e.g. {@code "a\"b.py"}.
     * Git still quotes names holding quotes, backslashes or control
     * characters when {@code core.quotepath} is off. Other lines come back as is.
     */
    static String unquote(String line) {
        int end = line.length() - 1;
        if (end < 1 || line.charAt(0) != '"' || line.charAt(end) != '"') {
            return line;
        }

        // Octal escapes are raw bytes of the UTF-8 name
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int i = 1;
        while (i < end) {
            int c = line.codePointAt(i);
            if (c != '\\' || i + 1 >= end) {
                bytes.writeBytes(new String(Character.toChars(c)).getBytes(StandardCharsets.UTF_8));
                i += Character.charCount(c);
                continue;
            }

            char escaped = line.charAt(i + 1);
            i += 2;
            switch (escaped) {
                case 'a' -> bytes.write(0x07);
                case 'b' -> bytes.write('\b');
                case 't' -> bytes.write('\t');
                case 'n' -> bytes.write('\n');
                case 'v' -> bytes.write(0x0B);
                case 'f' -> bytes.write('\f');
                case 'r' -> bytes.write('\r');
                case '"', '\\' -> bytes.write(escaped);
                default -> {
                    if (isOctal(line, i - 1, end)) {
                        bytes.write(Integer.parseInt(line.substring(i - 1, i + 2), 8));
                        i += 2;
                    } else {
                        bytes.write('\\');
                        bytes.writeBytes(String.valueOf(escaped).getBytes(StandardCharsets.UTF_8));
                    }
                }
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static boolean isOctal(String line, int start, int end) {
        if (start + 3 > end) {
            return false;
        }
        for (int j = start; j < start + 3; j++) {
            char c = line.charAt(j);
            if (c < '0' || c > '7') {
                return false;
            }
        }
        return line.charAt(start) <= '3';
    }

    private static String readQuietly(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }
}
