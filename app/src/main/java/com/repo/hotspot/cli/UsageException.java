package com.repo.hotspot.cli;

/**
 * Bad command-line input, reported with the usage text before any work starts.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
