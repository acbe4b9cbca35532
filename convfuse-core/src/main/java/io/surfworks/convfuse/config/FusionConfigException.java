package io.surfworks.convfuse.config;

import java.nio.file.Path;

/**
 * Thrown when a fusion config file exists but cannot be read or parsed.
 */
public class FusionConfigException extends RuntimeException {

    private final Path file;

    public FusionConfigException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public FusionConfigException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
