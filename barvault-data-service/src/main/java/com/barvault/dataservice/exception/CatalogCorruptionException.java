package com.barvault.dataservice.exception;

import java.nio.file.Path;

/**
 * A partition file name or its content could not be parsed.
 */
public class CatalogCorruptionException extends CatalogException {

    private final Path file;

    public CatalogCorruptionException(Path file, Throwable cause) {
        super("Corrupted catalog file: " + file + " (" + cause.getMessage() + ")", cause);
        this.file = file;
    }

    public CatalogCorruptionException(Path file, String reason) {
        super("Corrupted catalog file: " + file + " (" + reason + ")");
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
