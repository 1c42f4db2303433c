package com.initialone.jthemify.model;

import java.nio.file.Path;

/** A file excluded from the run because it could not be read, parsed, rewritten or written. */
public final class FileFailure {
    private final Path path;
    private final String message;

    public FileFailure(Path path, String message) {
        this.path = path;
        this.message = message;
    }

    public Path path() { return path; }
    public String message() { return message; }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
