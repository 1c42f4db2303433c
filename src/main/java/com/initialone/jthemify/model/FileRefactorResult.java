package com.initialone.jthemify.model;

import java.nio.file.Path;
import java.util.List;

public final class FileRefactorResult {
    private final Path path;
    private final String originalText;
    private final String rewrittenText;
    private final List<Transformation> transformations;

    public FileRefactorResult(Path path, String originalText, String rewrittenText, List<Transformation> transformations) {
        this.path = path;
        this.originalText = originalText;
        this.rewrittenText = rewrittenText;
        this.transformations = List.copyOf(transformations);
    }

    public Path path() { return path; }
    public String originalText() { return originalText; }
    public String rewrittenText() { return rewrittenText; }

    /** Ascending offset order */
    public List<Transformation> transformations() { return transformations; }

    public boolean hasChanges() { return !transformations.isEmpty(); }
    public int changeCount() { return transformations.size(); }
}
