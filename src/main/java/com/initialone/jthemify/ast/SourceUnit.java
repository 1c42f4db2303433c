package com.initialone.jthemify.ast;

import java.nio.file.Path;
import java.util.Objects;

/** A file's original text plus its syntax tree. Immutable once parsed. */
public final class SourceUnit {
    private final Path path;
    private final String text;
    private final SyntaxTree tree;

    public SourceUnit(Path path, String text, SyntaxTree tree) {
        this.path = path;
        this.text = Objects.requireNonNull(text, "text");
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    /** May be null for in-memory sources */
    public Path path() { return path; }
    public String text() { return text; }
    public SyntaxTree tree() { return tree; }

    public String displayName() {
        return path == null ? "<memory>" : path.toString();
    }
}
