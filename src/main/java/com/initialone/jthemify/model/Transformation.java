package com.initialone.jthemify.model;

import java.util.Objects;

/**
 * One intended edit: replace {@code [offset, offset + length)} of the original text with {@code newText}.
 * Offsets are char indexes into the file content.
 */
public final class Transformation {
    private final int offset;
    private final int length;
    private final String oldText;
    private final String newText;
    private final TransformationKind kind;
    private final String description;
    private final ContextAvailability availability;

    public Transformation(int offset, int length, String oldText, String newText,
                          TransformationKind kind, String description, ContextAvailability availability) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("negative offset/length: " + offset + "/" + length);
        }
        this.offset = offset;
        this.length = length;
        this.oldText = Objects.requireNonNull(oldText, "oldText");
        this.newText = Objects.requireNonNull(newText, "newText");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.description = description == null ? "" : description;
        this.availability = availability;
    }

    public int offset() { return offset; }
    public int length() { return length; }
    public int end() { return offset + length; }
    public String oldText() { return oldText; }
    public String newText() { return newText; }
    public TransformationKind kind() { return kind; }
    public String description() { return description; }

    /** Advisory only; null when the site was not analyzed */
    public ContextAvailability availability() { return availability; }

    public boolean overlaps(Transformation other) {
        return offset < other.end() && other.offset < end();
    }

    public boolean sameEdit(Transformation other) {
        return offset == other.offset && length == other.length && newText.equals(other.newText);
    }

    @Override
    public String toString() {
        return "Transformation{" + offset + "+" + length + " '" + oldText + "' -> '" + newText + "', " + kind + "}";
    }
}
