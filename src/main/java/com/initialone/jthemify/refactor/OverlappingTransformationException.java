package com.initialone.jthemify.refactor;

import com.initialone.jthemify.model.Transformation;

/** Two edits of one file touch the same chars and are not the same edit. */
public class OverlappingTransformationException extends IllegalArgumentException {
    private final transient Transformation first;
    private final transient Transformation second;

    public OverlappingTransformationException(Transformation first, Transformation second) {
        super("overlapping transformations: [" + first.offset() + "," + first.end() + ") '" + first.oldText()
                + "' and [" + second.offset() + "," + second.end() + ") '" + second.oldText() + "'");
        this.first = first;
        this.second = second;
    }

    public Transformation first() { return first; }
    public Transformation second() { return second; }
}
