package com.initialone.jthemify.model;

public enum TransformationKind {
    /** Rewritten to a canonical color-scheme slot */
    STRICT,
    /** Rewritten to a property of a theme extension group */
    EXTENSION
}
