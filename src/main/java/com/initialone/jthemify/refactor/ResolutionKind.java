package com.initialone.jthemify.refactor;

public enum ResolutionKind {
    STRICT,
    EXTENSION,
    /** Explicit no-op */
    PRESERVED,
    /** No rule; never an error */
    UNMAPPED
}
