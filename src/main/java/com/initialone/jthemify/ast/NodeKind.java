package com.initialone.jthemify.ast;

public enum NodeKind {
    METHOD,
    /** Free function; lambda expressions in Java sources */
    FUNCTION,
    CONSTRUCTOR,
    TYPE,
    /** A position evaluated without any instance scope, or one that requires a compile-time constant */
    FIXED_CONTEXT,
    /** Namespace.member access */
    REFERENCE,
    INVOCATION,
    OTHER
}
