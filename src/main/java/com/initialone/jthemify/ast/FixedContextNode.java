package com.initialone.jthemify.ast;

/**
 * A position where a runtime theme lookup can never run: static initialization,
 * enum constant arguments, or an expression that must be a compile-time constant.
 */
public interface FixedContextNode extends SyntaxNode {

    /** Human-readable reason, e.g. "used as an annotation value" */
    String reason();

    @Override
    default <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFixedContext(this);
    }
}
