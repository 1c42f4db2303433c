package com.initialone.jthemify.ast;

/** A {@code Namespace.member} access. */
public interface QualifiedReferenceNode extends SyntaxNode {

    /** Qualifier as a dotted name, e.g. {@code AppColors} or {@code com.acme.AppColors} */
    String qualifier();

    String member();
}
