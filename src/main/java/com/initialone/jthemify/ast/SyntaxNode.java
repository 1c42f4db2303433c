package com.initialone.jthemify.ast;

import java.util.Optional;

/**
 * Parser-neutral view of one node of a parsed source file.
 * Offsets are char indexes into the text the tree was parsed from.
 */
public interface SyntaxNode {

    NodeKind kind();

    int offset();

    int length();

    /** 1-based line of the first char */
    int line();

    /** Source text covered by this node */
    String text();

    Optional<SyntaxNode> parent();

    <R> R accept(SyntaxVisitor<R> visitor);
}
