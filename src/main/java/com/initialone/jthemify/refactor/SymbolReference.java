package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.SyntaxNode;

/** A located occurrence of Namespace.member within one file; lives for one file pass. */
public final class SymbolReference {
    private final SyntaxNode node;
    private final String qualifiedName;
    private final String text;
    private final Resolution resolution;

    SymbolReference(SyntaxNode node, String qualifiedName, String text, Resolution resolution) {
        this.node = node;
        this.qualifiedName = qualifiedName;
        this.text = text;
        this.resolution = resolution;
    }

    public int offset() { return node.offset(); }
    public int length() { return node.length(); }
    public int line() { return node.line(); }

    /** Exactly as written in the source */
    public String text() { return text; }

    /** Namespace.member, the key looked up in the mapping */
    public String qualifiedName() { return qualifiedName; }

    /** Handle for context analysis */
    public SyntaxNode node() { return node; }

    public Resolution resolution() { return resolution; }

    @Override
    public String toString() {
        return qualifiedName + "@" + offset() + " (" + resolution + ")";
    }
}
