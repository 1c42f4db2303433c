package com.initialone.jthemify.ast;

public interface FunctionNode extends CallableNode {

    /** False for stubs such as an empty block body */
    boolean hasNonTrivialBody();

    @Override
    default <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
