package com.initialone.jthemify.ast;

public interface MethodNode extends CallableNode {

    String name();

    boolean isStatic();

    @Override
    default <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitMethod(this);
    }
}
