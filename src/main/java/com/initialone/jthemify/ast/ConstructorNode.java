package com.initialone.jthemify.ast;

public interface ConstructorNode extends CallableNode {

    /**
     * True when instances are built during constant evaluation, where no runtime lookup can run.
     */
    boolean isConstantEvaluated();

    @Override
    default <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitConstructor(this);
    }
}
