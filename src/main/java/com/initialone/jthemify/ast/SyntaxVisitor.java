package com.initialone.jthemify.ast;

public interface SyntaxVisitor<R> {

    R visitMethod(MethodNode node);

    R visitFunction(FunctionNode node);

    R visitConstructor(ConstructorNode node);

    R visitType(TypeNode node);

    R visitFixedContext(FixedContextNode node);

    /** References, invocations and every other node kind */
    R visitOther(SyntaxNode node);
}
