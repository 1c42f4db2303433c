package com.initialone.jthemify.ast;

import java.util.List;

/** A parsed source file. */
public interface SyntaxTree {

    /** Every Namespace.member access whose qualifier is a plain dotted name, ascending offset */
    List<QualifiedReferenceNode> qualifiedReferences();

    /** Calls {@code target.method(...)} where target is {@code targetName} or ends with {@code .targetName} */
    List<SyntaxNode> invocations(String targetName, String methodName);

    /** Empty for the default package */
    String packageName();

    /** Non-static imports; on-demand imports end with {@code .*} */
    List<String> imports();

    /** 1-based line containing the given offset */
    int lineOf(int offset);
}
