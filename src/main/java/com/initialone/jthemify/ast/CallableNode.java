package com.initialone.jthemify.ast;

import java.util.List;
import java.util.Optional;

/** Common shape of methods, constructors and functions. */
public interface CallableNode extends SyntaxNode {

    /** Declared parameter types as written; an empty string for implicitly typed parameters */
    List<String> parameterTypes();

    /** Nearest type that declares this callable, if any */
    Optional<TypeNode> enclosingType();

    /**
     * True when a parameter's type, ignoring qualifiers and type arguments, is {@code simpleTypeName}.
     */
    default boolean declaresParameterOfType(String simpleTypeName) {
        for (String t : parameterTypes()) {
            if (simpleTypeName.equals(TypeNames.simple(t))) return true;
        }
        return false;
    }
}
