package com.initialone.jthemify.ast;

import java.util.List;

public interface TypeNode extends SyntaxNode {

    /** Simple name; the instantiated type's name for anonymous classes */
    String name();

    /** Declared supertypes as written, type arguments included */
    List<String> supertypeNames();

    /** Anonymous or local types capture the scope they are declared in */
    boolean isLocal();

    @Override
    default <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitType(this);
    }
}
