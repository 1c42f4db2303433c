package com.initialone.jthemify.ast.java;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithExtends;
import com.github.javaparser.ast.nodeTypes.NodeWithImplements;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.initialone.jthemify.ast.ConstructorNode;
import com.initialone.jthemify.ast.FixedContextNode;
import com.initialone.jthemify.ast.FunctionNode;
import com.initialone.jthemify.ast.MethodNode;
import com.initialone.jthemify.ast.NodeKind;
import com.initialone.jthemify.ast.QualifiedReferenceNode;
import com.initialone.jthemify.ast.SyntaxNode;
import com.initialone.jthemify.ast.SyntaxVisitor;
import com.initialone.jthemify.ast.TypeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JavaParser adapters for the {@link SyntaxNode} variants.
 *
 * Mapping:
 * MethodDeclaration -> METHOD, LambdaExpr -> FUNCTION,
 * ConstructorDeclaration / CompactConstructorDeclaration -> CONSTRUCTOR (enum constructors are constant-evaluated),
 * TypeDeclaration / anonymous class body -> TYPE,
 * annotations, switch labels, static initializers, static fields, enum constant arguments -> FIXED_CONTEXT.
 */
final class JavaNodes {
    private JavaNodes() {
    }

    static SyntaxNode wrap(Node n, JavaSyntaxTree tree) {
        if (n instanceof MethodDeclaration) return new Method((MethodDeclaration) n, tree);
        if (n instanceof ConstructorDeclaration || n instanceof CompactConstructorDeclaration) {
            return new Constructor((BodyDeclaration<?>) n, tree);
        }
        if (n instanceof LambdaExpr) return new Function((LambdaExpr) n, tree);
        if (n instanceof TypeDeclaration) return new Type(n, tree);
        if (n instanceof ObjectCreationExpr && ((ObjectCreationExpr) n).getAnonymousClassBody().isPresent()) {
            return new Type(n, tree);
        }
        if (n instanceof AnnotationExpr) {
            return new FixedContext(n, tree, "used as an annotation value, which must be a compile-time constant");
        }
        if (n instanceof InitializerDeclaration && ((InitializerDeclaration) n).isStatic()) {
            return new FixedContext(n, tree, "declared in a static initializer");
        }
        if (n instanceof FieldDeclaration && ((FieldDeclaration) n).isStatic()) {
            return new FixedContext(n, tree, "initializes a static field");
        }
        if (n instanceof EnumConstantDeclaration) {
            return new FixedContext(n, tree, "evaluated while initializing an enum constant");
        }
        return new OtherNode(n, tree, NodeKind.OTHER);
    }

    /** a, a.b.c; empty for anything that is not a plain dotted name */
    static Optional<String> dottedName(Expression e) {
        if (e instanceof NameExpr) return Optional.of(((NameExpr) e).getNameAsString());
        if (e instanceof FieldAccessExpr) {
            FieldAccessExpr fa = (FieldAccessExpr) e;
            return dottedName(fa.getScope()).map(s -> s + "." + fa.getNameAsString());
        }
        return Optional.empty();
    }

    static Optional<TypeNode> enclosingType(Node n, JavaSyntaxTree tree) {
        Node cur = n.getParentNode().orElse(null);
        while (cur != null) {
            SyntaxNode wrapped = isTypeLike(cur) ? wrap(cur, tree) : null;
            if (wrapped instanceof TypeNode) return Optional.of((TypeNode) wrapped);
            cur = cur.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    private static boolean isTypeLike(Node n) {
        return n instanceof TypeDeclaration || n instanceof ObjectCreationExpr;
    }

    private static List<String> typesOf(List<Parameter> params) {
        return params.stream().map(p -> p.getType().asString()).collect(Collectors.toList());
    }

    /* ======================= base ======================= */

    abstract static class JavaNode<N extends Node> implements SyntaxNode {
        final N node;
        final JavaSyntaxTree tree;

        JavaNode(N node, JavaSyntaxTree tree) {
            this.node = node;
            this.tree = tree;
        }

        private Range range() {
            return node.getRange().orElseThrow(() -> new IllegalStateException("node without range: " + node.getClass().getSimpleName()));
        }

        @Override
        public int offset() {
            return tree.offsetOf(range().begin);
        }

        @Override
        public int length() {
            // JavaParser 的 range 末尾是闭区间
            return tree.offsetOf(range().end) + 1 - offset();
        }

        @Override
        public int line() {
            return range().begin.line;
        }

        @Override
        public String text() {
            int off = offset();
            return tree.text().substring(off, off + length());
        }

        @Override
        public Optional<SyntaxNode> parent() {
            Node p = node.getParentNode().orElse(null);
            if (p == null) return Optional.empty();
            if (p instanceof SwitchEntry && isLabelOf((SwitchEntry) p)) {
                return Optional.of(new FixedContext(p, tree, "used as a switch case label, which must be a compile-time constant"));
            }
            return Optional.of(wrap(p, tree));
        }

        private boolean isLabelOf(SwitchEntry entry) {
            for (Expression label : entry.getLabels()) {
                if (label == node) return true;
            }
            return false;
        }

        @Override
        public String toString() {
            return kind() + "@" + line() + " " + node.getClass().getSimpleName();
        }
    }

    /* ======================= variants ======================= */

    static final class Method extends JavaNode<MethodDeclaration> implements MethodNode {
        Method(MethodDeclaration node, JavaSyntaxTree tree) {
            super(node, tree);
        }

        @Override public NodeKind kind() { return NodeKind.METHOD; }
        @Override public String name() { return node.getNameAsString(); }
        @Override public boolean isStatic() { return node.isStatic(); }
        @Override public List<String> parameterTypes() { return typesOf(node.getParameters()); }
        @Override public Optional<TypeNode> enclosingType() { return JavaNodes.enclosingType(node, tree); }
    }

    static final class Constructor extends JavaNode<BodyDeclaration<?>> implements ConstructorNode {
        Constructor(BodyDeclaration<?> node, JavaSyntaxTree tree) {
            super(node, tree);
        }

        @Override public NodeKind kind() { return NodeKind.CONSTRUCTOR; }

        @Override
        public boolean isConstantEvaluated() {
            return node.getParentNode().filter(p -> p instanceof EnumDeclaration).isPresent();
        }

        @Override
        public List<String> parameterTypes() {
            if (node instanceof ConstructorDeclaration) {
                return typesOf(((ConstructorDeclaration) node).getParameters());
            }
            // compact constructors take the record components
            return node.getParentNode()
                    .filter(p -> p instanceof RecordDeclaration)
                    .map(p -> typesOf(((RecordDeclaration) p).getParameters()))
                    .orElse(List.of());
        }

        @Override public Optional<TypeNode> enclosingType() { return JavaNodes.enclosingType(node, tree); }
    }

    static final class Function extends JavaNode<LambdaExpr> implements FunctionNode {
        Function(LambdaExpr node, JavaSyntaxTree tree) {
            super(node, tree);
        }

        @Override public NodeKind kind() { return NodeKind.FUNCTION; }
        @Override public List<String> parameterTypes() { return typesOf(node.getParameters()); }
        @Override public Optional<TypeNode> enclosingType() { return JavaNodes.enclosingType(node, tree); }

        @Override
        public boolean hasNonTrivialBody() {
            if (node.getBody() instanceof BlockStmt) {
                return !((BlockStmt) node.getBody()).getStatements().isEmpty();
            }
            return true;
        }
    }

    static final class Type extends JavaNode<Node> implements TypeNode {
        Type(Node node, JavaSyntaxTree tree) {
            super(node, tree);
        }

        @Override public NodeKind kind() { return NodeKind.TYPE; }

        @Override
        public String name() {
            if (node instanceof ObjectCreationExpr) return ((ObjectCreationExpr) node).getType().getNameAsString();
            return ((TypeDeclaration<?>) node).getNameAsString();
        }

        @Override
        public List<String> supertypeNames() {
            List<String> out = new ArrayList<>();
            if (node instanceof ObjectCreationExpr) {
                out.add(((ObjectCreationExpr) node).getType().asString());
                return out;
            }
            if (node instanceof NodeWithExtends) {
                for (ClassOrInterfaceType t : ((NodeWithExtends<?>) node).getExtendedTypes()) out.add(t.asString());
            }
            if (node instanceof NodeWithImplements) {
                for (ClassOrInterfaceType t : ((NodeWithImplements<?>) node).getImplementedTypes()) out.add(t.asString());
            }
            return out;
        }

        @Override
        public boolean isLocal() {
            return node instanceof ObjectCreationExpr
                    || node.getParentNode().filter(p -> p instanceof LocalClassDeclarationStmt).isPresent();
        }
    }

    static final class FixedContext extends JavaNode<Node> implements FixedContextNode {
        private final String reason;

        FixedContext(Node node, JavaSyntaxTree tree, String reason) {
            super(node, tree);
            this.reason = reason;
        }

        @Override public NodeKind kind() { return NodeKind.FIXED_CONTEXT; }
        @Override public String reason() { return reason; }
    }

    static final class ReferenceNode extends JavaNode<FieldAccessExpr> implements QualifiedReferenceNode {
        private final String qualifier;
        private final String member;

        ReferenceNode(FieldAccessExpr node, JavaSyntaxTree tree, String qualifier, String member) {
            super(node, tree);
            this.qualifier = qualifier;
            this.member = member;
        }

        @Override public NodeKind kind() { return NodeKind.REFERENCE; }
        @Override public String qualifier() { return qualifier; }
        @Override public String member() { return member; }
        @Override public <R> R accept(SyntaxVisitor<R> visitor) { return visitor.visitOther(this); }
    }

    static final class OtherNode extends JavaNode<Node> implements SyntaxNode {
        private final NodeKind kind;

        OtherNode(Node node, JavaSyntaxTree tree, NodeKind kind) {
            super(node, tree);
            this.kind = kind;
        }

        @Override public NodeKind kind() { return kind; }
        @Override public <R> R accept(SyntaxVisitor<R> visitor) { return visitor.visitOther(this); }
    }
}
