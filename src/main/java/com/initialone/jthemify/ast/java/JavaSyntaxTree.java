package com.initialone.jthemify.ast.java;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.initialone.jthemify.ast.NodeKind;
import com.initialone.jthemify.ast.QualifiedReferenceNode;
import com.initialone.jthemify.ast.SyntaxNode;
import com.initialone.jthemify.ast.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

final class JavaSyntaxTree implements SyntaxTree {
    private final CompilationUnit cu;
    private final String text;
    private final LineIndex lines;

    JavaSyntaxTree(CompilationUnit cu, String text) {
        this.cu = cu;
        this.text = text;
        this.lines = new LineIndex(text);
    }

    String text() {
        return text;
    }

    int offsetOf(Position p) {
        return lines.offsetOf(p.line, p.column);
    }

    @Override
    public List<QualifiedReferenceNode> qualifiedReferences() {
        List<QualifiedReferenceNode> out = new ArrayList<>();
        for (FieldAccessExpr fa : cu.findAll(FieldAccessExpr.class)) {
            if (fa.getRange().isEmpty()) continue;
            Optional<String> qualifier = JavaNodes.dottedName(fa.getScope());
            qualifier.ifPresent(q -> out.add(new JavaNodes.ReferenceNode(fa, this, q, fa.getNameAsString())));
        }
        out.sort(Comparator.comparingInt(SyntaxNode::offset));
        return out;
    }

    @Override
    public List<SyntaxNode> invocations(String targetName, String methodName) {
        List<SyntaxNode> out = new ArrayList<>();
        for (MethodCallExpr mc : cu.findAll(MethodCallExpr.class, m -> m.getNameAsString().equals(methodName))) {
            if (mc.getRange().isEmpty()) continue;
            boolean matches = mc.getScope()
                    .flatMap(JavaNodes::dottedName)
                    .map(n -> n.equals(targetName) || n.endsWith("." + targetName))
                    .orElse(false);
            if (matches) out.add(new JavaNodes.OtherNode(mc, this, NodeKind.INVOCATION));
        }
        out.sort(Comparator.comparingInt(SyntaxNode::offset));
        return out;
    }

    @Override
    public String packageName() {
        return cu.getPackageDeclaration().map(pd -> pd.getNameAsString()).orElse("");
    }

    @Override
    public List<String> imports() {
        List<String> out = new ArrayList<>();
        for (ImportDeclaration id : cu.getImports()) {
            if (id.isStatic()) continue;
            out.add(id.isAsterisk() ? id.getNameAsString() + ".*" : id.getNameAsString());
        }
        return out;
    }

    @Override
    public int lineOf(int offset) {
        return lines.lineOf(offset);
    }
}
