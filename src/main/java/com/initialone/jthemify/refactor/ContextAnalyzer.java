package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.ConstructorNode;
import com.initialone.jthemify.ast.FixedContextNode;
import com.initialone.jthemify.ast.FunctionNode;
import com.initialone.jthemify.ast.MethodNode;
import com.initialone.jthemify.ast.SyntaxNode;
import com.initialone.jthemify.ast.SyntaxVisitor;
import com.initialone.jthemify.ast.TypeNode;
import com.initialone.jthemify.model.ContextAvailability;
import com.initialone.jthemify.model.ThemeConvention;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether the scope around a node can supply the theme handle.
 *
 * Walks from the node to the nearest enclosing callable (or fixed context) and applies, in order:
 * <ul>
 *   <li>method: static -> REQUIRES_MANUAL; render method of a UI type -> AVAILABLE;
 *       handle parameter -> AVAILABLE; anonymous/local class capturing an available handle -> AVAILABLE;
 *       member of a UI type -> CAN_INJECT; otherwise REQUIRES_MANUAL</li>
 *   <li>function (lambda): handle parameter -> AVAILABLE; otherwise whatever the enclosing callable
 *       provides, since lambdas capture it; with no enclosing callable a non-trivial body -> CAN_INJECT,
 *       a stub -> REQUIRES_MANUAL</li>
 *   <li>constructor: constant-evaluated -> UNAVAILABLE; handle parameter -> AVAILABLE; otherwise REQUIRES_MANUAL</li>
 *   <li>fixed context (static initialization, annotation value, case label) or nothing found -> UNAVAILABLE</li>
 * </ul>
 */
public class ContextAnalyzer {
    private final ThemeConvention convention;
    private final Rules rules = new Rules();

    public ContextAnalyzer(ThemeConvention convention) {
        this.convention = convention == null ? ThemeConvention.defaults() : convention;
    }

    public ContextAvailability analyze(SyntaxNode node) {
        return assess(node).availability();
    }

    public boolean canAutoInject(SyntaxNode node) {
        return analyze(node).canAutoInject();
    }

    /** Empty when the handle is available or can be injected */
    public List<String> manualInterventionReasons(SyntaxNode node) {
        ContextAssessment a = assess(node);
        return a.availability().canAutoInject() ? List.of() : a.reasons();
    }

    public ContextAssessment assess(SyntaxNode node) {
        return nearestScope(node).orElseGet(() -> ContextAssessment.of(ContextAvailability.UNAVAILABLE,
                "not inside any method or constructor, so no " + convention.handleType + " is in scope"));
    }

    /** Empty when the walk reaches the root without finding a deciding node */
    private Optional<ContextAssessment> nearestScope(SyntaxNode start) {
        SyntaxNode cur = start;
        while (cur != null) {
            ContextAssessment a = cur.accept(rules);
            if (a != null) return Optional.of(a);
            cur = cur.parent().orElse(null);
        }
        return Optional.empty();
    }

    boolean isUiType(TypeNode type) {
        String marker = convention.uiTypeMarker;
        if (marker == null || marker.isEmpty()) return false;
        for (String s : type.supertypeNames()) {
            if (s.contains(marker)) return true;
        }
        return false;
    }

    private final class Rules implements SyntaxVisitor<ContextAssessment> {

        @Override
        public ContextAssessment visitMethod(MethodNode m) {
            if (m.isStatic()) {
                return ContextAssessment.of(ContextAvailability.REQUIRES_MANUAL,
                        "declared in a static method (" + m.name() + "), which has no instance-bound " + convention.handleType);
            }
            Optional<TypeNode> owner = m.enclosingType();
            boolean uiOwner = owner.map(ContextAnalyzer.this::isUiType).orElse(false);
            if (m.name().equals(convention.renderMethod) && uiOwner) {
                return ContextAssessment.of(ContextAvailability.AVAILABLE,
                        m.name() + "() of a UI type receives " + convention.handleType);
            }
            if (m.declaresParameterOfType(convention.handleType)) {
                return ContextAssessment.of(ContextAvailability.AVAILABLE,
                        m.name() + "() declares a " + convention.handleType + " parameter");
            }
            if (owner.isPresent() && owner.get().isLocal() && capturesHandle(owner.get())) {
                return ContextAssessment.of(ContextAvailability.AVAILABLE,
                        m.name() + "() captures " + convention.handleType + " from the enclosing scope");
            }
            if (uiOwner) {
                return ContextAssessment.of(ContextAvailability.CAN_INJECT,
                        m.name() + "() belongs to a UI type; a " + convention.handleType + " parameter can be added");
            }
            return ContextAssessment.of(ContextAvailability.REQUIRES_MANUAL,
                    "declared in " + m.name() + "() of a non-UI type without a " + convention.handleType + " parameter");
        }

        @Override
        public ContextAssessment visitFunction(FunctionNode f) {
            if (f.declaresParameterOfType(convention.handleType)) {
                return ContextAssessment.of(ContextAvailability.AVAILABLE,
                        "function declares a " + convention.handleType + " parameter");
            }
            Optional<ContextAssessment> enclosing = f.parent().flatMap(ContextAnalyzer.this::nearestScope);
            if (enclosing.isPresent()) {
                List<String> reasons = new ArrayList<>(enclosing.get().reasons());
                reasons.add("function captures its enclosing scope");
                return new ContextAssessment(enclosing.get().availability(), reasons);
            }
            if (f.hasNonTrivialBody()) {
                return ContextAssessment.of(ContextAvailability.CAN_INJECT,
                        "function body can take a " + convention.handleType + " parameter");
            }
            return ContextAssessment.of(ContextAvailability.REQUIRES_MANUAL, "declared in an empty function");
        }

        @Override
        public ContextAssessment visitConstructor(ConstructorNode c) {
            if (c.isConstantEvaluated()) {
                return ContextAssessment.of(ContextAvailability.UNAVAILABLE,
                        "declared inside a compile-time-constant constructor");
            }
            if (c.declaresParameterOfType(convention.handleType)) {
                return ContextAssessment.of(ContextAvailability.AVAILABLE,
                        "constructor declares a " + convention.handleType + " parameter");
            }
            return ContextAssessment.of(ContextAvailability.REQUIRES_MANUAL,
                    "declared in a constructor without a " + convention.handleType + " parameter");
        }

        @Override
        public ContextAssessment visitType(TypeNode node) {
            return null;
        }

        @Override
        public ContextAssessment visitFixedContext(FixedContextNode node) {
            return ContextAssessment.of(ContextAvailability.UNAVAILABLE, node.reason());
        }

        @Override
        public ContextAssessment visitOther(SyntaxNode node) {
            return null;
        }

        private boolean capturesHandle(TypeNode localType) {
            return localType.parent()
                    .flatMap(ContextAnalyzer.this::nearestScope)
                    .map(a -> a.availability() == ContextAvailability.AVAILABLE)
                    .orElse(false);
        }
    }
}
