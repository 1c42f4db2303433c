package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.SourceUnit;
import com.initialone.jthemify.model.ContextAvailability;
import com.initialone.jthemify.model.FileRefactorResult;
import com.initialone.jthemify.model.ThemeConvention;
import com.initialone.jthemify.model.Transformation;
import com.initialone.jthemify.model.TransformationKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns resolved references into text edits and splices them into the original text.
 *
 * Edits are checked against the text first (bounds, expected old text, overlap) and then
 * applied from the highest offset down, so no edit shifts the offsets of one not yet applied.
 * Availability is recorded on every edit but never filters: the validator reports it.
 */
public class TransformationEngine {
    private final ThemeConvention convention;
    private final ContextAnalyzer analyzer;

    public TransformationEngine(ThemeConvention convention) {
        this(convention, new ContextAnalyzer(convention));
    }

    public TransformationEngine(ThemeConvention convention, ContextAnalyzer analyzer) {
        this.convention = convention == null ? ThemeConvention.defaults() : convention;
        this.analyzer = analyzer;
    }

    /** One transformation per STRICT or EXTENSION reference, ascending offset */
    public List<Transformation> plan(List<SymbolReference> references) {
        List<Transformation> out = new ArrayList<>();
        for (SymbolReference ref : references) {
            Resolution r = ref.resolution();
            if (!r.isRewrite()) continue;
            ContextAvailability availability = analyzer == null ? null : analyzer.analyze(ref.node());
            out.add(new Transformation(ref.offset(), ref.length(), ref.text(), replacementFor(r),
                    kindOf(r), describe(r), availability));
        }
        out.sort(Comparator.comparingInt(Transformation::offset));
        return out;
    }

    /** Theme.of(context).colorScheme.primary, Theme.of(context).extension(BrandColors.class).accent */
    public String replacementFor(Resolution r) {
        switch (r.kind()) {
            case STRICT:
                return convention.accessorExpression() + "." + r.target();
            case EXTENSION:
                return convention.accessorExpression() + "." + convention.extensionLookup
                        + "(" + r.group() + ".class)." + r.target();
            default:
                throw new IllegalArgumentException("not a rewrite: " + r);
        }
    }

    /**
     * Plans and applies the edits for one unit.
     *
     * @throws OverlappingTransformationException when two references claim the same chars
     */
    public FileRefactorResult rewrite(SourceUnit unit, List<SymbolReference> references) {
        List<Transformation> edits = check(unit.text(), plan(references));
        return new FileRefactorResult(unit.path(), unit.text(), splice(unit.text(), edits), edits);
    }

    /**
     * Applies arbitrary edits to {@code text}. The input text is not touched;
     * an empty edit list returns it unchanged.
     */
    public String apply(String text, List<Transformation> transformations) {
        return splice(text, check(text, transformations));
    }

    /**
     * Sorts ascending, merges exact duplicates and rejects edits that fall outside the text,
     * do not match it, or overlap each other.
     */
    public List<Transformation> check(String text, List<Transformation> transformations) {
        List<Transformation> sorted = new ArrayList<>(transformations);
        sorted.sort(Comparator.comparingInt(Transformation::offset).thenComparingInt(Transformation::length));

        List<Transformation> out = new ArrayList<>();
        for (Transformation t : sorted) {
            if (t.end() > text.length()) {
                throw new IllegalArgumentException("transformation [" + t.offset() + "," + t.end()
                        + ") outside text of length " + text.length());
            }
            String actual = text.substring(t.offset(), t.end());
            if (!actual.equals(t.oldText())) {
                throw new IllegalArgumentException("text at " + t.offset() + " is '" + actual
                        + "', expected '" + t.oldText() + "'");
            }
            if (!out.isEmpty()) {
                Transformation prev = out.get(out.size() - 1);
                if (prev.sameEdit(t)) continue;
                // 已保留的编辑互不重叠且升序，只可能和最后一个冲突
                if (prev.overlaps(t) || prev.offset() == t.offset()) {
                    throw new OverlappingTransformationException(prev, t);
                }
            }
            out.add(t);
        }
        return out;
    }

    private static String splice(String text, List<Transformation> ascending) {
        StringBuilder sb = new StringBuilder(text);
        for (int i = ascending.size() - 1; i >= 0; i--) {
            Transformation t = ascending.get(i);
            sb.replace(t.offset(), t.end(), t.newText());
        }
        return sb.toString();
    }

    private static TransformationKind kindOf(Resolution r) {
        return r.kind() == ResolutionKind.STRICT ? TransformationKind.STRICT : TransformationKind.EXTENSION;
    }

    private static String describe(Resolution r) {
        String d = r.kind() == ResolutionKind.STRICT
                ? "Map to " + r.target()
                : "Map to " + r.group() + "." + r.target();
        return r.note() == null ? d : d + " (" + r.note() + ")";
    }
}
