package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.SourceParseException;
import com.initialone.jthemify.ast.SourceParser;
import com.initialone.jthemify.ast.SourceUnit;
import com.initialone.jthemify.ast.SyntaxNode;
import com.initialone.jthemify.ast.SyntaxTree;
import com.initialone.jthemify.model.ContextAvailability;
import com.initialone.jthemify.model.FileRefactorResult;
import com.initialone.jthemify.model.RefactorRun;
import com.initialone.jthemify.model.ThemeConvention;
import com.initialone.jthemify.model.ValidationIssue;
import com.initialone.jthemify.model.ValidationReport;
import com.initialone.jthemify.util.Tools;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks planned rewrites before they are written. Read-only.
 *
 * Per changed file: the rewritten text must parse (ERROR), the accessor type must be imported
 * when it is used (WARNING), and every accessor call must sit where the handle exists
 * (UNAVAILABLE is an ERROR, REQUIRES_MANUAL a WARNING).
 */
public class RefactorValidator {
    private final SourceParser parser;
    private final ThemeConvention convention;
    private final ContextAnalyzer analyzer;

    public RefactorValidator(SourceParser parser, ThemeConvention convention) {
        this.parser = parser;
        this.convention = convention == null ? ThemeConvention.defaults() : convention;
        this.analyzer = new ContextAnalyzer(this.convention);
    }

    public ValidationReport validate(RefactorRun run) {
        ValidationReport report = ValidationReport.empty();
        for (FileRefactorResult r : run.fileResults()) {
            if (!r.hasChanges()) continue;
            String file = displayName(run.projectRoot(), r.path());
            try {
                report.addAll(validate(file, r.path(), r.rewrittenText()));
            } catch (Throwable t) {
                // 校验本身挂了按 ERROR 算，宁可拦下也不放行
                System.err.println("[validate] " + file + " : " + t);
                report.add(ValidationIssue.error(file, null, "Validation failed: " + t,
                        "Review this file manually or exclude it"));
            }
        }
        return report;
    }

    public List<ValidationIssue> validate(FileRefactorResult result) {
        return validate(displayName(null, result.path()), result.path(), result.rewrittenText());
    }

    public List<ValidationIssue> validate(String file, Path path, String rewrittenText) {
        List<ValidationIssue> issues = new ArrayList<>();
        SourceUnit unit;
        try {
            unit = parser.parse(path, rewrittenText);
        } catch (SourceParseException e) {
            String detail = e.problems().isEmpty() ? "" : ": " + e.problems().get(0);
            issues.add(ValidationIssue.error(file, null, "Modified code contains parse errors" + detail,
                    "Review the transformations for this file"));
            return issues;
        }

        List<SyntaxNode> usages = unit.tree().invocations(convention.accessorType, convention.accessorMethod);
        if (usages.isEmpty()) return issues;

        checkImport(file, unit.tree(), usages, issues);

        for (SyntaxNode call : usages) {
            ContextAssessment a = analyzer.assess(call);
            if (a.availability() == ContextAvailability.UNAVAILABLE) {
                issues.add(ValidationIssue.error(file, call.line(),
                        convention.handleType + " not available: " + String.join(", ", a.reasons()),
                        "Consider using a different approach or keeping the original constant"));
            } else if (a.availability() == ContextAvailability.REQUIRES_MANUAL) {
                issues.add(ValidationIssue.warning(file, call.line(),
                        "Manual intervention required: " + String.join(", ", a.reasons()),
                        "Add a " + convention.handleType + " parameter manually"));
            }
        }
        return issues;
    }

    private void checkImport(String file, SyntaxTree tree, List<SyntaxNode> usages, List<ValidationIssue> issues) {
        String fqn = convention.accessorImport;
        if (fqn == null || fqn.isBlank()) return;
        String pkg = convention.accessorPackage();
        if (pkg.equals(tree.packageName())) return;
        List<String> imports = tree.imports();
        if (imports.contains(fqn) || (!pkg.isEmpty() && imports.contains(pkg + ".*"))) return;

        SyntaxNode firstShortForm = null;
        for (SyntaxNode call : usages) {
            if (!call.text().startsWith(fqn + ".")) {
                firstShortForm = call;
                break;
            }
        }
        if (firstShortForm == null) return;
        issues.add(ValidationIssue.warning(file, firstShortForm.line(),
                "Missing " + convention.accessorType + " import",
                "Add: import " + fqn + ";"));
    }

    static String displayName(Path root, Path file) {
        if (file == null) return "<memory>";
        if (root != null && file.startsWith(root)) return Tools.unixPath(root.relativize(file));
        return file.toString();
    }
}
