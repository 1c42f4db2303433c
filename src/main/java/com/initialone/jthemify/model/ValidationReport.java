package com.initialone.jthemify.model;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class ValidationReport {
    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    public static ValidationReport empty() {
        return new ValidationReport();
    }

    public ValidationReport add(ValidationIssue issue) {
        switch (issue.severity()) {
            case ERROR:
                errors.add(issue);
                break;
            case WARNING:
                warnings.add(issue);
                break;
            default:
                throw new IllegalStateException("unknown severity " + issue.severity());
        }
        return this;
    }

    public ValidationReport addAll(Collection<ValidationIssue> issues) {
        issues.forEach(this::add);
        return this;
    }

    public List<ValidationIssue> errors() { return List.copyOf(errors); }
    public List<ValidationIssue> warnings() { return List.copyOf(warnings); }

    public boolean isValid() { return errors.isEmpty(); }
    public boolean isClean() { return errors.isEmpty() && warnings.isEmpty(); }

    public void print(PrintStream out, String tag) {
        for (ValidationIssue e : errors) {
            out.println(tag + " ERROR " + e.location() + " " + e.message());
            if (e.suggestion() != null) out.println(tag + "       hint: " + e.suggestion());
        }
        for (ValidationIssue w : warnings) {
            out.println(tag + " WARN  " + w.location() + " " + w.message());
            if (w.suggestion() != null) out.println(tag + "       hint: " + w.suggestion());
        }
        if (isClean()) {
            out.println(tag + " no issues found");
        } else {
            out.println(tag + " errors=" + errors.size() + " warnings=" + warnings.size());
        }
    }
}
