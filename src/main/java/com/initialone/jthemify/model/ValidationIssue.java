package com.initialone.jthemify.model;

import java.util.Objects;

public final class ValidationIssue {
    private final String file;
    private final Integer line;
    private final String message;
    private final Severity severity;
    private final String suggestion;

    public ValidationIssue(String file, Integer line, String message, Severity severity, String suggestion) {
        this.file = file;
        this.line = line;
        this.message = Objects.requireNonNull(message, "message");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.suggestion = suggestion;
    }

    public static ValidationIssue error(String file, Integer line, String message, String suggestion) {
        return new ValidationIssue(file, line, message, Severity.ERROR, suggestion);
    }

    public static ValidationIssue warning(String file, Integer line, String message, String suggestion) {
        return new ValidationIssue(file, line, message, Severity.WARNING, suggestion);
    }

    /** May be null for table-level issues */
    public String file() { return file; }

    /** 1-based, null when the issue is not tied to a line */
    public Integer line() { return line; }

    public String message() { return message; }
    public Severity severity() { return severity; }
    public String suggestion() { return suggestion; }

    public String location() {
        if (file == null) return "";
        return line == null ? file : file + ":" + line;
    }

    @Override
    public String toString() {
        String loc = location();
        return severity + (loc.isEmpty() ? "" : " " + loc) + " " + message
                + (suggestion == null ? "" : " (" + suggestion + ")");
    }
}
