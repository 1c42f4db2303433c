package com.initialone.jthemify.ast;

import java.util.List;

public class SourceParseException extends Exception {
    private final List<String> problems;

    public SourceParseException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + problems.get(0)));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
