package com.initialone.jthemify.ast.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.initialone.jthemify.ast.SourceParseException;
import com.initialone.jthemify.ast.SourceParser;
import com.initialone.jthemify.ast.SourceUnit;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link SourceParser} backed by JavaParser. No symbol resolution: references are matched by name only.
 * Not thread-safe, one instance per run.
 */
public class JavaSourceParser implements SourceParser {
    private final JavaParser parser;

    public JavaSourceParser() {
        ParserConfiguration cfg = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setTabSize(1);
        this.parser = new JavaParser(cfg);
    }

    @Override
    public SourceUnit parse(Path path, String text) throws SourceParseException {
        ParseResult<CompilationUnit> res = parser.parse(text);
        if (!res.isSuccessful() || res.getResult().isEmpty()) {
            List<String> problems = res.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.toList());
            throw new SourceParseException("parse failed: " + (path == null ? "<memory>" : path), problems);
        }
        return new SourceUnit(path, text, new JavaSyntaxTree(res.getResult().get(), text));
    }
}
