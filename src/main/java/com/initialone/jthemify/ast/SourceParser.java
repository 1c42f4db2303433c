package com.initialone.jthemify.ast;

import java.nio.file.Path;

public interface SourceParser {

    /**
     * @param path used for diagnostics only, may be null
     */
    SourceUnit parse(Path path, String text) throws SourceParseException;
}
