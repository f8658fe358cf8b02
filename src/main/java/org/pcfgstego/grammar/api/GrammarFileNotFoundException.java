package org.pcfgstego.grammar.api;

import java.nio.file.Path;

/**
 * The grammar file to load does not exist or is not a regular file.
 */
public class GrammarFileNotFoundException extends GrammarException {

    private final Path path;

    public GrammarFileNotFoundException(Path path) {
        super(GrammarErrorCode.FILE_NOT_FOUND, "Grammar file not found: " + path.toAbsolutePath());
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
