package org.pcfgstego.grammar;

import org.pcfgstego.grammar.api.GrammarErrorCode;
import org.pcfgstego.grammar.api.GrammarException;
import org.pcfgstego.grammar.api.GrammarFileNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads UTF-8 grammar files from disk and hands them to a {@link GrammarParser}.
 */
public final class GrammarLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarLoader.class);

    private final GrammarParser parser;

    public GrammarLoader(GrammarParser parser) {
        this.parser = parser;
    }

    /**
     * Loads and parses a grammar file.
     *
     * @param path The grammar file.
     * @return The parsed grammar.
     * @throws GrammarFileNotFoundException if the file does not exist.
     * @throws GrammarException if the file cannot be read or does not parse.
     */
    public Grammar load(Path path) throws GrammarException {
        if (!Files.isRegularFile(path)) {
            throw new GrammarFileNotFoundException(path);
        }
        final List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GrammarException(GrammarErrorCode.IO_ERROR, "Failed to read grammar file " + path + ": " + e.getMessage(), e);
        }
        LOG.info("Loading grammar from {}", path.toAbsolutePath());
        return parser.parse(lines, path.getFileName().toString());
    }
}
