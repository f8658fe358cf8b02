package org.pcfgstego.codec.search;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads candidate messages for {@link KeySearchEngine}, one per line.
 */
public final class Wordlists {

    private Wordlists() {}

    /**
     * Blank lines and lines starting with {@code #} are skipped; surrounding whitespace is removed.
     *
     * @param path A UTF-8 text file.
     * @return The candidate messages in file order.
     * @throws IOException if the file cannot be read.
     */
    public static List<String> load(Path path) throws IOException {
        try (var lines = Files.lines(path, StandardCharsets.UTF_8)) {
            return lines.map(String::strip)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .toList();
        }
    }
}
