package org.pcfgstego.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the right-hand side of a rule into tokens.
 * <p>
 * Tokens are separated by whitespace. A token written in double quotes is a literal terminal and
 * may contain spaces; the quotes are not part of its surface text.
 */
public final class Tokens {

    private Tokens() {}

    /**
     * Splits an alternative into its raw tokens, keeping quotes on quoted literals.
     *
     * @param alternative The alternative text as written in the grammar.
     * @return The raw tokens in order.
     * @throws IllegalArgumentException if a quoted literal is not closed.
     */
    public static List<String> split(String alternative) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int n = alternative.length();
        while (i < n) {
            char c = alternative.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '"') {
                int close = alternative.indexOf('"', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated quoted literal: " + alternative.substring(i));
                }
                tokens.add(alternative.substring(i, close + 1));
                i = close + 1;
            } else {
                int start = i;
                while (i < n && !Character.isWhitespace(alternative.charAt(i))) i++;
                tokens.add(alternative.substring(start, i));
            }
        }
        return tokens;
    }

    /**
     * @param token A raw token.
     * @return {@code true} if the token is a quoted literal.
     */
    public static boolean isQuoted(String token) {
        return token.length() >= 2 && token.charAt(0) == '"' && token.charAt(token.length() - 1) == '"';
    }

    /**
     * Returns the text a token contributes to a generated sentence.
     *
     * @param token A raw token.
     * @return The token without surrounding quotes.
     */
    public static String surface(String token) {
        return isQuoted(token) ? token.substring(1, token.length() - 1) : token;
    }
}
