package com.userstats.platform.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line on spaces. A double quote toggles quoted mode, in which spaces are kept as
 * content; the quote characters themselves are dropped. Empty tokens are never emitted and an
 * unmatched quote simply stays open until the end of the line.
 */
public final class LineTokenizer {

    private static final char QUOTE = '"';
    private static final char SEPARATOR = ' ';

    private LineTokenizer() {
    }

    public static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        if (line == null || line.isEmpty()) {
            return tokens;
        }

        StringBuilder buffer = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == QUOTE) {
                quoted = !quoted;
            } else if (ch == SEPARATOR && !quoted) {
                flush(buffer, tokens);
            } else {
                buffer.append(ch);
            }
        }
        flush(buffer, tokens);
        return tokens;
    }

    private static void flush(StringBuilder buffer, List<String> tokens) {
        if (buffer.length() > 0) {
            tokens.add(buffer.toString());
            buffer.setLength(0);
        }
    }
}
