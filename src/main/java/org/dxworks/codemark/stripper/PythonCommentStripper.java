package org.dxworks.codemark.stripper;

/**
 * Strips {@code #} comments from Python sources. Triple-quoted literals may span lines and
 * suspend comment detection until they close.
 */
public class PythonCommentStripper extends LineCommentStripper {

    private static final String TRIPLE_DOUBLE = "\"\"\"";
    private static final String TRIPLE_SINGLE = "'''";

    @Override
    public String stripLine(String line, LexerState state) {
        StringBuilder out = new StringBuilder(line.length());
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);

            if (state.tripleQuote != null) {
                if (c == '\\' && i + 1 < line.length()) {
                    out.append(c).append(line.charAt(i + 1));
                    i += 2;
                } else if (line.startsWith(state.tripleQuote, i)) {
                    out.append(state.tripleQuote);
                    i += state.tripleQuote.length();
                    state.tripleQuote = null;
                } else {
                    out.append(c);
                    i++;
                }
                continue;
            }

            if (state.quote != LexerState.NO_QUOTE) {
                i = copyLiteralChar(line, i, state, true, out);
                continue;
            }

            String triple = tripleQuoteAt(line, i);
            if (triple != null) {
                state.tripleQuote = triple;
                out.append(triple);
                i += triple.length();
                continue;
            }
            if (c == '"' || c == '\'') {
                state.quote = c;
                out.append(c);
                i++;
                continue;
            }
            if (c == '#') {
                break;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static String tripleQuoteAt(String line, int i) {
        if (line.startsWith(TRIPLE_DOUBLE, i)) {
            return TRIPLE_DOUBLE;
        }
        if (line.startsWith(TRIPLE_SINGLE, i)) {
            return TRIPLE_SINGLE;
        }
        return null;
    }
}
