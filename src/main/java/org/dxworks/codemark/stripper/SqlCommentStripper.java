package org.dxworks.codemark.stripper;

/**
 * Strips {@code --} and {@code /* ... *}{@code /} comments from SQL scripts.
 * <p>
 * A {@code --} that directly follows {@code ://} is kept: it is most likely part of a URL.
 * The check is textual and does not look at literals.
 */
public class SqlCommentStripper extends LineCommentStripper {

    private static final String URL_SCHEME_SEPARATOR = "://";

    @Override
    public String stripLine(String line, LexerState state) {
        StringBuilder out = new StringBuilder(line.length());
        int i = 0;
        while (i < line.length()) {
            if (state.inBlockComment) {
                int close = line.indexOf("*/", i);
                if (close < 0) {
                    break;
                }
                state.inBlockComment = false;
                i = close + 2;
                continue;
            }

            char c = line.charAt(i);
            if (state.quote != LexerState.NO_QUOTE) {
                // '' inside a literal closes and reopens it, which is all the escaping SQL needs
                i = copyLiteralChar(line, i, state, false, out);
                continue;
            }
            if (c == '\'' || c == '"') {
                state.quote = c;
                out.append(c);
                i++;
                continue;
            }
            if (line.startsWith("/*", i)) {
                state.inBlockComment = true;
                i += 2;
                continue;
            }
            if (line.startsWith("--", i)) {
                if (!followsUrlScheme(line, i)) {
                    break;
                }
                out.append("--");
                i += 2;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    static boolean followsUrlScheme(String line, int dashIndex) {
        int from = dashIndex - URL_SCHEME_SEPARATOR.length();
        return from >= 0 && line.startsWith(URL_SCHEME_SEPARATOR, from);
    }
}
