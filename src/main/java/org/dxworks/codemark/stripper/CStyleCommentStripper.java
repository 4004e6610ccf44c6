package org.dxworks.codemark.stripper;

/**
 * Strips {@code //} and {@code /* ... *}{@code /} comments. Shared by the C family and every
 * language that borrowed its comment syntax (C#, Java, JS/TS, Go, Rust, Kotlin, CSS...).
 */
public class CStyleCommentStripper extends LineCommentStripper {

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
                i = copyLiteralChar(line, i, state, true, out);
                continue;
            }
            if (c == '"' || c == '\'') {
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
            if (line.startsWith("//", i)) {
                break;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }
}
