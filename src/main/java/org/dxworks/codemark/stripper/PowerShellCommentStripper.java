package org.dxworks.codemark.stripper;

/**
 * Strips {@code #} line comments and {@code <# ... #>} block comments from PowerShell scripts.
 * A {@code #} directly after {@code [} is kept so type attribute syntax survives.
 */
public class PowerShellCommentStripper extends LineCommentStripper {

    private static final String BLOCK_OPEN = "<#";
    private static final String BLOCK_CLOSE = "#>";

    @Override
    public String stripLine(String line, LexerState state) {
        int i = 0;
        if (state.inBlockComment) {
            int close = line.indexOf(BLOCK_CLOSE);
            if (close < 0) {
                return "";
            }
            state.inBlockComment = false;
            i = close + BLOCK_CLOSE.length();
        }

        StringBuilder out = new StringBuilder(line.length());
        while (i < line.length()) {
            char c = line.charAt(i);

            if (state.quote != LexerState.NO_QUOTE) {
                // single-quoted strings are verbatim in PowerShell
                i = copyLiteralChar(line, i, state, state.quote == '"', out);
                continue;
            }

            if (c == '"' || c == '\'') {
                state.quote = c;
                out.append(c);
                i++;
                continue;
            }

            if (line.startsWith(BLOCK_OPEN, i)) {
                int close = line.indexOf(BLOCK_CLOSE, i + BLOCK_OPEN.length());
                if (close < 0) {
                    state.inBlockComment = true;
                    break;
                }
                i = close + BLOCK_CLOSE.length();
                continue;
            }

            if (c == '#' && (i == 0 || line.charAt(i - 1) != '[')) {
                break;
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }
}
