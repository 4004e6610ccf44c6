package org.dxworks.codemark.stripper;

/**
 * Removes {@code <!-- ... -->} comments from markup. Lines inside a multi-line comment become
 * blank lines so the output keeps the line count of the input.
 */
public class HtmlCommentStripper extends LineCommentStripper {

    private static final String OPEN = "<!--";
    private static final String CLOSE = "-->";

    @Override
    public String stripLine(String line, LexerState state) {
        StringBuilder out = new StringBuilder(line.length());
        int i = 0;
        while (i < line.length()) {
            if (state.inBlockComment) {
                int close = line.indexOf(CLOSE, i);
                if (close < 0) {
                    break;
                }
                state.inBlockComment = false;
                i = close + CLOSE.length();
                continue;
            }
            int open = line.indexOf(OPEN, i);
            if (open < 0) {
                out.append(line, i, line.length());
                break;
            }
            out.append(line, i, open);
            state.inBlockComment = true;
            i = open + OPEN.length();
        }
        return out.toString();
    }
}
