package org.dxworks.codemark.stripper;

/**
 * Base for the line-oriented strippers. One input line always yields exactly one output line,
 * blank when a comment consumed all of it. Trailing whitespace is trimmed except on lines
 * that end inside a multi-line literal.
 */
public abstract class LineCommentStripper implements CommentStripper {

    private static final String CRLF = "\r\n";
    private static final String LF = "\n";

    @Override
    public String strip(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        String separator = content.contains(CRLF) ? CRLF : LF;
        String[] lines = content.split("\r?\n", -1);

        LexerState state = new LexerState();
        StringBuilder sb = new StringBuilder(content.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append(separator);
            }
            String stripped = stripLine(lines[i], state);
            state.endLine();
            // a line ending inside a multi-line literal keeps its trailing spaces
            sb.append(state.isInLiteral() ? stripped : stripped.stripTrailing());
        }
        return sb.toString();
    }

    /**
     * Removes the comment parts of one line. Block comment and multi-line literal state is read
     * from and written back to {@code state}.
     */
    public abstract String stripLine(String line, LexerState state);

    /**
     * Copies one character of an open single-line literal starting at {@code i} and returns the
     * index of the next character to scan. Closes the literal on its unescaped quote.
     */
    static int copyLiteralChar(String line, int i, LexerState state, boolean backslashEscapes, StringBuilder out) {
        char c = line.charAt(i);
        out.append(c);
        if (backslashEscapes && c == '\\' && i + 1 < line.length()) {
            out.append(line.charAt(i + 1));
            return i + 2;
        }
        if (c == state.quote) {
            state.quote = LexerState.NO_QUOTE;
        }
        return i + 1;
    }
}
