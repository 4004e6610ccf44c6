package org.dxworks.codemark.stripper;

/**
 * Scanner state of a single file being stripped. A new instance is created for every
 * {@link LineCommentStripper#strip(String)} call and handed from one line to the next.
 */
public final class LexerState {

    static final char NO_QUOTE = 0;

    boolean inBlockComment;
    /** Quote character of the single-line literal currently open, or {@link #NO_QUOTE}. */
    char quote = NO_QUOTE;
    /** Delimiter of an open Python triple-quoted literal, or null. */
    String tripleQuote;

    public boolean isInBlockComment() {
        return inBlockComment;
    }

    public boolean isInLiteral() {
        return quote != NO_QUOTE || tripleQuote != null;
    }

    void endLine() {
        quote = NO_QUOTE;
    }
}
