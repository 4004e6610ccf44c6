package org.dxworks.codemark.stripper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CStyleCommentStripperTest {

    private final CStyleCommentStripper stripper = new CStyleCommentStripper();

    @Test
    void strip_LineComment() {
        assertEquals("int a = 1;", stripper.strip("int a = 1; // one"));
    }

    @Test
    void strip_CommentMarkersInsideStringsAreKept() {
        String line = "String s = \"// not /* a */ comment\";";
        assertEquals(line, stripper.strip(line));
    }

    @Test
    void strip_EscapedQuoteDoesNotCloseString() {
        String line = "var s = \"a \\\" // b\";";
        assertEquals(line, stripper.strip(line));
    }

    @Test
    void strip_CharLiteralWithSlash() {
        assertEquals("char c = '/'; char d = '\\'';", stripper.strip("char c = '/'; char d = '\\''; // chars"));
    }

    @Test
    void strip_InlineBlockComment() {
        assertEquals("int a  = 1;", stripper.strip("int a /* first */ = 1;"));
    }

    @Test
    void strip_BlockCommentAcrossLines() {
        String input = "a();\n/* one\ntwo\nthree */ b();\nc();";
        assertEquals("a();\n\n\n b();\nc();", stripper.strip(input));
    }

    @Test
    void strip_UnterminatedBlockCommentBlanksRemainingLines() {
        String input = "class A {}\n/* never closed\nclass B {}\nclass C {}\n";
        assertEquals("class A {}\n\n\n\n", stripper.strip(input));
    }

    @Test
    void strip_QuoteStateDoesNotLeakToNextLine() {
        String input = "fn f<'a>(x: &'a str) {}\nlet y = 1; // note";
        assertEquals("fn f<'a>(x: &'a str) {}\nlet y = 1;", stripper.strip(input));
    }

    @Test
    void strip_KeepsCrLfSeparators() {
        assertEquals("a\r\nb\r\n", stripper.strip("a // x\r\nb\r\n"));
    }
}
