package org.dxworks.codemark.stripper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlCommentStripperTest {

    private final HtmlCommentStripper stripper = new HtmlCommentStripper();

    @Test
    void strip_InlineComment() {
        assertEquals("<p>a  b</p>", stripper.strip("<p>a <!-- x --> b</p>"));
    }

    @Test
    void strip_MultiLineCommentKeepsLineCount() {
        String input = "<div>\n<!-- one\ntwo\nthree --><span/>\n</div>";
        String stripped = stripper.strip(input);
        assertEquals("<div>\n\n\n<span/>\n</div>", stripped);
        assertEquals(input.split("\n", -1).length, stripped.split("\n", -1).length);
    }

    @Test
    void strip_SeveralCommentsOnOneLine() {
        assertEquals("ab c", stripper.strip("a<!-- 1 -->b <!-- 2 -->c"));
    }
}
