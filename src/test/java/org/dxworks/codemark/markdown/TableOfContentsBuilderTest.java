package org.dxworks.codemark.markdown;

import org.dxworks.codemark.model.HeadingInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TableOfContentsBuilderTest {

    private final TableOfContentsBuilder builder = new TableOfContentsBuilder();

    @Test
    void collectHeadings_ReadsLevelTextAndLine() {
        List<HeadingInfo> headings = builder.collectHeadings("# Title\n\n## Files\n\n### src/App.java\n");
        assertEquals(3, headings.size());
        assertEquals(1, headings.get(0).level);
        assertEquals("src/App.java", headings.get(2).text);
        assertEquals(4, headings.get(2).lineIndex);
        assertEquals("srcappjava", headings.get(2).anchor);
    }

    @Test
    void collectHeadings_SkipsHashLinesInCode() {
        List<HeadingInfo> headings = builder.collectHeadings("# Title\n\n```\n## not me\n```\n");
        assertEquals(1, headings.size());
    }

    @Test
    void collectHeadings_RepeatedAnchorsGetSuffix() {
        List<HeadingInfo> headings = builder.collectHeadings("## Intro\n\n## Intro\n");
        assertEquals("intro", headings.get(0).anchor);
        assertEquals("intro-1", headings.get(1).anchor);
    }

    @Test
    void insert_PlacesListBelowTitle() {
        String input = "# Title\n\n## Files\n\n### a.cs\n\ntext\n";
        String expected = "# Title\n\n## Table of Contents\n\n- [Files](#files)\n  - [a.cs](#acs)\n\n"
                + "## Files\n\n### a.cs\n\ntext\n";
        assertEquals(expected, new MarkdownNormalizer().normalize(builder.insert(input)));
    }

    @Test
    void insert_NothingToListLeavesDocumentUnchanged() {
        String input = "# Title\n\ntext\n";
        assertEquals(input, builder.insert(input));
    }

    @Test
    void insert_IsNotRepeated() {
        String once = builder.insert("# Title\n\n## Files\n");
        assertEquals(once, builder.insert(once));
    }

    @Test
    void slugify_FollowsGithubRules() {
        assertEquals("hello-world-2", TableOfContentsBuilder.slugify("Hello, World (2)"));
        assertEquals("my_file-v1", TableOfContentsBuilder.slugify("my_file v1"));
    }
}
