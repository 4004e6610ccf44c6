package org.dxworks.codemark.markdown;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HeadingDisambiguatorTest {

    private final HeadingDisambiguator disambiguator = new HeadingDisambiguator();

    @Test
    void disambiguate_RepeatedHeadingGetsCounter() {
        String input = "## Intro\n\ntext\n\n## Intro\n";
        assertEquals("## Intro\n\ntext\n\n## Intro (1)\n", disambiguator.disambiguate(input));
    }

    @Test
    void disambiguate_CountsAcrossLevels() {
        String input = "# Overview\n\n## Overview\n\n### Overview\n";
        assertEquals("# Overview\n\n## Overview (1)\n\n### Overview (2)\n", disambiguator.disambiguate(input));
    }

    @Test
    void disambiguate_FirstLiteralOccurrenceIsLeftUnchanged() {
        String input = "## A\n## A\n## A (1)\n";
        assertEquals("## A\n## A (1)\n## A (1)\n", disambiguator.disambiguate(input));
    }

    @Test
    void disambiguate_IgnoresHashLinesInsideFences() {
        String input = "## Setup\n\n```sh\n## Setup\n```\n\n## Setup\n";
        assertEquals("## Setup\n\n```sh\n## Setup\n```\n\n## Setup (1)\n", disambiguator.disambiguate(input));
    }

    @Test
    void disambiguate_UniqueHeadingsUnchanged() {
        String input = "# A\n\n## B\n\n## C\n";
        assertEquals(input, HeadingDisambiguator.disambiguateHeadings(input));
    }
}
