package org.dxworks.codemark.markdown;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.codemark.model.HeadingInfo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a table of contents from the headings of a Markdown document and inserts it below
 * the top-level heading. Anchors follow the GitHub convention.
 */
public class TableOfContentsBuilder {

    public static final String TOC_TITLE = "Table of Contents";

    private static final int MIN_LEVEL = 2;
    private static final int MAX_LEVEL = 3;

    private final Parser parser;

    public TableOfContentsBuilder() {
        this.parser = Parser.builder()
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    public List<HeadingInfo> collectHeadings(String markdown) {
        List<HeadingInfo> headings = new ArrayList<>();
        Map<String, Integer> anchors = new HashMap<>();
        parser.parse(markdown).accept(new AbstractVisitor() {
            @Override
            public void visit(Heading heading) {
                HeadingInfo info = new HeadingInfo();
                info.level = heading.getLevel();
                info.text = textOf(heading);
                info.lineIndex = lineIndexOf(heading);
                info.anchor = uniqueAnchor(slugify(info.text), anchors);
                headings.add(info);
            }
        });
        return headings;
    }

    /**
     * Returns the document with a table of contents after its top-level heading. Documents that
     * already have one, or have nothing to list, are returned unchanged.
     */
    public String insert(String markdown) {
        List<HeadingInfo> headings = collectHeadings(markdown);
        if (headings.stream().anyMatch(h -> TOC_TITLE.equals(h.text))) {
            return markdown;
        }

        List<String> entries = new ArrayList<>();
        for (HeadingInfo heading : headings) {
            if (heading.level < MIN_LEVEL || heading.level > MAX_LEVEL) {
                continue;
            }
            String indent = "  ".repeat(heading.level - MIN_LEVEL);
            entries.add(indent + "- [" + escapeLinkText(heading.text) + "](#" + heading.anchor + ")");
        }
        if (entries.isEmpty()) {
            return markdown;
        }

        int insertAt = headings.stream()
                .filter(h -> h.level == 1)
                .findFirst()
                .map(h -> h.lineIndex + 1)
                .orElse(0);

        List<String> lines = new ArrayList<>(MarkdownLines.split(markdown));
        List<String> block = new ArrayList<>();
        block.add("");
        block.add("## " + TOC_TITLE);
        block.add("");
        block.addAll(entries);
        block.add("");
        lines.addAll(Math.min(insertAt, lines.size()), block);
        return MarkdownLines.join(lines);
    }

    static String slugify(String text) {
        StringBuilder slug = new StringBuilder(text.length());
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                slug.append(c);
            } else if (c == ' ') {
                slug.append('-');
            }
        }
        return slug.toString();
    }

    private static String uniqueAnchor(String slug, Map<String, Integer> anchors) {
        Integer count = anchors.get(slug);
        if (count == null) {
            anchors.put(slug, 0);
            return slug;
        }
        anchors.put(slug, count + 1);
        return slug + "-" + (count + 1);
    }

    private static String escapeLinkText(String text) {
        return text.replace("[", "\\[").replace("]", "\\]");
    }

    private static String textOf(Node node) {
        StringBuilder sb = new StringBuilder();
        node.accept(new AbstractVisitor() {
            @Override
            public void visit(Text text) {
                sb.append(text.getLiteral());
            }

            @Override
            public void visit(Code code) {
                sb.append(code.getLiteral());
            }
        });
        return sb.toString().strip();
    }

    private static int lineIndexOf(Heading heading) {
        List<SourceSpan> spans = heading.getSourceSpans();
        return spans.isEmpty() ? 0 : spans.get(0).getLineIndex();
    }
}
