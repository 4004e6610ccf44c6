package org.dxworks.codemark.markdown;

import org.dxworks.codemark.Diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;

/**
 * Rewrites an assembled Markdown document into a canonical, lint-friendly form.
 * <p>
 * The passes run in a fixed order and each one is applied on its own: if a pass fails, the
 * buffer produced by the previous passes is kept and a warning is reported. Normalizing an
 * already normalized document returns it unchanged.
 * <p>
 * Heading repair, heading spacing and blank-line collapsing skip fenced code blocks, so blank
 * lines and {@code #} comments inside code are left as they are.
 */
public class MarkdownNormalizer {

    public static final String DEFAULT_TITLE = "# Source Code Export";

    static final int MAX_FENCED_LINE_LENGTH = 120;
    static final int WRAP_WIDTH = 118;

    private static final String TAB_REPLACEMENT = "    ";

    private final List<Pass> passes;
    private final Consumer<String> warnings;

    public MarkdownNormalizer() {
        this(Diagnostics.STDERR);
    }

    public MarkdownNormalizer(Consumer<String> warnings) {
        this(defaultPasses(), warnings);
    }

    MarkdownNormalizer(List<Pass> passes, Consumer<String> warnings) {
        this.passes = List.copyOf(passes);
        this.warnings = warnings;
    }

    public static String normalizeMarkdown(String content) {
        return new MarkdownNormalizer().normalize(content);
    }

    public String normalize(String content) {
        if (content == null) {
            return null;
        }
        String current = content;
        for (Pass pass : passes) {
            current = apply(pass, current);
        }
        return current;
    }

    private String apply(Pass pass, String input) {
        try {
            return pass.rewrite().apply(input);
        } catch (RuntimeException e) {
            warnings.accept("Warning: markdown pass '" + pass.name() + "' failed: " + e + "; pass skipped");
            return input;
        }
    }

    static List<Pass> defaultPasses() {
        return List.of(
                new Pass("whitespace", MarkdownNormalizer::cleanWhitespace),
                new Pass("heading-markers", MarkdownNormalizer::fixHeadingMarkers),
                new Pass("heading-spacing", MarkdownNormalizer::spaceHeadings),
                new Pass("blank-lines", MarkdownNormalizer::collapseBlankLines),
                new Pass("top-level-heading", MarkdownNormalizer::ensureTopLevelHeading),
                new Pass("fenced-line-wrap", MarkdownNormalizer::wrapFencedLines),
                new Pass("trailing-newline", MarkdownNormalizer::ensureTrailingNewline));
    }

    static String cleanWhitespace(String content) {
        String unified = content.replace("\r\n", "\n").replace('\r', '\n');
        List<String> out = new ArrayList<>();
        for (String line : MarkdownLines.split(unified)) {
            out.add(line.replace("\t", TAB_REPLACEMENT).stripTrailing());
        }
        return MarkdownLines.join(out);
    }

    static String fixHeadingMarkers(String content) {
        FenceTracker fences = new FenceTracker();
        List<String> out = new ArrayList<>();
        for (String line : MarkdownLines.split(content)) {
            if (fences.isMarkdownLine(line)) {
                Matcher matcher = MarkdownLines.HEADING_MISSING_SPACE.matcher(line);
                if (matcher.matches()) {
                    line = matcher.group(1) + " " + matcher.group(2);
                }
            }
            out.add(line);
        }
        return MarkdownLines.join(out);
    }

    static String spaceHeadings(String content) {
        List<String> lines = MarkdownLines.split(content);
        FenceTracker fences = new FenceTracker();
        List<String> out = new ArrayList<>(lines.size() + 16);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!fences.isMarkdownLine(line) || !MarkdownLines.isHeading(line)) {
                out.add(line);
                continue;
            }
            if (!out.isEmpty() && !MarkdownLines.isBlank(out.get(out.size() - 1))) {
                out.add("");
            }
            out.add(line);
            if (i + 1 < lines.size()) {
                String next = lines.get(i + 1);
                if (!MarkdownLines.isBlank(next) && !MarkdownLines.isHeading(next)) {
                    out.add("");
                }
            }
        }
        return MarkdownLines.join(out);
    }

    static String collapseBlankLines(String content) {
        FenceTracker fences = new FenceTracker();
        List<String> out = new ArrayList<>();
        for (String line : MarkdownLines.split(content)) {
            boolean markdown = fences.isMarkdownLine(line);
            if (markdown && MarkdownLines.isBlank(line)
                    && !out.isEmpty() && MarkdownLines.isBlank(out.get(out.size() - 1))) {
                continue;
            }
            out.add(line);
        }
        return MarkdownLines.join(out);
    }

    static String ensureTopLevelHeading(String content) {
        List<String> lines = MarkdownLines.split(content);
        int first = 0;
        while (first < lines.size() && MarkdownLines.isBlank(lines.get(first))) {
            first++;
        }
        List<String> out = new ArrayList<>(lines.subList(first, lines.size()));
        if (out.isEmpty() || !MarkdownLines.TOP_LEVEL_HEADING.matcher(out.get(0)).matches()) {
            out.add(0, "");
            out.add(0, DEFAULT_TITLE);
        }
        return MarkdownLines.join(out);
    }

    static String wrapFencedLines(String content) {
        FenceTracker fences = new FenceTracker();
        List<String> out = new ArrayList<>();
        for (String line : MarkdownLines.split(content)) {
            boolean fenceLine = fences.accept(line);
            if (fenceLine || !fences.isInsideFence() || line.length() <= MAX_FENCED_LINE_LENGTH) {
                out.add(line);
                continue;
            }
            List<String> segments = wrap(line, WRAP_WIDTH);
            // a segment reading as a closing fence would end the block early; keep the line whole
            if (segments.stream().anyMatch(fences::wouldClose)) {
                out.add(line);
            } else {
                out.addAll(segments);
            }
        }
        return MarkdownLines.join(out);
    }

    /**
     * Greedy word wrap. Every segment keeps the indentation of the original line; a word longer
     * than the width gets a segment of its own rather than being split.
     */
    static List<String> wrap(String line, int width) {
        int indentEnd = 0;
        while (indentEnd < line.length() && line.charAt(indentEnd) == ' ') {
            indentEnd++;
        }
        String indent = line.substring(0, indentEnd);

        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder(indent);
        boolean empty = true;
        for (String word : line.substring(indentEnd).split(" +")) {
            if (word.isEmpty()) {
                continue;
            }
            if (!empty && current.length() + 1 + word.length() > width) {
                segments.add(current.toString());
                current = new StringBuilder(indent);
                empty = true;
            }
            if (!empty) {
                current.append(' ');
            }
            current.append(word);
            empty = false;
        }
        if (!empty) {
            segments.add(current.toString());
        }
        return segments;
    }

    static String ensureTrailingNewline(String content) {
        return content.stripTrailing() + "\n";
    }

    record Pass(String name, UnaryOperator<String> rewrite) {
    }
}
