package org.dxworks.codemark.markdown;

import org.dxworks.codemark.Diagnostics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;

/**
 * Makes heading texts unique by appending {@code (n)} to every repeated occurrence.
 * Headings are compared by text only, so {@code # Overview} and {@code ## Overview} collide.
 * Counters are kept per original text; a literal {@code A (1)} is counted on its own.
 */
public class HeadingDisambiguator {

    private final Consumer<String> warnings;

    public HeadingDisambiguator() {
        this(Diagnostics.STDERR);
    }

    public HeadingDisambiguator(Consumer<String> warnings) {
        this.warnings = warnings;
    }

    public static String disambiguateHeadings(String content) {
        return new HeadingDisambiguator().disambiguate(content);
    }

    public String disambiguate(String content) {
        if (content == null) {
            return null;
        }
        try {
            return rewrite(content);
        } catch (RuntimeException e) {
            warnings.accept("Warning: heading disambiguation failed: " + e + "; headings left unchanged");
            return content;
        }
    }

    private static String rewrite(String content) {
        Map<String, Integer> occurrences = new HashMap<>();
        FenceTracker fences = new FenceTracker();
        List<String> out = new ArrayList<>();

        for (String line : MarkdownLines.split(content)) {
            if (!fences.isMarkdownLine(line)) {
                out.add(line);
                continue;
            }
            Matcher matcher = MarkdownLines.HEADING.matcher(line);
            if (!matcher.matches()) {
                out.add(line);
                continue;
            }
            String markers = matcher.group(1);
            String text = matcher.group(2).strip();
            Integer seen = occurrences.get(text);
            if (seen == null) {
                occurrences.put(text, 0);
                out.add(line);
                continue;
            }
            int n = seen + 1;
            occurrences.put(text, n);
            out.add(markers + " " + text + " (" + n + ")");
        }
        return MarkdownLines.join(out);
    }
}
