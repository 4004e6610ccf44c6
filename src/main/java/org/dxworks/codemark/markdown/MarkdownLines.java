package org.dxworks.codemark.markdown;

import java.util.List;
import java.util.regex.Pattern;

final class MarkdownLines {

    static final Pattern HEADING = Pattern.compile("^(#+)\\s+(.*)$");
    static final Pattern HEADING_MISSING_SPACE = Pattern.compile("^(#{1,6})([^#\\s].*)$");
    static final Pattern TOP_LEVEL_HEADING = Pattern.compile("^#\\s.*$");

    private MarkdownLines() {
    }

    static List<String> split(String content) {
        return List.of(content.split("\n", -1));
    }

    static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    static boolean isHeading(String line) {
        return HEADING.matcher(line).matches();
    }

    static boolean isBlank(String line) {
        return line.isBlank();
    }
}
