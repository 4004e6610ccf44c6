package org.dxworks.codemark.markdown;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows fenced code blocks line by line. A run of three or more backticks or tildes opens a
 * fence; it is closed by a run of the same character that is at least as long and carries no
 * info string.
 */
final class FenceTracker {

    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,})(.*)$");

    private boolean inFence;
    private char fenceChar;
    private int fenceLength;

    /**
     * Feeds the next line of the document.
     *
     * @return true if the line opened or closed a fence
     */
    boolean accept(String line) {
        Matcher matcher = FENCE.matcher(line);
        if (!matcher.matches()) {
            return false;
        }
        String marker = matcher.group(1);
        String info = matcher.group(2);
        char markerChar = marker.charAt(0);

        if (!inFence) {
            if (markerChar == '`' && info.indexOf('`') >= 0) {
                return false;
            }
            inFence = true;
            fenceChar = markerChar;
            fenceLength = marker.length();
            return true;
        }
        if (isClosingMarker(markerChar, marker.length(), info)) {
            inFence = false;
            fenceChar = 0;
            fenceLength = 0;
            return true;
        }
        return false;
    }

    /**
     * Tells whether the line would close the currently open fence, without feeding it.
     */
    boolean wouldClose(String line) {
        if (!inFence) {
            return false;
        }
        Matcher matcher = FENCE.matcher(line);
        return matcher.matches()
                && isClosingMarker(matcher.group(1).charAt(0), matcher.group(1).length(), matcher.group(2));
    }

    private boolean isClosingMarker(char markerChar, int markerLength, String info) {
        return markerChar == fenceChar && markerLength >= fenceLength && info.isBlank();
    }

    boolean isInsideFence() {
        return inFence;
    }

    /**
     * Feeds the line and tells whether it is plain Markdown: neither a fence delimiter nor part
     * of a fenced block.
     */
    boolean isMarkdownLine(String line) {
        boolean fenceLine = accept(line);
        return !fenceLine && !inFence;
    }
}
