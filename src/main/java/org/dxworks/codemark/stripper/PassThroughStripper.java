package org.dxworks.codemark.stripper;

/**
 * Used for data formats that have no comment syntax worth removing (JSON, YAML, Markdown...).
 */
public class PassThroughStripper implements CommentStripper {

    @Override
    public String strip(String content) {
        return content;
    }
}
