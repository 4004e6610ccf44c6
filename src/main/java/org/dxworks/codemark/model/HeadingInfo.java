package org.dxworks.codemark.model;

public class HeadingInfo {
    public int level;
    public String text;
    public int lineIndex; // zero-based line of the heading in the document
    public String anchor;
}
