package org.dxworks.codemark.stripper;

public interface CommentStripper {
    String strip(String content);
}
