package org.dxworks.codemark.model;

public class SkippedFile {
    public String path;
    public String reason;

    public SkippedFile() {
    }

    public SkippedFile(String path, String reason) {
        this.path = path;
        this.reason = reason;
    }
}
