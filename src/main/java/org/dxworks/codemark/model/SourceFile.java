package org.dxworks.codemark.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceFile {
    public String path;      // relative to the export root, '/' separated
    public String extension;
    public String grammar;
    public int lines;
    public boolean commentsStripped;
}
