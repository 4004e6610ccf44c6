package org.dxworks.codemark.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExportSummary {
    public String inputPath;
    public String startedAt;
    public String endedAt;
    public long durationMillis;
    public int filesExported;
    public int filesSkipped;
    public long totalLines;
    public int warnings;
    public List<SourceFile> files = new ArrayList<>();
    public List<SkippedFile> skipped = new ArrayList<>();
}
