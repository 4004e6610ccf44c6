package org.dxworks.codemark.export;

import org.dxworks.codemark.model.ExportSummary;

public class ExportResult {

    private final String markdown;
    private final ExportSummary summary;

    public ExportResult(String markdown, ExportSummary summary) {
        this.markdown = markdown;
        this.summary = summary;
    }

    public String getMarkdown() {
        return markdown;
    }

    public ExportSummary getSummary() {
        return summary;
    }
}
