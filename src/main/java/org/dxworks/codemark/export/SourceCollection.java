package org.dxworks.codemark.export;

import org.dxworks.codemark.model.SkippedFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Files picked for export, relative to {@link #getBaseDirectory()}, plus the ones left out.
 */
public class SourceCollection {

    private final Path baseDirectory;
    private final List<Path> files;
    private final List<SkippedFile> skipped;

    public SourceCollection(Path baseDirectory, List<Path> files, List<SkippedFile> skipped) {
        this.baseDirectory = baseDirectory;
        this.files = List.copyOf(files);
        this.skipped = List.copyOf(skipped);
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public List<Path> getFiles() {
        return files;
    }

    public List<SkippedFile> getSkipped() {
        return skipped;
    }
}
