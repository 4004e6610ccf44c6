package org.dxworks.codemark.export;

import org.dxworks.codemark.CodemarkConfig;
import org.dxworks.codemark.GrammarRegistry;
import org.dxworks.codemark.model.SkippedFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

public class SourceCollector {

    private final CodemarkConfig config;

    public SourceCollector(CodemarkConfig config) {
        this.config = config;
    }

    public SourceCollection collect(Path input) throws IOException {
        Path root = input.toAbsolutePath().normalize();
        List<Path> candidates = new ArrayList<>();
        Path base;

        if (Files.isDirectory(root)) {
            base = root;
            try (Stream<Path> stream = Files.walk(root)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> !isInExcludedDirectory(root.relativize(p)))
                      .filter(p -> GrammarRegistry.isKnownExtension(GrammarRegistry.extensionOf(p)))
                      .forEach(candidates::add);
            }
        } else if (Files.isRegularFile(root)) {
            base = root.getParent();
            candidates.add(root);
        } else {
            throw new IOException("Not a file or directory: " + root);
        }

        candidates.sort(Comparator.comparing(p -> relativePath(base, p)));

        List<Path> files = new ArrayList<>();
        List<SkippedFile> skipped = new ArrayList<>();
        for (Path candidate : candidates) {
            String reason = rejectionReason(candidate);
            if (reason == null) {
                files.add(base.relativize(candidate));
            } else {
                skipped.add(new SkippedFile(relativePath(base, candidate), reason));
            }
        }
        return new SourceCollection(base, files, skipped);
    }

    public static String relativePath(Path base, Path file) {
        Path relative = file.isAbsolute() ? base.relativize(file) : file;
        return relative.toString().replace('\\', '/');
    }

    private boolean isInExcludedDirectory(Path relative) {
        // the last element is the file itself
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (config.getExcludedDirectories().contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    private String rejectionReason(Path file) throws IOException {
        long limitBytes = config.getMaxFileSizeKb() * 1024L;
        long size = Files.size(file);
        if (size > limitBytes) {
            return "larger than " + config.getMaxFileSizeKb() + " KB (" + size + " bytes)";
        }
        if (!withinMaxLines(file, config.getMaxFileLines())) {
            return "more than " + config.getMaxFileLines() + " lines";
        }
        return null;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable content is reported when the file is read for export
            return true;
        }
    }
}
