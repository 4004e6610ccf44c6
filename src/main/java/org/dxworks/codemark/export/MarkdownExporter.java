package org.dxworks.codemark.export;

import org.dxworks.codemark.CodemarkConfig;
import org.dxworks.codemark.Diagnostics;
import org.dxworks.codemark.GrammarRegistry;
import org.dxworks.codemark.markdown.HeadingDisambiguator;
import org.dxworks.codemark.markdown.MarkdownNormalizer;
import org.dxworks.codemark.markdown.TableOfContentsBuilder;
import org.dxworks.codemark.model.ExportSummary;
import org.dxworks.codemark.model.SkippedFile;
import org.dxworks.codemark.model.SourceFile;
import org.dxworks.codemark.stripper.CommentStripping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Assembles one Markdown document for a source tree: title, directory tree and one fenced
 * section per file, then runs the document through normalization.
 */
public class MarkdownExporter {

    private static final String BOM = "\uFEFF";

    private final CodemarkConfig config;
    private final AtomicInteger warningCount = new AtomicInteger();
    private final CommentStripping stripping;
    private final MarkdownNormalizer normalizer;
    private final HeadingDisambiguator disambiguator;
    private final TableOfContentsBuilder tableOfContents = new TableOfContentsBuilder();
    private final DirectoryTreeRenderer treeRenderer = new DirectoryTreeRenderer();

    public MarkdownExporter(CodemarkConfig config) {
        this(config, Diagnostics.STDERR);
    }

    public MarkdownExporter(CodemarkConfig config, Consumer<String> warnings) {
        this.config = config;
        Consumer<String> counting = message -> {
            warningCount.incrementAndGet();
            warnings.accept(message);
        };
        this.stripping = new CommentStripping(counting);
        this.normalizer = new MarkdownNormalizer(counting);
        this.disambiguator = new HeadingDisambiguator(counting);
    }

    public ExportResult export(Path input) throws IOException {
        Instant startTime = Instant.now();
        warningCount.set(0);

        SourceCollection collection = new SourceCollector(config).collect(input);
        Path base = collection.getBaseDirectory();

        ExportSummary summary = new ExportSummary();
        summary.inputPath = input.toString();
        summary.startedAt = startTime.toString();
        summary.skipped.addAll(collection.getSkipped());

        List<String> exportedPaths = new ArrayList<>();
        StringBuilder sections = new StringBuilder();
        for (Path relative : collection.getFiles()) {
            String path = SourceCollector.relativePath(base, relative);
            String content;
            try {
                content = readSource(base.resolve(relative));
            } catch (IOException e) {
                summary.skipped.add(new SkippedFile(path, "unreadable: " + e.getMessage()));
                continue;
            }

            String extension = GrammarRegistry.extensionOf(relative);
            if (config.isStripComments()) {
                content = stripping.strip(content, extension);
            }
            appendFileSection(sections, path, extension, content);

            SourceFile file = new SourceFile();
            file.path = path;
            file.extension = extension;
            file.grammar = GrammarRegistry.forExtension(extension).getName();
            file.lines = countLines(content);
            file.commentsStripped = config.isStripComments();
            summary.files.add(file);
            summary.totalLines += file.lines;
            exportedPaths.add(path);
        }

        String title = titleOf(input, base);
        StringBuilder document = new StringBuilder();
        document.append("# ").append(title).append("\n\n");
        document.append("## Directory Structure\n\n");
        document.append("```text\n").append(treeRenderer.render(title, exportedPaths)).append("```\n\n");
        document.append("## Files\n\n");
        document.append(sections);

        String markdown = normalizer.normalize(document.toString());
        if (config.isDedupeHeadings()) {
            markdown = disambiguator.disambiguate(markdown);
        }
        if (config.isTableOfContents()) {
            markdown = normalizer.normalize(tableOfContents.insert(markdown));
        }

        Instant endTime = Instant.now();
        summary.endedAt = endTime.toString();
        summary.durationMillis = Duration.between(startTime, endTime).toMillis();
        summary.filesExported = summary.files.size();
        summary.filesSkipped = summary.skipped.size();
        summary.warnings = warningCount.get();
        return new ExportResult(markdown, summary);
    }

    private void appendFileSection(StringBuilder sb, String path, String extension, String content) {
        String body = config.isLineNumbers() ? numberLines(content) : content;
        String fence = fenceFor(body);
        sb.append("### ").append(path).append("\n\n");
        sb.append(fence).append(CodeFenceLanguages.forExtension(extension)).append('\n');
        sb.append(body);
        if (!body.isEmpty() && !body.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(fence).append("\n\n");
    }

    static String readSource(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.startsWith(BOM)) {
            content = content.substring(1);
        }
        return content;
    }

    static String numberLines(String content) {
        if (content.isEmpty()) {
            return content;
        }
        String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        String[] lines = body.split("\r?\n", -1);
        int width = String.valueOf(lines.length).length();
        StringBuilder sb = new StringBuilder(content.length() + lines.length * (width + 3));
        for (int i = 0; i < lines.length; i++) {
            sb.append(String.format("%" + width + "d | ", i + 1)).append(lines[i]).append('\n');
        }
        return sb.toString();
    }

    /**
     * A backtick fence one longer than the longest backtick run in the body, at least three.
     */
    static String fenceFor(String body) {
        int longest = 0;
        int run = 0;
        for (int i = 0; i < body.length(); i++) {
            if (body.charAt(i) == '`') {
                run++;
                longest = Math.max(longest, run);
            } else {
                run = 0;
            }
        }
        return "`".repeat(Math.max(3, longest + 1));
    }

    static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        return body.split("\r?\n", -1).length;
    }

    private static String titleOf(Path input, Path base) {
        Path named = Files.isDirectory(input) ? input.toAbsolutePath().normalize() : base;
        Path fileName = named.getFileName();
        return fileName != null ? fileName.toString() : named.toString();
    }
}
