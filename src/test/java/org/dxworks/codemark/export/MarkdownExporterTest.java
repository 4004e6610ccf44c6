package org.dxworks.codemark.export;

import org.dxworks.codemark.CodemarkConfig;
import org.dxworks.codemark.markdown.MarkdownNormalizer;
import org.dxworks.codemark.model.ExportSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MarkdownExporterTest {

    @TempDir
    Path tempDir;

    private Path root;
    private final List<String> warnings = new ArrayList<>();

    @BeforeEach
    void createProject() throws IOException {
        root = tempDir.resolve("shop");
        write("src/App.java", "public class App { // entry\n}\n");
        write("scripts/run.py", "print('hi')  # greet\n");
        write("node_modules/lib/x.js", "var x = 1;\n");
        write("big.sql", "SELECT 1;\n".repeat(10));
    }

    @Test
    void export_AssemblesNormalizedDocument() throws IOException {
        CodemarkConfig config = CodemarkConfig.defaults().withLimits(5, 512).withTableOfContents(false);

        ExportResult result = new MarkdownExporter(config, warnings::add).export(root);

        String expected = "# shop\n"
                + "\n"
                + "## Directory Structure\n"
                + "\n"
                + "```text\n"
                + "shop/\n"
                + "├── scripts/\n"
                + "│   └── run.py\n"
                + "└── src/\n"
                + "    └── App.java\n"
                + "```\n"
                + "\n"
                + "## Files\n"
                + "\n"
                + "### scripts/run.py\n"
                + "\n"
                + "```python\n"
                + "print('hi')\n"
                + "```\n"
                + "\n"
                + "### src/App.java\n"
                + "\n"
                + "```java\n"
                + "public class App {\n"
                + "}\n"
                + "```\n";
        assertEquals(expected, result.getMarkdown());
        assertTrue(warnings.isEmpty());

        ExportSummary summary = result.getSummary();
        assertEquals(2, summary.filesExported);
        assertEquals(1, summary.filesSkipped);
        assertEquals("big.sql", summary.skipped.get(0).path);
        assertEquals(3, summary.totalLines);
        assertEquals("python", summary.files.get(0).grammar);
    }

    @Test
    void export_TableOfContentsLinksEverySection() throws IOException {
        ExportResult result = new MarkdownExporter(CodemarkConfig.defaults(), warnings::add).export(root);

        String markdown = result.getMarkdown();
        assertTrue(markdown.startsWith("# shop\n\n## Table of Contents\n\n"
                + "- [Directory Structure](#directory-structure)\n"
                + "- [Files](#files)\n"
                + "  - [big.sql](#bigsql)\n"
                + "  - [scripts/run.py](#scriptsrunpy)\n"
                + "  - [src/App.java](#srcappjava)\n\n## Directory Structure\n"), markdown);
        assertEquals(markdown, new MarkdownNormalizer().normalize(markdown));
    }

    @Test
    void export_WithoutStrippingKeepsComments() throws IOException {
        CodemarkConfig config = CodemarkConfig.defaults().withStripComments(false).withTableOfContents(false);

        String markdown = new MarkdownExporter(config, warnings::add).export(root).getMarkdown();

        assertTrue(markdown.contains("public class App { // entry\n"));
        assertTrue(markdown.contains("print('hi')  # greet\n"));
    }

    @Test
    void export_LineNumbers() throws IOException {
        CodemarkConfig config = CodemarkConfig.defaults().withLineNumbers(true).withTableOfContents(false);

        String markdown = new MarkdownExporter(config, warnings::add).export(root).getMarkdown();

        assertTrue(markdown.contains("```java\n1 | public class App {\n2 | }\n```\n"), markdown);
    }

    @Test
    void numberLines_PadsToWidestNumber() {
        String content = "x\n".repeat(10);
        String numbered = MarkdownExporter.numberLines(content);
        assertTrue(numbered.startsWith(" 1 | x\n"));
        assertTrue(numbered.endsWith("10 | x\n"));
    }

    @Test
    void fenceFor_OutgrowsBacktickRunsInContent() {
        assertEquals("```", MarkdownExporter.fenceFor("plain"));
        assertEquals("````", MarkdownExporter.fenceFor("Use ```java fences"));
    }

    @Test
    void readSource_DropsByteOrderMark() throws IOException {
        Path file = write("src/Bom.cs", "\uFEFFclass Bom {}\n");
        assertEquals("class Bom {}\n", MarkdownExporter.readSource(file));
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
