package org.dxworks.codemark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codemark.export.ExportResult;
import org.dxworks.codemark.export.MarkdownExporter;
import org.dxworks.codemark.model.ExportSummary;
import org.dxworks.codemark.model.SkippedFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar codemark.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to source code directory or file");
            System.err.println("  <output-file>:  Path to output Markdown file");
            System.err.println("Options are read from codemark-config.yml in the working directory");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (output.toAbsolutePath().getParent() != null) {
            Files.createDirectories(output.toAbsolutePath().getParent());
        }

        System.out.println("Starting export...");
        System.out.println("Input: " + input.toAbsolutePath());

        CodemarkConfig config = CodemarkConfig.load();
        ExportResult result = export(input, output, config);
        printSummary(result.getSummary(), output);
    }

    public static ExportResult export(Path input, Path output, CodemarkConfig config) throws IOException {
        ExportResult result = new MarkdownExporter(config).export(input);
        Files.writeString(output, result.getMarkdown(), StandardCharsets.UTF_8);
        MAPPER.writeValue(summaryPathFor(output).toFile(), result.getSummary());
        return result;
    }

    static Path summaryPathFor(Path output) {
        return output.resolveSibling(output.getFileName() + ".summary.json");
    }

    private static void printSummary(ExportSummary summary, Path output) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("Export complete!");
        System.out.println("Files exported: " + summary.filesExported + " (" + summary.totalLines + " lines)");
        if (summary.filesSkipped > 0) {
            System.out.println("Files skipped: " + summary.filesSkipped);
            for (SkippedFile skipped : summary.skipped) {
                System.out.println("  - " + skipped.path + ": " + skipped.reason);
            }
        }
        if (summary.warnings > 0) {
            System.out.println("Warnings: " + summary.warnings);
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }
}
