package org.dxworks.codemark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void export_WritesDocumentAndSummary() throws IOException {
        Path root = tempDir.resolve("repo");
        Files.createDirectories(root);
        Files.writeString(root.resolve("setup.ps1"), "<#\nhelp\n#>\nWrite-Host \"# hi\" # greet\n");
        Path output = tempDir.resolve("out").resolve("repo.md");
        Files.createDirectories(output.getParent());

        App.export(root, output, CodemarkConfig.defaults());

        String markdown = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(markdown.startsWith("# repo\n"));
        assertTrue(markdown.contains("```powershell\n\n\n\nWrite-Host \"# hi\"\n```"), markdown);

        JsonNode summary = new ObjectMapper().readTree(App.summaryPathFor(output).toFile());
        assertEquals(1, summary.get("files_exported").asInt());
        assertEquals("setup.ps1", summary.get("files").get(0).get("path").asText());
        assertEquals("powershell", summary.get("files").get(0).get("grammar").asText());
    }
}
