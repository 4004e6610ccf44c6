package org.dxworks.codemark.export;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DirectoryTreeRendererTest {

    @Test
    void render_DirectoriesFirstThenFiles() {
        String tree = new DirectoryTreeRenderer().render("project", List.of(
                "README.md",
                "scripts/deploy.ps1",
                "src/app/Main.java",
                "src/app/util.py",
                "src/index.html"));

        String expected = String.join("\n",
                "project/",
                "├── scripts/",
                "│   └── deploy.ps1",
                "├── src/",
                "│   ├── app/",
                "│   │   ├── Main.java",
                "│   │   └── util.py",
                "│   └── index.html",
                "└── README.md",
                "");
        assertEquals(expected, tree);
    }

    @Test
    void render_EmptyTreeIsJustTheRoot() {
        assertEquals("empty/\n", new DirectoryTreeRenderer().render("empty", List.of()));
    }
}
