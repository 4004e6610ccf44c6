package org.dxworks.codemark;

import java.util.List;

public enum Grammar {
    POWERSHELL_STYLE("powershell", List.of(".ps1", ".psm1", ".psd1")),
    C_STYLE("c-style", List.of(
            ".cs", ".java", ".js", ".jsx", ".mjs", ".cjs", ".ts", ".tsx",
            ".c", ".h", ".cpp", ".cc", ".cxx", ".hpp",
            ".go", ".rs", ".swift", ".kt", ".kts", ".dart", ".php", ".rb",
            ".css", ".scss", ".less", ".scala", ".groovy")),
    HTML_STYLE("html", List.of(".html", ".htm", ".xml", ".xaml", ".svg", ".csproj", ".props", ".targets", ".resx", ".vue")),
    SQL_STYLE("sql", List.of(".sql")),
    PYTHON_STYLE("python", List.of(".py", ".pyw", ".pyi")),
    NONE("none", List.of(".json", ".yml", ".yaml", ".md", ".markdown", ".toml", ".ini", ".cfg", ".conf", ".txt", ".csv"));

    private final String name;
    private final List<String> extensions;

    Grammar(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }
}
