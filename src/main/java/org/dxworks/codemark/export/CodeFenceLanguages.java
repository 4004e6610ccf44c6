package org.dxworks.codemark.export;

import java.util.Map;

/**
 * Info strings used on code fences so renderers pick the right highlighter.
 */
final class CodeFenceLanguages {

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".ps1", "powershell"),
            Map.entry(".psm1", "powershell"),
            Map.entry(".psd1", "powershell"),
            Map.entry(".cs", "csharp"),
            Map.entry(".java", "java"),
            Map.entry(".js", "javascript"),
            Map.entry(".jsx", "jsx"),
            Map.entry(".mjs", "javascript"),
            Map.entry(".cjs", "javascript"),
            Map.entry(".ts", "typescript"),
            Map.entry(".tsx", "tsx"),
            Map.entry(".c", "c"),
            Map.entry(".h", "c"),
            Map.entry(".cpp", "cpp"),
            Map.entry(".cc", "cpp"),
            Map.entry(".cxx", "cpp"),
            Map.entry(".hpp", "cpp"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".swift", "swift"),
            Map.entry(".kt", "kotlin"),
            Map.entry(".kts", "kotlin"),
            Map.entry(".dart", "dart"),
            Map.entry(".php", "php"),
            Map.entry(".rb", "ruby"),
            Map.entry(".css", "css"),
            Map.entry(".scss", "scss"),
            Map.entry(".less", "less"),
            Map.entry(".scala", "scala"),
            Map.entry(".groovy", "groovy"),
            Map.entry(".html", "html"),
            Map.entry(".htm", "html"),
            Map.entry(".vue", "vue"),
            Map.entry(".xml", "xml"),
            Map.entry(".xaml", "xml"),
            Map.entry(".svg", "xml"),
            Map.entry(".csproj", "xml"),
            Map.entry(".props", "xml"),
            Map.entry(".targets", "xml"),
            Map.entry(".resx", "xml"),
            Map.entry(".sql", "sql"),
            Map.entry(".py", "python"),
            Map.entry(".pyw", "python"),
            Map.entry(".pyi", "python"),
            Map.entry(".json", "json"),
            Map.entry(".yml", "yaml"),
            Map.entry(".yaml", "yaml"),
            Map.entry(".md", "markdown"),
            Map.entry(".markdown", "markdown"),
            Map.entry(".toml", "toml"),
            Map.entry(".ini", "ini"),
            Map.entry(".cfg", "ini"),
            Map.entry(".conf", "ini"),
            Map.entry(".txt", "text"),
            Map.entry(".csv", "csv"));

    private CodeFenceLanguages() {
    }

    static String forExtension(String extension) {
        return BY_EXTENSION.getOrDefault(extension, "text");
    }
}
