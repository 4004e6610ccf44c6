package org.dxworks.codemark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

public class CodemarkConfig {

    private static final String CONFIG_FILE_NAME = "codemark-config.yml";

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_FILE_SIZE_KB = 512;
    private static final boolean DEFAULT_STRIP_COMMENTS = true;
    private static final boolean DEFAULT_LINE_NUMBERS = false;
    private static final boolean DEFAULT_DEDUPE_HEADINGS = false;
    private static final boolean DEFAULT_TABLE_OF_CONTENTS = true;
    private static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Set.of(
            ".git", "node_modules", "bin", "obj", "target", "build", "dist",
            ".idea", ".vs", ".vscode", "__pycache__");

    private final int maxFileLines;
    private final int maxFileSizeKb;
    private final boolean stripComments;
    private final boolean lineNumbers;
    private final boolean dedupeHeadings;
    private final boolean tableOfContents;
    private final Set<String> excludedDirectories;

    private CodemarkConfig(int maxFileLines, int maxFileSizeKb, boolean stripComments, boolean lineNumbers,
                           boolean dedupeHeadings, boolean tableOfContents, Set<String> excludedDirectories) {
        this.maxFileLines = maxFileLines;
        this.maxFileSizeKb = maxFileSizeKb;
        this.stripComments = stripComments;
        this.lineNumbers = lineNumbers;
        this.dedupeHeadings = dedupeHeadings;
        this.tableOfContents = tableOfContents;
        this.excludedDirectories = Set.copyOf(excludedDirectories);
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getMaxFileSizeKb() {
        return maxFileSizeKb;
    }

    public boolean isStripComments() {
        return stripComments;
    }

    public boolean isLineNumbers() {
        return lineNumbers;
    }

    public boolean isDedupeHeadings() {
        return dedupeHeadings;
    }

    public boolean isTableOfContents() {
        return tableOfContents;
    }

    public Set<String> getExcludedDirectories() {
        return excludedDirectories;
    }

    public static CodemarkConfig defaults() {
        return new CodemarkConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_FILE_SIZE_KB, DEFAULT_STRIP_COMMENTS,
                DEFAULT_LINE_NUMBERS, DEFAULT_DEDUPE_HEADINGS, DEFAULT_TABLE_OF_CONTENTS, DEFAULT_EXCLUDED_DIRECTORIES);
    }

    public static CodemarkConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodemarkConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + " (" + e.getMessage() + "), using defaults");
        }

        return defaults();
    }

    private static CodemarkConfig fromYaml(YamlConfig yaml) {
        int maxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        int maxFileSizeKb = (yaml.maxFileSizeKb != null && yaml.maxFileSizeKb > 0)
                ? yaml.maxFileSizeKb
                : DEFAULT_MAX_FILE_SIZE_KB;
        Set<String> excluded = yaml.excludedDirectories != null
                ? Set.copyOf(yaml.excludedDirectories)
                : DEFAULT_EXCLUDED_DIRECTORIES;

        return new CodemarkConfig(
                maxFileLines,
                maxFileSizeKb,
                yaml.stripComments != null ? yaml.stripComments : DEFAULT_STRIP_COMMENTS,
                yaml.lineNumbers != null ? yaml.lineNumbers : DEFAULT_LINE_NUMBERS,
                yaml.dedupeHeadings != null ? yaml.dedupeHeadings : DEFAULT_DEDUPE_HEADINGS,
                yaml.tableOfContents != null ? yaml.tableOfContents : DEFAULT_TABLE_OF_CONTENTS,
                excluded);
    }

    public CodemarkConfig withStripComments(boolean stripComments) {
        return new CodemarkConfig(maxFileLines, maxFileSizeKb, stripComments, lineNumbers,
                dedupeHeadings, tableOfContents, excludedDirectories);
    }

    public CodemarkConfig withLineNumbers(boolean lineNumbers) {
        return new CodemarkConfig(maxFileLines, maxFileSizeKb, stripComments, lineNumbers,
                dedupeHeadings, tableOfContents, excludedDirectories);
    }

    public CodemarkConfig withDedupeHeadings(boolean dedupeHeadings) {
        return new CodemarkConfig(maxFileLines, maxFileSizeKb, stripComments, lineNumbers,
                dedupeHeadings, tableOfContents, excludedDirectories);
    }

    public CodemarkConfig withTableOfContents(boolean tableOfContents) {
        return new CodemarkConfig(maxFileLines, maxFileSizeKb, stripComments, lineNumbers,
                dedupeHeadings, tableOfContents, excludedDirectories);
    }

    public CodemarkConfig withLimits(int maxFileLines, int maxFileSizeKb) {
        return new CodemarkConfig(
                maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES,
                maxFileSizeKb > 0 ? maxFileSizeKb : DEFAULT_MAX_FILE_SIZE_KB,
                stripComments, lineNumbers, dedupeHeadings, tableOfContents, excludedDirectories);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxFileSizeKb;
        public Boolean stripComments;
        public Boolean lineNumbers;
        public Boolean dedupeHeadings;
        public Boolean tableOfContents;
        public List<String> excludedDirectories;
    }
}
