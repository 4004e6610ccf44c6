package org.dxworks.codemark;

import org.dxworks.codemark.stripper.CStyleCommentStripper;
import org.dxworks.codemark.stripper.CommentStripper;
import org.dxworks.codemark.stripper.HtmlCommentStripper;
import org.dxworks.codemark.stripper.PassThroughStripper;
import org.dxworks.codemark.stripper.PowerShellCommentStripper;
import org.dxworks.codemark.stripper.PythonCommentStripper;
import org.dxworks.codemark.stripper.SqlCommentStripper;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class GrammarRegistry {

    public static final Grammar DEFAULT_GRAMMAR = Grammar.C_STYLE;

    private static final Map<String, Grammar> BY_EXTENSION;

    static {
        Map<String, Grammar> table = new HashMap<>();
        for (Grammar grammar : Grammar.values()) {
            for (String extension : grammar.getExtensions()) {
                table.put(extension, grammar);
            }
        }
        BY_EXTENSION = Collections.unmodifiableMap(table);
    }

    private GrammarRegistry() {
    }

    /**
     * Looks up the grammar for an extension such as {@code .cs}. Lookup is case-insensitive and
     * tolerates a missing leading dot. Unknown extensions fall back to {@link #DEFAULT_GRAMMAR}.
     */
    public static Grammar forExtension(String extension) {
        String key = normalizeExtension(extension);
        if (key.isEmpty()) {
            return DEFAULT_GRAMMAR;
        }
        return BY_EXTENSION.getOrDefault(key, DEFAULT_GRAMMAR);
    }

    public static boolean isKnownExtension(String extension) {
        return BY_EXTENSION.containsKey(normalizeExtension(extension));
    }

    public static Set<String> knownExtensions() {
        return BY_EXTENSION.keySet();
    }

    public static String extensionOf(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    public static Map<Grammar, CommentStripper> buildStrippers() {
        Map<Grammar, CommentStripper> strippers = new EnumMap<>(Grammar.class);
        for (Grammar grammar : Grammar.values()) {
            strippers.put(grammar, createStripper(grammar));
        }
        return Collections.unmodifiableMap(strippers);
    }

    private static CommentStripper createStripper(Grammar grammar) {
        return switch (grammar) {
            case POWERSHELL_STYLE -> new PowerShellCommentStripper();
            case C_STYLE -> new CStyleCommentStripper();
            case HTML_STYLE -> new HtmlCommentStripper();
            case SQL_STYLE -> new SqlCommentStripper();
            case PYTHON_STYLE -> new PythonCommentStripper();
            case NONE -> new PassThroughStripper();
        };
    }
}
