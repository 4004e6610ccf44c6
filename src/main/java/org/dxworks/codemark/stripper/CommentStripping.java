package org.dxworks.codemark.stripper;

import org.dxworks.codemark.Diagnostics;
import org.dxworks.codemark.Grammar;
import org.dxworks.codemark.GrammarRegistry;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Entry point for comment removal: picks the stripper for a file extension and runs it.
 * Never throws; when a stripper fails the original content is returned and a warning is
 * reported to the listener.
 */
public class CommentStripping {

    private static final CommentStripping DEFAULT = new CommentStripping();

    private final Map<Grammar, CommentStripper> strippers;
    private final Consumer<String> warnings;

    public CommentStripping() {
        this(Diagnostics.STDERR);
    }

    public CommentStripping(Consumer<String> warnings) {
        this(GrammarRegistry.buildStrippers(), warnings);
    }

    CommentStripping(Map<Grammar, CommentStripper> strippers, Consumer<String> warnings) {
        this.strippers = strippers;
        this.warnings = warnings;
    }

    public static String stripComments(String content, String extension) {
        return DEFAULT.strip(content, extension);
    }

    public String strip(String content, String extension) {
        if (content == null) {
            return null;
        }
        Grammar grammar = GrammarRegistry.forExtension(extension);
        try {
            return strippers.get(grammar).strip(content);
        } catch (RuntimeException e) {
            warnings.accept("Warning: failed to strip comments (" + grammar.getName() + " grammar, extension '"
                    + extension + "'): " + e + "; keeping original content");
            return content;
        }
    }
}
