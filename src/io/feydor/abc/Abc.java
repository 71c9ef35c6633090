package io.feydor.abc;

import io.feydor.abc.fmt.AbcFormatter;
import io.feydor.abc.fmt.FormatterConfig;
import io.feydor.abc.fmt.Stringifier;
import io.feydor.abc.parse.Parser;
import io.feydor.abc.parse.Scanner;
import io.feydor.abc.tree.Expr.FileStructure;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TreeCloner;
import io.feydor.util.FileIo;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * This class represents a parsed ABC document.
 * <p>
 * The source is scanned and parsed once, on construction. The tree keeps rendering the source as written;
 * {@link #format()} works on a copy of it.
 */
public class Abc {
    private static final Logger LOGGER = Logger.getLogger(Abc.class.getName());
    private final String source;
    private final AbcContext context = new AbcContext();
    private final List<Token> tokens;
    private final FileStructure tree;
    public final String filename;

    private Abc(String source, String filename) {
        this.source = source;
        this.filename = filename;
        LOGGER.log(Level.FINE, "Starting to parse {0}...", filename);
        this.tokens = Collections.unmodifiableList(new Scanner(source, context).scanTokens());
        this.tree = new Parser(tokens, context).parse();
        LOGGER.log(Level.FINE, "Finished parsing {0} with {1} diagnostic(s)", new Object[]{filename, context.errors().size()});
    }

    public static Abc parse(String source) {
        return new Abc(source, "<string>");
    }

    public static Abc read(File file) throws IOException {
        return new Abc(FileIo.readString(file), file.getPath());
    }

    public String getSource() {
        return source;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /** @return The tree, or null if the file structure could not be parsed */
    public FileStructure getTree() {
        return tree;
    }

    public boolean isParsed() {
        return tree != null;
    }

    public List<AbcError> getErrors() {
        return context.errors();
    }

    /** Renders the tree as parsed, which reproduces the source. */
    public String stringify() {
        requireTree();
        return new Stringifier().stringify(tree);
    }

    public String format() {
        return format(FormatterConfig.defaults());
    }

    public String format(FormatterConfig config) {
        requireTree();
        var copy = new TreeCloner(context).copy(tree);
        return new AbcFormatter(context, config).format(copy);
    }

    private void requireTree() {
        if (tree == null) {
            String reason = context.errors().isEmpty() ? "" : ": " + context.errors().get(context.errors().size() - 1);
            throw new IllegalStateException("The file " + filename + " could not be parsed" + reason);
        }
    }
}
