package io.feydor.abc.fmt;

import io.feydor.abc.AbcContext;
import io.feydor.abc.tree.Expr.ErrorExpr;
import io.feydor.abc.tree.Expr.FileStructure;
import io.feydor.abc.tree.Expr.Tune;
import io.feydor.abc.tree.Expr.TuneBody;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formats the bodies of the tunes in a file.
 * <p>
 * For each system of a tune body, in this order: multi-measure rests are expanded (multi-voice tunes only),
 * whitespace is replaced according to the spacing rules, and the voices are aligned (multi-voice tunes only).
 * Headers, the file header and everything between tunes are left as written.
 * <p>
 * The tree is modified in place. Format a {@link io.feydor.abc.tree.TreeCloner clone} to keep the original.
 */
public class AbcFormatter {
    private static final Logger LOGGER = Logger.getLogger(AbcFormatter.class.getName());
    private final FormatterConfig config;
    private final Stringifier stringifier = new Stringifier();
    private final MultiMeasureRestExpander restExpander;
    private final SpacingResolver spacingResolver;
    private final SystemAligner aligner;

    public AbcFormatter(AbcContext context, FormatterConfig config) {
        this.config = config;
        this.restExpander = new MultiMeasureRestExpander(context);
        this.spacingResolver = new SpacingResolver(context);
        this.aligner = new SystemAligner(context, config.strictAlignment());
    }

    /** Formats every tune of the file and renders the result. */
    public String format(FileStructure file) {
        for (var tune : file.tunes()) {
            formatTune(tune);
        }
        return stringifier.stringify(file);
    }

    public void formatTune(Tune tune) {
        TuneBody body = tune.body();
        if (body == null) {
            return;
        }
        if (!config.formatTunesWithErrors() && containsErrors(body)) {
            LOGGER.log(Level.FINE, "Leaving tune {0} as written, its body has parse errors", tune.id());
            return;
        }

        boolean multiVoice = tune.isMultiVoice();
        for (var system : body.systems()) {
            if (multiVoice) {
                restExpander.expand(system);
            }
            spacingResolver.resolve(system);
            if (multiVoice && config.alignVoices()) {
                aligner.align(system);
            }
        }
    }

    private static boolean containsErrors(TuneBody body) {
        for (var system : body.systems()) {
            for (var node : system) {
                if (node instanceof ErrorExpr || (node instanceof Token token && token.is(TokenType.INVALID))) {
                    return true;
                }
            }
        }
        return false;
    }
}
