package io.feydor.abc.fmt;

import io.feydor.abc.AbcContext;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.BarLine;
import io.feydor.abc.tree.Expr.MultiMeasureRest;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites {@code Z4} as {@code Z|Z|Z|Z} so every voice has one bar per measure and bars can be compared
 * across voices. The new rests and barlines keep the position of the rest they replace.
 */
public class MultiMeasureRestExpander {
    private static final Logger LOGGER = Logger.getLogger(MultiMeasureRestExpander.class.getName());
    private final AbcContext context;

    public MultiMeasureRestExpander(AbcContext context) {
        this.context = context;
    }

    /** Rewrites {@code system} in place. */
    public void expand(List<AbcNode> system) {
        var expanded = new ArrayList<AbcNode>(system.size());
        for (var node : system) {
            if (node instanceof MultiMeasureRest rest && rest.measures() > MultiMeasureRest.MAX_MEASURES) {
                LOGGER.log(Level.WARNING, "Leaving a rest of {0} measures unexpanded at line {1}",
                        new Object[]{rest.measures(), rest.rest().line()});
                expanded.add(node);
            } else if (node instanceof MultiMeasureRest rest && rest.measures() > 1) {
                expanded.addAll(expand(rest));
            } else {
                expanded.add(node);
            }
        }
        system.clear();
        system.addAll(expanded);
    }

    private List<AbcNode> expand(MultiMeasureRest rest) {
        var nodes = new ArrayList<AbcNode>();
        Token origin = rest.rest();
        for (int i = 0; i < rest.measures(); i++) {
            if (i > 0) {
                var barline = Token.synthesized(TokenType.BARLINE, "|", origin, context);
                nodes.add(new BarLine(context.nextId(), List.of(barline), List.of()));
            }
            nodes.add(new MultiMeasureRest(context.nextId(), origin.copy(context), null));
        }
        return nodes;
    }
}
