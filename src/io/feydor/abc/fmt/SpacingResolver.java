package io.feydor.abc.fmt;

import io.feydor.abc.AbcContext;
import io.feydor.abc.parse.BeamGrouper;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces the whitespace of a system with single spaces placed according to each element's {@link SpacingRule}.
 * <p>
 * One left-to-right pass: surround and follow rules put a space after their element unless the next element
 * refuses one; a precede rule puts a space after the previous element instead. Elements left touching
 * each other are then grouped into beams, as they would be when the output is parsed again.
 */
public class SpacingResolver {
    private final AbcContext context;

    public SpacingResolver(AbcContext context) {
        this.context = context;
    }

    /** Rewrites {@code system} in place. */
    public void resolve(List<AbcNode> system) {
        var elements = new ArrayList<AbcNode>(system.size());
        for (var node : system) {
            if (!(node instanceof Token token && token.is(TokenType.WHITESPACE))) {
                elements.add(node);
            }
        }

        boolean[] spaceAfter = new boolean[elements.size()];
        for (int i = 0; i < elements.size(); i++) {
            var node = elements.get(i);
            switch (SpacingRule.of(node)) {
                case SURROUND_SPC, FOLLOW_SPC -> {
                    if (i + 1 < elements.size() && !SpacingRule.rejectsLeadingSpace(elements.get(i + 1))) {
                        spaceAfter[i] = true;
                    }
                }
                case PRECEDE_SPC -> {
                    if (i > 0 && SpacingRule.acceptsTrailingSpace(elements.get(i - 1))) {
                        spaceAfter[i - 1] = true;
                    }
                }
                default -> {
                    // no space on either side
                }
            }
        }

        var spaced = new ArrayList<AbcNode>(elements.size() * 2);
        for (int i = 0; i < elements.size(); i++) {
            spaced.add(elements.get(i));
            if (spaceAfter[i]) {
                spaced.add(Token.whitespace(1, context));
            }
        }
        system.clear();
        system.addAll(BeamGrouper.group(spaced, context));
    }
}
