package io.feydor.abc.fmt;

import io.feydor.abc.AbcContext;
import io.feydor.abc.parse.Parser;
import io.feydor.abc.parse.Scanner;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.BarLine;
import io.feydor.abc.tree.Expr.MultiMeasureRest;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultiMeasureRestExpanderTest {
    private final AbcContext context = new AbcContext();

    private List<AbcNode> system(String source) {
        var file = new Parser(new Scanner(source, context).scanTokens(), context).parse();
        return file.tunes().get(0).body().systems().get(0);
    }

    @Test
    void aRestOfFourMeasuresBecomesFourRests() {
        var system = system("X:1\nZ4|");
        new MultiMeasureRestExpander(context).expand(system);

        assertEquals("Z|Z|Z|Z|", new Stringifier().stringify(system));
        assertEquals(4, system.stream().filter(MultiMeasureRest.class::isInstance).count());
        assertEquals(4, system.stream().filter(BarLine.class::isInstance).count());
        for (var node : system.subList(0, system.size() - 1)) {
            var token = node instanceof MultiMeasureRest rest ? rest.rest() : ((BarLine) node).barline().get(0);
            assertEquals(1, token.line());
            assertEquals(0, token.column());
        }
    }

    @Test
    void invisibleRestsStayInvisible() {
        var system = system("X:1\nX2|");
        new MultiMeasureRestExpander(context).expand(system);

        assertEquals("X|X|", new Stringifier().stringify(system));
    }

    @Test
    void singleMeasureRestsAreUntouched() {
        var system = system("X:1\nZ|Z1|");
        var before = List.copyOf(system);
        new MultiMeasureRestExpander(context).expand(system);

        assertEquals(before, system);
    }

    @Test
    void expandedNodesGetFreshIds() {
        var system = system("X:1\nZ3|");
        new MultiMeasureRestExpander(context).expand(system);

        assertEquals(system.size(), system.stream().mapToInt(AbcNode::id).distinct().count());
    }

    @Test
    void restsLongerThanTheLimitAreNotExpanded() {
        var rest = new MultiMeasureRest(context.nextId(),
                new Token(TokenType.LETTER, "Z", 1, 0, context.nextId()),
                new Token(TokenType.NUMBER, String.valueOf(MultiMeasureRest.MAX_MEASURES + 1), 1, 1, context.nextId()));
        var system = new ArrayList<AbcNode>(List.of(rest));

        new MultiMeasureRestExpander(context).expand(system);

        assertEquals(List.of(rest), system);
    }
}
