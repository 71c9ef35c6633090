package io.feydor.abc.fmt;

import io.feydor.abc.Abc;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.Rhythm;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeMapperTest {

    private static List<AbcNode> line(String music) {
        return Abc.parse("X:1\n" + music).getTree().tunes().get(0).body().systems().get(0);
    }

    private static List<Duration> timestamps(String music) {
        return List.copyOf(TimeMapper.bars(line(music)).get(0).timeMap().keySet());
    }

    @Test
    void rhythmsScaleTheUnitLength() {
        assertEquals(List.of(Duration.ZERO, Duration.of(2, 1), Duration.of(5, 2), Duration.of(11, 4), Duration.of(17, 4)),
                timestamps("C2 D/ E// F3/2 G|"));
    }

    @Test
    void brokenRhythmsMoveTimeBetweenNeighbours() {
        assertEquals(List.of(Duration.ZERO, Duration.of(3, 2), Duration.of(2, 1), Duration.of(5, 2)),
                timestamps("A> B C< D|"));
    }

    @Test
    void tripletsFitThreeNotesInTwo() {
        assertEquals(List.of(Duration.ZERO, Duration.of(2, 3), Duration.of(4, 3), Duration.of(2, 1)),
                timestamps("(3 C D E F|"));
    }

    @Test
    void tupletRCountsTheNotesAffected() {
        assertEquals(List.of(Duration.ZERO, Duration.of(2, 3), Duration.of(4, 3)), timestamps("(3:2:2 C D E|"));
    }

    @Test
    void aBeamIsOneTimePoint() {
        var line = line("CD E|");
        var timeMap = TimeMapper.bars(line).get(0).timeMap();

        assertEquals(List.of(Duration.ZERO, Duration.of(2, 1)), List.copyOf(timeMap.keySet()));
        assertEquals(line.get(0).id(), timeMap.get(Duration.ZERO));
    }

    @Test
    void chordsUseTheirOwnRhythmOrTheirFirstNote() {
        assertEquals(List.of(Duration.ZERO, Duration.of(2, 1), Duration.of(5, 2)), timestamps("[CE]2 [C/E/] G|"));
    }

    @Test
    void barsStartAtTheirBarline() {
        var line = line("CD|EF|G");
        var bars = TimeMapper.bars(line);

        assertEquals(3, bars.size());
        assertEquals(line.get(0).id(), bars.get(0).startId());
        assertEquals(line.get(1).id(), bars.get(0).endId());
        assertEquals(line.get(1).id(), bars.get(1).startId());
        assertFalse(bars.get(1).isLast());
        assertTrue(bars.get(2).isLast());
    }

    @Test
    void aMultiMeasureRestEndsTheTimeMap() {
        var timeMap = TimeMapper.bars(line("Z C|")).get(0).timeMap();

        assertEquals(1, timeMap.size());
    }

    @Test
    void baseDurationOfBareSlashes() {
        var slashes = new Token(TokenType.SLASH, "///", 0, 0, 1);

        assertEquals(Duration.of(1, 8), TimeMapper.baseDuration(new Rhythm(0, null, slashes, null, null)));
        assertEquals(Duration.ONE, TimeMapper.baseDuration(null));
    }
}
