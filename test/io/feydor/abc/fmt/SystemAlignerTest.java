package io.feydor.abc.fmt;

import io.feydor.abc.Abc;
import io.feydor.abc.AbcContext;
import io.feydor.abc.exceptions.AbcAlignmentException;
import io.feydor.abc.tree.AbcNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemAlignerTest {
    private static final int STALE_ID = -42;
    private final Stringifier stringifier = new Stringifier();

    private static List<AbcNode> line(String music) {
        return new ArrayList<>(Abc.parse("X:1\n" + music).getTree().tunes().get(0).body().systems().get(0));
    }

    @Test
    void paddingGoesAfterTheWhitespaceInFrontOfTheNote() {
        var nodes = line("C D|");
        var bar = TimeMapper.bars(nodes).get(0);
        int d = bar.timeMap().lastEntry().getValue();

        new SystemAligner(new AbcContext(), true).pad(nodes, bar, d, 2);

        assertEquals("C   D|", stringifier.stringify(nodes));
    }

    @Test
    void strictAlignmentThrowsOnAStaleNodeId() {
        var nodes = line("C D|");
        var bar = TimeMapper.bars(nodes).get(0);
        var aligner = new SystemAligner(new AbcContext(), true);

        assertThrows(AbcAlignmentException.class, () -> aligner.pad(nodes, bar, STALE_ID, 2));
        assertThrows(AbcAlignmentException.class, () -> aligner.widthBetween(nodes, bar.startId(), STALE_ID));
        assertThrows(AbcAlignmentException.class, () -> aligner.widthBetween(nodes, STALE_ID, bar.endId()));
    }

    @Test
    void lenientAlignmentLeavesTheBarUnpadded() {
        var nodes = line("C D|");
        var before = List.copyOf(nodes);
        var bar = TimeMapper.bars(nodes).get(0);
        var aligner = new SystemAligner(new AbcContext(), false);

        aligner.pad(nodes, bar, STALE_ID, 2);

        assertEquals(before, nodes);
        assertEquals(0, aligner.widthBetween(nodes, bar.startId(), STALE_ID));
    }

    @Test
    void aSingleVoiceIsLeftAlone() {
        var nodes = line("C D|EF|");
        var before = List.copyOf(nodes);

        new SystemAligner(new AbcContext(), true).align(nodes);

        assertEquals(before, nodes);
    }
}
