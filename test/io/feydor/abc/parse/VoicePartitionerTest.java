package io.feydor.abc.parse;

import io.feydor.abc.AbcContext;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.InlineField;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VoicePartitionerTest {
    private final AbcContext context = new AbcContext();

    private InlineField marker(String voice) {
        return new InlineField(context.nextId(),
                new Token(TokenType.LEFTBRKT, "[", 0, 0, context.nextId()),
                new Token(TokenType.LETTER_COLON, "V:", 0, 0, context.nextId()),
                List.of(new Token(TokenType.INFO_STRING, voice, 0, 0, context.nextId())),
                new Token(TokenType.RIGHT_BRKT, "]", 0, 0, context.nextId()));
    }

    private Token eol() {
        return new Token(TokenType.EOL, "\n", 0, 0, context.nextId());
    }

    private List<AbcNode> lines(String... voices) {
        var elements = new ArrayList<AbcNode>();
        for (var voice : voices) {
            elements.add(marker(voice));
            elements.add(eol());
        }
        return elements;
    }

    @Test
    void singleVoiceSplitsOnLineBreaks() {
        var systems = new VoicePartitioner(List.of("1")).partition(lines("1", "1", "1"));

        assertEquals(3, systems.size());
        assertEquals(2, systems.get(0).size());
    }

    @Test
    void aVoiceRepeatingStartsANewSystem() {
        var systems = new VoicePartitioner(List.of("1", "2")).partition(lines("1", "2", "1", "2"));

        assertEquals(2, systems.size());
        assertEquals(4, systems.get(0).size());
    }

    @Test
    void aVoiceGoingBackwardsStartsANewSystem() {
        var systems = new VoicePartitioner(List.of("1", "2", "3")).partition(lines("1", "3", "2", "3"));

        assertEquals(2, systems.size());
        assertEquals("2", VoicePartitioner.voiceName(systems.get(1).get(0)));
    }

    @Test
    void elementsBeforeTheFirstMarkerStayInTheFirstSystem() {
        var elements = new ArrayList<AbcNode>();
        elements.add(eol());
        elements.addAll(lines("1", "2"));
        var systems = new VoicePartitioner(List.of("1", "2")).partition(elements);

        assertEquals(1, systems.size());
        assertEquals(5, systems.get(0).size());
    }

    @Test
    void onlyVoiceFieldsHaveAVoiceName() {
        var key = new InlineField(context.nextId(),
                new Token(TokenType.LEFTBRKT, "[", 0, 0, context.nextId()),
                new Token(TokenType.LETTER_COLON, "K:", 0, 0, context.nextId()),
                List.of(new Token(TokenType.INFO_STRING, "G", 0, 0, context.nextId())),
                new Token(TokenType.RIGHT_BRKT, "]", 0, 0, context.nextId()));

        assertNull(VoicePartitioner.voiceName(key));
        assertNull(VoicePartitioner.voiceName(eol()));
        assertEquals("1", VoicePartitioner.voiceName(marker("1")));
    }
}
