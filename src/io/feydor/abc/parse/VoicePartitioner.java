package io.feydor.abc.parse;

import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.InfoLine;
import io.feydor.abc.tree.Expr.InlineField;
import io.feydor.abc.tree.TokenType;
import io.feydor.abc.tree.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the elements of a tune body into systems: the lines of music engraved side by side.
 * <p>
 * With fewer than two voices every line is its own system. Otherwise a new system starts whenever a
 * voice marker names a voice that does not come after the previous marker's voice in declaration order,
 * so {@code V:1 V:2 V:1 V:2} gives two systems.
 */
public class VoicePartitioner {
    private final List<String> voices;

    public VoicePartitioner(List<String> voices) {
        this.voices = voices;
    }

    public List<List<AbcNode>> partition(List<AbcNode> elements) {
        if (voices.size() < 2) {
            return splitLines(elements);
        }

        var systems = new ArrayList<List<AbcNode>>();
        var system = new ArrayList<AbcNode>();
        int lastIndex = -1;
        for (var element : elements) {
            String name = voiceName(element);
            if (name != null) {
                int index = voices.indexOf(name);
                if (lastIndex != -1 && index <= lastIndex) {
                    systems.add(system);
                    system = new ArrayList<>();
                }
                lastIndex = index;
            }
            system.add(element);
        }
        if (!system.isEmpty()) {
            systems.add(system);
        }
        return systems;
    }

    private static List<List<AbcNode>> splitLines(List<AbcNode> elements) {
        var systems = new ArrayList<List<AbcNode>>();
        var system = new ArrayList<AbcNode>();
        for (var element : elements) {
            system.add(element);
            if (element instanceof Token token && token.is(TokenType.EOL)) {
                systems.add(system);
                system = new ArrayList<>();
            }
        }
        if (!system.isEmpty()) {
            systems.add(system);
        }
        return systems;
    }

    /** @return The voice a {@code V:} info line or {@code [V:..]} field switches to, or null for anything else */
    public static String voiceName(AbcNode node) {
        if (node instanceof InfoLine infoLine && infoLine.isVoiceMarker()) {
            return infoLine.voiceName();
        }
        if (node instanceof InlineField inlineField && inlineField.isVoiceMarker()) {
            return inlineField.voiceName();
        }
        return null;
    }
}
