package io.feydor.abc.fmt;

import io.feydor.abc.parse.VoicePartitioner;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.*;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a system into its physical lines and works out which voice each line of music belongs to.
 */
public final class VoiceSplitter {

    /**
     * A line of a system. Only lines of music that follow a voice marker are formattable; comment lines,
     * lyrics and the voice marker lines themselves pass through untouched.
     */
    public record VoiceLine(String voice, List<AbcNode> nodes, boolean formattable) {}

    private VoiceSplitter() {}

    public static List<VoiceLine> split(List<AbcNode> system) {
        var lines = new ArrayList<VoiceLine>();
        var nodes = new ArrayList<AbcNode>();
        String voice = null;
        for (var node : system) {
            String marker = VoicePartitioner.voiceName(node);
            if (marker != null) {
                voice = marker;
            }
            nodes.add(node);
            if (node instanceof Token token && token.is(TokenType.EOL)) {
                lines.add(new VoiceLine(voice, nodes, voice != null && containsMusic(nodes)));
                nodes = new ArrayList<>();
            }
        }
        if (!nodes.isEmpty()) {
            lines.add(new VoiceLine(voice, nodes, voice != null && containsMusic(nodes)));
        }
        return lines;
    }

    private static boolean containsMusic(List<AbcNode> nodes) {
        for (var node : nodes) {
            if (node instanceof BarLine || node instanceof Note || node instanceof Chord
                    || node instanceof Beam || node instanceof MultiMeasureRest) {
                return true;
            }
        }
        return false;
    }
}
