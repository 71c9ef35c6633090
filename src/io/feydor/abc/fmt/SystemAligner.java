package io.feydor.abc.fmt;

import io.feydor.abc.AbcContext;
import io.feydor.abc.exceptions.AbcAlignmentException;
import io.feydor.abc.fmt.TimeMapper.Bar;
import io.feydor.abc.fmt.VoiceSplitter.VoiceLine;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pads the voices of a system so that notes sounding at the same time start in the same column,
 * and so that the barlines closing each bar line up.
 * <p>
 * Works on a system whose spacing has already been resolved. For every bar index, the timestamps of all
 * voices are visited in increasing order and the voices that are behind at that timestamp get a
 * whitespace token in front of the note. Then, from the last bar back to the first, bars are padded
 * before their closing barline to the widest voice. A voice's last bar is never padded at its end.
 * <p>
 * Every position is looked up by node id right before it is used, since each insertion shifts the lines.
 */
public class SystemAligner {
    private static final Logger LOGGER = Logger.getLogger(SystemAligner.class.getName());
    private final AbcContext context;
    private final Stringifier stringifier = new Stringifier();
    private final boolean strict;

    public SystemAligner(AbcContext context, boolean strict) {
        this.context = context;
        this.strict = strict;
    }

    /** Rewrites {@code system} in place. */
    public void align(List<AbcNode> system) {
        var lines = VoiceSplitter.split(system);
        var voices = lines.stream().filter(VoiceLine::formattable).toList();
        if (voices.size() < 2) {
            return;
        }

        var bars = new ArrayList<List<Bar>>(voices.size());
        int maxBars = 0;
        for (var voice : voices) {
            var voiceBars = TimeMapper.bars(voice.nodes());
            bars.add(voiceBars);
            maxBars = Math.max(maxBars, voiceBars.size());
        }

        for (int barIndex = 0; barIndex < maxBars; barIndex++) {
            alignTimePoints(voices, bars, barIndex);
        }
        for (int barIndex = maxBars - 1; barIndex >= 0; barIndex--) {
            equalizeBar(voices, bars, barIndex);
        }

        system.clear();
        for (var line : lines) {
            system.addAll(line.nodes());
        }
    }

    private void alignTimePoints(List<VoiceLine> voices, List<List<Bar>> bars, int barIndex) {
        var timestamps = new TreeSet<Duration>();
        for (var voiceBars : bars) {
            if (barIndex < voiceBars.size()) {
                timestamps.addAll(voiceBars.get(barIndex).timeMap().keySet());
            }
        }

        for (var timestamp : timestamps) {
            int target = 0;
            int[] widths = new int[voices.size()];
            for (int v = 0; v < voices.size(); v++) {
                widths[v] = -1;
                var bar = barAt(bars.get(v), barIndex);
                if (bar == null || !bar.timeMap().containsKey(timestamp)) {
                    continue;
                }
                widths[v] = widthBetween(voices.get(v).nodes(), bar.startId(), bar.timeMap().get(timestamp));
                target = Math.max(target, widths[v]);
            }
            for (int v = 0; v < voices.size(); v++) {
                if (widths[v] >= 0 && widths[v] < target) {
                    var bar = bars.get(v).get(barIndex);
                    pad(voices.get(v).nodes(), bar, bar.timeMap().get(timestamp), target - widths[v]);
                }
            }
        }
    }

    private void equalizeBar(List<VoiceLine> voices, List<List<Bar>> bars, int barIndex) {
        int target = 0;
        int[] widths = new int[voices.size()];
        for (int v = 0; v < voices.size(); v++) {
            widths[v] = -1;
            var bar = barAt(bars.get(v), barIndex);
            if (bar == null || bar.isLast()) {
                continue;
            }
            widths[v] = widthBetween(voices.get(v).nodes(), bar.startId(), bar.endId());
            target = Math.max(target, widths[v]);
        }
        for (int v = 0; v < voices.size(); v++) {
            if (widths[v] >= 0 && widths[v] < target) {
                var bar = bars.get(v).get(barIndex);
                pad(voices.get(v).nodes(), bar, bar.endId(), target - widths[v]);
            }
        }
    }

    private static Bar barAt(List<Bar> bars, int index) {
        return index < bars.size() ? bars.get(index) : null;
    }

    /** The rendered width from the bar start (inclusive) up to the node (exclusive), or 0 if a node is missing. */
    int widthBetween(List<AbcNode> nodes, int startId, int nodeId) {
        int start = indexOf(nodes, startId);
        int end = indexOf(nodes, nodeId);
        if (start == -1 || end == -1 || end < start) {
            violation("Cannot measure from node " + startId + " to node " + nodeId);
            return 0;
        }
        return stringifier.width(nodes, start, end);
    }

    /**
     * Inserts {@code width} spaces before the node, just after the closest whitespace in front of it,
     * so the padding never separates the node from a tuplet or slur glued to it.
     */
    void pad(List<AbcNode> nodes, Bar bar, int nodeId, int width) {
        int start = indexOf(nodes, bar.startId());
        int index = indexOf(nodes, nodeId);
        if (start == -1 || index == -1) {
            violation("Cannot pad before node " + nodeId + " in the bar starting at node " + bar.startId());
            return;
        }

        int insertAt = index;
        for (int i = index - 1; i > start; i--) {
            if (nodes.get(i) instanceof Token token && token.is(TokenType.WHITESPACE)) {
                insertAt = i + 1;
                break;
            }
        }
        var padding = Token.whitespace(width, context);
        nodes.add(insertAt, padding);
        if (insertAt <= start) {
            bar.setStartId(padding.id());
        }
    }

    private static int indexOf(List<AbcNode> nodes, int id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() == id) {
                return i;
            }
        }
        return -1;
    }

    private void violation(String msg) {
        if (strict) {
            throw new AbcAlignmentException(msg);
        }
        LOGGER.log(Level.WARNING, "{0}. The bar is left unaligned", msg);
    }
}
