package io.feydor.abc.fmt;

import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Splits one voice's line into bars and maps each bar's musical time to the node sounding at that time.
 * <p>
 * A bar starts at a barline (or at the start of the line) and runs up to the next barline. Notes, rests,
 * chords, beams and multi-measure rests are recorded at the duration accumulated before them.
 */
public final class TimeMapper {

    /**
     * One bar of a voice, identified by node ids so it survives insertions into the line.
     * {@code endId} is the barline closing the bar, or -1 for the last bar of the line.
     */
    public static final class Bar {
        private int startId;
        private final int endId;
        private final NavigableMap<Duration, Integer> timeMap;

        Bar(int startId, int endId, NavigableMap<Duration, Integer> timeMap) {
            this.startId = startId;
            this.endId = endId;
            this.timeMap = timeMap;
        }

        public int startId() {
            return startId;
        }

        void setStartId(int startId) {
            this.startId = startId;
        }

        public int endId() {
            return endId;
        }

        public boolean isLast() {
            return endId == -1;
        }

        public NavigableMap<Duration, Integer> timeMap() {
            return timeMap;
        }
    }

    /** Tuplet and broken rhythm state carried from one note to the next within a bar. */
    private static final class TimeState {
        Duration time = Duration.ZERO;
        int tupletP;
        int tupletQ;
        int tupletRemaining;
        /** n after a run of n '>', -n after a run of n '<', 0 otherwise. */
        int brokenPending;
    }

    private TimeMapper() {}

    public static List<Bar> bars(List<AbcNode> line) {
        var segments = new ArrayList<List<AbcNode>>();
        var segment = new ArrayList<AbcNode>();
        for (var node : line) {
            if (node instanceof BarLine && !segment.isEmpty()) {
                segments.add(segment);
                segment = new ArrayList<>();
            }
            segment.add(node);
        }
        if (!segment.isEmpty()) {
            segments.add(segment);
        }

        var bars = new ArrayList<Bar>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            int endId = i + 1 < segments.size() ? segments.get(i + 1).get(0).id() : -1;
            bars.add(new Bar(segments.get(i).get(0).id(), endId, timeMap(segments.get(i))));
        }
        return bars;
    }

    static NavigableMap<Duration, Integer> timeMap(List<AbcNode> bar) {
        var timeMap = new TreeMap<Duration, Integer>();
        var state = new TimeState();
        for (var node : bar) {
            if (node instanceof Tuplet tuplet) {
                state.tupletP = tuplet.p();
                state.tupletQ = tuplet.resolvedQ();
                state.tupletRemaining = tuplet.resolvedR();
            } else if (node instanceof Note || node instanceof Chord) {
                timeMap.putIfAbsent(state.time, node.id());
                state.time = state.time.plus(duration(node, state));
            } else if (node instanceof Beam beam && containsTimeEvent(beam)) {
                timeMap.putIfAbsent(state.time, beam.id());
                for (var child : beam.contents()) {
                    if (child instanceof Note || child instanceof Chord) {
                        state.time = state.time.plus(duration(child, state));
                    }
                }
            } else if (node instanceof MultiMeasureRest) {
                // fills the rest of the bar
                timeMap.putIfAbsent(state.time, node.id());
                break;
            }
        }
        return timeMap;
    }

    private static boolean containsTimeEvent(Beam beam) {
        for (var child : beam.contents()) {
            if (child instanceof Note || child instanceof Chord) {
                return true;
            }
        }
        return false;
    }

    /** The duration of a note or chord, updating the tuplet and broken rhythm state. */
    private static Duration duration(AbcNode node, TimeState state) {
        Rhythm rhythm = rhythmOf(node);
        Duration duration = baseDuration(rhythm);

        if (state.brokenPending > 0) {
            duration = duration.times(shortened(state.brokenPending));
        } else if (state.brokenPending < 0) {
            duration = duration.times(lengthened(-state.brokenPending));
        }
        state.brokenPending = 0;
        if (rhythm != null && rhythm.broken() != null) {
            int run = rhythm.broken().lexeme().length();
            if (rhythm.broken().lexeme().charAt(0) == '>') {
                duration = duration.times(lengthened(run));
                state.brokenPending = run;
            } else {
                duration = duration.times(shortened(run));
                state.brokenPending = -run;
            }
        }

        if (state.tupletRemaining > 0) {
            duration = duration.times(Duration.of(state.tupletQ, state.tupletP));
            state.tupletRemaining--;
        }
        return duration;
    }

    private static Rhythm rhythmOf(AbcNode node) {
        if (node instanceof Note note) {
            return note.rhythm();
        }
        var chord = (Chord) node;
        if (chord.rhythm() != null) {
            return chord.rhythm();
        }
        var notes = chord.notes();
        return notes.isEmpty() ? null : notes.get(0).rhythm();
    }

    /** numerator / denominator, where a bare run of n slashes means 1/2^n. */
    static Duration baseDuration(Rhythm rhythm) {
        if (rhythm == null) {
            return Duration.ONE;
        }
        long numerator = rhythm.numerator() == null ? 1 : Long.parseLong(rhythm.numerator().lexeme());
        long denominator = 1;
        if (rhythm.denominator() != null) {
            denominator = Long.parseLong(rhythm.denominator().lexeme());
        } else if (rhythm.separator() != null) {
            denominator = 1L << rhythm.separator().lexeme().length();
        }
        return Duration.of(numerator, denominator == 0 ? 1 : denominator);
    }

    /** 2 - 1/2^n: 3/2 for one '>', 7/4 for two. */
    private static Duration lengthened(int run) {
        long pow = 1L << run;
        return Duration.of(2 * pow - 1, pow);
    }

    /** 1/2^n */
    private static Duration shortened(int run) {
        return Duration.of(1, 1L << run);
    }
}
