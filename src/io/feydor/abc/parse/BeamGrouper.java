package io.feydor.abc.parse;

import io.feydor.abc.AbcContext;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges notes and their ornaments that are written without whitespace between them into {@link Beam}s.
 * Any other element ends the current run; a run of one element stays as it is.
 * <p>
 * An existing beam joins a run like any other beamable element and is merged into the new beam,
 * so grouping again after whitespace has been removed gives the beams a fresh parse would.
 */
public final class BeamGrouper {

    private BeamGrouper() {}

    public static List<AbcNode> group(List<AbcNode> elements, AbcContext context) {
        var grouped = new ArrayList<AbcNode>(elements.size());
        var run = new ArrayList<AbcNode>();
        for (var element : elements) {
            if (isBeamable(element) || element instanceof Beam) {
                run.add(element);
            } else {
                flush(run, grouped, context);
                grouped.add(element);
            }
        }
        flush(run, grouped, context);
        return grouped;
    }

    public static boolean isBeamable(AbcNode node) {
        return node instanceof Note
                || node instanceof Chord
                || node instanceof Decoration
                || node instanceof GraceGroup
                || node instanceof Annotation
                || node instanceof Symbol
                || node instanceof YSpacer;
    }

    private static void flush(List<AbcNode> run, List<AbcNode> grouped, AbcContext context) {
        if (run.size() == 1) {
            grouped.add(run.get(0));
        } else if (run.size() > 1) {
            var contents = new ArrayList<AbcNode>();
            for (var element : run) {
                if (element instanceof Beam beam) {
                    contents.addAll(beam.contents());
                } else {
                    contents.add(element);
                }
            }
            grouped.add(new Beam(context.nextId(), contents));
        }
        run.clear();
    }
}
