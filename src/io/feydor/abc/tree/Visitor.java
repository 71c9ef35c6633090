package io.feydor.abc.tree;

import io.feydor.abc.tree.Expr.*;

/**
 * One method per kind of node. Adding a node kind breaks every pass until it handles it.
 */
public interface Visitor<R> {
    R visitToken(Token token);

    R visitFileStructure(FileStructure fileStructure);

    R visitFileHeader(FileHeader fileHeader);

    R visitTune(Tune tune);

    R visitTuneHeader(TuneHeader tuneHeader);

    R visitTuneBody(TuneBody tuneBody);

    R visitInfoLine(InfoLine infoLine);

    R visitComment(Comment comment);

    R visitNote(Note note);

    R visitPitch(Pitch pitch);

    R visitRest(Rest rest);

    R visitMultiMeasureRest(MultiMeasureRest multiMeasureRest);

    R visitRhythm(Rhythm rhythm);

    R visitChord(Chord chord);

    R visitBeam(Beam beam);

    R visitGraceGroup(GraceGroup graceGroup);

    R visitDecoration(Decoration decoration);

    R visitAnnotation(Annotation annotation);

    R visitSymbol(Symbol symbol);

    R visitInlineField(InlineField inlineField);

    R visitBarLine(BarLine barLine);

    R visitTuplet(Tuplet tuplet);

    R visitYSpacer(YSpacer ySpacer);

    R visitVoiceOverlay(VoiceOverlay voiceOverlay);

    R visitErrorExpr(ErrorExpr errorExpr);
}
