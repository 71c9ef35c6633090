package io.feydor.abc.tree;

import io.feydor.abc.AbcContext;
import io.feydor.abc.tree.Expr.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Deep-copies a tree. Every token and node of the copy gets a fresh id from the context,
 * so the copy can be formatted while the original keeps its source text.
 */
public class TreeCloner implements Visitor<AbcNode> {
    private final AbcContext context;

    public TreeCloner(AbcContext context) {
        this.context = context;
    }

    @SuppressWarnings("unchecked")
    public <T extends AbcNode> T copy(T node) {
        return node == null ? null : (T) node.accept(this);
    }

    private <T extends AbcNode> List<T> copyAll(List<T> nodes) {
        var copies = new ArrayList<T>(nodes.size());
        for (var node : nodes) {
            copies.add(copy(node));
        }
        return copies;
    }

    @Override
    public AbcNode visitToken(Token token) {
        return token.copy(context);
    }

    @Override
    public AbcNode visitFileStructure(FileStructure fileStructure) {
        return new FileStructure(context.nextId(), copy(fileStructure.fileHeader()), copyAll(fileStructure.contents()));
    }

    @Override
    public AbcNode visitFileHeader(FileHeader fileHeader) {
        return new FileHeader(context.nextId(), copyAll(fileHeader.contents()));
    }

    @Override
    public AbcNode visitTune(Tune tune) {
        return new Tune(context.nextId(), copy(tune.header()), copy(tune.body()));
    }

    @Override
    public AbcNode visitTuneHeader(TuneHeader tuneHeader) {
        return new TuneHeader(context.nextId(), copyAll(tuneHeader.lines()), new ArrayList<>(tuneHeader.voices()));
    }

    @Override
    public AbcNode visitTuneBody(TuneBody tuneBody) {
        var systems = new ArrayList<List<AbcNode>>(tuneBody.systems().size());
        for (var system : tuneBody.systems()) {
            systems.add(copyAll(system));
        }
        return new TuneBody(context.nextId(), systems);
    }

    @Override
    public AbcNode visitInfoLine(InfoLine infoLine) {
        return new InfoLine(context.nextId(), copy(infoLine.key()), copyAll(infoLine.value()));
    }

    @Override
    public AbcNode visitComment(Comment comment) {
        return new Comment(context.nextId(), copy(comment.token()));
    }

    @Override
    public AbcNode visitNote(Note note) {
        return new Note(context.nextId(), copy(note.head()), copy(note.rhythm()), copy(note.tie()));
    }

    @Override
    public AbcNode visitPitch(Pitch pitch) {
        return new Pitch(context.nextId(), copy(pitch.alteration()), copy(pitch.noteLetter()), copy(pitch.octave()));
    }

    @Override
    public AbcNode visitRest(Rest rest) {
        return new Rest(context.nextId(), copy(rest.rest()));
    }

    @Override
    public AbcNode visitMultiMeasureRest(MultiMeasureRest multiMeasureRest) {
        return new MultiMeasureRest(context.nextId(), copy(multiMeasureRest.rest()), copy(multiMeasureRest.length()));
    }

    @Override
    public AbcNode visitRhythm(Rhythm rhythm) {
        return new Rhythm(context.nextId(), copy(rhythm.numerator()), copy(rhythm.separator()),
                copy(rhythm.denominator()), copy(rhythm.broken()));
    }

    @Override
    public AbcNode visitChord(Chord chord) {
        return new Chord(context.nextId(), copy(chord.leftBracket()), copyAll(chord.contents()),
                copy(chord.rightBracket()), copy(chord.rhythm()), copy(chord.tie()));
    }

    @Override
    public AbcNode visitBeam(Beam beam) {
        return new Beam(context.nextId(), copyAll(beam.contents()));
    }

    @Override
    public AbcNode visitGraceGroup(GraceGroup graceGroup) {
        return new GraceGroup(context.nextId(), copy(graceGroup.leftBrace()), copy(graceGroup.slash()),
                copyAll(graceGroup.notes()), copy(graceGroup.rightBrace()));
    }

    @Override
    public AbcNode visitDecoration(Decoration decoration) {
        return new Decoration(context.nextId(), copy(decoration.decoration()));
    }

    @Override
    public AbcNode visitAnnotation(Annotation annotation) {
        return new Annotation(context.nextId(), copy(annotation.text()));
    }

    @Override
    public AbcNode visitSymbol(Symbol symbol) {
        return new Symbol(context.nextId(), copy(symbol.symbol()));
    }

    @Override
    public AbcNode visitInlineField(InlineField inlineField) {
        return new InlineField(context.nextId(), copy(inlineField.leftBracket()), copy(inlineField.field()),
                copyAll(inlineField.text()), copy(inlineField.rightBracket()));
    }

    @Override
    public AbcNode visitBarLine(BarLine barLine) {
        return new BarLine(context.nextId(), copyAll(barLine.barline()), copyAll(barLine.repeatNumbers()));
    }

    @Override
    public AbcNode visitTuplet(Tuplet tuplet) {
        return new Tuplet(context.nextId(), copy(tuplet.pToken()), copy(tuplet.firstColon()), copy(tuplet.qToken()),
                copy(tuplet.secondColon()), copy(tuplet.rToken()));
    }

    @Override
    public AbcNode visitYSpacer(YSpacer ySpacer) {
        return new YSpacer(context.nextId(), copy(ySpacer.ySpacer()), copy(ySpacer.rhythm()));
    }

    @Override
    public AbcNode visitVoiceOverlay(VoiceOverlay voiceOverlay) {
        return new VoiceOverlay(context.nextId(), copyAll(voiceOverlay.ampersands()));
    }

    @Override
    public AbcNode visitErrorExpr(ErrorExpr errorExpr) {
        return new ErrorExpr(context.nextId(), copyAll(errorExpr.tokens()), errorExpr.expectedType(),
                errorExpr.message());
    }
}
