package io.feydor.abc.fmt;

import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.*;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.Visitor;

import java.util.List;

/**
 * Renders nodes back to text exactly as they are in the tree. On an unformatted tree this reproduces
 * the source; after spacing and alignment it yields the formatted text. Also used to measure widths.
 */
public class Stringifier implements Visitor<String> {

    public String stringify(AbcNode node) {
        return node == null ? "" : node.accept(this);
    }

    public String stringify(List<? extends AbcNode> nodes) {
        var sb = new StringBuilder();
        for (var node : nodes) {
            sb.append(stringify(node));
        }
        return sb.toString();
    }

    /** The rendered width of {@code nodes[from, to)}. */
    public int width(List<? extends AbcNode> nodes, int from, int to) {
        return stringify(nodes.subList(from, to)).length();
    }

    @Override
    public String visitToken(Token token) {
        return token.lexeme();
    }

    @Override
    public String visitFileStructure(FileStructure fileStructure) {
        return stringify(fileStructure.fileHeader()) + stringify(fileStructure.contents());
    }

    @Override
    public String visitFileHeader(FileHeader fileHeader) {
        return stringify(fileHeader.contents());
    }

    @Override
    public String visitTune(Tune tune) {
        return stringify(tune.header()) + stringify(tune.body());
    }

    @Override
    public String visitTuneHeader(TuneHeader tuneHeader) {
        return stringify(tuneHeader.lines());
    }

    @Override
    public String visitTuneBody(TuneBody tuneBody) {
        var sb = new StringBuilder();
        for (var system : tuneBody.systems()) {
            sb.append(stringify(system));
        }
        return sb.toString();
    }

    @Override
    public String visitInfoLine(InfoLine infoLine) {
        return infoLine.key().lexeme() + stringify(infoLine.value());
    }

    @Override
    public String visitComment(Comment comment) {
        return comment.token().lexeme();
    }

    @Override
    public String visitNote(Note note) {
        return stringify(note.head()) + stringify(note.rhythm()) + stringify(note.tie());
    }

    @Override
    public String visitPitch(Pitch pitch) {
        return stringify(pitch.alteration()) + stringify(pitch.noteLetter()) + stringify(pitch.octave());
    }

    @Override
    public String visitRest(Rest rest) {
        return rest.rest().lexeme();
    }

    @Override
    public String visitMultiMeasureRest(MultiMeasureRest multiMeasureRest) {
        return multiMeasureRest.rest().lexeme() + stringify(multiMeasureRest.length());
    }

    @Override
    public String visitRhythm(Rhythm rhythm) {
        return stringify(rhythm.numerator()) + stringify(rhythm.separator()) + stringify(rhythm.denominator())
                + stringify(rhythm.broken());
    }

    @Override
    public String visitChord(Chord chord) {
        return chord.leftBracket().lexeme() + stringify(chord.contents()) + chord.rightBracket().lexeme()
                + stringify(chord.rhythm()) + stringify(chord.tie());
    }

    @Override
    public String visitBeam(Beam beam) {
        return stringify(beam.contents());
    }

    @Override
    public String visitGraceGroup(GraceGroup graceGroup) {
        return graceGroup.leftBrace().lexeme() + stringify(graceGroup.slash()) + stringify(graceGroup.notes())
                + graceGroup.rightBrace().lexeme();
    }

    @Override
    public String visitDecoration(Decoration decoration) {
        return decoration.decoration().lexeme();
    }

    @Override
    public String visitAnnotation(Annotation annotation) {
        return annotation.text().lexeme();
    }

    @Override
    public String visitSymbol(Symbol symbol) {
        return symbol.symbol().lexeme();
    }

    @Override
    public String visitInlineField(InlineField inlineField) {
        return inlineField.leftBracket().lexeme() + inlineField.field().lexeme() + stringify(inlineField.text())
                + stringify(inlineField.rightBracket());
    }

    @Override
    public String visitBarLine(BarLine barLine) {
        return stringify(barLine.barline()) + stringify(barLine.repeatNumbers());
    }

    @Override
    public String visitTuplet(Tuplet tuplet) {
        return tuplet.pToken().lexeme() + stringify(tuplet.firstColon()) + stringify(tuplet.qToken())
                + stringify(tuplet.secondColon()) + stringify(tuplet.rToken());
    }

    @Override
    public String visitYSpacer(YSpacer ySpacer) {
        return ySpacer.ySpacer().lexeme() + stringify(ySpacer.rhythm());
    }

    @Override
    public String visitVoiceOverlay(VoiceOverlay voiceOverlay) {
        return stringify(voiceOverlay.ampersands());
    }

    @Override
    public String visitErrorExpr(ErrorExpr errorExpr) {
        return stringify(errorExpr.tokens());
    }
}
