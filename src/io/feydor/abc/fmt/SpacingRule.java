package io.feydor.abc.fmt;

import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.*;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;
import io.feydor.abc.tree.Visitor;

/**
 * Where an element of a system wants whitespace.
 */
public enum SpacingRule {
    /** A space after the element; the previous element provides the one before it. */
    SURROUND_SPC,
    /** A space before the element only. */
    PRECEDE_SPC,
    /** A space after the element only. */
    FOLLOW_SPC,
    NO_SPC;

    private static final Visitor<SpacingRule> ASSIGNER = new Assigner();

    public static SpacingRule of(AbcNode node) {
        return node.accept(ASSIGNER);
    }

    /** Elements that must sit directly against whatever comes before them. */
    public static boolean rejectsLeadingSpace(AbcNode node) {
        return node instanceof Token token
                && (token.is(TokenType.RIGHT_PAREN) || token.is(TokenType.EOL) || token.is(TokenType.EOF));
    }

    /** Whether a following precede-space element may put a space after this one. */
    public static boolean acceptsTrailingSpace(AbcNode node) {
        return !(node instanceof Token token)
                || !(token.is(TokenType.EOL) || token.is(TokenType.ANTISLASH_EOL) || token.is(TokenType.LEFTPAREN));
    }

    private static final class Assigner implements Visitor<SpacingRule> {
        @Override
        public SpacingRule visitToken(Token token) {
            return switch (token.type()) {
                case LEFTPAREN, EOL, EOF, ANTISLASH_EOL -> NO_SPC;
                case RIGHT_PAREN -> FOLLOW_SPC;
                default -> SURROUND_SPC;
            };
        }

        @Override
        public SpacingRule visitFileStructure(FileStructure fileStructure) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitFileHeader(FileHeader fileHeader) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitTune(Tune tune) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitTuneHeader(TuneHeader tuneHeader) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitTuneBody(TuneBody tuneBody) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitInfoLine(InfoLine infoLine) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitComment(Comment comment) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitNote(Note note) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitPitch(Pitch pitch) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitRest(Rest rest) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitMultiMeasureRest(MultiMeasureRest multiMeasureRest) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitRhythm(Rhythm rhythm) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitChord(Chord chord) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitBeam(Beam beam) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitGraceGroup(GraceGroup graceGroup) {
            return PRECEDE_SPC;
        }

        @Override
        public SpacingRule visitDecoration(Decoration decoration) {
            return PRECEDE_SPC;
        }

        @Override
        public SpacingRule visitAnnotation(Annotation annotation) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitSymbol(Symbol symbol) {
            return PRECEDE_SPC;
        }

        @Override
        public SpacingRule visitInlineField(InlineField inlineField) {
            return FOLLOW_SPC;
        }

        @Override
        public SpacingRule visitBarLine(BarLine barLine) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitTuplet(Tuplet tuplet) {
            return PRECEDE_SPC;
        }

        @Override
        public SpacingRule visitYSpacer(YSpacer ySpacer) {
            return NO_SPC;
        }

        @Override
        public SpacingRule visitVoiceOverlay(VoiceOverlay voiceOverlay) {
            return SURROUND_SPC;
        }

        @Override
        public SpacingRule visitErrorExpr(ErrorExpr errorExpr) {
            return SURROUND_SPC;
        }
    }
}
