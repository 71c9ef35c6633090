package io.feydor.abc.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * The parsed constructs of an ABC file. The set of constructs is closed: every pass over the tree
 * is a {@link Visitor} and has to handle each of them.
 * <p>
 * An ABC file is laid out as:
 * <ul>
 *     <li>
 *         FileStructure: an optional free-text FileHeader followed by Tunes (and the blank lines between them)
 *     </li>
 *     <li>
 *         Tune: a TuneHeader of info lines and an optional TuneBody
 *     </li>
 *     <li>
 *         TuneBody: a list of systems, each one a list of music code, comments and info lines
 *     </li>
 * </ul>
 * Optional children are {@code null} when absent.
 */
public sealed interface Expr extends AbcNode {

    record FileStructure(int id, FileHeader fileHeader, List<AbcNode> contents) implements Expr {
        public List<Tune> tunes() {
            var tunes = new ArrayList<Tune>();
            for (var node : contents) {
                if (node instanceof Tune tune) {
                    tunes.add(tune);
                }
            }
            return tunes;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFileStructure(this);
        }
    }

    record FileHeader(int id, List<AbcNode> contents) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFileHeader(this);
        }
    }

    record Tune(int id, TuneHeader header, TuneBody body) implements Expr {
        public boolean isMultiVoice() {
            return header.voices().size() > 1;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTune(this);
        }
    }

    /**
     * Info lines, comments and the line breaks between them. {@code voices} holds the voice ids in
     * order of first appearance, which is also the order voices are expected in within a system.
     */
    record TuneHeader(int id, List<AbcNode> lines, List<String> voices) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuneHeader(this);
        }
    }

    record TuneBody(int id, List<List<AbcNode>> systems) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuneBody(this);
        }
    }

    /**
     * A field such as {@code T:Title} or {@code V:1 clef=bass}. The value keeps every token after the key,
     * including a trailing comment and any {@code +:} continuation lines.
     */
    record InfoLine(int id, Token key, List<Token> value) implements Expr {
        public String field() {
            return key.lexeme();
        }

        /** The value text without comments or continuation markers. */
        public String valueText() {
            var sb = new StringBuilder();
            for (var token : value) {
                if (token.is(TokenType.INFO_STRING)) {
                    sb.append(token.lexeme());
                }
            }
            return sb.toString().trim();
        }

        public boolean isVoiceMarker() {
            return field().equals("V:");
        }

        /** The voice id: the first word of a {@code V:} value. */
        public String voiceName() {
            return firstWord(valueText());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInfoLine(this);
        }
    }

    record Comment(int id, Token token) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    /** A note or a rest, either of which may carry a rhythm and a tie. */
    record Note(int id, NoteHead head, Rhythm rhythm, Token tie) implements Expr {
        public boolean isRest() {
            return head instanceof Rest;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNote(this);
        }
    }

    sealed interface NoteHead extends Expr permits Pitch, Rest {}

    record Pitch(int id, Token alteration, Token noteLetter, Token octave) implements NoteHead {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPitch(this);
        }
    }

    /** {@code z} for a visible rest, {@code x} for an invisible one. */
    record Rest(int id, Token rest) implements NoteHead {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRest(this);
        }
    }

    /** {@code Z4} or {@code X4}: a rest lasting several whole measures. */
    record MultiMeasureRest(int id, Token rest, Token length) implements Expr {
        public static final int MAX_MEASURES = 1000;

        public int measures() {
            return length == null ? 1 : Integer.parseInt(length.lexeme());
        }

        public boolean isInvisible() {
            return rest.lexeme().equals("X");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMultiMeasureRest(this);
        }
    }

    /**
     * A multiplier on the unit note length: {@code 3/2}, {@code /}, {@code //}, {@code 2>}...
     * The parser never builds a rhythm with all four parts missing.
     */
    record Rhythm(int id, Token numerator, Token separator, Token denominator, Token broken) implements Expr {
        public boolean isEmpty() {
            return numerator == null && separator == null && denominator == null && broken == null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRhythm(this);
        }
    }

    record Chord(int id, Token leftBracket, List<AbcNode> contents, Token rightBracket, Rhythm rhythm, Token tie)
            implements Expr {
        public List<Note> notes() {
            var notes = new ArrayList<Note>();
            for (var node : contents) {
                if (node instanceof Note note) {
                    notes.add(note);
                }
            }
            return notes;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChord(this);
        }
    }

    /** Notes and their ornaments written with no space between them. */
    record Beam(int id, List<AbcNode> contents) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBeam(this);
        }
    }

    record GraceGroup(int id, Token leftBrace, Token slash, List<AbcNode> notes, Token rightBrace) implements Expr {
        public boolean isAcciaccatura() {
            return slash != null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGraceGroup(this);
        }
    }

    /** {@code .}, {@code ~} or one of the single-letter decorations. */
    record Decoration(int id, Token decoration) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDecoration(this);
        }
    }

    record Annotation(int id, Token text) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnnotation(this);
        }
    }

    /** {@code !trill!} or {@code +trill+}. */
    record Symbol(int id, Token symbol) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymbol(this);
        }
    }

    /** {@code [K:G]}, {@code [V:1]}... The closing bracket is null when the line ended first. */
    record InlineField(int id, Token leftBracket, Token field, List<Token> text, Token rightBracket) implements Expr {
        public boolean isVoiceMarker() {
            return field.lexeme().equals("V:");
        }

        public String voiceName() {
            var sb = new StringBuilder();
            for (var token : text) {
                sb.append(token.lexeme());
            }
            return firstWord(sb.toString().trim());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineField(this);
        }
    }

    /** A barline such as {@code |}, {@code :|2}, {@code [1,3} or {@code |]}, with its repeat numbers. */
    record BarLine(int id, List<Token> barline, List<Token> repeatNumbers) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBarLine(this);
        }
    }

    /**
     * {@code (p:q:r}: put p notes into the time of q for the next r notes. Only the p token is required;
     * the colon tokens are kept so shapes like {@code (3::} render back as written.
     */
    record Tuplet(int id, Token pToken, Token firstColon, Token qToken, Token secondColon, Token rToken)
            implements Expr {
        public int p() {
            return Integer.parseInt(pToken.lexeme().substring(1));
        }

        public OptionalInt q() {
            return qToken == null ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(qToken.lexeme()));
        }

        public OptionalInt r() {
            return rToken == null ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(rToken.lexeme()));
        }

        public int resolvedQ() {
            return q().orElse(defaultQ(p()));
        }

        public int resolvedR() {
            return r().orElse(p());
        }

        public static int defaultQ(int p) {
            return switch (p) {
                case 2, 4, 5, 7, 9 -> 3;
                case 3, 6, 8 -> 2;
                default -> 2;
            };
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuplet(this);
        }
    }

    record YSpacer(int id, Token ySpacer, Rhythm rhythm) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYSpacer(this);
        }
    }

    record VoiceOverlay(int id, List<Token> ampersands) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVoiceOverlay(this);
        }
    }

    /** Tokens that failed to parse. {@code expectedType} is null when there was no single expected token. */
    record ErrorExpr(int id, List<Token> tokens, TokenType expectedType, String message) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitErrorExpr(this);
        }
    }

    private static String firstWord(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return text.split("\\s+")[0];
    }
}
