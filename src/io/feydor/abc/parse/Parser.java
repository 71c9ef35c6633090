package io.feydor.abc.parse;

import io.feydor.abc.AbcContext;
import io.feydor.abc.AbcErrorOrigin;
import io.feydor.abc.exceptions.AbcParseException;
import io.feydor.abc.parse.ParseResult.Failure;
import io.feydor.abc.parse.ParseResult.Ok;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.Expr.*;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.feydor.abc.tree.TokenType.*;

/**
 * Recursive descent parser from a token list to a {@link FileStructure}.
 * <p>
 * A file is an optional free-text header followed by tunes. A tune is a header of info lines,
 * optionally followed by a body which runs until the next blank line.
 * <p>
 * Music constructs (chords, grace groups, notes, tuplets, barlines...) report failures through
 * {@link ParseResult}. The body loop turns a failure into an {@link ErrorExpr} holding the tokens
 * up to the next end of line or barline, and carries on from there. Text between tunes is kept as
 * file-level tokens. Only a tune header without a single line stops the parse, in which case
 * {@link #parse()} returns null.
 */
public class Parser {
    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());
    private static final Set<String> DECORATION_LETTERS = Set.of("H", "L", "M", "O", "P", "S", "T", "u", "v");
    private static final int MAX_TUPLET_VALUE = 99;
    private static final int MAX_RHYTHM_VALUE = 9999;
    private static final int MAX_RHYTHM_SLASHES = 16;
    private final List<Token> tokens;
    private final AbcContext context;
    private int current = 0;

    public Parser(List<Token> tokens, AbcContext context) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF)) {
            throw new IllegalArgumentException("The token list must end with an EOF token");
        }
        this.tokens = tokens;
        this.context = context;
    }

    /**
     * @return The parsed file, or null when the file structure could not be recovered
     */
    public FileStructure parse() {
        try {
            return fileStructure();
        } catch (AbcParseException e) {
            context.report(e.getMessage(), e.getToken(), e.getOrigin());
            LOGGER.log(Level.WARNING, "Parse aborted at {0}: {1}", new Object[]{e.getToken(), e.getMessage()});
            return null;
        }
    }

    private FileStructure fileStructure() {
        FileHeader fileHeader = null;
        if (!isReferenceField(peek())) {
            fileHeader = fileHeader();
        }

        var contents = new ArrayList<AbcNode>();
        while (!isAtEnd()) {
            Token token = peek();
            if (isReferenceField(token)) {
                contents.add(tune());
            } else if (token.is(WHITESPACE) || token.is(EOL)) {
                contents.add(advance());
            } else if (token.type().isCommentLike()) {
                contents.add(new Comment(context.nextId(), advance()));
            } else {
                freeText(contents);
            }
        }
        LOGGER.log(Level.FINE, "Parsed a file with {0} tune(s)", contents.stream().filter(Tune.class::isInstance).count());
        return new FileStructure(context.nextId(), fileHeader, contents);
    }

    /** Text between tunes is kept as it was written, up to the end of its line. */
    private void freeText(List<AbcNode> contents) {
        LOGGER.log(Level.FINE, "Free text between tunes at line {0}", peek().line());
        while (!isAtEnd() && !peek().is(EOL)) {
            contents.add(advance());
        }
    }

    /** Everything before the first {@code X:} field. */
    private FileHeader fileHeader() {
        var contents = new ArrayList<AbcNode>();
        while (!isAtEnd() && !isReferenceField(peek())) {
            contents.add(advance());
        }
        return new FileHeader(context.nextId(), contents);
    }

    private Tune tune() {
        TuneHeader header = tuneHeader();
        TuneBody body = null;
        if (!isAtEnd() && !atBlankLine()) {
            body = tuneBody(header.voices());
        }
        return new Tune(context.nextId(), header, body);
    }

    private TuneHeader tuneHeader() {
        var lines = new ArrayList<AbcNode>();
        var voices = new ArrayList<String>();
        while (!isAtEnd()) {
            Token token = peek();
            if (token.is(LETTER_COLON)) {
                if (token.lexeme().equals("V:") && !isVoiceLegend(voices)) {
                    break;
                }
                InfoLine infoLine = infoLine();
                if (infoLine.isVoiceMarker() && !voices.contains(infoLine.voiceName())) {
                    voices.add(infoLine.voiceName());
                }
                lines.add(infoLine);
                if (token.lexeme().equals("K:")) {
                    if (peek().is(EOL)) {
                        lines.add(advance());
                    }
                    break;
                }
            } else if (token.type().isCommentLike()) {
                lines.add(new Comment(context.nextId(), advance()));
            } else {
                break;
            }

            if (peek().is(EOL)) {
                lines.add(advance());
            }
        }
        if (lines.isEmpty()) {
            throw new AbcParseException("A tune must start with an info line", peek(), AbcErrorOrigin.TUNE_HEADER);
        }
        return new TuneHeader(context.nextId(), lines, voices);
    }

    /**
     * Decides whether the {@code V:} line at the cursor declares a voice (header) or starts one (body).
     * It declares one when the next line that is not a comment is another info line, an inline voice
     * marker, or the end of the file. A voice that was already declared always starts the body.
     */
    private boolean isVoiceLegend(List<String> voices) {
        Token value = tokens.get(current + 1);
        if (value.is(INFO_STRING)) {
            String name = value.lexeme().trim().split("\\s+")[0];
            if (voices.contains(name)) {
                return false;
            }
        }

        int i = skipLine(current);
        while (true) {
            if (tokens.get(i).is(EOF)) {
                return true;
            }
            i++;
            Token next = tokens.get(i);
            if (next.type().isCommentLike()) {
                i = skipLine(i);
                continue;
            }
            if (next.is(EOF) || next.is(LETTER_COLON)) {
                return true;
            }
            return next.is(LEFTBRKT) && tokens.get(i + 1).is(LETTER_COLON) && tokens.get(i + 1).lexeme().equals("V:");
        }
    }

    /** @return the index of the EOL or EOF that ends the line containing {@code from} */
    private int skipLine(int from) {
        int i = from;
        while (!tokens.get(i).is(EOL) && !tokens.get(i).is(EOF)) i++;
        return i;
    }

    /** A field and its value, including {@code +:} continuation lines. */
    private InfoLine infoLine() {
        Token key = advance();
        var value = new ArrayList<Token>();
        while (true) {
            while (!isAtEnd() && !peek().is(EOL)) {
                value.add(advance());
            }
            if (peek().is(EOL) && peekNext().is(PLUS_COLON)) {
                value.add(advance());
                value.add(advance());
            } else {
                break;
            }
        }
        return new InfoLine(context.nextId(), key, value);
    }

    private TuneBody tuneBody(List<String> voices) {
        var elements = new ArrayList<AbcNode>();
        while (!isAtEnd() && !atBlankLine()) {
            Token token = peek();
            if (token.type().isCommentLike()) {
                elements.add(new Comment(context.nextId(), advance()));
            } else if (token.is(LETTER_COLON)) {
                elements.add(infoLine());
            } else {
                int constructStart = current;
                var result = musicContent();
                if (result instanceof Ok<List<AbcNode>> ok) {
                    elements.addAll(ok.value());
                } else if (result instanceof Failure<List<AbcNode>> failure) {
                    elements.add(synchronize(constructStart, failure));
                }
            }
        }

        discoverVoices(elements, voices);
        var beamed = BeamGrouper.group(elements, context);
        var systems = new VoicePartitioner(voices).partition(beamed);
        return new TuneBody(context.nextId(), systems);
    }

    /**
     * Reports the failure and wraps everything from the start of the broken construct up to the
     * next recovery token (end of line or barline) into an error node.
     */
    private ErrorExpr synchronize(int constructStart, Failure<?> failure) {
        context.report(failure.message(), failure.at(), failure.origin());
        LOGGER.log(Level.FINE, "Recovered from: {0} at {1}", new Object[]{failure.message(), failure.at()});
        current = constructStart;
        var errorTokens = new ArrayList<Token>();
        do {
            errorTokens.add(advance());
        } while (!isAtEnd() && !peek().type().isRecoveryPoint());
        return new ErrorExpr(context.nextId(), errorTokens, failure.expected(), failure.message());
    }

    /** Voices only referenced in the body join the declared ones, in order of first appearance. */
    private void discoverVoices(List<AbcNode> elements, List<String> voices) {
        for (var element : elements) {
            String name = VoicePartitioner.voiceName(element);
            if (name != null && !voices.contains(name)) {
                LOGGER.log(Level.FINE, "Discovered voice {0} in the tune body", name);
                voices.add(name);
            }
        }
    }

    private ParseResult<List<AbcNode>> musicContent() {
        Token token = peek();
        return switch (token.type()) {
            case EOL, WHITESPACE, ANTISLASH_EOL, DOLLAR, RESERVED_CHAR, BACKTICK, ESCAPED_CHAR, LEFTPAREN,
                    RIGHT_PAREN, INVALID -> single(ParseResult.ok(advance()));
            case AMPERSAND -> single(ParseResult.ok(new VoiceOverlay(context.nextId(), List.of(advance()))));
            case BARLINE, COLON -> single(barline());
            case LEFTBRKT -> {
                Token next = peekNext();
                if (next.is(LETTER_COLON)) {
                    yield single(inlineField());
                } else if (next.is(NUMBER) || next.is(BARLINE)) {
                    yield single(barline());
                }
                yield single(chord());
            }
            case STRING -> single(ParseResult.ok(new Annotation(context.nextId(), advance())));
            case SYMBOL -> single(ParseResult.ok(new Symbol(context.nextId(), advance())));
            case DOT, TILDE -> single(decoration());
            case SHARP, SHARP_DBL, SHARP_HALF, FLAT, FLAT_DBL, FLAT_HALF, NATURAL, NOTE_LETTER -> single(note());
            case LEFT_BRACE -> single(graceGroup());
            case LEFTPAREN_NUMBER -> single(tuplet());
            case LETTER -> single(letter());
            default -> ParseResult.fail("Unexpected token in the tune body: '" + token.lexeme() + "'", token,
                    AbcErrorOrigin.TUNE_BODY);
        };
    }

    private static <T extends AbcNode> ParseResult<List<AbcNode>> single(ParseResult<T> result) {
        if (result instanceof Ok<T> ok) {
            return ParseResult.ok(List.of(ok.value()));
        }
        return result.propagate();
    }

    private ParseResult<? extends AbcNode> letter() {
        Token token = peek();
        return switch (token.lexeme()) {
            case "y" -> {
                Token ySpacer = advance();
                var rhythm = rhythm(AbcErrorOrigin.TUNE_BODY);
                if (!(rhythm instanceof Ok<Rhythm> ok)) {
                    yield rhythm.<YSpacer>propagate();
                }
                yield ParseResult.ok(new YSpacer(context.nextId(), ySpacer, ok.value()));
            }
            case "z", "x" -> note();
            case "Z", "X" -> multiMeasureRest();
            default -> {
                if (DECORATION_LETTERS.contains(token.lexeme())) {
                    yield decoration();
                }
                yield ParseResult.fail("Unexpected letter in the tune body: '" + token.lexeme() + "'", token,
                        AbcErrorOrigin.TUNE_BODY);
            }
        };
    }

    private ParseResult<MultiMeasureRest> multiMeasureRest() {
        Token rest = advance();
        Token length = null;
        if (peek().is(NUMBER)) {
            length = advance();
            int measures = intValue(length);
            if (measures < 1 || measures > MultiMeasureRest.MAX_MEASURES) {
                return ParseResult.fail("A multi-measure rest must last between 1 and "
                        + MultiMeasureRest.MAX_MEASURES + " measures", length, AbcErrorOrigin.MULTI_MEASURE_REST);
            }
        }
        return ParseResult.ok(new MultiMeasureRest(context.nextId(), rest, length));
    }

    private ParseResult<Decoration> decoration() {
        Token token = peek();
        if (!isDecoration()) {
            return ParseResult.fail("A decoration must be followed by a note, a rest or a chord", token,
                    AbcErrorOrigin.DECORATION);
        }
        return ParseResult.ok(new Decoration(context.nextId(), advance()));
    }

    /** Looks past further decorations, annotations, symbols and grace groups for something to decorate. */
    private boolean isDecoration() {
        int i = current + 1;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            TokenType type = token.type();
            if (type == DOT || type == TILDE || type == STRING || type == SYMBOL) {
                i++;
            } else if (type == LETTER && DECORATION_LETTERS.contains(token.lexeme())) {
                i++;
            } else if (type == LEFT_BRACE) {
                while (i < tokens.size() && !tokens.get(i).is(RIGHT_BRACE) && !tokens.get(i).is(EOL)) i++;
                if (i >= tokens.size() || !tokens.get(i).is(RIGHT_BRACE)) {
                    return false;
                }
                i++;
            } else if (type == LETTER) {
                return Set.of("z", "x", "Z", "X", "y").contains(token.lexeme());
            } else {
                return type.isAccidental() || type == NOTE_LETTER || type == LEFTBRKT;
            }
        }
        return false;
    }

    private ParseResult<Note> note() {
        NoteHead head;
        if (peek().is(LETTER)) {
            head = new Rest(context.nextId(), advance());
        } else {
            var pitch = pitch();
            if (!(pitch instanceof Ok<Pitch> ok)) {
                return pitch.propagate();
            }
            head = ok.value();
        }
        var rhythm = rhythm(AbcErrorOrigin.NOTE);
        if (!(rhythm instanceof Ok<Rhythm> ok)) {
            return rhythm.propagate();
        }
        Token tie = peek().is(MINUS) ? advance() : null;
        return ParseResult.ok(new Note(context.nextId(), head, ok.value(), tie));
    }

    private ParseResult<Pitch> pitch() {
        Token alteration = peek().type().isAccidental() ? advance() : null;
        if (!peek().is(NOTE_LETTER)) {
            return ParseResult.expected(NOTE_LETTER, "Expected a note letter, found '" + peek().lexeme() + "'",
                    peek(), AbcErrorOrigin.NOTE);
        }
        Token noteLetter = advance();
        Token octave = peek().type().isOctave() ? advance() : null;
        return ParseResult.ok(new Pitch(context.nextId(), alteration, noteLetter, octave));
    }

    /**
     * {@code [numerator] [/... [denominator]] [<... | >...]}
     * @return The rhythm, null if none of its parts are present, or a failure for a number too large to time
     */
    private ParseResult<Rhythm> rhythm(AbcErrorOrigin origin) {
        Token numerator = peek().is(NUMBER) ? advance() : null;
        Token separator = null;
        Token denominator = null;
        if (peek().is(SLASH)) {
            separator = advance();
            if (peek().is(NUMBER)) {
                denominator = advance();
            }
        }
        Token broken = peek().type().isBroken() ? advance() : null;
        if (numerator == null && separator == null && broken == null) {
            return ParseResult.ok(null);
        }
        for (Token number : new Token[]{numerator, denominator}) {
            int value = number == null ? 0 : intValue(number);
            if (value < 0 || value > MAX_RHYTHM_VALUE) {
                return ParseResult.fail("A note length must not exceed " + MAX_RHYTHM_VALUE, number, origin);
            }
        }
        if (separator != null && denominator == null && separator.lexeme().length() > MAX_RHYTHM_SLASHES) {
            return ParseResult.fail("A note length takes at most " + MAX_RHYTHM_SLASHES + " slashes", separator,
                    origin);
        }
        return ParseResult.ok(new Rhythm(context.nextId(), numerator, separator, denominator, broken));
    }

    /**
     * The value of a run of digits, ignoring a leading {@code (}.
     * @return The value, or -1 when the run has more digits than an int is sure to hold
     */
    private static int intValue(Token number) {
        String digits = number.lexeme().startsWith("(") ? number.lexeme().substring(1) : number.lexeme();
        if (digits.isEmpty() || digits.length() > 9) {
            return -1;
        }
        return Integer.parseInt(digits);
    }

    private static boolean isTupletValue(Token number) {
        int value = intValue(number);
        return value >= 1 && value <= MAX_TUPLET_VALUE;
    }

    private ParseResult<Chord> chord() {
        Token leftBracket = advance();
        var contents = new ArrayList<AbcNode>();
        while (!peek().is(RIGHT_BRKT)) {
            Token token = peek();
            if (token.is(STRING)) {
                contents.add(new Annotation(context.nextId(), advance()));
            } else if (token.type().isAccidental() || token.is(NOTE_LETTER)) {
                var note = note();
                if (!(note instanceof Ok<Note> ok)) {
                    return note.propagate();
                }
                contents.add(ok.value());
            } else if (token.is(EOL) || token.is(EOF)) {
                return ParseResult.expected(RIGHT_BRKT, "Expected a ']' to close the chord", token,
                        AbcErrorOrigin.CHORD);
            } else {
                return ParseResult.fail("Unexpected token in a chord: '" + token.lexeme() + "'", token,
                        AbcErrorOrigin.CHORD);
            }
        }
        if (contents.isEmpty()) {
            return ParseResult.fail("A chord needs at least one note", peek(), AbcErrorOrigin.CHORD);
        }
        Token rightBracket = advance();
        var rhythm = rhythm(AbcErrorOrigin.CHORD);
        if (!(rhythm instanceof Ok<Rhythm> ok)) {
            return rhythm.propagate();
        }
        Token tie = peek().is(MINUS) ? advance() : null;
        return ParseResult.ok(new Chord(context.nextId(), leftBracket, contents, rightBracket, ok.value(), tie));
    }

    private ParseResult<GraceGroup> graceGroup() {
        Token leftBrace = advance();
        Token slash = peek().is(SLASH) ? advance() : null;
        var notes = new ArrayList<AbcNode>();
        while (!peek().is(RIGHT_BRACE)) {
            Token token = peek();
            if (token.type().isAccidental() || token.is(NOTE_LETTER)) {
                var note = note();
                if (!(note instanceof Ok<Note> ok)) {
                    return note.propagate();
                }
                notes.add(ok.value());
            } else if (token.is(EOL) || token.is(EOF)) {
                return ParseResult.expected(RIGHT_BRACE, "Expected a '}' to close the grace group", token,
                        AbcErrorOrigin.GRACE_GROUP);
            } else {
                return ParseResult.fail("Unexpected token in a grace group: '" + token.lexeme() + "'", token,
                        AbcErrorOrigin.GRACE_GROUP);
            }
        }
        Token rightBrace = advance();
        return ParseResult.ok(new GraceGroup(context.nextId(), leftBrace, slash, notes, rightBrace));
    }

    private ParseResult<InlineField> inlineField() {
        Token leftBracket = advance();
        Token field = advance();
        var text = new ArrayList<Token>();
        while (peek().is(INFO_STRING)) {
            text.add(advance());
        }
        if (!peek().is(RIGHT_BRKT)) {
            return ParseResult.expected(RIGHT_BRKT, "Expected a ']' to close the inline field", peek(),
                    AbcErrorOrigin.INLINE_FIELD);
        }
        Token rightBracket = advance();
        return ParseResult.ok(new InlineField(context.nextId(), leftBracket, field, text, rightBracket));
    }

    /** {@code (p}, {@code (p:q}, {@code (p::}, {@code (p:q:r}, {@code (p::r} or {@code (p:} */
    private ParseResult<Tuplet> tuplet() {
        Token p = advance();
        if (!isTupletValue(p)) {
            return ParseResult.fail("A tuplet must contain between 1 and " + MAX_TUPLET_VALUE + " notes", p,
                    AbcErrorOrigin.TUPLET);
        }
        Token firstColon = null, q = null, secondColon = null, r = null;
        if (peek().is(COLON)) {
            firstColon = advance();
            if (peek().is(NUMBER)) {
                q = advance();
            }
            if (peek().is(COLON)) {
                secondColon = advance();
                if (peek().is(NUMBER)) {
                    r = advance();
                }
            }
        }
        if (q != null && !isTupletValue(q)) {
            return ParseResult.fail("A tuplet's q must be between 1 and " + MAX_TUPLET_VALUE, q, AbcErrorOrigin.TUPLET);
        }
        if (r != null && !isTupletValue(r)) {
            return ParseResult.fail("A tuplet's r must be between 1 and " + MAX_TUPLET_VALUE, r, AbcErrorOrigin.TUPLET);
        }
        return ParseResult.ok(new Tuplet(context.nextId(), p, firstColon, q, secondColon, r));
    }

    private ParseResult<BarLine> barline() {
        Token first = peek();
        return switch (first.type()) {
            case COLON -> colonBarline();
            case BARLINE -> pipeBarline();
            case LEFTBRKT -> bracketBarline();
            default -> ParseResult.fail("Expected a barline, found '" + first.lexeme() + "'", first,
                    AbcErrorOrigin.BARLINE);
        };
    }

    /** {@code ::}, {@code :|}, {@code :||}, {@code :|:}, {@code :|]}, {@code :|2} */
    private ParseResult<BarLine> colonBarline() {
        Token first = peek();
        var barline = new ArrayList<Token>();
        while (peek().is(COLON)) barline.add(advance());
        boolean hasPipes = false;
        while (peek().is(BARLINE)) {
            barline.add(advance());
            hasPipes = true;
        }
        if (!hasPipes && barline.size() == 1) {
            return ParseResult.expected(BARLINE, "Expected a barline after ':'", first, AbcErrorOrigin.BARLINE);
        }
        if (hasPipes) {
            closeBarline(barline);
        }
        return ParseResult.ok(new BarLine(context.nextId(), barline, repeatNumbersAfter(barline)));
    }

    /** {@code |}, {@code ||}, {@code |]}, {@code |:}, {@code |1} */
    private ParseResult<BarLine> pipeBarline() {
        var barline = new ArrayList<Token>();
        while (peek().is(BARLINE)) barline.add(advance());
        closeBarline(barline);
        return ParseResult.ok(new BarLine(context.nextId(), barline, repeatNumbersAfter(barline)));
    }

    /** {@code [|}, {@code [|]}, {@code [|:}, {@code [1}, {@code [1,3} */
    private ParseResult<BarLine> bracketBarline() {
        var barline = new ArrayList<Token>();
        barline.add(advance());
        if (peek().is(BARLINE)) {
            while (peek().is(BARLINE)) barline.add(advance());
            closeBarline(barline);
            return ParseResult.ok(new BarLine(context.nextId(), barline, List.of()));
        }
        return ParseResult.ok(new BarLine(context.nextId(), barline, repeatNumbers()));
    }

    /** A run of pipes may end in ']' or in repeat colons. */
    private void closeBarline(List<Token> barline) {
        if (peek().is(RIGHT_BRKT)) {
            barline.add(advance());
        } else {
            while (peek().is(COLON)) barline.add(advance());
        }
    }

    private List<Token> repeatNumbersAfter(List<Token> barline) {
        if (barline.get(barline.size() - 1).is(BARLINE)) {
            return repeatNumbers();
        }
        return List.of();
    }

    /** {@code 1}, {@code 1,3,5-7,9}, {@code 1x2} */
    private List<Token> repeatNumbers() {
        var numbers = new ArrayList<Token>();
        if (!peek().is(NUMBER)) {
            return numbers;
        }
        repeatItem(numbers);
        while (peek().is(COMMA) && peek().lexeme().length() == 1 && peekNext().is(NUMBER)) {
            numbers.add(advance());
            repeatItem(numbers);
        }
        return numbers;
    }

    private void repeatItem(List<Token> numbers) {
        numbers.add(advance());
        if (peek().is(MINUS) && peekNext().is(NUMBER)) {
            numbers.add(advance());
            numbers.add(advance());
        } else if (peek().is(LETTER) && peek().lexeme().equals("x")) {
            numbers.add(advance());
            if (peek().is(NUMBER)) {
                numbers.add(advance());
            }
        }
    }

    /** Only whitespace between the cursor (at a line start) and the next line break. */
    private boolean atBlankLine() {
        if (current > 0 && !tokens.get(current - 1).is(EOL)) {
            return false;
        }
        int i = current;
        while (tokens.get(i).is(WHITESPACE)) i++;
        return tokens.get(i).is(EOL) || tokens.get(i).is(EOF);
    }

    private static boolean isReferenceField(Token token) {
        return token.is(LETTER_COLON) && token.lexeme().equals("X:");
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!isAtEnd()) current++;
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }

    private boolean isAtEnd() {
        return peek().is(EOF);
    }
}
