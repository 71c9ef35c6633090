package io.feydor.abc.parse;

import io.feydor.abc.AbcContext;
import io.feydor.abc.AbcErrorOrigin;
import io.feydor.abc.tree.Token;
import io.feydor.abc.tree.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.feydor.abc.tree.TokenType.*;

/**
 * Turns ABC source text into a flat list of tokens ending with an EOF token.
 * <p>
 * Nothing is dropped: whitespace, comments and line breaks all become tokens so the tree can be
 * rendered back to the exact source. Characters that start no known token become INVALID tokens
 * and are reported to the context; scanning always runs to the end of the input.
 */
public class Scanner {
    private static final Logger LOGGER = Logger.getLogger(Scanner.class.getName());
    private final String source;
    private final AbcContext context;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 0;
    private int lineStart = 0;

    public Scanner(String source, AbcContext context) {
        this.source = source;
        this.context = context;
    }

    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        start = current;
        addToken(EOF);
        LOGGER.log(Level.FINE, "Scanned {0} tokens over {1} lines", new Object[]{tokens.size(), line + 1});
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '`' -> addToken(BACKTICK);
            case '\\' -> backslash();
            case '&' -> run('&', AMPERSAND);
            case '\'' -> run('\'', APOSTROPHE);
            case ',' -> run(',', COMMA);
            case '>' -> run('>', GREATER);
            case '<' -> run('<', LESS);
            case '/' -> run('/', SLASH);
            case '|' -> addToken(BARLINE);
            case ':' -> addToken(COLON);
            case '^' -> addToken(match('^') ? SHARP_DBL : match('/') ? SHARP_HALF : SHARP);
            case '_' -> addToken(match('_') ? FLAT_DBL : match('/') ? FLAT_HALF : FLAT);
            case '=', '♮' -> addToken(NATURAL);
            case '♯' -> addToken(SHARP);
            case '♭' -> addToken(FLAT);
            case '%' -> {
                TokenType type = match('%') ? STYLESHEET_DIRECTIVE : COMMENT;
                consumeToEndOfLine();
                addToken(type);
            }
            case '.' -> addToken(DOT);
            case '~' -> addToken(TILDE);
            case '-' -> addToken(MINUS);
            case '$' -> addToken(DOLLAR);
            case '[' -> addToken(LEFTBRKT);
            case ']' -> addToken(RIGHT_BRKT);
            case '{' -> addToken(LEFT_BRACE);
            case '}' -> addToken(RIGHT_BRACE);
            case ')' -> addToken(RIGHT_PAREN);
            case '(' -> {
                if (isDigit(peek())) {
                    while (isDigit(peek())) advance();
                    addToken(LEFTPAREN_NUMBER);
                } else {
                    addToken(LEFTPAREN);
                }
            }
            case '+' -> plus();
            case '!' -> bangSymbol();
            case '"' -> string();
            case '#', '*', ';', '?', '@' -> addToken(RESERVED_CHAR);
            case '\n' -> {
                addToken(EOL);
                newLine();
            }
            case '\r' -> {
                if (match('\n')) {
                    addToken(EOL);
                    newLine();
                } else {
                    whitespace();
                }
            }
            case ' ', '\t' -> whitespace();
            default -> {
                if (isDigit(c)) {
                    while (isDigit(peek())) advance();
                    addToken(NUMBER);
                } else if (isAlpha(c)) {
                    letter(c);
                } else {
                    Token token = addToken(INVALID);
                    context.report("Unexpected character: '" + c + "'", token, AbcErrorOrigin.SCANNER);
                }
            }
        }
    }

    /**
     * Letters followed by ':' at the start of a line open an info line, after '[' they open an inline field.
     * Anywhere else the colon belongs to what follows (e.g. the barline in {@code C:|}).
     */
    private void letter(char c) {
        boolean atLineStart = start == lineStart;
        boolean afterBracket = start > 0 && source.charAt(start - 1) == '[';
        if (peek() == ':' && (atLineStart || afterBracket)) {
            advance();
            addToken(LETTER_COLON);
            if (atLineStart) {
                infoString();
            } else {
                inlineFieldText();
            }
            return;
        }
        addToken(isNoteLetter(c) ? NOTE_LETTER : LETTER);
    }

    private void plus() {
        if (start == lineStart && match(':')) {
            addToken(PLUS_COLON);
            infoString();
            return;
        }
        int end = current;
        while (end < source.length() && isAlpha(source.charAt(end))) end++;
        if (end > current && end < source.length() && source.charAt(end) == '+') {
            current = end + 1;
            addToken(SYMBOL);
        } else {
            addToken(PLUS);
        }
    }

    private void bangSymbol() {
        int end = current;
        while (end < source.length() && source.charAt(end) != '!' && source.charAt(end) != '\n') end++;
        if (end < source.length() && source.charAt(end) == '!') {
            current = end + 1;
            addToken(SYMBOL);
        } else {
            Token token = addToken(INVALID);
            context.report("Unterminated symbol, expected a closing '!'", token, AbcErrorOrigin.SCANNER);
        }
    }

    private void string() {
        while (!isAtEnd() && peek() != '"' && peek() != '\n') advance();
        if (peek() == '"') {
            advance();
            addToken(STRING);
        } else {
            Token token = addToken(INVALID);
            context.report("Unterminated string", token, AbcErrorOrigin.SCANNER);
        }
    }

    /** The value of an info line, up to a comment or the end of the line. */
    private void infoString() {
        start = current;
        while (!isAtEnd() && peek() != '\n' && peek() != '\r' && peek() != '%') advance();
        if (current > start) {
            addToken(INFO_STRING);
        }
    }

    private void inlineFieldText() {
        start = current;
        while (!isAtEnd() && peek() != ']' && peek() != '\n' && peek() != '\r') advance();
        if (current > start) {
            addToken(INFO_STRING);
        }
    }

    private void backslash() {
        int end = current;
        while (end < source.length() && (source.charAt(end) == ' ' || source.charAt(end) == '\t'
                || source.charAt(end) == '\r')) {
            end++;
        }
        if (end < source.length() && source.charAt(end) == '\n') {
            current = end + 1;
            addToken(ANTISLASH_EOL);
            newLine();
        } else {
            if (!isAtEnd()) advance();
            addToken(ESCAPED_CHAR);
        }
    }

    private void whitespace() {
        while (peek() == ' ' || peek() == '\t' || (peek() == '\r' && peekNext() != '\n')) advance();
        addToken(WHITESPACE);
    }

    private void run(char c, TokenType type) {
        while (peek() == c) advance();
        addToken(type);
    }

    private void consumeToEndOfLine() {
        while (!isAtEnd() && peek() != '\n' && !(peek() == '\r' && peekNext() == '\n')) advance();
    }

    private Token addToken(TokenType type) {
        var token = new Token(type, source.substring(start, current), line, start - lineStart, context.nextId());
        tokens.add(token);
        return token;
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isNoteLetter(char c) {
        return (c >= 'a' && c <= 'g') || (c >= 'A' && c <= 'G');
    }
}
