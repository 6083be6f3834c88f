package org.witlang.compiler.frontend.lexer;

import org.witlang.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "var", TokenType.VAR,
            "begin", TokenType.BEGIN,
            "end", TokenType.END,
            "export", TokenType.EXPORT,
            "as", TokenType.AS
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int startColumn = 1;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by an {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ',': addToken(TokenType.COMMA); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '&': addToken(TokenType.AMPERSAND); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case ':':
                addToken(match('=') ? TokenType.ASSIGN : TokenType.COLON);
                break;
            case '<':
                if (match('<')) {
                    addToken(TokenType.SHIFT_LEFT);
                } else {
                    reportUnexpected(c);
                }
                break;
            case '>':
                if (match('>')) {
                    addToken(TokenType.SHIFT_RIGHT);
                } else {
                    reportUnexpected(c);
                }
                break;
            case '\'': character(); break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                line++;
                column = 1;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    reportUnexpected(c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        if (previous() == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'b' || peek() == 'B')) {
            advance(); // consume 'x' or 'b'
            while (isHexDigit(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
        }
        if (peek() == 'l' || peek() == 'L') advance();
        if (isAlphaNumeric(peek())) {
            while (isAlphaNumeric(peek())) advance();
            diagnostics.reportError("Invalid number format: " + source.substring(start, current), logicalFileName, line, startColumn);
            return;
        }

        String numberString = source.substring(start, current);
        try {
            addToken(TokenType.INTEGER, parseLong(numberString));
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number format: " + numberString, logicalFileName, line, startColumn);
        }
    }

    private long parseLong(String token) {
        String s = token;
        if (s.endsWith("l") || s.endsWith("L")) {
            s = s.substring(0, s.length() - 1);
        }
        int radix = 10;
        if (s.startsWith("0b") || s.startsWith("0B")) {
            radix = 2;
            s = s.substring(2);
        } else if (s.startsWith("0x") || s.startsWith("0X")) {
            radix = 16;
            s = s.substring(2);
        }
        if (s.isEmpty()) throw new NumberFormatException("Empty numeric literal");
        return Long.parseLong(s, radix);
    }

    private void character() {
        if (isAtEnd() || peek() == '\n') {
            diagnostics.reportError("Unterminated character literal.", logicalFileName, line, startColumn);
            return;
        }
        char c = advance();
        if (c == '\\') {
            if (isAtEnd()) {
                diagnostics.reportError("Unterminated character literal.", logicalFileName, line, startColumn);
                return;
            }
            char escaped = advance();
            switch (escaped) {
                case 'n': c = '\n'; break;
                case 't': c = '\t'; break;
                case '0': c = '\0'; break;
                case '\\': c = '\\'; break;
                case '\'': c = '\''; break;
                default:
                    diagnostics.reportError("Unknown escape sequence: \\" + escaped, logicalFileName, line, startColumn);
                    return;
            }
        }
        if (!match('\'')) {
            diagnostics.reportError("Unterminated character literal.", logicalFileName, line, startColumn);
            return;
        }
        addToken(TokenType.CHARACTER, (long) c);
    }

    private void reportUnexpected(char c) {
        diagnostics.reportError("Unexpected character: " + c, logicalFileName, line, startColumn);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line, startColumn, logicalFileName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private char previous() {
        return source.charAt(current - 1);
    }
}
