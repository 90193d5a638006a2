package com.newtype;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits Newtype source into tokens. Whitespace, {@code //} line comments and
 * {@code {- ... -}} block comments are skipped; block comments do not nest.
 */
public class Lexer {
    // Reserved words are never identifiers
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("from", TokenType.FROM),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("then", TokenType.THEN),
        Map.entry("while", TokenType.WHILE),
        Map.entry("for", TokenType.FOR),
        Map.entry("goto", TokenType.GOTO),
        Map.entry("require", TokenType.REQUIRE),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("as", TokenType.AS),
        Map.entry("do", TokenType.DO),
        Map.entry("yield", TokenType.YIELD),
        Map.entry("await", TokenType.AWAIT),
        Map.entry("async", TokenType.ASYNC),
        Map.entry("readonly", TokenType.READONLY),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE)
    );

    private final String source;
    private final char[] buf;
    private final int length;
    private int position = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source) {
        this.source = source;
        this.buf = source.toCharArray();
        this.length = buf.length;
    }

    public static boolean isReservedWord(String name) {
        TokenType type = KEYWORDS.get(name);
        return type != null && type != TokenType.TRUE && type != TokenType.FALSE;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (position >= length) {
                tokens.add(new Token(TokenType.EOF, "", null, line, column()));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private Token nextToken() {
        int start = position;
        int startLine = line;
        int startCol = column();
        char c = buf[position];

        if (isIdentifierStart(c)) {
            return scanWord(start, startLine, startCol);
        }
        if (isDigit(c)) {
            return scanNumber(start, startLine, startCol);
        }
        if (c == '"') {
            return scanString(start, startLine, startCol);
        }

        char next = peekChar(1);
        TokenType type = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case ',' -> TokenType.COMMA;
            case '|' -> TokenType.PIPE;
            case '&' -> TokenType.AMPERSAND;
            case '?' -> TokenType.QUESTION;
            case '*' -> TokenType.STAR;
            case ':' -> next == '>' ? TokenType.EXTENDS_RIGHT : TokenType.COLON;
            case '=' -> next == '=' ? TokenType.EQ : TokenType.ASSIGN;
            case '-' -> next == '>' ? TokenType.ARROW : TokenType.MINUS;
            case '<' -> next == ':' ? TokenType.EXTENDS_LEFT : null;
            case '!' -> next == '=' ? TokenType.NOT_EQ : null;
            default -> null;
        };
        if (type == null) {
            throw new ParseException(startLine, startCol, "unexpected character '" + c + "'");
        }
        int width = switch (type) {
            case EXTENDS_RIGHT, EXTENDS_LEFT, EQ, NOT_EQ, ARROW -> 2;
            default -> 1;
        };
        position += width;
        return makeToken(type, start, startLine, startCol, null);
    }

    private Token scanWord(int start, int startLine, int startCol) {
        while (position < length && isIdentifierPart(buf[position])) {
            position++;
        }
        String word = source.substring(start, position);
        TokenType type = KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER);
        return makeToken(type, start, startLine, startCol, null);
    }

    private Token scanNumber(int start, int startLine, int startCol) {
        boolean isDouble = false;
        consumeDigits();
        if (peekChar(0) == '.' && isDigit(peekChar(1))) {
            isDouble = true;
            position++;
            consumeDigits();
        }
        char e = peekChar(0);
        if (e == 'e' || e == 'E') {
            int sign = (peekChar(1) == '+' || peekChar(1) == '-') ? 1 : 0;
            if (isDigit(peekChar(1 + sign))) {
                isDouble = true;
                position += 1 + sign;
                consumeDigits();
            }
        }
        if (position < length && isIdentifierStart(buf[position])) {
            throw new ParseException(startLine, startCol,
                "unexpected '" + buf[position] + "' after number literal");
        }
        String text = source.substring(start, position);
        if (!isDouble) {
            return makeToken(TokenType.INTEGER, start, startLine, startCol, new BigInteger(text));
        }
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw new ParseException(startLine, startCol, "number literal " + text + " is out of range");
        }
        return makeToken(TokenType.DOUBLE, start, startLine, startCol, value);
    }

    private Token scanString(int start, int startLine, int startCol) {
        StringBuilder value = new StringBuilder();
        position++; // opening quote
        while (true) {
            if (position >= length || buf[position] == '\n') {
                throw new ParseException(startLine, startCol, "unterminated string literal");
            }
            char c = buf[position++];
            if (c == '"') {
                break;
            }
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (position >= length) {
                throw new ParseException(startLine, startCol, "unterminated string literal");
            }
            char escaped = buf[position++];
            switch (escaped) {
                case '"' -> value.append('"');
                case '\\' -> value.append('\\');
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                default -> throw new ParseException(line, position - lineStart - 1,
                    "unknown escape sequence '\\" + escaped + "'");
            }
        }
        return makeToken(TokenType.STRING, start, startLine, startCol, value.toString());
    }

    private void skipWhitespaceAndComments() {
        while (position < length) {
            char c = buf[position];
            if (c == '\n') {
                newLine();
            } else if (c == ' ' || c == '\t' || c == '\r') {
                position++;
            } else if (c == '/' && peekChar(1) == '/') {
                while (position < length && buf[position] != '\n') {
                    position++;
                }
            } else if (c == '{' && peekChar(1) == '-') {
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startCol = column();
        position += 2;
        while (position < length) {
            if (buf[position] == '-' && peekChar(1) == '}') {
                position += 2;
                return;
            }
            if (buf[position] == '\n') {
                newLine();
            } else {
                position++;
            }
        }
        throw new ParseException(startLine, startCol, "unterminated block comment");
    }

    private void newLine() {
        position++;
        line++;
        lineStart = position;
    }

    private void consumeDigits() {
        while (position < length && isDigit(buf[position])) {
            position++;
        }
    }

    private Token makeToken(TokenType type, int start, int startLine, int startCol, Object literal) {
        return new Token(type, source.substring(start, position), literal, startLine, startCol);
    }

    private int column() {
        return position - lineStart + 1;
    }

    private char peekChar(int offset) {
        int pos = position + offset;
        return pos < length ? buf[pos] : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
