package com.warden.core.validation.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Indentation-aware tokenizer for the Python-syntax subset accepted as CODE and EXPRESSION content.
 *
 * <p>Newlines inside brackets and after a trailing backslash are joined. Blank and comment-only
 * lines never produce INDENT/DEDENT tokens.
 */
final class Lexer {

    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private int bracketDepth;

    private Lexer(String src) {
        this.src = src;
        indents.push(0);
    }

    static List<Token> tokenize(String src) {
        var lexer = new Lexer(src);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        boolean atLineStart = true;
        while (pos < src.length()) {
            if (atLineStart && bracketDepth == 0) {
                if (handleIndentation()) {
                    continue;
                }
                atLineStart = false;
            }
            char c = src.charAt(pos);
            if (c == '\n') {
                if (bracketDepth == 0 && !lastIs(Token.Type.NEWLINE) && !tokens.isEmpty()) {
                    add(Token.Type.NEWLINE, "\n", pos);
                }
                newline();
                atLineStart = true;
            } else if (c == '\r' || c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                    pos++;
                    newline();
                } else if (pos + 2 < src.length() && src.charAt(pos + 1) == '\r' && src.charAt(pos + 2) == '\n') {
                    pos += 2;
                    newline();
                } else {
                    throw error("unexpected character after line continuation");
                }
            } else if (isStringStart()) {
                readString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else {
                readOperator();
            }
        }
        if (bracketDepth > 0) {
            throw error("unexpected end of input: unclosed bracket");
        }
        if (!tokens.isEmpty() && !lastIs(Token.Type.NEWLINE)) {
            add(Token.Type.NEWLINE, "\n", pos);
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(Token.Type.DEDENT, "", pos);
        }
        add(Token.Type.EOF, "", pos);
    }

    /**
     * Measures the indentation of a new logical line. Returns true when the line was blank or a
     * comment and has been consumed entirely.
     */
    private boolean handleIndentation() {
        int width = 0;
        int p = pos;
        while (p < src.length()) {
            char c = src.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c != '\f') {
                break;
            }
            p++;
        }
        if (p >= src.length()) {
            pos = p;
            return true;
        }
        char c = src.charAt(p);
        if (c == '\n' || c == '\r' || c == '#') {
            pos = p;
            if (c == '#') {
                skipComment();
            }
            if (pos < src.length() && src.charAt(pos) == '\r') {
                pos++;
            }
            if (pos < src.length() && src.charAt(pos) == '\n') {
                newline();
            }
            return true;
        }
        pos = p;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(Token.Type.INDENT, "", pos);
        } else if (width < current) {
            while (indents.peek() > width) {
                indents.pop();
                add(Token.Type.DEDENT, "", pos);
            }
            if (indents.peek() != width) {
                throw error("unindent does not match any outer indentation level");
            }
        }
        return false;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
    }

    private boolean isStringStart() {
        int p = pos;
        int prefix = 0;
        while (p < src.length() && prefix < 2 && "rRbBuUfF".indexOf(src.charAt(p)) >= 0) {
            p++;
            prefix++;
        }
        return p < src.length() && (src.charAt(p) == '\'' || src.charAt(p) == '"');
    }

    private void readString() {
        int start = pos;
        boolean raw = false;
        boolean bytes = false;
        while ("rRbBuUfF".indexOf(src.charAt(pos)) >= 0) {
            char p = Character.toLowerCase(src.charAt(pos));
            raw |= p == 'r';
            bytes |= p == 'b';
            pos++;
        }
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        int startLine = line;
        int startCol = start - lineStart + 1;
        var value = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new ContentParseException("unterminated string literal", startLine, startCol);
            }
            char c = src.charAt(pos);
            if (triple && src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                pos += 3;
                break;
            }
            if (!triple && c == quote) {
                pos++;
                break;
            }
            if (!triple && c == '\n') {
                throw new ContentParseException("unterminated string literal", startLine, startCol);
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char next = src.charAt(pos + 1);
                if (raw) {
                    value.append(c).append(next);
                } else {
                    switch (next) {
                        case 'n' -> value.append('\n');
                        case 't' -> value.append('\t');
                        case 'r' -> value.append('\r');
                        case '0' -> value.append('\0');
                        case '\\', '\'', '"' -> value.append(next);
                        case '\n' -> { }
                        default -> value.append(c).append(next);
                    }
                }
                if (next == '\n') {
                    line++;
                    lineStart = pos + 2;
                }
                pos += 2;
                continue;
            }
            if (c == '\n') {
                line++;
                lineStart = pos + 1;
            }
            value.append(c);
            pos++;
        }
        tokens.add(new Token(bytes ? Token.Type.BYTES : Token.Type.STRING, value.toString(), startLine, startCol));
    }

    private void readNumber() {
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            digits();
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                digits();
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    digits();
                } else {
                    pos = mark;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
                pos++;
            }
        }
        if (pos < src.length() && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw error("invalid numeric literal");
        }
        add(Token.Type.NUMBER, src.substring(start, pos), start);
    }

    private void digits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readName() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        add(Token.Type.NAME, src.substring(start, pos), start);
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                int start = pos;
                pos += op.length();
                switch (op) {
                    case "(", "[", "{" -> bracketDepth++;
                    case ")", "]", "}" -> {
                        if (bracketDepth == 0) {
                            throw new ContentParseException("unmatched '" + op + "'", line, start - lineStart + 1);
                        }
                        bracketDepth--;
                    }
                    default -> { }
                }
                add(Token.Type.OP, op, start);
                return;
            }
        }
        throw error("unexpected character '" + src.charAt(pos) + "'");
    }

    private void newline() {
        pos++;
        line++;
        lineStart = pos;
    }

    private boolean lastIs(Token.Type type) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == type;
    }

    private void add(Token.Type type, String text, int offset) {
        tokens.add(new Token(type, text, line, Math.max(1, offset - lineStart + 1)));
    }

    private ContentParseException error(String message) {
        return new ContentParseException(message, line, pos - lineStart + 1);
    }
}
