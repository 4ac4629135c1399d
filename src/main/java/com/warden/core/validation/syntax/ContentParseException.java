package com.warden.core.validation.syntax;

/**
 * Raised by the lexer or parser when content is not well-formed.
 */
public class ContentParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ContentParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
