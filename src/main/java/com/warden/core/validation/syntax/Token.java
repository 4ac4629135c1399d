package com.warden.core.validation.syntax;

/**
 * A lexical token. {@code text} is the decoded value for strings and the raw source otherwise.
 */
record Token(Type type, String text, int line, int column) {

    enum Type {
        NAME,
        NUMBER,
        STRING,
        BYTES,
        OP,
        NEWLINE,
        INDENT,
        DEDENT,
        EOF
    }

    boolean is(Type t, String value) {
        return type == t && text.equals(value);
    }

    boolean isOp(String value) {
        return type == Type.OP && text.equals(value);
    }

    boolean isKeyword(String value) {
        return type == Type.NAME && text.equals(value);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
