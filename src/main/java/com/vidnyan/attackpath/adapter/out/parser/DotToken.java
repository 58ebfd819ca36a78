package com.vidnyan.attackpath.adapter.out.parser;

/**
 * A lexical token of the DOT subset.
 *
 * @param quoted true for double-quoted ids, which are never keywords
 */
record DotToken(Type type, String text, int line, boolean quoted) {

    enum Type {
        ID,
        ARROW,
        UNDIRECTED_EDGE,
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        EQUALS,
        SEMICOLON,
        COMMA,
        COLON,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    /**
     * Unquoted id matching a keyword, case-insensitively as DOT does.
     */
    boolean isKeyword(String keyword) {
        return type == Type.ID && !quoted && text.equalsIgnoreCase(keyword);
    }

    String describe() {
        return type == Type.EOF ? "end of input" : "'" + text + "'";
    }
}
