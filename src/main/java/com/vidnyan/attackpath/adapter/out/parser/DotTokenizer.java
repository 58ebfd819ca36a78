package com.vidnyan.attackpath.adapter.out.parser;

import com.vidnyan.attackpath.domain.graph.MalformedGraphException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a DOT description into tokens.
 * Handles bare and quoted ids, numerals, {@code //} and block comments and
 * {@code #} preprocessor lines. HTML strings are not part of the supported subset.
 */
final class DotTokenizer {

    private final String input;
    private int pos;
    private int line = 1;
    private boolean lineStart = true;

    DotTokenizer(String input) {
        this.input = input;
    }

    static List<DotToken> tokenize(String input) {
        return new DotTokenizer(input).run();
    }

    private List<DotToken> run() {
        List<DotToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                tokens.add(new DotToken(DotToken.Type.EOF, "", line, false));
                return tokens;
            }
            lineStart = false;
            char c = input.charAt(pos);
            switch (c) {
                case '{' -> tokens.add(single(DotToken.Type.LBRACE));
                case '}' -> tokens.add(single(DotToken.Type.RBRACE));
                case '[' -> tokens.add(single(DotToken.Type.LBRACKET));
                case ']' -> tokens.add(single(DotToken.Type.RBRACKET));
                case '=' -> tokens.add(single(DotToken.Type.EQUALS));
                case ';' -> tokens.add(single(DotToken.Type.SEMICOLON));
                case ',' -> tokens.add(single(DotToken.Type.COMMA));
                case ':' -> tokens.add(single(DotToken.Type.COLON));
                case '"' -> tokens.add(quoted());
                case '<' -> throw new MalformedGraphException("HTML strings are not supported", line);
                default -> tokens.add(wordOrEdgeOp(c));
            }
        }
    }

    private DotToken single(DotToken.Type type) {
        DotToken token = new DotToken(type, String.valueOf(input.charAt(pos)), line, false);
        pos++;
        return token;
    }

    private DotToken wordOrEdgeOp(char c) {
        if (c == '-' && pos + 1 < input.length()) {
            char next = input.charAt(pos + 1);
            if (next == '>') {
                pos += 2;
                return new DotToken(DotToken.Type.ARROW, "->", line, false);
            }
            if (next == '-') {
                pos += 2;
                return new DotToken(DotToken.Type.UNDIRECTED_EDGE, "--", line, false);
            }
        }
        if (c == '-' || c == '.' || Character.isDigit(c)) {
            return numeral();
        }
        if (isIdStart(c)) {
            int start = pos;
            while (pos < input.length() && isIdPart(input.charAt(pos))) {
                pos++;
            }
            return new DotToken(DotToken.Type.ID, input.substring(start, pos), line, false);
        }
        throw new MalformedGraphException("Unexpected character '" + c + "'", line);
    }

    private DotToken numeral() {
        int start = pos;
        if (input.charAt(pos) == '-') {
            pos++;
        }
        boolean digits = false;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
            digits = true;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
                digits = true;
            }
        }
        if (!digits) {
            throw new MalformedGraphException("Malformed numeral '" + input.substring(start, pos) + "'", line);
        }
        return new DotToken(DotToken.Type.ID, input.substring(start, pos), line, false);
    }

    private DotToken quoted() {
        int startLine = line;
        StringBuilder text = new StringBuilder();
        pos++; // opening quote
        while (true) {
            if (pos >= input.length()) {
                throw new MalformedGraphException("Unterminated string", startLine);
            }
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                break;
            }
            if (c == '\\' && pos + 1 < input.length()) {
                char next = input.charAt(pos + 1);
                if (next == '"') {
                    text.append('"');
                    pos += 2;
                    continue;
                }
                if (next == '\n') {
                    line++;
                    pos += 2;
                    continue; // line continuation
                }
            }
            if (c == '\n') {
                line++;
            }
            text.append(c);
            pos++;
        }
        if (concatenationFollows()) {
            DotToken rest = quoted();
            text.append(rest.text());
        }
        return new DotToken(DotToken.Type.ID, text.toString(), startLine, true);
    }

    /**
     * DOT allows {@code "a" + "b"}; consumes the plus when another quoted string follows.
     */
    private boolean concatenationFollows() {
        int save = pos;
        int saveLine = line;
        skipWhitespaceAndComments();
        if (pos < input.length() && input.charAt(pos) == '+') {
            pos++;
            skipWhitespaceAndComments();
            if (pos < input.length() && input.charAt(pos) == '"') {
                return true;
            }
        }
        pos = save;
        line = saveLine;
        return false;
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
                lineStart = true;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#' && lineStart) {
                skipToEndOfLine();
            } else if (input.startsWith("//", pos)) {
                skipToEndOfLine();
            } else if (input.startsWith("/*", pos)) {
                int end = input.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new MalformedGraphException("Unterminated comment", line);
                }
                for (int i = pos; i < end; i++) {
                    if (input.charAt(i) == '\n') {
                        line++;
                    }
                }
                pos = end + 2;
            } else {
                return;
            }
        }
    }

    private void skipToEndOfLine() {
        while (pos < input.length() && input.charAt(pos) != '\n') {
            pos++;
        }
    }

    private static boolean isIdStart(char c) {
        return Character.isLetter(c) || c == '_' || c >= 0x80;
    }

    private static boolean isIdPart(char c) {
        return isIdStart(c) || Character.isDigit(c);
    }
}
