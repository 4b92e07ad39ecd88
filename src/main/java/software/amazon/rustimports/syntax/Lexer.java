/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.ArrayList;
import java.util.List;
import software.amazon.smithy.utils.SimpleParser;

/**
 * Turns the text of a use declaration into a list of {@link Token}.
 *
 * <p>The lexer never fails. Whitespace and comments are skipped, and any
 * character that can't start a token is dropped, leaving it to the
 * {@link UseTreeParser} to decide whether what remains makes sense.
 *
 * <p>Token positions are relative to the start of the lexed text: the first
 * line is line 0, and columns on every line start at 0.
 */
final class Lexer extends SimpleParser {
    private final String text;
    private final List<Token> tokens = new ArrayList<>();

    private Lexer(String text) {
        super(text);
        this.text = text;
    }

    /**
     * @param text The text to lex
     * @return The tokens of {@code text}, in order
     */
    static List<Token> tokenize(String text) {
        Lexer lexer = new Lexer(text);
        lexer.lex();
        return lexer.tokens;
    }

    private void lex() {
        while (!eof()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                skip();
            } else if (c == '/' && peek(1) == '/') {
                lineComment();
            } else if (c == '/' && peek(1) == '*') {
                blockComment();
            } else if (c == ':' && peek(1) == ':') {
                punctuation(TokenType.PATH_SEPARATOR, 2);
            } else if (TokenType.forPunctuation(c) != null) {
                punctuation(TokenType.forPunctuation(c), 1);
            } else if (c == 'r' && peek(1) == '#' && isIdentStart(peek(2))) {
                word(true);
            } else if (isIdentStart(c)) {
                word(false);
            } else {
                skip();
            }
        }
    }

    private void punctuation(TokenType type, int length) {
        int line = currentLine();
        int start = currentColumn();
        for (int i = 0; i < length; i++) {
            skip();
        }
        tokens.add(new Token(type, type.text(), line, start, start + length));
    }

    private void word(boolean raw) {
        int line = currentLine();
        int startColumn = currentColumn();
        int start = position();
        if (raw) {
            skip(); // 'r'
            skip(); // '#'
        }
        while (!eof() && isIdentPart(peek())) {
            skip();
        }
        String value = text.substring(start, position());
        TokenType type = raw ? TokenType.IDENTIFIER : TokenType.forWord(value);
        tokens.add(new Token(type, value, line, startColumn, startColumn + value.length()));
    }

    private void lineComment() {
        while (!eof() && peek() != '\n') {
            skip();
        }
    }

    private void blockComment() {
        skip(); // '/'
        skip(); // '*'
        while (!eof() && !(peek() == '*' && peek(1) == '/')) {
            skip();
        }
        if (!eof()) {
            skip();
            skip();
        }
    }

    private int currentLine() {
        return line() - 1;
    }

    private int currentColumn() {
        return column() - 1;
    }

    private static boolean isIdentStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
