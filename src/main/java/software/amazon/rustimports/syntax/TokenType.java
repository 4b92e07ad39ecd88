/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

/**
 * The kinds of token that can appear in a use declaration.
 */
public enum TokenType {
    USE("use"),
    PUB("pub"),
    AS("as"),
    SELF("self"),
    CRATE("crate"),
    SUPER("super"),
    IN("in"),
    IDENTIFIER(null),
    PATH_SEPARATOR("::"),
    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    COMMA(","),
    SEMICOLON(";"),
    STAR("*"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")");

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /**
     * @return The fixed text of this token type, or {@code null} for
     *  {@link #IDENTIFIER}
     */
    public String text() {
        return text;
    }

    /**
     * @param word An identifier-like word
     * @return The keyword type for {@code word}, or {@link #IDENTIFIER} if it
     *  isn't a keyword
     */
    static TokenType forWord(String word) {
        return switch (word) {
            case "use" -> USE;
            case "pub" -> PUB;
            case "as" -> AS;
            case "self" -> SELF;
            case "crate" -> CRATE;
            case "super" -> SUPER;
            case "in" -> IN;
            default -> IDENTIFIER;
        };
    }

    /**
     * @param c A single character
     * @return The punctuation type for {@code c}, or {@code null} if {@code c}
     *  isn't single-character punctuation
     */
    static TokenType forPunctuation(char c) {
        return switch (c) {
            case '{' -> OPEN_BRACE;
            case '}' -> CLOSE_BRACE;
            case ',' -> COMMA;
            case ';' -> SEMICOLON;
            case '*' -> STAR;
            case '(' -> OPEN_PAREN;
            case ')' -> CLOSE_PAREN;
            default -> null;
        };
    }
}
