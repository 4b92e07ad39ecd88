/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

/**
 * A single lexed token.
 *
 * @param type The kind of token
 * @param value The text of the token
 * @param line The 0-indexed line of the token, relative to the start of the lexed text
 * @param startColumn The 0-indexed column the token starts at
 * @param endColumn The column just past the end of the token
 */
public record Token(TokenType type, String value, int line, int startColumn, int endColumn) {
    /**
     * @param type The type to check
     * @return Whether this token is of the given type
     */
    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + line + ":" + startColumn;
    }
}
