/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

/**
 * Thrown when the tokens of a use declaration don't follow the grammar.
 *
 * <p>Parsing doesn't attempt to recover. The {@link UseScanner} drops the
 * declaration that failed to parse and moves on to the next one.
 */
public final class UseParseException extends RuntimeException {
    private final int line;
    private final int column;

    UseParseException(String message, int line, int column) {
        super(line < 0 ? message : message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    /**
     * @return The 0-indexed line the error occurred on, or -1 at end of input
     */
    public int line() {
        return line;
    }

    /**
     * @return The 0-indexed column the error occurred at, or -1 at end of input
     */
    public int column() {
        return column;
    }
}
