/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.List;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Provides the entry points for parsing use declarations, either one at a
 * time with {@link #parseStatement(String)}, or all the declarations at the
 * top of a file with {@link #scanFile(String)}.
 *
 * <p>The lexer is lenient, dropping any characters it doesn't recognize,
 * but the parser isn't: any declaration that doesn't follow the grammar
 * fails with a {@link UseParseException}. When scanning a file, such
 * declarations are skipped and reported in {@link ScanResult#skipped()}.
 */
public final class Syntax {
    private Syntax() {
    }

    /**
     * @param text The text of the declaration, like {@code use std::io;}
     * @return The parsed declaration, with ranges relative to the start of {@code text}
     * @throws UseParseException If the text isn't a valid use declaration
     */
    public static UseStatement parseStatement(String text) {
        return parseStatement(text, List.of(), null);
    }

    /**
     * @param text The text of the declaration
     * @param attributes The attribute lines of the declaration
     * @param range The nullable range of {@code text} in its document. When
     *              present, segment ranges are positions in the document
     * @return The parsed declaration
     * @throws UseParseException If the text isn't a valid use declaration
     */
    public static UseStatement parseStatement(String text, List<String> attributes, Range range) {
        Position base = range == null ? new Position(0, 0) : range.getStart();
        UseTreeParser.Parsed parsed = new UseTreeParser(Lexer.tokenize(text), base).parseStatement();
        Range statementRange = range == null ? new Range(new Position(0, 0), endOf(text)) : range;
        return new UseStatement(parsed.visibility(), parsed.tree(), attributes, statementRange, null);
    }

    /**
     * @param text The text of a file
     * @return The use declarations at the top of the file
     */
    public static ScanResult scanFile(String text) {
        if (text.isEmpty()) {
            return ScanResult.EMPTY;
        }
        return UseScanner.scan(text);
    }

    private static Position endOf(String text) {
        int lastNewline = text.lastIndexOf('\n');
        int line = (int) text.chars().filter(c -> c == '\n').count();
        return new Position(line, text.length() - lastNewline - 1);
    }
}
