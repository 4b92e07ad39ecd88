/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.document;

import java.util.Arrays;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * The current text of an open Rust source file, with a table of where each
 * line starts so LSP positions can be turned into offsets and back.
 *
 * <p>Lookups answer {@code -1} or {@code null} when given something outside
 * the document instead of throwing. A line's text never includes its
 * {@code \n}, but does keep a preceding {@code \r}.
 */
public final class Document {
    private String text;
    private int[] lineStarts;

    private Document(String text, int[] lineStarts) {
        this.text = text;
        this.lineStarts = lineStarts;
    }

    /**
     * @param text Initial text of the document
     * @return The created document
     */
    public static Document of(String text) {
        return new Document(text, lineStarts(text));
    }

    /**
     * @return A document with the same text, unaffected by later edits to this one
     */
    public Document copy() {
        return new Document(text, lineStarts);
    }

    /**
     * Replaces the text in {@code range} with {@code replacement}. A range
     * starting past the last line appends, and one ending past the last line
     * replaces everything from its start on.
     *
     * @param range The range to replace, or {@code null} for the whole document
     * @param replacement The new text
     */
    public void applyEdit(Range range, String replacement) {
        int from = 0;
        int to = text.length();
        if (range != null) {
            from = editOffset(range.getStart());
            to = Math.max(from, editOffset(range.getEnd()));
        }
        text = text.substring(0, from) + replacement + text.substring(to);
        lineStarts = lineStarts(text);
    }

    /**
     * @return The range from (0, 0) to {@link #end()}
     */
    public Range fullRange() {
        return new Range(new Position(0, 0), end());
    }

    /**
     * @param line Zero-based line number
     * @return The offset the line starts at, or {@code -1} if there is no such line
     */
    public int indexOfLine(int line) {
        return line < 0 || line >= lineStarts.length ? -1 : lineStarts[line];
    }

    /**
     * @param index Offset into the text
     * @return The line containing {@code index}, or {@code -1} if it isn't
     *  before the end of the text
     */
    public int lineOfIndex(int index) {
        if (index < 0 || index >= text.length()) {
            return -1;
        }
        int found = Arrays.binarySearch(lineStarts, index);
        return found >= 0 ? found : -found - 2;
    }

    /**
     * @param position A position in the document
     * @return Its offset, or {@code -1} if the character is past the end of its
     *  line. The end of the document is a valid position
     */
    public int indexOfPosition(Position position) {
        int start = indexOfLine(position.getLine());
        if (start < 0 || position.getCharacter() < 0) {
            return -1;
        }
        int offset = start + position.getCharacter();
        return offset > lineLimit(position.getLine()) ? -1 : offset;
    }

    /**
     * @param index Offset into the text, up to and including its length
     * @return The position of {@code index}, or {@code null} if out of bounds
     */
    public Position positionAtIndex(int index) {
        if (index == text.length()) {
            return end();
        }
        int line = lineOfIndex(index);
        return line < 0 ? null : new Position(line, index - lineStarts[line]);
    }

    /**
     * @return Zero-based number of the last line, which is empty if the text
     *  ends with a line break
     */
    public int lastLine() {
        return lineStarts.length - 1;
    }

    /**
     * @return The position just past the last character
     */
    public Position end() {
        return new Position(lastLine(), text.length() - lineStarts[lastLine()]);
    }

    /**
     * @return The whole text
     */
    public String copyText() {
        return text;
    }

    /**
     * @param range Range to copy
     * @return The text in {@code range}, or {@code null} if either end is out
     *  of bounds or the range is reversed
     */
    public String copyRange(Range range) {
        int from = indexOfPosition(range.getStart());
        int to = indexOfPosition(range.getEnd());
        if (from < 0 || to < from) {
            return null;
        }
        return text.substring(from, to);
    }

    /**
     * @param line Zero-based line number
     * @return The line's text without its line break, or {@code null} if there
     *  is no such line
     */
    public String copyLine(int line) {
        int start = indexOfLine(line);
        return start < 0 ? null : text.substring(start, lineLimit(line));
    }

    /**
     * @param position A position in the document
     * @return The text on the same line before {@code position}, or
     *  {@code null} if the position is out of bounds
     */
    public String copyLineBefore(Position position) {
        int offset = indexOfPosition(position);
        return offset < 0 ? null : text.substring(lineStarts[position.getLine()], offset);
    }

    /**
     * @param position A position in the document
     * @return The text on the same line from {@code position} to the line
     *  break, or {@code null} if the position is out of bounds
     */
    public String copyLineAfter(Position position) {
        int offset = indexOfPosition(position);
        return offset < 0 ? null : text.substring(offset, lineLimit(position.getLine()));
    }

    /**
     * @return Number of characters in the text
     */
    public int length() {
        return text.length();
    }

    // Offset of the line break ending the line, or the text length for the last line.
    private int lineLimit(int line) {
        return line == lastLine() ? text.length() : lineStarts[line + 1] - 1;
    }

    private int editOffset(Position position) {
        if (position.getLine() >= lineStarts.length) {
            return text.length();
        }
        return Math.min(lineStarts[position.getLine()] + position.getCharacter(), text.length());
    }

    private static int[] lineStarts(String text) {
        int breaks = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                breaks++;
            }
        }
        int[] starts = new int[breaks + 1];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }
}
