/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.protocol;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Utility methods for creating and comparing LSP types {@link Range} and
 * {@link Position}, and converting LSP URIs (which are just strings) to paths.
 *
 * <p>Ranges and positions handed out by these methods are fresh instances,
 * so callers can treat them as values.
 */
public final class LspAdapter {
    /**
     * Orders positions by line, then by character.
     */
    public static final Comparator<Position> POSITION_ORDER = Comparator
            .comparingInt(Position::getLine)
            .thenComparingInt(Position::getCharacter);

    private LspAdapter() {
    }

    /**
     * @param point Position to create a point range of
     * @return Range of (point) - (point)
     */
    public static Range point(Position point) {
        return new Range(copy(point), copy(point));
    }

    /**
     * @param line Line of the point
     * @param character Character offset on the line
     * @return Range of (line, character) - (line, character)
     */
    public static Range point(int line, int character) {
        return point(new Position(line, character));
    }

    /**
     * @param startLine Range start line
     * @param startCharacter Range start character
     * @param endLine Range end line
     * @param endCharacter Range end character
     * @return Range of (startLine, startCharacter) - (endLine, endCharacter)
     */
    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * @param a First position
     * @param b Second position
     * @return Negative if {@code a} is before {@code b}, positive if after,
     *  zero if equal
     */
    public static int compare(Position a, Position b) {
        return POSITION_ORDER.compare(a, b);
    }

    /**
     * @param outer The containing range
     * @param inner The range to check
     * @return Whether {@code inner} lies entirely within {@code outer}
     */
    public static boolean contains(Range outer, Range inner) {
        return compare(outer.getStart(), inner.getStart()) <= 0
               && compare(inner.getEnd(), outer.getEnd()) <= 0;
    }

    /**
     * @param a First range
     * @param b Second range
     * @return The smallest range covering both {@code a} and {@code b}
     */
    public static Range union(Range a, Range b) {
        Position start = compare(a.getStart(), b.getStart()) <= 0 ? a.getStart() : b.getStart();
        Position end = compare(a.getEnd(), b.getEnd()) >= 0 ? a.getEnd() : b.getEnd();
        return new Range(copy(start), copy(end));
    }

    /**
     * @param position The position to copy
     * @return A new position equal to {@code position}
     */
    public static Position copy(Position position) {
        return new Position(position.getLine(), position.getCharacter());
    }

    /**
     * @param uri LSP URI to convert to a path
     * @return A path representation of the {@code uri}, or {@code null} if the
     *  uri doesn't use the file scheme
     */
    public static Path toPath(String uri) {
        if (uri.startsWith("file:")) {
            return Paths.get(URI.create(uri));
        }
        return null;
    }

    /**
     * @param path Path to convert to LSP URI
     * @return A URI representation of the given {@code path}
     */
    public static String toUri(Path path) {
        return path.toUri().toString();
    }
}
