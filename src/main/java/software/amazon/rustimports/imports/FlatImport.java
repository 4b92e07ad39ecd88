/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.eclipse.lsp4j.Range;

/**
 * A single imported path, independent of how it was nested in its use tree.
 * {@code use std::{io::{self, Read}, fs::*};} has the flat imports
 * {@code std::io}, {@code std::io::Read} and {@code std::fs::*}.
 *
 * <p>{@code A} and {@code A::{self}} have the same flat import.
 *
 * @param path The segment names of the path, never empty. For a glob, this
 *             is the path the glob is under, without the {@code *}
 * @param alias The nullable alias of the import
 * @param glob Whether this is a wildcard import of everything under {@link #path}
 * @param spans The nullable source ranges of each element of {@link #path}
 * @param markerSpan The nullable source range of the {@code self} or
 *                   {@code *} that made this an import, if there was one
 */
public record FlatImport(List<String> path, String alias, boolean glob, List<Range> spans, Range markerSpan) {
    public FlatImport {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("flat import path can't be empty");
        }
        path = List.copyOf(path);
        // Spans are allowed to hold nulls, for trees that weren't parsed from a document.
        spans = spans == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(spans));
    }

    /**
     * @param path The segment names of the path
     * @param alias The nullable alias
     * @return A non-glob import with no source ranges
     */
    public static FlatImport of(List<String> path, String alias) {
        return new FlatImport(path, alias, false, null, null);
    }

    /**
     * @param path The path the glob is under
     * @return A glob import with no source ranges
     */
    public static FlatImport globOf(List<String> path) {
        return new FlatImport(path, null, true, null, null);
    }

    /**
     * @return The first segment of the path
     */
    public String root() {
        return path.get(0);
    }

    /**
     * Two imports with the same key import the same thing, differing at most
     * in their alias.
     *
     * @return The path joined with {@code ::}, with {@code ::*} appended for a glob
     */
    public String key() {
        String joined = String.join("::", path);
        return glob ? joined + "::*" : joined;
    }

    /**
     * @return The nullable range of the token that names this import: the
     *  {@code self} or {@code *} if there was one, otherwise the last path segment
     */
    public Range targetSpan() {
        if (markerSpan != null) {
            return markerSpan;
        }
        return spans.isEmpty() ? null : spans.get(spans.size() - 1);
    }

    /**
     * @param newAlias The nullable alias to use
     * @return A copy of this import with the given alias
     */
    public FlatImport withAlias(String newAlias) {
        return new FlatImport(path, newAlias, glob, spans, markerSpan);
    }

    @Override
    public String toString() {
        return alias == null ? key() : key() + " as " + alias;
    }
}
