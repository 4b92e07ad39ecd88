/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.Objects;
import org.eclipse.lsp4j.Range;

/**
 * A single path component of a use tree, like {@code io} in {@code std::io},
 * with an optional rename.
 *
 * @param name The segment name: an identifier, {@code self}, {@code *},
 *             {@code crate} or {@code super}
 * @param alias The nullable alias, from {@code name as alias}
 * @param range The nullable range of the name in the source document
 */
public record Segment(String name, String alias, Range range) {
    public static final String SELF = "self";
    public static final String GLOB = "*";

    public Segment {
        Objects.requireNonNull(name, "name");
    }

    /**
     * @param name The segment name
     * @return A segment with no alias and no source range
     */
    public static Segment of(String name) {
        return new Segment(name, null, null);
    }

    /**
     * @param name The segment name
     * @param alias The nullable alias
     * @return A segment with no source range
     */
    public static Segment of(String name, String alias) {
        return new Segment(name, alias, null);
    }

    /**
     * @return Whether this segment has an alias
     */
    public boolean hasAlias() {
        return alias != null;
    }

    /**
     * @param newAlias The nullable alias to use
     * @return A copy of this segment with the given alias
     */
    public Segment withAlias(String newAlias) {
        return new Segment(name, newAlias, range);
    }
}
