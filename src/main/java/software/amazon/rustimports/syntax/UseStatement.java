/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.List;
import java.util.Objects;
import org.eclipse.lsp4j.Range;

/**
 * A complete use declaration, like {@code pub(crate) use std::io;}.
 *
 * @param visibility The nullable visibility qualifier, like {@code pub} or
 *                   {@code pub(in crate::a)}. Treated as an opaque key.
 * @param tree The use tree
 * @param attributes Attribute lines, like {@code #[cfg(test)]}, in source order
 * @param range The range of the declaration text, from the visibility (or
 *              {@code use}) up to and including the terminating {@code ;}.
 *              Doesn't include the attributes.
 * @param blockId The nullable id of the block of consecutive declarations
 *                this declaration belongs to
 */
public record UseStatement(
        String visibility,
        UseTree tree,
        List<String> attributes,
        Range range,
        Integer blockId
) {
    public UseStatement {
        Objects.requireNonNull(tree, "tree");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    /**
     * @param visibility The nullable visibility
     * @param tree The use tree
     * @param range The nullable source range
     * @return A statement with no attributes and no block
     */
    public static UseStatement of(String visibility, UseTree tree, Range range) {
        return new UseStatement(visibility, tree, List.of(), range, null);
    }

    /**
     * @return The name of the first segment of the tree, like {@code std} for
     *  {@code use std::io;}
     */
    public String root() {
        return tree.name();
    }

    /**
     * @return Whether this statement has any attribute lines
     */
    public boolean hasAttributes() {
        return !attributes.isEmpty();
    }

    /**
     * @param newTree The tree to use
     * @return A copy of this statement with the given tree
     */
    public UseStatement withTree(UseTree newTree) {
        return new UseStatement(visibility, newTree, attributes, range, blockId);
    }
}
