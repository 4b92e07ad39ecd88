/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.List;
import java.util.Objects;
import org.eclipse.lsp4j.Range;

/**
 * A node of a use tree. Given {@code use std::{io::{self, Read}, fs::*};},
 * the tree is:
 * <pre>
 *     std
 *     ├── io
 *     │   ├── self
 *     │   └── Read
 *     └── fs
 *         └── *
 * </pre>
 *
 * <p>A node with children imports everything listed under it. A glob node is
 * a wildcard leaf, and a {@code self} leaf refers to the path of its parent.
 * Glob and {@code self} nodes never have children.
 *
 * @param segment The segment at this node
 * @param children The children of this node, empty for a leaf
 * @param glob Whether this node is a wildcard leaf
 */
public record UseTree(Segment segment, List<UseTree> children, boolean glob) {
    public UseTree {
        Objects.requireNonNull(segment, "segment");
        children = children == null ? List.of() : List.copyOf(children);
        if (glob && !children.isEmpty()) {
            throw new IllegalArgumentException("glob node can't have children");
        }
    }

    /**
     * @param segment The segment of the leaf
     * @return A leaf node importing {@code segment}
     */
    public static UseTree leaf(Segment segment) {
        return new UseTree(segment, List.of(), false);
    }

    /**
     * @param range The nullable range of the {@code *}
     * @return A wildcard leaf
     */
    public static UseTree glob(Range range) {
        return new UseTree(new Segment(Segment.GLOB, null, range), List.of(), true);
    }

    /**
     * @param alias The nullable alias of the {@code self} import
     * @param range The nullable range of the {@code self} keyword
     * @return A {@code self} leaf
     */
    public static UseTree self(String alias, Range range) {
        return new UseTree(new Segment(Segment.SELF, alias, range), List.of(), false);
    }

    /**
     * @param segment The segment of the node
     * @param children The non-empty children of the node
     * @return A node with the given children
     */
    public static UseTree branch(Segment segment, List<UseTree> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("branch needs at least one child");
        }
        return new UseTree(segment, children, false);
    }

    /**
     * @return The name of this node's segment
     */
    public String name() {
        return segment.name();
    }

    /**
     * @return Whether this node has children
     */
    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * @return Whether this node is a {@code self} leaf
     */
    public boolean isSelf() {
        return !glob && children.isEmpty() && Segment.SELF.equals(segment.name());
    }

    /**
     * @param newChildren The children to use
     * @return A copy of this node with the given children
     */
    public UseTree withChildren(List<UseTree> newChildren) {
        return new UseTree(segment, newChildren, glob);
    }
}
