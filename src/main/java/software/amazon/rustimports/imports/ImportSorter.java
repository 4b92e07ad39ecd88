/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import software.amazon.rustimports.syntax.UseStatement;
import software.amazon.rustimports.syntax.UseTree;

/**
 * Canonical ordering of use declarations and of the children in their trees.
 *
 * <p>Within a tree, a {@code self} child comes first, a glob child comes
 * last, and everything else is ordered by case-sensitive comparison of the
 * segment name. Declarations are ordered by the path read off their sorted
 * tree, following the first child at each level.
 */
public final class ImportSorter {
    private static final Comparator<UseTree> CHILD_ORDER = Comparator
            .comparingInt(ImportSorter::childRank)
            .thenComparing(UseTree::name)
            .thenComparing(tree -> tree.segment().alias(), Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Comparator<UseStatement> STATEMENT_ORDER = Comparator
            .comparing((UseStatement statement) -> canonicalPath(statement.tree()))
            .thenComparing(statement -> statement.visibility() == null ? "" : statement.visibility())
            .thenComparing(statement -> String.join("\n", statement.attributes()));

    private ImportSorter() {
    }

    /**
     * @param tree The tree to sort
     * @return A copy of {@code tree} with the children of every node sorted
     */
    public static UseTree sortTree(UseTree tree) {
        if (!tree.hasChildren()) {
            return tree;
        }
        List<UseTree> children = new ArrayList<>(tree.children().size());
        for (UseTree child : tree.children()) {
            children.add(sortTree(child));
        }
        children.sort(CHILD_ORDER);
        return tree.withChildren(children);
    }

    /**
     * @param statements The declarations to sort
     * @return New declarations with sorted trees, in canonical order
     */
    public static List<UseStatement> sort(List<UseStatement> statements) {
        List<UseStatement> sorted = new ArrayList<>(statements.size());
        for (UseStatement statement : statements) {
            sorted.add(statement.withTree(sortTree(statement.tree())));
        }
        sorted.sort(STATEMENT_ORDER);
        return sorted;
    }

    /**
     * @param a First declaration
     * @param b Second declaration
     * @return The canonical order of {@code a} relative to {@code b}
     */
    public static int compare(UseStatement a, UseStatement b) {
        return STATEMENT_ORDER.compare(a, b);
    }

    /**
     * @param tree The tree to get the path of
     * @return The path through the first child at every level of the sorted
     *  tree, joined with {@code ::}
     */
    public static String canonicalPath(UseTree tree) {
        StringBuilder builder = new StringBuilder(tree.name());
        UseTree node = sortTree(tree);
        while (node.hasChildren()) {
            node = node.children().get(0);
            builder.append("::").append(node.name());
        }
        return builder.toString();
    }

    private static int childRank(UseTree tree) {
        if (tree.isSelf()) {
            return 0;
        }
        return tree.glob() ? 2 : 1;
    }
}
