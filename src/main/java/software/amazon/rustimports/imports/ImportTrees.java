/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.eclipse.lsp4j.Range;
import software.amazon.rustimports.syntax.Segment;
import software.amazon.rustimports.syntax.UseTree;

/**
 * Converts between {@link UseTree} and lists of {@link FlatImport}.
 *
 * <p>{@link #buildTree(List)} is the inverse of {@link #flatten(UseTree)} for
 * a list without duplicates: flattening the built tree gives back the same
 * set of imports.
 */
public final class ImportTrees {
    private ImportTrees() {
    }

    /**
     * @param tree The tree to flatten
     * @return The imports of {@code tree}, in depth-first order
     */
    public static List<FlatImport> flatten(UseTree tree) {
        List<FlatImport> imports = new ArrayList<>();
        flatten(tree, new ArrayList<>(), new ArrayList<>(), imports);
        return imports;
    }

    private static void flatten(UseTree node, List<String> path, List<Range> spans, List<FlatImport> imports) {
        Segment segment = node.segment();
        if (node.glob()) {
            if (!path.isEmpty()) {
                imports.add(new FlatImport(path, null, true, spans, segment.range()));
            }
            return;
        }

        // `self` refers to the path it's under, unless it starts the path
        if (node.isSelf() && !path.isEmpty()) {
            imports.add(new FlatImport(path, segment.alias(), false, spans, segment.range()));
            return;
        }

        path.add(segment.name());
        spans.add(segment.range());
        if (node.hasChildren()) {
            for (UseTree child : node.children()) {
                flatten(child, path, spans, imports);
            }
        } else {
            imports.add(new FlatImport(path, segment.alias(), false, spans, null));
        }
        path.remove(path.size() - 1);
        spans.remove(spans.size() - 1);
    }

    /**
     * Builds a single tree out of imports that all share the same root. A
     * path that is imported itself and is also the prefix of other imports
     * gets a {@code self} child. Children are ordered by name, with the
     * {@code self} child first and the glob child last.
     *
     * <p>If the same path is imported more than once, its alias is picked
     * using {@link AliasPriority}.
     *
     * @param imports The non-empty imports to build a tree of
     * @return The built tree
     * @throws IllegalArgumentException If {@code imports} is empty or the
     *  imports don't share a root
     */
    public static UseTree buildTree(List<FlatImport> imports) {
        if (imports.isEmpty()) {
            throw new IllegalArgumentException("can't build a use tree without imports");
        }

        FlatImport first = imports.get(0);
        TrieNode root = new TrieNode(first.root(), spanAt(first, 0));
        for (FlatImport flat : imports) {
            if (!root.name.equals(flat.root())) {
                throw new IllegalArgumentException(
                        "expected imports rooted at " + root.name + " but got " + flat.key());
            }
            insert(root, flat);
        }
        return toTree(root);
    }

    private static void insert(TrieNode root, FlatImport flat) {
        TrieNode node = root;
        List<String> path = flat.path();
        for (int i = 1; i < path.size(); i++) {
            node = node.child(path.get(i), spanAt(flat, i));
        }

        if (flat.glob()) {
            node.glob = true;
            if (node.globSpan == null) {
                node.globSpan = flat.markerSpan();
            }
        } else if (node.terminal) {
            node.alias = AliasPriority.preferred(node.alias, flat.alias());
        } else {
            node.terminal = true;
            node.alias = flat.alias();
            node.selfSpan = flat.markerSpan();
        }
    }

    private static UseTree toTree(TrieNode node) {
        Segment segment = new Segment(node.name, null, node.span);
        List<UseTree> children = new ArrayList<>();
        if (node.terminal) {
            if (node.children.isEmpty() && !node.glob) {
                segment = segment.withAlias(node.alias);
            } else {
                children.add(UseTree.self(node.alias, node.selfSpan));
            }
        }

        for (TrieNode child : node.children.values()) {
            children.add(toTree(child));
        }

        if (node.glob) {
            children.add(UseTree.glob(node.globSpan));
        }

        if (children.isEmpty()) {
            return UseTree.leaf(segment);
        }
        return UseTree.branch(segment, children);
    }

    private static Range spanAt(FlatImport flat, int index) {
        return index < flat.spans().size() ? flat.spans().get(index) : null;
    }

    // Children are owned by their parent, keyed by segment name. The TreeMap
    // keeps them in case-sensitive lexicographic order.
    private static final class TrieNode {
        private final String name;
        private final Range span;
        private final Map<String, TrieNode> children = new TreeMap<>();
        private boolean terminal;
        private String alias;
        private Range selfSpan;
        private boolean glob;
        private Range globSpan;

        TrieNode(String name, Range span) {
            this.name = name;
            this.span = span;
        }

        TrieNode child(String childName, Range childSpan) {
            return children.computeIfAbsent(childName, n -> new TrieNode(n, childSpan));
        }
    }
}
