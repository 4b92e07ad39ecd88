/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.eclipse.lsp4j.Range;
import software.amazon.rustimports.protocol.LspAdapter;
import software.amazon.rustimports.syntax.UseStatement;
import software.amazon.rustimports.syntax.UseTree;

/**
 * Merges use declarations that share a root segment and a visibility into a
 * single declaration, removing duplicate imports along the way.
 *
 * <p>Declarations that differ in either their root or their visibility are
 * never merged. Groups keep the order in which their first declaration
 * appeared in the input.
 */
public final class ImportMerger {
    private final MergeListener listener;

    /**
     * Creates a merger that doesn't report any events.
     */
    public ImportMerger() {
        this(MergeListener.NOOP);
    }

    /**
     * @param listener The listener to notify of merge events
     */
    public ImportMerger(MergeListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * @param statements The declarations to merge
     * @return One sorted declaration per distinct root and visibility
     */
    public List<UseStatement> merge(List<UseStatement> statements) {
        Map<GroupKey, List<UseStatement>> groups = new LinkedHashMap<>();
        for (UseStatement statement : statements) {
            GroupKey key = new GroupKey(statement.root(), statement.visibility());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(statement);
        }

        List<UseStatement> merged = new ArrayList<>(groups.size());
        for (Map.Entry<GroupKey, List<UseStatement>> entry : groups.entrySet()) {
            merged.add(mergeGroup(entry.getKey(), entry.getValue()));
        }
        return merged;
    }

    private UseStatement mergeGroup(GroupKey key, List<UseStatement> group) {
        Map<String, FlatImport> unique = new LinkedHashMap<>();
        for (UseStatement statement : group) {
            for (FlatImport flat : ImportTrees.flatten(statement.tree())) {
                FlatImport existing = unique.get(flat.key());
                if (existing == null) {
                    unique.put(flat.key(), flat);
                } else {
                    unique.put(flat.key(), resolve(existing, flat));
                }
            }
        }

        List<FlatImport> imports = new ArrayList<>(unique.values());
        listener.onGroupMerged(key.root(), key.visibility(), group.size(), imports.size());

        UseStatement first = group.get(0);
        UseTree tree = ImportSorter.sortTree(ImportTrees.buildTree(imports));
        return new UseStatement(key.visibility(), tree, mergedAttributes(group), mergedRange(group), first.blockId());
    }

    private FlatImport resolve(FlatImport existing, FlatImport incoming) {
        if (AliasPriority.conflicts(existing.alias(), incoming.alias())) {
            listener.onAliasConflict(existing.key(), existing.alias(), incoming.alias());
            return existing;
        }
        String alias = AliasPriority.preferred(existing.alias(), incoming.alias());
        if (Objects.equals(alias, existing.alias())) {
            listener.onDuplicate(existing, incoming);
            return existing;
        }
        listener.onDuplicate(incoming, existing);
        return incoming;
    }

    // Attributes survive only when every declaration in the group carries the
    // same ones.
    private static List<String> mergedAttributes(List<UseStatement> group) {
        List<String> attributes = group.get(0).attributes();
        for (UseStatement statement : group) {
            if (!statement.attributes().equals(attributes)) {
                return List.of();
            }
        }
        return attributes;
    }

    private static Range mergedRange(List<UseStatement> group) {
        Range range = null;
        for (UseStatement statement : group) {
            if (statement.range() == null) {
                continue;
            }
            range = range == null ? statement.range() : LspAdapter.union(range, statement.range());
        }
        return range;
    }

    private record GroupKey(String root, String visibility) {
    }
}
