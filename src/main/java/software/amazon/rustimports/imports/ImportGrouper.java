/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import software.amazon.rustimports.syntax.UseStatement;

/**
 * Sorts use declarations into {@link ImportCategory categories}, and builds
 * the merged, sorted groups that make up an organized import section.
 */
public final class ImportGrouper {
    static final Set<String> STANDARD_LIBRARY_ROOTS = Set.of("std", "core", "alloc");
    static final Set<String> INTERNAL_ROOTS = Set.of("crate", "super", "self");

    private static final Logger LOGGER = Logger.getLogger(ImportGrouper.class.getName());
    private static final Comparator<List<String>> ATTRIBUTE_ORDER =
            Comparator.comparing(attributes -> String.join("\n", attributes));

    private ImportGrouper() {
    }

    /**
     * @param statement The declaration to categorize
     * @param dependencies The dependencies of the package the declaration is in
     * @return The category of the declaration
     */
    public static ImportCategory categorize(UseStatement statement, DependencySet dependencies) {
        if (statement.hasAttributes()) {
            return ImportCategory.ATTRIBUTED;
        }
        String root = statement.root();
        if (STANDARD_LIBRARY_ROOTS.contains(root)) {
            return ImportCategory.STANDARD_LIBRARY;
        }
        if (INTERNAL_ROOTS.contains(root)) {
            return ImportCategory.INTERNAL;
        }
        if (!dependencies.contains(root)) {
            // Most likely a crate the manifest didn't tell us about.
            LOGGER.finest(() -> "Treating unknown root " + root + " as an external crate");
        }
        return ImportCategory.EXTERNAL;
    }

    /**
     * Partitions {@code statements} by category, and attributed declarations
     * further by their exact set of attributes, then merges and sorts each
     * partition. Unattributed groups come first, in category order, followed
     * by one group per attribute set. Empty groups are left out.
     *
     * @param statements The declarations to group
     * @param dependencies The dependencies of the package
     * @param merger The merger to merge each group with
     * @return The non-empty groups, in output order
     */
    public static List<ImportGroup> group(
            List<UseStatement> statements,
            DependencySet dependencies,
            ImportMerger merger
    ) {
        Map<ImportCategory, List<UseStatement>> byCategory = new EnumMap<>(ImportCategory.class);
        Map<List<String>, List<UseStatement>> byAttributes = new TreeMap<>(ATTRIBUTE_ORDER);
        for (UseStatement statement : statements) {
            ImportCategory category = categorize(statement, dependencies);
            if (category == ImportCategory.ATTRIBUTED) {
                byAttributes.computeIfAbsent(attributeKey(statement), k -> new ArrayList<>()).add(statement);
            } else {
                byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(statement);
            }
        }

        List<ImportGroup> groups = new ArrayList<>();
        for (Map.Entry<ImportCategory, List<UseStatement>> entry : byCategory.entrySet()) {
            groups.add(new ImportGroup(entry.getKey(), List.of(), organize(entry.getValue(), merger)));
        }
        for (Map.Entry<List<String>, List<UseStatement>> entry : byAttributes.entrySet()) {
            groups.add(new ImportGroup(ImportCategory.ATTRIBUTED, entry.getKey(),
                    organize(entry.getValue(), merger)));
        }
        return groups;
    }

    /**
     * @param statement A declaration
     * @return The attribute lines of the declaration, sorted, so the order
     *  they were written in doesn't matter
     */
    public static List<String> attributeKey(UseStatement statement) {
        List<String> key = new ArrayList<>(statement.attributes());
        key.sort(Comparator.naturalOrder());
        return List.copyOf(key);
    }

    private static List<UseStatement> organize(List<UseStatement> statements, ImportMerger merger) {
        // Every declaration here has the same attributes, maybe in a different
        // order. The first declaration's order is the one that gets written.
        List<String> attributes = statements.get(0).attributes();
        List<UseStatement> normalized = new ArrayList<>(statements.size());
        for (UseStatement statement : statements) {
            normalized.add(new UseStatement(statement.visibility(), statement.tree(), attributes,
                    statement.range(), statement.blockId()));
        }
        return ImportSorter.sort(merger.merge(normalized));
    }
}
