/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

/**
 * Receives events from an {@link ImportMerger}, for tracing or for flagging
 * declarations that need a closer look. Every method does nothing by default.
 */
public interface MergeListener {
    /**
     * A listener that ignores every event.
     */
    MergeListener NOOP = new MergeListener() {
    };

    /**
     * Called once per group of declarations merged into one.
     *
     * @param root The root segment shared by the group
     * @param visibility The nullable visibility shared by the group
     * @param statementCount The number of declarations in the group
     * @param importCount The number of distinct imports after merging
     */
    default void onGroupMerged(String root, String visibility, int statementCount, int importCount) {
    }

    /**
     * Called when an import is dropped because the same path was already imported.
     *
     * @param kept The import that was kept
     * @param dropped The import that was dropped
     */
    default void onDuplicate(FlatImport kept, FlatImport dropped) {
    }

    /**
     * Called when the same path is imported with two different explicit
     * aliases. The first alias is kept.
     *
     * @param key The key of the path
     * @param keptAlias The alias that was kept
     * @param rejectedAlias The alias that was dropped
     */
    default void onAliasConflict(String key, String keptAlias, String rejectedAlias) {
    }
}
