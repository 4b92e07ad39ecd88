/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.logging.Logger;

/**
 * {@link MergeListener} that writes merge events to the log. Alias conflicts
 * are logged as warnings, since one of the aliases is lost.
 */
public final class LoggingMergeListener implements MergeListener {
    private static final Logger LOGGER = Logger.getLogger(LoggingMergeListener.class.getName());

    @Override
    public void onGroupMerged(String root, String visibility, int statementCount, int importCount) {
        LOGGER.finest(() -> String.format("Merged %d declarations of %s%s into %d imports",
                statementCount, visibility == null ? "" : visibility + " ", root, importCount));
    }

    @Override
    public void onDuplicate(FlatImport kept, FlatImport dropped) {
        LOGGER.finest(() -> "Dropped duplicate import " + dropped + ", keeping " + kept);
    }

    @Override
    public void onAliasConflict(String key, String keptAlias, String rejectedAlias) {
        LOGGER.warning(() -> String.format(
                "%s is imported as both %s and %s, keeping %s", key, keptAlias, rejectedAlias, keptAlias));
    }
}
