/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Range;
import software.amazon.rustimports.protocol.LspAdapter;
import software.amazon.rustimports.syntax.UseStatement;

/**
 * Removes imports reported as unused, given the ranges of the unused parts of
 * the declarations.
 *
 * <p>An import is unused if the token that names it, like the last segment of
 * its path or its {@code self} or {@code *}, is within one of the ranges. When
 * a path is imported both with and without the {@code _} alias and either one
 * is unused, only the {@code _} import is removed: the other import already
 * brings the trait into scope.
 */
public final class UnusedImportFilter {
    private static final Logger LOGGER = Logger.getLogger(UnusedImportFilter.class.getName());

    private UnusedImportFilter() {
    }

    /**
     * @param statements The declarations to filter
     * @param unusedSpans Ranges in the document of unused imports
     * @return The declarations with unused imports removed. Declarations with
     *  nothing removed are returned as-is, and declarations with everything
     *  removed are left out
     */
    public static List<UseStatement> filter(List<UseStatement> statements, List<Range> unusedSpans) {
        if (unusedSpans.isEmpty()) {
            return statements;
        }

        List<List<Candidate>> perStatement = new ArrayList<>(statements.size());
        Map<String, List<Candidate>> byKey = new LinkedHashMap<>();
        for (UseStatement statement : statements) {
            List<Candidate> candidates = new ArrayList<>();
            for (FlatImport flat : ImportTrees.flatten(statement.tree())) {
                Candidate candidate = new Candidate(flat, isUnused(flat, unusedSpans));
                candidates.add(candidate);
                byKey.computeIfAbsent(flat.key(), k -> new ArrayList<>()).add(candidate);
            }
            perStatement.add(candidates);
        }

        for (List<Candidate> sameKey : byKey.values()) {
            preferRemovingDiscarded(sameKey);
        }

        List<UseStatement> result = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            UseStatement statement = statements.get(i);
            List<FlatImport> kept = new ArrayList<>();
            for (Candidate candidate : perStatement.get(i)) {
                if (candidate.unused) {
                    LOGGER.finest(() -> "Removing unused import " + candidate.flat);
                } else {
                    kept.add(candidate.flat);
                }
            }

            if (kept.size() == perStatement.get(i).size()) {
                result.add(statement);
            } else if (!kept.isEmpty()) {
                result.add(statement.withTree(ImportTrees.buildTree(kept)));
            }
        }
        return result;
    }

    private static boolean isUnused(FlatImport flat, List<Range> unusedSpans) {
        Range target = flat.targetSpan();
        if (target == null) {
            return false;
        }
        for (Range span : unusedSpans) {
            if (LspAdapter.contains(span, target)) {
                return true;
            }
        }
        return false;
    }

    private static void preferRemovingDiscarded(List<Candidate> sameKey) {
        boolean anyUnused = false;
        boolean anyDiscarded = false;
        boolean anyUsable = false;
        for (Candidate candidate : sameKey) {
            anyUnused |= candidate.unused;
            if (AliasPriority.DISCARD.equals(candidate.flat.alias())) {
                anyDiscarded = true;
            } else {
                anyUsable = true;
            }
        }

        if (anyUnused && anyDiscarded && anyUsable) {
            for (Candidate candidate : sameKey) {
                candidate.unused = AliasPriority.DISCARD.equals(candidate.flat.alias());
            }
        }
    }

    private static final class Candidate {
        private final FlatImport flat;
        private boolean unused;

        Candidate(FlatImport flat, boolean unused) {
            this.flat = flat;
            this.unused = unused;
        }
    }
}
