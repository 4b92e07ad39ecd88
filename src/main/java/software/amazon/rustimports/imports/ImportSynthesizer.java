/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import software.amazon.rustimports.syntax.Segment;
import software.amazon.rustimports.syntax.UseStatement;
import software.amazon.rustimports.syntax.UseTree;

/**
 * Creates use declarations for paths that need to be imported, ready to be
 * merged with the declarations already in a file.
 */
public final class ImportSynthesizer {
    private ImportSynthesizer() {
    }

    /**
     * @param suggestions The paths to import
     * @return One declaration per suggestion, with no source range
     * @throws IllegalArgumentException If a path has an empty segment
     */
    public static List<UseStatement> synthesize(List<ImportSuggestion> suggestions) {
        List<UseStatement> statements = new ArrayList<>(suggestions.size());
        for (ImportSuggestion suggestion : suggestions) {
            statements.add(synthesize(suggestion));
        }
        return statements;
    }

    /**
     * @param suggestion The path to import
     * @return A declaration importing the path
     * @throws IllegalArgumentException If the path has an empty segment
     */
    public static UseStatement synthesize(ImportSuggestion suggestion) {
        String[] names = suggestion.path().strip().split("::", -1);
        for (String name : names) {
            if (name.isBlank()) {
                throw new IllegalArgumentException("invalid import path: `" + suggestion.path() + "`");
            }
        }

        String alias = suggestion.traitLike() ? AliasPriority.DISCARD : null;
        UseTree tree = UseTree.leaf(Segment.of(names[names.length - 1].strip(), alias));
        for (int i = names.length - 2; i >= 0; i--) {
            tree = UseTree.branch(Segment.of(names[i].strip()), List.of(tree));
        }
        return UseStatement.of(null, tree, null);
    }

    /**
     * Picks the suggestions that can be applied without asking: symbols with
     * exactly one candidate, where that candidate is a real path and not just
     * a bare name.
     *
     * @param candidates Candidate paths for each unresolved symbol
     * @return The single path of each unambiguous symbol, in order
     */
    public static List<String> unambiguous(Map<String, List<String>> candidates) {
        List<String> picked = new ArrayList<>();
        for (List<String> paths : candidates.values()) {
            if (paths.size() == 1 && paths.get(0).contains("::")) {
                picked.add(paths.get(0));
            }
        }
        return picked;
    }
}
