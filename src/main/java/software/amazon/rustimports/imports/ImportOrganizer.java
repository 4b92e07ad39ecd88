/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.List;
import org.eclipse.lsp4j.Range;
import software.amazon.rustimports.syntax.ScanResult;
import software.amazon.rustimports.syntax.Syntax;
import software.amazon.rustimports.syntax.UseStatement;

/**
 * Entry point for organizing use declarations: parse them, drop the unused
 * ones, add missing ones, then merge, sort and group them and write them back
 * out.
 *
 * <p>Every method is a pure function of its arguments. The only state is the
 * {@link MergeListener} notified while merging.
 */
public final class ImportOrganizer {
    private final ImportMerger merger;

    public ImportOrganizer() {
        this(MergeListener.NOOP);
    }

    /**
     * @param listener The listener to notify of merge events
     */
    public ImportOrganizer(MergeListener listener) {
        this.merger = new ImportMerger(listener);
    }

    /**
     * @see Syntax#parseStatement(String, List, Range)
     */
    public UseStatement parseStatement(String text, List<String> attributes, Range range) {
        return Syntax.parseStatement(text, attributes, range);
    }

    /**
     * @see Syntax#parseStatement(String)
     */
    public UseStatement parseStatement(String text) {
        return Syntax.parseStatement(text);
    }

    /**
     * @see Syntax#scanFile(String)
     */
    public ScanResult scanFile(String text) {
        return Syntax.scanFile(text);
    }

    /**
     * @param statements The declarations to organize
     * @param dependencies The dependencies of the package
     * @return The merged and sorted declarations, grouped by category
     */
    public List<ImportGroup> organize(List<UseStatement> statements, DependencySet dependencies) {
        return ImportGrouper.group(statements, dependencies, merger);
    }

    /**
     * @param groups Groups from {@link #organize(List, DependencySet)}
     * @return The text of the groups, ending in exactly one line break, or
     *  the empty string if there are no groups
     */
    public String render(List<ImportGroup> groups) {
        List<ImportGroup> sorted = new ArrayList<>(groups.size());
        for (ImportGroup group : groups) {
            if (!group.statements().isEmpty()) {
                sorted.add(new ImportGroup(group.category(), group.attributes(),
                        ImportSorter.sort(group.statements())));
            }
        }
        return UseFormatter.formatForFile(sorted);
    }

    /**
     * @see UnusedImportFilter#filter(List, List)
     */
    public List<UseStatement> filterByUnusedSpans(List<UseStatement> statements, List<Range> unusedSpans) {
        return UnusedImportFilter.filter(statements, unusedSpans);
    }

    /**
     * @see ImportSynthesizer#synthesize(List)
     */
    public List<UseStatement> synthesizeStatements(List<ImportSuggestion> suggestions) {
        return ImportSynthesizer.synthesize(suggestions);
    }
}
