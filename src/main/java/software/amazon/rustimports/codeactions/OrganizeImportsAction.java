/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.codeactions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import software.amazon.rustimports.document.Document;
import software.amazon.rustimports.format.ExternalFormatter;
import software.amazon.rustimports.imports.DependencySet;
import software.amazon.rustimports.imports.ImportOrganizer;
import software.amazon.rustimports.imports.ImportSorter;
import software.amazon.rustimports.imports.ImportSuggestion;
import software.amazon.rustimports.imports.UseFormatter;
import software.amazon.rustimports.protocol.LspAdapter;
import software.amazon.rustimports.syntax.ImportBlock;
import software.amazon.rustimports.syntax.ScanResult;
import software.amazon.rustimports.syntax.UseStatement;

/**
 * Computes the edits that organize the use declarations of a document.
 *
 * <p>Each block of declarations, as split up by comment lines, is organized
 * and replaced on its own, so the comments between blocks stay where they
 * are. Imports to add go into the last block. A block containing a
 * declaration that couldn't be parsed is left alone, since replacing it
 * would drop that declaration.
 */
public final class OrganizeImportsAction {
    public static final String TITLE = "Organize imports";

    private static final Logger LOGGER = Logger.getLogger(OrganizeImportsAction.class.getName());

    private final ImportOrganizer organizer;
    private final ExternalFormatter formatter;
    private final boolean groupImports;
    private final boolean removeUnused;

    /**
     * @param organizer The organizer to organize declarations with
     * @param formatter The formatter to run on the text of each block
     * @param groupImports Whether to merge, sort and group declarations. If
     *                     false, declarations are rewritten in source order
     * @param removeUnused Whether to remove imports reported as unused
     */
    public OrganizeImportsAction(
            ImportOrganizer organizer,
            ExternalFormatter formatter,
            boolean groupImports,
            boolean removeUnused
    ) {
        this.organizer = organizer;
        this.formatter = formatter;
        this.groupImports = groupImports;
        this.removeUnused = removeUnused;
    }

    /**
     * @param uri The URI of the document
     * @param edits The edits to make to the document
     * @return A code action that applies {@code edits}
     */
    public static CodeAction build(String uri, List<TextEdit> edits) {
        CodeAction codeAction = new CodeAction(TITLE);
        codeAction.setKind(CodeActionKind.SourceOrganizeImports);
        WorkspaceEdit workspaceEdit = new WorkspaceEdit();
        workspaceEdit.setChanges(Map.of(uri, edits));
        codeAction.setEdit(workspaceEdit);
        return codeAction;
    }

    /**
     * @param document The document to organize
     * @param dependencies The dependencies of the package the document is in
     * @param unusedSpans Ranges of imports reported as unused
     * @param suggestions Imports to add
     * @return The edits to make, which may be empty if the imports are
     *  already organized
     */
    public List<TextEdit> computeEdits(
            Document document,
            DependencySet dependencies,
            List<Range> unusedSpans,
            List<ImportSuggestion> suggestions
    ) {
        ScanResult scan = organizer.scanFile(document.copyText());
        List<UseStatement> added = organizer.synthesizeStatements(suggestions);
        if (scan.isEmpty()) {
            return added.isEmpty() ? List.of() : List.of(insertNew(document, added, dependencies));
        }

        List<UseStatement> kept = removeUnused
                ? organizer.filterByUnusedSpans(scan.statements(), unusedSpans)
                : scan.statements();
        Map<Integer, List<UseStatement>> keptByBlock = new LinkedHashMap<>();
        for (UseStatement statement : kept) {
            keptByBlock.computeIfAbsent(statement.blockId(), id -> new ArrayList<>()).add(statement);
        }

        List<TextEdit> edits = new ArrayList<>();
        List<ImportBlock> blocks = scan.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            ImportBlock block = blocks.get(i);
            boolean last = i == blocks.size() - 1;
            if (containsSkipped(block, scan.skipped())) {
                LOGGER.fine(() -> "Not organizing block " + block.id() + " since it has unparsable declarations");
                continue;
            }

            List<UseStatement> statements = new ArrayList<>(keptByBlock.getOrDefault(block.id(), List.of()));
            if (last) {
                statements.addAll(added);
            }

            TextEdit edit = blockEdit(document, block, statements, dependencies,
                    last && !scan.hasTrailingBlankLine());
            if (edit != null) {
                edits.add(edit);
            }
        }
        return edits;
    }

    private TextEdit blockEdit(
            Document document,
            ImportBlock block,
            List<UseStatement> statements,
            DependencySet dependencies,
            boolean needsBlankLineAfter
    ) {
        Range range = block.region();
        String rendered = render(statements, dependencies).stripTrailing();

        boolean codeBefore = !isBlank(document.copyLineBefore(range.getStart()));
        boolean codeAfter = !isBlank(document.copyLineAfter(range.getEnd()));
        String replacement = rendered;
        if (rendered.isEmpty()) {
            if (!codeBefore && !codeAfter) {
                range = withLineBreak(document, range);
            }
        } else {
            if (codeBefore) {
                replacement = "\n\n" + replacement;
            }
            if (codeAfter) {
                replacement = replacement + "\n\n";
            } else if (needsBlankLineAfter) {
                replacement = replacement + "\n";
            }
        }

        if (replacement.equals(document.copyRange(range))) {
            return null;
        }
        return new TextEdit(range, replacement);
    }

    private TextEdit insertNew(Document document, List<UseStatement> added, DependencySet dependencies) {
        int line = firstCodeLine(document);
        String rendered = render(added, dependencies);
        String after = document.copyLine(line);
        if (after != null && !after.isBlank()) {
            rendered = rendered + "\n";
        }
        return new TextEdit(LspAdapter.point(line, 0), rendered);
    }

    private String render(List<UseStatement> statements, DependencySet dependencies) {
        String text;
        if (groupImports) {
            text = organizer.render(organizer.organize(statements, dependencies));
        } else {
            StringBuilder builder = new StringBuilder();
            for (UseStatement statement : statements) {
                UseStatement canonical = statement.withTree(ImportSorter.sortTree(statement.tree()));
                builder.append(UseFormatter.formatStatement(canonical)).append('\n');
            }
            text = builder.toString();
        }
        return text.isEmpty() ? text : formatter.format(text);
    }

    // The first line after the inner attributes and comments at the top of the file
    private static int firstCodeLine(Document document) {
        int line = 0;
        while (line <= document.lastLine()) {
            String trimmed = document.copyLine(line).strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("//") && !trimmed.startsWith("#![")) {
                break;
            }
            line++;
        }
        return Math.min(line, document.lastLine());
    }

    private static Range withLineBreak(Document document, Range range) {
        int nextLine = range.getEnd().getLine() + 1;
        if (nextLine > document.lastLine()) {
            return range;
        }
        return new Range(range.getStart(), new Position(nextLine, 0));
    }

    private static boolean containsSkipped(ImportBlock block, List<Range> skipped) {
        for (Range range : skipped) {
            if (LspAdapter.contains(block.region(), range)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
