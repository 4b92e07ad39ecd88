/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.codeactions;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Range;

public final class RustCodeActions {
    public static final String ORGANIZE_IMPORTS_COMMAND = "rustImports.organizeImports";

    static final Set<String> UNUSED_IMPORT_CODES = Set.of("unused_imports", "unused-imports");

    private RustCodeActions() {
    }

    public static List<String> commands() {
        return List.of(ORGANIZE_IMPORTS_COMMAND);
    }

    public static List<String> kinds() {
        return List.of(CodeActionKind.SourceOrganizeImports);
    }

    /**
     * @param only The kinds of code action the client asked for, or {@code null}
     *             if it asked for any kind
     * @return Whether the organize imports action should be offered
     */
    public static boolean isRequested(List<String> only) {
        if (only == null || only.isEmpty()) {
            return true;
        }
        for (String kind : only) {
            if (CodeActionKind.SourceOrganizeImports.startsWith(kind)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param diagnostics Diagnostics sent by the client along with a code action request
     * @return The ranges of the diagnostics reporting unused imports
     */
    public static List<Range> unusedImportSpans(List<Diagnostic> diagnostics) {
        List<Range> spans = new ArrayList<>();
        if (diagnostics == null) {
            return spans;
        }
        for (Diagnostic diagnostic : diagnostics) {
            if (unusedImportPredicate().test(diagnostic)) {
                spans.add(diagnostic.getRange());
            }
        }
        return spans;
    }

    private static Predicate<Diagnostic> unusedImportPredicate() {
        return d -> d.getCode() != null
                && d.getCode().isLeft()
                && UNUSED_IMPORT_CODES.contains(d.getCode().getLeft());
    }
}
