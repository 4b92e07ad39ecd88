/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.codeactions;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import java.util.List;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Test;

public class RustCodeActionsTest {
    @Test
    public void offeredForMatchingKinds() {
        assertThat(RustCodeActions.isRequested(null), is(true));
        assertThat(RustCodeActions.isRequested(List.of()), is(true));
        assertThat(RustCodeActions.isRequested(List.of(CodeActionKind.Source)), is(true));
        assertThat(RustCodeActions.isRequested(List.of(CodeActionKind.SourceOrganizeImports)), is(true));
        assertThat(RustCodeActions.isRequested(List.of(CodeActionKind.QuickFix, CodeActionKind.Source)), is(true));
    }

    @Test
    public void notOfferedForOtherKinds() {
        assertThat(RustCodeActions.isRequested(List.of(CodeActionKind.QuickFix)), is(false));
        assertThat(RustCodeActions.isRequested(List.of(CodeActionKind.SourceFixAll)), is(false));
    }

    @Test
    public void advertisesCommandAndKind() {
        assertThat(RustCodeActions.commands(), contains(RustCodeActions.ORGANIZE_IMPORTS_COMMAND));
        assertThat(RustCodeActions.kinds(), contains(CodeActionKind.SourceOrganizeImports));
    }

    @Test
    public void findsUnusedImportDiagnostics() {
        Range first = range(0, 4, 0, 7);
        Range second = range(2, 9, 2, 12);
        Diagnostic unused = diagnostic(first, "unused_imports");
        Diagnostic unusedDashed = diagnostic(second, "unused-imports");
        Diagnostic other = diagnostic(range(5, 0, 5, 1), "dead_code");
        Diagnostic numbered = new Diagnostic(range(6, 0, 6, 1), "numbered");
        numbered.setCode(42);
        Diagnostic uncoded = new Diagnostic(range(7, 0, 7, 1), "no code");

        List<Range> spans = RustCodeActions.unusedImportSpans(
                List.of(unused, other, numbered, uncoded, unusedDashed));

        assertThat(spans, contains(first, second));
    }

    @Test
    public void noDiagnostics() {
        assertThat(RustCodeActions.unusedImportSpans(null), empty());
    }

    private static Diagnostic diagnostic(Range range, String code) {
        Diagnostic diagnostic = new Diagnostic(range, "message");
        diagnostic.setCode(code);
        return diagnostic;
    }

    private static Range range(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }
}
