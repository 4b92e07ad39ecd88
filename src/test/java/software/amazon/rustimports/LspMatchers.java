/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import java.util.List;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import software.amazon.rustimports.document.Document;

/**
 * Hamcrest matchers for LSP4J types.
 */
public final class LspMatchers {
    private LspMatchers() {}

    public static Matcher<List<TextEdit>> makesEditedDocument(Document document, String expected) {
        return new CustomTypeSafeMatcher<>("makes an edited document " + expected) {
            @Override
            protected boolean matchesSafely(List<TextEdit> edits) {
                return applyAll(document, edits).equals(expected);
            }

            @Override
            public void describeMismatchSafely(List<TextEdit> edits, Description description) {
                description.appendText("makes an edited document:\n" + applyAll(document, edits));
            }
        };
    }

    public static Matcher<Range> isRange(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new CustomTypeSafeMatcher<>(String.format("a range of (%d, %d) - (%d, %d)",
                startLine, startCharacter, endLine, endCharacter)) {
            @Override
            protected boolean matchesSafely(Range range) {
                return range.getStart().getLine() == startLine
                       && range.getStart().getCharacter() == startCharacter
                       && range.getEnd().getLine() == endLine
                       && range.getEnd().getCharacter() == endCharacter;
            }
        };
    }

    public static Matcher<MessageParams> hasType(MessageType type) {
        return new CustomTypeSafeMatcher<>("a message of type " + type) {
            @Override
            protected boolean matchesSafely(MessageParams item) {
                return item.getType() == type;
            }
        };
    }

    // Edits are applied last to first, so earlier ranges stay valid.
    private static String applyAll(Document document, List<TextEdit> edits) {
        Document copy = document.copy();
        for (int i = edits.size() - 1; i >= 0; i--) {
            TextEdit edit = edits.get(i);
            copy.applyEdit(edit.getRange(), edit.getNewText());
        }
        return copy.copyText();
    }
}
