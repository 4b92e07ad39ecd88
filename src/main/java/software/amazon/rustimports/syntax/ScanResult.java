/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.List;
import org.eclipse.lsp4j.Range;

/**
 * The use declarations found in a file, and where they are.
 *
 * @param statements The declarations that parsed successfully, in source order
 * @param importsRegion The nullable range from the first line of the first
 *                      declaration (including its attributes) to the end of
 *                      the last one. {@code null} if there are no declarations
 * @param hasTrailingBlankLine Whether a blank line follows the last declaration.
 *                             Also true if there's nothing after the last
 *                             declaration, or code follows it on the same line
 * @param blocks The declarations grouped into blocks separated by comment lines
 * @param skipped Ranges of declarations that were found but failed to parse
 */
public record ScanResult(
        List<UseStatement> statements,
        Range importsRegion,
        boolean hasTrailingBlankLine,
        List<ImportBlock> blocks,
        List<Range> skipped
) {
    static final ScanResult EMPTY = new ScanResult(List.of(), null, true, List.of(), List.of());

    public ScanResult {
        statements = List.copyOf(statements);
        blocks = List.copyOf(blocks);
        skipped = List.copyOf(skipped);
    }

    /**
     * @return Whether no declarations were found
     */
    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
