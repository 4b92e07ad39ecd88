/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.List;
import org.eclipse.lsp4j.Range;

/**
 * A run of use declarations not separated by a comment line. Blank lines
 * don't split a block.
 *
 * @param id The block id shared by the declarations in {@link #statements}
 * @param region The range from the first line of the first declaration,
 *               including its attributes, to the end of the last declaration
 * @param statements The declarations in the block, in source order
 */
public record ImportBlock(int id, Range region, List<UseStatement> statements) {
    public ImportBlock {
        statements = List.copyOf(statements);
    }
}
