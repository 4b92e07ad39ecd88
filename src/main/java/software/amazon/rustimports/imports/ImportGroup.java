/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.List;
import software.amazon.rustimports.syntax.UseStatement;

/**
 * A non-empty run of declarations rendered together, separated from other
 * groups by a blank line.
 *
 * @param category The category of every declaration in the group
 * @param attributes The attribute lines shared by the declarations, sorted.
 *                   Empty unless {@code category} is {@link ImportCategory#ATTRIBUTED}
 * @param statements The declarations, in canonical order
 */
public record ImportGroup(ImportCategory category, List<String> attributes, List<UseStatement> statements) {
    public ImportGroup {
        attributes = List.copyOf(attributes);
        statements = List.copyOf(statements);
    }
}
