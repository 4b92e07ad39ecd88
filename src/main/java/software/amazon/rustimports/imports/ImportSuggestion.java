/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

/**
 * A path to add an import for.
 *
 * @param path The full path, like {@code std::io::Read}
 * @param traitLike Whether the path names a trait that's only needed for its
 *                  methods, so it's imported as {@code _}
 */
public record ImportSuggestion(String path, boolean traitLike) {
}
