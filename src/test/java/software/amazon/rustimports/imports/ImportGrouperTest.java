/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import software.amazon.rustimports.syntax.Syntax;
import software.amazon.rustimports.syntax.UseStatement;

public class ImportGrouperTest {
    private static final DependencySet DEPENDENCIES = DependencySet.of("serde", "tokio");

    @ParameterizedTest
    @CsvSource({
            "use std::io;, STANDARD_LIBRARY",
            "use core::mem;, STANDARD_LIBRARY",
            "use alloc::vec::Vec;, STANDARD_LIBRARY",
            "use serde::Serialize;, EXTERNAL",
            "use unknown_crate::Thing;, EXTERNAL",
            "use crate::a;, INTERNAL",
            "use super::a;, INTERNAL",
            "use self::a;, INTERNAL"
    })
    public void categorizesByRoot(String text, ImportCategory expected) {
        assertThat(ImportGrouper.categorize(Syntax.parseStatement(text), DEPENDENCIES), equalTo(expected));
    }

    @Test
    public void attributesTakePrecedence() {
        UseStatement statement = Syntax.parseStatement("use std::io;", List.of("#[cfg(test)]"), null);

        assertThat(ImportGrouper.categorize(statement, DEPENDENCIES), equalTo(ImportCategory.ATTRIBUTED));
    }

    @Test
    public void groupsInCategoryOrder() {
        List<ImportGroup> groups = group(
                "use crate::x;",
                "use serde::Serialize;",
                "use std::io;",
                "use tokio::sync::Mutex;",
                "use std::fs;",
                "use core::mem;");

        assertThat(groups.stream().map(ImportGroup::category).toList(), contains(
                ImportCategory.STANDARD_LIBRARY,
                ImportCategory.EXTERNAL,
                ImportCategory.INTERNAL));
        assertThat(format(groups.get(0)), contains("use core::mem;", "use std::{\n    fs,\n    io,\n};"));
        assertThat(format(groups.get(1)), contains("use serde::Serialize;", "use tokio::sync::Mutex;"));
        assertThat(format(groups.get(2)), contains("use crate::x;"));
    }

    @Test
    public void leavesOutEmptyCategories() {
        List<ImportGroup> groups = group("use crate::x;");

        assertThat(groups.stream().map(ImportGroup::category).toList(), contains(ImportCategory.INTERNAL));
        assertThat(groups.get(0).attributes(), empty());
    }

    @Test
    public void groupsAttributedDeclarationsByAttributeSet() {
        List<ImportGroup> groups = ImportGrouper.group(List.of(
                Syntax.parseStatement("use std::io;"),
                Syntax.parseStatement("use a::b;", List.of("#[cfg(test)]"), null),
                Syntax.parseStatement("use d::e;", List.of("#[cfg(unix)]", "#[allow(x)]"), null),
                Syntax.parseStatement("use a::c;", List.of("#[cfg(test)]"), null),
                Syntax.parseStatement("use d::f;", List.of("#[allow(x)]", "#[cfg(unix)]"), null)
        ), DEPENDENCIES, new ImportMerger());

        assertThat(groups.stream().map(ImportGroup::category).toList(), contains(
                ImportCategory.STANDARD_LIBRARY,
                ImportCategory.ATTRIBUTED,
                ImportCategory.ATTRIBUTED));
        assertThat(groups.get(1).attributes(), contains("#[allow(x)]", "#[cfg(unix)]"));
        assertThat(format(groups.get(1)), contains("#[cfg(unix)]\n#[allow(x)]\nuse d::{\n    e,\n    f,\n};"));
        assertThat(groups.get(2).attributes(), contains("#[cfg(test)]"));
        assertThat(format(groups.get(2)), contains("#[cfg(test)]\nuse a::{\n    b,\n    c,\n};"));
    }

    @Test
    public void attributeKeyIsSorted() {
        UseStatement statement = Syntax.parseStatement("use a::b;", List.of("#[z]", "#[a]"), null);

        assertThat(ImportGrouper.attributeKey(statement), contains("#[a]", "#[z]"));
    }

    private static List<ImportGroup> group(String... texts) {
        List<UseStatement> statements = Arrays.stream(texts).map(Syntax::parseStatement).toList();
        return ImportGrouper.group(statements, DEPENDENCIES, new ImportMerger());
    }

    private static List<String> format(ImportGroup group) {
        return group.statements().stream().map(UseFormatter::formatStatement).toList();
    }
}
