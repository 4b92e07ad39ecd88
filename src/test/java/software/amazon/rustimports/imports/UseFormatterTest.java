/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import software.amazon.rustimports.syntax.Segment;
import software.amazon.rustimports.syntax.Syntax;
import software.amazon.rustimports.syntax.UseStatement;
import software.amazon.rustimports.syntax.UseTree;

public class UseFormatterTest {
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "use a;|use a;",
            "use a::b::c;|use a::b::c;",
            "use a::{b::{c}};|use a::b::c;",
            "use a::*;|use a::*;",
            "use a::{*};|use a::*;",
            "use a::b as c;|use a::b as c;",
            "pub use a::b;|pub use a::b;",
            "pub(in crate::a) use b::c;|pub(in crate::a) use b::c;",
            "use   a :: b ;|use a::b;"
    })
    public void formatsSingleLineDeclarations(String text, String expected) {
        assertThat(UseFormatter.formatStatement(Syntax.parseStatement(text)), equalTo(expected));
    }

    @Test
    public void formatsNestedGroupsOnePerLine() {
        UseStatement statement = Syntax.parseStatement("use a::{b::{c, d as x}, e, f::*};");

        assertThat(UseFormatter.formatStatement(statement), equalTo("""
                use a::{
                    b::{
                        c,
                        d as x,
                    },
                    e,
                    f::*,
                };"""));
    }

    @Test
    public void lonelySelfKeepsBraces() {
        UseStatement statement = Syntax.parseStatement("use a::{self as b};");

        assertThat(UseFormatter.formatStatement(statement), equalTo("""
                use a::{
                    self as b,
                };"""));
    }

    @Test
    public void writesAttributesAboveDeclaration() {
        UseStatement statement = Syntax.parseStatement("pub(crate) use a::b;",
                List.of("#[cfg(test)]", "#[allow(unused)]"), null);

        assertThat(UseFormatter.formatStatement(statement), equalTo("""
                #[cfg(test)]
                #[allow(unused)]
                pub(crate) use a::b;"""));
    }

    @Test
    public void indentsFromLevel() {
        UseTree tree = UseTree.branch(Segment.of("a"), List.of(
                UseTree.leaf(Segment.of("b")),
                UseTree.leaf(Segment.of("c"))));

        assertThat(UseFormatter.formatTree(tree, 1), equalTo("a::{\n        b,\n        c,\n    }"));
    }

    @Test
    public void separatesGroupsWithBlankLine() {
        List<ImportGroup> groups = List.of(
                new ImportGroup(ImportCategory.STANDARD_LIBRARY, List.of(), List.of(
                        Syntax.parseStatement("use core::mem;"),
                        Syntax.parseStatement("use std::io;"))),
                new ImportGroup(ImportCategory.INTERNAL, List.of(), List.of(
                        Syntax.parseStatement("use crate::a;"))));

        assertThat(UseFormatter.formatGroups(groups), equalTo("use core::mem;\nuse std::io;\n\nuse crate::a;"));
        assertThat(UseFormatter.formatForFile(groups), equalTo("use core::mem;\nuse std::io;\n\nuse crate::a;\n"));
    }

    @Test
    public void noGroupsIsEmptyText() {
        assertThat(UseFormatter.formatForFile(List.of()), equalTo(""));
    }
}
