/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.rustimports.syntax.ScanResult;
import software.amazon.rustimports.syntax.UseStatement;

public class ImportOrganizerTest {
    private static final String MESSY = """
            use std::io::Write;
            use crate::util;
            use serde::{Serialize, Deserialize};
            use std::collections::HashMap;
            use std::io;
            #[cfg(test)]
            use crate::testing::fixture;
            pub use crate::api;
            """;

    private static final String ORGANIZED = """
            use std::{
                collections::HashMap,
                io::{
                    self,
                    Write,
                },
            };

            use serde::{
                Deserialize,
                Serialize,
            };

            pub use crate::api;
            use crate::util;

            #[cfg(test)]
            use crate::testing::fixture;
            """;

    private final ImportOrganizer organizer = new ImportOrganizer();

    @Test
    public void organizesFile() {
        assertThat(organize(MESSY), equalTo(ORGANIZED));
    }

    @Test
    public void organizingIsIdempotent() {
        String once = organize(MESSY);

        assertThat(organize(once), equalTo(once));
    }

    @Test
    public void renderedDeclarationsParseBack() {
        List<ImportGroup> groups = organizer.organize(organizer.scanFile(MESSY).statements(),
                DependencySet.of("serde"));
        String rendered = organizer.render(groups);

        ScanResult rescanned = organizer.scanFile(rendered);

        assertThat(rescanned.statements(), hasSize(5));
        assertThat(rescanned.skipped(), hasSize(0));
    }

    @Test
    public void renderSortsAndSkipsEmptyGroups() {
        List<ImportGroup> groups = List.of(
                new ImportGroup(ImportCategory.STANDARD_LIBRARY, List.of(), List.of(
                        organizer.parseStatement("use std::io;"),
                        organizer.parseStatement("use core::{mem, cell};"))),
                new ImportGroup(ImportCategory.EXTERNAL, List.of(), List.of()));

        assertThat(organizer.render(groups), equalTo("""
                use core::{
                    cell,
                    mem,
                };
                use std::io;
                """));
    }

    @Test
    public void renderNothing() {
        assertThat(organizer.render(List.of()), equalTo(""));
    }

    @Test
    public void synthesizedImportsJoinTheirGroup() {
        List<UseStatement> statements = new ArrayList<>(
                organizer.scanFile("use std::io;\n").statements());
        statements.addAll(organizer.synthesizeStatements(List.of(
                new ImportSuggestion("std::io::Write", true),
                new ImportSuggestion("serde::Serialize", false))));

        String rendered = organizer.render(organizer.organize(statements, DependencySet.EMPTY));

        assertThat(rendered, equalTo("""
                use std::io::{
                    self,
                    Write as _,
                };

                use serde::Serialize;
                """));
    }

    private String organize(String text) {
        List<UseStatement> statements = organizer.scanFile(text).statements();
        return organizer.render(organizer.organize(statements, DependencySet.of("serde")));
    }
}
