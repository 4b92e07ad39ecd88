/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static software.amazon.rustimports.LspMatchers.isRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Test;
import software.amazon.rustimports.syntax.Syntax;
import software.amazon.rustimports.syntax.UseStatement;

public class ImportMergerTest {
    @Test
    public void mergesSameRoot() {
        List<String> merged = merge("use std::io;", "use std::fs::File;", "use std::io::Read;");

        assertThat(merged, contains("""
                use std::{
                    fs::File,
                    io::{
                        self,
                        Read,
                    },
                };"""));
    }

    @Test
    public void insertsSelfForImportedPrefix() {
        assertThat(merge("use a::b;", "use a::b::c;"), contains("""
                use a::b::{
                    self,
                    c,
                };"""));
    }

    @Test
    public void keepsDifferentRootsApart() {
        assertThat(merge("use a::b;", "use c::d;", "use a::e;"), contains(
                "use a::{\n    b,\n    e,\n};",
                "use c::d;"));
    }

    @Test
    public void keepsDifferentVisibilitiesApart() {
        assertThat(merge("pub use a::b;", "use a::c;", "pub(crate) use a::d;"), contains(
                "pub use a::b;",
                "use a::c;",
                "pub(crate) use a::d;"));
    }

    @Test
    public void removesDuplicates() {
        assertThat(merge("use a::{b, b};", "use a::b;"), contains("use a::b;"));
    }

    @Test
    public void plainImportWinsOverDiscard() {
        assertThat(merge("use a::b as _;", "use a::b;"), contains("use a::b;"));
        assertThat(merge("use a::b;", "use a::b as _;"), contains("use a::b;"));
    }

    @Test
    public void explicitAliasWinsOverPlainImport() {
        assertThat(merge("use a::b;", "use a::b as c;"), contains("use a::b as c;"));
        assertThat(merge("use a::b as c;", "use a::b;"), contains("use a::b as c;"));
    }

    @Test
    public void explicitAliasWinsOverDiscard() {
        assertThat(merge("use a::b as _;", "use a::b as r;"), contains("use a::b as r;"));
        assertThat(merge("use a::b as r;", "use a::b as _;"), contains("use a::b as r;"));
    }

    @Test
    public void firstAliasWinsOnConflict() {
        RecordingListener listener = new RecordingListener();

        List<UseStatement> merged = new ImportMerger(listener).merge(parse("use a::b as x;", "use a::b as y;"));

        assertThat(format(merged), contains("use a::b as x;"));
        assertThat(listener.events, contains("conflict a::b x y", "merged a null 2 1"));
    }

    @Test
    public void resultDoesNotDependOnInputOrder() {
        String[] texts = {"use a::{c, b::d};", "use a::b;", "use a::c as _;", "use a::b::*;"};
        List<String> forward = merge(texts);

        List<String> reversed = new ArrayList<>(Arrays.asList(texts));
        Collections.reverse(reversed);

        assertThat(merge(reversed.toArray(String[]::new)), equalTo(forward));
    }

    @Test
    public void notifiesListener() {
        RecordingListener listener = new RecordingListener();

        new ImportMerger(listener).merge(parse("use a::b;", "use a::{b, c};"));

        assertThat(listener.events, contains("duplicate a::b", "merged a null 2 2"));
    }

    @Test
    public void keepsSharedAttributes() {
        List<UseStatement> merged = new ImportMerger().merge(List.of(
                Syntax.parseStatement("use a::b;", List.of("#[cfg(test)]"), null),
                Syntax.parseStatement("use a::c;", List.of("#[cfg(test)]"), null)));

        assertThat(merged.get(0).attributes(), contains("#[cfg(test)]"));
    }

    @Test
    public void dropsDifferingAttributes() {
        List<UseStatement> merged = new ImportMerger().merge(List.of(
                Syntax.parseStatement("use a::b;", List.of("#[cfg(test)]"), null),
                Syntax.parseStatement("use a::c;", List.of(), null)));

        assertThat(merged.get(0).attributes(), empty());
    }

    @Test
    public void rangeCoversAllMergedDeclarations() {
        List<UseStatement> merged = new ImportMerger().merge(List.of(
                Syntax.parseStatement("use a::b;", List.of(), range(2, 0, 2, 9)),
                Syntax.parseStatement("use a::c;", List.of(), range(0, 0, 0, 9))));

        assertThat(merged, hasSize(1));
        assertThat(merged.get(0).range(), isRange(0, 0, 2, 9));
    }

    private static List<String> merge(String... texts) {
        return format(new ImportMerger().merge(parse(texts)));
    }

    private static List<UseStatement> parse(String... texts) {
        return Arrays.stream(texts).map(Syntax::parseStatement).toList();
    }

    private static List<String> format(List<UseStatement> statements) {
        return statements.stream().map(UseFormatter::formatStatement).toList();
    }

    private static Range range(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    private static final class RecordingListener implements MergeListener {
        private final List<String> events = new ArrayList<>();

        @Override
        public void onGroupMerged(String root, String visibility, int statementCount, int importCount) {
            events.add("merged " + root + " " + visibility + " " + statementCount + " " + importCount);
        }

        @Override
        public void onDuplicate(FlatImport kept, FlatImport dropped) {
            events.add("duplicate " + kept.key());
        }

        @Override
        public void onAliasConflict(String key, String keptAlias, String rejectedAlias) {
            events.add("conflict " + key + " " + keptAlias + " " + rejectedAlias);
        }
    }
}
