/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.ArrayList;
import java.util.List;
import software.amazon.rustimports.syntax.UseStatement;
import software.amazon.rustimports.syntax.UseTree;

/**
 * Writes use declarations in canonical form:
 * <pre>
 * use std::{
 *     fs::File,
 *     io::{
 *         self,
 *         Read,
 *     },
 * };
 * </pre>
 *
 * <p>A node with a single child is written inline, unless that child is
 * {@code self}. Brace groups put each child on its own line, indented one
 * level deeper than the line the group was opened on, followed by a comma.
 */
public final class UseFormatter {
    static final String INDENT = "    ";

    private UseFormatter() {
    }

    /**
     * @param tree The tree to write
     * @param level The nesting level of the line the tree starts on
     * @return The text of the tree
     */
    public static String formatTree(UseTree tree, int level) {
        StringBuilder builder = new StringBuilder();
        appendTree(builder, tree, level);
        return builder.toString();
    }

    /**
     * @param statement The declaration to write
     * @return The text of the declaration, including its attribute lines,
     *  without a trailing line break
     */
    public static String formatStatement(UseStatement statement) {
        StringBuilder builder = new StringBuilder();
        for (String attribute : statement.attributes()) {
            builder.append(attribute).append('\n');
        }
        if (statement.visibility() != null) {
            builder.append(statement.visibility()).append(' ');
        }
        builder.append("use ");
        appendTree(builder, statement.tree(), 0);
        return builder.append(';').toString();
    }

    /**
     * @param groups The groups to write
     * @return The declarations of each group on consecutive lines, with a
     *  blank line between groups, without a trailing line break
     */
    public static String formatGroups(List<ImportGroup> groups) {
        List<String> sections = new ArrayList<>(groups.size());
        for (ImportGroup group : groups) {
            List<String> lines = new ArrayList<>(group.statements().size());
            for (UseStatement statement : group.statements()) {
                lines.add(formatStatement(statement));
            }
            sections.add(String.join("\n", lines));
        }
        return String.join("\n\n", sections);
    }

    /**
     * @param groups The groups to write
     * @return The same text as {@link #formatGroups(List)}, ending in exactly
     *  one line break, or the empty string if there are no groups
     */
    public static String formatForFile(List<ImportGroup> groups) {
        if (groups.isEmpty()) {
            return "";
        }
        return formatGroups(groups) + "\n";
    }

    private static void appendTree(StringBuilder builder, UseTree tree, int level) {
        if (tree.glob()) {
            builder.append('*');
            return;
        }

        builder.append(tree.name());
        if (!tree.hasChildren()) {
            if (tree.segment().hasAlias()) {
                builder.append(" as ").append(tree.segment().alias());
            }
            return;
        }

        builder.append("::");
        List<UseTree> children = tree.children();
        if (children.size() == 1 && !children.get(0).isSelf()) {
            appendTree(builder, children.get(0), level);
            return;
        }

        builder.append("{\n");
        for (UseTree child : children) {
            builder.append(INDENT.repeat(level + 1));
            appendTree(builder, child, level + 1);
            builder.append(",\n");
        }
        builder.append(INDENT.repeat(level)).append('}');
    }
}
