/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import software.amazon.rustimports.protocol.LspAdapter;

/**
 * Finds the use declarations at the top of a file in a single pass over its
 * lines.
 *
 * <p>A declaration may start anywhere in a line, span multiple lines, and
 * share its first and last lines with other code. Its end is the first
 * {@code ;} outside of braces. Attribute lines directly above a declaration
 * (blank and comment lines in between are allowed) are attached to it.
 *
 * <p>Scanning stops at the first line that isn't blank, a comment, an
 * attribute, or part of a use declaration, once at least one declaration has
 * been found. A later line with code in front of its declaration counts as
 * such a line, and code following a declaration on its last line ends the
 * scan after that line. A trailing comment instead ends the block. Text in
 * line comments and string literals is never taken for a declaration. A
 * declaration that fails to parse is skipped, and doesn't prevent the
 * following ones from being found.
 */
final class UseScanner {
    private static final Logger LOGGER = Logger.getLogger(UseScanner.class.getName());
    private static final Pattern USE_START = Pattern.compile("(?<![\\w])(pub\\s*(\\([^)]*\\))?\\s*)?use\\s+");

    private final String[] lines;
    private final List<UseStatement> statements = new ArrayList<>();
    private final List<Range> skipped = new ArrayList<>();
    private final Map<Integer, BlockBuilder> blocks = new LinkedHashMap<>();
    private Position firstFootprintStart;
    private int blockId = 0;
    private boolean emittedInBlock = false;
    private boolean foundAny = false;
    private boolean stopped = false;

    // State of the declaration currently being accumulated across lines
    private boolean inStatement = false;
    private final List<String> currentLines = new ArrayList<>();
    private Position currentStart;
    private Position currentFootprint;
    private List<String> currentAttributes = List.of();
    private int braceDepth = 0;

    private UseScanner(String text) {
        this.lines = text.split("\n", -1);
    }

    /**
     * @param text The text of the file to scan
     * @return The use declarations in the file
     */
    static ScanResult scan(String text) {
        UseScanner scanner = new UseScanner(text);
        scanner.scan();
        return scanner.result();
    }

    private void scan() {
        int i = skipPreamble();
        while (i < lines.length && !stopped) {
            String line = lines[i];
            if (inStatement) {
                continueStatement(line, i);
                i++;
                continue;
            }

            String trimmed = line.strip();
            if (trimmed.isEmpty() || isAttribute(trimmed)) {
                i++;
                continue;
            }

            if (isComment(trimmed)) {
                closeBlock();
                i++;
                continue;
            }

            int useColumn = findUseStart(line, 0);
            if (useColumn >= 0) {
                if (foundAny && !line.substring(0, useColumn).isBlank()) {
                    break;
                }
                foundAny = true;
                startStatement(line, i, useColumn);
                i++;
                continue;
            }

            if (foundAny) {
                break;
            }
            i++;
        }

        if (inStatement) {
            LOGGER.fine(() -> "Unterminated use declaration starting at " + currentStart);
            skipped.add(new Range(currentStart, new Position(lines.length - 1, lines[lines.length - 1].length())));
        }
    }

    private int skipPreamble() {
        int i = 0;
        while (i < lines.length) {
            String trimmed = lines[i].strip();
            if (trimmed.isEmpty() || trimmed.startsWith("//") || trimmed.startsWith("#![")) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private void startStatement(String line, int lineNumber, int startColumn) {
        currentStart = new Position(lineNumber, startColumn);
        if (line.substring(0, startColumn).isBlank()) {
            currentAttributes = collectAttributes(lineNumber);
            currentFootprint = currentAttributes.isEmpty()
                    ? currentStart
                    : new Position(attributeStartLine(lineNumber), 0);
        } else {
            currentAttributes = List.of();
            currentFootprint = currentStart;
        }

        braceDepth = 0;
        int end = findEnd(line, startColumn);
        if (end >= 0) {
            emit(line.substring(startColumn, end), new Position(lineNumber, end));
            scanRestOfLine(line, lineNumber, end);
        } else {
            inStatement = true;
            currentLines.clear();
            currentLines.add(line.substring(startColumn));
        }
    }

    private void continueStatement(String line, int lineNumber) {
        int end = findEnd(line, 0);
        if (end >= 0) {
            currentLines.add(line.substring(0, end));
            inStatement = false;
            emit(String.join("\n", currentLines), new Position(lineNumber, end));
            scanRestOfLine(line, lineNumber, end);
        } else {
            currentLines.add(line);
        }
    }

    // Another declaration may directly follow on the same line. A comment
    // after it ends the block, and any other code ends the scan.
    private void scanRestOfLine(String line, int lineNumber, int from) {
        int next = findUseStart(line, from);
        if (next >= 0 && line.substring(from, next).isBlank()) {
            startStatement(line, lineNumber, next);
            return;
        }

        String rest = line.substring(from).strip();
        if (rest.isEmpty()) {
            return;
        }
        if (rest.startsWith("//") || rest.startsWith("/*")) {
            closeBlock();
        } else {
            LOGGER.finest(() -> "Code after the use declaration ending at line " + lineNumber + " ends the imports");
            stopped = true;
        }
    }

    private void closeBlock() {
        if (emittedInBlock) {
            blockId++;
            emittedInBlock = false;
        }
    }

    // Column of the first declaration at or after from, or -1. Matches in
    // line comments and string literals don't count.
    private static int findUseStart(String line, int from) {
        boolean[] code = codeColumns(line);
        Matcher matcher = USE_START.matcher(line);
        if (!matcher.find(from)) {
            return -1;
        }
        do {
            if (code[matcher.start()]) {
                return matcher.start();
            }
        } while (matcher.find());
        return -1;
    }

    private static boolean[] codeColumns(String line) {
        boolean[] code = new boolean[line.length()];
        boolean inString = false;
        for (int col = 0; col < line.length(); col++) {
            char c = line.charAt(col);
            if (inString) {
                if (c == '\\') {
                    col++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '/' && col + 1 < line.length() && line.charAt(col + 1) == '/') {
                break;
            } else if (c == '"') {
                inString = true;
            } else {
                code[col] = true;
            }
        }
        return code;
    }

    // Returns the column just past the terminating ';', or -1 if the
    // declaration doesn't end on this line.
    private int findEnd(String line, int from) {
        for (int col = from; col < line.length(); col++) {
            char c = line.charAt(col);
            if (c == '{') {
                braceDepth++;
            } else if (c == '}') {
                braceDepth--;
            } else if (c == ';' && braceDepth == 0) {
                return col + 1;
            }
        }
        return -1;
    }

    private void emit(String text, Position end) {
        Range range = new Range(currentStart, end);
        try {
            UseTreeParser.Parsed parsed = new UseTreeParser(Lexer.tokenize(text), currentStart).parseStatement();
            UseStatement statement = new UseStatement(
                    parsed.visibility(), parsed.tree(), currentAttributes, range, blockId);
            statements.add(statement);
            emittedInBlock = true;
            if (firstFootprintStart == null) {
                firstFootprintStart = currentFootprint;
            }
            blocks.computeIfAbsent(blockId, id -> new BlockBuilder(id, currentFootprint)).add(statement);
        } catch (UseParseException e) {
            LOGGER.fine(() -> "Skipping malformed use declaration at " + currentStart + ": " + e.getMessage());
            skipped.add(range);
        }
    }

    private List<String> collectAttributes(int useLine) {
        List<String> attributes = new ArrayList<>();
        for (int i = useLine - 1; i >= 0; i--) {
            String trimmed = lines[i].strip();
            if (isAttribute(trimmed)) {
                attributes.add(0, trimmed);
            } else if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                break;
            }
        }
        return attributes;
    }

    private int attributeStartLine(int useLine) {
        int start = useLine;
        for (int i = useLine - 1; i >= 0; i--) {
            String trimmed = lines[i].strip();
            if (isAttribute(trimmed)) {
                start = i;
            } else if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                break;
            }
        }
        return start;
    }

    private ScanResult result() {
        if (statements.isEmpty()) {
            return new ScanResult(List.of(), null, true, List.of(), skipped);
        }

        UseStatement last = statements.get(statements.size() - 1);
        Range importsRegion = new Range(firstFootprintStart, last.range().getEnd());

        List<ImportBlock> builtBlocks = new ArrayList<>();
        for (BlockBuilder builder : blocks.values()) {
            builtBlocks.add(builder.build());
        }

        return new ScanResult(statements, importsRegion, hasTrailingBlankLine(last), builtBlocks, skipped);
    }

    private boolean hasTrailingBlankLine(UseStatement last) {
        Position end = last.range().getEnd();
        String endLine = lines[end.getLine()];
        if (!endLine.substring(end.getCharacter()).isBlank()) {
            return true;
        }
        int next = end.getLine() + 1;
        if (next >= lines.length) {
            return true;
        }
        return lines[next].isBlank();
    }

    private static boolean isAttribute(String trimmed) {
        return trimmed.startsWith("#[");
    }

    private static boolean isComment(String trimmed) {
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*");
    }

    private static final class BlockBuilder {
        private final int id;
        private final Position start;
        private final List<UseStatement> statements = new ArrayList<>();

        BlockBuilder(int id, Position start) {
            this.id = id;
            this.start = start;
        }

        void add(UseStatement statement) {
            statements.add(statement);
        }

        ImportBlock build() {
            Position end = statements.get(statements.size() - 1).range().getEnd();
            return new ImportBlock(id, new Range(LspAdapter.copy(start), LspAdapter.copy(end)), statements);
        }
    }
}
