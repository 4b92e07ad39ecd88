/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.syntax;

import java.util.ArrayList;
import java.util.List;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Recursive-descent parser for a single use declaration:
 * <pre>
 *     statement   := visibility? "use" tree ";"
 *     visibility  := "pub" ( "(" ( "in" path | token ) ")" )?
 *     tree        := "*" | "self" alias? | segment alias? ( "::" child )?
 *     child       := "{" tree ("," tree)* ","? "}" | "*" | tree
 *     alias       := "as" identifier
 * </pre>
 *
 * <p>The parser is constructed with the document position the text starts at,
 * so every {@link Segment#range()} it produces is a position in the document,
 * not in the text.
 */
final class UseTreeParser {
    private final List<Token> tokens;
    private final int baseLine;
    private final int baseColumn;
    private int pos = 0;

    UseTreeParser(List<Token> tokens, Position base) {
        this.tokens = tokens;
        this.baseLine = base.getLine();
        this.baseColumn = base.getCharacter();
    }

    /**
     * The parts of a declaration produced by the parser.
     *
     * @param visibility The nullable visibility qualifier
     * @param tree The use tree
     */
    record Parsed(String visibility, UseTree tree) {}

    /**
     * @return The parsed declaration
     * @throws UseParseException If the tokens don't make a use declaration
     */
    Parsed parseStatement() {
        String visibility = parseVisibility();
        expect(TokenType.USE);
        UseTree tree = parseRootTree();
        expect(TokenType.SEMICOLON);
        if (current() != null) {
            throw error("unexpected " + current().type() + " after ;");
        }
        return new Parsed(visibility, tree);
    }

    /**
     * @return The visibility qualifier, like {@code pub(crate)}, or {@code null}
     *  if there isn't one
     */
    String parseVisibility() {
        if (!match(TokenType.PUB)) {
            return null;
        }
        advance();

        if (!match(TokenType.OPEN_PAREN)) {
            return "pub";
        }
        advance();

        StringBuilder builder = new StringBuilder("pub(");
        if (match(TokenType.IN)) {
            advance();
            builder.append("in ");
            if (match(TokenType.CLOSE_PAREN)) {
                throw error("expected path after in");
            }
            while (current() != null && !match(TokenType.CLOSE_PAREN)) {
                builder.append(advance().value());
            }
        } else {
            builder.append(expectAny().value());
        }

        expect(TokenType.CLOSE_PAREN);
        return builder.append(')').toString();
    }

    /**
     * @return A segment name with an optional alias
     */
    Segment parseSegment() {
        Token token = expectAny();
        switch (token.type()) {
            case IDENTIFIER, CRATE, SUPER, SELF -> {
            }
            default -> throw error("expected path segment but got " + token.type(), token);
        }
        return new Segment(token.value(), parseAlias(), rangeOf(token));
    }

    /**
     * @return A use tree, which may be a glob, a self leaf, or a path with
     *  optional children
     */
    UseTree parseUseTree() {
        Token token = current();
        if (token == null) {
            throw error("unexpected end of input");
        }

        if (token.is(TokenType.STAR)) {
            advance();
            return UseTree.glob(rangeOf(token));
        }

        if (token.is(TokenType.SELF) && !peekIs(1, TokenType.PATH_SEPARATOR)) {
            advance();
            return UseTree.self(parseAlias(), rangeOf(token));
        }

        return parsePath();
    }

    /**
     * @return The comma-separated trees within braces. The opening brace must
     *  already have been consumed, and the closing brace is left for the caller
     */
    List<UseTree> parseUseTreeList() {
        List<UseTree> trees = new ArrayList<>();
        while (current() != null && !match(TokenType.CLOSE_BRACE)) {
            trees.add(parseUseTree());
            if (match(TokenType.COMMA)) {
                advance();
            } else {
                break;
            }
        }
        return trees;
    }

    // At the root of a declaration, `self` is a path segment like `crate`,
    // and a glob without a prefix isn't allowed.
    private UseTree parseRootTree() {
        Token token = current();
        if (token != null && token.is(TokenType.STAR)) {
            throw error("glob import needs a path prefix", token);
        }
        return parsePath();
    }

    private UseTree parsePath() {
        Segment segment = parseSegment();
        if (!match(TokenType.PATH_SEPARATOR)) {
            return UseTree.leaf(segment);
        }
        if (segment.hasAlias()) {
            throw error("alias must be on the last segment of a path");
        }
        advance();

        Token next = current();
        if (next == null) {
            throw error("unexpected end of input after ::");
        }

        if (next.is(TokenType.OPEN_BRACE)) {
            advance();
            List<UseTree> children = parseUseTreeList();
            expect(TokenType.CLOSE_BRACE);
            if (children.isEmpty()) {
                throw error("empty use group", next);
            }
            return UseTree.branch(segment, children);
        }

        if (next.is(TokenType.STAR)) {
            advance();
            return UseTree.branch(segment, List.of(UseTree.glob(rangeOf(next))));
        }

        return UseTree.branch(segment, List.of(parseUseTree()));
    }

    private String parseAlias() {
        if (!match(TokenType.AS)) {
            return null;
        }
        advance();
        Token alias = expectAny();
        if (!alias.is(TokenType.IDENTIFIER)) {
            throw error("expected alias but got " + alias.type(), alias);
        }
        return alias.value();
    }

    private Range rangeOf(Token token) {
        int line = baseLine + token.line();
        int offset = token.line() == 0 ? baseColumn : 0;
        return new Range(
                new Position(line, offset + token.startColumn()),
                new Position(line, offset + token.endColumn()));
    }

    private Token current() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private boolean peekIs(int offset, TokenType type) {
        int idx = pos + offset;
        return idx < tokens.size() && tokens.get(idx).is(type);
    }

    private boolean match(TokenType type) {
        Token token = current();
        return token != null && token.is(type);
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private Token expectAny() {
        if (current() == null) {
            throw error("unexpected end of input");
        }
        return advance();
    }

    private Token expect(TokenType type) {
        Token token = current();
        if (token == null) {
            throw error("expected " + type + " but got end of input");
        }
        if (!token.is(type)) {
            throw error("expected " + type + " but got " + token.type(), token);
        }
        return advance();
    }

    private UseParseException error(String message) {
        Token token = current();
        if (token == null) {
            return new UseParseException(message, -1, -1);
        }
        return error(message, token);
    }

    private UseParseException error(String message, Token token) {
        Range range = rangeOf(token);
        return new UseParseException(message, range.getStart().getLine(), range.getStart().getCharacter());
    }
}
