/*
 * Parse-Tree Runtime - Parse tree model and traversal for generated parsers
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.parsetree.tree;

/**
 * Discriminates the three kinds of parse tree node. Error nodes are also terminal nodes, so callers
 * must test {@link #ERROR} before {@link #TERMINAL}.
 */
public enum NodeKind {
    RULE,
    TERMINAL,
    ERROR;

    /**
     * Returns the declared kind of {@code tree} after checking that the node actually implements the
     * matching capability.
     *
     * @throws TreeStructureException if the node is not a {@link ParseTree}, declares no kind, or
     *     declares a kind it cannot honour
     */
    public static NodeKind classify(Tree tree) {
        if (!(tree instanceof ParseTree node)) {
            throw new TreeStructureException(
                    "Not a parse tree node: " + (tree == null ? "null" : tree.getClass().getName()));
        }

        NodeKind kind = node.kind();
        if (kind == null) {
            throw new TreeStructureException(
                    "Node " + node.getClass().getName() + " declares no node kind");
        }

        boolean honoured =
                switch (kind) {
                    case ERROR -> node instanceof ErrorNode;
                    case TERMINAL -> node instanceof TerminalNode;
                    case RULE -> node instanceof RuleNode;
                };
        if (!honoured) {
            throw new TreeStructureException(
                    "Node " + node.getClass().getName() + " claims kind " + kind
                            + " but does not implement it");
        }
        return kind;
    }
}
