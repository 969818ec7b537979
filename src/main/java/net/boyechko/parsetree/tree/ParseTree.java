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

import java.util.List;
import net.boyechko.parsetree.context.RuleContext;
import net.boyechko.parsetree.visitor.ParseTreeVisitor;

/**
 * A node of the tree a parser builds: either a rule invocation, a matched token, or a token the
 * parser consumed while recovering from a syntax error.
 */
public interface ParseTree extends SyntaxTree {

    @Override
    ParseTree getParent();

    @Override
    ParseTree getChild(int i);

    /**
     * Attaches this node to {@code parent}. Passing the current parent again is a no-op and passing
     * null detaches the node.
     *
     * @throws TreeStructureException if the node is already attached to a different parent
     */
    void setParent(RuleContext parent);

    /** Returns which kind of node this is; used for dispatch instead of type tests. */
    NodeKind kind();

    /** Routes {@code visitor} to the visit method matching this node. */
    <T> T accept(ParseTreeVisitor<? extends T> visitor);

    /** Returns the text of all terminal descendants concatenated in left-to-right order. */
    String getText();

    /** Renders this subtree in LISP form, naming rule nodes from {@code ruleNames}. */
    String toStringTree(List<String> ruleNames);
}
