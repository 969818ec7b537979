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
package net.boyechko.parsetree.visitor;

import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.ParseTree;
import net.boyechko.parsetree.tree.RuleNode;
import net.boyechko.parsetree.tree.TerminalNode;

/**
 * Pull-style traversal of a parse tree that computes a value of type {@code T} per subtree.
 *
 * @param <T> the result type of every visit method; use {@link Void} for visitors with no result
 */
public interface ParseTreeVisitor<T> {

    /** Visits a tree and returns the result for it. */
    T visit(ParseTree tree);

    /** Visits the children of a rule node and combines their results. */
    T visitChildren(RuleNode node);

    T visitTerminal(TerminalNode node);

    T visitErrorNode(ErrorNode node);
}
