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
package net.boyechko.parsetree.visitors;

import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.TerminalNode;
import net.boyechko.parsetree.visitor.AbstractParseTreeVisitor;

/** Counts the terminal nodes in a tree. Error nodes count only if asked for. */
public class TerminalCountVisitor extends AbstractParseTreeVisitor<Integer> {

    private final boolean countErrorNodes;

    public TerminalCountVisitor() {
        this(false);
    }

    public TerminalCountVisitor(boolean countErrorNodes) {
        this.countErrorNodes = countErrorNodes;
    }

    @Override
    public Integer visitTerminal(TerminalNode node) {
        return 1;
    }

    @Override
    public Integer visitErrorNode(ErrorNode node) {
        return countErrorNodes ? 1 : 0;
    }

    @Override
    protected Integer defaultResult() {
        return 0;
    }

    @Override
    protected Integer aggregateResult(Integer aggregate, Integer nextResult) {
        return aggregate + nextResult;
    }
}
