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

import java.util.Optional;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.ParseTree;
import net.boyechko.parsetree.tree.RuleNode;
import net.boyechko.parsetree.visitor.AbstractParseTreeVisitor;

/**
 * Finds the first error node in document order. Once one is found no further siblings are visited
 * at any level, so the rest of the tree is skipped.
 */
public class FirstErrorVisitor extends AbstractParseTreeVisitor<ErrorNode> {

    /** Returns the first error node under {@code tree}, if any. */
    public Optional<ErrorNode> find(ParseTree tree) {
        return Optional.ofNullable(visit(tree));
    }

    @Override
    public ErrorNode visitErrorNode(ErrorNode node) {
        return node;
    }

    @Override
    protected ErrorNode aggregateResult(ErrorNode aggregate, ErrorNode nextResult) {
        return aggregate != null ? aggregate : nextResult;
    }

    @Override
    protected boolean shouldVisitNextChild(RuleNode node, ErrorNode currentResult) {
        return currentResult == null;
    }
}
