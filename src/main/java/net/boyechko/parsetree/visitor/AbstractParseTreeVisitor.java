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
import net.boyechko.parsetree.tree.NodeKind;
import net.boyechko.parsetree.tree.ParseTree;
import net.boyechko.parsetree.tree.RuleNode;
import net.boyechko.parsetree.tree.TerminalNode;

/**
 * Base visitor that walks every child of a rule node and keeps the last child's result. Subclasses
 * change the reduction by overriding {@link #defaultResult()}, {@link #aggregateResult} and {@link
 * #shouldVisitNextChild}, and change what a node produces by overriding the visit methods.
 */
public abstract class AbstractParseTreeVisitor<T> implements ParseTreeVisitor<T> {

    /** Delegates to {@link #accept(ParseTree)}. */
    @Override
    public T visit(ParseTree tree) {
        return accept(tree);
    }

    /**
     * Routes {@code tree} to the visit method for its kind. Error nodes are recognised before plain
     * terminals; rule nodes go through their own {@code accept} so generated contexts can reach
     * rule-specific visit methods.
     */
    protected T accept(ParseTree tree) {
        NodeKind kind = NodeKind.classify(tree);
        if (kind == NodeKind.ERROR) {
            return visitErrorNode((ErrorNode) tree);
        }
        if (kind == NodeKind.TERMINAL) {
            return visitTerminal((TerminalNode) tree);
        }
        return tree.accept(this);
    }

    /**
     * Seeds the aggregate with {@link #defaultResult()}, then for each child in order asks {@link
     * #shouldVisitNextChild} and stops at the first false; otherwise visits the child and folds its
     * result in with {@link #aggregateResult}.
     */
    @Override
    public T visitChildren(RuleNode node) {
        T result = defaultResult();
        int n = node.getChildCount();
        for (int i = 0; i < n; i++) {
            if (!shouldVisitNextChild(node, result)) {
                break;
            }

            T childResult = accept(node.getChild(i));
            result = aggregateResult(result, childResult);
        }
        return result;
    }

    /** Returns {@link #defaultResult()}. */
    @Override
    public T visitTerminal(TerminalNode node) {
        return defaultResult();
    }

    /** Returns {@link #defaultResult()}. */
    @Override
    public T visitErrorNode(ErrorNode node) {
        return defaultResult();
    }

    /** Result for leaves and seed of every aggregation. Null unless overridden. */
    protected T defaultResult() {
        return null;
    }

    /** Combines the running aggregate with one child's result. Keeps {@code nextResult}. */
    protected T aggregateResult(T aggregate, T nextResult) {
        return nextResult;
    }

    /**
     * Checked before each child of {@code node}, including the first. Returning false stops the
     * loop in {@link #visitChildren} and returns the aggregate so far. Always true unless
     * overridden.
     */
    protected boolean shouldVisitNextChild(RuleNode node, T currentResult) {
        return true;
    }
}
