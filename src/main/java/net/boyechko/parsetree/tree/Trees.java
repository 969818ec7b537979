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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import net.boyechko.parsetree.context.ParserRuleContext;
import net.boyechko.parsetree.context.RuleContext;
import net.boyechko.parsetree.token.Interval;
import net.boyechko.parsetree.token.Token;

/** Utilities for rendering and searching parse trees. */
public final class Trees {

    private Trees() {}

    /**
     * Renders a tree in LISP form: a leaf as its text, any other node as {@code (name child ...)}.
     * Rule nodes are named from {@code ruleNames} when given.
     */
    public static String toStringTree(Tree t, List<String> ruleNames) {
        if (t.getChildCount() == 0) return label(t, ruleNames);

        StringBuilder buf = new StringBuilder();
        Deque<Tree> open = new ArrayDeque<>();
        Deque<Integer> nextChild = new ArrayDeque<>();
        buf.append('(').append(label(t, ruleNames));
        open.push(t);
        nextChild.push(0);

        while (!open.isEmpty()) {
            Tree node = open.peek();
            int i = nextChild.pop();
            if (i == node.getChildCount()) {
                buf.append(')');
                open.pop();
                continue;
            }
            nextChild.push(i + 1);

            Tree child = node.getChild(i);
            buf.append(' ');
            if (child.getChildCount() == 0) {
                buf.append(label(child, ruleNames));
            } else {
                buf.append('(').append(label(child, ruleNames));
                open.push(child);
                nextChild.push(0);
            }
        }
        return buf.toString();
    }

    private static String label(Tree t, List<String> ruleNames) {
        return escapeWhitespace(getNodeText(t, ruleNames));
    }

    /**
     * Returns the label of a single node: the rule name (or rule index, or class name) for a rule
     * node and the rendered token for a terminal.
     */
    public static String getNodeText(Tree t, List<String> ruleNames) {
        if (t instanceof RuleContext ctx) {
            int ruleIndex = ctx.getRuleIndex();
            if (ruleNames != null && ruleIndex >= 0 && ruleIndex < ruleNames.size()) {
                return ruleNames.get(ruleIndex);
            }
            return ruleIndex >= 0 ? String.valueOf(ruleIndex) : ctx.getClass().getSimpleName();
        }
        if (t instanceof TerminalNode) {
            return t.toString();
        }

        Object payload = t.getPayload();
        if (payload instanceof Token token) {
            return token.getText();
        }
        return String.valueOf(payload);
    }

    /** Returns the ancestors of {@code t}, root first, not including {@code t} itself. */
    public static List<Tree> getAncestors(Tree t) {
        if (t.getParent() == null) return List.of();

        List<Tree> ancestors = new ArrayList<>();
        Tree current = t.getParent();
        while (current != null) {
            ancestors.add(current);
            current = current.getParent();
        }
        Collections.reverse(ancestors);
        return ancestors;
    }

    /** Returns true if {@code ancestor} is a strict ancestor of {@code t}. */
    public static boolean isAncestorOf(Tree ancestor, Tree t) {
        if (ancestor == null || t == null) return false;

        Tree current = t.getParent();
        while (current != null) {
            if (current == ancestor) return true;
            current = current.getParent();
        }
        return false;
    }

    /** Returns {@code t} and all its descendants in pre-order. */
    public static List<ParseTree> getDescendants(ParseTree t) {
        List<ParseTree> nodes = new ArrayList<>();
        Deque<ParseTree> pending = new ArrayDeque<>();
        pending.push(t);
        while (!pending.isEmpty()) {
            ParseTree node = pending.pop();
            nodes.add(node);
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                pending.push(node.getChild(i));
            }
        }
        return nodes;
    }

    /** Finds every terminal (including error nodes) whose token has type {@code tokenType}. */
    public static List<TerminalNode> findAllTokenNodes(ParseTree t, int tokenType) {
        List<TerminalNode> found = new ArrayList<>();
        for (ParseTree node : getDescendants(t)) {
            if (node instanceof TerminalNode terminal
                    && terminal.getSymbol() != null
                    && terminal.getSymbol().getType() == tokenType) {
                found.add(terminal);
            }
        }
        return found;
    }

    /** Finds every rule context in the subtree invoked for rule {@code ruleIndex}. */
    public static List<ParserRuleContext> findAllRuleNodes(ParseTree t, int ruleIndex) {
        List<ParserRuleContext> found = new ArrayList<>();
        for (ParseTree node : getDescendants(t)) {
            if (node instanceof ParserRuleContext ctx && ctx.getRuleIndex() == ruleIndex) {
                found.add(ctx);
            }
        }
        return found;
    }

    /**
     * Returns the deepest rule context whose source interval encloses the token range {@code
     * [startTokenIndex, stopTokenIndex]}, or null if {@code t} itself does not enclose it.
     */
    public static ParserRuleContext getRootOfSubtreeEnclosingRegion(
            ParseTree t, int startTokenIndex, int stopTokenIndex) {
        if (!(t instanceof ParserRuleContext ctx)) return null;

        Interval region = Interval.of(startTokenIndex, stopTokenIndex);
        if (!region.within(ctx.getSourceInterval())) return null;

        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParserRuleContext deeper =
                    getRootOfSubtreeEnclosingRegion(ctx.getChild(i), startTokenIndex, stopTokenIndex);
            if (deeper != null) return deeper;
        }
        return ctx;
    }

    /** Escapes tabs, newlines and carriage returns so node text stays on one line. */
    public static String escapeWhitespace(String s) {
        return s.replace("\t", "\\t").replace("\n", "\\n").replace("\r", "\\r");
    }
}
