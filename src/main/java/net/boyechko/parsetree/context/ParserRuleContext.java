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
package net.boyechko.parsetree.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.parsetree.token.Interval;
import net.boyechko.parsetree.token.Token;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.ParseTree;
import net.boyechko.parsetree.tree.TerminalNode;
import net.boyechko.parsetree.tree.TreeStructureException;
import net.boyechko.parsetree.tree.Trees;
import net.boyechko.parsetree.visitor.ParseTreeVisitor;
import net.boyechko.parsetree.walker.ParseTreeListener;

/**
 * Base class for the context objects a generated parser creates per rule invocation. Holds the
 * children in grammar order, the first and last tokens matched, and a non-owning reference to the
 * invoking context.
 *
 * <p>Generated subclasses override {@link #getRuleIndex()}, {@link #enterRule}, {@link #exitRule}
 * and usually {@link #accept} to reach rule-specific listener and visitor methods.
 */
public class ParserRuleContext implements RuleContext {

    private final List<ParseTree> children = new ArrayList<>();
    private final int invokingState;

    private RuleContext parent;
    private Token start;
    private Token stop;

    public ParserRuleContext() {
        this(null, -1);
    }

    /**
     * Creates a context invoked from {@code parent}. The parent link is recorded but the context is
     * not added to the parent's children; the parser does that with {@link #addChild}.
     */
    public ParserRuleContext(ParserRuleContext parent, int invokingState) {
        this.parent = parent;
        this.invokingState = invokingState;
    }

    // ── Tree capability ─────────────────────────────────────────────

    @Override
    public RuleContext getParent() {
        return parent;
    }

    @Override
    public void setParent(RuleContext parent) {
        if (this.parent != null && parent != null && this.parent != parent) {
            throw new TreeStructureException(
                    "Rule context " + this + " is already attached to another rule");
        }
        this.parent = parent;
    }

    @Override
    public RuleContext getRuleContext() {
        return this;
    }

    @Override
    public ParserRuleContext getBaseRuleContext() {
        return this;
    }

    @Override
    public ParserRuleContext getPayload() {
        return this;
    }

    /**
     * Returns the {@code i}-th child.
     *
     * @throws IndexOutOfBoundsException if {@code i} is outside {@code [0, getChildCount())}
     */
    @Override
    public ParseTree getChild(int i) {
        if (i < 0 || i >= children.size()) {
            throw new IndexOutOfBoundsException(
                    "Child index " + i + " out of range for " + children.size() + " children");
        }
        return children.get(i);
    }

    @Override
    public int getChildCount() {
        return children.size();
    }

    @Override
    public List<ParseTree> getChildren() {
        return Collections.unmodifiableList(children);
    }

    // ── Typed child access ──────────────────────────────────────────

    /** Returns the {@code i}-th child of the given type, or null if there are not that many. */
    public <T extends ParseTree> T getChild(Class<? extends T> type, int i) {
        int seen = -1;
        for (ParseTree child : children) {
            if (type.isInstance(child)) {
                seen++;
                if (seen == i) {
                    return type.cast(child);
                }
            }
        }
        return null;
    }

    public <T extends ParserRuleContext> T getRuleContext(Class<? extends T> type, int i) {
        return getChild(type, i);
    }

    public <T extends ParserRuleContext> List<T> getRuleContexts(Class<? extends T> type) {
        List<T> contexts = new ArrayList<>();
        for (ParseTree child : children) {
            if (type.isInstance(child)) {
                contexts.add(type.cast(child));
            }
        }
        return contexts;
    }

    /** Returns the {@code i}-th terminal child whose token has type {@code tokenType}, or null. */
    public TerminalNode getToken(int tokenType, int i) {
        int seen = -1;
        for (ParseTree child : children) {
            if (isTokenOfType(child, tokenType)) {
                seen++;
                if (seen == i) {
                    return (TerminalNode) child;
                }
            }
        }
        return null;
    }

    public List<TerminalNode> getTokens(int tokenType) {
        List<TerminalNode> tokens = new ArrayList<>();
        for (ParseTree child : children) {
            if (isTokenOfType(child, tokenType)) {
                tokens.add((TerminalNode) child);
            }
        }
        return tokens;
    }

    private static boolean isTokenOfType(ParseTree child, int tokenType) {
        return child instanceof TerminalNode terminal
                && !(child instanceof ErrorNode)
                && terminal.getSymbol() != null
                && terminal.getSymbol().getType() == tokenType;
    }

    // ── Structural operations ───────────────────────────────────────

    public TerminalNode addChild(TerminalNode terminal) {
        return attach(terminal);
    }

    public <C extends RuleContext> C addChild(C ruleInvocation) {
        return attach(ruleInvocation);
    }

    public ErrorNode addErrorNode(ErrorNode errorNode) {
        return attach(errorNode);
    }

    private <C extends ParseTree> C attach(C child) {
        if (child == this) {
            throw new TreeStructureException("A rule context cannot be its own child");
        }
        child.setParent(this);
        children.add(child);
        return child;
    }

    /**
     * Detaches and returns the last child, or null if there are none. Used when the parser backs out
     * of a partially matched alternative.
     */
    public ParseTree removeLastChild() {
        if (children.isEmpty()) return null;

        ParseTree removed = children.remove(children.size() - 1);
        removed.setParent(null);
        return removed;
    }

    // ── Token span ──────────────────────────────────────────────────

    public Token getStart() {
        return start;
    }

    public void setStart(Token start) {
        this.start = start;
    }

    public Token getStop() {
        return stop;
    }

    public void setStop(Token stop) {
        this.stop = stop;
    }

    /**
     * Returns {@code [start, stop]}, {@link Interval#INVALID} if no start token was recorded, or the
     * empty range {@code (start, start - 1)} if the rule matched nothing.
     */
    @Override
    public Interval getSourceInterval() {
        if (start == null) return Interval.INVALID;

        int startIndex = start.getTokenIndex();
        if (stop == null || stop.getTokenIndex() < startIndex) {
            return Interval.of(startIndex, startIndex - 1);
        }
        return Interval.of(startIndex, stop.getTokenIndex());
    }

    // ── Rule hooks ──────────────────────────────────────────────────

    @Override
    public int getRuleIndex() {
        return -1;
    }

    @Override
    public int getInvokingState() {
        return invokingState;
    }

    @Override
    public int getAltNumber() {
        return 0;
    }

    @Override
    public int depth() {
        int n = 0;
        RuleContext p = this;
        while (p != null) {
            p = p.getParent();
            n++;
        }
        return n;
    }

    @Override
    public boolean isEmpty() {
        return invokingState == -1;
    }

    @Override
    public void enterRule(ParseTreeListener listener) {}

    @Override
    public void exitRule(ParseTreeListener listener) {}

    @Override
    public <T> T accept(ParseTreeVisitor<? extends T> visitor) {
        return visitor.visitChildren(this);
    }

    // ── Rendering ───────────────────────────────────────────────────

    /** Concatenates the text of every terminal below this context, without recursing. */
    @Override
    public String getText() {
        if (children.isEmpty()) return "";

        StringBuilder builder = new StringBuilder();
        for (ParseTree node : Trees.getDescendants(this)) {
            if (node instanceof TerminalNode terminal) {
                builder.append(terminal.getText());
            }
        }
        return builder.toString();
    }

    @Override
    public String toStringTree(List<String> ruleNames) {
        return Trees.toStringTree(this, ruleNames);
    }

    @Override
    public String toStringTree() {
        return toStringTree(null);
    }

    /** Renders the invocation stack from this context up to the root, e.g. {@code [expr stat]}. */
    public String toString(List<String> ruleNames) {
        StringBuilder buf = new StringBuilder("[");
        RuleContext p = this;
        while (p != null) {
            buf.append(Trees.getNodeText(p, ruleNames));
            p = p.getParent();
            if (p != null) buf.append(' ');
        }
        return buf.append(']').toString();
    }

    @Override
    public String toString() {
        return toString(null);
    }
}
