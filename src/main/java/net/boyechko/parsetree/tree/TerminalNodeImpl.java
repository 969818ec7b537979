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
import net.boyechko.parsetree.token.Interval;
import net.boyechko.parsetree.token.Token;
import net.boyechko.parsetree.visitor.ParseTreeVisitor;

/** Default {@link TerminalNode}: a token plus a back-reference to the rule that matched it. */
public class TerminalNodeImpl implements TerminalNode {
    static final String EOF_TEXT = "<EOF>";

    private final Token symbol;
    private RuleContext parent;

    public TerminalNodeImpl(Token symbol) {
        this.symbol = symbol;
    }

    @Override
    public Token getSymbol() {
        return symbol;
    }

    @Override
    public RuleContext getParent() {
        return parent;
    }

    @Override
    public void setParent(RuleContext parent) {
        if (this.parent != null && parent != null && this.parent != parent) {
            throw new TreeStructureException(
                    "Terminal " + this + " is already attached to another rule");
        }
        this.parent = parent;
    }

    @Override
    public Token getPayload() {
        return symbol;
    }

    @Override
    public ParseTree getChild(int i) {
        throw new IndexOutOfBoundsException("Terminal nodes have no children, index " + i);
    }

    @Override
    public int getChildCount() {
        return 0;
    }

    @Override
    public List<ParseTree> getChildren() {
        return List.of();
    }

    /** Always fails: terminal nodes are leaves. */
    public void setChildren(List<? extends ParseTree> children) {
        throw new TreeStructureException("Cannot set children on terminal node " + this);
    }

    @Override
    public Interval getSourceInterval() {
        if (symbol == null) return Interval.INVALID;

        int tokenIndex = symbol.getTokenIndex();
        return Interval.of(tokenIndex, tokenIndex);
    }

    /**
     * Routes by node kind rather than by class: any subclass that is an {@link ErrorNode} reaches
     * {@code visitErrorNode}.
     */
    @Override
    public <T> T accept(ParseTreeVisitor<? extends T> visitor) {
        if (NodeKind.classify(this) == NodeKind.ERROR) {
            return visitor.visitErrorNode((ErrorNode) this);
        }
        return visitor.visitTerminal(this);
    }

    @Override
    public String getText() {
        if (symbol == null || symbol.getText() == null) return "";
        return symbol.getText();
    }

    @Override
    public String toStringTree(List<String> ruleNames) {
        return Trees.toStringTree(this, ruleNames);
    }

    @Override
    public String toStringTree() {
        return toStringTree(null);
    }

    /** Returns the token text, or {@code <EOF>} for the end-of-file token. */
    @Override
    public String toString() {
        if (symbol == null) return "";
        if (symbol.getType() == Token.EOF) return EOF_TEXT;
        return getText();
    }
}
