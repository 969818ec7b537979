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
package net.boyechko.parsetree.walker;

import net.boyechko.parsetree.context.ParserRuleContext;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.NodeKind;
import net.boyechko.parsetree.tree.ParseTree;
import net.boyechko.parsetree.tree.RuleNode;
import net.boyechko.parsetree.tree.TerminalNode;
import net.boyechko.parsetree.tree.TreeStructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a parse tree depth-first, driving a {@link ParseTreeListener}. Every rule node produces an
 * enter notification before anything in its subtree and an exit notification after it; terminals
 * and error nodes produce a single callback. The whole tree is always visited.
 */
public class ParseTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(ParseTreeWalker.class);

    public static final ParseTreeWalker DEFAULT = new ParseTreeWalker();

    /** Walks {@code t} recursively; stack depth grows with the nesting depth of the tree. */
    public void walk(ParseTreeListener listener, ParseTree t) {
        NodeKind kind = classify(t);
        if (kind == NodeKind.ERROR) {
            listener.visitErrorNode((ErrorNode) t);
            return;
        }
        if (kind == NodeKind.TERMINAL) {
            listener.visitTerminal((TerminalNode) t);
            return;
        }

        RuleNode r = (RuleNode) t;
        enterRule(listener, r);
        int n = r.getChildCount();
        for (int i = 0; i < n; i++) {
            walk(listener, r.getChild(i));
        }
        exitRule(listener, r);
    }

    /** Fires {@code enterEveryRule}, then the context's own enter hook. */
    protected void enterRule(ParseTreeListener listener, RuleNode r) {
        ParserRuleContext ctx = contextOf(r);
        listener.enterEveryRule(ctx);
        ctx.enterRule(listener);
    }

    /** Fires the context's own exit hook, then {@code exitEveryRule}. */
    protected void exitRule(ParseTreeListener listener, RuleNode r) {
        ParserRuleContext ctx = contextOf(r);
        ctx.exitRule(listener);
        listener.exitEveryRule(ctx);
    }

    protected NodeKind classify(ParseTree t) {
        try {
            return NodeKind.classify(t);
        } catch (TreeStructureException e) {
            logger.error("Malformed parse tree: {}", e.getMessage());
            throw e;
        }
    }

    private static ParserRuleContext contextOf(RuleNode r) {
        ParserRuleContext ctx = r.getBaseRuleContext();
        if (ctx == null) {
            logger.error("Rule node {} has no rule context", r.getClass().getName());
            throw new TreeStructureException(
                    "Rule node " + r.getClass().getName() + " has no rule context");
        }
        return ctx;
    }
}
