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

import net.boyechko.parsetree.tree.RuleNode;
import net.boyechko.parsetree.walker.ParseTreeListener;

/**
 * The state of one rule invocation. Generated parsers subclass {@link ParserRuleContext}; code that
 * only reads the tree should depend on this interface.
 */
public interface RuleContext extends RuleNode {

    @Override
    RuleContext getParent();

    /** Index of the grammar rule this context was invoked for, or -1 if unknown. */
    int getRuleIndex();

    /** ATN state that invoked this rule, or -1 for the start rule. */
    int getInvokingState();

    /** Outer alternative number the parser chose for this invocation, or 0 if not tracked. */
    int getAltNumber();

    /** Number of rule invocations between this context and the root, counting itself. */
    int depth();

    /** Returns true if no rule invoked this context, i.e. it is the start rule's context. */
    boolean isEmpty();

    /** Rule-specific hook called by the walker after {@code enterEveryRule}. */
    void enterRule(ParseTreeListener listener);

    /** Rule-specific hook called by the walker before {@code exitEveryRule}. */
    void exitRule(ParseTreeListener listener);
}
