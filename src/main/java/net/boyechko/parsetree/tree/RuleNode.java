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

import net.boyechko.parsetree.context.ParserRuleContext;
import net.boyechko.parsetree.context.RuleContext;

/** A parse tree node standing for one invocation of a grammar rule. */
public interface RuleNode extends ParseTree {

    /** Returns the per-invocation state of the rule as a generic capability. */
    RuleContext getRuleContext();

    /** Returns the same state as the concrete base type used for structural operations. */
    ParserRuleContext getBaseRuleContext();

    @Override
    default NodeKind kind() {
        return NodeKind.RULE;
    }
}
