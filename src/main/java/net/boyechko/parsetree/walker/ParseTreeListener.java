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
import net.boyechko.parsetree.tree.TerminalNode;

/**
 * Push-style consumer of a parse tree. Only a {@link ParseTreeWalker} calls these methods; a
 * listener never drives traversal itself.
 */
public interface ParseTreeListener {

    void visitTerminal(TerminalNode node);

    void visitErrorNode(ErrorNode node);

    /** Called on entering any rule node, before the context's rule-specific enter hook. */
    void enterEveryRule(ParserRuleContext ctx);

    /** Called on leaving any rule node, after the context's rule-specific exit hook. */
    void exitEveryRule(ParserRuleContext ctx);
}
