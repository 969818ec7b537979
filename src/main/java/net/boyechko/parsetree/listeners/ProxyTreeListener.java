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
package net.boyechko.parsetree.listeners;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.parsetree.context.ParserRuleContext;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.TerminalNode;
import net.boyechko.parsetree.walker.ParseTreeListener;

/** Forwards every callback to several listeners, in the order they were added. */
public class ProxyTreeListener implements ParseTreeListener {
    private final List<ParseTreeListener> listeners = new ArrayList<>();

    public ProxyTreeListener addListener(ParseTreeListener listener) {
        listeners.add(listener);
        return this;
    }

    public List<ParseTreeListener> getListeners() {
        return Collections.unmodifiableList(listeners);
    }

    @Override
    public void visitTerminal(TerminalNode node) {
        for (ParseTreeListener listener : listeners) {
            listener.visitTerminal(node);
        }
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        for (ParseTreeListener listener : listeners) {
            listener.visitErrorNode(node);
        }
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
        for (ParseTreeListener listener : listeners) {
            listener.enterEveryRule(ctx);
        }
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        for (ParseTreeListener listener : listeners) {
            listener.exitEveryRule(ctx);
        }
    }
}
