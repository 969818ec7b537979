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
package net.boyechko.parsetree;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.parsetree.context.ParserRuleContext;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.TerminalNode;
import net.boyechko.parsetree.tree.Trees;
import net.boyechko.parsetree.walker.ParseTreeListener;

/** Records every listener callback as a short string, e.g. {@code "enterEveryRule a"}. */
public class RecordingListener implements ParseTreeListener {
    private final List<String> events = new ArrayList<>();
    private final boolean recordRuleHooks;

    public RecordingListener() {
        this(false);
    }

    /** @param recordRuleHooks also record the contexts' rule-specific enter and exit hooks */
    public RecordingListener(boolean recordRuleHooks) {
        this.recordRuleHooks = recordRuleHooks;
    }

    public List<String> events() {
        return events;
    }

    void ruleHook(String hook, ParserRuleContext ctx) {
        if (recordRuleHooks) {
            events.add(hook + " " + name(ctx));
        }
    }

    @Override
    public void visitTerminal(TerminalNode node) {
        events.add("visitTerminal " + node);
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        events.add("visitErrorNode " + node);
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
        events.add("enterEveryRule " + name(ctx));
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        events.add("exitEveryRule " + name(ctx));
    }

    private static String name(ParserRuleContext ctx) {
        return Trees.getNodeText(ctx, TreeTestBase.RULE_NAMES);
    }
}
