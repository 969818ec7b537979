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

import java.util.ArrayDeque;
import java.util.Deque;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.NodeKind;
import net.boyechko.parsetree.tree.ParseTree;
import net.boyechko.parsetree.tree.RuleNode;
import net.boyechko.parsetree.tree.TerminalNode;

/**
 * A {@link ParseTreeWalker} that keeps its position on heap stacks instead of the call stack, so
 * deeply nested input cannot overflow the thread stack. Notification order is identical to the
 * recursive walker.
 */
public class IterativeParseTreeWalker extends ParseTreeWalker {

    @Override
    public void walk(ParseTreeListener listener, ParseTree t) {
        Deque<ParseTree> nodeStack = new ArrayDeque<>();
        Deque<Integer> indexStack = new ArrayDeque<>();

        ParseTree current = t;
        int currentIndex = 0;

        while (current != null) {
            // pre-order
            NodeKind kind = classify(current);
            if (kind == NodeKind.ERROR) {
                listener.visitErrorNode((ErrorNode) current);
            } else if (kind == NodeKind.TERMINAL) {
                listener.visitTerminal((TerminalNode) current);
            } else {
                enterRule(listener, (RuleNode) current);
            }

            if (kind == NodeKind.RULE && current.getChildCount() > 0) {
                nodeStack.push(current);
                indexStack.push(currentIndex);
                currentIndex = 0;
                current = current.getChild(0);
                continue;
            }

            // No children: climb until a next sibling exists, exiting rules on the way up.
            do {
                if (current.kind() == NodeKind.RULE) {
                    exitRule(listener, (RuleNode) current);
                }

                if (nodeStack.isEmpty()) {
                    current = null;
                    break;
                }

                ParseTree parent = nodeStack.peek();
                currentIndex++;
                if (currentIndex < parent.getChildCount()) {
                    current = parent.getChild(currentIndex);
                    break;
                }

                current = nodeStack.pop();
                currentIndex = indexStack.pop();
            } while (current != null);
        }
    }
}
