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
package net.boyechko.parsetree.visitors;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.parsetree.TreeTestBase;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.ErrorNodeImpl;
import net.boyechko.parsetree.tree.TerminalNode;
import org.junit.jupiter.api.Test;

class FirstErrorVisitorTest extends TreeTestBase {

    @Test
    void findsFirstErrorInDocumentOrder() {
        ErrorNodeImpl first = err("!");
        ErrorNodeImpl second = err("?");

        var found = new FirstErrorVisitor().find(rule(0, term("x"), rule(1, first), second));

        assertSame(first, found.orElseThrow());
    }

    @Test
    void stopsVisitingOnceFound() {
        List<String> seen = new ArrayList<>();
        FirstErrorVisitor visitor =
                new FirstErrorVisitor() {
                    @Override
                    public ErrorNode visitTerminal(TerminalNode node) {
                        seen.add(node.getText());
                        return super.visitTerminal(node);
                    }
                };

        visitor.find(rule(0, term("x"), rule(1, term("y"), err("!"), term("z")), term("w")));

        assertEquals(List.of("x", "y"), seen);
    }

    @Test
    void cleanTreeHasNoError() {
        assertTrue(new FirstErrorVisitor().find(sampleTree()).isEmpty());
    }
}
