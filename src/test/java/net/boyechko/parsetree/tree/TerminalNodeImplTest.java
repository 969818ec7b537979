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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.parsetree.TreeTestBase;
import net.boyechko.parsetree.token.CommonToken;
import net.boyechko.parsetree.token.Interval;
import net.boyechko.parsetree.token.Token;
import net.boyechko.parsetree.visitor.AbstractParseTreeVisitor;
import org.junit.jupiter.api.Test;

class TerminalNodeImplTest extends TreeTestBase {

    @Test
    void sourceIntervalIsTheTokenIndex() {
        TerminalNodeImpl node = new TerminalNodeImpl(new CommonToken(ID, "x", 7));

        assertEquals(new Interval(7, 7), node.getSourceInterval());
    }

    @Test
    void missingTokenDegradesToInvalidInterval() {
        TerminalNodeImpl node = new TerminalNodeImpl(null);

        assertEquals(Interval.INVALID, node.getSourceInterval());
        assertEquals(-1, node.getSourceInterval().start());
        assertEquals(-2, node.getSourceInterval().stop());
        assertEquals("", node.getText());
        assertEquals("", node.toString());
        assertNull(node.getPayload());
    }

    @Test
    void unplacedTokenCoversIndexMinusOne() {
        TerminalNodeImpl node = new TerminalNodeImpl(looseToken("x"));

        assertEquals(new Interval(-1, -1), node.getSourceInterval());
    }

    @Test
    void eofRendersAsSentinelRegardlessOfText() {
        TerminalNodeImpl node = new TerminalNodeImpl(new CommonToken(Token.EOF, "raw-eof", 4));

        assertEquals("<EOF>", node.toString());
        assertEquals("<EOF>", node.toStringTree());
        assertEquals("raw-eof", node.getText());
    }

    @Test
    void terminalHasNoChildren() {
        TerminalNodeImpl node = term("x");

        assertEquals(0, node.getChildCount());
        assertTrue(node.getChildren().isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> node.getChild(0));
        assertThrows(IndexOutOfBoundsException.class, () -> node.getChild(-1));
    }

    @Test
    void settingChildrenOnTerminalFails() {
        TerminalNodeImpl node = term("x");

        assertThrows(TreeStructureException.class, () -> node.setChildren(List.of(term("y"))));
    }

    @Test
    void payloadIsTheToken() {
        CommonToken token = new CommonToken(ID, "x", 0);

        TerminalNodeImpl node = new TerminalNodeImpl(token);

        assertSame(token, node.getPayload());
        assertSame(token, node.getSymbol());
        assertEquals(NodeKind.TERMINAL, node.kind());
    }

    @Test
    void errorNodeIsTerminalWithErrorKind() {
        ErrorNodeImpl node = err("!");

        assertInstanceOf(TerminalNode.class, node);
        assertEquals(NodeKind.ERROR, node.kind());
        assertEquals(NodeKind.ERROR, NodeKind.classify(node));
        assertEquals("!", node.getText());
        assertEquals(0, node.getChildCount());
    }

    @Test
    void setParentIsIdempotentForSameParent() {
        TerminalNodeImpl node = term("x");
        TestRuleContext parent = rule(0, node);

        node.setParent(parent);

        assertSame(parent, node.getParent());
    }

    @Test
    void reattachingToAnotherParentFails() {
        TerminalNodeImpl node = term("x");
        rule(0, node);

        TestRuleContext other = rule(1);

        assertThrows(TreeStructureException.class, () -> other.addChild(node));
        assertEquals(0, other.getChildCount(), "Rejected child should not be added");
    }

    @Test
    void nullParentDetaches() {
        TerminalNodeImpl node = term("x");
        rule(0, node);

        node.setParent(null);

        assertNull(node.getParent());
        assertDoesNotThrow(() -> rule(1, node));
    }

    /** Names the visit method each leaf reaches. */
    private static final class KindNamingVisitor extends AbstractParseTreeVisitor<String> {
        @Override
        public String visitTerminal(TerminalNode node) {
            return "terminal";
        }

        @Override
        public String visitErrorNode(ErrorNode node) {
            return "error";
        }
    }

    /** An error node that reuses the plain terminal implementation. */
    private static final class RecoveredToken extends TerminalNodeImpl implements ErrorNode {
        RecoveredToken(Token token) {
            super(token);
        }
    }

    @Test
    void acceptRoutesLeavesByKind() {
        KindNamingVisitor visitor = new KindNamingVisitor();

        assertEquals("terminal", term("x").accept(visitor));
        assertEquals("error", err("!").accept(visitor));
    }

    @Test
    void errorNodeOutsideErrorNodeImplStillReachesVisitErrorNode() {
        KindNamingVisitor visitor = new KindNamingVisitor();
        RecoveredToken node = new RecoveredToken(new CommonToken(PUNCT, ";", 0));

        assertEquals(NodeKind.ERROR, node.kind());
        assertEquals("error", node.accept(visitor));
        assertEquals("error", visitor.visit(node), "accept and visit should agree");
    }

    @Test
    void classifyRejectsNodeThatIsNotParseTree() {
        Tree plain =
                new Tree() {
                    @Override
                    public Tree getParent() {
                        return null;
                    }

                    @Override
                    public Object getPayload() {
                        return null;
                    }

                    @Override
                    public Tree getChild(int i) {
                        throw new IndexOutOfBoundsException(i);
                    }

                    @Override
                    public int getChildCount() {
                        return 0;
                    }

                    @Override
                    public String toStringTree() {
                        return "plain";
                    }
                };

        assertThrows(TreeStructureException.class, () -> NodeKind.classify(plain));
        assertThrows(TreeStructureException.class, () -> NodeKind.classify(null));
    }
}
