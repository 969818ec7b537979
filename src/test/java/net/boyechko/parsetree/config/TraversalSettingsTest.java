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
package net.boyechko.parsetree.config;

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.parsetree.walker.IterativeParseTreeWalker;
import net.boyechko.parsetree.walker.ParseTreeWalker;
import org.junit.jupiter.api.Test;

class TraversalSettingsTest {

    @Test
    void defaultResourceSelectsRecursiveWalker() {
        TraversalSettings settings = TraversalSettings.loadDefault();

        assertEquals(WalkStrategy.RECURSIVE, settings.getStrategy());
        assertSame(ParseTreeWalker.DEFAULT, settings.walker());
        assertEquals("  ", settings.getIndent());
        assertEquals(5, settings.getIndexWidth());
        assertEquals(30, settings.getNodeWidth());
        assertEquals(10, settings.getIntervalWidth());
    }

    @Test
    void customResourceOverridesEveryField() {
        TraversalSettings settings = TraversalSettings.fromResource("/parsetree-iterative.yaml");

        assertEquals(WalkStrategy.ITERATIVE, settings.getStrategy());
        assertInstanceOf(IterativeParseTreeWalker.class, settings.walker());
        assertEquals("    ", settings.getIndent());
        assertEquals(3, settings.getIndexWidth());
        assertEquals(20, settings.getNodeWidth());
        assertEquals(8, settings.getIntervalWidth());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        TraversalSettings settings = TraversalSettings.fromResource("/parsetree-invalid.yaml");

        assertEquals(WalkStrategy.RECURSIVE, settings.getStrategy());
        assertEquals(5, settings.getIndexWidth());
        assertEquals(30, settings.getNodeWidth());
        assertEquals(10, settings.getIntervalWidth(), "Absent keys keep their defaults");
    }

    @Test
    void normalizeReportsEachReplacedValue() {
        TraversalSettings settings = TraversalSettings.defaults();
        settings.strategy = "sideways";
        settings.indent = null;
        settings.node_width = 0;

        assertEquals(3, settings.normalize().size());
        assertTrue(TraversalSettings.defaults().normalize().isEmpty());
    }

    @Test
    void missingResourceFails() {
        RuntimeException e =
                assertThrows(
                        RuntimeException.class,
                        () -> TraversalSettings.fromResource("/no-such-settings.yaml"));

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(e.getMessage().contains("/no-such-settings.yaml"));
    }

    @Test
    void strategyNamesAreCaseInsensitive() {
        assertEquals(WalkStrategy.ITERATIVE, WalkStrategy.fromName(" Iterative "));
        assertEquals(WalkStrategy.RECURSIVE, WalkStrategy.fromName("RECURSIVE"));
        assertThrows(IllegalArgumentException.class, () -> WalkStrategy.fromName("bfs"));
        assertThrows(IllegalArgumentException.class, () -> WalkStrategy.fromName(null));
    }
}
