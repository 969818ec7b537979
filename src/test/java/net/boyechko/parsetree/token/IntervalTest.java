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
package net.boyechko.parsetree.token;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class IntervalTest {

    @Test
    void invalidIntervalIsEmptySentinel() {
        assertEquals(-1, Interval.INVALID.start());
        assertEquals(-2, Interval.INVALID.stop());
        assertTrue(Interval.INVALID.isEmpty());
        assertEquals(0, Interval.INVALID.length());
        assertSame(Interval.INVALID, Interval.of(-1, -2));
    }

    @Test
    void closedRangeCountsBothEnds() {
        Interval interval = Interval.of(3, 5);

        assertEquals(3, interval.length());
        assertTrue(interval.contains(3));
        assertTrue(interval.contains(5));
        assertFalse(interval.contains(6));
        assertEquals("3..5", interval.toString());
    }

    @Test
    void withinRequiresFullContainment() {
        Interval outer = Interval.of(0, 10);

        assertTrue(Interval.of(2, 4).within(outer));
        assertTrue(outer.within(outer));
        assertFalse(Interval.of(5, 11).within(outer));
        assertFalse(Interval.INVALID.within(outer), "Empty ranges lie within nothing");
    }

    @Test
    void unionCoversBoth() {
        assertEquals(Interval.of(1, 9), Interval.of(1, 3).union(Interval.of(7, 9)));
    }

    @Test
    void unionIgnoresEmptyOperands() {
        Interval tokens = Interval.of(3, 5);

        assertEquals(tokens, Interval.INVALID.union(tokens));
        assertEquals(tokens, tokens.union(Interval.INVALID));
        assertEquals(tokens, tokens.union(Interval.of(8, 7)));
        assertTrue(Interval.INVALID.union(Interval.INVALID).isEmpty());
    }
}
