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

/**
 * Closed range {@code [start, stop]} of token indices. A range with {@code start > stop} covers no
 * tokens; {@link #INVALID} is the canonical "no span" value.
 */
public record Interval(int start, int stop) {

    public static final Interval INVALID = new Interval(-1, -2);

    public static Interval of(int start, int stop) {
        if (start == INVALID.start && stop == INVALID.stop) {
            return INVALID;
        }
        return new Interval(start, stop);
    }

    /** Number of token indices covered, 0 for empty or inverted ranges. */
    public int length() {
        if (stop < start) return 0;
        return stop - start + 1;
    }

    public boolean isEmpty() {
        return stop < start;
    }

    public boolean contains(int index) {
        return index >= start && index <= stop;
    }

    /** Returns true if this range lies entirely within {@code other}. */
    public boolean within(Interval other) {
        return !isEmpty() && start >= other.start && stop <= other.stop;
    }

    /** Smallest range covering both this and {@code other}. An empty operand contributes nothing. */
    public Interval union(Interval other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        return Interval.of(Math.min(start, other.start), Math.max(stop, other.stop));
    }

    @Override
    public String toString() {
        return start + ".." + stop;
    }
}
