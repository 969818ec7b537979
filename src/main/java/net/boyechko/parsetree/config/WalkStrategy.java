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

import java.util.Locale;
import net.boyechko.parsetree.walker.IterativeParseTreeWalker;
import net.boyechko.parsetree.walker.ParseTreeWalker;

/** How a {@link ParseTreeWalker} keeps track of its position in the tree. */
public enum WalkStrategy {
    /** Native recursion; fastest, but depth is bounded by the thread stack. */
    RECURSIVE,

    /** Explicit heap stacks; safe for arbitrarily deep trees. */
    ITERATIVE;

    public ParseTreeWalker newWalker() {
        return switch (this) {
            case RECURSIVE -> ParseTreeWalker.DEFAULT;
            case ITERATIVE -> new IterativeParseTreeWalker();
        };
    }

    /**
     * Parses a strategy name case-insensitively.
     *
     * @throws IllegalArgumentException if the name matches no strategy
     */
    public static WalkStrategy fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Walk strategy name is null");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
