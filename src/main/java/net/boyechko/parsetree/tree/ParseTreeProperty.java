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

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Associates a value with parse tree nodes, keyed by node identity. Lets listeners pass results
 * between enter and exit callbacks without adding fields to the nodes.
 */
public class ParseTreeProperty<V> {
    private final Map<ParseTree, V> annotations = new IdentityHashMap<>();

    public V get(ParseTree node) {
        return annotations.get(node);
    }

    public void put(ParseTree node, V value) {
        annotations.put(node, value);
    }

    public V removeFrom(ParseTree node) {
        return annotations.remove(node);
    }

    public int size() {
        return annotations.size();
    }
}
