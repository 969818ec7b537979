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

import java.util.ArrayList;
import java.util.List;

/**
 * The most abstract notion of a tree: a parent, a payload, and an ordered list of children.
 *
 * <p>Child indices must lie in {@code [0, getChildCount())}. Implementations in this library throw
 * {@link IndexOutOfBoundsException} for anything else.
 */
public interface Tree {

    /** Returns the parent of this node, or null if this node is a root or is detached. */
    Tree getParent();

    /** Returns whatever object this node represents: a token for leaves, a context for rules. */
    Object getPayload();

    Tree getChild(int i);

    int getChildCount();

    /** Returns a snapshot of this node's children in left-to-right order. */
    default List<? extends Tree> getChildren() {
        List<Tree> children = new ArrayList<>(getChildCount());
        for (int i = 0; i < getChildCount(); i++) {
            children.add(getChild(i));
        }
        return children;
    }

    /** Renders this subtree in LISP form without rule names. */
    String toStringTree();
}
