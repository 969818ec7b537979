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
 * A token handed to the tree by the lexer. Only the parts the tree model needs are exposed here;
 * positional bookkeeping stays with the token stream that produced it.
 */
public interface Token {

    /** Token type of the end-of-file token. */
    int EOF = -1;

    /** Token type reserved for "no valid type". */
    int INVALID_TYPE = 0;

    int getType();

    String getText();

    /** Index of this token in its token stream, or -1 if it was never placed in a stream. */
    int getTokenIndex();
}
