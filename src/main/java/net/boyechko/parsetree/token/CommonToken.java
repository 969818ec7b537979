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

/** Immutable {@link Token} carrying a type, its matched text, and its stream index. */
public record CommonToken(int type, String text, int tokenIndex) implements Token {

    /** Creates a token that has not been placed in a token stream. */
    public CommonToken(int type, String text) {
        this(type, text, -1);
    }

    /** Creates the end-of-file token at the given stream index. */
    public static CommonToken eof(int tokenIndex) {
        return new CommonToken(EOF, "<EOF>", tokenIndex);
    }

    @Override
    public int getType() {
        return type;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public int getTokenIndex() {
        return tokenIndex;
    }

    @Override
    public String toString() {
        return "[@" + tokenIndex + ",'" + text + "'<" + type + ">]";
    }
}
