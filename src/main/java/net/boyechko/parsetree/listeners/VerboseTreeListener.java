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
package net.boyechko.parsetree.listeners;

import java.util.List;
import java.util.function.Consumer;
import net.boyechko.parsetree.config.TraversalSettings;
import net.boyechko.parsetree.context.ParserRuleContext;
import net.boyechko.parsetree.token.Interval;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.ParseTree;
import net.boyechko.parsetree.tree.TerminalNode;
import net.boyechko.parsetree.tree.Trees;
import net.boyechko.parsetree.walker.BaseParseTreeListener;

/** Outputs a tabular listing of the parse tree during traversal, one row per node. */
public class VerboseTreeListener extends BaseParseTreeListener {

    private final Consumer<String> output;
    private final List<String> ruleNames;
    private final String indent;
    private final int indexWidth;
    private final int nodeWidth;
    private final int intervalWidth;
    private final String rowFormat;

    private boolean headerPrinted = false;
    private int globalIndex = 0;
    private int depth = 0;

    public VerboseTreeListener(Consumer<String> output, List<String> ruleNames) {
        this(output, ruleNames, TraversalSettings.defaults());
    }

    public VerboseTreeListener(
            Consumer<String> output, List<String> ruleNames, TraversalSettings settings) {
        this.output = output;
        this.ruleNames = ruleNames;
        this.indent = settings.getIndent();
        this.indexWidth = settings.getIndexWidth();
        this.nodeWidth = settings.getNodeWidth();
        this.intervalWidth = settings.getIntervalWidth();
        this.rowFormat =
                String.format(
                        "%%-%ds %%-%ds %%-%ds %%s%%n", indexWidth, nodeWidth, intervalWidth);
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
        printRow(ctx, "- " + Trees.getNodeText(ctx, ruleNames), "");
        depth++;
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        depth--;
    }

    @Override
    public void visitTerminal(TerminalNode node) {
        printRow(node, "'" + node + "'", "");
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        printRow(node, "'" + node + "'", "error recovery");
    }

    private void printHeader() {
        if (headerPrinted) return;
        headerPrinted = true;

        output.accept(String.format(rowFormat, "Index", "Node", "Tokens", "Note"));
        output.accept(
                String.format(
                        rowFormat,
                        "-".repeat(indexWidth),
                        "-".repeat(nodeWidth),
                        "-".repeat(intervalWidth),
                        "-".repeat(4)));
    }

    private void printRow(ParseTree node, String label, String note) {
        printHeader();
        globalIndex++;

        String paddedIndex = String.format("%" + indexWidth + "d", globalIndex);
        String nodeName = Trees.escapeWhitespace(indent.repeat(depth) + label);
        Interval interval = node.getSourceInterval();
        String tokens = interval.equals(Interval.INVALID) ? "" : interval.toString();

        output.accept(String.format(rowFormat, paddedIndex, nodeName, tokens, note));
    }
}
