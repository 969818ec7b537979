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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import net.boyechko.parsetree.context.ParserRuleContext;
import net.boyechko.parsetree.tree.ErrorNode;
import net.boyechko.parsetree.tree.TerminalNode;
import net.boyechko.parsetree.tree.Trees;
import net.boyechko.parsetree.walker.ParseTreeListener;
import org.slf4j.LoggerFactory;

/**
 * A {@link ParseTreeListener} that routes every traversal event through SLF4J. Rule and terminal
 * events are logged at DEBUG, error nodes at WARN.
 */
public class LoggingTreeListener implements ParseTreeListener {

    static final String LOGGER_NAME = "net.boyechko.parsetree.traversal";
    private static final String CONSOLE_APPENDER_NAME = "PARSETREE_CONSOLE";

    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    private final List<String> ruleNames;

    public LoggingTreeListener() {
        this(null);
    }

    /** @param ruleNames rule name table used to label rule nodes; may be null */
    public LoggingTreeListener(List<String> ruleNames) {
        this.ruleNames = ruleNames;
    }

    /** Creates a {@link LoggingTreeListener} and ensures its events are emitted to stdout. */
    public static LoggingTreeListener withConsoleOutput(List<String> ruleNames) {
        ensureConsoleAppender();
        return new LoggingTreeListener(ruleNames);
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger traversal = ctx.getLogger(LOGGER_NAME);

        if (traversal.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-5level %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        traversal.addAppender(console);
        traversal.setLevel(Level.DEBUG);
        traversal.setAdditive(false);
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
        logger.debug(
                "ENTER {} {}", Trees.getNodeText(ctx, ruleNames), ctx.getSourceInterval());
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        logger.debug("EXIT {} {}", Trees.getNodeText(ctx, ruleNames), ctx.getSourceInterval());
    }

    @Override
    public void visitTerminal(TerminalNode node) {
        logger.debug("TERMINAL '{}' {}", node, node.getSourceInterval());
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        logger.warn("ERROR '{}' {}", node, node.getSourceInterval());
    }
}
