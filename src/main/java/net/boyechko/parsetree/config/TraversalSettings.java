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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.parsetree.walker.ParseTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Traversal defaults: which walker to use and how tree listings are laid out. Field names match
 * the keys of the YAML resource they are loaded from.
 */
public final class TraversalSettings {
    private static final String DEFAULT_SETTINGS_RESOURCE = "/parsetree-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(TraversalSettings.class);

    private static final String DEFAULT_STRATEGY = "recursive";
    private static final String DEFAULT_INDENT = "  ";
    private static final int DEFAULT_INDEX_WIDTH = 5;
    private static final int DEFAULT_NODE_WIDTH = 30;
    private static final int DEFAULT_INTERVAL_WIDTH = 10;

    public String strategy = DEFAULT_STRATEGY;
    public String indent = DEFAULT_INDENT;
    public Integer index_width = DEFAULT_INDEX_WIDTH;
    public Integer node_width = DEFAULT_NODE_WIDTH;
    public Integer interval_width = DEFAULT_INTERVAL_WIDTH;

    /** Settings with every field at its built-in default. */
    public static TraversalSettings defaults() {
        return new TraversalSettings();
    }

    /**
     * Load settings from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static TraversalSettings fromResource(String resourcePath) {
        try (var inputStream = TraversalSettings.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(TraversalSettings.class, new LoaderOptions()));
            TraversalSettings settings = yaml.load(inputStream);
            if (settings == null) {
                logger.debug("Settings resource {} is empty; using defaults", resourcePath);
                return defaults();
            }

            List<String> warnings = settings.normalize();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Settings loaded from {} have {} invalid values:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }

            logger.debug("Loaded traversal settings from {}: {}", resourcePath, settings);
            return settings;
        } catch (Exception e) {
            logger.error(
                    "Failed to load traversal settings from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load settings from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load default settings from standard location */
    public static TraversalSettings loadDefault() {
        return fromResource(DEFAULT_SETTINGS_RESOURCE);
    }

    /**
     * Replaces invalid values with their defaults.
     *
     * @return one message per value that was replaced (empty if all values were valid)
     */
    List<String> normalize() {
        List<String> warnings = new ArrayList<>();

        try {
            WalkStrategy.fromName(strategy);
        } catch (IllegalArgumentException e) {
            warnings.add(
                    String.format(
                            "Unknown strategy '%s', using '%s'", strategy, DEFAULT_STRATEGY));
            strategy = DEFAULT_STRATEGY;
        }

        if (indent == null) {
            warnings.add("Missing indent, using two spaces");
            indent = DEFAULT_INDENT;
        }

        index_width = positiveOrDefault("index_width", index_width, DEFAULT_INDEX_WIDTH, warnings);
        node_width = positiveOrDefault("node_width", node_width, DEFAULT_NODE_WIDTH, warnings);
        interval_width =
                positiveOrDefault(
                        "interval_width", interval_width, DEFAULT_INTERVAL_WIDTH, warnings);

        return warnings;
    }

    private static Integer positiveOrDefault(
            String key, Integer value, int fallback, List<String> warnings) {
        if (value == null || value <= 0) {
            warnings.add(String.format("%s=%s is not positive, using %d", key, value, fallback));
            return fallback;
        }
        return value;
    }

    public WalkStrategy getStrategy() {
        return WalkStrategy.fromName(strategy);
    }

    /** Returns a walker for the configured strategy. */
    public ParseTreeWalker walker() {
        return getStrategy().newWalker();
    }

    public String getIndent() {
        return indent;
    }

    public int getIndexWidth() {
        return index_width;
    }

    public int getNodeWidth() {
        return node_width;
    }

    public int getIntervalWidth() {
        return interval_width;
    }

    @Override
    public String toString() {
        return "strategy="
                + strategy
                + ", index_width="
                + index_width
                + ", node_width="
                + node_width
                + ", interval_width="
                + interval_width;
    }
}
