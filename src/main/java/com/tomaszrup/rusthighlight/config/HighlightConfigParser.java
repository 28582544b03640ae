////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.rusthighlight.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parses highlighting options from the {@code initializationOptions} JSON
 * object of an LSP client. Options with the wrong JSON type are ignored and
 * keep their defaults.
 */
public final class HighlightConfigParser {

    private static final Logger logger = LoggerFactory.getLogger(HighlightConfigParser.class);

    private static final String SEMANTIC_HIGHLIGHTING_OPTION = "semanticHighlighting";
    private static final String SYNTACTIC_NAME_REF_OPTION = "syntacticNameRefHighlighting";
    private static final String INJECT_DOC_TESTS_OPTION = "injectDocTests";
    private static final String FIXTURE_PREFIX_OPTION = "fixturePrefix";
    private static final String FORMAT_MACROS_OPTION = "formatMacros";
    private static final String LOG_LEVEL_OPTION = "logLevel";

    /**
     * Parse the options and apply the log level, if one is given.
     *
     * @return the parsed configuration; {@link HighlightConfig#defaults()} if
     *         the input is not a {@link JsonObject}
     */
    public static HighlightConfig parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return HighlightConfig.defaults();
        }
        JsonObject opts = (JsonObject) initOptions;
        HighlightConfig.Builder builder = HighlightConfig.builder();

        Boolean semantic = booleanOption(opts, SEMANTIC_HIGHLIGHTING_OPTION);
        if (semantic != null) {
            builder.semanticHighlighting(semantic);
        }
        Boolean syntactic = booleanOption(opts, SYNTACTIC_NAME_REF_OPTION);
        if (syntactic != null) {
            builder.syntacticNameRefHighlighting(syntactic);
        }
        Boolean docTests = booleanOption(opts, INJECT_DOC_TESTS_OPTION);
        if (docTests != null) {
            builder.injectDocTests(docTests);
        }
        String fixturePrefix = stringOption(opts, FIXTURE_PREFIX_OPTION);
        if (fixturePrefix != null && !fixturePrefix.isEmpty()) {
            builder.fixturePrefix(fixturePrefix);
        }
        List<String> formatMacros = parseFormatMacrosOption(opts);
        if (formatMacros != null) {
            builder.formatMacros(formatMacros);
        }
        String logLevel = stringOption(opts, LOG_LEVEL_OPTION);
        if (logLevel != null) {
            builder.logLevel(logLevel);
            applyLogLevel(logLevel);
        }

        HighlightConfig config = builder.build();
        logger.debug("Parsed highlight configuration: {}", config);
        return config;
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     *
     * @return whether the level was changed
     */
    public static boolean applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return false;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
            return false;
        }
    }

    private static Boolean booleanOption(JsonObject opts, String name) {
        JsonPrimitive value = primitive(opts, name);
        if (value == null) {
            return null;
        }
        if (!value.isBoolean()) {
            logger.warn("Ignoring option {}: expected a boolean, got {}", name, value);
            return null;
        }
        return value.getAsBoolean();
    }

    private static String stringOption(JsonObject opts, String name) {
        JsonPrimitive value = primitive(opts, name);
        if (value == null) {
            return null;
        }
        if (!value.isString()) {
            logger.warn("Ignoring option {}: expected a string, got {}", name, value);
            return null;
        }
        return value.getAsString();
    }

    private static JsonPrimitive primitive(JsonObject opts, String name) {
        if (!opts.has(name)) {
            return null;
        }
        JsonElement element = opts.get(name);
        if (!element.isJsonPrimitive()) {
            logger.warn("Ignoring option {}: expected a primitive value", name);
            return null;
        }
        return element.getAsJsonPrimitive();
    }

    private static List<String> parseFormatMacrosOption(JsonObject opts) {
        if (!opts.has(FORMAT_MACROS_OPTION) || !opts.get(FORMAT_MACROS_OPTION).isJsonArray()) {
            return null;
        }
        JsonArray arr = opts.getAsJsonArray(FORMAT_MACROS_OPTION);
        List<String> macros = new ArrayList<>();
        for (JsonElement el : arr) {
            if (el.isJsonPrimitive() && el.getAsJsonPrimitive().isString()) {
                String name = el.getAsString().trim();
                if (!name.isEmpty()) {
                    macros.add(name);
                }
            }
        }
        if (macros.isEmpty()) {
            return null;
        }
        logger.info("Format macros: {}", macros);
        return Collections.unmodifiableList(macros);
    }

    private HighlightConfigParser() {
        // utility class
    }
}
