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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.rusthighlight.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Unit tests for {@link HighlightConfigParser}: option parsing, type checks
 * and log level changes.
 */
class HighlightConfigParserTests {

	private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
	private final Level initialLevel = root.getLevel();

	@AfterEach
	void restoreLogLevel() {
		root.setLevel(initialLevel);
	}

	private static JsonObject json(String text) {
		return JsonParser.parseString(text).getAsJsonObject();
	}

	// ------------------------------------------------------------------
	// defaults
	// ------------------------------------------------------------------

	@Test
	void testNullGivesDefaults() {
		Assertions.assertEquals(HighlightConfig.defaults(), HighlightConfigParser.parse(null));
	}

	@Test
	void testNonObjectGivesDefaults() {
		Assertions.assertEquals(HighlightConfig.defaults(), HighlightConfigParser.parse("semanticHighlighting"));
		Assertions.assertEquals(HighlightConfig.defaults(),
				HighlightConfigParser.parse(JsonParser.parseString("[true]")));
	}

	@Test
	void testEmptyObjectGivesDefaults() {
		HighlightConfig config = HighlightConfigParser.parse(new JsonObject());
		Assertions.assertEquals(HighlightConfig.defaults(), config);
		Assertions.assertTrue(config.isSemanticHighlighting());
		Assertions.assertFalse(config.isSyntacticNameRefHighlighting());
		Assertions.assertTrue(config.isInjectDocTests());
		Assertions.assertEquals("ra_fixture", config.getFixturePrefix());
		Assertions.assertEquals(Arrays.asList("format_args", "format_args_nl"), config.getFormatMacros());
		Assertions.assertNull(config.getLogLevel());
	}

	// ------------------------------------------------------------------
	// options
	// ------------------------------------------------------------------

	@Test
	void testAllOptions() {
		HighlightConfig config = HighlightConfigParser.parse(json("{"
				+ "\"semanticHighlighting\": false,"
				+ "\"syntacticNameRefHighlighting\": true,"
				+ "\"injectDocTests\": false,"
				+ "\"fixturePrefix\": \"fixture\","
				+ "\"formatMacros\": [\"format_args\", \" my_format \"]"
				+ "}"));

		Assertions.assertFalse(config.isSemanticHighlighting());
		Assertions.assertTrue(config.isSyntacticNameRefHighlighting());
		Assertions.assertFalse(config.isInjectDocTests());
		Assertions.assertEquals("fixture", config.getFixturePrefix());
		Assertions.assertEquals(Arrays.asList("format_args", "my_format"), config.getFormatMacros());
	}

	@Test
	void testWrongTypesAreIgnored() {
		HighlightConfig config = HighlightConfigParser.parse(json("{"
				+ "\"semanticHighlighting\": \"no\","
				+ "\"injectDocTests\": {},"
				+ "\"fixturePrefix\": 3,"
				+ "\"formatMacros\": \"format_args\""
				+ "}"));
		Assertions.assertEquals(HighlightConfig.defaults(), config);
	}

	@Test
	void testEmptyFixturePrefixKeepsDefault() {
		HighlightConfig config = HighlightConfigParser.parse(json("{\"fixturePrefix\": \"\"}"));
		Assertions.assertEquals(HighlightConfig.DEFAULT_FIXTURE_PREFIX, config.getFixturePrefix());
	}

	@Test
	void testFormatMacrosSkipsBlankAndNonStringEntries() {
		HighlightConfig config = HighlightConfigParser.parse(json("{\"formatMacros\": [\"\", 1, null, \"fmt\"]}"));
		Assertions.assertEquals(Arrays.asList("fmt"), config.getFormatMacros());
	}

	@Test
	void testEmptyFormatMacrosKeepsDefault() {
		HighlightConfig config = HighlightConfigParser.parse(json("{\"formatMacros\": [\" \"]}"));
		Assertions.assertEquals(HighlightConfig.DEFAULT_FORMAT_MACROS, config.getFormatMacros());
	}

	// ------------------------------------------------------------------
	// log level
	// ------------------------------------------------------------------

	@Test
	void testLogLevelOptionChangesRootLevel() {
		HighlightConfig config = HighlightConfigParser.parse(json("{\"logLevel\": \"debug\"}"));
		Assertions.assertEquals("debug", config.getLogLevel());
		Assertions.assertEquals(Level.DEBUG, root.getLevel());
	}

	@Test
	void testUnknownLogLevelIsIgnored() {
		root.setLevel(Level.WARN);
		Assertions.assertFalse(HighlightConfigParser.applyLogLevel("NOT_A_LEVEL"));
		Assertions.assertEquals(Level.WARN, root.getLevel());
	}

	@Test
	void testApplyLogLevel() {
		Assertions.assertTrue(HighlightConfigParser.applyLogLevel("ERROR"));
		Assertions.assertEquals(Level.ERROR, root.getLevel());
	}

	// ------------------------------------------------------------------
	// builder
	// ------------------------------------------------------------------

	@Test
	void testToBuilderRoundTrip() {
		HighlightConfig config = HighlightConfig.builder()
				.syntacticNameRefHighlighting(true)
				.fixturePrefix("fx")
				.logLevel("INFO")
				.build();
		Assertions.assertEquals(config, config.toBuilder().build());
		Assertions.assertNotEquals(config, config.toBuilder().injectDocTests(false).build());
	}

	@Test
	void testFormatMacrosAreCopied() {
		List<String> macros = new ArrayList<>(Arrays.asList("a"));
		HighlightConfig config = HighlightConfig.builder().formatMacros(macros).build();
		macros.add("b");
		Assertions.assertEquals(Arrays.asList("a"), config.getFormatMacros());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> config.getFormatMacros().add("c"));
	}
}
