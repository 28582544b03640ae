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
package com.tomaszrup.rusthighlight.syntax;

import static com.tomaszrup.rusthighlight.TreeFixtures.build;
import static com.tomaszrup.rusthighlight.TreeFixtures.node;
import static com.tomaszrup.rusthighlight.TreeFixtures.token;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FormatSpecifierLexer}: placeholder pieces reported
 * for typical format strings, escaped braces and malformed placeholders.
 */
class FormatSpecifierLexerTests {

	/**
	 * Lexes the string literal {@code text} and describes each reported piece
	 * as {@code SPECIFIER:source text}.
	 */
	private static List<String> lex(String text) {
		SyntaxNode root = build(node(SyntaxKind.SOURCE_FILE, token(SyntaxKind.STRING, text)));
		StringLiteral string = StringLiteral.cast(root.firstToken());
		List<String> result = new ArrayList<>();
		byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
		FormatSpecifierLexer.lex(string.pieces(), (range, specifier) -> result.add(specifier + ":"
				+ new String(bytes, range.getStart(), range.getLength(), StandardCharsets.UTF_8)));
		return result;
	}

	@Test
	void testPlainTextReportsNothing() {
		Assertions.assertEquals(Collections.emptyList(), lex("\"hello world\""));
	}

	@Test
	void testEmptyPlaceholder() {
		Assertions.assertEquals(Arrays.asList("OPEN:{", "CLOSE:}"), lex("\"a {} b\""));
	}

	@Test
	void testEscapedBracesAreSkipped() {
		Assertions.assertEquals(Arrays.asList("OPEN:{", "CLOSE:}"), lex("\"{{x}} {}\""));
	}

	@Test
	void testPositionalAndNamedArguments() {
		Assertions.assertEquals(Arrays.asList("OPEN:{", "INTEGER:12", "CLOSE:}"), lex("\"{12}\""));
		Assertions.assertEquals(Arrays.asList("OPEN:{", "IDENTIFIER:name", "CLOSE:}"), lex("\"{name}\""));
	}

	@Test
	void testAlignWidthPrecision() {
		Assertions.assertEquals(Arrays.asList(
				"OPEN:{", "IDENTIFIER:x", "COLON::", "ALIGN:>", "INTEGER:8", "DOT:.", "INTEGER:2", "CLOSE:}"),
				lex("\"{x:>8.2}\""));
	}

	@Test
	void testFillSignAlternateZero() {
		Assertions.assertEquals(Arrays.asList(
				"OPEN:{", "COLON::", "FILL:*", "ALIGN:^", "SIGN:+", "NUMBER_SIGN:#", "ZERO:0", "INTEGER:5",
				"CLOSE:}"),
				lex("\"{:*^+#05}\""));
	}

	@Test
	void testWidthAndPrecisionArguments() {
		Assertions.assertEquals(Arrays.asList(
				"OPEN:{", "COLON::", "INTEGER:1", "DOLLAR_SIGN:$", "DOT:.", "ASTERISK:*", "CLOSE:}"),
				lex("\"{:1$.*}\""));
		Assertions.assertEquals(Arrays.asList(
				"OPEN:{", "COLON::", "IDENTIFIER:width", "DOLLAR_SIGN:$", "CLOSE:}"),
				lex("\"{:width$}\""));
	}

	@Test
	void testDebugAndTypeSpecifiers() {
		Assertions.assertEquals(Arrays.asList("OPEN:{", "COLON::", "QUESTION_MARK:?", "CLOSE:}"), lex("\"{:?}\""));
		Assertions.assertEquals(Arrays.asList("OPEN:{", "COLON::", "IDENTIFIER:x", "CLOSE:}"), lex("\"{:x}\""));
		Assertions.assertEquals(Arrays.asList(
				"OPEN:{", "COLON::", "NUMBER_SIGN:#", "IDENTIFIER:x", "QUESTION_MARK:?", "CLOSE:}"),
				lex("\"{:#x?}\""));
	}

	@Test
	void testUnterminatedPlaceholderStops() {
		Assertions.assertEquals(Arrays.asList("OPEN:{", "IDENTIFIER:x"), lex("\"{x\""));
	}

	@Test
	void testRangesUseSourceBytesAfterEscapes() {
		// ranges point into the source, past the two-byte escape
		Assertions.assertEquals(Arrays.asList("OPEN:{", "CLOSE:}"), lex("\"\\n{}\""));
	}
}
