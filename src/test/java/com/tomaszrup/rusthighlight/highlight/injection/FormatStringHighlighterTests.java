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
package com.tomaszrup.rusthighlight.highlight.injection;

import static com.tomaszrup.rusthighlight.TreeFixtures.build;
import static com.tomaszrup.rusthighlight.TreeFixtures.ident;
import static com.tomaszrup.rusthighlight.TreeFixtures.node;
import static com.tomaszrup.rusthighlight.TreeFixtures.nameRef;
import static com.tomaszrup.rusthighlight.TreeFixtures.path;
import static com.tomaszrup.rusthighlight.TreeFixtures.token;
import static com.tomaszrup.rusthighlight.TreeFixtures.ws;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.rusthighlight.TreeFixtures;
import com.tomaszrup.rusthighlight.TreeFixtures.Shape;
import com.tomaszrup.rusthighlight.highlight.Highlight;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.highlight.HighlightedRange;
import com.tomaszrup.rusthighlight.highlight.HighlightedRangeStack;
import com.tomaszrup.rusthighlight.syntax.FormatSpecifier;
import com.tomaszrup.rusthighlight.syntax.StringLiteral;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;
import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * Unit tests for {@link FormatStringHighlighter}: recognizing the format
 * string of a formatting macro and highlighting its placeholders.
 */
class FormatStringHighlighterTests {

	private static final List<String> MACROS = Arrays.asList("format_args", "format_args_nl");

	/** {@code <name>!(<args>)} */
	private static SyntaxNode macroCall(Shape path, Shape... args) {
		Shape[] children = new Shape[args.length + 2];
		children[0] = token(SyntaxKind.L_PAREN);
		System.arraycopy(args, 0, children, 1, args.length);
		children[args.length + 1] = token(SyntaxKind.R_PAREN);
		return build(node(SyntaxKind.MACRO_CALL, path, token(SyntaxKind.BANG), node(SyntaxKind.TOKEN_TREE, children)));
	}

	private static List<HighlightedRange> highlight(FormatStringHighlighter highlighter, SyntaxNode macroCall,
			SyntaxToken string) {
		HighlightedRangeStack stack = new HighlightedRangeStack();
		stack.push();
		stack.add(new HighlightedRange(string.getTextRange(), Highlight.of(HighlightTag.STRING_LITERAL)));
		highlighter.checkForFormatString(macroCall.firstChild(SyntaxKind.TOKEN_TREE));
		highlighter.highlightFormatString(stack, StringLiteral.cast(string), string.getTextRange());
		stack.pop();
		return stack.flattened();
	}

	private static SyntaxToken stringOf(SyntaxNode macroCall) {
		return macroCall.firstChild(SyntaxKind.TOKEN_TREE).firstChildToken(SyntaxKind.STRING);
	}

	@Test
	void testPlaceholdersOfFormatString() {
		// format_args!("{0:>w$}")
		SyntaxNode call = macroCall(path("format_args"), token(SyntaxKind.STRING, "\"{0:>w$}\""));

		List<HighlightedRange> ranges = highlight(new FormatStringHighlighter(MACROS), call, stringOf(call));

		List<HighlightTag> tags = new ArrayList<>();
		for (HighlightedRange range : ranges) {
			tags.add(range.getHighlight().getTag());
		}
		// " { 0 : > w $ } "
		Assertions.assertEquals(Arrays.asList(
				HighlightTag.STRING_LITERAL,
				HighlightTag.FORMAT_SPECIFIER,
				HighlightTag.NUMERIC_LITERAL,
				HighlightTag.FORMAT_SPECIFIER,
				HighlightTag.FORMAT_SPECIFIER,
				HighlightTag.LOCAL,
				HighlightTag.FORMAT_SPECIFIER,
				HighlightTag.FORMAT_SPECIFIER,
				HighlightTag.STRING_LITERAL), tags);
		Assertions.assertEquals(TextRange.of(18, 19), ranges.get(5).getRange());
	}

	@Test
	void testOtherMacroIsIgnored() {
		SyntaxNode call = macroCall(path("concat"), token(SyntaxKind.STRING, "\"{}\""));
		SyntaxToken string = stringOf(call);
		List<HighlightedRange> ranges = highlight(new FormatStringHighlighter(MACROS), call, string);
		Assertions.assertEquals(Collections.singletonList(
				new HighlightedRange(string.getTextRange(), Highlight.of(HighlightTag.STRING_LITERAL))), ranges);
	}

	@Test
	void testConfiguredMacro() {
		SyntaxNode call = macroCall(path("concat"), token(SyntaxKind.STRING, "\"{}\""));
		List<HighlightedRange> ranges =
				highlight(new FormatStringHighlighter(Arrays.asList("concat")), call, stringOf(call));
		Assertions.assertEquals(4, ranges.size());
	}

	@Test
	void testOnlyFirstArgumentIsFormatString() {
		// format_args!(x, "{}")
		SyntaxNode call = macroCall(path("format_args"),
				ident("x"), token(SyntaxKind.COMMA), ws(), token(SyntaxKind.STRING, "\"{}\""));
		List<HighlightedRange> ranges = highlight(new FormatStringHighlighter(MACROS), call, stringOf(call));
		Assertions.assertEquals(1, ranges.size());
	}

	@Test
	void testResetForgetsFormatString() {
		SyntaxNode call = macroCall(path("format_args"), token(SyntaxKind.STRING, "\"{}\""));
		SyntaxToken string = stringOf(call);
		FormatStringHighlighter highlighter = new FormatStringHighlighter(MACROS);
		highlighter.checkForFormatString(call.firstChild(SyntaxKind.TOKEN_TREE));
		highlighter.reset();

		HighlightedRangeStack stack = new HighlightedRangeStack();
		highlighter.highlightFormatString(stack, StringLiteral.cast(string), string.getTextRange());
		Assertions.assertEquals(Collections.emptyList(), stack.flattened());
	}

	// ------------------------------------------------------------------
	// helpers
	// ------------------------------------------------------------------

	@Test
	void testMacroNameOfQualifiedPath() {
		// std::format_args!()
		SyntaxNode call = macroCall(node(SyntaxKind.PATH,
				path("std"), token(SyntaxKind.COLON2), node(SyntaxKind.PATH_SEGMENT, nameRef("format_args"))));
		Assertions.assertEquals("format_args", FormatStringHighlighter.macroName(call));
	}

	@Test
	void testMacroNameWithoutPath() {
		SyntaxNode call = TreeFixtures.build(node(SyntaxKind.MACRO_CALL, token(SyntaxKind.BANG)));
		Assertions.assertNull(FormatStringHighlighter.macroName(call));
	}

	@Test
	void testTagOfSpecifiers() {
		Assertions.assertEquals(HighlightTag.NUMERIC_LITERAL, FormatStringHighlighter.tagOf(FormatSpecifier.INTEGER));
		Assertions.assertEquals(HighlightTag.NUMERIC_LITERAL, FormatStringHighlighter.tagOf(FormatSpecifier.ZERO));
		Assertions.assertEquals(HighlightTag.LOCAL, FormatStringHighlighter.tagOf(FormatSpecifier.IDENTIFIER));
		Assertions.assertEquals(HighlightTag.FORMAT_SPECIFIER, FormatStringHighlighter.tagOf(FormatSpecifier.OPEN));
		Assertions.assertEquals(HighlightTag.FORMAT_SPECIFIER,
				FormatStringHighlighter.tagOf(FormatSpecifier.DOLLAR_SIGN));
	}
}
