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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.rusthighlight.TestLexer;
import com.tomaszrup.rusthighlight.highlight.Highlight;
import com.tomaszrup.rusthighlight.highlight.injection.MacroRulesHighlighter.RuleState;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;

/**
 * Unit tests for {@link MacroRulesHighlighter}: rule state tracking,
 * metavariables and repetition operators.
 */
class MacroRulesHighlighterTests {

	/**
	 * Feeds every token of {@code source} and collects the non-null
	 * highlights as {@code text:TAG}.
	 */
	private static List<String> highlights(MacroRulesHighlighter highlighter, String source) {
		SyntaxNode root = TestLexer.lex(source);
		List<String> result = new ArrayList<>();
		for (SyntaxToken token : root.descendantTokens()) {
			highlighter.advance(token);
			Highlight highlight = highlighter.highlight(token);
			if (highlight != null) {
				result.add(token.getText() + ":" + highlight.getTag().name());
			}
		}
		return result;
	}

	private static List<String> highlights(String source) {
		MacroRulesHighlighter highlighter = new MacroRulesHighlighter();
		highlighter.init();
		return highlights(highlighter, source);
	}

	// ------------------------------------------------------------------
	// metavariables
	// ------------------------------------------------------------------

	@Test
	void testMetavariablesInMatcherAndExpander() {
		Assertions.assertEquals(Arrays.asList("x:UNRESOLVED_REFERENCE", "x:UNRESOLVED_REFERENCE"),
				highlights("macro_rules! m { ($x:expr) => { $x }; }"));
	}

	@Test
	void testFragmentSpecifierIsNotHighlighted() {
		List<String> result = highlights("macro_rules! m { ($x:ident) => {}; }");
		Assertions.assertFalse(result.contains("ident:UNRESOLVED_REFERENCE"));
	}

	@Test
	void testKeywordAfterDollar() {
		Assertions.assertEquals(Arrays.asList("crate:UNRESOLVED_REFERENCE"),
				highlights("macro_rules! m { () => { $crate::f() }; }"));
	}

	@Test
	void testNothingBeforeRulesBlock() {
		// `$x` in the name position is not inside any rule
		Assertions.assertEquals(Arrays.asList(), highlights("macro_rules! $x"));
	}

	// ------------------------------------------------------------------
	// repetitions
	// ------------------------------------------------------------------

	@Test
	void testRepetitionsInMatcherAndExpander() {
		Assertions.assertEquals(Arrays.asList(
				"$:OPERATOR", "e:UNRESOLVED_REFERENCE", "*:OPERATOR",
				"$:OPERATOR", "e:UNRESOLVED_REFERENCE", "*:OPERATOR"),
				highlights("macro_rules! m { ($($e:expr),*) => { $($e);* } }"));
	}

	@Test
	void testPlusAndQuestionRepetitions() {
		Assertions.assertEquals(Arrays.asList(
				"$:OPERATOR", "a:UNRESOLVED_REFERENCE", "+:OPERATOR",
				"$:OPERATOR", "b:UNRESOLVED_REFERENCE", "?:OPERATOR"),
				highlights("macro_rules! m { ($($a:tt)+ $($b:tt)?) => {}; }"));
	}

	@Test
	void testStarOutsideRepetitionIsNotOperator() {
		Assertions.assertEquals(Arrays.asList("a:UNRESOLVED_REFERENCE", "a:UNRESOLVED_REFERENCE"),
				highlights("macro_rules! m { ($a:expr) => { $a * 2 }; }"));
	}

	// ------------------------------------------------------------------
	// state
	// ------------------------------------------------------------------

	@Test
	void testRuleStatesCycle() {
		MacroRulesHighlighter highlighter = new MacroRulesHighlighter();
		highlighter.init();
		List<RuleState> states = new ArrayList<>();
		for (SyntaxToken token : TestLexer.lex("macro_rules! m { (a) => [b]; (c) => {d} }").descendantTokens()) {
			highlighter.advance(token);
			if (token.getText().length() == 1 && Character.isLetter(token.getText().charAt(0))) {
				states.add(highlighter.getRuleState());
			}
		}
		// m, a, b, c, d
		Assertions.assertEquals(Arrays.asList(RuleState.NONE, RuleState.MATCHER, RuleState.EXPANDER,
				RuleState.MATCHER, RuleState.EXPANDER), states);
	}

	@Test
	void testResetDeactivates() {
		MacroRulesHighlighter highlighter = new MacroRulesHighlighter();
		highlighter.init();
		highlighter.reset();
		Assertions.assertEquals(Arrays.asList(), highlights(highlighter, "macro_rules! m { ($x:expr) => { $x }; }"));
	}
}
