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
package com.tomaszrup.rusthighlight.highlight.injection;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.rusthighlight.highlight.Highlight;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.highlight.HighlightedRange;
import com.tomaszrup.rusthighlight.highlight.HighlightedRangeStack;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.syntax.StringLiteral;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;
import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * Highlights a raw string passed to a fixture parameter (by default one whose
 * name starts with {@code ra_fixture}) as Rust code.
 */
public class FixtureInjector {
	private static final Logger logger = LoggerFactory.getLogger(FixtureInjector.class);

	private final String parameterPrefix;
	private final SnippetHighlighter snippets;

	public FixtureInjector(String parameterPrefix, SnippetHighlighter snippets) {
		this.parameterPrefix = parameterPrefix;
		this.snippets = snippets;
	}

	/**
	 * Adds the highlights of {@code literal} if it is a fixture.
	 *
	 * @param expanded the token {@code literal} became after macro expansion,
	 *                 used to find the parameter it is passed to
	 * @return whether the literal was highlighted as a fixture
	 */
	public boolean inject(HighlightedRangeStack stack, Semantics semantics, StringLiteral literal,
			SyntaxToken expanded) {
		if (!literal.isRaw()) {
			return false;
		}
		Optional<String> parameter = semantics.activeParameterName(expanded);
		if (!parameter.isPresent() || !parameter.get().startsWith(parameterPrefix)) {
			return false;
		}
		String value = literal.getValue();
		if (value == null) {
			return false;
		}
		List<HighlightedRange> ranges = snippets.highlight(value);
		if (ranges == null) {
			logger.debug("Fixture at {} not highlighted: snippet could not be analyzed",
					literal.getToken().getTextRange());
			return false;
		}

		stack.add(new HighlightedRange(literal.getOpenQuoteRange(), Highlight.of(HighlightTag.STRING_LITERAL)));
		TextRange contents = literal.getContentsRange();
		for (HighlightedRange range : ranges) {
			TextRange mapped = range.getRange().shift(contents.getStart());
			if (contents.containsRange(mapped)) {
				stack.add(range.withRange(mapped));
			}
		}
		stack.add(new HighlightedRange(literal.getCloseQuoteRange(), Highlight.of(HighlightTag.STRING_LITERAL)));
		return true;
	}
}
