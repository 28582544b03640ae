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

import java.util.ArrayDeque;
import java.util.Deque;

import com.tomaszrup.rusthighlight.highlight.Highlight;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.syntax.SyntaxElement;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;

/**
 * Highlights metavariables and repetitions in the rules of a
 * {@code macro_rules!} definition. The highlighter is fed every token of the
 * definition in order through {@link #advance(SyntaxToken)} and tracks
 * whether it is inside a matcher such as {@code ($x:expr)} or an expander such
 * as <code>{ $x + 1 }</code>.
 */
public class MacroRulesHighlighter {

	enum RuleState {
		MATCHER,
		BETWEEN,
		EXPANDER,
		NONE;

		RuleState next() {
			switch (this) {
				case MATCHER:
					return BETWEEN;
				case BETWEEN:
					return EXPANDER;
				case EXPANDER:
					return NONE;
				default:
					return MATCHER;
			}
		}
	}

	private boolean active;
	private boolean inRulesBlock;
	private SyntaxKind openKind;
	private SyntaxKind closeKind;
	private int depth;
	private RuleState ruleState = RuleState.NONE;
	// brackets nested inside the current matcher or expander; true for `$(`
	private final Deque<Boolean> groups = new ArrayDeque<>();
	private boolean repetitionClosed;
	private int tokensSinceRepetition;

	/**
	 * Starts tracking a new definition.
	 */
	public void init() {
		active = true;
		inRulesBlock = false;
		openKind = null;
		closeKind = null;
		depth = 0;
		ruleState = RuleState.NONE;
		groups.clear();
		repetitionClosed = false;
		tokensSinceRepetition = 0;
	}

	/**
	 * Stops tracking.
	 */
	public void reset() {
		init();
		active = false;
	}

	RuleState getRuleState() {
		return ruleState;
	}

	public void advance(SyntaxToken token) {
		if (!active) {
			return;
		}
		SyntaxKind kind = token.getKind();
		if (!inRulesBlock) {
			if (kind == SyntaxKind.L_CURLY || kind == SyntaxKind.L_PAREN) {
				inRulesBlock = true;
			}
			return;
		}
		if (kind.isTrivia()) {
			return;
		}
		if (repetitionClosed) {
			tokensSinceRepetition++;
		}
		if (openKind != null) {
			if (kind == openKind) {
				depth++;
			} else if (kind == closeKind) {
				depth--;
				if (depth == 0) {
					ruleState = ruleState.next();
					openKind = null;
					closeKind = null;
					groups.clear();
					return;
				}
			}
			trackGroups(token);
			return;
		}
		if (kind == SyntaxKind.L_PAREN) {
			openKind = SyntaxKind.L_PAREN;
			closeKind = SyntaxKind.R_PAREN;
		} else if (kind == SyntaxKind.L_CURLY) {
			openKind = SyntaxKind.L_CURLY;
			closeKind = SyntaxKind.R_CURLY;
		} else if (kind == SyntaxKind.L_BRACK) {
			openKind = SyntaxKind.L_BRACK;
			closeKind = SyntaxKind.R_BRACK;
		}
		if (openKind != null) {
			depth = 1;
			ruleState = ruleState.next();
		}
	}

	private void trackGroups(SyntaxToken token) {
		switch (token.getKind()) {
			case L_PAREN:
			case L_CURLY:
			case L_BRACK: {
				SyntaxToken prev = token.prevToken();
				groups.push(token.getKind() == SyntaxKind.L_PAREN && prev != null
						&& prev.getKind() == SyntaxKind.DOLLAR);
				break;
			}
			case R_PAREN:
			case R_CURLY:
			case R_BRACK:
				if (!groups.isEmpty() && groups.pop()) {
					repetitionClosed = true;
					tokensSinceRepetition = 0;
				}
				break;
			default:
				break;
		}
	}

	/**
	 * Returns the highlight of a metavariable, a repetition {@code $} or a
	 * repetition operator, or {@code null} for anything else.
	 */
	public Highlight highlight(SyntaxElement element) {
		if (!active || (ruleState != RuleState.MATCHER && ruleState != RuleState.EXPANDER)) {
			return null;
		}
		SyntaxToken token = element.asToken();
		if (token == null) {
			return null;
		}
		SyntaxKind kind = token.getKind();
		if (kind == SyntaxKind.IDENT || kind.isKeyword()) {
			SyntaxToken prev = token.prevToken();
			if (prev != null && prev.getKind() == SyntaxKind.DOLLAR) {
				return Highlight.of(HighlightTag.UNRESOLVED_REFERENCE);
			}
			return null;
		}
		if (kind == SyntaxKind.DOLLAR) {
			SyntaxToken next = token.nextToken();
			if (next != null && next.getKind() == SyntaxKind.L_PAREN) {
				return Highlight.of(HighlightTag.OPERATOR);
			}
			return null;
		}
		if (repetitionClosed && (kind == SyntaxKind.STAR || kind == SyntaxKind.PLUS || kind == SyntaxKind.QUESTION)) {
			if (tokensSinceRepetition <= 2) {
				repetitionClosed = false;
				return Highlight.of(HighlightTag.OPERATOR);
			}
		}
		if (repetitionClosed && tokensSinceRepetition >= 2) {
			repetitionClosed = false;
		}
		return null;
	}
}
