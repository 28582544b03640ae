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
package com.tomaszrup.rusthighlight.highlight;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.rusthighlight.config.HighlightConfig;
import com.tomaszrup.rusthighlight.highlight.injection.DocCommentInjector;
import com.tomaszrup.rusthighlight.highlight.injection.EscapeSequenceHighlighter;
import com.tomaszrup.rusthighlight.highlight.injection.FixtureInjector;
import com.tomaszrup.rusthighlight.highlight.injection.FormatStringHighlighter;
import com.tomaszrup.rusthighlight.highlight.injection.SnippetHighlighter;
import com.tomaszrup.rusthighlight.semantics.AnalyzedSnippet;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.semantics.SnippetAnalyzer;
import com.tomaszrup.rusthighlight.syntax.Preorder;
import com.tomaszrup.rusthighlight.syntax.StringLiteral;
import com.tomaszrup.rusthighlight.syntax.SyntaxElement;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;
import com.tomaszrup.rusthighlight.syntax.TextRange;
import com.tomaszrup.rusthighlight.syntax.WalkEvent;

/**
 * Computes the highlighted ranges of a syntax tree.
 *
 * <p>The tree is walked depth first. Every element entered opens a frame on a
 * {@link HighlightedRangeStack} and gets classified; leaving it merges the
 * frame into its parent. Tokens inside macro calls are classified through
 * their expansion, and string literals, {@code macro_rules!} bodies and doc
 * comments get extra ranges from the injection highlighters.</p>
 *
 * <p>A highlighter can be reused, but not concurrently: every call to
 * {@link #highlight(SyntaxNode, TextRange)} holds its walk state locally.</p>
 */
public class SemanticHighlighter {
	private static final Logger logger = LoggerFactory.getLogger(SemanticHighlighter.class);

	private final HighlightConfig config;
	private final Semantics semantics;
	private final SnippetAnalyzer snippetAnalyzer;
	private final DocCommentInjector docComments;
	private final FixtureInjector fixtures;

	public SemanticHighlighter(HighlightConfig config, Semantics semantics) {
		this(config, semantics, null);
	}

	/**
	 * @param snippetAnalyzer analyzes doc test and fixture code; may be
	 *                        {@code null}, which disables those injections
	 */
	public SemanticHighlighter(HighlightConfig config, Semantics semantics, SnippetAnalyzer snippetAnalyzer) {
		this.config = config;
		this.semantics = semantics != null ? semantics : Semantics.NONE;
		this.snippetAnalyzer = snippetAnalyzer;
		SnippetHighlighter snippets = this::highlightSnippet;
		this.docComments = new DocCommentInjector(snippets);
		this.fixtures = new FixtureInjector(config.getFixturePrefix(), snippets);
	}

	public List<HighlightedRange> highlight(SyntaxNode root) {
		return highlight(root, null);
	}

	/**
	 * Highlights {@code file}, or only the elements intersecting
	 * {@code viewport} when it is not {@code null}.
	 *
	 * @return sorted, pairwise disjoint ranges
	 */
	public List<HighlightedRange> highlight(SyntaxNode file, TextRange viewport) {
		SyntaxNode root = file;
		TextRange range = file.getTextRange();
		if (viewport != null) {
			SyntaxElement covering = file.coveringElement(viewport);
			root = covering.isNode() ? (SyntaxNode) covering : covering.getParent();
			range = viewport;
		}

		Walk walk = new Walk();
		Preorder preorder = root.preorderWithTokens();
		while (preorder.hasNext()) {
			WalkEvent event = preorder.next();
			SyntaxElement element = event.getElement();
			if (range.intersect(element.getTextRange()) == null) {
				// outside of the viewport
				preorder.skipSubtree();
				continue;
			}
			if (event.isEnter()) {
				walk.stack.push();
				walk.enter(element);
			} else {
				walk.stack.pop();
				walk.leave(element);
			}
		}

		List<HighlightedRange> result = walk.stack.flattened();
		logger.debug("Highlighted {} range={} ranges={}", root.getKind(), range, result.size());
		return result;
	}

	private List<HighlightedRange> highlightSnippet(String text) {
		if (snippetAnalyzer == null) {
			return null;
		}
		AnalyzedSnippet snippet = snippetAnalyzer.analyze(text);
		if (snippet == null) {
			return null;
		}
		HighlightConfig nested = config.toBuilder().syntacticNameRefHighlighting(true).build();
		return new SemanticHighlighter(nested, snippet.getSemantics(), snippetAnalyzer).highlight(snippet.getRoot());
	}

	/**
	 * Range of the macro name of a call, {@code foo!} in {@code foo!(...)},
	 * or {@code null} if the call has no name.
	 */
	static TextRange macroCallRange(SyntaxNode macroCall) {
		SyntaxNode path = macroCall.firstChild(SyntaxKind.PATH);
		if (path == null) {
			return null;
		}
		SyntaxNode segment = path.firstChild(SyntaxKind.PATH_SEGMENT);
		SyntaxNode nameRef = segment != null ? segment.firstChild(SyntaxKind.NAME_REF) : null;
		if (nameRef == null) {
			return null;
		}
		int start = nameRef.getTextRange().getStart();
		int end = nameRef.getTextRange().getEnd();
		for (SyntaxElement sibling : path.siblingsWithTokensForward()) {
			if (sibling.getKind() == SyntaxKind.BANG || sibling.getKind() == SyntaxKind.IDENT) {
				end = sibling.getTextRange().getEnd();
			}
		}
		return TextRange.of(start, end);
	}

	/**
	 * Range of the leading {@code macro_rules} identifier of a definition, or
	 * {@code null}. The {@code !} after it is classified on its own.
	 */
	static TextRange macroRulesKeywordRange(SyntaxNode definition) {
		SyntaxToken keyword = definition.firstChildToken(SyntaxKind.IDENT);
		return keyword != null ? keyword.getTextRange() : null;
	}

	/**
	 * Whether a macro call is an old-style {@code macro_rules! name { ... }}
	 * definition.
	 */
	static boolean isMacroRulesCall(SyntaxNode macroCall) {
		return "macro_rules".equals(FormatStringHighlighter.macroName(macroCall))
				&& macroCall.firstChild(SyntaxKind.NAME) != null;
	}

	private final class Walk {
		private final HighlightedRangeStack stack = new HighlightedRangeStack();
		private final TraversalContext context = new TraversalContext(config.getFormatMacros());
		private final TokenClassifier classifier =
				new TokenClassifier(semantics, new ShadowCounter(), config.isSyntacticNameRefHighlighting());

		private void enter(SyntaxElement element) {
			SyntaxKind kind = element.getKind();
			if (kind == SyntaxKind.MACRO_CALL) {
				enterMacroCall((SyntaxNode) element);
				return;
			}
			if (kind == SyntaxKind.MACRO_RULES) {
				context.enterMacroRules((SyntaxNode) element);
				TextRange keyword = macroRulesKeywordRange((SyntaxNode) element);
				if (keyword != null) {
					stack.add(new HighlightedRange(keyword, attributed(Highlight.of(HighlightTag.MACRO))));
				}
			} else if (kind == SyntaxKind.ATTR) {
				context.setInsideAttribute(true);
			}

			if (context.isInMacroRules() && element.isToken()) {
				context.getMacroRulesHighlighter().advance((SyntaxToken) element);
			}

			SyntaxElement target = element;
			if (context.isInMacroCall() && kind != SyntaxKind.COMMENT) {
				if (!element.isToken() || element.getParent().getKind() != SyntaxKind.TOKEN_TREE) {
					return;
				}
				target = expand((SyntaxToken) element);
			}

			TextRange range = element.getTextRange();
			StringLiteral source = StringLiteral.cast(element.asToken());
			if (source != null && source.isRaw() && target.isToken()
					&& fixtures.inject(stack, semantics, source, (SyntaxToken) target)) {
				return;
			}

			Highlight metavariable = context.isInMacroRules()
					? context.getMacroRulesHighlighter().highlight(target)
					: null;
			if (metavariable != null) {
				stack.add(new HighlightedRange(range, attributed(metavariable)));
				return;
			}

			Classification classification = classifier.classify(target);
			if (classification == null) {
				return;
			}
			stack.add(new HighlightedRange(range, attributed(classification.getHighlight()),
					classification.getBindingHash()));

			StringLiteral string = StringLiteral.cast(target.asToken());
			if (string != null) {
				context.getFormatStrings().highlightFormatString(stack, string, range);
				EscapeSequenceHighlighter.highlight(stack, string, range);
			}
		}

		private void enterMacroCall(SyntaxNode macroCall) {
			context.enterMacroCall(macroCall);
			TextRange nameRange = macroCallRange(macroCall);
			if (nameRange != null) {
				stack.add(new HighlightedRange(nameRange, attributed(Highlight.of(HighlightTag.MACRO))));
			}
			if (isMacroRulesCall(macroCall)) {
				context.enterMacroRules(macroCall);
				SyntaxNode name = macroCall.firstChild(SyntaxKind.NAME);
				Classification classification = classifier.classify(name);
				if (classification != null) {
					stack.add(new HighlightedRange(name.getTextRange(), attributed(classification.getHighlight()),
							classification.getBindingHash()));
				}
			}
		}

		/**
		 * The element to classify in place of a token inside a macro call: its
		 * expansion, or the name node around an expanded identifier.
		 */
		private SyntaxElement expand(SyntaxToken token) {
			Optional<SyntaxToken> descended = semantics.descendIntoMacros(token);
			SyntaxToken expanded = descended.isPresent() ? descended.get() : token;
			SyntaxNode parent = expanded.getParent();
			context.getFormatStrings().checkForFormatString(parent);
			if (expanded.getKind() == SyntaxKind.IDENT && parent != null
					&& (parent.getKind() == SyntaxKind.NAME || parent.getKind() == SyntaxKind.NAME_REF)) {
				return parent;
			}
			return expanded;
		}

		private Highlight attributed(Highlight highlight) {
			return context.isInsideAttribute() ? highlight.with(HighlightModifier.ATTRIBUTE) : highlight;
		}

		private void leave(SyntaxElement element) {
			if (!element.isNode()) {
				return;
			}
			SyntaxNode node = (SyntaxNode) element;
			switch (node.getKind()) {
				case MACRO_CALL:
					context.leaveMacroCall(node);
					if (isMacroRulesCall(node)) {
						context.leaveMacroRules(node);
					}
					break;
				case MACRO_RULES:
					context.leaveMacroRules(node);
					break;
				case ATTR:
					context.setInsideAttribute(false);
					break;
				default:
					break;
			}
			if (config.isInjectDocTests()) {
				docComments.inject(node, stack);
			}
		}
	}
}
