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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.rusthighlight.highlight.Highlight;
import com.tomaszrup.rusthighlight.highlight.HighlightModifier;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.highlight.HighlightedRange;
import com.tomaszrup.rusthighlight.highlight.HighlightedRangeStack;
import com.tomaszrup.rusthighlight.syntax.Comments;
import com.tomaszrup.rusthighlight.syntax.SyntaxElement;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;
import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * Highlights Rust code blocks inside doc comments. The code lines of a node's
 * doc comments are wrapped into a function, highlighted as a snippet and
 * mapped back onto the comment lines; the comment prefixes keep their comment
 * highlight.
 */
public class DocCommentInjector {
	private static final Logger logger = LoggerFactory.getLogger(DocCommentInjector.class);

	static final String FENCE = "```";
	static final String PREFIX = "fn doctest() {\n";
	static final String SUFFIX = "}\n";
	static final Set<String> FENCE_TOKENS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"", "rust", "should_panic", "ignore", "no_run", "compile_fail",
			"edition2015", "edition2018", "edition2021")));

	private final SnippetHighlighter snippets;

	public DocCommentInjector(SnippetHighlighter snippets) {
		this.snippets = snippets;
	}

	/** One extracted code line: where it starts in the snippet and in the source. */
	static final class Line {
		final int snippetStart;
		final int sourceStart;
		final int length;

		Line(int snippetStart, int sourceStart, int length) {
			this.snippetStart = snippetStart;
			this.sourceStart = sourceStart;
			this.length = length;
		}
	}

	/** The code extracted from the doc comments of one node. */
	static final class DocTest {
		final String text;
		final NavigableMap<Integer, Line> lines;
		final List<HighlightedRange> commentPrefixes;

		DocTest(String text, NavigableMap<Integer, Line> lines, List<HighlightedRange> commentPrefixes) {
			this.text = text;
			this.lines = lines;
			this.commentPrefixes = commentPrefixes;
		}

		/**
		 * Maps a snippet range to source ranges, one per code line it touches.
		 */
		List<TextRange> mapRange(TextRange range) {
			List<TextRange> result = new ArrayList<>();
			Integer from = lines.floorKey(range.getStart());
			if (from == null) {
				from = range.getStart();
			}
			for (Line line : lines.subMap(from, true, range.getEnd(), false).values()) {
				TextRange lineRange = TextRange.at(line.snippetStart, line.length);
				TextRange common = lineRange.intersect(range);
				if (common != null && !common.isEmpty()) {
					result.add(common.shift(line.sourceStart - line.snippetStart));
				}
			}
			return result;
		}
	}

	/**
	 * Called after {@code node} has been left: injects the highlighted doc
	 * test code into the innermost open frame, which holds the comment ranges.
	 */
	public void inject(SyntaxNode node, HighlightedRangeStack stack) {
		DocTest docTest = extract(node);
		if (docTest == null) {
			return;
		}
		List<HighlightedRange> highlighted = snippets.highlight(docTest.text);
		if (highlighted == null) {
			logger.debug("Doc test in {} not highlighted: snippet could not be analyzed", node);
			return;
		}

		stack.push();
		for (HighlightedRange range : highlighted) {
			Highlight injected = range.getHighlight().with(HighlightModifier.INJECTED);
			for (TextRange mapped : docTest.mapRange(range.getRange())) {
				stack.add(new HighlightedRange(mapped, injected, range.getBindingHash()));
			}
		}

		stack.push();
		for (HighlightedRange prefix : docTest.commentPrefixes) {
			stack.add(prefix);
		}
		stack.popAndInject(null);
		stack.popAndInject(Highlight.of(HighlightTag.DUMMY, HighlightModifier.INJECTED));
	}

	/**
	 * Collects the lines of Rust code blocks in the doc comments directly
	 * under {@code node}, or returns {@code null} if there are none.
	 */
	static DocTest extract(SyntaxNode node) {
		List<SyntaxToken> docComments = new ArrayList<>();
		boolean hasFence = false;
		for (SyntaxElement child : node.getChildrenWithTokens()) {
			if (child.isToken() && Comments.isDocComment((SyntaxToken) child)) {
				docComments.add((SyntaxToken) child);
				hasFence |= child.getText().contains(FENCE);
			}
		}
		if (!hasFence) {
			return null;
		}

		StringBuilder code = new StringBuilder();
		NavigableMap<Integer, Line> lines = new TreeMap<>();
		List<HighlightedRange> prefixes = new ArrayList<>();
		int lineStart = PREFIX.length();
		boolean inCodeBlock = false;
		boolean isDocTest = false;

		for (SyntaxToken comment : docComments) {
			String text = comment.getText();
			int fence = text.indexOf(FENCE);
			if (fence >= 0) {
				inCodeBlock = !inCodeBlock;
				isDocTest = inCodeBlock && isRustFence(text.substring(fence + FENCE.length()));
				continue;
			}
			if (!isDocTest) {
				continue;
			}

			int pos = Comments.prefix(text).length();
			// whitespace after the comment prefix is not part of the code
			if (pos < text.length() && Character.isWhitespace(text.codePointAt(pos))) {
				pos += Character.charCount(text.codePointAt(pos));
			}
			// lines starting with `#` are hidden in rendered docs; drop the marker
			if (pos < text.length() && text.charAt(pos) == '#') {
				pos++;
			}
			int prefixBytes = TextRange.utf8Length(text.substring(0, pos));
			TextRange range = comment.getTextRange();
			String codeLine = text.substring(pos);
			int codeBytes = TextRange.utf8Length(codeLine);

			lines.put(lineStart, new Line(lineStart, range.getStart() + prefixBytes, codeBytes));
			prefixes.add(new HighlightedRange(TextRange.at(range.getStart(), prefixBytes),
					Highlight.of(HighlightTag.COMMENT, HighlightModifier.DOCUMENTATION)));
			code.append(codeLine).append('\n');
			lineStart += codeBytes + 1;
		}

		if (lines.isEmpty()) {
			return null;
		}
		return new DocTest(PREFIX + code + SUFFIX, lines, prefixes);
	}

	static boolean isRustFence(String attributes) {
		for (String attribute : attributes.split(",", -1)) {
			if (!FENCE_TOKENS.contains(attribute.trim())) {
				return false;
			}
		}
		return true;
	}
}
