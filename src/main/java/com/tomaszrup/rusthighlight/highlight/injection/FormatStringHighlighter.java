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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.tomaszrup.rusthighlight.highlight.Highlight;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.highlight.HighlightedRange;
import com.tomaszrup.rusthighlight.highlight.HighlightedRangeStack;
import com.tomaszrup.rusthighlight.syntax.CharPiece;
import com.tomaszrup.rusthighlight.syntax.FormatSpecifier;
import com.tomaszrup.rusthighlight.syntax.FormatSpecifierLexer;
import com.tomaszrup.rusthighlight.syntax.StringLiteral;
import com.tomaszrup.rusthighlight.syntax.SyntaxElement;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;
import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * Highlights the placeholders of the format string passed to a formatting
 * macro. Macros such as {@code println!} expand to {@code format_args!}, so
 * the check runs on expanded tokens.
 */
public class FormatStringHighlighter {
	private final Set<String> formatMacros;
	private SyntaxToken formatString;

	public FormatStringHighlighter(List<String> formatMacros) {
		this.formatMacros = new HashSet<>(formatMacros);
	}

	/**
	 * Remembers the format string if {@code parent} is the argument list of a
	 * formatting macro: the string right after the opening delimiter.
	 */
	public void checkForFormatString(SyntaxNode parent) {
		if (parent == null || parent.getKind() != SyntaxKind.TOKEN_TREE) {
			return;
		}
		SyntaxNode macroCall = parent.getParent();
		if (macroCall == null || macroCall.getKind() != SyntaxKind.MACRO_CALL) {
			return;
		}
		String name = macroName(macroCall);
		if (name == null || !formatMacros.contains(name)) {
			return;
		}
		formatString = null;
		int seen = 0;
		for (SyntaxElement child : parent.getChildrenWithTokens()) {
			if (child.getKind() == SyntaxKind.WHITESPACE) {
				continue;
			}
			if (seen++ == 1) {
				if (child.getKind() == SyntaxKind.STRING) {
					formatString = (SyntaxToken) child;
				}
				return;
			}
		}
	}

	/**
	 * Adds placeholder ranges if {@code string} is the remembered format
	 * string. {@code range} is where the string appears in the source.
	 */
	public void highlightFormatString(HighlightedRangeStack stack, StringLiteral string, TextRange range) {
		if (formatString == null || formatString != string.getToken()) {
			return;
		}
		List<CharPiece> pieces = string.pieces();
		if (pieces == null) {
			return;
		}
		stack.push();
		FormatSpecifierLexer.lex(pieces, (pieceRange, specifier) ->
				stack.add(new HighlightedRange(pieceRange.shift(range.getStart()), Highlight.of(tagOf(specifier)))));
		stack.pop();
	}

	public void reset() {
		formatString = null;
	}

	static HighlightTag tagOf(FormatSpecifier specifier) {
		switch (specifier) {
			case INTEGER:
			case ZERO:
				return HighlightTag.NUMERIC_LITERAL;
			case IDENTIFIER:
				return HighlightTag.LOCAL;
			default:
				return HighlightTag.FORMAT_SPECIFIER;
		}
	}

	/**
	 * Name of the last path segment of a macro call, e.g. {@code format_args}
	 * for {@code std::format_args!}.
	 */
	public static String macroName(SyntaxNode macroCall) {
		SyntaxNode path = macroCall.firstChild(SyntaxKind.PATH);
		if (path == null) {
			return null;
		}
		SyntaxNode segment = path.firstChild(SyntaxKind.PATH_SEGMENT);
		if (segment == null) {
			return null;
		}
		SyntaxNode nameRef = segment.firstChild(SyntaxKind.NAME_REF);
		return nameRef != null ? nameRef.getText() : null;
	}
}
