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
package com.tomaszrup.rusthighlight.syntax;

/**
 * A leaf of the syntax tree carrying source text.
 */
public final class SyntaxToken extends SyntaxElement {
	private final String text;
	private final int textLength;

	SyntaxToken(SyntaxKind kind, int offset, String text) {
		super(kind, offset);
		this.text = text;
		this.textLength = TextRange.utf8Length(text);
	}

	@Override
	public int getTextLength() {
		return textLength;
	}

	@Override
	public String getText() {
		return text;
	}

	/**
	 * Previous token in document order, crossing node boundaries.
	 */
	public SyntaxToken prevToken() {
		SyntaxElement current = this;
		while (current != null) {
			SyntaxElement sibling = current.prevSiblingOrToken();
			while (sibling != null) {
				if (sibling.isToken()) {
					return (SyntaxToken) sibling;
				}
				SyntaxToken last = ((SyntaxNode) sibling).lastToken();
				if (last != null) {
					return last;
				}
				sibling = sibling.prevSiblingOrToken();
			}
			current = current.getParent();
		}
		return null;
	}

	/**
	 * Next token in document order, crossing node boundaries.
	 */
	public SyntaxToken nextToken() {
		SyntaxElement current = this;
		while (current != null) {
			SyntaxElement sibling = current.nextSiblingOrToken();
			while (sibling != null) {
				if (sibling.isToken()) {
					return (SyntaxToken) sibling;
				}
				SyntaxToken first = ((SyntaxNode) sibling).firstToken();
				if (first != null) {
					return first;
				}
				sibling = sibling.nextSiblingOrToken();
			}
			current = current.getParent();
		}
		return null;
	}

	/**
	 * Previous non-trivia token in document order.
	 */
	public SyntaxToken prevNonTriviaToken() {
		SyntaxToken token = prevToken();
		while (token != null && token.getKind().isTrivia()) {
			token = token.prevToken();
		}
		return token;
	}

	@Override
	public String toString() {
		return super.toString() + " " + text;
	}
}
