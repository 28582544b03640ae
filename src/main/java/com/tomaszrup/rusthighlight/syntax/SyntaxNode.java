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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An interior element of the syntax tree.
 */
public final class SyntaxNode extends SyntaxElement {
	private final List<SyntaxElement> children;
	private final int textLength;

	SyntaxNode(SyntaxKind kind, int offset, List<SyntaxElement> children) {
		super(kind, offset);
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
		int length = 0;
		for (int i = 0; i < this.children.size(); i++) {
			SyntaxElement child = this.children.get(i);
			child.attach(this, i);
			length += child.getTextLength();
		}
		this.textLength = length;
	}

	@Override
	public int getTextLength() {
		return textLength;
	}

	@Override
	public String getText() {
		StringBuilder builder = new StringBuilder();
		for (SyntaxToken token : descendantTokens()) {
			builder.append(token.getText());
		}
		return builder.toString();
	}

	public List<SyntaxElement> getChildrenWithTokens() {
		return children;
	}

	/**
	 * Child nodes only.
	 */
	public List<SyntaxNode> getChildren() {
		List<SyntaxNode> result = new ArrayList<>();
		for (SyntaxElement child : children) {
			if (child.isNode()) {
				result.add((SyntaxNode) child);
			}
		}
		return result;
	}

	public SyntaxNode firstChild(SyntaxKind kind) {
		for (SyntaxElement child : children) {
			if (child.isNode() && child.getKind() == kind) {
				return (SyntaxNode) child;
			}
		}
		return null;
	}

	public SyntaxToken firstChildToken(SyntaxKind kind) {
		for (SyntaxElement child : children) {
			if (child.isToken() && child.getKind() == kind) {
				return (SyntaxToken) child;
			}
		}
		return null;
	}

	public SyntaxToken firstToken() {
		for (SyntaxElement child : children) {
			if (child.isToken()) {
				return (SyntaxToken) child;
			}
			SyntaxToken nested = ((SyntaxNode) child).firstToken();
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}

	public SyntaxToken lastToken() {
		for (int i = children.size() - 1; i >= 0; i--) {
			SyntaxElement child = children.get(i);
			if (child.isToken()) {
				return (SyntaxToken) child;
			}
			SyntaxToken nested = ((SyntaxNode) child).lastToken();
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}

	public List<SyntaxToken> descendantTokens() {
		List<SyntaxToken> result = new ArrayList<>();
		collectTokens(this, result);
		return result;
	}

	private static void collectTokens(SyntaxNode node, List<SyntaxToken> result) {
		for (SyntaxElement child : node.children) {
			if (child.isToken()) {
				result.add((SyntaxToken) child);
			} else {
				collectTokens((SyntaxNode) child, result);
			}
		}
	}

	/**
	 * Returns the innermost element whose range covers {@code range}. A range
	 * sitting on a boundary between two children resolves to this node.
	 */
	public SyntaxElement coveringElement(TextRange range) {
		if (!getTextRange().containsRange(range)) {
			throw new IllegalArgumentException("Range " + range + " is outside of " + this);
		}
		SyntaxNode current = this;
		while (true) {
			SyntaxElement next = null;
			for (SyntaxElement child : current.children) {
				TextRange childRange = child.getTextRange();
				if (childRange.containsRange(range) && !(childRange.isEmpty() && !range.isEmpty())) {
					next = child;
					break;
				}
			}
			if (next == null) {
				return current;
			}
			if (next.isToken()) {
				return next;
			}
			current = (SyntaxNode) next;
		}
	}

	/**
	 * Pre-order walk over this subtree, tokens included.
	 */
	public Preorder preorderWithTokens() {
		return new Preorder(this);
	}
}
