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
import java.util.List;

/**
 * Common base of {@link SyntaxNode} and {@link SyntaxToken}. Elements are
 * created by {@link SyntaxTreeBuilder} and are immutable afterwards; equality
 * is identity.
 */
public abstract class SyntaxElement {
	private final SyntaxKind kind;
	private final int offset;
	private SyntaxNode parent;
	private int indexInParent = -1;

	SyntaxElement(SyntaxKind kind, int offset) {
		this.kind = kind;
		this.offset = offset;
	}

	void attach(SyntaxNode parent, int indexInParent) {
		this.parent = parent;
		this.indexInParent = indexInParent;
	}

	public SyntaxKind getKind() {
		return kind;
	}

	public TextRange getTextRange() {
		return TextRange.at(offset, getTextLength());
	}

	public abstract int getTextLength();

	public abstract String getText();

	/**
	 * Returns the parent node, or {@code null} for the root.
	 */
	public SyntaxNode getParent() {
		return parent;
	}

	public boolean isNode() {
		return this instanceof SyntaxNode;
	}

	public boolean isToken() {
		return this instanceof SyntaxToken;
	}

	/**
	 * Returns this element as a node, or {@code null} if it is a token.
	 */
	public SyntaxNode asNode() {
		return isNode() ? (SyntaxNode) this : null;
	}

	/**
	 * Returns this element as a token, or {@code null} if it is a node.
	 */
	public SyntaxToken asToken() {
		return isToken() ? (SyntaxToken) this : null;
	}

	/**
	 * Enclosing nodes, innermost first. A node starts with itself, a token
	 * starts with its parent.
	 */
	public List<SyntaxNode> ancestors() {
		List<SyntaxNode> result = new ArrayList<>();
		SyntaxNode current = isNode() ? (SyntaxNode) this : parent;
		while (current != null) {
			result.add(current);
			current = current.getParent();
		}
		return result;
	}

	public SyntaxElement prevSiblingOrToken() {
		if (parent == null || indexInParent <= 0) {
			return null;
		}
		return parent.getChildrenWithTokens().get(indexInParent - 1);
	}

	public SyntaxElement nextSiblingOrToken() {
		if (parent == null) {
			return null;
		}
		List<SyntaxElement> siblings = parent.getChildrenWithTokens();
		if (indexInParent + 1 >= siblings.size()) {
			return null;
		}
		return siblings.get(indexInParent + 1);
	}

	/**
	 * This element followed by all of its following siblings, tokens included.
	 */
	public List<SyntaxElement> siblingsWithTokensForward() {
		List<SyntaxElement> result = new ArrayList<>();
		SyntaxElement current = this;
		while (current != null) {
			result.add(current);
			current = current.nextSiblingOrToken();
		}
		return result;
	}

	@Override
	public String toString() {
		return kind + "@" + getTextRange();
	}
}
