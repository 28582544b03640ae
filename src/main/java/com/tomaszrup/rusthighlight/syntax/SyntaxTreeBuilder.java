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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds an immutable {@link SyntaxNode} tree from a flat sequence of
 * start-node, token and finish-node calls, as emitted by a parser or a macro
 * expander. Offsets are counted in UTF-8 bytes from {@code startOffset}.
 *
 * <pre>
 * SyntaxTreeBuilder builder = new SyntaxTreeBuilder();
 * builder.startNode(SyntaxKind.SOURCE_FILE);
 * builder.token(SyntaxKind.IDENT, "foo");
 * builder.finishNode();
 * SyntaxNode root = builder.finish();
 * </pre>
 */
public final class SyntaxTreeBuilder {

	private static final class OpenNode {
		private final SyntaxKind kind;
		private final int offset;
		private final List<SyntaxElement> children = new ArrayList<>();

		private OpenNode(SyntaxKind kind, int offset) {
			this.kind = kind;
			this.offset = offset;
		}
	}

	private final Deque<OpenNode> stack = new ArrayDeque<>();
	private int offset;
	private SyntaxNode root;

	public SyntaxTreeBuilder() {
		this(0);
	}

	public SyntaxTreeBuilder(int startOffset) {
		this.offset = startOffset;
	}

	public SyntaxTreeBuilder startNode(SyntaxKind kind) {
		if (root != null) {
			throw new IllegalStateException("Tree already finished");
		}
		if (!kind.isNode()) {
			throw new IllegalArgumentException(kind + " is not a node kind");
		}
		stack.push(new OpenNode(kind, offset));
		return this;
	}

	public SyntaxTreeBuilder token(SyntaxKind kind, String text) {
		if (stack.isEmpty()) {
			throw new IllegalStateException("Token " + kind + " outside of any node");
		}
		if (!kind.isToken()) {
			throw new IllegalArgumentException(kind + " is not a token kind");
		}
		SyntaxToken token = new SyntaxToken(kind, offset, text);
		stack.peek().children.add(token);
		offset += token.getTextLength();
		return this;
	}

	/**
	 * Adds a token whose kind is fixed by its text (keywords, punctuation).
	 */
	public SyntaxTreeBuilder token(SyntaxKind kind) {
		if (kind.getText() == null) {
			throw new IllegalArgumentException(kind + " has no fixed text");
		}
		return token(kind, kind.getText());
	}

	public SyntaxTreeBuilder finishNode() {
		if (stack.isEmpty()) {
			throw new IllegalStateException("No open node to finish");
		}
		OpenNode open = stack.pop();
		SyntaxNode node = new SyntaxNode(open.kind, open.offset, open.children);
		if (stack.isEmpty()) {
			root = node;
		} else {
			stack.peek().children.add(node);
		}
		return this;
	}

	public SyntaxNode finish() {
		if (!stack.isEmpty()) {
			throw new IllegalStateException("Unfinished nodes: " + stack.size());
		}
		if (root == null) {
			throw new IllegalStateException("Empty tree");
		}
		return root;
	}
}
