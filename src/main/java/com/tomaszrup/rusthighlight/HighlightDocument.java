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
package com.tomaszrup.rusthighlight;

import java.util.Objects;

import com.tomaszrup.lsp.utils.LineIndex;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.semantics.SnippetAnalyzer;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * An open document ready to be highlighted: its text, the tree parsed from
 * it and the semantic facts about that tree.
 */
public final class HighlightDocument {
	private final String text;
	private final SyntaxNode root;
	private final Semantics semantics;
	private final SnippetAnalyzer snippetAnalyzer;
	private volatile LineIndex lineIndex;

	public HighlightDocument(String text, SyntaxNode root, Semantics semantics) {
		this(text, root, semantics, null);
	}

	/**
	 * @throws IllegalArgumentException if {@code root} does not span exactly
	 *                                  {@code text}
	 */
	public HighlightDocument(String text, SyntaxNode root, Semantics semantics, SnippetAnalyzer snippetAnalyzer) {
		this.text = Objects.requireNonNull(text, "text");
		this.root = Objects.requireNonNull(root, "root");
		TextRange expected = TextRange.of(0, TextRange.utf8Length(text));
		if (!expected.equals(root.getTextRange())) {
			throw new IllegalArgumentException("Tree " + root + " does not span the document " + expected);
		}
		this.semantics = semantics != null ? semantics : Semantics.NONE;
		this.snippetAnalyzer = snippetAnalyzer;
	}

	public String getText() {
		return text;
	}

	public SyntaxNode getRoot() {
		return root;
	}

	public Semantics getSemantics() {
		return semantics;
	}

	/**
	 * May be {@code null}, in which case embedded code is not highlighted.
	 */
	public SnippetAnalyzer getSnippetAnalyzer() {
		return snippetAnalyzer;
	}

	public LineIndex getLineIndex() {
		LineIndex index = lineIndex;
		if (index == null) {
			index = new LineIndex(text);
			lineIndex = index;
		}
		return index;
	}
}
