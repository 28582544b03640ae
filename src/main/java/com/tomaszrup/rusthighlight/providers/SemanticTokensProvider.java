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
package com.tomaszrup.rusthighlight.providers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensLegend;

import com.tomaszrup.lsp.utils.LineIndex;
import com.tomaszrup.rusthighlight.HighlightDocument;
import com.tomaszrup.rusthighlight.config.HighlightConfig;
import com.tomaszrup.rusthighlight.highlight.HighlightModifier;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.highlight.HighlightedRange;
import com.tomaszrup.rusthighlight.highlight.SemanticHighlighter;
import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * Provides semantic tokens for Rust documents, enabling semantic-aware
 * syntax highlighting in editors that support the LSP semantic tokens protocol.
 */
public class SemanticTokensProvider {

	// Token types, indexed by HighlightTag ordinal
	public static final List<String> TOKEN_TYPES;

	// Token modifiers, bit i is the HighlightModifier with ordinal i
	public static final List<String> TOKEN_MODIFIERS;

	static {
		List<String> types = new ArrayList<>();
		for (HighlightTag tag : HighlightTag.values()) {
			types.add(tag.getName());
		}
		TOKEN_TYPES = Collections.unmodifiableList(types);
		List<String> modifiers = new ArrayList<>();
		for (HighlightModifier modifier : HighlightModifier.values()) {
			modifiers.add(modifier.getName());
		}
		TOKEN_MODIFIERS = Collections.unmodifiableList(modifiers);
	}

	private final HighlightConfig config;

	public SemanticTokensProvider(HighlightConfig config) {
		this.config = config;
	}

	public static SemanticTokensLegend getLegend() {
		return new SemanticTokensLegend(TOKEN_TYPES, TOKEN_MODIFIERS);
	}

	public CompletableFuture<SemanticTokens> provideSemanticTokensFull(HighlightDocument document) {
		return provide(document, null);
	}

	/**
	 * Provides semantic tokens for a range of a document. Only the part of the
	 * tree intersecting the range is walked; tokens crossing its edges are
	 * reported whole.
	 */
	public CompletableFuture<SemanticTokens> provideSemanticTokensRange(HighlightDocument document, Range range) {
		LineIndex lineIndex = document.getLineIndex();
		Range normalized = LineIndex.normalize(range);
		TextRange viewport = TextRange.of(
				lineIndex.toClampedOffset(normalized.getStart()),
				lineIndex.toClampedOffset(normalized.getEnd()));
		return provide(document, viewport);
	}

	private CompletableFuture<SemanticTokens> provide(HighlightDocument document, TextRange viewport) {
		List<HighlightedRange> ranges;
		try {
			SemanticHighlighter highlighter = new SemanticHighlighter(config, document.getSemantics(),
					document.getSnippetAnalyzer());
			ranges = highlighter.highlight(document.getRoot(), viewport);
		} catch (RuntimeException e) {
			CompletableFuture<SemanticTokens> failed = new CompletableFuture<>();
			failed.completeExceptionally(e);
			return failed;
		}
		List<SemanticToken> tokens = toTokens(ranges, document.getLineIndex());
		return CompletableFuture.completedFuture(new SemanticTokens(encodeTokens(tokens)));
	}

	/**
	 * Converts sorted byte ranges into line/column tokens, one per line a range
	 * spans. {@code dummy} ranges and empty pieces produce no token.
	 */
	static List<SemanticToken> toTokens(List<HighlightedRange> ranges, LineIndex lineIndex) {
		List<SemanticToken> tokens = new ArrayList<>(ranges.size());
		for (HighlightedRange range : ranges) {
			HighlightTag tag = range.getHighlight().getTag();
			if (tag == HighlightTag.DUMMY) {
				continue;
			}
			int start = range.getRange().getStart();
			int end = range.getRange().getEnd();
			int firstLine = lineIndex.lineOf(start);
			int lastLine = lineIndex.lineOf(end);
			for (int line = firstLine; line <= lastLine; line++) {
				int pieceStart = line == firstLine ? start : lineIndex.getLineStart(line);
				int pieceEnd = line == lastLine ? end : lineIndex.getLineEnd(line);
				if (pieceEnd <= pieceStart) {
					continue;
				}
				SemanticToken token = new SemanticToken();
				token.line = line;
				token.column = lineIndex.toPosition(pieceStart).getCharacter();
				token.length = lineIndex.utf16Length(pieceStart, pieceEnd);
				token.tokenType = tag.ordinal();
				token.tokenModifiers = range.getHighlight().getModifierBits();
				tokens.add(token);
			}
		}
		return tokens;
	}

	/**
	 * Encodes tokens into the LSP relative format:
	 * {@code [deltaLine, deltaStart, length, tokenType, tokenModifiers]}.
	 */
	static List<Integer> encodeTokens(List<SemanticToken> tokens) {
		List<Integer> data = new ArrayList<>(tokens.size() * 5);
		int prevLine = 0;
		int prevColumn = 0;

		for (SemanticToken token : tokens) {
			int deltaLine = token.line - prevLine;
			int deltaColumn = (deltaLine == 0) ? token.column - prevColumn : token.column;

			data.add(deltaLine);
			data.add(deltaColumn);
			data.add(token.length);
			data.add(token.tokenType);
			data.add(token.tokenModifiers);

			prevLine = token.line;
			prevColumn = token.column;
		}

		return data;
	}

	static class SemanticToken {
		int line;
		int column;
		int length;
		int tokenType;
		int tokenModifiers;
	}
}
