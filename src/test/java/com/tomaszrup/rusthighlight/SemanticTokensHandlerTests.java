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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.rusthighlight;

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensParams;
import org.eclipse.lsp4j.SemanticTokensRangeParams;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.rusthighlight.config.HighlightConfig;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.semantics.NameRefClass;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;

/**
 * Tests for {@link SemanticTokensHandler}: the enable switch, missing
 * documents, failures and the per-URI fallback cache.
 */
class SemanticTokensHandlerTests {
	private static final URI URI_MAIN = URI.create("file:///workspace/src/main.rs");
	private static final String SOURCE = "fn main() {}";
	private static final List<Integer> SOURCE_DATA = Arrays.asList(
			0, 0, 2, HighlightTag.KEYWORD.ordinal(), 0,
			0, 7, 1, HighlightTag.PUNCTUATION.ordinal(), 0,
			0, 1, 1, HighlightTag.PUNCTUATION.ordinal(), 0,
			0, 2, 1, HighlightTag.PUNCTUATION.ordinal(), 0,
			0, 1, 1, HighlightTag.PUNCTUATION.ordinal(), 0);

	private final Map<URI, HighlightDocument> documents = new HashMap<>();
	private SemanticTokensHandler handler;

	@BeforeEach
	void setup() {
		documents.clear();
		handler = new SemanticTokensHandler(HighlightConfig.defaults(), documents::get);
	}

	private static SemanticTokensParams fullParams(URI uri) {
		return new SemanticTokensParams(new TextDocumentIdentifier(uri.toString()));
	}

	private static SemanticTokensRangeParams rangeParams(URI uri, Range range) {
		return new SemanticTokensRangeParams(new TextDocumentIdentifier(uri.toString()), range);
	}

	private static HighlightDocument lexed(String text) {
		return new HighlightDocument(text, TestLexer.lex(text), Semantics.NONE);
	}

	/** A document whose semantic queries fail. */
	private static HighlightDocument failing() {
		SyntaxNode root = TreeFixtures.build(TreeFixtures.node(SyntaxKind.SOURCE_FILE, TreeFixtures.pathExpr("x")));
		TestSemantics semantics = new TestSemantics() {
			@Override
			public Optional<NameRefClass> classifyNameRef(SyntaxNode nameRef) {
				throw new IllegalStateException("analysis cancelled");
			}
		};
		return new HighlightDocument("x", root, semantics);
	}

	// --- semanticTokensFull ---

	@Test
	void testFullReturnsTokens() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		SemanticTokens result = handler.semanticTokensFull(fullParams(URI_MAIN)).get();
		Assertions.assertEquals(SOURCE_DATA, result.getData());
	}

	@Test
	void testFullDisabledReturnsEmpty() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		SemanticTokensHandler disabled = new SemanticTokensHandler(
				HighlightConfig.builder().semanticHighlighting(false).build(), documents::get);
		Assertions.assertTrue(disabled.semanticTokensFull(fullParams(URI_MAIN)).get().getData().isEmpty());
	}

	@Test
	void testFullUnknownDocumentReturnsEmpty() throws Exception {
		Assertions.assertTrue(handler.semanticTokensFull(fullParams(URI_MAIN)).get().getData().isEmpty());
	}

	@Test
	void testFullFallsBackWhenDocumentDisappears() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		handler.semanticTokensFull(fullParams(URI_MAIN)).get();
		documents.remove(URI_MAIN);

		SemanticTokens result = handler.semanticTokensFull(fullParams(URI_MAIN)).get();

		Assertions.assertEquals(SOURCE_DATA, result.getData());
	}

	@Test
	void testFullFallsBackOnFailure() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		handler.semanticTokensFull(fullParams(URI_MAIN)).get();
		documents.put(URI_MAIN, failing());

		SemanticTokens result = handler.semanticTokensFull(fullParams(URI_MAIN)).get();

		Assertions.assertEquals(SOURCE_DATA, result.getData());
	}

	@Test
	void testFullFailureWithoutCacheReturnsEmpty() throws Exception {
		documents.put(URI_MAIN, failing());
		Assertions.assertTrue(handler.semanticTokensFull(fullParams(URI_MAIN)).get().getData().isEmpty());
	}

	@Test
	void testFullResolverExceptionFallsBack() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		boolean[] broken = { false };
		SemanticTokensHandler flaky = new SemanticTokensHandler(HighlightConfig.defaults(), uri -> {
			if (broken[0]) {
				throw new IllegalStateException("parse failed");
			}
			return documents.get(uri);
		});
		flaky.semanticTokensFull(fullParams(URI_MAIN)).get();
		broken[0] = true;

		Assertions.assertEquals(SOURCE_DATA, flaky.semanticTokensFull(fullParams(URI_MAIN)).get().getData());
	}

	@Test
	void testFullEmptyResultUsesFallback() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		handler.semanticTokensFull(fullParams(URI_MAIN)).get();
		// only an identifier, which yields no tokens
		documents.put(URI_MAIN, lexed("main"));

		Assertions.assertEquals(SOURCE_DATA, handler.semanticTokensFull(fullParams(URI_MAIN)).get().getData());
	}

	@Test
	void testClearCacheDropsFallback() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		handler.semanticTokensFull(fullParams(URI_MAIN)).get();
		handler.clearCache(URI_MAIN);
		documents.remove(URI_MAIN);

		Assertions.assertTrue(handler.semanticTokensFull(fullParams(URI_MAIN)).get().getData().isEmpty());
	}

	// --- semanticTokensRange ---

	@Test
	void testRangeReturnsTokensInRange() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		Range range = new Range(new Position(0, 0), new Position(0, 2));

		SemanticTokens result = handler.semanticTokensRange(rangeParams(URI_MAIN, range)).get();

		Assertions.assertEquals(Arrays.asList(0, 0, 2, HighlightTag.KEYWORD.ordinal(), 0), result.getData());
	}

	@Test
	void testRangeFailureReturnsEmpty() throws Exception {
		documents.put(URI_MAIN, failing());
		Range range = new Range(new Position(0, 0), new Position(0, 1));
		Assertions.assertEquals(Collections.emptyList(),
				handler.semanticTokensRange(rangeParams(URI_MAIN, range)).get().getData());
	}

	@Test
	void testRangeUnknownDocumentReturnsEmpty() throws Exception {
		Range range = new Range(new Position(0, 0), new Position(0, 1));
		Assertions.assertTrue(handler.semanticTokensRange(rangeParams(URI_MAIN, range)).get().getData().isEmpty());
	}

	@Test
	void testRangeDisabledReturnsEmpty() throws Exception {
		documents.put(URI_MAIN, lexed(SOURCE));
		SemanticTokensHandler disabled = new SemanticTokensHandler(
				HighlightConfig.builder().semanticHighlighting(false).build(), documents::get);
		Range range = new Range(new Position(0, 0), new Position(0, 2));
		Assertions.assertTrue(disabled.semanticTokensRange(rangeParams(URI_MAIN, range)).get().getData().isEmpty());
	}
}
