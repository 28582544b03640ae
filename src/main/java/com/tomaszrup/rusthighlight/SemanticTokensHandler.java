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

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensParams;
import org.eclipse.lsp4j.SemanticTokensRangeParams;

import com.tomaszrup.rusthighlight.config.HighlightConfig;
import com.tomaszrup.rusthighlight.providers.SemanticTokensProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles LSP semantic tokens requests (full and range), including fallback
 * caching of the last successful result per URI.
 */
public class SemanticTokensHandler {
	private static final Logger logger = LoggerFactory.getLogger(SemanticTokensHandler.class);

	private final Map<URI, SemanticTokens> lastSemanticTokensByUri = new ConcurrentHashMap<>();
	private final HighlightConfig config;
	private final Function<URI, HighlightDocument> documents;
	private final SemanticTokensProvider provider;

	/**
	 * @param documents resolves the current state of a document; returns
	 *                  {@code null} when the document is unknown or not
	 *                  parsed yet
	 */
	public SemanticTokensHandler(HighlightConfig config, Function<URI, HighlightDocument> documents) {
		this.config = config;
		this.documents = documents;
		this.provider = new SemanticTokensProvider(config);
	}

	public HighlightConfig getConfig() {
		return config;
	}

	public void clearCache(URI uri) {
		lastSemanticTokensByUri.remove(uri);
	}

	public CompletableFuture<SemanticTokens> semanticTokensFull(SemanticTokensParams params) {
		if (!config.isSemanticHighlighting()) {
			return completedEmptySemanticTokens();
		}
		URI uri = URI.create(params.getTextDocument().getUri());
		HighlightDocument document;
		try {
			document = documents.apply(uri);
		} catch (RuntimeException e) {
			return CompletableFuture.completedFuture(handleSemanticTokensFullResult(uri, null, e));
		}
		if (document == null) {
			return handleSemanticTokensFullDocumentUnavailable(uri);
		}
		return provider.provideSemanticTokensFull(document)
				.handle((tokens, throwable) -> handleSemanticTokensFullResult(uri, tokens, throwable));
	}

	private CompletableFuture<SemanticTokens> handleSemanticTokensFullDocumentUnavailable(URI uri) {
		logger.debug("semanticTokensFull uri={} documentUnavailable=true", uri);
		SemanticTokens fallback = lastSemanticTokensByUri.get(uri);
		return CompletableFuture.completedFuture(fallback != null ? fallback : emptySemanticTokens());
	}

	private SemanticTokens handleSemanticTokensFullResult(
			URI uri,
			SemanticTokens tokens,
			Throwable throwable) {
		if (throwable != null) {
			logger.warn("semanticTokensFull failed uri={} error={}", uri, throwable.toString());
			logger.debug("semanticTokensFull failure details", throwable);
			SemanticTokens fallback = lastSemanticTokensByUri.get(uri);
			return fallback != null ? fallback : emptySemanticTokens();
		}
		if (tokens != null && tokens.getData() != null && !tokens.getData().isEmpty()) {
			lastSemanticTokensByUri.put(uri, tokens);
			return tokens;
		}
		SemanticTokens fallback = lastSemanticTokensByUri.get(uri);
		if (fallback != null) {
			logger.debug("semanticTokensFull uri={} usingFallback=true", uri);
			return fallback;
		}
		return tokens != null ? tokens : emptySemanticTokens();
	}

	public CompletableFuture<SemanticTokens> semanticTokensRange(SemanticTokensRangeParams params) {
		if (!config.isSemanticHighlighting()) {
			return completedEmptySemanticTokens();
		}
		URI uri = URI.create(params.getTextDocument().getUri());
		HighlightDocument document;
		try {
			document = documents.apply(uri);
		} catch (RuntimeException e) {
			logger.warn("semanticTokensRange failed uri={} error={}", uri, e.toString());
			logger.debug("semanticTokensRange failure details", e);
			return completedEmptySemanticTokens();
		}
		if (document == null) {
			logger.debug("semanticTokensRange uri={} documentUnavailable=true", uri);
			return completedEmptySemanticTokens();
		}
		return provider.provideSemanticTokensRange(document, params.getRange())
				.handle((tokens, throwable) -> {
					if (throwable != null) {
						logger.warn("semanticTokensRange failed uri={} error={}", uri, throwable.toString());
						logger.debug("semanticTokensRange failure details", throwable);
						return emptySemanticTokens();
					}
					return tokens != null ? tokens : emptySemanticTokens();
				});
	}

	private CompletableFuture<SemanticTokens> completedEmptySemanticTokens() {
		return CompletableFuture.completedFuture(emptySemanticTokens());
	}

	private SemanticTokens emptySemanticTokens() {
		return new SemanticTokens(Collections.emptyList());
	}
}
