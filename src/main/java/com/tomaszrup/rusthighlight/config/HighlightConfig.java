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
package com.tomaszrup.rusthighlight.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable highlighting options. Use {@link #defaults()} or
 * {@link #builder()}.
 */
public final class HighlightConfig {
	public static final String DEFAULT_FIXTURE_PREFIX = "ra_fixture";
	public static final List<String> DEFAULT_FORMAT_MACROS =
			Collections.unmodifiableList(Arrays.asList("format_args", "format_args_nl"));

	private static final HighlightConfig DEFAULTS = builder().build();

	private final boolean semanticHighlighting;
	private final boolean syntacticNameRefHighlighting;
	private final boolean injectDocTests;
	private final String fixturePrefix;
	private final List<String> formatMacros;
	private final String logLevel;

	private HighlightConfig(Builder builder) {
		this.semanticHighlighting = builder.semanticHighlighting;
		this.syntacticNameRefHighlighting = builder.syntacticNameRefHighlighting;
		this.injectDocTests = builder.injectDocTests;
		this.fixturePrefix = builder.fixturePrefix;
		this.formatMacros = Collections.unmodifiableList(new ArrayList<>(builder.formatMacros));
		this.logLevel = builder.logLevel;
	}

	public static HighlightConfig defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.semanticHighlighting(semanticHighlighting)
				.syntacticNameRefHighlighting(syntacticNameRefHighlighting)
				.injectDocTests(injectDocTests)
				.fixturePrefix(fixturePrefix)
				.formatMacros(formatMacros)
				.logLevel(logLevel);
	}

	/** Whether semantic tokens are produced at all. */
	public boolean isSemanticHighlighting() {
		return semanticHighlighting;
	}

	/**
	 * Whether unresolved name references are classified from syntax instead
	 * of being reported as unresolved.
	 */
	public boolean isSyntacticNameRefHighlighting() {
		return syntacticNameRefHighlighting;
	}

	public boolean isInjectDocTests() {
		return injectDocTests;
	}

	public String getFixturePrefix() {
		return fixturePrefix;
	}

	/** Macros whose first argument is a format string. */
	public List<String> getFormatMacros() {
		return formatMacros;
	}

	/**
	 * Requested Logback root level, or {@code null} to keep the current one.
	 */
	public String getLogLevel() {
		return logLevel;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof HighlightConfig)) return false;
		HighlightConfig other = (HighlightConfig) o;
		return semanticHighlighting == other.semanticHighlighting
				&& syntacticNameRefHighlighting == other.syntacticNameRefHighlighting
				&& injectDocTests == other.injectDocTests
				&& fixturePrefix.equals(other.fixturePrefix)
				&& formatMacros.equals(other.formatMacros)
				&& Objects.equals(logLevel, other.logLevel);
	}

	@Override
	public int hashCode() {
		return Objects.hash(semanticHighlighting, syntacticNameRefHighlighting, injectDocTests, fixturePrefix,
				formatMacros, logLevel);
	}

	@Override
	public String toString() {
		return "HighlightConfig{semanticHighlighting=" + semanticHighlighting
				+ ", syntacticNameRefHighlighting=" + syntacticNameRefHighlighting
				+ ", injectDocTests=" + injectDocTests
				+ ", fixturePrefix=" + fixturePrefix
				+ ", formatMacros=" + formatMacros
				+ ", logLevel=" + logLevel + "}";
	}

	public static final class Builder {
		private boolean semanticHighlighting = true;
		private boolean syntacticNameRefHighlighting = false;
		private boolean injectDocTests = true;
		private String fixturePrefix = DEFAULT_FIXTURE_PREFIX;
		private List<String> formatMacros = DEFAULT_FORMAT_MACROS;
		private String logLevel;

		private Builder() {
		}

		public Builder semanticHighlighting(boolean value) {
			this.semanticHighlighting = value;
			return this;
		}

		public Builder syntacticNameRefHighlighting(boolean value) {
			this.syntacticNameRefHighlighting = value;
			return this;
		}

		public Builder injectDocTests(boolean value) {
			this.injectDocTests = value;
			return this;
		}

		public Builder fixturePrefix(String value) {
			this.fixturePrefix = Objects.requireNonNull(value, "fixturePrefix");
			return this;
		}

		public Builder formatMacros(List<String> value) {
			this.formatMacros = Objects.requireNonNull(value, "formatMacros");
			return this;
		}

		public Builder logLevel(String value) {
			this.logLevel = value;
			return this;
		}

		public HighlightConfig build() {
			return new HighlightConfig(this);
		}
	}
}
