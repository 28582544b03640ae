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
package com.tomaszrup.rusthighlight.highlight;

import java.util.Objects;

import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * A range of source text with its highlight. The optional binding hash tells
 * same-named local bindings apart.
 */
public final class HighlightedRange {
	private final TextRange range;
	private final Highlight highlight;
	private final Long bindingHash;

	public HighlightedRange(TextRange range, Highlight highlight) {
		this(range, highlight, null);
	}

	public HighlightedRange(TextRange range, Highlight highlight, Long bindingHash) {
		this.range = Objects.requireNonNull(range, "range");
		this.highlight = Objects.requireNonNull(highlight, "highlight");
		this.bindingHash = bindingHash;
	}

	public TextRange getRange() {
		return range;
	}

	public Highlight getHighlight() {
		return highlight;
	}

	/**
	 * Returns the binding hash, or {@code null} for anything but locals.
	 */
	public Long getBindingHash() {
		return bindingHash;
	}

	public HighlightedRange withRange(TextRange newRange) {
		return new HighlightedRange(newRange, highlight, bindingHash);
	}

	public HighlightedRange withHighlight(Highlight newHighlight) {
		return new HighlightedRange(range, newHighlight, bindingHash);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof HighlightedRange)) return false;
		HighlightedRange other = (HighlightedRange) o;
		return range.equals(other.range) && highlight.equals(other.highlight)
				&& Objects.equals(bindingHash, other.bindingHash);
	}

	@Override
	public int hashCode() {
		return Objects.hash(range, highlight, bindingHash);
	}

	@Override
	public String toString() {
		return range + " " + highlight + (bindingHash != null ? " #" + Long.toHexString(bindingHash) : "");
	}
}
