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

import java.util.EnumSet;
import java.util.Set;

/**
 * A tag with its modifiers. Immutable.
 */
public final class Highlight {
	private final HighlightTag tag;
	private final int modifiers;

	private Highlight(HighlightTag tag, int modifiers) {
		this.tag = tag;
		this.modifiers = modifiers;
	}

	public static Highlight of(HighlightTag tag) {
		return new Highlight(tag, 0);
	}

	public static Highlight of(HighlightTag tag, HighlightModifier... modifiers) {
		int bits = 0;
		for (HighlightModifier modifier : modifiers) {
			bits |= modifier.mask();
		}
		return new Highlight(tag, bits);
	}

	public HighlightTag getTag() {
		return tag;
	}

	public Highlight with(HighlightModifier modifier) {
		return new Highlight(tag, modifiers | modifier.mask());
	}

	public Highlight withTag(HighlightTag newTag) {
		return new Highlight(newTag, modifiers);
	}

	public boolean has(HighlightModifier modifier) {
		return (modifiers & modifier.mask()) != 0;
	}

	public int getModifierBits() {
		return modifiers;
	}

	public Set<HighlightModifier> getModifiers() {
		EnumSet<HighlightModifier> result = EnumSet.noneOf(HighlightModifier.class);
		for (HighlightModifier modifier : HighlightModifier.values()) {
			if (has(modifier)) {
				result.add(modifier);
			}
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Highlight)) return false;
		Highlight other = (Highlight) o;
		return tag == other.tag && modifiers == other.modifiers;
	}

	@Override
	public int hashCode() {
		return 31 * tag.hashCode() + modifiers;
	}

	/**
	 * Tag name followed by {@code .modifier} for each modifier, for example
	 * {@code function.associated.unsafe}.
	 */
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder(tag.getName());
		for (HighlightModifier modifier : getModifiers()) {
			builder.append('.').append(modifier.getName());
		}
		return builder.toString();
	}
}
