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

import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * A half-open range {@code [start, end)} of UTF-8 byte offsets into a source
 * text.
 */
public final class TextRange {

	/** Orders ranges by start offset, then by end offset. */
	public static final Comparator<TextRange> BY_START = (TextRange r1, TextRange r2) -> {
		if (r1.start != r2.start) {
			return Integer.compare(r1.start, r2.start);
		}
		return Integer.compare(r1.end, r2.end);
	};

	private final int start;
	private final int end;

	private TextRange(int start, int end) {
		this.start = start;
		this.end = end;
	}

	public static TextRange of(int start, int end) {
		if (start < 0 || start > end) {
			throw new IllegalArgumentException("Invalid text range [" + start + "; " + end + ")");
		}
		return new TextRange(start, end);
	}

	public static TextRange at(int offset, int length) {
		return of(offset, offset + length);
	}

	public static TextRange empty(int offset) {
		return of(offset, offset);
	}

	/**
	 * Number of UTF-8 bytes needed to encode {@code text}.
	 */
	public static int utf8Length(CharSequence text) {
		return text.toString().getBytes(StandardCharsets.UTF_8).length;
	}

	/**
	 * Number of UTF-8 bytes needed to encode a single code point.
	 */
	public static int utf8Length(int codePoint) {
		if (codePoint < 0x80) {
			return 1;
		} else if (codePoint < 0x800) {
			return 2;
		} else if (codePoint < 0x10000) {
			return 3;
		}
		return 4;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int getLength() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	/**
	 * Whether {@code offset} lies inside this range. The end offset is
	 * excluded.
	 */
	public boolean contains(int offset) {
		return start <= offset && offset < end;
	}

	public boolean containsInclusive(int offset) {
		return start <= offset && offset <= end;
	}

	public boolean containsRange(TextRange other) {
		return start <= other.start && other.end <= end;
	}

	/**
	 * Returns the common part of both ranges, or {@code null} when they are
	 * apart. Ranges that only touch intersect in an empty range.
	 */
	public TextRange intersect(TextRange other) {
		int s = Math.max(start, other.start);
		int e = Math.min(end, other.end);
		if (s > e) {
			return null;
		}
		return new TextRange(s, e);
	}

	public TextRange cover(TextRange other) {
		return new TextRange(Math.min(start, other.start), Math.max(end, other.end));
	}

	public TextRange shift(int delta) {
		return of(start + delta, end + delta);
	}

	public TextRange withStart(int newStart) {
		return of(newStart, end);
	}

	public TextRange withEnd(int newEnd) {
		return of(start, newEnd);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TextRange)) return false;
		TextRange other = (TextRange) o;
		return start == other.start && end == other.end;
	}

	@Override
	public int hashCode() {
		return 31 * start + end;
	}

	@Override
	public String toString() {
		return "[" + start + "; " + end + ")";
	}
}
