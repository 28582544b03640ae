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

/**
 * One source character of a string literal after unescaping: either a code
 * point or the reason its escape sequence is invalid. The range is relative to
 * the start of the literal token and covers the whole escape sequence for
 * escaped characters.
 */
public final class CharPiece {
	private final TextRange range;
	private final int codePoint;
	private final EscapeError error;
	private final boolean escaped;

	private CharPiece(TextRange range, int codePoint, EscapeError error, boolean escaped) {
		this.range = range;
		this.codePoint = codePoint;
		this.error = error;
		this.escaped = escaped;
	}

	public static CharPiece of(TextRange range, int codePoint, boolean escaped) {
		return new CharPiece(range, codePoint, null, escaped);
	}

	public static CharPiece error(TextRange range, EscapeError error) {
		return new CharPiece(range, -1, error, true);
	}

	public TextRange getRange() {
		return range;
	}

	public boolean isOk() {
		return error == null;
	}

	/**
	 * Returns the unescaped code point, or -1 for an error piece.
	 */
	public int getCodePoint() {
		return codePoint;
	}

	public EscapeError getError() {
		return error;
	}

	/**
	 * Whether the piece was written as a backslash escape in the source.
	 */
	public boolean isEscaped() {
		return escaped;
	}

	@Override
	public String toString() {
		if (error != null) {
			return range + " " + error;
		}
		return range + " " + new String(Character.toChars(codePoint));
	}
}
