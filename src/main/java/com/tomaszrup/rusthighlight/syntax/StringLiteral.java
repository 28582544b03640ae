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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * View over a {@link SyntaxKind#STRING} token: quotes, contents and the
 * unescaped characters.
 */
public final class StringLiteral {
	private final SyntaxToken token;
	private final String text;
	private final int openQuoteEnd;
	private final int closeQuoteStart;

	private StringLiteral(SyntaxToken token) {
		this.token = token;
		this.text = token.getText();
		int first = text.indexOf('"');
		int last = text.lastIndexOf('"');
		if (first < 0 || last <= first) {
			openQuoteEnd = -1;
			closeQuoteStart = -1;
		} else {
			openQuoteEnd = TextRange.utf8Length(text.substring(0, first + 1));
			closeQuoteStart = TextRange.utf8Length(text.substring(0, last));
		}
	}

	/**
	 * Returns a view over {@code token}, or {@code null} if it is not a string
	 * literal.
	 */
	public static StringLiteral cast(SyntaxToken token) {
		if (token == null || token.getKind() != SyntaxKind.STRING) {
			return null;
		}
		return new StringLiteral(token);
	}

	public SyntaxToken getToken() {
		return token;
	}

	public boolean isRaw() {
		return text.startsWith("r");
	}

	/**
	 * Whether both the opening and the closing quote are present.
	 */
	public boolean isTerminated() {
		return openQuoteEnd >= 0;
	}

	/** Absolute range of the opening quote including any raw prefix. */
	public TextRange getOpenQuoteRange() {
		if (!isTerminated()) {
			return null;
		}
		return TextRange.at(token.getTextRange().getStart(), openQuoteEnd);
	}

	/** Absolute range between the quotes. */
	public TextRange getContentsRange() {
		if (!isTerminated()) {
			return null;
		}
		return TextRange.of(openQuoteEnd, closeQuoteStart).shift(token.getTextRange().getStart());
	}

	/** Absolute range of the closing quote including any raw suffix. */
	public TextRange getCloseQuoteRange() {
		if (!isTerminated()) {
			return null;
		}
		return TextRange.of(closeQuoteStart, token.getTextLength()).shift(token.getTextRange().getStart());
	}

	private String contentsText() {
		int first = text.indexOf('"');
		int last = text.lastIndexOf('"');
		return text.substring(first + 1, last);
	}

	/**
	 * Returns the characters of the literal with ranges relative to the token
	 * start, or {@code null} if the literal is unterminated.
	 */
	public List<CharPiece> pieces() {
		if (!isTerminated()) {
			return null;
		}
		String contents = contentsText();
		if (isRaw()) {
			List<CharPiece> pieces = new ArrayList<>();
			int pos = openQuoteEnd;
			for (int i = 0; i < contents.length();) {
				int cp = contents.codePointAt(i);
				int length = TextRange.utf8Length(cp);
				pieces.add(CharPiece.of(TextRange.at(pos, length), cp, false));
				pos += length;
				i += Character.charCount(cp);
			}
			return Collections.unmodifiableList(pieces);
		}
		return Collections.unmodifiableList(new Unescaper(contents, openQuoteEnd).run());
	}

	/**
	 * Returns the value of the literal, or {@code null} if it is unterminated
	 * or contains an invalid escape.
	 */
	public String getValue() {
		if (!isTerminated()) {
			return null;
		}
		if (isRaw()) {
			return contentsText();
		}
		StringBuilder builder = new StringBuilder();
		for (CharPiece piece : pieces()) {
			if (!piece.isOk()) {
				return null;
			}
			builder.appendCodePoint(piece.getCodePoint());
		}
		return builder.toString();
	}

	private static final class Unescaper {
		private final String contents;
		private final List<CharPiece> pieces = new ArrayList<>();
		private int index;
		private int pos;

		private Unescaper(String contents, int base) {
			this.contents = contents;
			this.pos = base;
		}

		private boolean atEnd() {
			return index >= contents.length();
		}

		private int peek() {
			return atEnd() ? -1 : contents.codePointAt(index);
		}

		private int bump() {
			int cp = contents.codePointAt(index);
			index += Character.charCount(cp);
			pos += TextRange.utf8Length(cp);
			return cp;
		}

		private List<CharPiece> run() {
			while (!atEnd()) {
				int start = pos;
				int cp = bump();
				if (cp == '\\') {
					escape(start);
				} else if (cp == '\r') {
					pieces.add(CharPiece.error(TextRange.of(start, pos), EscapeError.BARE_CARRIAGE_RETURN));
				} else {
					pieces.add(CharPiece.of(TextRange.of(start, pos), cp, false));
				}
			}
			return pieces;
		}

		private void escape(int start) {
			if (atEnd()) {
				fail(start, EscapeError.LONE_SLASH);
				return;
			}
			int cp = bump();
			switch (cp) {
				case 'n':
					ok(start, '\n');
					break;
				case 'r':
					ok(start, '\r');
					break;
				case 't':
					ok(start, '\t');
					break;
				case '0':
					ok(start, 0);
					break;
				case '\\':
				case '\'':
				case '"':
					ok(start, cp);
					break;
				case 'x':
					hexEscape(start);
					break;
				case 'u':
					unicodeEscape(start);
					break;
				case '\n':
					while (peek() == ' ' || peek() == '\t' || peek() == '\n' || peek() == '\r') {
						bump();
					}
					break;
				default:
					fail(start, EscapeError.INVALID_ESCAPE);
			}
		}

		private void hexEscape(int start) {
			int value = 0;
			for (int i = 0; i < 2; i++) {
				if (atEnd()) {
					fail(start, EscapeError.TOO_SHORT_HEX_ESCAPE);
					return;
				}
				int digit = Character.digit(bump(), 16);
				if (digit < 0) {
					fail(start, EscapeError.INVALID_CHAR_IN_HEX_ESCAPE);
					return;
				}
				value = value * 16 + digit;
			}
			if (value > 0x7F) {
				fail(start, EscapeError.OUT_OF_RANGE_HEX_ESCAPE);
				return;
			}
			ok(start, value);
		}

		private void unicodeEscape(int start) {
			if (peek() != '{') {
				fail(start, EscapeError.NO_BRACE_IN_UNICODE_ESCAPE);
				return;
			}
			bump();
			if (peek() == '_') {
				bump();
				fail(start, EscapeError.LEADING_UNDERSCORE_UNICODE_ESCAPE);
				return;
			}
			if (peek() == '}') {
				bump();
				fail(start, EscapeError.EMPTY_UNICODE_ESCAPE);
				return;
			}
			int digits = 0;
			int value = 0;
			while (true) {
				if (atEnd()) {
					fail(start, EscapeError.UNCLOSED_UNICODE_ESCAPE);
					return;
				}
				int cp = bump();
				if (cp == '_') {
					continue;
				}
				if (cp == '}') {
					break;
				}
				int digit = Character.digit(cp, 16);
				if (digit < 0) {
					fail(start, EscapeError.INVALID_CHAR_IN_UNICODE_ESCAPE);
					return;
				}
				digits++;
				if (digits <= 6) {
					value = value * 16 + digit;
				}
			}
			if (digits > 6) {
				fail(start, EscapeError.OVERLONG_UNICODE_ESCAPE);
			} else if (value >= 0xD800 && value <= 0xDFFF) {
				fail(start, EscapeError.LONE_SURROGATE_UNICODE_ESCAPE);
			} else if (value > 0x10FFFF) {
				fail(start, EscapeError.OUT_OF_RANGE_UNICODE_ESCAPE);
			} else {
				ok(start, value);
			}
		}

		private void ok(int start, int codePoint) {
			pieces.add(CharPiece.of(TextRange.of(start, pos), codePoint, true));
		}

		private void fail(int start, EscapeError error) {
			pieces.add(CharPiece.error(TextRange.of(start, pos), error));
		}
	}
}
