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

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Lexes the placeholders of a Rust format string, for example
 * {@code {name:>8.2$?}}, over the unescaped characters of the literal.
 * Malformed placeholders are abandoned at the first unexpected character;
 * text outside placeholders and {@code {{} escapes report nothing.
 */
public final class FormatSpecifierLexer {
	private final List<CharPiece> pieces;
	private final BiConsumer<TextRange, FormatSpecifier> callback;
	private int index;

	private FormatSpecifierLexer(List<CharPiece> pieces, BiConsumer<TextRange, FormatSpecifier> callback) {
		this.pieces = pieces;
		this.callback = callback;
	}

	/**
	 * Reports every placeholder piece in source order. Ranges are those of the
	 * character pieces they cover.
	 */
	public static void lex(List<CharPiece> pieces, BiConsumer<TextRange, FormatSpecifier> callback) {
		new FormatSpecifierLexer(pieces, callback).run();
	}

	private int peek(int ahead) {
		int i = index + ahead;
		if (i >= pieces.size() || !pieces.get(i).isOk()) {
			return -1;
		}
		return pieces.get(i).getCodePoint();
	}

	private int peek() {
		return peek(0);
	}

	private boolean hasMore() {
		return index < pieces.size();
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentStart(int c) {
		return c == '_' || (c >= 0 && Character.isAlphabetic(c));
	}

	private void run() {
		while (hasMore()) {
			CharPiece first = pieces.get(index++);
			if (first.isOk() && first.getCodePoint() == '{') {
				placeholder(first);
			} else {
				while (hasMore() && pieces.get(index).isOk() && peek() != '{') {
					index++;
				}
			}
		}
	}

	private void placeholder(CharPiece open) {
		if (peek() == '{') {
			// `{{` is an escaped brace
			index++;
			return;
		}
		callback.accept(open.getRange(), FormatSpecifier.OPEN);

		int c = peek();
		if (isDigit(c)) {
			readInteger();
		} else if (isIdentStart(c)) {
			readIdentifier();
		}

		if (peek() == ':') {
			emit(FormatSpecifier.COLON);

			int fill = peek(0);
			int align = peek(1);
			if (align == '<' || align == '^' || align == '>') {
				emit(FormatSpecifier.FILL);
				emit(FormatSpecifier.ALIGN);
			} else if (fill == '<' || fill == '^' || fill == '>') {
				emit(FormatSpecifier.ALIGN);
			}

			if (peek() == '+' || peek() == '-') {
				emit(FormatSpecifier.SIGN);
			}
			if (peek() == '#') {
				emit(FormatSpecifier.NUMBER_SIGN);
			}
			if (peek(0) == '0' && peek(1) != '$') {
				emit(FormatSpecifier.ZERO);
			}

			// width
			c = peek();
			if (isDigit(c)) {
				readInteger();
				if (peek() == '$') {
					emit(FormatSpecifier.DOLLAR_SIGN);
				}
			} else if (isIdentStart(c)) {
				readIdentifier();
				if (peek() == '?') {
					emit(FormatSpecifier.QUESTION_MARK);
				}
				// an identifier is either a width argument or already the type
				int next = peek();
				if (next == '$') {
					emit(FormatSpecifier.DOLLAR_SIGN);
				} else if (next == '}') {
					emit(FormatSpecifier.CLOSE);
					return;
				} else {
					return;
				}
			}

			// precision
			if (peek() == '.') {
				emit(FormatSpecifier.DOT);
				c = peek();
				if (c == '*') {
					emit(FormatSpecifier.ASTERISK);
				} else if (isDigit(c)) {
					readInteger();
					if (peek() == '$') {
						emit(FormatSpecifier.DOLLAR_SIGN);
					}
				} else if (isIdentStart(c)) {
					readIdentifier();
					if (peek() != '$') {
						return;
					}
					emit(FormatSpecifier.DOLLAR_SIGN);
				} else {
					return;
				}
			}

			// type
			c = peek();
			if (c == '?') {
				emit(FormatSpecifier.QUESTION_MARK);
			} else if (isIdentStart(c)) {
				readIdentifier();
				if (peek() == '?') {
					emit(FormatSpecifier.QUESTION_MARK);
				}
			}
		}

		if (peek() == '}') {
			emit(FormatSpecifier.CLOSE);
		}
	}

	private void emit(FormatSpecifier specifier) {
		callback.accept(pieces.get(index++).getRange(), specifier);
	}

	private void readInteger() {
		TextRange range = pieces.get(index++).getRange();
		while (isDigit(peek())) {
			range = range.cover(pieces.get(index++).getRange());
		}
		callback.accept(range, FormatSpecifier.INTEGER);
	}

	private void readIdentifier() {
		TextRange range = pieces.get(index++).getRange();
		while (peek() == '_' || isDigit(peek()) || (peek() >= 0 && Character.isAlphabetic(peek()))) {
			range = range.cover(pieces.get(index++).getRange());
		}
		callback.accept(range, FormatSpecifier.IDENTIFIER);
	}
}
