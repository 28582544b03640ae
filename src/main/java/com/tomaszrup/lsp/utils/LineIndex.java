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
package com.tomaszrup.lsp.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Maps UTF-8 byte offsets of a document to LSP positions, whose columns count
 * UTF-16 code units, and back. Lines are terminated by {@code \n}; a
 * {@code \r} right before it is not part of the line.
 */
public class LineIndex {

	/** Orders positions by line, then by column. */
	public static final Comparator<Position> POSITION_ORDER = (Position p1, Position p2) -> {
		if (p1.getLine() != p2.getLine()) {
			return Integer.compare(p1.getLine(), p2.getLine());
		}
		return Integer.compare(p1.getCharacter(), p2.getCharacter());
	};

	private final String text;
	private final int[] lineStartChars;
	private final int[] lineStartBytes;
	private final int totalBytes;

	public LineIndex(String text) {
		this.text = text;
		List<int[]> starts = new ArrayList<>();
		starts.add(new int[] { 0, 0 });
		int bytes = 0;
		int i = 0;
		while (i < text.length()) {
			int codePoint = text.codePointAt(i);
			i += Character.charCount(codePoint);
			bytes += utf8Length(codePoint);
			if (codePoint == '\n') {
				starts.add(new int[] { i, bytes });
			}
		}
		this.totalBytes = bytes;
		this.lineStartChars = new int[starts.size()];
		this.lineStartBytes = new int[starts.size()];
		for (int line = 0; line < starts.size(); line++) {
			lineStartChars[line] = starts.get(line)[0];
			lineStartBytes[line] = starts.get(line)[1];
		}
	}

	public int getLineCount() {
		return lineStartBytes.length;
	}

	/**
	 * Length of the whole document in UTF-8 bytes.
	 */
	public int getLength() {
		return totalBytes;
	}

	public int getLineStart(int line) {
		return lineStartBytes[line];
	}

	/**
	 * Byte offset where the content of {@code line} ends, line terminator
	 * excluded.
	 */
	public int getLineEnd(int line) {
		if (line + 1 >= lineStartBytes.length) {
			return totalBytes;
		}
		int end = lineStartBytes[line + 1] - 1;
		int newline = lineStartChars[line + 1] - 1;
		if (newline > lineStartChars[line] && text.charAt(newline - 1) == '\r') {
			end--;
		}
		return end;
	}

	/**
	 * Line holding {@code offset}. An offset right after a line terminator
	 * belongs to the next line.
	 */
	public int lineOf(int offset) {
		checkOffset(offset);
		int index = Arrays.binarySearch(lineStartBytes, offset);
		return index >= 0 ? index : -index - 2;
	}

	/**
	 * Position of a byte offset. An offset pointing into the middle of a
	 * multi-byte character resolves to the start of that character.
	 */
	public Position toPosition(int offset) {
		int line = lineOf(offset);
		return new Position(line, charIndex(line, offset) - lineStartChars[line]);
	}

	/**
	 * Number of UTF-16 code units between two byte offsets.
	 */
	public int utf16Length(int startOffset, int endOffset) {
		return charIndex(lineOf(endOffset), endOffset) - charIndex(lineOf(startOffset), startOffset);
	}

	/**
	 * Byte offset of a position, or -1 if the position lies outside of the
	 * document.
	 */
	public int toOffset(Position position) {
		if (!isValid(position) || position.getLine() >= getLineCount()) {
			return -1;
		}
		int line = position.getLine();
		int offset = byteOffset(line, position.getCharacter());
		return offset <= getLineEnd(line) ? offset : -1;
	}

	/**
	 * Like {@link #toOffset(Position)} but clamps positions past the end of a
	 * line, or of the document, to that end.
	 */
	public int toClampedOffset(Position position) {
		if (!isValid(position)) {
			return 0;
		}
		if (position.getLine() >= getLineCount()) {
			return totalBytes;
		}
		int line = position.getLine();
		return Math.min(byteOffset(line, position.getCharacter()), getLineEnd(line));
	}

	private int byteOffset(int line, int character) {
		int bytes = lineStartBytes[line];
		int i = lineStartChars[line];
		int limit = lineStartChars[line] + character;
		while (i < limit && i < text.length()) {
			int codePoint = text.codePointAt(i);
			if (codePoint == '\n') {
				// past the end of the line
				return Integer.MAX_VALUE;
			}
			i += Character.charCount(codePoint);
			bytes += utf8Length(codePoint);
		}
		return i < limit ? Integer.MAX_VALUE : bytes;
	}

	private int charIndex(int line, int offset) {
		int bytes = lineStartBytes[line];
		int i = lineStartChars[line];
		while (bytes < offset && i < text.length()) {
			int codePoint = text.codePointAt(i);
			int length = utf8Length(codePoint);
			if (bytes + length > offset) {
				break;
			}
			bytes += length;
			i += Character.charCount(codePoint);
		}
		return i;
	}

	/**
	 * Returns {@code range} with its ends swapped when the start comes after
	 * the end. Clients occasionally send such ranges for backwards selections.
	 */
	public static Range normalize(Range range) {
		Position start = range.getStart();
		Position end = range.getEnd();
		if (POSITION_ORDER.compare(start, end) <= 0) {
			return range;
		}
		return new Range(end, start);
	}

	static boolean isValid(Position position) {
		return position != null && position.getLine() >= 0 && position.getCharacter() >= 0;
	}

	private void checkOffset(int offset) {
		if (offset < 0 || offset > totalBytes) {
			throw new IllegalArgumentException("Offset " + offset + " is outside of [0; " + totalBytes + "]");
		}
	}

	private static int utf8Length(int codePoint) {
		if (codePoint < 0x80) {
			return 1;
		} else if (codePoint < 0x800) {
			return 2;
		} else if (codePoint < 0x10000) {
			return 3;
		}
		return 4;
	}
}
