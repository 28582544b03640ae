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
package com.tomaszrup.rusthighlight.highlight.injection;

import java.util.List;

import com.tomaszrup.rusthighlight.highlight.Highlight;
import com.tomaszrup.rusthighlight.highlight.HighlightTag;
import com.tomaszrup.rusthighlight.highlight.HighlightedRange;
import com.tomaszrup.rusthighlight.highlight.HighlightedRangeStack;
import com.tomaszrup.rusthighlight.syntax.CharPiece;
import com.tomaszrup.rusthighlight.syntax.StringLiteral;
import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * Highlights the valid escape sequences of a string literal.
 */
public final class EscapeSequenceHighlighter {

	private EscapeSequenceHighlighter() {
	}

	public static void highlight(HighlightedRangeStack stack, StringLiteral string, TextRange range) {
		List<CharPiece> pieces = string.pieces();
		if (pieces == null) {
			return;
		}
		stack.push();
		for (CharPiece piece : pieces) {
			if (piece.isOk() && piece.isEscaped()) {
				stack.add(new HighlightedRange(piece.getRange().shift(range.getStart()),
						Highlight.of(HighlightTag.ESCAPE_SEQUENCE)));
			}
		}
		stack.popAndInject(null);
	}
}
