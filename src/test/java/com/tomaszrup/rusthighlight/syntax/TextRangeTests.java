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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.rusthighlight.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TextRange}: construction, containment, intersection
 * and UTF-8 length computation.
 */
class TextRangeTests {

	// ------------------------------------------------------------------
	// construction
	// ------------------------------------------------------------------

	@Test
	void testOfAndAtAgree() {
		Assertions.assertEquals(TextRange.of(3, 8), TextRange.at(3, 5));
		Assertions.assertEquals(5, TextRange.of(3, 8).getLength());
	}

	@Test
	void testEmptyRange() {
		TextRange empty = TextRange.empty(4);
		Assertions.assertTrue(empty.isEmpty());
		Assertions.assertEquals(4, empty.getStart());
		Assertions.assertEquals(4, empty.getEnd());
	}

	@Test
	void testInvalidRangesAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> TextRange.of(5, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> TextRange.of(-1, 4));
	}

	// ------------------------------------------------------------------
	// containment
	// ------------------------------------------------------------------

	@Test
	void testContainsExcludesEnd() {
		TextRange range = TextRange.of(2, 5);
		Assertions.assertTrue(range.contains(2));
		Assertions.assertTrue(range.contains(4));
		Assertions.assertFalse(range.contains(5));
		Assertions.assertTrue(range.containsInclusive(5));
	}

	@Test
	void testContainsRange() {
		TextRange range = TextRange.of(0, 23);
		Assertions.assertTrue(range.containsRange(TextRange.of(16, 21)));
		Assertions.assertTrue(range.containsRange(range));
		Assertions.assertFalse(range.containsRange(TextRange.of(20, 24)));
	}

	// ------------------------------------------------------------------
	// intersect / cover / shift
	// ------------------------------------------------------------------

	@Test
	void testIntersectOverlapping() {
		Assertions.assertEquals(TextRange.of(4, 6), TextRange.of(0, 6).intersect(TextRange.of(4, 10)));
	}

	@Test
	void testIntersectTouchingIsEmpty() {
		TextRange common = TextRange.of(0, 4).intersect(TextRange.of(4, 10));
		Assertions.assertNotNull(common);
		Assertions.assertTrue(common.isEmpty());
	}

	@Test
	void testIntersectApartIsNull() {
		Assertions.assertNull(TextRange.of(0, 3).intersect(TextRange.of(4, 10)));
	}

	@Test
	void testCoverAndShift() {
		Assertions.assertEquals(TextRange.of(1, 9), TextRange.of(1, 3).cover(TextRange.of(7, 9)));
		Assertions.assertEquals(TextRange.of(11, 13), TextRange.of(1, 3).shift(10));
		Assertions.assertEquals(TextRange.of(0, 2), TextRange.of(10, 12).shift(-10));
	}

	@Test
	void testSortByStartThenEnd() {
		List<TextRange> ranges = new ArrayList<>(Arrays.asList(
				TextRange.of(5, 9), TextRange.of(0, 4), TextRange.of(5, 6)));
		ranges.sort(TextRange.BY_START);
		Assertions.assertEquals(Arrays.asList(TextRange.of(0, 4), TextRange.of(5, 6), TextRange.of(5, 9)), ranges);
	}

	// ------------------------------------------------------------------
	// utf8Length()
	// ------------------------------------------------------------------

	@Test
	void testUtf8Length() {
		Assertions.assertEquals(3, TextRange.utf8Length("abc"));
		Assertions.assertEquals(2, TextRange.utf8Length("é"));
		Assertions.assertEquals(3, TextRange.utf8Length("€"));
		Assertions.assertEquals(4, TextRange.utf8Length("🦀"));
		Assertions.assertEquals(4, TextRange.utf8Length(0x1F980));
	}
}
