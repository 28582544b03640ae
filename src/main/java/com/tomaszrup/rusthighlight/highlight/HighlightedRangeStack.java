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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.tomaszrup.rusthighlight.syntax.TextRange;

/**
 * Collects highlighted ranges per open tree scope and flattens nested ranges
 * into a sorted, disjoint sequence as scopes are closed.
 *
 * <p>All frames live in one list: a frame is the slice from its start index to
 * the start of the next frame (or the end of the list for the innermost one).
 * Closing a frame whose ranges simply follow the parent's is therefore free.</p>
 *
 * <p>For example {@code #[cfg(feature = "foo")]} produces the attribute range
 * {@code [0, 23)} in the outer frame and the string {@code [16, 21)} in the
 * inner one; {@link #pop()} turns them into attribute {@code [0, 16)}, string
 * {@code [16, 21)} and attribute {@code [21, 23)}.</p>
 */
public final class HighlightedRangeStack {
	private static final Comparator<HighlightedRange> BY_START =
			Comparator.comparingInt((HighlightedRange r) -> r.getRange().getStart());

	private final List<HighlightedRange> arena = new ArrayList<>();
	private int[] frameStarts = new int[32];
	private int depth = 1;

	/**
	 * Opens a new empty frame.
	 */
	public void push() {
		if (depth == frameStarts.length) {
			frameStarts = Arrays.copyOf(frameStarts, depth * 2);
		}
		frameStarts[depth++] = arena.size();
	}

	/**
	 * Appends a range to the innermost open frame.
	 */
	public void add(HighlightedRange range) {
		arena.add(range);
	}

	public int depth() {
		return depth;
	}

	/**
	 * Closes the innermost frame and merges its ranges into the parent frame.
	 * If the parent's last range contains the first child, that range is split
	 * around every child; otherwise the children are appended.
	 */
	public void pop() {
		int childStart = closeFrame();
		int parentStart = frameStarts[depth - 1];
		if (childStart == arena.size() || childStart == parentStart) {
			return;
		}
		HighlightedRange parent = arena.get(childStart - 1);
		if (!parent.getRange().containsRange(arena.get(childStart).getRange())) {
			return;
		}
		List<HighlightedRange> children = new ArrayList<>(arena.subList(childStart, arena.size()));
		truncate(childStart - 1);
		for (HighlightedRange child : children) {
			if (!parent.getRange().containsRange(child.getRange())) {
				throw new IllegalStateException("Child range " + child + " escapes parent range " + parent);
			}
			HighlightedRange before = parent.withRange(parent.getRange().withEnd(child.getRange().getStart()));
			HighlightedRange after = parent.withRange(parent.getRange().withStart(child.getRange().getEnd()));
			if (!before.getRange().isEmpty()) {
				arena.add(before);
			}
			arena.add(child);
			parent = after;
		}
		if (!parent.getRange().isEmpty()) {
			arena.add(parent);
		}
	}

	/**
	 * Closes the innermost frame and injects its ranges anywhere into the
	 * parent frame, not just into its last range. A parent range that fully
	 * contains a child is split around it, after its highlight is replaced by
	 * {@code overwriteParent} when one is given. A parent range that only
	 * contains the child's start is cut at that start; the part past the child
	 * is dropped. Any other child is inserted at its sorted position.
	 */
	public void popAndInject(Highlight overwriteParent) {
		int childStart = closeFrame();
		int parentStart = frameStarts[depth - 1];
		if (childStart == arena.size()) {
			return;
		}
		List<HighlightedRange> children = new ArrayList<>(arena.subList(childStart, arena.size()));
		truncate(childStart);
		children.sort(BY_START);
		List<HighlightedRange> parents = arena.subList(parentStart, arena.size());
		parents.sort(BY_START);

		for (HighlightedRange child : children) {
			TextRange childRange = child.getRange();
			int idx = indexOfContaining(parents, childRange);
			if (idx >= 0) {
				HighlightedRange parent = parents.get(idx);
				if (overwriteParent != null) {
					parent = parent.withHighlight(overwriteParent);
				}
				HighlightedRange before = parent.withRange(parent.getRange().withEnd(childRange.getStart()));
				HighlightedRange after = parent.withRange(parent.getRange().withStart(childRange.getEnd()));
				int insertIdx = replaceOrRemove(parents, idx, before);
				parents.add(insertIdx, child);
				if (!after.getRange().isEmpty()) {
					parents.add(insertIdx + 1, after);
				}
				continue;
			}
			idx = indexOfContainingOffset(parents, childRange.getStart());
			if (idx >= 0) {
				HighlightedRange parent = parents.get(idx);
				HighlightedRange before = parent.withRange(parent.getRange().withEnd(childRange.getStart()));
				int insertIdx = replaceOrRemove(parents, idx, before);
				parents.add(insertIdx, child);
			} else {
				parents.add(insertionPoint(parents, childRange.getStart()), child);
			}
		}
	}

	/**
	 * Returns the final ranges. Exactly the root frame must be open.
	 */
	public List<HighlightedRange> flattened() {
		if (depth != 1) {
			throw new IllegalStateException("Expected only the root frame, found " + depth + " frames");
		}
		List<HighlightedRange> result = new ArrayList<>(arena);
		result.sort(BY_START);
		for (int i = 1; i < result.size(); i++) {
			HighlightedRange left = result.get(i - 1);
			HighlightedRange right = result.get(i);
			if (left.getRange().getEnd() > right.getRange().getStart()) {
				throw new IllegalStateException("Overlapping ranges " + left + " and " + right);
			}
		}
		return Collections.unmodifiableList(result);
	}

	private int closeFrame() {
		if (depth <= 1) {
			throw new IllegalStateException("Cannot close the root frame");
		}
		return frameStarts[--depth];
	}

	private void truncate(int size) {
		arena.subList(size, arena.size()).clear();
	}

	/**
	 * Puts {@code before} at {@code idx}, or removes the entry if
	 * {@code before} is empty. Returns where the child goes.
	 */
	private static int replaceOrRemove(List<HighlightedRange> parents, int idx, HighlightedRange before) {
		if (before.getRange().isEmpty()) {
			parents.remove(idx);
			return idx;
		}
		parents.set(idx, before);
		return idx + 1;
	}

	private static int indexOfContaining(List<HighlightedRange> parents, TextRange range) {
		for (int i = 0; i < parents.size(); i++) {
			if (parents.get(i).getRange().containsRange(range)) {
				return i;
			}
		}
		return -1;
	}

	private static int indexOfContainingOffset(List<HighlightedRange> parents, int offset) {
		for (int i = 0; i < parents.size(); i++) {
			if (parents.get(i).getRange().contains(offset)) {
				return i;
			}
		}
		return -1;
	}

	private static int insertionPoint(List<HighlightedRange> parents, int start) {
		int low = 0;
		int high = parents.size();
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (parents.get(mid).getRange().getStart() < start) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}
}
