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

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Depth-first walk over a subtree that reports entering and leaving every node
 * and token. The walk is lazy, so {@link #skipSubtree()} can prune it.
 */
public final class Preorder implements Iterator<WalkEvent> {
	private final SyntaxNode root;
	private WalkEvent next;
	private WalkEvent last;

	Preorder(SyntaxNode root) {
		this.root = root;
		this.next = WalkEvent.enter(root);
	}

	@Override
	public boolean hasNext() {
		return next != null;
	}

	@Override
	public WalkEvent next() {
		if (next == null) {
			throw new NoSuchElementException();
		}
		last = next;
		next = successor(last);
		return last;
	}

	/**
	 * Skips the subtree of the element entered by the last call to
	 * {@link #next()}. The matching leave event is not reported either.
	 */
	public void skipSubtree() {
		if (last == null || !last.isEnter()) {
			throw new IllegalStateException("skipSubtree() must follow an enter event");
		}
		next = successor(WalkEvent.leave(last.getElement()));
	}

	private WalkEvent successor(WalkEvent event) {
		SyntaxElement element = event.getElement();
		if (event.isEnter()) {
			if (element.isNode()) {
				List<SyntaxElement> children = ((SyntaxNode) element).getChildrenWithTokens();
				if (!children.isEmpty()) {
					return WalkEvent.enter(children.get(0));
				}
			}
			return WalkEvent.leave(element);
		}
		if (element == root) {
			return null;
		}
		SyntaxElement sibling = element.nextSiblingOrToken();
		if (sibling != null) {
			return WalkEvent.enter(sibling);
		}
		return WalkEvent.leave(element.getParent());
	}
}
