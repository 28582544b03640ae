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
 * Enter or leave notification produced by {@link Preorder}.
 */
public final class WalkEvent {

	public enum Type {
		ENTER, LEAVE
	}

	private final Type type;
	private final SyntaxElement element;

	private WalkEvent(Type type, SyntaxElement element) {
		this.type = type;
		this.element = element;
	}

	public static WalkEvent enter(SyntaxElement element) {
		return new WalkEvent(Type.ENTER, element);
	}

	public static WalkEvent leave(SyntaxElement element) {
		return new WalkEvent(Type.LEAVE, element);
	}

	public Type getType() {
		return type;
	}

	public boolean isEnter() {
		return type == Type.ENTER;
	}

	public boolean isLeave() {
		return type == Type.LEAVE;
	}

	public SyntaxElement getElement() {
		return element;
	}

	@Override
	public String toString() {
		return type + " " + element;
	}
}
