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

/**
 * Attributes that can be combined with any {@link HighlightTag}. Modifier
 * {@code m} occupies bit {@code m.ordinal()} of {@link Highlight#getModifierBits()}.
 */
public enum HighlightModifier {
	DEFINITION("definition"),
	MUTABLE("mutable"),
	UNSAFE("unsafe"),
	CONSUMING("consuming"),
	ASSOCIATED("associated"),
	STATIC("static"),
	CALLABLE("callable"),
	CONTROL_FLOW("control_flow"),
	DOCUMENTATION("documentation"),
	ATTRIBUTE("attribute"),
	INJECTED("injected");

	private final String name;

	HighlightModifier(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public int mask() {
		return 1 << ordinal();
	}

	@Override
	public String toString() {
		return name;
	}
}
