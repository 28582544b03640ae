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
package com.tomaszrup.rusthighlight.semantics;

/**
 * Classification of a name reference ({@code NAME_REF} node).
 */
public final class NameRefClass {

	public enum Kind {
		DEFINITION,
		/** {@code Foo { field }} in an expression. */
		FIELD_SHORTHAND,
		EXTERN_CRATE
	}

	private final Kind kind;
	private final Definition definition;
	private final Definition field;

	private NameRefClass(Kind kind, Definition definition, Definition field) {
		this.kind = kind;
		this.definition = definition;
		this.field = field;
	}

	public static NameRefClass definition(Definition definition) {
		return new NameRefClass(Kind.DEFINITION, definition, null);
	}

	public static NameRefClass fieldShorthand(Definition local, Definition field) {
		return new NameRefClass(Kind.FIELD_SHORTHAND, local, field);
	}

	public static NameRefClass externCrate() {
		return new NameRefClass(Kind.EXTERN_CRATE, null, null);
	}

	public Kind getKind() {
		return kind;
	}

	public Definition getDefinition() {
		return definition;
	}

	public Definition getField() {
		return field;
	}
}
