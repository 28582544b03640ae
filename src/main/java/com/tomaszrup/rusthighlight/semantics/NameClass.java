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
 * Classification of a binding name ({@code NAME} node).
 */
public final class NameClass {

	public enum Kind {
		/** The name defines {@link #getDefinition()}. */
		DEFINITION,
		/** A pattern that refers to an existing constant. */
		CONST_REFERENCE,
		/** {@code Foo { field }} in a pattern: a local and a field at once. */
		PAT_FIELD_SHORTHAND,
		/** The alias of an {@code extern crate} item. */
		EXTERN_CRATE
	}

	private final Kind kind;
	private final Definition definition;
	private final Definition field;

	private NameClass(Kind kind, Definition definition, Definition field) {
		this.kind = kind;
		this.definition = definition;
		this.field = field;
	}

	public static NameClass definition(Definition definition) {
		return new NameClass(Kind.DEFINITION, definition, null);
	}

	public static NameClass constReference(Definition definition) {
		return new NameClass(Kind.CONST_REFERENCE, definition, null);
	}

	public static NameClass patFieldShorthand(Definition local, Definition field) {
		return new NameClass(Kind.PAT_FIELD_SHORTHAND, local, field);
	}

	public static NameClass externCrate() {
		return new NameClass(Kind.EXTERN_CRATE, null, null);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * The defined or referenced item; for a field shorthand the local.
	 */
	public Definition getDefinition() {
		return definition;
	}

	/**
	 * The field of a field shorthand, otherwise {@code null}.
	 */
	public Definition getField() {
		return field;
	}
}
