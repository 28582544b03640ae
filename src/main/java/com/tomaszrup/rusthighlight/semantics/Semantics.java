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

import java.util.Optional;

import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;

/**
 * Read-only semantic queries over the tree being highlighted. Implementations
 * live outside this library (a type checker, an index). Every query may answer
 * "don't know"; the highlighter then degrades to syntax-based rules.
 *
 * <p>Nodes passed in are always elements of the tree being highlighted, or of
 * a macro expansion returned by {@link #descendIntoMacros(SyntaxToken)}.</p>
 */
public interface Semantics {

	/** Answers nothing: highlighting from syntax alone. */
	Semantics NONE = new Semantics() {
	};

	/**
	 * @param name a {@code NAME} node
	 */
	default Optional<NameClass> classifyName(SyntaxNode name) {
		return Optional.empty();
	}

	/**
	 * @param nameRef a {@code NAME_REF} node
	 */
	default Optional<NameRefClass> classifyNameRef(SyntaxNode nameRef) {
		return Optional.empty();
	}

	/**
	 * Classifies a {@code LIFETIME} node that declares a lifetime or label.
	 */
	default Optional<NameClass> classifyLifetime(SyntaxNode lifetime) {
		return Optional.empty();
	}

	/**
	 * Classifies a {@code LIFETIME} node that uses a lifetime or label.
	 */
	default Optional<NameRefClass> classifyLifetimeReference(SyntaxNode lifetime) {
		return Optional.empty();
	}

	/**
	 * Resolves the callee of a {@code METHOD_CALL_EXPR} to its function.
	 */
	default Optional<Definition> resolveMethodCall(SyntaxNode methodCall) {
		return Optional.empty();
	}

	/**
	 * Resolves the field accessed by a {@code FIELD_EXPR}.
	 */
	default Optional<Definition> resolveField(SyntaxNode fieldExpr) {
		return Optional.empty();
	}

	/**
	 * Resolves a {@code PATH} node.
	 */
	default Optional<Definition> resolvePath(SyntaxNode path) {
		return Optional.empty();
	}

	default Optional<TypeInfo> typeOfExpr(SyntaxNode expr) {
		return Optional.empty();
	}

	/**
	 * Maps a token inside a macro invocation's arguments to the token it
	 * became in the expansion.
	 */
	default Optional<SyntaxToken> descendIntoMacros(SyntaxToken token) {
		return Optional.empty();
	}

	/**
	 * Whether a {@code REF_EXPR} takes a reference to something only
	 * reachable unsafely, such as a field of a packed struct.
	 */
	default boolean isUnsafeRefExpr(SyntaxNode refExpr) {
		return false;
	}

	default boolean isUnsafeMethodCall(SyntaxNode methodCall) {
		return false;
	}

	/**
	 * Whether an {@code IDENT_PAT} with {@code ref} binds into an unsafe
	 * location.
	 */
	default boolean isUnsafeIdentPat(SyntaxNode identPat) {
		return false;
	}

	/**
	 * Name of the parameter that receives the argument containing
	 * {@code token}, if the token sits in a call's argument list.
	 */
	default Optional<String> activeParameterName(SyntaxToken token) {
		return Optional.empty();
	}
}
