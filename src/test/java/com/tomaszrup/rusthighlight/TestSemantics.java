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
package com.tomaszrup.rusthighlight;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.tomaszrup.rusthighlight.semantics.Definition;
import com.tomaszrup.rusthighlight.semantics.NameClass;
import com.tomaszrup.rusthighlight.semantics.NameRefClass;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.semantics.TypeInfo;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;

/**
 * {@link Semantics} answering from maps filled by the test. Keys are tree
 * elements compared by identity.
 */
public class TestSemantics implements Semantics {
	private final Map<SyntaxNode, NameClass> names = new IdentityHashMap<>();
	private final Map<SyntaxNode, NameRefClass> nameRefs = new IdentityHashMap<>();
	private final Map<SyntaxNode, NameClass> lifetimes = new IdentityHashMap<>();
	private final Map<SyntaxNode, NameRefClass> lifetimeRefs = new IdentityHashMap<>();
	private final Map<SyntaxNode, Definition> methodCalls = new IdentityHashMap<>();
	private final Map<SyntaxNode, Definition> fields = new IdentityHashMap<>();
	private final Map<SyntaxNode, Definition> paths = new IdentityHashMap<>();
	private final Map<SyntaxNode, TypeInfo> types = new IdentityHashMap<>();
	private final Map<SyntaxToken, SyntaxToken> expansions = new IdentityHashMap<>();
	private final Map<SyntaxToken, String> activeParameters = new IdentityHashMap<>();
	private final Set<SyntaxNode> unsafeNodes = Collections.newSetFromMap(new IdentityHashMap<>());

	public TestSemantics name(SyntaxNode name, Definition definition) {
		names.put(name, NameClass.definition(definition));
		return this;
	}

	public TestSemantics name(SyntaxNode name, NameClass nameClass) {
		names.put(name, nameClass);
		return this;
	}

	public TestSemantics nameRef(SyntaxNode nameRef, Definition definition) {
		nameRefs.put(nameRef, NameRefClass.definition(definition));
		return this;
	}

	public TestSemantics nameRef(SyntaxNode nameRef, NameRefClass refClass) {
		nameRefs.put(nameRef, refClass);
		return this;
	}

	public TestSemantics lifetime(SyntaxNode lifetime, NameClass nameClass) {
		lifetimes.put(lifetime, nameClass);
		return this;
	}

	public TestSemantics lifetimeRef(SyntaxNode lifetime, NameRefClass refClass) {
		lifetimeRefs.put(lifetime, refClass);
		return this;
	}

	public TestSemantics methodCall(SyntaxNode methodCall, Definition function) {
		methodCalls.put(methodCall, function);
		return this;
	}

	public TestSemantics field(SyntaxNode fieldExpr, Definition field) {
		fields.put(fieldExpr, field);
		return this;
	}

	public TestSemantics path(SyntaxNode path, Definition definition) {
		paths.put(path, definition);
		return this;
	}

	public TestSemantics type(SyntaxNode expr, TypeInfo type) {
		types.put(expr, type);
		return this;
	}

	public TestSemantics expansion(SyntaxToken source, SyntaxToken expanded) {
		expansions.put(source, expanded);
		return this;
	}

	public TestSemantics activeParameter(SyntaxToken argument, String parameterName) {
		activeParameters.put(argument, parameterName);
		return this;
	}

	/** Marks a reference expression, method call or ident pattern unsafe. */
	public TestSemantics unsafe(SyntaxNode node) {
		unsafeNodes.add(node);
		return this;
	}

	@Override
	public Optional<NameClass> classifyName(SyntaxNode name) {
		return Optional.ofNullable(names.get(name));
	}

	@Override
	public Optional<NameRefClass> classifyNameRef(SyntaxNode nameRef) {
		return Optional.ofNullable(nameRefs.get(nameRef));
	}

	@Override
	public Optional<NameClass> classifyLifetime(SyntaxNode lifetime) {
		return Optional.ofNullable(lifetimes.get(lifetime));
	}

	@Override
	public Optional<NameRefClass> classifyLifetimeReference(SyntaxNode lifetime) {
		return Optional.ofNullable(lifetimeRefs.get(lifetime));
	}

	@Override
	public Optional<Definition> resolveMethodCall(SyntaxNode methodCall) {
		return Optional.ofNullable(methodCalls.get(methodCall));
	}

	@Override
	public Optional<Definition> resolveField(SyntaxNode fieldExpr) {
		return Optional.ofNullable(fields.get(fieldExpr));
	}

	@Override
	public Optional<Definition> resolvePath(SyntaxNode path) {
		return Optional.ofNullable(paths.get(path));
	}

	@Override
	public Optional<TypeInfo> typeOfExpr(SyntaxNode expr) {
		return Optional.ofNullable(types.get(expr));
	}

	@Override
	public Optional<SyntaxToken> descendIntoMacros(SyntaxToken token) {
		return Optional.ofNullable(expansions.get(token));
	}

	@Override
	public boolean isUnsafeRefExpr(SyntaxNode refExpr) {
		return unsafeNodes.contains(refExpr);
	}

	@Override
	public boolean isUnsafeMethodCall(SyntaxNode methodCall) {
		return unsafeNodes.contains(methodCall);
	}

	@Override
	public boolean isUnsafeIdentPat(SyntaxNode identPat) {
		return unsafeNodes.contains(identPat);
	}

	@Override
	public Optional<String> activeParameterName(SyntaxToken token) {
		return Optional.ofNullable(activeParameters.get(token));
	}
}
