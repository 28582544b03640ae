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

import java.util.Optional;

import com.tomaszrup.rusthighlight.semantics.Access;
import com.tomaszrup.rusthighlight.semantics.Definition;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.semantics.TypeInfo;
import com.tomaszrup.rusthighlight.syntax.SyntaxElement;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;

/**
 * Highlights resolved definitions and method calls.
 */
public class DefinitionHighlighter {
	private final Semantics semantics;

	public DefinitionHighlighter(Semantics semantics) {
		this.semantics = semantics;
	}

	public Highlight highlight(Definition def) {
		switch (def.getKind()) {
			case MACRO:
				return Highlight.of(HighlightTag.MACRO);
			case FIELD:
				return Highlight.of(HighlightTag.FIELD);
			case MODULE:
				return Highlight.of(HighlightTag.MODULE);
			case FUNCTION: {
				Highlight h = Highlight.of(HighlightTag.FUNCTION);
				if (def.isAssociated()) {
					h = h.with(HighlightModifier.ASSOCIATED);
					if (!def.hasSelfParam()) {
						h = h.with(HighlightModifier.STATIC);
					}
				}
				if (def.isUnsafe()) {
					h = h.with(HighlightModifier.UNSAFE);
				}
				return h;
			}
			case STRUCT:
				return Highlight.of(HighlightTag.STRUCT);
			case ENUM:
				return Highlight.of(HighlightTag.ENUM);
			case UNION:
				return Highlight.of(HighlightTag.UNION);
			case VARIANT:
				return Highlight.of(HighlightTag.ENUM_VARIANT);
			case CONST: {
				Highlight h = Highlight.of(HighlightTag.CONSTANT);
				return def.isAssociated() ? h.with(HighlightModifier.ASSOCIATED) : h;
			}
			case STATIC: {
				Highlight h = Highlight.of(HighlightTag.STATIC);
				if (def.isMutable()) {
					h = h.with(HighlightModifier.MUTABLE).with(HighlightModifier.UNSAFE);
				}
				return h;
			}
			case TRAIT:
				return Highlight.of(HighlightTag.TRAIT);
			case TYPE_ALIAS: {
				Highlight h = Highlight.of(HighlightTag.TYPE_ALIAS);
				return def.isAssociated() ? h.with(HighlightModifier.ASSOCIATED) : h;
			}
			case BUILTIN_TYPE:
				return Highlight.of(HighlightTag.BUILTIN_TYPE);
			case SELF_TYPE:
				return Highlight.of(HighlightTag.SELF_TYPE);
			case TYPE_PARAM:
				return Highlight.of(HighlightTag.TYPE_PARAM);
			case CONST_PARAM:
				return Highlight.of(HighlightTag.CONST_PARAM);
			case LIFETIME_PARAM:
				return Highlight.of(HighlightTag.LIFETIME_PARAM);
			case LABEL:
				return Highlight.of(HighlightTag.LABEL);
			case LOCAL:
				return highlightLocal(def);
			default:
				return Highlight.of(HighlightTag.UNRESOLVED_REFERENCE);
		}
	}

	private Highlight highlightLocal(Definition local) {
		HighlightTag tag;
		if (local.isSelf()) {
			tag = HighlightTag.SELF_PARAM;
		} else if (local.isParam()) {
			tag = HighlightTag.VALUE_PARAM;
		} else {
			tag = HighlightTag.LOCAL;
		}
		Highlight h = Highlight.of(tag);
		TypeInfo type = local.getType();
		if (local.isMutable() || (type != null && type.isMutableReference())) {
			h = h.with(HighlightModifier.MUTABLE);
		}
		if (type != null && type.isCallable()) {
			h = h.with(HighlightModifier.CALLABLE);
		}
		return h;
	}

	/**
	 * Highlights the method name of a {@code METHOD_CALL_EXPR}, or returns
	 * {@code null} if the callee does not resolve.
	 */
	public Highlight highlightMethodCall(SyntaxNode methodCall) {
		Optional<Definition> resolved = semantics.resolveMethodCall(methodCall);
		if (!resolved.isPresent()) {
			return null;
		}
		Definition func = resolved.get();
		Highlight h = Highlight.of(HighlightTag.FUNCTION, HighlightModifier.ASSOCIATED);
		if (func.isUnsafe() || semantics.isUnsafeMethodCall(methodCall)) {
			h = h.with(HighlightModifier.UNSAFE);
		}
		Access access = func.getSelfAccess();
		if (access == Access.EXCLUSIVE) {
			h = h.with(HighlightModifier.MUTABLE);
		} else if (access == Access.OWNED) {
			SyntaxNode receiver = methodCall.getChildren().isEmpty() ? null : methodCall.getChildren().get(0);
			if (receiver != null) {
				Optional<TypeInfo> receiverType = semantics.typeOfExpr(receiver);
				if (receiverType.isPresent() && !receiverType.get().isCopy()) {
					h = h.with(HighlightModifier.CONSUMING);
				}
			}
		}
		return h;
	}

	/**
	 * Whether {@code element} passes the non-copy local {@code local} by value
	 * as a call argument.
	 */
	static boolean isConsumedLvalue(SyntaxElement element, Definition local) {
		TypeInfo type = local.getType();
		return parentsMatch(element, SyntaxKind.PATH_SEGMENT, SyntaxKind.PATH, SyntaxKind.PATH_EXPR,
				SyntaxKind.ARG_LIST) && type != null && !type.isCopy();
	}

	/**
	 * Whether the ancestors of {@code element}, innermost first, have exactly
	 * the given kinds.
	 */
	static boolean parentsMatch(SyntaxElement element, SyntaxKind... kinds) {
		SyntaxElement current = element;
		for (SyntaxKind kind : kinds) {
			SyntaxNode parent = current.getParent();
			if (parent == null || parent.getKind() != kind) {
				return false;
			}
			current = parent;
		}
		return true;
	}
}
