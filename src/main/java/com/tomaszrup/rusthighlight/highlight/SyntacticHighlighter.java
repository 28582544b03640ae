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

import com.tomaszrup.rusthighlight.semantics.Definition;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;

/**
 * Guesses highlights for names that semantic resolution could not classify,
 * from the shape of the surrounding tree.
 */
public class SyntacticHighlighter {
	private final Semantics semantics;
	private final DefinitionHighlighter definitions;

	public SyntacticHighlighter(Semantics semantics, DefinitionHighlighter definitions) {
		this.semantics = semantics;
		this.definitions = definitions;
	}

	/**
	 * Highlight for an unresolved {@code NAME}, based on the item it names.
	 */
	public Highlight highlightName(SyntaxNode name) {
		SyntaxNode parent = name.getParent();
		if (parent == null) {
			return Highlight.of(HighlightTag.UNRESOLVED_REFERENCE);
		}
		HighlightTag tag;
		switch (parent.getKind()) {
			case STRUCT:
				tag = HighlightTag.STRUCT;
				break;
			case ENUM:
				tag = HighlightTag.ENUM;
				break;
			case VARIANT:
				tag = HighlightTag.ENUM_VARIANT;
				break;
			case UNION:
				tag = HighlightTag.UNION;
				break;
			case TRAIT:
				tag = HighlightTag.TRAIT;
				break;
			case TYPE_ALIAS:
				tag = HighlightTag.TYPE_ALIAS;
				break;
			case TYPE_PARAM:
				tag = HighlightTag.TYPE_PARAM;
				break;
			case RECORD_FIELD:
				tag = HighlightTag.FIELD;
				break;
			case MODULE:
				tag = HighlightTag.MODULE;
				break;
			case FN:
				tag = HighlightTag.FUNCTION;
				break;
			case CONST:
				tag = HighlightTag.CONSTANT;
				break;
			case STATIC:
				tag = HighlightTag.STATIC;
				break;
			case IDENT_PAT:
				tag = HighlightTag.LOCAL;
				break;
			case MACRO_RULES:
			case MACRO_DEF:
			case MACRO_CALL:
				tag = HighlightTag.MACRO;
				break;
			default:
				tag = HighlightTag.UNRESOLVED_REFERENCE;
		}
		return Highlight.of(tag);
	}

	/**
	 * Highlight for an unresolved {@code NAME_REF}, based on where it is used.
	 */
	public Highlight highlightNameRef(SyntaxNode nameRef) {
		Highlight unresolved = Highlight.of(HighlightTag.UNRESOLVED_REFERENCE);
		SyntaxNode parent = nameRef.getParent();
		if (parent == null) {
			return unresolved;
		}
		switch (parent.getKind()) {
			case METHOD_CALL_EXPR: {
				Highlight h = definitions.highlightMethodCall(parent);
				return h != null ? h : Highlight.of(HighlightTag.FUNCTION);
			}
			case FIELD_EXPR: {
				Optional<Definition> field = semantics.resolveField(parent);
				Highlight h = Highlight.of(HighlightTag.FIELD);
				return field.isPresent() && field.get().isParentUnion() ? h.with(HighlightModifier.UNSAFE) : h;
			}
			case PATH_SEGMENT: {
				SyntaxNode path = parent.getParent();
				if (path == null || path.getKind() != SyntaxKind.PATH) {
					return unresolved;
				}
				SyntaxNode expr = path.getParent();
				boolean uppercase = startsWithUppercase(nameRef.getText());
				if (expr == null || expr.getKind() != SyntaxKind.PATH_EXPR) {
					return Highlight.of(uppercase ? HighlightTag.STRUCT : HighlightTag.MODULE);
				}
				SyntaxNode exprParent = expr.getParent();
				if (exprParent == null) {
					return unresolved;
				}
				if (exprParent.getKind() == SyntaxKind.CALL_EXPR) {
					return Highlight.of(HighlightTag.FUNCTION);
				}
				return Highlight.of(uppercase ? HighlightTag.STRUCT : HighlightTag.CONSTANT);
			}
			default:
				return unresolved;
		}
	}

	private static boolean startsWithUppercase(String text) {
		return !text.isEmpty() && Character.isUpperCase(text.codePointAt(0));
	}
}
