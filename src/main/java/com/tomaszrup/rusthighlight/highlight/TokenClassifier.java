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
import com.tomaszrup.rusthighlight.semantics.DefinitionKind;
import com.tomaszrup.rusthighlight.semantics.NameClass;
import com.tomaszrup.rusthighlight.semantics.NameRefClass;
import com.tomaszrup.rusthighlight.semantics.Semantics;
import com.tomaszrup.rusthighlight.semantics.TypeInfo;
import com.tomaszrup.rusthighlight.syntax.Comments;
import com.tomaszrup.rusthighlight.syntax.SyntaxElement;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;

/**
 * Maps a single tree element to its highlight. Apart from the shadow counter,
 * which tracks local bindings across calls, classification has no side
 * effects. Elements without an applicable rule yield {@code null}.
 */
public class TokenClassifier {
	private final Semantics semantics;
	private final ShadowCounter shadows;
	private final boolean syntacticNameRefHighlighting;
	private final DefinitionHighlighter definitions;
	private final SyntacticHighlighter syntactic;

	public TokenClassifier(Semantics semantics, ShadowCounter shadows, boolean syntacticNameRefHighlighting) {
		this.semantics = semantics;
		this.shadows = shadows;
		this.syntacticNameRefHighlighting = syntacticNameRefHighlighting;
		this.definitions = new DefinitionHighlighter(semantics);
		this.syntactic = new SyntacticHighlighter(semantics, definitions);
	}

	public Classification classify(SyntaxElement element) {
		SyntaxKind kind = element.getKind();
		switch (kind) {
			case FN:
				shadows.clear();
				return null;
			case NAME:
				return classifyName((SyntaxNode) element);
			case NAME_REF:
				if (isInsideAttribute(element)) {
					return Classification.of(Highlight.of(HighlightTag.FUNCTION));
				}
				return classifyNameRef((SyntaxNode) element);
			case COMMENT: {
				Highlight h = Highlight.of(HighlightTag.COMMENT);
				return Classification.of(Comments.isDoc(element.getText()) ? h.with(HighlightModifier.DOCUMENTATION) : h);
			}
			case STRING:
			case BYTE_STRING:
				return Classification.of(Highlight.of(HighlightTag.STRING_LITERAL));
			case ATTR:
				return Classification.of(Highlight.of(HighlightTag.ATTRIBUTE));
			case INT_NUMBER:
			case FLOAT_NUMBER:
				return Classification.of(Highlight.of(HighlightTag.NUMERIC_LITERAL));
			case BYTE:
				return Classification.of(Highlight.of(HighlightTag.BYTE_LITERAL));
			case CHAR:
				return Classification.of(Highlight.of(HighlightTag.CHAR_LITERAL));
			case QUESTION:
				return Classification.of(Highlight.of(HighlightTag.OPERATOR, HighlightModifier.CONTROL_FLOW));
			case LIFETIME:
				return Classification.of(classifyLifetime((SyntaxNode) element));
			default:
				break;
		}
		if (kind.isPunct()) {
			Highlight h = classifyPunct(element);
			return h != null ? Classification.of(h) : null;
		}
		if (kind.isKeyword()) {
			return Classification.of(classifyKeyword(element));
		}
		return null;
	}

	private Classification classifyName(SyntaxNode name) {
		Optional<NameClass> nameClass = semantics.classifyName(name);
		if (!nameClass.isPresent()) {
			return Classification.of(syntactic.highlightName(name).with(HighlightModifier.DEFINITION));
		}
		NameClass cls = nameClass.get();
		switch (cls.getKind()) {
			case EXTERN_CRATE:
				return Classification.of(Highlight.of(HighlightTag.MODULE));
			case CONST_REFERENCE:
				return Classification.of(definitions.highlight(cls.getDefinition()));
			case PAT_FIELD_SHORTHAND: {
				Highlight h = Highlight.of(HighlightTag.FIELD);
				Definition field = cls.getField();
				return Classification.of(field != null && field.isParentUnion() ? h.with(HighlightModifier.UNSAFE) : h);
			}
			case DEFINITION:
			default: {
				Definition def = cls.getDefinition();
				Long bindingHash = null;
				if (def.getKind() == DefinitionKind.LOCAL) {
					bindingHash = shadows.bind(nameOf(def, name));
				}
				Highlight h = definitions.highlight(def).with(HighlightModifier.DEFINITION);
				if (isUnionField(def)) {
					h = h.with(HighlightModifier.UNSAFE);
				}
				return new Classification(h, bindingHash);
			}
		}
	}

	private Classification classifyNameRef(SyntaxNode nameRef) {
		SyntaxNode parent = nameRef.getParent();
		if (parent != null && parent.getKind() == SyntaxKind.METHOD_CALL_EXPR) {
			Highlight h = definitions.highlightMethodCall(parent);
			if (h != null) {
				return Classification.of(h);
			}
		}
		Optional<NameRefClass> refClass = semantics.classifyNameRef(nameRef);
		if (!refClass.isPresent()) {
			if (syntacticNameRefHighlighting) {
				return Classification.of(syntactic.highlightNameRef(nameRef));
			}
			return Classification.of(Highlight.of(HighlightTag.UNRESOLVED_REFERENCE));
		}
		NameRefClass cls = refClass.get();
		switch (cls.getKind()) {
			case EXTERN_CRATE:
				return Classification.of(Highlight.of(HighlightTag.MODULE));
			case FIELD_SHORTHAND:
				return Classification.of(Highlight.of(HighlightTag.FIELD));
			case DEFINITION:
			default: {
				Definition def = cls.getDefinition();
				Highlight h = definitions.highlight(def);
				if (isUnionField(def) && isUnionFieldAccess(nameRef)) {
					h = h.with(HighlightModifier.UNSAFE);
				}
				Long bindingHash = null;
				if (def.getKind() == DefinitionKind.LOCAL) {
					bindingHash = shadows.reference(nameOf(def, nameRef));
					if (DefinitionHighlighter.isConsumedLvalue(nameRef, def)) {
						h = h.with(HighlightModifier.CONSUMING);
					}
				}
				return new Classification(h, bindingHash);
			}
		}
	}

	private static boolean isUnionField(Definition def) {
		return def.getKind() == DefinitionKind.FIELD && def.isParentUnion();
	}

	/**
	 * Only reading a field through a field expression or matching it in a
	 * record pattern is unsafe. Initializing it in a record expression is not.
	 */
	private static boolean isUnionFieldAccess(SyntaxNode nameRef) {
		SyntaxNode parent = nameRef.getParent();
		return parent != null
				&& (parent.getKind() == SyntaxKind.FIELD_EXPR || parent.getKind() == SyntaxKind.RECORD_PAT_FIELD);
	}

	private Highlight classifyLifetime(SyntaxNode lifetime) {
		Optional<NameClass> nameClass = semantics.classifyLifetime(lifetime);
		if (nameClass.isPresent()) {
			NameClass cls = nameClass.get();
			if (cls.getKind() == NameClass.Kind.DEFINITION) {
				return definitions.highlight(cls.getDefinition()).with(HighlightModifier.DEFINITION);
			}
			return Highlight.of(HighlightTag.LIFETIME_PARAM, HighlightModifier.DEFINITION);
		}
		Optional<NameRefClass> refClass = semantics.classifyLifetimeReference(lifetime);
		if (refClass.isPresent() && refClass.get().getKind() == NameRefClass.Kind.DEFINITION) {
			return definitions.highlight(refClass.get().getDefinition());
		}
		SyntaxNode parent = lifetime.getParent();
		if (parent != null && parent.getKind() == SyntaxKind.LIFETIME_PARAM) {
			return Highlight.of(HighlightTag.LIFETIME_PARAM, HighlightModifier.DEFINITION);
		}
		if (parent != null && parent.getKind() == SyntaxKind.LABEL) {
			return Highlight.of(HighlightTag.LABEL, HighlightModifier.DEFINITION);
		}
		return Highlight.of(HighlightTag.LIFETIME_PARAM);
	}

	private Highlight classifyPunct(SyntaxElement element) {
		SyntaxNode parent = element.getParent();
		SyntaxKind parentKind = parent != null ? parent.getKind() : null;
		switch (element.getKind()) {
			case AMP: {
				Highlight h = Highlight.of(HighlightTag.OPERATOR);
				if (parentKind == SyntaxKind.REF_EXPR && semantics.isUnsafeRefExpr(parent)) {
					h = h.with(HighlightModifier.UNSAFE);
				}
				return h;
			}
			case COLON2:
			case THIN_ARROW:
			case FAT_ARROW:
			case DOT2:
			case EQ:
			case AT:
			case DOT:
				return Highlight.of(HighlightTag.OPERATOR);
			case BANG:
				if (parentKind == SyntaxKind.MACRO_CALL || parentKind == SyntaxKind.MACRO_RULES) {
					return Highlight.of(HighlightTag.MACRO);
				}
				if (parentKind == SyntaxKind.NEVER_TYPE) {
					return Highlight.of(HighlightTag.BUILTIN_TYPE);
				}
				break;
			case STAR:
				if (parentKind == SyntaxKind.PTR_TYPE) {
					return Highlight.of(HighlightTag.KEYWORD);
				}
				if (parentKind == SyntaxKind.PREFIX_EXPR) {
					SyntaxNode operand = firstChildNode(parent);
					Optional<TypeInfo> type = operand != null ? semantics.typeOfExpr(operand) : Optional.<TypeInfo>empty();
					if (type.isPresent() && type.get().isRawPointer()) {
						return Highlight.of(HighlightTag.OPERATOR, HighlightModifier.UNSAFE);
					}
					return Highlight.of(HighlightTag.OPERATOR);
				}
				break;
			case MINUS:
				if (parentKind == SyntaxKind.PREFIX_EXPR) {
					SyntaxNode operand = firstChildNode(parent);
					if (operand != null && operand.getKind() == SyntaxKind.LITERAL) {
						return Highlight.of(HighlightTag.NUMERIC_LITERAL);
					}
					return Highlight.of(HighlightTag.OPERATOR);
				}
				break;
			default:
				break;
		}
		if (parentKind == null) {
			return Highlight.of(HighlightTag.PUNCTUATION);
		}
		switch (parentKind) {
			case PREFIX_EXPR:
			case BIN_EXPR:
			case RANGE_EXPR:
			case RANGE_PAT:
			case REST_PAT:
				return Highlight.of(HighlightTag.OPERATOR);
			case ATTR:
				return Highlight.of(HighlightTag.ATTRIBUTE);
			default:
				return Highlight.of(HighlightTag.PUNCTUATION);
		}
	}

	private Highlight classifyKeyword(SyntaxElement element) {
		Highlight h = Highlight.of(HighlightTag.KEYWORD);
		SyntaxNode parent = element.getParent();
		switch (element.getKind()) {
			case BREAK_KW:
			case CONTINUE_KW:
			case ELSE_KW:
			case IF_KW:
			case LOOP_KW:
			case MATCH_KW:
			case RETURN_KW:
			case WHILE_KW:
			case IN_KW:
				return h.with(HighlightModifier.CONTROL_FLOW);
			case FOR_KW:
				if (parent != null && parent.getKind() == SyntaxKind.IMPL) {
					return h;
				}
				return h.with(HighlightModifier.CONTROL_FLOW);
			case UNSAFE_KW:
				return h.with(HighlightModifier.UNSAFE);
			case TRUE_KW:
			case FALSE_KW:
				return Highlight.of(HighlightTag.BOOL_LITERAL);
			case SELF_KW:
				return classifySelfKeyword(element);
			case REF_KW:
				if (parent != null && parent.getKind() == SyntaxKind.IDENT_PAT && semantics.isUnsafeIdentPat(parent)) {
					return h.with(HighlightModifier.UNSAFE);
				}
				return h;
			default:
				return h;
		}
	}

	private Highlight classifySelfKeyword(SyntaxElement element) {
		Highlight h = Highlight.of(HighlightTag.SELF_PARAM);
		SyntaxNode parent = element.getParent();
		if (parent == null) {
			return h;
		}
		if (parent.getKind() == SyntaxKind.SELF_PARAM) {
			return parent.firstChildToken(SyntaxKind.MUT_KW) != null ? h.with(HighlightModifier.MUTABLE) : h;
		}
		SyntaxNode path = parent.getParent();
		if (path == null || path.getKind() != SyntaxKind.PATH) {
			return h;
		}
		Optional<Definition> resolved = semantics.resolvePath(path);
		if (!resolved.isPresent() || resolved.get().getKind() != DefinitionKind.LOCAL) {
			return h;
		}
		Definition local = resolved.get();
		TypeInfo type = local.getType();
		if (local.isSelf() && (local.isMutable() || (type != null && type.isMutableReference()))) {
			h = h.with(HighlightModifier.MUTABLE);
		}
		if (DefinitionHighlighter.isConsumedLvalue(element, local)) {
			h = h.with(HighlightModifier.CONSUMING);
		}
		return h;
	}

	private static boolean isInsideAttribute(SyntaxElement element) {
		for (SyntaxNode ancestor : element.ancestors()) {
			if (ancestor.getKind() == SyntaxKind.ATTR) {
				return true;
			}
		}
		return false;
	}

	private static SyntaxNode firstChildNode(SyntaxNode node) {
		for (SyntaxElement child : node.getChildrenWithTokens()) {
			if (child.isNode()) {
				return (SyntaxNode) child;
			}
		}
		return null;
	}

	private static String nameOf(Definition def, SyntaxNode node) {
		return def.getName() != null ? def.getName() : node.getText();
	}
}
