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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.tomaszrup.rusthighlight.syntax.Preorder;
import com.tomaszrup.rusthighlight.syntax.SyntaxElement;
import com.tomaszrup.rusthighlight.syntax.SyntaxKind;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;
import com.tomaszrup.rusthighlight.syntax.SyntaxToken;
import com.tomaszrup.rusthighlight.syntax.SyntaxTreeBuilder;
import com.tomaszrup.rusthighlight.syntax.WalkEvent;

/**
 * Small DSL for building syntax trees in tests:
 * {@code build(node(SOURCE_FILE, token(FN_KW), ws(), ...))}.
 */
public final class TreeFixtures {
	private TreeFixtures() {
	}

	/** Shape of a tree element before it is built. */
	public static final class Shape {
		final SyntaxKind kind;
		final String text;
		final List<Shape> children;

		private Shape(SyntaxKind kind, String text, List<Shape> children) {
			this.kind = kind;
			this.text = text;
			this.children = children;
		}
	}

	public static Shape node(SyntaxKind kind, Shape... children) {
		return new Shape(kind, null, Arrays.asList(children));
	}

	public static Shape token(SyntaxKind kind, String text) {
		return new Shape(kind, text, null);
	}

	public static Shape token(SyntaxKind kind) {
		return new Shape(kind, kind.getText(), null);
	}

	public static Shape ws() {
		return token(SyntaxKind.WHITESPACE, " ");
	}

	public static Shape ws(String text) {
		return token(SyntaxKind.WHITESPACE, text);
	}

	public static Shape ident(String text) {
		return token(SyntaxKind.IDENT, text);
	}

	public static Shape name(String text) {
		return node(SyntaxKind.NAME, ident(text));
	}

	public static Shape nameRef(String text) {
		return node(SyntaxKind.NAME_REF, ident(text));
	}

	/** {@code PATH_EXPR > PATH > PATH_SEGMENT > NAME_REF} */
	public static Shape pathExpr(String text) {
		return node(SyntaxKind.PATH_EXPR, path(text));
	}

	public static Shape path(String text) {
		return node(SyntaxKind.PATH, node(SyntaxKind.PATH_SEGMENT, nameRef(text)));
	}

	public static SyntaxNode build(Shape root) {
		SyntaxTreeBuilder builder = new SyntaxTreeBuilder();
		append(builder, root);
		return builder.finish();
	}

	private static void append(SyntaxTreeBuilder builder, Shape shape) {
		if (shape.children == null) {
			builder.token(shape.kind, shape.text);
			return;
		}
		builder.startNode(shape.kind);
		for (Shape child : shape.children) {
			append(builder, child);
		}
		builder.finishNode();
	}

	/**
	 * All elements of {@code kind} whose text is {@code text}, in document
	 * order.
	 */
	public static List<SyntaxElement> findAll(SyntaxNode root, SyntaxKind kind, String text) {
		List<SyntaxElement> result = new ArrayList<>();
		Preorder preorder = root.preorderWithTokens();
		while (preorder.hasNext()) {
			WalkEvent event = preorder.next();
			SyntaxElement element = event.getElement();
			if (event.isEnter() && element.getKind() == kind && element.getText().equals(text)) {
				result.add(element);
			}
		}
		return result;
	}

	public static SyntaxNode findNode(SyntaxNode root, SyntaxKind kind, String text) {
		return find(root, kind, text).asNode();
	}

	public static SyntaxToken findToken(SyntaxNode root, SyntaxKind kind, String text) {
		return find(root, kind, text).asToken();
	}

	private static SyntaxElement find(SyntaxNode root, SyntaxKind kind, String text) {
		List<SyntaxElement> all = findAll(root, kind, text);
		if (all.isEmpty()) {
			throw new IllegalArgumentException("No " + kind + " with text '" + text + "' in " + root);
		}
		return all.get(0);
	}
}
