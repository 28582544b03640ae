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
 * Helpers for {@link SyntaxKind#COMMENT} tokens.
 */
public final class Comments {

	private Comments() {
	}

	/**
	 * Returns the comment prefix: {@code ///}, {@code //!}, {@code /**},
	 * {@code /*!} for doc comments and {@code //} or {@code /*} otherwise.
	 */
	public static String prefix(String text) {
		if (text.startsWith("///") && !text.startsWith("////")) {
			return "///";
		}
		if (text.startsWith("//!")) {
			return "//!";
		}
		if (text.startsWith("/**") && !text.startsWith("/***") && !text.startsWith("/**/")) {
			return "/**";
		}
		if (text.startsWith("/*!")) {
			return "/*!";
		}
		if (text.startsWith("/*")) {
			return "/*";
		}
		return "//";
	}

	public static boolean isDoc(String text) {
		return prefix(text).length() == 3;
	}

	/**
	 * Whether the comment documents the enclosing item ({@code //!} or
	 * {@code /*!}).
	 */
	public static boolean isInnerDoc(String text) {
		String prefix = prefix(text);
		return prefix.equals("//!") || prefix.equals("/*!");
	}

	public static boolean isDocComment(SyntaxToken token) {
		return token.getKind() == SyntaxKind.COMMENT && isDoc(token.getText());
	}
}
