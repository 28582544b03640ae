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
 * What a highlighted range is. The declaration order is the order of the
 * semantic token legend.
 */
public enum HighlightTag {
	KEYWORD("keyword"),
	FUNCTION("function"),
	STRUCT("struct"),
	ENUM("enum"),
	UNION("union"),
	ENUM_VARIANT("enum_variant"),
	TRAIT("trait"),
	TYPE_ALIAS("type_alias"),
	TYPE_PARAM("type_param"),
	CONST_PARAM("const_param"),
	LIFETIME_PARAM("lifetime"),
	FIELD("field"),
	LOCAL("variable"),
	VALUE_PARAM("value_param"),
	SELF_PARAM("self_keyword"),
	MODULE("module"),
	CONSTANT("constant"),
	STATIC("static"),
	MACRO("macro"),
	LABEL("label"),
	OPERATOR("operator"),
	PUNCTUATION("punctuation"),
	ATTRIBUTE("attribute"),
	COMMENT("comment"),
	STRING_LITERAL("string_literal"),
	BYTE_LITERAL("byte_literal"),
	CHAR_LITERAL("char_literal"),
	NUMERIC_LITERAL("numeric_literal"),
	BOOL_LITERAL("bool_literal"),
	ESCAPE_SEQUENCE("escape_sequence"),
	FORMAT_SPECIFIER("format_specifier"),
	BUILTIN_TYPE("builtin_type"),
	UNRESOLVED_REFERENCE("unresolved_reference"),
	SELF_TYPE("self_type"),
	// a region whose highlighting comes from injected ranges only
	DUMMY("dummy");

	private final String name;

	HighlightTag(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return name;
	}
}
