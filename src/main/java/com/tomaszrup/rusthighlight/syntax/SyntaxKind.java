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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Every token and node kind of the Rust syntax tree. The set is closed: the
 * parser that produces trees for the highlighter must map its own kinds onto
 * these.
 */
public enum SyntaxKind {
	// punctuation
	SEMICOLON(Category.PUNCT, ";"),
	COMMA(Category.PUNCT, ","),
	L_PAREN(Category.PUNCT, "("),
	R_PAREN(Category.PUNCT, ")"),
	L_CURLY(Category.PUNCT, "{"),
	R_CURLY(Category.PUNCT, "}"),
	L_BRACK(Category.PUNCT, "["),
	R_BRACK(Category.PUNCT, "]"),
	L_ANGLE(Category.PUNCT, "<"),
	R_ANGLE(Category.PUNCT, ">"),
	AT(Category.PUNCT, "@"),
	POUND(Category.PUNCT, "#"),
	TILDE(Category.PUNCT, "~"),
	QUESTION(Category.PUNCT, "?"),
	DOLLAR(Category.PUNCT, "$"),
	AMP(Category.PUNCT, "&"),
	PIPE(Category.PUNCT, "|"),
	PLUS(Category.PUNCT, "+"),
	STAR(Category.PUNCT, "*"),
	SLASH(Category.PUNCT, "/"),
	CARET(Category.PUNCT, "^"),
	PERCENT(Category.PUNCT, "%"),
	UNDERSCORE(Category.PUNCT, "_"),
	DOT(Category.PUNCT, "."),
	DOT2(Category.PUNCT, ".."),
	DOT3(Category.PUNCT, "..."),
	DOT2EQ(Category.PUNCT, "..="),
	COLON(Category.PUNCT, ":"),
	COLON2(Category.PUNCT, "::"),
	EQ(Category.PUNCT, "="),
	EQ2(Category.PUNCT, "=="),
	FAT_ARROW(Category.PUNCT, "=>"),
	BANG(Category.PUNCT, "!"),
	NEQ(Category.PUNCT, "!="),
	MINUS(Category.PUNCT, "-"),
	THIN_ARROW(Category.PUNCT, "->"),
	LTEQ(Category.PUNCT, "<="),
	GTEQ(Category.PUNCT, ">="),
	PLUSEQ(Category.PUNCT, "+="),
	MINUSEQ(Category.PUNCT, "-="),
	PIPEEQ(Category.PUNCT, "|="),
	AMPEQ(Category.PUNCT, "&="),
	CARETEQ(Category.PUNCT, "^="),
	SLASHEQ(Category.PUNCT, "/="),
	STAREQ(Category.PUNCT, "*="),
	PERCENTEQ(Category.PUNCT, "%="),
	AMP2(Category.PUNCT, "&&"),
	PIPE2(Category.PUNCT, "||"),
	SHL(Category.PUNCT, "<<"),
	SHR(Category.PUNCT, ">>"),
	SHLEQ(Category.PUNCT, "<<="),
	SHREQ(Category.PUNCT, ">>="),

	// keywords
	AS_KW(Category.KEYWORD, "as"),
	ASYNC_KW(Category.KEYWORD, "async"),
	AWAIT_KW(Category.KEYWORD, "await"),
	BOX_KW(Category.KEYWORD, "box"),
	BREAK_KW(Category.KEYWORD, "break"),
	CONST_KW(Category.KEYWORD, "const"),
	CONTINUE_KW(Category.KEYWORD, "continue"),
	CRATE_KW(Category.KEYWORD, "crate"),
	DYN_KW(Category.KEYWORD, "dyn"),
	ELSE_KW(Category.KEYWORD, "else"),
	ENUM_KW(Category.KEYWORD, "enum"),
	EXTERN_KW(Category.KEYWORD, "extern"),
	FALSE_KW(Category.KEYWORD, "false"),
	FN_KW(Category.KEYWORD, "fn"),
	FOR_KW(Category.KEYWORD, "for"),
	IF_KW(Category.KEYWORD, "if"),
	IMPL_KW(Category.KEYWORD, "impl"),
	IN_KW(Category.KEYWORD, "in"),
	LET_KW(Category.KEYWORD, "let"),
	LOOP_KW(Category.KEYWORD, "loop"),
	MACRO_KW(Category.KEYWORD, "macro"),
	MATCH_KW(Category.KEYWORD, "match"),
	MOD_KW(Category.KEYWORD, "mod"),
	MOVE_KW(Category.KEYWORD, "move"),
	MUT_KW(Category.KEYWORD, "mut"),
	PUB_KW(Category.KEYWORD, "pub"),
	REF_KW(Category.KEYWORD, "ref"),
	RETURN_KW(Category.KEYWORD, "return"),
	SELF_KW(Category.KEYWORD, "self"),
	STATIC_KW(Category.KEYWORD, "static"),
	STRUCT_KW(Category.KEYWORD, "struct"),
	SUPER_KW(Category.KEYWORD, "super"),
	TRAIT_KW(Category.KEYWORD, "trait"),
	TRUE_KW(Category.KEYWORD, "true"),
	TRY_KW(Category.KEYWORD, "try"),
	TYPE_KW(Category.KEYWORD, "type"),
	UNSAFE_KW(Category.KEYWORD, "unsafe"),
	USE_KW(Category.KEYWORD, "use"),
	WHERE_KW(Category.KEYWORD, "where"),
	WHILE_KW(Category.KEYWORD, "while"),
	YIELD_KW(Category.KEYWORD, "yield"),
	// contextual keywords, never produced for plain identifiers by fromKeyword
	AUTO_KW(Category.CONTEXTUAL_KEYWORD, "auto"),
	DEFAULT_KW(Category.CONTEXTUAL_KEYWORD, "default"),
	EXISTENTIAL_KW(Category.CONTEXTUAL_KEYWORD, "existential"),
	UNION_KW(Category.CONTEXTUAL_KEYWORD, "union"),
	RAW_KW(Category.CONTEXTUAL_KEYWORD, "raw"),

	// literals
	INT_NUMBER(Category.LITERAL),
	FLOAT_NUMBER(Category.LITERAL),
	CHAR(Category.LITERAL),
	BYTE(Category.LITERAL),
	STRING(Category.LITERAL),
	BYTE_STRING(Category.LITERAL),

	// other tokens
	ERROR(Category.TOKEN),
	IDENT(Category.TOKEN),
	LIFETIME_IDENT(Category.TOKEN),
	WHITESPACE(Category.TRIVIA),
	COMMENT(Category.TRIVIA),
	SHEBANG(Category.TOKEN),

	// nodes
	SOURCE_FILE,
	STRUCT,
	UNION,
	ENUM,
	FN,
	RET_TYPE,
	EXTERN_CRATE,
	MODULE,
	USE,
	STATIC,
	CONST,
	TRAIT,
	IMPL,
	TYPE_ALIAS,
	MACRO_CALL,
	MACRO_RULES,
	MACRO_DEF,
	TOKEN_TREE,
	PAREN_TYPE,
	TUPLE_TYPE,
	NEVER_TYPE,
	PATH_TYPE,
	PTR_TYPE,
	ARRAY_TYPE,
	SLICE_TYPE,
	REF_TYPE,
	INFER_TYPE,
	FN_PTR_TYPE,
	FOR_TYPE,
	IMPL_TRAIT_TYPE,
	DYN_TRAIT_TYPE,
	OR_PAT,
	PAREN_PAT,
	REF_PAT,
	BOX_PAT,
	IDENT_PAT,
	WILDCARD_PAT,
	REST_PAT,
	PATH_PAT,
	RECORD_PAT,
	RECORD_PAT_FIELD_LIST,
	RECORD_PAT_FIELD,
	TUPLE_STRUCT_PAT,
	TUPLE_PAT,
	SLICE_PAT,
	RANGE_PAT,
	LITERAL_PAT,
	MACRO_PAT,
	TUPLE_EXPR,
	ARRAY_EXPR,
	PAREN_EXPR,
	PATH_EXPR,
	CLOSURE_EXPR,
	IF_EXPR,
	WHILE_EXPR,
	CONDITION,
	LOOP_EXPR,
	FOR_EXPR,
	CONTINUE_EXPR,
	BREAK_EXPR,
	LABEL,
	BLOCK_EXPR,
	RETURN_EXPR,
	MATCH_EXPR,
	MATCH_ARM_LIST,
	MATCH_ARM,
	MATCH_GUARD,
	RECORD_EXPR,
	RECORD_EXPR_FIELD_LIST,
	RECORD_EXPR_FIELD,
	CALL_EXPR,
	INDEX_EXPR,
	METHOD_CALL_EXPR,
	FIELD_EXPR,
	AWAIT_EXPR,
	TRY_EXPR,
	CAST_EXPR,
	REF_EXPR,
	PREFIX_EXPR,
	RANGE_EXPR,
	BIN_EXPR,
	LITERAL,
	EXTERN_BLOCK,
	EXTERN_ITEM_LIST,
	VARIANT,
	VARIANT_LIST,
	RECORD_FIELD_LIST,
	RECORD_FIELD,
	TUPLE_FIELD_LIST,
	TUPLE_FIELD,
	ITEM_LIST,
	ASSOC_ITEM_LIST,
	ATTR,
	USE_TREE,
	USE_TREE_LIST,
	PATH,
	PATH_SEGMENT,
	RENAME,
	VISIBILITY,
	WHERE_CLAUSE,
	WHERE_PRED,
	ABI,
	NAME,
	NAME_REF,
	LET_STMT,
	EXPR_STMT,
	GENERIC_PARAM_LIST,
	LIFETIME_PARAM,
	TYPE_PARAM,
	CONST_PARAM,
	GENERIC_ARG_LIST,
	LIFETIME,
	LIFETIME_ARG,
	TYPE_ARG,
	ASSOC_TYPE_ARG,
	CONST_ARG,
	PARAM_LIST,
	PARAM,
	SELF_PARAM,
	ARG_LIST,
	TYPE_BOUND,
	TYPE_BOUND_LIST,
	MACRO_ITEMS,
	MACRO_STMTS;

	private enum Category {
		PUNCT,
		KEYWORD,
		CONTEXTUAL_KEYWORD,
		LITERAL,
		TRIVIA,
		TOKEN,
		NODE
	}

	private static final Map<String, SyntaxKind> KEYWORDS;
	private static final Map<String, SyntaxKind> PUNCTUATION;

	static {
		Map<String, SyntaxKind> keywords = new HashMap<>();
		Map<String, SyntaxKind> punctuation = new HashMap<>();
		for (SyntaxKind kind : values()) {
			if (kind.category == Category.KEYWORD) {
				keywords.put(kind.text, kind);
			} else if (kind.category == Category.PUNCT) {
				punctuation.put(kind.text, kind);
			}
		}
		KEYWORDS = Collections.unmodifiableMap(keywords);
		PUNCTUATION = Collections.unmodifiableMap(punctuation);
	}

	private final Category category;
	private final String text;

	SyntaxKind() {
		this(Category.NODE, null);
	}

	SyntaxKind(Category category) {
		this(category, null);
	}

	SyntaxKind(Category category, String text) {
		this.category = category;
		this.text = text;
	}

	/**
	 * Returns the fixed source text of a keyword or punctuation kind, or
	 * {@code null} for kinds whose text varies.
	 */
	public String getText() {
		return text;
	}

	public boolean isKeyword() {
		return category == Category.KEYWORD || category == Category.CONTEXTUAL_KEYWORD;
	}

	public boolean isPunct() {
		return category == Category.PUNCT;
	}

	public boolean isLiteral() {
		return category == Category.LITERAL;
	}

	public boolean isTrivia() {
		return category == Category.TRIVIA;
	}

	public boolean isNode() {
		return category == Category.NODE;
	}

	public boolean isToken() {
		return category != Category.NODE;
	}

	/**
	 * Maps a strict keyword to its kind. Contextual keywords are identifiers
	 * unless the parser says otherwise, so they are not returned here.
	 */
	public static SyntaxKind fromKeyword(String word) {
		return KEYWORDS.get(word);
	}

	public static SyntaxKind fromPunct(String punct) {
		return PUNCTUATION.get(punct);
	}
}
