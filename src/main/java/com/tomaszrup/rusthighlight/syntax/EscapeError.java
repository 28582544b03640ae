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
 * Reasons an escape sequence in a string literal cannot be unescaped.
 */
public enum EscapeError {
	LONE_SLASH,
	INVALID_ESCAPE,
	BARE_CARRIAGE_RETURN,
	TOO_SHORT_HEX_ESCAPE,
	INVALID_CHAR_IN_HEX_ESCAPE,
	OUT_OF_RANGE_HEX_ESCAPE,
	NO_BRACE_IN_UNICODE_ESCAPE,
	INVALID_CHAR_IN_UNICODE_ESCAPE,
	EMPTY_UNICODE_ESCAPE,
	UNCLOSED_UNICODE_ESCAPE,
	LEADING_UNDERSCORE_UNICODE_ESCAPE,
	OVERLONG_UNICODE_ESCAPE,
	LONE_SURROGATE_UNICODE_ESCAPE,
	OUT_OF_RANGE_UNICODE_ESCAPE
}
