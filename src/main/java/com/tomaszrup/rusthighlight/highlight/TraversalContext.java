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

import java.util.List;

import com.tomaszrup.rusthighlight.highlight.injection.FormatStringHighlighter;
import com.tomaszrup.rusthighlight.highlight.injection.MacroRulesHighlighter;
import com.tomaszrup.rusthighlight.syntax.SyntaxNode;

/**
 * State of one highlighting walk that depends on where the walk currently is:
 * the enclosing macro call, the enclosing {@code macro_rules!} definition and
 * whether it is inside an attribute.
 */
public class TraversalContext {
	private SyntaxNode macroCall;
	private SyntaxNode macroRules;
	private boolean insideAttribute;
	private final FormatStringHighlighter formatStrings;
	private final MacroRulesHighlighter macroRulesHighlighter = new MacroRulesHighlighter();

	public TraversalContext(List<String> formatMacros) {
		this.formatStrings = new FormatStringHighlighter(formatMacros);
	}

	/**
	 * Macro calls do not nest in a source tree: arguments are token trees, so
	 * a call is entered only when no other call is open.
	 */
	public void enterMacroCall(SyntaxNode macroCall) {
		if (this.macroCall != null) {
			throw new IllegalStateException("Entering macro call " + macroCall + " inside " + this.macroCall);
		}
		this.macroCall = macroCall;
	}

	public void leaveMacroCall(SyntaxNode macroCall) {
		if (this.macroCall != macroCall) {
			throw new IllegalStateException("Leaving macro call " + macroCall + " that is not the current one");
		}
		this.macroCall = null;
		formatStrings.reset();
	}

	public boolean isInMacroCall() {
		return macroCall != null;
	}

	public void enterMacroRules(SyntaxNode definition) {
		macroRules = definition;
		macroRulesHighlighter.init();
	}

	public void leaveMacroRules(SyntaxNode definition) {
		if (macroRules != definition) {
			throw new IllegalStateException("Leaving macro definition " + definition + " that is not the current one");
		}
		macroRules = null;
		macroRulesHighlighter.reset();
	}

	public boolean isInMacroRules() {
		return macroRules != null;
	}

	public boolean isInsideAttribute() {
		return insideAttribute;
	}

	public void setInsideAttribute(boolean insideAttribute) {
		this.insideAttribute = insideAttribute;
	}

	public FormatStringHighlighter getFormatStrings() {
		return formatStrings;
	}

	public MacroRulesHighlighter getMacroRulesHighlighter() {
		return macroRulesHighlighter;
	}
}
