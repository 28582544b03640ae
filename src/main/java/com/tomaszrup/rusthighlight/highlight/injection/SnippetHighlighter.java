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
package com.tomaszrup.rusthighlight.highlight.injection;

import java.util.List;

import com.tomaszrup.rusthighlight.highlight.HighlightedRange;

/**
 * Highlights a standalone piece of Rust code found inside other code.
 */
@FunctionalInterface
public interface SnippetHighlighter {

	/**
	 * Returns the highlighted ranges of {@code text}, with offsets relative to
	 * its start, or {@code null} if the snippet cannot be analyzed.
	 */
	List<HighlightedRange> highlight(String text);
}
