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

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts how often each local name has been bound in the current function so
 * that shadowed bindings get distinct binding hashes.
 */
public final class ShadowCounter {
	private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
	private static final long FNV_PRIME = 0x100000001b3L;

	private final Map<String, Integer> counts = new HashMap<>();

	/**
	 * Forgets all names; called when a new function starts.
	 */
	public void clear() {
		counts.clear();
	}

	/**
	 * Records a new binding of {@code name} and returns its hash.
	 */
	public long bind(String name) {
		int count = counts.getOrDefault(name, 0) + 1;
		counts.put(name, count);
		return bindingHash(name, count);
	}

	/**
	 * Hash of the binding of {@code name} currently in scope.
	 */
	public long reference(String name) {
		return bindingHash(name, counts.getOrDefault(name, 0));
	}

	/**
	 * 64-bit FNV-1a over the UTF-8 name followed by the big-endian counter.
	 */
	public static long bindingHash(String name, int shadowCount) {
		long hash = FNV_OFFSET_BASIS;
		for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
			hash ^= (b & 0xff);
			hash *= FNV_PRIME;
		}
		for (int shift = 24; shift >= 0; shift -= 8) {
			hash ^= (shadowCount >>> shift) & 0xff;
			hash *= FNV_PRIME;
		}
		return hash;
	}
}
