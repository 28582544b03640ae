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
package com.tomaszrup.rusthighlight.semantics;

/**
 * The type facts the highlighter asks about. Instances are immutable; the
 * {@code with*} methods return modified copies.
 */
public final class TypeInfo {
	/** A type that is neither copyable nor otherwise special. */
	public static final TypeInfo UNKNOWN = new TypeInfo(false, false, false, false);

	private final boolean copy;
	private final boolean mutableReference;
	private final boolean rawPointer;
	private final boolean callable;

	private TypeInfo(boolean copy, boolean mutableReference, boolean rawPointer, boolean callable) {
		this.copy = copy;
		this.mutableReference = mutableReference;
		this.rawPointer = rawPointer;
		this.callable = callable;
	}

	public boolean isCopy() {
		return copy;
	}

	public boolean isMutableReference() {
		return mutableReference;
	}

	public boolean isRawPointer() {
		return rawPointer;
	}

	/**
	 * Whether values of the type can be called: functions, closures and
	 * {@code FnOnce} implementors.
	 */
	public boolean isCallable() {
		return callable;
	}

	public TypeInfo withCopy() {
		return new TypeInfo(true, mutableReference, rawPointer, callable);
	}

	public TypeInfo withMutableReference() {
		return new TypeInfo(copy, true, rawPointer, callable);
	}

	public TypeInfo withRawPointer() {
		return new TypeInfo(copy, mutableReference, true, callable);
	}

	public TypeInfo withCallable() {
		return new TypeInfo(copy, mutableReference, rawPointer, true);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TypeInfo)) return false;
		TypeInfo other = (TypeInfo) o;
		return copy == other.copy && mutableReference == other.mutableReference
				&& rawPointer == other.rawPointer && callable == other.callable;
	}

	@Override
	public int hashCode() {
		return (copy ? 1 : 0) | (mutableReference ? 2 : 0) | (rawPointer ? 4 : 0) | (callable ? 8 : 0);
	}

	@Override
	public String toString() {
		return "TypeInfo{copy=" + copy + ", mutableReference=" + mutableReference
				+ ", rawPointer=" + rawPointer + ", callable=" + callable + "}";
	}
}
