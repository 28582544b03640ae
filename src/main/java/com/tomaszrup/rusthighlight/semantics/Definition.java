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

import java.util.Objects;

/**
 * A resolved definition as reported by {@link Semantics}. Only the facts that
 * influence highlighting are carried. Instances are created with
 * {@link #builder(DefinitionKind, String)}.
 */
public final class Definition {
	private final DefinitionKind kind;
	private final String name;
	private final boolean associated;
	private final Access selfAccess;
	private final boolean unsafe;
	private final boolean mutable;
	private final boolean param;
	private final boolean self;
	private final boolean parentIsUnion;
	private final TypeInfo type;

	private Definition(Builder builder) {
		this.kind = builder.kind;
		this.name = builder.name;
		this.associated = builder.associated;
		this.selfAccess = builder.selfAccess;
		this.unsafe = builder.unsafe;
		this.mutable = builder.mutable;
		this.param = builder.param;
		this.self = builder.self;
		this.parentIsUnion = builder.parentIsUnion;
		this.type = builder.type;
	}

	public static Builder builder(DefinitionKind kind, String name) {
		return new Builder(kind, name);
	}

	public DefinitionKind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	/** Whether a function or constant is a trait or impl member. */
	public boolean isAssociated() {
		return associated;
	}

	/**
	 * Receiver access of a function, or {@code null} if it takes no
	 * {@code self}.
	 */
	public Access getSelfAccess() {
		return selfAccess;
	}

	public boolean hasSelfParam() {
		return selfAccess != null;
	}

	public boolean isUnsafe() {
		return unsafe;
	}

	/** {@code let mut}, {@code static mut} or {@code mut self}. */
	public boolean isMutable() {
		return mutable;
	}

	/** Whether a local is a function parameter. */
	public boolean isParam() {
		return param;
	}

	/** Whether a local is the {@code self} binding. */
	public boolean isSelf() {
		return self;
	}

	/** Whether a field belongs to a union. */
	public boolean isParentUnion() {
		return parentIsUnion;
	}

	/**
	 * Type of a local, or {@code null} when unknown.
	 */
	public TypeInfo getType() {
		return type;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Definition)) return false;
		Definition other = (Definition) o;
		return kind == other.kind && Objects.equals(name, other.name) && associated == other.associated
				&& selfAccess == other.selfAccess && unsafe == other.unsafe && mutable == other.mutable
				&& param == other.param && self == other.self && parentIsUnion == other.parentIsUnion
				&& Objects.equals(type, other.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name, associated, selfAccess, unsafe, mutable, param, self, parentIsUnion, type);
	}

	@Override
	public String toString() {
		return "Definition{" + kind + " " + name + "}";
	}

	public static final class Builder {
		private final DefinitionKind kind;
		private final String name;
		private boolean associated;
		private Access selfAccess;
		private boolean unsafe;
		private boolean mutable;
		private boolean param;
		private boolean self;
		private boolean parentIsUnion;
		private TypeInfo type;

		private Builder(DefinitionKind kind, String name) {
			this.kind = Objects.requireNonNull(kind, "kind");
			this.name = name;
		}

		public Builder associated() {
			this.associated = true;
			return this;
		}

		public Builder selfAccess(Access access) {
			this.selfAccess = access;
			return this;
		}

		public Builder unsafe() {
			this.unsafe = true;
			return this;
		}

		public Builder mutable() {
			this.mutable = true;
			return this;
		}

		public Builder param() {
			this.param = true;
			return this;
		}

		public Builder self() {
			this.self = true;
			return this;
		}

		public Builder parentIsUnion() {
			this.parentIsUnion = true;
			return this;
		}

		public Builder type(TypeInfo type) {
			this.type = type;
			return this;
		}

		public Definition build() {
			return new Definition(this);
		}
	}
}
