// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wysilicon.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import wysilicon.core.SilFile;

/**
 * A unit of resource held in a heap, together with the amount of permission
 * held to it. Chunks are immutable and have identity: two chunks describing the
 * same location are distinct objects, and a heap removes chunks by identity.
 */
public abstract class Chunk {
	private final Term permission;

	public Chunk(Term permission) {
		this.permission = permission;
	}

	public Term getPermission() {
		return permission;
	}

	public abstract Chunk withPermission(Term permission);

	/**
	 * Permission to a single field of a single object.
	 */
	public static final class Field extends Chunk {
		private final Term receiver;
		private final String field;
		private final Term value;

		public Field(Term receiver, String field, Term value, Term permission) {
			super(permission);
			this.receiver = receiver;
			this.field = field;
			this.value = value;
		}

		public Term getReceiver() {
			return receiver;
		}

		public String getField() {
			return field;
		}

		public Term getValue() {
			return value;
		}

		public Field withValue(Term value) {
			return new Field(receiver, field, value, getPermission());
		}

		@Override
		public Field withPermission(Term permission) {
			return new Field(receiver, field, value, permission);
		}

		@Override
		public String toString() {
			return receiver + "." + field + " -> " + value + " # " + getPermission();
		}
	}

	/**
	 * An instance of a predicate. The snapshot records the values held by the
	 * resources folded into the instance.
	 */
	public static final class Predicate extends Chunk {
		private final String name;
		private final List<Term> arguments;
		private final Term snapshot;

		public Predicate(String name, List<Term> arguments, Term snapshot, Term permission) {
			super(permission);
			this.name = name;
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			this.snapshot = snapshot;
		}

		public String getName() {
			return name;
		}

		public List<Term> getArguments() {
			return arguments;
		}

		public Term getSnapshot() {
			return snapshot;
		}

		@Override
		public Predicate withPermission(Term permission) {
			return new Predicate(name, arguments, snapshot, permission);
		}

		@Override
		public String toString() {
			return name + arguments + " -> " + snapshot + " # " + getPermission();
		}
	}

	/**
	 * A magic wand. The bindings map each variable occurring free in the wand to
	 * the value it had when the wand was created.
	 */
	public static final class MagicWand extends Chunk {
		private final SilFile.Expr.MagicWand wand;
		private final Map<String, Term> bindings;

		public MagicWand(SilFile.Expr.MagicWand wand, Map<String, Term> bindings, Term permission) {
			super(permission);
			this.wand = wand;
			this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
		}

		public SilFile.Expr.MagicWand getWand() {
			return wand;
		}

		public Map<String, Term> getBindings() {
			return bindings;
		}

		/**
		 * Check whether this chunk and another describe the same wand, meaning the
		 * same wand expression closed over the same values.
		 *
		 * @param other
		 * @return
		 */
		public boolean hasSameIdentity(MagicWand other) {
			return wand == other.wand && bindings.equals(other.bindings);
		}

		@Override
		public MagicWand withPermission(Term permission) {
			return new MagicWand(wand, bindings, permission);
		}

		@Override
		public String toString() {
			return "wand" + bindings + " # " + getPermission();
		}
	}
}
