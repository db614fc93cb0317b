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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import wysilicon.util.Rational;

/**
 * A symbolic term. Terms are immutable and compared structurally, so that two
 * separately constructed terms denoting the same expression are equal. Terms
 * should normally be built through {@link Terms}, which simplifies as it goes.
 */
public abstract class Term {

	public enum Sort {
		INT, BOOL, REF, PERM, SNAP, WAND;

		public boolean isNumeric() {
			return this == INT || this == PERM;
		}
	}

	public static final Bool TRUE = new Bool(true);
	public static final Bool FALSE = new Bool(false);
	public static final Null NULL = new Null();
	public static final Unit UNIT = new Unit();

	public abstract Sort getSort();

	// =========================================================================
	// Leaves
	// =========================================================================

	/**
	 * A symbolic constant, such as the fresh value introduced when a variable is
	 * havocked.
	 */
	public static final class Var extends Term {
		private final String name;
		private final Sort sort;

		public Var(String name, Sort sort) {
			this.name = name;
			this.sort = sort;
		}

		public String getName() {
			return name;
		}

		@Override
		public Sort getSort() {
			return sort;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Var) {
				Var v = (Var) o;
				return name.equals(v.name) && sort == v.sort;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * A numeric literal of sort {@link Sort#INT} or {@link Sort#PERM}.
	 */
	public static final class Num extends Term {
		private final Rational value;
		private final Sort sort;

		public Num(Rational value, Sort sort) {
			if (!sort.isNumeric()) {
				throw new IllegalArgumentException("invalid sort for numeric literal (" + sort + ")");
			}
			this.value = value;
			this.sort = sort;
		}

		public Rational getValue() {
			return value;
		}

		@Override
		public Sort getSort() {
			return sort;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Num) {
				Num n = (Num) o;
				return value.equals(n.value) && sort == n.sort;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	public static final class Bool extends Term {
		private final boolean value;

		private Bool(boolean value) {
			this.value = value;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public Sort getSort() {
			return Sort.BOOL;
		}

		@Override
		public String toString() {
			return Boolean.toString(value);
		}
	}

	public static final class Null extends Term {
		private Null() {
		}

		@Override
		public Sort getSort() {
			return Sort.REF;
		}

		@Override
		public String toString() {
			return "null";
		}
	}

	/**
	 * The empty snapshot, as recorded for pure assertions.
	 */
	public static final class Unit extends Term {
		private Unit() {
		}

		@Override
		public Sort getSort() {
			return Sort.SNAP;
		}

		@Override
		public String toString() {
			return "()";
		}
	}

	/**
	 * The value bound to a variable of wand type, which refers to a wand chunk
	 * that need not (yet) be in the heap.
	 */
	public static final class WandChunk extends Term {
		private final Chunk.MagicWand chunk;

		public WandChunk(Chunk.MagicWand chunk) {
			this.chunk = chunk;
		}

		public Chunk.MagicWand getChunk() {
			return chunk;
		}

		@Override
		public Sort getSort() {
			return Sort.WAND;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof WandChunk && ((WandChunk) o).chunk == chunk;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(chunk);
		}

		@Override
		public String toString() {
			return "wand@" + Integer.toHexString(hashCode());
		}
	}

	// =========================================================================
	// Applications
	// =========================================================================

	public static abstract class Application extends Term {
		private final Sort sort;
		private final List<Term> operands;

		protected Application(Sort sort, Term... operands) {
			this.sort = sort;
			this.operands = Collections.unmodifiableList(Arrays.asList(operands));
		}

		protected Application(Sort sort, List<Term> operands) {
			this.sort = sort;
			this.operands = Collections.unmodifiableList(operands);
		}

		public List<Term> getOperands() {
			return operands;
		}

		public Term getOperand(int i) {
			return operands.get(i);
		}

		@Override
		public Sort getSort() {
			return sort;
		}

		@Override
		public boolean equals(Object o) {
			if (o != null && o.getClass() == getClass()) {
				Application a = (Application) o;
				return sort == a.sort && operands.equals(a.operands);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return getClass().hashCode() ^ operands.hashCode();
		}

		protected String infix(String operator) {
			StringBuilder sb = new StringBuilder("(");
			for (int i = 0; i != operands.size(); ++i) {
				if (i != 0) {
					sb.append(" ").append(operator).append(" ");
				}
				sb.append(operands.get(i));
			}
			return sb.append(")").toString();
		}

		protected String prefix(String operator) {
			StringBuilder sb = new StringBuilder(operator).append("(");
			for (int i = 0; i != operands.size(); ++i) {
				if (i != 0) {
					sb.append(", ");
				}
				sb.append(operands.get(i));
			}
			return sb.append(")").toString();
		}
	}

	public static final class Plus extends Application {
		public Plus(Term lhs, Term rhs) {
			super(lhs.getSort(), lhs, rhs);
		}

		@Override
		public String toString() {
			return infix("+");
		}
	}

	public static final class Minus extends Application {
		public Minus(Term lhs, Term rhs) {
			super(lhs.getSort(), lhs, rhs);
		}

		@Override
		public String toString() {
			return infix("-");
		}
	}

	public static final class Times extends Application {
		public Times(Term lhs, Term rhs) {
			super(lhs.getSort() == Sort.PERM || rhs.getSort() == Sort.PERM ? Sort.PERM : lhs.getSort(), lhs, rhs);
		}

		@Override
		public String toString() {
			return infix("*");
		}
	}

	/**
	 * Division, which is integer division at sort {@link Sort#INT} and exact
	 * division when forming a permission amount.
	 */
	public static final class Div extends Application {
		public Div(Term lhs, Term rhs, Sort sort) {
			super(sort, lhs, rhs);
		}

		@Override
		public String toString() {
			return infix(getSort() == Sort.PERM ? "/" : "div");
		}
	}

	public static final class Eq extends Application {
		public Eq(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}

		@Override
		public String toString() {
			return infix("==");
		}
	}

	public static final class Less extends Application {
		public Less(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}

		@Override
		public String toString() {
			return infix("<");
		}
	}

	public static final class AtMost extends Application {
		public AtMost(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}

		@Override
		public String toString() {
			return infix("<=");
		}
	}

	public static final class Not extends Application {
		public Not(Term operand) {
			super(Sort.BOOL, operand);
		}

		@Override
		public String toString() {
			return "!" + getOperand(0);
		}
	}

	public static final class And extends Application {
		public And(List<Term> operands) {
			super(Sort.BOOL, operands);
		}

		@Override
		public String toString() {
			return infix("&&");
		}
	}

	public static final class Or extends Application {
		public Or(List<Term> operands) {
			super(Sort.BOOL, operands);
		}

		@Override
		public String toString() {
			return infix("||");
		}
	}

	public static final class Implies extends Application {
		public Implies(Term lhs, Term rhs) {
			super(Sort.BOOL, lhs, rhs);
		}

		@Override
		public String toString() {
			return infix("==>");
		}
	}

	public static final class Ite extends Application {
		public Ite(Term condition, Term trueBranch, Term falseBranch) {
			super(trueBranch.getSort(), condition, trueBranch, falseBranch);
		}

		@Override
		public String toString() {
			return "(" + getOperand(0) + " ? " + getOperand(1) + " : " + getOperand(2) + ")";
		}
	}

	/**
	 * Pairs the snapshots of two sub-assertions.
	 */
	public static final class Combine extends Application {
		public Combine(Term lhs, Term rhs) {
			super(Sort.SNAP, lhs, rhs);
		}

		@Override
		public String toString() {
			return prefix("combine");
		}
	}

	public static final class First extends Application {
		public First(Term snapshot) {
			super(Sort.SNAP, snapshot);
		}

		@Override
		public String toString() {
			return prefix("first");
		}
	}

	public static final class Second extends Application {
		public Second(Term snapshot) {
			super(Sort.SNAP, snapshot);
		}

		@Override
		public String toString() {
			return prefix("second");
		}
	}

	/**
	 * Views a snapshot as a value of some other sort.
	 */
	public static final class Wrap extends Application {
		public Wrap(Term snapshot, Sort sort) {
			super(sort, snapshot);
		}

		@Override
		public String toString() {
			return prefix("$" + getSort().name().toLowerCase());
		}
	}
}
