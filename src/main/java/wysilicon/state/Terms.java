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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;

import wysilicon.core.SilFile;
import wysilicon.state.Term.Sort;
import wysilicon.util.Rational;

/**
 * Simplifying constructors for terms. Simplification here is purely local
 * (constant folding, flattening and identities) and never consults the path
 * conditions.
 */
public class Terms {

	public static Term.Num num(long value, Sort sort) {
		return new Term.Num(Rational.valueOf(value), sort);
	}

	public static Term.Num num(BigInteger value, Sort sort) {
		return new Term.Num(Rational.valueOf(value), sort);
	}

	public static Term.Num fullPerm() {
		return num(1, Sort.PERM);
	}

	public static Term.Num noPerm() {
		return num(0, Sort.PERM);
	}

	public static Term bool(boolean b) {
		return b ? Term.TRUE : Term.FALSE;
	}

	/**
	 * Determine the sort used to represent values of a given program type.
	 *
	 * @param type
	 * @return
	 */
	public static Sort toSort(SilFile.Type type) {
		if (type instanceof SilFile.Type.Bool) {
			return Sort.BOOL;
		} else if (type instanceof SilFile.Type.Int) {
			return Sort.INT;
		} else if (type instanceof SilFile.Type.Ref) {
			return Sort.REF;
		} else if (type instanceof SilFile.Type.Perm) {
			return Sort.PERM;
		} else if (type instanceof SilFile.Type.Wand) {
			return Sort.WAND;
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type.getClass().getName() + ")");
		}
	}

	// =========================================================================
	// Arithmetic
	// =========================================================================

	public static Term plus(Term lhs, Term rhs) {
		if (lhs instanceof Term.Num && rhs instanceof Term.Num) {
			return new Term.Num(value(lhs).add(value(rhs)), lhs.getSort());
		} else if (isZero(lhs)) {
			return rhs;
		} else if (isZero(rhs)) {
			return lhs;
		}
		return new Term.Plus(lhs, rhs);
	}

	public static Term minus(Term lhs, Term rhs) {
		if (lhs instanceof Term.Num && rhs instanceof Term.Num) {
			return new Term.Num(value(lhs).subtract(value(rhs)), lhs.getSort());
		} else if (isZero(rhs)) {
			return lhs;
		} else if (lhs.equals(rhs)) {
			return new Term.Num(Rational.ZERO, lhs.getSort());
		}
		return new Term.Minus(lhs, rhs);
	}

	public static Term times(Term lhs, Term rhs) {
		Sort sort = lhs.getSort() == Sort.PERM || rhs.getSort() == Sort.PERM ? Sort.PERM : lhs.getSort();
		if (lhs instanceof Term.Num && rhs instanceof Term.Num) {
			return new Term.Num(value(lhs).multiply(value(rhs)), sort);
		} else if (isOne(lhs) && rhs.getSort() == sort) {
			return rhs;
		} else if (isOne(rhs) && lhs.getSort() == sort) {
			return lhs;
		} else if (isZero(lhs) || isZero(rhs)) {
			return new Term.Num(Rational.ZERO, sort);
		}
		return new Term.Times(lhs, rhs);
	}

	/**
	 * Integer division, rounding towards negative infinity when both operands are
	 * known.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Term div(Term lhs, Term rhs) {
		if (lhs instanceof Term.Num && rhs instanceof Term.Num && value(rhs).signum() != 0) {
			BigInteger n = value(lhs).getNumerator();
			BigInteger d = value(rhs).getNumerator();
			BigInteger[] qr = n.divideAndRemainder(d);
			BigInteger q = qr[0];
			if (qr[1].signum() != 0 && (n.signum() < 0) != (d.signum() < 0)) {
				q = q.subtract(BigInteger.ONE);
			}
			return num(q, Sort.INT);
		} else if (isOne(rhs)) {
			return lhs;
		}
		return new Term.Div(lhs, rhs, Sort.INT);
	}

	/**
	 * Construct the permission amount <code>numerator/denominator</code>.
	 *
	 * @param numerator
	 * @param denominator
	 * @return
	 */
	public static Term fraction(Term numerator, Term denominator) {
		if (numerator instanceof Term.Num && denominator instanceof Term.Num && value(denominator).signum() != 0) {
			return new Term.Num(value(numerator).divide(value(denominator)), Sort.PERM);
		}
		return new Term.Div(numerator, denominator, Sort.PERM);
	}

	// =========================================================================
	// Relations
	// =========================================================================

	public static Term eq(Term lhs, Term rhs) {
		if (lhs.equals(rhs)) {
			return Term.TRUE;
		} else if (isLiteral(lhs) && isLiteral(rhs)) {
			if (lhs instanceof Term.Num && rhs instanceof Term.Num) {
				return bool(value(lhs).equals(value(rhs)));
			}
			return Term.FALSE;
		}
		return new Term.Eq(lhs, rhs);
	}

	public static Term neq(Term lhs, Term rhs) {
		return not(eq(lhs, rhs));
	}

	public static Term less(Term lhs, Term rhs) {
		if (lhs instanceof Term.Num && rhs instanceof Term.Num) {
			return bool(value(lhs).compareTo(value(rhs)) < 0);
		} else if (lhs.equals(rhs)) {
			return Term.FALSE;
		}
		return new Term.Less(lhs, rhs);
	}

	public static Term atMost(Term lhs, Term rhs) {
		if (lhs instanceof Term.Num && rhs instanceof Term.Num) {
			return bool(value(lhs).compareTo(value(rhs)) <= 0);
		} else if (lhs.equals(rhs)) {
			return Term.TRUE;
		}
		return new Term.AtMost(lhs, rhs);
	}

	public static Term isPositive(Term perm) {
		return less(noPerm(), perm);
	}

	public static Term isNonNegative(Term perm) {
		return atMost(noPerm(), perm);
	}

	// =========================================================================
	// Logical connectives
	// =========================================================================

	public static Term not(Term t) {
		if (t == Term.TRUE) {
			return Term.FALSE;
		} else if (t == Term.FALSE) {
			return Term.TRUE;
		} else if (t instanceof Term.Not) {
			return ((Term.Not) t).getOperand(0);
		}
		return new Term.Not(t);
	}

	public static Term and(Term... operands) {
		return and(Arrays.asList(operands));
	}

	public static Term and(Collection<? extends Term> operands) {
		ArrayList<Term> noperands = new ArrayList<>();
		for (Term t : operands) {
			if (t == Term.FALSE) {
				return Term.FALSE;
			} else if (t instanceof Term.And) {
				noperands.addAll(((Term.And) t).getOperands());
			} else if (t != Term.TRUE && !noperands.contains(t)) {
				noperands.add(t);
			}
		}
		switch (noperands.size()) {
		case 0:
			return Term.TRUE;
		case 1:
			return noperands.get(0);
		default:
			return new Term.And(noperands);
		}
	}

	public static Term or(Term... operands) {
		return or(Arrays.asList(operands));
	}

	public static Term or(Collection<? extends Term> operands) {
		ArrayList<Term> noperands = new ArrayList<>();
		for (Term t : operands) {
			if (t == Term.TRUE) {
				return Term.TRUE;
			} else if (t instanceof Term.Or) {
				noperands.addAll(((Term.Or) t).getOperands());
			} else if (t != Term.FALSE && !noperands.contains(t)) {
				noperands.add(t);
			}
		}
		switch (noperands.size()) {
		case 0:
			return Term.FALSE;
		case 1:
			return noperands.get(0);
		default:
			return new Term.Or(noperands);
		}
	}

	public static Term implies(Term lhs, Term rhs) {
		if (lhs == Term.TRUE) {
			return rhs;
		} else if (lhs == Term.FALSE || rhs == Term.TRUE) {
			return Term.TRUE;
		} else if (rhs == Term.FALSE) {
			return not(lhs);
		}
		return new Term.Implies(lhs, rhs);
	}

	public static Term ite(Term condition, Term trueBranch, Term falseBranch) {
		if (condition == Term.TRUE || trueBranch.equals(falseBranch)) {
			return trueBranch;
		} else if (condition == Term.FALSE) {
			return falseBranch;
		}
		return new Term.Ite(condition, trueBranch, falseBranch);
	}

	// =========================================================================
	// Snapshots
	// =========================================================================

	public static Term combine(Term lhs, Term rhs) {
		return new Term.Combine(lhs, rhs);
	}

	public static Term first(Term snapshot) {
		if (snapshot instanceof Term.Combine) {
			return ((Term.Combine) snapshot).getOperand(0);
		}
		return new Term.First(snapshot);
	}

	public static Term second(Term snapshot) {
		if (snapshot instanceof Term.Combine) {
			return ((Term.Combine) snapshot).getOperand(1);
		}
		return new Term.Second(snapshot);
	}

	/**
	 * View a term as one of the given sort, which is the identity when the sorts
	 * already agree.
	 *
	 * @param term
	 * @param sort
	 * @return
	 */
	public static Term convert(Term term, Sort sort) {
		if (term.getSort() == sort) {
			return term;
		} else if (term instanceof Term.Wrap && ((Term.Wrap) term).getOperand(0).getSort() == sort) {
			return ((Term.Wrap) term).getOperand(0);
		}
		return new Term.Wrap(term, sort);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	public static boolean isLiteral(Term t) {
		return t instanceof Term.Num || t instanceof Term.Bool || t instanceof Term.Null;
	}

	public static boolean isZero(Term t) {
		return t instanceof Term.Num && ((Term.Num) t).getValue().signum() == 0;
	}

	public static boolean isOne(Term t) {
		return t instanceof Term.Num && ((Term.Num) t).getValue().equals(Rational.ONE);
	}

	private static Rational value(Term t) {
		return ((Term.Num) t).getValue();
	}
}
