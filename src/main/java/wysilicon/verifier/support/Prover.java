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
package wysilicon.verifier.support;

import java.util.Collection;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.microsoft.z3.ArithSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.UninterpretedSort;

import wysilicon.state.Chunk;
import wysilicon.state.Term;
import wysilicon.util.Rational;

/**
 * <p>
 * Answers queries over symbolic terms using the Z3 solver. Terms are
 * translated as follows:
 * </p>
 * <ul>
 * <li>Integers and booleans map to the corresponding Z3 sorts, whilst
 * permission amounts are reals.</li>
 * <li>References, snapshots and wands are uninterpreted sorts. The
 * <code>null</code> reference and the unit snapshot are constants of their
 * sort.</li>
 * <li>Snapshot pairing and projection, along with conversions between sorts,
 * are uninterpreted functions.</li>
 * </ul>
 * <p>
 * Facts are asserted incrementally and scoped with {@link #push()} and
 * {@link #pop()}. A query which times out, or which Z3 otherwise cannot
 * decide, is answered negatively.
 * </p>
 */
@SuppressWarnings({ "unchecked", "rawtypes" })
public class Prover implements AutoCloseable {
	private static final Logger logger = LogManager.getLogger(Prover.class);

	private final Context context;
	private final Solver solver;
	private final UninterpretedSort refSort;
	private final UninterpretedSort snapSort;
	private final UninterpretedSort wandSort;
	private final Expr nullRef;
	private final Expr unit;
	private final FuncDecl combine;
	private final FuncDecl first;
	private final FuncDecl second;
	private final HashMap<String, FuncDecl> conversions = new HashMap<>();
	private final IdentityHashMap<Chunk.MagicWand, Expr> wands = new IdentityHashMap<>();

	/**
	 * Construct a prover whose queries give up after a given number of
	 * milliseconds. A timeout of zero means queries are never abandoned.
	 *
	 * @param timeout
	 */
	public Prover(int timeout) {
		this.context = new Context();
		this.solver = context.mkSolver();
		if (timeout > 0) {
			Params params = context.mkParams();
			params.add("timeout", timeout);
			solver.setParameters(params);
		}
		this.refSort = context.mkUninterpretedSort("$Ref");
		this.snapSort = context.mkUninterpretedSort("$Snap");
		this.wandSort = context.mkUninterpretedSort("$Wand");
		this.nullRef = context.mkConst("$null", refSort);
		this.unit = context.mkConst("$unit", snapSort);
		this.combine = context.mkFuncDecl("$combine", new Sort[] { snapSort, snapSort }, snapSort);
		this.first = context.mkFuncDecl("$first", snapSort, snapSort);
		this.second = context.mkFuncDecl("$second", snapSort, snapSort);
	}

	public void push() {
		solver.push();
	}

	public void pop() {
		solver.pop();
	}

	public void assume(Term fact) {
		solver.add(bool(fact));
	}

	/**
	 * Check whether a goal follows from the facts assumed so far.
	 *
	 * @param goal
	 * @return
	 */
	public boolean entails(Term goal) {
		if (goal == Term.TRUE) {
			return true;
		}
		solver.push();
		try {
			solver.add(context.mkNot(bool(goal)));
			return check() == Status.UNSATISFIABLE;
		} finally {
			solver.pop();
		}
	}

	/**
	 * Check whether the facts assumed so far are contradictory.
	 *
	 * @return
	 */
	public boolean isUnsatisfiable() {
		return check() == Status.UNSATISFIABLE;
	}

	/**
	 * Check whether a goal follows from some facts, in addition to those
	 * assumed so far.
	 *
	 * @param facts
	 * @param goal
	 * @return
	 */
	public boolean entails(Collection<? extends Term> facts, Term goal) {
		solver.push();
		try {
			for (Term f : facts) {
				assume(f);
			}
			return entails(goal);
		} finally {
			solver.pop();
		}
	}

	/**
	 * Check whether some facts are contradictory, in addition to those assumed
	 * so far.
	 *
	 * @param facts
	 * @return
	 */
	public boolean isUnsatisfiable(Collection<? extends Term> facts) {
		solver.push();
		try {
			for (Term f : facts) {
				assume(f);
			}
			return isUnsatisfiable();
		} finally {
			solver.pop();
		}
	}

	public void logComment(String comment) {
		logger.trace("; {}", comment);
	}

	@Override
	public void close() {
		context.close();
	}

	private Status check() {
		Status status = solver.check();
		if (status == Status.UNKNOWN) {
			logger.debug("solver returned unknown ({})", solver.getReasonUnknown());
		}
		return status;
	}

	// =========================================================================
	// Translation
	// =========================================================================

	private BoolExpr bool(Term term) {
		return (BoolExpr) translate(term);
	}

	/**
	 * Translate a numeric term, promoting it to a real where necessary.
	 *
	 * @param term
	 * @param real
	 * @return
	 */
	private Expr<? extends ArithSort> arith(Term term, boolean real) {
		Expr e = translate(term);
		if (real && term.getSort() == Term.Sort.INT) {
			return context.mkInt2Real((Expr<IntSort>) e);
		}
		return e;
	}

	private Expr translate(Term term) {
		if (term instanceof Term.Bool) {
			return context.mkBool(((Term.Bool) term).getValue());
		} else if (term instanceof Term.Num) {
			return translate((Term.Num) term);
		} else if (term instanceof Term.Var) {
			Term.Var v = (Term.Var) term;
			return context.mkConst(v.getName(), toSort(v.getSort()));
		} else if (term instanceof Term.Null) {
			return nullRef;
		} else if (term instanceof Term.Unit) {
			return unit;
		} else if (term instanceof Term.WandChunk) {
			return translate((Term.WandChunk) term);
		} else if (term instanceof Term.Not) {
			return context.mkNot(bool(((Term.Not) term).getOperand(0)));
		} else if (term instanceof Term.And) {
			return context.mkAnd(bools(((Term.And) term).getOperands()));
		} else if (term instanceof Term.Or) {
			return context.mkOr(bools(((Term.Or) term).getOperands()));
		} else if (term instanceof Term.Implies) {
			Term.Implies t = (Term.Implies) term;
			return context.mkImplies(bool(t.getOperand(0)), bool(t.getOperand(1)));
		} else if (term instanceof Term.Eq) {
			return translate((Term.Eq) term);
		} else if (term instanceof Term.Less) {
			Term.Less t = (Term.Less) term;
			boolean real = isReal(t);
			return context.mkLt(arith(t.getOperand(0), real), arith(t.getOperand(1), real));
		} else if (term instanceof Term.AtMost) {
			Term.AtMost t = (Term.AtMost) term;
			boolean real = isReal(t);
			return context.mkLe(arith(t.getOperand(0), real), arith(t.getOperand(1), real));
		} else if (term instanceof Term.Plus) {
			Term.Plus t = (Term.Plus) term;
			boolean real = isReal(t);
			return context.mkAdd(arith(t.getOperand(0), real), arith(t.getOperand(1), real));
		} else if (term instanceof Term.Minus) {
			Term.Minus t = (Term.Minus) term;
			boolean real = isReal(t);
			return context.mkSub(arith(t.getOperand(0), real), arith(t.getOperand(1), real));
		} else if (term instanceof Term.Times) {
			Term.Times t = (Term.Times) term;
			boolean real = isReal(t);
			return context.mkMul(arith(t.getOperand(0), real), arith(t.getOperand(1), real));
		} else if (term instanceof Term.Div) {
			return translate((Term.Div) term);
		} else if (term instanceof Term.Ite) {
			Term.Ite t = (Term.Ite) term;
			if (t.getSort() == Term.Sort.PERM) {
				return context.mkITE(bool(t.getOperand(0)), arith(t.getOperand(1), true),
						arith(t.getOperand(2), true));
			}
			return context.mkITE(bool(t.getOperand(0)), translate(t.getOperand(1)), translate(t.getOperand(2)));
		} else if (term instanceof Term.Combine) {
			Term.Combine t = (Term.Combine) term;
			return context.mkApp(combine, translate(t.getOperand(0)), translate(t.getOperand(1)));
		} else if (term instanceof Term.First) {
			return context.mkApp(first, translate(((Term.First) term).getOperand(0)));
		} else if (term instanceof Term.Second) {
			return context.mkApp(second, translate(((Term.Second) term).getOperand(0)));
		} else if (term instanceof Term.Wrap) {
			Term.Wrap t = (Term.Wrap) term;
			Term operand = t.getOperand(0);
			return context.mkApp(conversion(operand.getSort(), t.getSort()), translate(operand));
		}
		throw new IllegalArgumentException("unknown term encountered (" + term.getClass().getSimpleName() + ")");
	}

	private Expr translate(Term.Num term) {
		Rational value = term.getValue();
		Rational magnitude = value.abs();
		Expr e;
		if (term.getSort() == Term.Sort.INT) {
			e = context.mkInt(magnitude.getNumerator().toString());
		} else {
			e = context.mkNumeral(magnitude.getNumerator() + "/" + magnitude.getDenominator(), context.getRealSort());
		}
		return value.signum() < 0 ? context.mkUnaryMinus(e) : e;
	}

	private Expr translate(Term.WandChunk term) {
		Expr e = wands.get(term.getChunk());
		if (e == null) {
			e = context.mkConst("$wand@" + wands.size(), wandSort);
			wands.put(term.getChunk(), e);
		}
		return e;
	}

	private Expr translate(Term.Eq term) {
		Term lhs = term.getOperand(0);
		Term rhs = term.getOperand(1);
		if (lhs.getSort().isNumeric() && rhs.getSort().isNumeric()) {
			boolean real = isReal(term);
			return context.mkEq((Expr) arith(lhs, real), (Expr) arith(rhs, real));
		}
		return context.mkEq(translate(lhs), translate(rhs));
	}

	/**
	 * Integer division rounds towards negative infinity, whereas Z3 rounds so
	 * that the remainder is non-negative. The two agree for positive divisors.
	 *
	 * @param term
	 * @return
	 */
	private Expr translate(Term.Div term) {
		if (term.getSort() == Term.Sort.PERM) {
			return context.mkDiv(arith(term.getOperand(0), true), arith(term.getOperand(1), true));
		}
		Expr n = translate(term.getOperand(0));
		Expr d = translate(term.getOperand(1));
		BoolExpr positive = context.mkLe(context.mkInt(0), d);
		return context.mkITE(positive, context.mkDiv(n, d),
				context.mkDiv(context.mkUnaryMinus(n), context.mkUnaryMinus(d)));
	}

	private BoolExpr[] bools(List<Term> terms) {
		BoolExpr[] es = new BoolExpr[terms.size()];
		for (int i = 0; i != es.length; ++i) {
			es[i] = bool(terms.get(i));
		}
		return es;
	}

	private FuncDecl conversion(Term.Sort from, Term.Sort to) {
		String name = "$" + from.name().toLowerCase() + "2" + to.name().toLowerCase();
		FuncDecl f = conversions.get(name);
		if (f == null) {
			f = context.mkFuncDecl(name, toSort(from), toSort(to));
			conversions.put(name, f);
		}
		return f;
	}

	private Sort toSort(Term.Sort sort) {
		switch (sort) {
		case INT:
			return context.getIntSort();
		case BOOL:
			return context.getBoolSort();
		case PERM:
			return context.getRealSort();
		case REF:
			return refSort;
		case SNAP:
			return snapSort;
		case WAND:
			return wandSort;
		default:
			throw new IllegalArgumentException("unknown sort encountered (" + sort + ")");
		}
	}

	private static boolean isReal(Term.Application term) {
		if (term.getSort() == Term.Sort.PERM) {
			return true;
		}
		for (Term t : term.getOperands()) {
			if (t.getSort() == Term.Sort.PERM) {
				return true;
			}
		}
		return false;
	}
}
