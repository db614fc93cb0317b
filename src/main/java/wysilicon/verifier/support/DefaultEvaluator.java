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

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;
import wysilicon.state.Terms;
import wysilicon.util.Rational;
import wysilicon.verifier.Decider;
import wysilicon.verifier.ErrorReason;
import wysilicon.verifier.Evaluator;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;

/**
 * Evaluates pure expressions into terms. Reading a field requires some
 * permission to it in the heap being evaluated against, and dividing requires
 * a divisor which is provably non-zero. Logical connectives evaluate all of
 * their operands.
 */
public class DefaultEvaluator implements Evaluator {
	private final Decider decider;

	public DefaultEvaluator(Decider decider) {
		this.decider = decider;
	}

	@Override
	public VerificationResult eval(SymbolicState state, Expr expr, VerificationError.Partial pve, Context context,
			TermContinuation Q) {
		if (expr instanceof Expr.Boolean) {
			return Q.apply(Terms.bool(((Expr.Boolean) expr).getValue()), context);
		} else if (expr instanceof Expr.Integer) {
			return Q.apply(Terms.num(((Expr.Integer) expr).getValue(), Term.Sort.INT), context);
		} else if (expr instanceof Expr.Null) {
			return Q.apply(Term.NULL, context);
		} else if (expr instanceof Expr.FullPerm) {
			return Q.apply(Terms.fullPerm(), context);
		} else if (expr instanceof Expr.NoPerm) {
			return Q.apply(Terms.noPerm(), context);
		} else if (expr instanceof Expr.VariableAccess) {
			return evalVariableAccess(state, (Expr.VariableAccess) expr, context, Q);
		} else if (expr instanceof Expr.FieldAccess) {
			return evalFieldAccess(state, (Expr.FieldAccess) expr, pve, context, Q);
		} else if (expr instanceof Expr.CurrentPerm) {
			return evalCurrentPerm(state, (Expr.CurrentPerm) expr, pve, context, Q);
		} else if (expr instanceof Expr.Negation) {
			return eval(state, ((Expr.Negation) expr).getOperand(), pve, context,
					(t, c1) -> Q.apply(Terms.minus(new Term.Num(Rational.ZERO, t.getSort()), t), c1));
		} else if (expr instanceof Expr.LogicalNot) {
			return eval(state, ((Expr.LogicalNot) expr).getOperand(), pve, context,
					(t, c1) -> Q.apply(Terms.not(t), c1));
		} else if (expr instanceof Expr.LogicalAnd) {
			return evals(state, ((Expr.LogicalAnd) expr).getOperands(), pve, context,
					(ts, c1) -> Q.apply(Terms.and(ts), c1));
		} else if (expr instanceof Expr.LogicalOr) {
			return evals(state, ((Expr.LogicalOr) expr).getOperands(), pve, context,
					(ts, c1) -> Q.apply(Terms.or(ts), c1));
		} else if (expr instanceof Expr.Implies) {
			return evalBinary(state, (Expr.Implies) expr, pve, context, Terms::implies, Q);
		} else if (expr instanceof Expr.Equals) {
			return evalBinary(state, (Expr.Equals) expr, pve, context, Terms::eq, Q);
		} else if (expr instanceof Expr.NotEquals) {
			return evalBinary(state, (Expr.NotEquals) expr, pve, context, Terms::neq, Q);
		} else if (expr instanceof Expr.LessThan) {
			return evalBinary(state, (Expr.LessThan) expr, pve, context, Terms::less, Q);
		} else if (expr instanceof Expr.LessThanOrEqual) {
			return evalBinary(state, (Expr.LessThanOrEqual) expr, pve, context, Terms::atMost, Q);
		} else if (expr instanceof Expr.GreaterThan) {
			return evalBinary(state, (Expr.GreaterThan) expr, pve, context, (l, r) -> Terms.less(r, l), Q);
		} else if (expr instanceof Expr.GreaterThanOrEqual) {
			return evalBinary(state, (Expr.GreaterThanOrEqual) expr, pve, context, (l, r) -> Terms.atMost(r, l), Q);
		} else if (expr instanceof Expr.Addition) {
			return evalBinary(state, (Expr.Addition) expr, pve, context, Terms::plus, Q);
		} else if (expr instanceof Expr.Subtraction) {
			return evalBinary(state, (Expr.Subtraction) expr, pve, context, Terms::minus, Q);
		} else if (expr instanceof Expr.Multiplication) {
			return evalBinary(state, (Expr.Multiplication) expr, pve, context, Terms::times, Q);
		} else if (expr instanceof Expr.Division) {
			return evalDivision(state, (Expr.Division) expr, pve, context, Q);
		} else if (expr instanceof Expr.FractionalPerm) {
			return evalDivision(state, (Expr.FractionalPerm) expr, pve, context, Q);
		} else if (expr instanceof Expr.Old) {
			return evalOld(state, (Expr.Old) expr, pve, context, Q);
		} else if (expr instanceof Expr.Resource || expr instanceof Expr.PredicateAccess) {
			throw new IllegalArgumentException("cannot evaluate resource (" + expr.getClass().getName() + ")");
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
		}
	}

	@Override
	public VerificationResult evals(SymbolicState state, List<? extends Expr> exprs, VerificationError.Partial pve,
			Context context, TermsContinuation Q) {
		return evals(state, exprs, 0, new ArrayList<>(), pve, context, Q);
	}

	private VerificationResult evals(SymbolicState state, List<? extends Expr> exprs, int index, List<Term> terms,
			VerificationError.Partial pve, Context context, TermsContinuation Q) {
		if (index == exprs.size()) {
			return Q.apply(terms, context);
		}
		return eval(state, exprs.get(index), pve, context, (t, c1) -> {
			ArrayList<Term> nterms = new ArrayList<>(terms);
			nterms.add(t);
			return evals(state, exprs, index + 1, nterms, pve, c1, Q);
		});
	}

	private VerificationResult evalVariableAccess(SymbolicState state, Expr.VariableAccess expr, Context context,
			TermContinuation Q) {
		Term t = state.getStore().get(expr.getVariable());
		if (t == null) {
			throw new IllegalStateException("unbound variable " + expr.getVariable());
		}
		return Q.apply(t, context);
	}

	private VerificationResult evalFieldAccess(SymbolicState state, Expr.FieldAccess expr,
			VerificationError.Partial pve, Context context, TermContinuation Q) {
		String field = expr.getField().getName();
		return eval(state, expr.getReceiver(), pve, context, (tRcvr, c1) -> {
			Chunk.Field ch = decider.getFieldChunk(state.getHeap(), tRcvr, field);
			if (ch != null && decider.check(Terms.isPositive(ch.getPermission()))) {
				return Q.apply(ch.getValue(), c1);
			}
			return VerificationResult.failure(pve.dueTo(ErrorReason.insufficientPermission(expr)));
		});
	}

	private VerificationResult evalCurrentPerm(SymbolicState state, Expr.CurrentPerm expr,
			VerificationError.Partial pve, Context context, TermContinuation Q) {
		Expr.FieldAccess location = expr.getLocation();
		return eval(state, location.getReceiver(), pve, context, (tRcvr, c1) -> {
			Chunk.Field ch = decider.getFieldChunk(state.getHeap(), tRcvr, location.getField().getName());
			return Q.apply(ch == null ? Terms.noPerm() : ch.getPermission(), c1);
		});
	}

	private VerificationResult evalDivision(SymbolicState state, Expr.BinaryOperator expr,
			VerificationError.Partial pve, Context context, TermContinuation Q) {
		return eval(state, expr.getLeftHandSide(), pve, context,
				(lhs, c1) -> eval(state, expr.getRightHandSide(), pve, c1, (rhs, c2) -> {
					Term zero = new Term.Num(Rational.ZERO, rhs.getSort());
					if (!decider.assertTerm(Terms.neq(rhs, zero))) {
						return VerificationResult.failure(pve.dueTo(ErrorReason.divisionByZero((Expr) expr)));
					}
					boolean exact = expr instanceof Expr.FractionalPerm || lhs.getSort() == Term.Sort.PERM;
					return Q.apply(exact ? Terms.fraction(lhs, rhs) : Terms.div(lhs, rhs), c2);
				}));
	}

	private VerificationResult evalOld(SymbolicState state, Expr.Old expr, VerificationError.Partial pve,
			Context context, TermContinuation Q) {
		String label = expr.getLabel();
		Heap heap;
		if (label == null) {
			heap = state.getOldHeap();
		} else if (label.equals(Expr.Old.LHS)) {
			heap = context.getLhsHeap();
			if (heap == null) {
				throw new IllegalStateException("no left-hand side heap available");
			}
		} else {
			throw new IllegalArgumentException("unknown label \"" + label + "\"");
		}
		return eval(state.withHeap(heap), expr.getOperand(), pve, context, Q);
	}

	private <T extends Expr & Expr.BinaryOperator> VerificationResult evalBinary(SymbolicState state, T expr,
			VerificationError.Partial pve, Context context, BinaryOperator<Term> constructor, TermContinuation Q) {
		return eval(state, expr.getLeftHandSide(), pve, context,
				(lhs, c1) -> eval(state, expr.getRightHandSide(), pve, c1,
						(rhs, c2) -> Q.apply(constructor.apply(lhs, rhs), c2)));
	}
}
