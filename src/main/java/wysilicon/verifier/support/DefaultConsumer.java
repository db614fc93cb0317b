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

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;
import wysilicon.state.Terms;
import wysilicon.util.FreeVariables;
import wysilicon.util.Util;
import wysilicon.verifier.Consumer;
import wysilicon.verifier.Decider;
import wysilicon.verifier.ErrorReason;
import wysilicon.verifier.Evaluator;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;

/**
 * <p>
 * Consumes assertions by removing the resources they describe from a heap and
 * checking the facts they state. Every expression of an assertion is evaluated
 * in the state <i>before</i> consumption began, such that an assertion like
 * <code>acc(x.f) &amp;&amp; x.f == 1</code> can be consumed even though the
 * permission to <code>x.f</code> is gone by the time its right-hand side is
 * considered.
 * </p>
 * <p>
 * A permission amount which is constrainable (see
 * {@link Context#isConstrainable(Term)}) is always consumable from a chunk
 * holding some permission, by assuming that it is strictly less than what the
 * chunk holds.
 * </p>
 */
public class DefaultConsumer implements Consumer {
	private final Decider decider;
	private final Evaluator evaluator;

	public DefaultConsumer(Decider decider, Evaluator evaluator) {
		this.decider = decider;
		this.evaluator = evaluator;
	}

	/**
	 * Continuation used internally, which receives only the remainder of the
	 * heap being consumed from.
	 */
	@FunctionalInterface
	private interface HeapContinuation {
		public VerificationResult apply(Heap heap, Term snapshot, List<Chunk> chunks, Context context);
	}

	@Override
	public VerificationResult consume(SymbolicState state, Term permission, Expr assertion,
			VerificationError.Partial pve, Context context, Continuation Q) {
		return consume(state, state.getHeap(), permission, assertion, pve, context, Q);
	}

	@Override
	public VerificationResult consume(SymbolicState state, Heap heap, Term permission, Expr assertion,
			VerificationError.Partial pve, Context context, Continuation Q) {
		return consumeFrom(state, heap, permission, assertion, pve, context,
				(h1, snap, chunks, c1) -> Q.apply(state.withHeap(h1), snap, chunks, c1));
	}

	@Override
	public VerificationResult consumes(SymbolicState state, Term permission, List<? extends Expr> assertions,
			Function<Expr, VerificationError.Partial> pveFn, Context context, Continuation Q) {
		return consumes(state, state.getHeap(), permission, assertions, 0, pveFn, context,
				(h1, snap, chunks, c1) -> Q.apply(state.withHeap(h1), snap, chunks, c1));
	}

	private VerificationResult consumes(SymbolicState state, Heap heap, Term permission,
			List<? extends Expr> assertions, int index, Function<Expr, VerificationError.Partial> pveFn,
			Context context, HeapContinuation Q) {
		if (index == assertions.size()) {
			return Q.apply(heap, Term.UNIT, Collections.emptyList(), context);
		}
		Expr e = assertions.get(index);
		if (index == assertions.size() - 1) {
			return consumeFrom(state, heap, permission, e, pveFn.apply(e), context, Q);
		}
		return consumeFrom(state, heap, permission, e, pveFn.apply(e), context,
				(h1, s1, chs1, c1) -> consumes(state, h1, permission, assertions, index + 1, pveFn, c1,
						(h2, s2, chs2, c2) -> Q.apply(h2, Terms.combine(s1, s2), Util.append(chs1, chs2), c2)));
	}

	private VerificationResult consumeFrom(SymbolicState state, Heap heap, Term permission, Expr assertion,
			VerificationError.Partial pve, Context context, HeapContinuation Q) {
		if (assertion instanceof Expr.LogicalAnd) {
			List<Expr> operands = ((Expr.LogicalAnd) assertion).getOperands();
			return consumes(state, heap, permission, operands, 0, e -> pve, context, Q);
		} else if (assertion instanceof Expr.Implies) {
			Expr.Implies e = (Expr.Implies) assertion;
			return evaluator.eval(state, e.getLeftHandSide(), pve, context,
					(tCond, c1) -> decider.branch(tCond,
							() -> consumeFrom(state, heap, permission, e.getRightHandSide(), pve, c1, Q),
							() -> Q.apply(heap, Term.UNIT, Collections.emptyList(), c1)));
		} else if (assertion instanceof Expr.FieldAccessPredicate) {
			return consumeField(state, heap, permission, (Expr.FieldAccessPredicate) assertion, pve, context, Q);
		} else if (assertion instanceof Expr.PredicateAccessPredicate) {
			return consumePredicate(state, heap, permission, (Expr.PredicateAccessPredicate) assertion, pve, context,
					Q);
		} else if (assertion instanceof Expr.MagicWand) {
			Expr.MagicWand wand = (Expr.MagicWand) assertion;
			Chunk.MagicWand identity = new Chunk.MagicWand(wand, FreeVariables.bind(wand, state.getStore()),
					permission);
			Chunk.MagicWand ch = decider.getChunk(heap, identity);
			if (ch == null) {
				return VerificationResult.failure(pve.dueTo(ErrorReason.magicWandChunkNotFound(wand)));
			}
			return Q.apply(heap.minus(ch), Term.UNIT, Collections.singletonList(ch), context);
		} else {
			return evaluator.eval(state, assertion, pve, context, (t, c1) -> {
				if (decider.assertTerm(t)) {
					return Q.apply(heap, Term.UNIT, Collections.emptyList(), c1);
				}
				return VerificationResult.failure(pve.dueTo(ErrorReason.assertionFalse(assertion)));
			});
		}
	}

	private VerificationResult consumeField(SymbolicState state, Heap heap, Term permission,
			Expr.FieldAccessPredicate assertion, VerificationError.Partial pve, Context context, HeapContinuation Q) {
		Expr.FieldAccess location = assertion.getLocation();
		String field = location.getField().getName();
		return evaluator.eval(state, location.getReceiver(), pve, context,
				(tRcvr, c1) -> evaluator.eval(state, assertion.getPermission(), pve, c1, (tPerm, c2) -> {
					if (!decider.assertTerm(Terms.isNonNegative(tPerm))) {
						return VerificationResult
								.failure(pve.dueTo(ErrorReason.negativePermission(assertion.getPermission())));
					}
					Term p = Terms.times(tPerm, permission);
					Chunk.Field ch = decider.getFieldChunk(heap, tRcvr, field);
					if (ch == null) {
						if (decider.check(Terms.eq(p, Terms.noPerm()))) {
							Term value = decider.fresh(field, Terms.toSort(location.getField().getType()));
							return Q.apply(heap, value, Collections.emptyList(), c2);
						}
						return VerificationResult.failure(pve.dueTo(ErrorReason.insufficientPermission(location)));
					} else if (!hasEnough(p, tPerm, ch, c2)) {
						return VerificationResult.failure(pve.dueTo(ErrorReason.insufficientPermission(location)));
					}
					return Q.apply(take(heap, ch, p), ch.getValue(), Collections.singletonList(ch), c2);
				}));
	}

	private VerificationResult consumePredicate(SymbolicState state, Heap heap, Term permission,
			Expr.PredicateAccessPredicate assertion, VerificationError.Partial pve, Context context,
			HeapContinuation Q) {
		Expr.PredicateAccess location = assertion.getLocation();
		return evaluator.evals(state, location.getArguments(), pve, context,
				(tArgs, c1) -> evaluator.eval(state, assertion.getPermission(), pve, c1, (tPerm, c2) -> {
					if (!decider.assertTerm(Terms.isNonNegative(tPerm))) {
						return VerificationResult
								.failure(pve.dueTo(ErrorReason.negativePermission(assertion.getPermission())));
					}
					Term p = Terms.times(tPerm, permission);
					Chunk.Predicate ch = decider.getPredicateChunk(heap, location.getName(), tArgs);
					if (ch == null || !hasEnough(p, tPerm, ch, c2)) {
						return VerificationResult.failure(pve.dueTo(ErrorReason.insufficientPermission(location)));
					}
					return Q.apply(take(heap, ch, p), ch.getSnapshot(), Collections.singletonList(ch), c2);
				}));
	}

	/**
	 * Check that a chunk holds at least a given amount of permission. A
	 * constrainable amount is instead constrained to fit.
	 *
	 * @param p
	 * @param amount  The amount as written, before scaling.
	 * @param ch
	 * @param context
	 * @return
	 */
	private boolean hasEnough(Term p, Term amount, Chunk ch, Context context) {
		if (decider.check(Terms.atMost(p, ch.getPermission()))) {
			return true;
		} else if ((context.isConstrainable(amount) || context.isConstrainable(p))
				&& decider.check(Terms.isPositive(ch.getPermission()))) {
			decider.assume(Terms.less(p, ch.getPermission()));
			return true;
		}
		return false;
	}

	/**
	 * Remove a given amount of permission from a chunk, dropping the chunk
	 * altogether when nothing remains.
	 *
	 * @param heap
	 * @param ch
	 * @param p
	 * @return
	 */
	private Heap take(Heap heap, Chunk ch, Term p) {
		Term remainder = Terms.minus(ch.getPermission(), p);
		if (decider.check(Terms.eq(remainder, Terms.noPerm()))) {
			return heap.minus(ch);
		}
		return heap.replace(ch, ch.withPermission(remainder));
	}
}
