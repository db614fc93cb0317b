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

import java.util.List;
import java.util.function.Function;

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Snapshots;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;
import wysilicon.state.Terms;
import wysilicon.util.FreeVariables;
import wysilicon.verifier.Continuation;
import wysilicon.verifier.Decider;
import wysilicon.verifier.ErrorReason;
import wysilicon.verifier.Evaluator;
import wysilicon.verifier.HeapCompressor;
import wysilicon.verifier.Producer;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;

/**
 * <p>
 * Produces assertions by adding the resources they describe to the heap and
 * assuming the facts they state. The left operand of a conjunction takes its
 * values from the first component of the snapshot, the right from the second.
 * Hence, producing from the snapshot recorded when consuming the same
 * assertion restores the values it held.
 * </p>
 * <p>
 * New field chunks are merged with any existing chunk for the same location
 * through the heap compressor.
 * </p>
 */
public class DefaultProducer implements Producer {
	private final Decider decider;
	private final Evaluator evaluator;
	private final HeapCompressor heapCompressor;

	public DefaultProducer(Decider decider, Evaluator evaluator, HeapCompressor heapCompressor) {
		this.decider = decider;
		this.evaluator = evaluator;
		this.heapCompressor = heapCompressor;
	}

	@Override
	public VerificationResult produce(SymbolicState state, Snapshots snapshots, Term permission, Expr assertion,
			VerificationError.Partial pve, Context context, Continuation Q) {
		if (assertion instanceof Expr.LogicalAnd) {
			return produces(state, snapshots, permission, ((Expr.LogicalAnd) assertion).getOperands(), 0, e -> pve,
					context, Q);
		} else if (assertion instanceof Expr.Implies) {
			Expr.Implies e = (Expr.Implies) assertion;
			return evaluator.eval(state, e.getLeftHandSide(), pve, context,
					(tCond, c1) -> decider.branch(tCond,
							() -> produce(state, snapshots, permission, e.getRightHandSide(), pve, c1, Q),
							() -> Q.apply(state, c1)));
		} else if (assertion instanceof Expr.FieldAccessPredicate) {
			return produceField(state, snapshots, permission, (Expr.FieldAccessPredicate) assertion, pve, context, Q);
		} else if (assertion instanceof Expr.PredicateAccessPredicate) {
			return producePredicate(state, snapshots, permission, (Expr.PredicateAccessPredicate) assertion, pve,
					context, Q);
		} else if (assertion instanceof Expr.MagicWand) {
			Expr.MagicWand wand = (Expr.MagicWand) assertion;
			Chunk.MagicWand ch = new Chunk.MagicWand(wand, FreeVariables.bind(wand, state.getStore()), permission);
			return Q.apply(state.plus(ch), context);
		} else {
			return evaluator.eval(state, assertion, pve, context, (t, c1) -> {
				decider.assume(t);
				return Q.apply(state, c1);
			});
		}
	}

	@Override
	public VerificationResult produces(SymbolicState state, Snapshots snapshots, Term permission,
			List<? extends Expr> assertions, Function<Expr, VerificationError.Partial> pveFn, Context context,
			Continuation Q) {
		if (assertions.isEmpty()) {
			return Q.apply(state, context);
		}
		return produces(state, snapshots, permission, assertions, 0, pveFn, context, Q);
	}

	private VerificationResult produces(SymbolicState state, Snapshots snapshots, Term permission,
			List<? extends Expr> assertions, int index, Function<Expr, VerificationError.Partial> pveFn,
			Context context, Continuation Q) {
		Expr e = assertions.get(index);
		if (index == assertions.size() - 1) {
			return produce(state, snapshots, permission, e, pveFn.apply(e), context, Q);
		}
		return produce(state, snapshots.first(), permission, e, pveFn.apply(e), context,
				(s1, c1) -> produces(s1, snapshots.second(), permission, assertions, index + 1, pveFn, c1, Q));
	}

	private VerificationResult produceField(SymbolicState state, Snapshots snapshots, Term permission,
			Expr.FieldAccessPredicate assertion, VerificationError.Partial pve, Context context, Continuation Q) {
		Expr.FieldAccess location = assertion.getLocation();
		String field = location.getField().getName();
		Term.Sort sort = Terms.toSort(location.getField().getType());
		return evaluator.eval(state, location.getReceiver(), pve, context,
				(tRcvr, c1) -> evaluator.eval(state, assertion.getPermission(), pve, c1, (tPerm, c2) -> {
					if (!decider.assertTerm(Terms.isNonNegative(tPerm))) {
						return VerificationResult
								.failure(pve.dueTo(ErrorReason.negativePermission(assertion.getPermission())));
					}
					Term p = Terms.times(tPerm, permission);
					decider.assume(Terms.implies(Terms.isPositive(p), Terms.neq(tRcvr, Term.NULL)));
					Chunk.Field ch = new Chunk.Field(tRcvr, field, snapshots.next(sort), p);
					return Q.apply(state.withHeap(heapCompressor.merge(state.getHeap(), ch)), c2);
				}));
	}

	private VerificationResult producePredicate(SymbolicState state, Snapshots snapshots, Term permission,
			Expr.PredicateAccessPredicate assertion, VerificationError.Partial pve, Context context, Continuation Q) {
		Expr.PredicateAccess location = assertion.getLocation();
		return evaluator.evals(state, location.getArguments(), pve, context,
				(tArgs, c1) -> evaluator.eval(state, assertion.getPermission(), pve, c1, (tPerm, c2) -> {
					if (!decider.assertTerm(Terms.isNonNegative(tPerm))) {
						return VerificationResult
								.failure(pve.dueTo(ErrorReason.negativePermission(assertion.getPermission())));
					}
					Term p = Terms.times(tPerm, permission);
					Chunk.Predicate ch = new Chunk.Predicate(location.getName(), tArgs, snapshots.next(Term.Sort.SNAP),
							p);
					return Q.apply(state.withHeap(heapCompressor.merge(state.getHeap(), ch)), c2);
				}));
	}
}
