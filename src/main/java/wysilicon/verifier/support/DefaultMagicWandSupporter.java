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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.Snapshots;
import wysilicon.state.SymbolicState;
import wysilicon.state.Terms;
import wysilicon.util.FreeVariables;
import wysilicon.util.Util;
import wysilicon.verifier.Consumer;
import wysilicon.verifier.Decider;
import wysilicon.verifier.MagicWandSupporter;
import wysilicon.verifier.Producer;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;

/**
 * <p>
 * Packages magic wands. The left-hand side of the wand is produced into an
 * otherwise empty heap, after which each conjunct of the right-hand side is
 * consumed. A conjunct is taken from the left-hand side where that succeeds,
 * otherwise from the heap the wand draws on. Everything learned whilst doing
 * this is discarded afterwards, since it holds only under the hypothesis of
 * the left-hand side.
 * </p>
 * <p>
 * When the left-hand side branches, the right-hand side must be consumable
 * along every branch and the continuation is run once per branch.
 * </p>
 */
public class DefaultMagicWandSupporter implements MagicWandSupporter {
	private static final Logger logger = LogManager.getLogger(DefaultMagicWandSupporter.class);

	private final Decider decider;
	private final Producer producer;
	private final Consumer consumer;

	public DefaultMagicWandSupporter(Decider decider, Producer producer, Consumer consumer) {
		this.decider = decider;
		this.producer = producer;
		this.consumer = consumer;
	}

	@Override
	public VerificationResult createChunk(SymbolicState state, Expr.MagicWand wand, VerificationError.Partial pve,
			Context context, ChunkContinuation Q) {
		return Q.apply(new Chunk.MagicWand(wand, FreeVariables.bind(wand, state.getStore()), Terms.fullPerm()),
				context);
	}

	@Override
	public VerificationResult packageWand(SymbolicState state, Expr.MagicWand wand, VerificationError.Partial pve,
			Context context, ChunkContinuation Q) {
		List<Heap> reserveHeaps = context.getReserveHeaps();
		if (reserveHeaps.size() < 2) {
			throw new IllegalStateException("expected at least 2 reserve heaps, but found " + reserveHeaps.size());
		}
		Heap outer = reserveHeaps.get(reserveHeaps.size() - 1);
		Chunk.MagicWand ch = new Chunk.MagicWand(wand, FreeVariables.bind(wand, state.getStore()),
				Terms.fullPerm());
		ArrayList<Outcome> outcomes = new ArrayList<>();
		VerificationResult r = decider.inScope(() -> {
			SymbolicState s0 = state.withHeap(Heap.EMPTY);
			Snapshots snapshots = Snapshots.fresh(sort -> decider.fresh(sort));
			return producer.produce(s0, snapshots, Terms.fullPerm(), wand.getLeftHandSide(), pve, context,
					(s1, c1) -> {
						Heap lhs = s1.getHeap();
						List<Expr> rhs = Util.conjuncts(wand.getRightHandSide());
						return consumeAll(state, lhs, outer, rhs, 0, pve, c1.withLhsHeap(lhs),
								new Outcome(lhs.values(), Heap.EMPTY, lhs, outer, Collections.emptyList(),
										Collections.emptyList()),
								outcomes);
					});
		});
		if (r.isFatal()) {
			return r;
		} else if (outcomes.isEmpty()) {
			// The left-hand side is infeasible, so nothing is used.
			logger.debug("left-hand side of {} infeasible", wand);
			return Q.apply(ch, context.withReserveHeaps(Arrays.asList(Heap.EMPTY, Heap.EMPTY, outer)));
		}
		VerificationResult result = VerificationResult.SUCCESS;
		for (Outcome o : outcomes) {
			Context c = context.withReserveHeaps(Arrays.asList(o.used, o.lhsRemainder, o.outerRemainder))
					.withProducedChunks(o.produced)
					.withConsumedChunks(Arrays.asList(o.fromLhs, o.fromOuter))
					.withLhsHeap(null);
			result = result.and(() -> Q.apply(ch, c));
		}
		return result;
	}

	/**
	 * Consume the remaining conjuncts of the right-hand side of a wand. Every
	 * conjunct is evaluated with the left-hand side and the outer heap both
	 * available.
	 */
	private VerificationResult consumeAll(SymbolicState state, Heap lhs, Heap outer, List<Expr> conjuncts, int index,
			VerificationError.Partial pve, Context context, Outcome outcome, List<Outcome> outcomes) {
		if (index == conjuncts.size()) {
			outcomes.add(outcome);
			return VerificationResult.SUCCESS;
		}
		Expr e = conjuncts.get(index);
		SymbolicState s = state.withHeap(lhs.plus(outer));
		boolean fromLhs = !decider.inScope(() -> consumer.consume(s, lhs, Terms.fullPerm(), e, pve, context,
				(s1, snap, chunks, c1) -> VerificationResult.SUCCESS)).isFatal();
		Heap from = fromLhs ? lhs : outer;
		return consumer.consume(s, from, Terms.fullPerm(), e, pve, context, (s1, snap, chunks, c1) -> {
			Heap nlhs = fromLhs ? s1.getHeap() : lhs;
			Heap nouter = fromLhs ? outer : s1.getHeap();
			Outcome o = outcome.consumed(nlhs, nouter, chunks, fromLhs);
			return consumeAll(state, nlhs, nouter, conjuncts, index + 1, pve, c1, o, outcomes);
		});
	}

	/**
	 * Records where the resources for one branch of a package came from.
	 */
	private static final class Outcome {
		private final Heap used;
		private final Heap lhsRemainder;
		private final Heap outerRemainder;
		private final List<Chunk> produced;
		private final List<Chunk> fromLhs;
		private final List<Chunk> fromOuter;

		public Outcome(List<Chunk> produced, Heap used, Heap lhsRemainder, Heap outerRemainder,
				List<Chunk> fromLhs, List<Chunk> fromOuter) {
			this.produced = produced;
			this.used = used;
			this.lhsRemainder = lhsRemainder;
			this.outerRemainder = outerRemainder;
			this.fromLhs = fromLhs;
			this.fromOuter = fromOuter;
		}

		public Outcome consumed(Heap lhs, Heap outer, List<Chunk> chunks, boolean fromLhs) {
			Heap nused = used;
			for (Chunk c : chunks) {
				nused = nused.plus(c);
			}
			if (fromLhs) {
				return new Outcome(produced, nused, lhs, outer, Util.append(this.fromLhs, chunks), fromOuter);
			} else {
				return new Outcome(produced, nused, lhs, outer, this.fromLhs, Util.append(fromOuter, chunks));
			}
		}
	}
}
