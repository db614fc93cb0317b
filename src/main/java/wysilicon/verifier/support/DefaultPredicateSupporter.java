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

import wysilicon.core.SilFile.Decl;
import wysilicon.core.SilFile.Expr;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.Snapshots;
import wysilicon.state.Store;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;
import wysilicon.state.Terms;
import wysilicon.verifier.Consumer;
import wysilicon.verifier.Continuation;
import wysilicon.verifier.Decider;
import wysilicon.verifier.ErrorReason;
import wysilicon.verifier.HeapCompressor;
import wysilicon.verifier.PredicateSupporter;
import wysilicon.verifier.Producer;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;

/**
 * Folds and unfolds predicate instances. Folding consumes the body of the
 * predicate and records the values consumed as the snapshot of the new
 * instance. Unfolding produces the body again from that snapshot.
 */
public class DefaultPredicateSupporter implements PredicateSupporter {
	private final Decider decider;
	private final Producer producer;
	private final Consumer consumer;
	private final HeapCompressor heapCompressor;

	public DefaultPredicateSupporter(Decider decider, Producer producer, Consumer consumer,
			HeapCompressor heapCompressor) {
		this.decider = decider;
		this.producer = producer;
		this.consumer = consumer;
		this.heapCompressor = heapCompressor;
	}

	@Override
	public VerificationResult fold(SymbolicState state, Decl.Predicate predicate, List<Term> arguments,
			Term permission, VerificationError.Partial pve, Context context, Continuation Q) {
		Expr body = getBody(predicate);
		Store store = bind(predicate, arguments);
		return consumer.consume(state.withStore(store), permission, body, pve, context, (s1, snap, chunks, c1) -> {
			Chunk.Predicate ch = new Chunk.Predicate(predicate.getName(), arguments, snap, permission);
			Heap heap = heapCompressor.merge(s1.getHeap(), ch);
			return Q.apply(state.withHeap(heap), c1);
		});
	}

	@Override
	public VerificationResult unfold(SymbolicState state, Decl.Predicate predicate, List<Term> arguments,
			Term permission, VerificationError.Partial pve, Context context, Expr.PredicateAccess location,
			Continuation Q) {
		Expr body = getBody(predicate);
		Chunk.Predicate ch = decider.getPredicateChunk(state.getHeap(), predicate.getName(), arguments);
		if (ch == null || !decider.check(Terms.atMost(permission, ch.getPermission()))) {
			return VerificationResult.failure(pve.dueTo(ErrorReason.insufficientPermission(location)));
		}
		Term remainder = Terms.minus(ch.getPermission(), permission);
		Heap heap;
		if (decider.check(Terms.eq(remainder, Terms.noPerm()))) {
			heap = state.getHeap().minus(ch);
		} else {
			heap = state.getHeap().replace(ch, ch.withPermission(remainder));
		}
		SymbolicState s1 = new SymbolicState(bind(predicate, arguments), heap, state.getOldHeap());
		return producer.produce(s1, Snapshots.of(ch.getSnapshot()), permission, body, pve, context,
				(s2, c2) -> Q.apply(s2.withStore(state.getStore()), c2));
	}

	private static Expr getBody(Decl.Predicate predicate) {
		Expr body = predicate.getBody();
		if (body == null) {
			throw new IllegalArgumentException("abstract predicate \"" + predicate.getName() + "\"");
		}
		return body;
	}

	private static Store bind(Decl.Predicate predicate, List<Term> arguments) {
		List<Decl.Parameter> parameters = predicate.getParameters();
		if (parameters.size() != arguments.size()) {
			throw new IllegalArgumentException("invalid number of arguments for predicate " + predicate.getName());
		}
		Store store = Store.EMPTY;
		for (int i = 0; i != parameters.size(); ++i) {
			store = store.plus(parameters.get(i).getName(), arguments.get(i));
		}
		return store;
	}
}
