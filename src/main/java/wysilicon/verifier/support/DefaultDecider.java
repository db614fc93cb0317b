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
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import wysilicon.core.SilFile;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.Term;
import wysilicon.state.Terms;
import wysilicon.verifier.Config;
import wysilicon.verifier.Decider;
import wysilicon.verifier.ErrorReason;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;

/**
 * A decider which keeps its path conditions on a stack of scopes and answers
 * queries using a {@link Prover}. Every scope pushed here is mirrored by a
 * scope of the prover, so that path conditions are asserted to the solver
 * once rather than for every query.
 */
public class DefaultDecider implements Decider {
	private static final Logger logger = LogManager.getLogger(DefaultDecider.class);

	private final Prover prover;
	private final ArrayList<ArrayList<Term>> scopes = new ArrayList<>();
	private int counter;

	public DefaultDecider(Config config) {
		this(new Prover(config.getProverTimeout()));
	}

	public DefaultDecider(Prover prover) {
		this.prover = prover;
		this.scopes.add(new ArrayList<>());
	}

	@Override
	public void pushScope() {
		scopes.add(new ArrayList<>());
		prover.push();
	}

	@Override
	public void popScope() {
		if (scopes.size() == 1) {
			throw new IllegalStateException("cannot pop outermost scope");
		}
		scopes.remove(scopes.size() - 1);
		prover.pop();
	}

	@Override
	public <T> T inScope(Supplier<T> block) {
		int depth = scopes.size();
		pushScope();
		try {
			return block.get();
		} finally {
			while (scopes.size() > depth) {
				popScope();
			}
		}
	}

	@Override
	public void assume(Term term) {
		if (term != Term.TRUE) {
			scopes.get(scopes.size() - 1).add(term);
			prover.assume(term);
		}
	}

	@Override
	public void assume(Collection<? extends Term> terms) {
		for (Term t : terms) {
			assume(t);
		}
	}

	@Override
	public List<Term> getPathConditions() {
		ArrayList<Term> pcs = new ArrayList<>();
		for (ArrayList<Term> scope : scopes) {
			pcs.addAll(scope);
		}
		return pcs;
	}

	@Override
	public boolean check(Term term) {
		if (term == Term.TRUE) {
			return true;
		}
		return prover.entails(term);
	}

	@Override
	public boolean assertTerm(Term term) {
		if (check(term)) {
			assume(term);
			return true;
		}
		return false;
	}

	@Override
	public boolean checkSmoke() {
		return prover.isUnsatisfiable();
	}

	@Override
	public Term.Var fresh(Term.Sort sort) {
		return fresh("$" + sort.name().toLowerCase(), sort);
	}

	@Override
	public Term.Var fresh(String id, Term.Sort sort) {
		return new Term.Var(id + "@" + (counter++), sort);
	}

	@Override
	public FreshArp freshArp() {
		Term.Var k = fresh("$k", Term.Sort.PERM);
		Term constraint = Terms.and(Terms.less(Terms.noPerm(), k), Terms.less(k, Terms.fullPerm()));
		return new FreshArp(k, constraint);
	}

	@Override
	public VerificationResult branch(Term condition, Supplier<VerificationResult> trueBranch,
			Supplier<VerificationResult> falseBranch) {
		Term negated = Terms.not(condition);
		boolean exploreTrue = !check(negated);
		boolean exploreFalse = !check(condition);
		logger.trace("branch on {} ({}, {})", condition, exploreTrue, exploreFalse);
		VerificationResult r = VerificationResult.SUCCESS;
		if (exploreTrue) {
			r = inScope(() -> {
				assume(condition);
				return trueBranch.get();
			});
		}
		if (exploreFalse) {
			r = r.and(() -> inScope(() -> {
				assume(negated);
				return falseBranch.get();
			}));
		}
		return r;
	}

	@Override
	public Chunk.Field getFieldChunk(Heap heap, Term receiver, String field) {
		// Syntactic matches are much cheaper than asking the prover
		for (Chunk ch : heap) {
			if (ch instanceof Chunk.Field) {
				Chunk.Field fc = (Chunk.Field) ch;
				if (fc.getField().equals(field) && fc.getReceiver().equals(receiver)) {
					return fc;
				}
			}
		}
		for (Chunk ch : heap) {
			if (ch instanceof Chunk.Field) {
				Chunk.Field fc = (Chunk.Field) ch;
				if (fc.getField().equals(field) && check(Terms.eq(fc.getReceiver(), receiver))) {
					return fc;
				}
			}
		}
		return null;
	}

	@Override
	public Chunk.Predicate getPredicateChunk(Heap heap, String name, List<Term> arguments) {
		for (Chunk ch : heap) {
			if (ch instanceof Chunk.Predicate) {
				Chunk.Predicate pc = (Chunk.Predicate) ch;
				if (pc.getName().equals(name) && pc.getArguments().equals(arguments)) {
					return pc;
				}
			}
		}
		for (Chunk ch : heap) {
			if (ch instanceof Chunk.Predicate) {
				Chunk.Predicate pc = (Chunk.Predicate) ch;
				if (pc.getName().equals(name) && areEqual(pc.getArguments(), arguments)) {
					return pc;
				}
			}
		}
		return null;
	}

	@Override
	public Chunk.MagicWand getChunk(Heap heap, Chunk.MagicWand identity) {
		for (Chunk ch : heap) {
			if (ch instanceof Chunk.MagicWand && ((Chunk.MagicWand) ch).hasSameIdentity(identity)) {
				return (Chunk.MagicWand) ch;
			}
		}
		for (Chunk ch : heap) {
			if (ch instanceof Chunk.MagicWand) {
				Chunk.MagicWand wc = (Chunk.MagicWand) ch;
				if (wc.getWand() == identity.getWand() && areEqual(wc.getBindings(), identity.getBindings())) {
					return wc;
				}
			}
		}
		return null;
	}

	@Override
	public VerificationResult withChunk(Heap heap, Term receiver, String field, Term permission,
			SilFile.Item location, VerificationError.Partial pve, Context context, ChunkContinuation Q) {
		Chunk.Field ch = getFieldChunk(heap, receiver, field);
		if (ch != null && check(Terms.atMost(permission, ch.getPermission()))) {
			return Q.apply(ch, context);
		}
		return VerificationResult.failure(pve.dueTo(ErrorReason.insufficientPermission(location)));
	}

	@Override
	public void logComment(String comment) {
		prover.logComment(comment);
	}

	@Override
	public void close() {
		prover.close();
	}

	private boolean areEqual(List<Term> lhs, List<Term> rhs) {
		if (lhs.size() != rhs.size()) {
			return false;
		}
		for (int i = 0; i != lhs.size(); ++i) {
			if (!check(Terms.eq(lhs.get(i), rhs.get(i)))) {
				return false;
			}
		}
		return true;
	}

	private boolean areEqual(Map<String, Term> lhs, Map<String, Term> rhs) {
		if (!lhs.keySet().equals(rhs.keySet())) {
			return false;
		}
		for (Map.Entry<String, Term> e : lhs.entrySet()) {
			if (!check(Terms.eq(e.getValue(), rhs.get(e.getKey())))) {
				return false;
			}
		}
		return true;
	}
}
