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
package wysilicon.verifier;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

import wysilicon.core.SilFile;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.Term;

/**
 * <p>
 * Maintains the path conditions of the branch currently being explored, and
 * answers questions about them. Path conditions are organised as a stack of
 * scopes: everything assumed after a scope is pushed is forgotten when it is
 * popped.
 * </p>
 * <p>
 * <b>NOTE:</b> a decider is mutable and must only be used by the thread
 * performing the verification it belongs to.
 * </p>
 */
public interface Decider extends AutoCloseable {

	@FunctionalInterface
	public interface ChunkContinuation {
		public VerificationResult apply(Chunk.Field chunk, Context context);
	}

	/**
	 * A fresh abstract read permission, along with the constraints on it.
	 */
	public static final class FreshArp {
		private final Term.Var permission;
		private final Term constraint;

		public FreshArp(Term.Var permission, Term constraint) {
			this.permission = permission;
			this.constraint = constraint;
		}

		public Term.Var getPermission() {
			return permission;
		}

		public Term getConstraint() {
			return constraint;
		}
	}

	public void pushScope();

	public void popScope();

	/**
	 * Compute something within a new scope, which is popped afterwards however
	 * the computation terminates.
	 *
	 * @param block
	 * @return
	 */
	public <T> T inScope(Supplier<T> block);

	public void assume(Term term);

	public void assume(Collection<? extends Term> terms);

	/**
	 * Get the path conditions currently in force, outermost scope first.
	 *
	 * @return
	 */
	public List<Term> getPathConditions();

	/**
	 * Check whether a term follows from the current path conditions, without
	 * recording anything.
	 *
	 * @param term
	 * @return
	 */
	public boolean check(Term term);

	/**
	 * Check whether a term follows from the current path conditions and, if so,
	 * assume it.
	 *
	 * @param term
	 * @return
	 */
	public boolean assertTerm(Term term);

	/**
	 * Check whether the current path conditions are contradictory, meaning the
	 * current branch cannot be reached.
	 *
	 * @return
	 */
	public boolean checkSmoke();

	public Term.Var fresh(Term.Sort sort);

	public Term.Var fresh(String id, Term.Sort sort);

	public FreshArp freshArp();

	/**
	 * Explore both outcomes of a condition, each in its own scope where the
	 * condition (respectively its negation) is assumed. An outcome which
	 * contradicts the current path conditions is not explored.
	 *
	 * @param condition
	 * @param trueBranch
	 * @param falseBranch
	 * @return
	 */
	public VerificationResult branch(Term condition, Supplier<VerificationResult> trueBranch,
			Supplier<VerificationResult> falseBranch);

	/**
	 * Find a chunk for a given field of a receiver which provably equals the
	 * given one.
	 *
	 * @param heap
	 * @param receiver
	 * @param field
	 * @return The chunk found, or <code>null</code> if none.
	 */
	public Chunk.Field getFieldChunk(Heap heap, Term receiver, String field);

	public Chunk.Predicate getPredicateChunk(Heap heap, String name, List<Term> arguments);

	/**
	 * Find a wand chunk with the same identity as the given one.
	 *
	 * @param heap
	 * @param identity
	 * @return The chunk found, or <code>null</code> if none.
	 */
	public Chunk.MagicWand getChunk(Heap heap, Chunk.MagicWand identity);

	/**
	 * Find a field chunk to which at least a given amount of permission is held,
	 * failing with insufficient permission otherwise.
	 *
	 * @param heap
	 * @param receiver
	 * @param field
	 * @param permission
	 * @param location
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult withChunk(Heap heap, Term receiver, String field, Term permission,
			SilFile.Item location, VerificationError.Partial pve, Context context, ChunkContinuation Q);

	public void logComment(String comment);

	/**
	 * Release any resources held by the underlying solver. The decider cannot be
	 * used afterwards.
	 */
	@Override
	public void close();
}
