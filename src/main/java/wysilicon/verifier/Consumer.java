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

import java.util.List;
import java.util.function.Function;

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;

/**
 * Removes the resources described by an assertion from a state, and checks the
 * facts it describes.
 */
public interface Consumer {

	@FunctionalInterface
	public interface Continuation {
		/**
		 * @param state    The state after consumption.
		 * @param snapshot The values held by the consumed resources.
		 * @param chunks   The chunks from which permission was taken.
		 * @param context
		 * @return
		 */
		public VerificationResult apply(SymbolicState state, Term snapshot, List<Chunk> chunks, Context context);
	}

	/**
	 * Consume an assertion from the heap of a given state, scaling every
	 * permission it describes by a given amount.
	 *
	 * @param state
	 * @param permission
	 * @param assertion
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult consume(SymbolicState state, Term permission, Expr assertion,
			VerificationError.Partial pve, Context context, Continuation Q);

	/**
	 * Consume an assertion from a given heap, whilst evaluating its expressions
	 * in a given state. The state passed on has the remainder of the given heap.
	 *
	 * @param state
	 * @param heap
	 * @param permission
	 * @param assertion
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult consume(SymbolicState state, Heap heap, Term permission, Expr assertion,
			VerificationError.Partial pve, Context context, Continuation Q);

	/**
	 * Consume a list of assertions in order. Every assertion is evaluated in the
	 * given state, which means a later assertion may refer to values whose
	 * permission an earlier one has consumed.
	 *
	 * @param state
	 * @param permission
	 * @param assertions
	 * @param pveFn
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult consumes(SymbolicState state, Term permission, List<? extends Expr> assertions,
			Function<Expr, VerificationError.Partial> pveFn, Context context, Continuation Q);
}
