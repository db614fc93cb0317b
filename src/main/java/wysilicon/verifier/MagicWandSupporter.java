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

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.SymbolicState;

/**
 * Creates and packages magic wands.
 */
public interface MagicWandSupporter {

	@FunctionalInterface
	public interface ChunkContinuation {
		public VerificationResult apply(Chunk.MagicWand chunk, Context context);
	}

	/**
	 * Create the chunk describing a given wand in a given state, without adding
	 * it to any heap.
	 *
	 * @param state
	 * @param wand
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult createChunk(SymbolicState state, Expr.MagicWand wand, VerificationError.Partial pve,
			Context context, ChunkContinuation Q);

	/**
	 * Package a given wand. On entry, the reserve heaps of the context are the
	 * empty heap followed by the heap from which resources for the wand may be
	 * taken. On exit, exactly three reserve heaps are present: the resources
	 * used by the wand, what remains of the left-hand side and what remains of
	 * the heap the wand drew on.
	 *
	 * @param state
	 * @param wand
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult packageWand(SymbolicState state, Expr.MagicWand wand, VerificationError.Partial pve,
			Context context, ChunkContinuation Q);
}
