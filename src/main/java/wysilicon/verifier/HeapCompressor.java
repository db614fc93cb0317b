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

import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.SymbolicState;

/**
 * Keeps heaps compact by merging chunks which describe the same location.
 */
public interface HeapCompressor {

	/**
	 * Add a chunk to a heap, merging it with any chunk which provably describes
	 * the same location.
	 *
	 * @param heap
	 * @param chunk
	 * @return
	 */
	public Heap merge(Heap heap, Chunk chunk);

	/**
	 * Record the facts implied by the chunks of a heap, such as values being
	 * equal when their receivers are, in the path conditions.
	 *
	 * @param state
	 * @param heap
	 * @param context
	 */
	public void compress(SymbolicState state, Heap heap, Context context);
}
