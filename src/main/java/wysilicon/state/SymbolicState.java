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
package wysilicon.state;

/**
 * The symbolic state at a given program point: a store, the current heap and
 * the heap against which <code>old</code> expressions are evaluated.
 */
public final class SymbolicState {
	private final Store store;
	private final Heap heap;
	private final Heap oldHeap;

	public SymbolicState(Store store, Heap heap, Heap oldHeap) {
		this.store = store;
		this.heap = heap;
		this.oldHeap = oldHeap;
	}

	public SymbolicState() {
		this(Store.EMPTY, Heap.EMPTY, Heap.EMPTY);
	}

	public Store getStore() {
		return store;
	}

	public Heap getHeap() {
		return heap;
	}

	public Heap getOldHeap() {
		return oldHeap;
	}

	public SymbolicState withStore(Store store) {
		return new SymbolicState(store, heap, oldHeap);
	}

	public SymbolicState withHeap(Heap heap) {
		return new SymbolicState(store, heap, oldHeap);
	}

	public SymbolicState withOldHeap(Heap oldHeap) {
		return new SymbolicState(store, heap, oldHeap);
	}

	public SymbolicState plus(String variable, Term value) {
		return withStore(store.plus(variable, value));
	}

	public SymbolicState plus(Store bindings) {
		return withStore(store.plus(bindings));
	}

	public SymbolicState plus(Chunk chunk) {
		return withHeap(heap.plus(chunk));
	}

	public SymbolicState plus(Heap chunks) {
		return withHeap(heap.plus(chunks));
	}

	public SymbolicState minus(Chunk chunk) {
		return withHeap(heap.minus(chunk));
	}

	@Override
	public String toString() {
		return "(" + store + ", " + heap + ", " + oldHeap + ")";
	}
}
