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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import wysilicon.core.SilFile;

/**
 * Branch-local bookkeeping which accompanies a symbolic state. Like the state
 * itself, a context is immutable and every update returns a copy. Hence, a
 * context handed to two sibling branches can never observe an update made by
 * either of them.
 */
public final class Context {
	private final SilFile program;
	private final Set<Term> constrainable;
	private final List<Heap> reserveHeaps;
	private final List<Chunk> producedChunks;
	private final List<List<Chunk>> consumedChunks;
	private final Heap lhsHeap;

	public Context(SilFile program) {
		this(program, Collections.emptySet(), Collections.emptyList(), Collections.emptyList(),
				Collections.emptyList(), null);
	}

	private Context(SilFile program, Set<Term> constrainable, List<Heap> reserveHeaps, List<Chunk> producedChunks,
			List<List<Chunk>> consumedChunks, Heap lhsHeap) {
		this.program = program;
		this.constrainable = constrainable;
		this.reserveHeaps = reserveHeaps;
		this.producedChunks = producedChunks;
		this.consumedChunks = consumedChunks;
		this.lhsHeap = lhsHeap;
	}

	public SilFile getProgram() {
		return program;
	}

	public Set<Term> getConstrainable() {
		return constrainable;
	}

	public boolean isConstrainable(Term permission) {
		return constrainable.contains(permission);
	}

	/**
	 * Mark (or unmark) a given set of permission terms as constrainable.
	 *
	 * @param terms
	 * @param flag
	 * @return
	 */
	public Context setConstrainable(Collection<? extends Term> terms, boolean flag) {
		LinkedHashSet<Term> nconstrainable = new LinkedHashSet<>(constrainable);
		if (flag) {
			nconstrainable.addAll(terms);
		} else {
			nconstrainable.removeAll(terms);
		}
		return new Context(program, Collections.unmodifiableSet(nconstrainable), reserveHeaps, producedChunks,
				consumedChunks, lhsHeap);
	}

	/**
	 * The stack of heaps used whilst packaging a magic wand, which is empty
	 * outside of packaging.
	 *
	 * @return
	 */
	public List<Heap> getReserveHeaps() {
		return reserveHeaps;
	}

	public Context withReserveHeaps(List<Heap> heaps) {
		return new Context(program, constrainable, copy(heaps), producedChunks, consumedChunks, lhsHeap);
	}

	public List<Chunk> getProducedChunks() {
		return producedChunks;
	}

	public Context withProducedChunks(List<Chunk> chunks) {
		return new Context(program, constrainable, reserveHeaps, copy(chunks), consumedChunks, lhsHeap);
	}

	public List<List<Chunk>> getConsumedChunks() {
		return consumedChunks;
	}

	public Context withConsumedChunks(List<List<Chunk>> chunks) {
		ArrayList<List<Chunk>> nchunks = new ArrayList<>();
		for (List<Chunk> l : chunks) {
			nchunks.add(copy(l));
		}
		return new Context(program, constrainable, reserveHeaps, producedChunks,
				Collections.unmodifiableList(nchunks), lhsHeap);
	}

	/**
	 * The heap from which the left-hand side of a magic wand was consumed, which
	 * is only present whilst the right-hand side of that wand is being produced.
	 *
	 * @return
	 */
	public Heap getLhsHeap() {
		return lhsHeap;
	}

	public Context withLhsHeap(Heap heap) {
		return new Context(program, constrainable, reserveHeaps, producedChunks, consumedChunks, heap);
	}

	private static <T> List<T> copy(List<T> items) {
		return Collections.unmodifiableList(new ArrayList<>(items));
	}
}
