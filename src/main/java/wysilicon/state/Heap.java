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
import java.util.Iterator;
import java.util.List;

/**
 * An immutable multiset of chunks. Every update returns a new heap.
 */
public final class Heap implements Iterable<Chunk> {
	public static final Heap EMPTY = new Heap(Collections.emptyList());

	private final List<Chunk> chunks;

	private Heap(List<Chunk> chunks) {
		this.chunks = chunks;
	}

	public static Heap of(Collection<? extends Chunk> chunks) {
		return new Heap(Collections.unmodifiableList(new ArrayList<>(chunks)));
	}

	public List<Chunk> values() {
		return chunks;
	}

	public int size() {
		return chunks.size();
	}

	public boolean isEmpty() {
		return chunks.isEmpty();
	}

	public boolean contains(Chunk chunk) {
		return indexOf(chunk) >= 0;
	}

	public Heap plus(Chunk chunk) {
		ArrayList<Chunk> nchunks = new ArrayList<>(chunks);
		nchunks.add(chunk);
		return new Heap(Collections.unmodifiableList(nchunks));
	}

	public Heap plus(Heap heap) {
		if (heap.isEmpty()) {
			return this;
		} else if (isEmpty()) {
			return heap;
		}
		ArrayList<Chunk> nchunks = new ArrayList<>(chunks);
		nchunks.addAll(heap.chunks);
		return new Heap(Collections.unmodifiableList(nchunks));
	}

	/**
	 * Remove a given chunk (by identity) from this heap.
	 *
	 * @param chunk
	 * @return
	 */
	public Heap minus(Chunk chunk) {
		int index = indexOf(chunk);
		if (index < 0) {
			throw new IllegalArgumentException("chunk not in heap (" + chunk + ")");
		}
		ArrayList<Chunk> nchunks = new ArrayList<>(chunks);
		nchunks.remove(index);
		return new Heap(Collections.unmodifiableList(nchunks));
	}

	/**
	 * Replace a given chunk (by identity) with another, retaining its position.
	 *
	 * @param chunk
	 * @param replacement
	 * @return
	 */
	public Heap replace(Chunk chunk, Chunk replacement) {
		int index = indexOf(chunk);
		if (index < 0) {
			throw new IllegalArgumentException("chunk not in heap (" + chunk + ")");
		}
		ArrayList<Chunk> nchunks = new ArrayList<>(chunks);
		nchunks.set(index, replacement);
		return new Heap(Collections.unmodifiableList(nchunks));
	}

	private int indexOf(Chunk chunk) {
		for (int i = 0; i != chunks.size(); ++i) {
			if (chunks.get(i) == chunk) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public Iterator<Chunk> iterator() {
		return chunks.iterator();
	}

	@Override
	public String toString() {
		return chunks.toString();
	}
}
