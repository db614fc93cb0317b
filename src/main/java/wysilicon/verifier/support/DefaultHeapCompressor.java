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
import java.util.List;

import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;
import wysilicon.state.Terms;
import wysilicon.verifier.Decider;
import wysilicon.verifier.HeapCompressor;

/**
 * Merges chunks which provably describe the same location, and records the
 * facts which follow from permissions never exceeding one.
 */
public class DefaultHeapCompressor implements HeapCompressor {
	private final Decider decider;

	public DefaultHeapCompressor(Decider decider) {
		this.decider = decider;
	}

	@Override
	public Heap merge(Heap heap, Chunk chunk) {
		if (chunk instanceof Chunk.Field) {
			return mergeField(heap, (Chunk.Field) chunk);
		} else if (chunk instanceof Chunk.Predicate) {
			return mergePredicate(heap, (Chunk.Predicate) chunk);
		} else {
			return heap.plus(chunk);
		}
	}

	@Override
	public void compress(SymbolicState state, Heap heap, Context context) {
		List<Chunk> chunks = heap.values();
		ArrayList<Term> facts = new ArrayList<>();
		for (int i = 0; i != chunks.size(); ++i) {
			Chunk ci = chunks.get(i);
			if (!(ci instanceof Chunk.Field)) {
				continue;
			}
			Chunk.Field fi = (Chunk.Field) ci;
			facts.add(Terms.implies(Terms.isPositive(fi.getPermission()), Terms.neq(fi.getReceiver(), Term.NULL)));
			for (int j = i + 1; j < chunks.size(); ++j) {
				Chunk cj = chunks.get(j);
				if (cj instanceof Chunk.Field && ((Chunk.Field) cj).getField().equals(fi.getField())) {
					Chunk.Field fj = (Chunk.Field) cj;
					Term sum = Terms.plus(fi.getPermission(), fj.getPermission());
					facts.add(Terms.implies(Terms.less(Terms.fullPerm(), sum),
							Terms.neq(fi.getReceiver(), fj.getReceiver())));
					facts.add(Terms.implies(Terms.eq(fi.getReceiver(), fj.getReceiver()),
							Terms.eq(fi.getValue(), fj.getValue())));
				}
			}
		}
		decider.assume(facts);
	}

	private Heap mergeField(Heap heap, Chunk.Field chunk) {
		ArrayList<Term> facts = new ArrayList<>();
		for (Chunk c : heap) {
			if (!(c instanceof Chunk.Field)) {
				continue;
			}
			Chunk.Field f = (Chunk.Field) c;
			if (!f.getField().equals(chunk.getField())) {
				continue;
			} else if (decider.check(Terms.eq(f.getReceiver(), chunk.getReceiver()))) {
				Term sum = Terms.plus(f.getPermission(), chunk.getPermission());
				decider.assume(Terms.eq(f.getValue(), chunk.getValue()));
				decider.assume(Terms.atMost(sum, Terms.fullPerm()));
				return heap.replace(f, new Chunk.Field(f.getReceiver(), f.getField(), f.getValue(), sum));
			}
			Term sum = Terms.plus(f.getPermission(), chunk.getPermission());
			if (decider.check(Terms.less(Terms.fullPerm(), sum))) {
				facts.add(Terms.neq(f.getReceiver(), chunk.getReceiver()));
			}
		}
		decider.assume(facts);
		return heap.plus(chunk);
	}

	private Heap mergePredicate(Heap heap, Chunk.Predicate chunk) {
		for (Chunk c : heap) {
			if (!(c instanceof Chunk.Predicate)) {
				continue;
			}
			Chunk.Predicate p = (Chunk.Predicate) c;
			if (p.getName().equals(chunk.getName()) && argumentsEqual(p.getArguments(), chunk.getArguments())) {
				if (p.getSnapshot().getSort() == chunk.getSnapshot().getSort()) {
					decider.assume(Terms.eq(p.getSnapshot(), chunk.getSnapshot()));
				}
				Term sum = Terms.plus(p.getPermission(), chunk.getPermission());
				return heap.replace(p, new Chunk.Predicate(p.getName(), p.getArguments(), p.getSnapshot(), sum));
			}
		}
		return heap.plus(chunk);
	}

	private boolean argumentsEqual(List<Term> lhs, List<Term> rhs) {
		if (lhs.size() != rhs.size()) {
			return false;
		}
		for (int i = 0; i != lhs.size(); ++i) {
			if (!decider.check(Terms.eq(lhs.get(i), rhs.get(i)))) {
				return false;
			}
		}
		return true;
	}
}
