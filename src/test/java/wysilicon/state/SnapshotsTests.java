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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;

import org.junit.jupiter.api.Test;

import wysilicon.state.Term.Sort;

public class SnapshotsTests {

	@Test
	public void test_fresh_01() {
		ArrayList<Term> generated = new ArrayList<>();
		Snapshots snapshots = Snapshots.fresh(sort -> {
			Term t = new Term.Var("s" + generated.size(), sort);
			generated.add(t);
			return t;
		});
		// Decomposing fresh snapshots yields fresh snapshots
		assertSame(snapshots, snapshots.first());
		assertSame(snapshots, snapshots.second());
		Term t = snapshots.first().next(Sort.INT);
		assertEquals(new Term.Var("s0", Sort.INT), t);
		assertEquals(1, generated.size());
	}

	@Test
	public void test_of_01() {
		Term.Var s = new Term.Var("s", Sort.SNAP);
		Snapshots snapshots = Snapshots.of(s);
		assertEquals(new Term.Wrap(new Term.First(s), Sort.INT), snapshots.first().next(Sort.INT));
		assertEquals(new Term.Second(s), snapshots.second().next(Sort.SNAP));
	}

	@Test
	public void test_of_02() {
		Term.Var i = new Term.Var("i", Sort.INT);
		Term.Var j = new Term.Var("j", Sort.REF);
		Snapshots snapshots = Snapshots.of(Terms.combine(Terms.convert(i, Sort.SNAP), Terms.convert(j, Sort.SNAP)));
		assertEquals(i, snapshots.first().next(Sort.INT));
		assertEquals(j, snapshots.second().next(Sort.REF));
	}
}
