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

import org.junit.jupiter.api.Test;

import wysilicon.state.Term.Sort;

public class TermsTests {
	private static final Term.Var I = new Term.Var("i", Sort.INT);
	private static final Term.Var J = new Term.Var("j", Sort.INT);
	private static final Term.Var S = new Term.Var("s", Sort.SNAP);

	@Test
	public void test_arithmetic_01() {
		assertEquals(Terms.num(5, Sort.INT), Terms.plus(Terms.num(2, Sort.INT), Terms.num(3, Sort.INT)));
		assertEquals(I, Terms.plus(I, Terms.num(0, Sort.INT)));
		assertEquals(new Term.Plus(I, J), Terms.plus(I, J));
	}

	@Test
	public void test_arithmetic_02() {
		assertEquals(I, Terms.times(I, Terms.num(1, Sort.INT)));
		assertEquals(Terms.num(0, Sort.INT), Terms.times(Terms.num(0, Sort.INT), J));
		assertEquals(Terms.num(0, Sort.INT), Terms.minus(I, I));
	}

	@Test
	public void test_arithmetic_03() {
		assertEquals(Terms.num(-4, Sort.INT), Terms.div(Terms.num(-7, Sort.INT), Terms.num(2, Sort.INT)));
		assertEquals(Terms.num(3, Sort.INT), Terms.div(Terms.num(7, Sort.INT), Terms.num(2, Sort.INT)));
		Term half = Terms.fraction(Terms.num(1, Sort.INT), Terms.num(2, Sort.INT));
		assertEquals(Sort.PERM, half.getSort());
		assertEquals("1/2", ((Term.Num) half).getValue().toString());
	}

	@Test
	public void test_relations_01() {
		assertSame(Term.TRUE, Terms.eq(I, I));
		assertSame(Term.FALSE, Terms.eq(Terms.num(1, Sort.INT), Terms.num(2, Sort.INT)));
		assertSame(Term.FALSE, Terms.eq(Term.NULL, Term.TRUE));
		assertSame(Term.TRUE, Terms.isPositive(Terms.fullPerm()));
		assertSame(Term.TRUE, Terms.isNonNegative(Terms.noPerm()));
		assertSame(Term.FALSE, Terms.less(I, I));
	}

	@Test
	public void test_connectives_01() {
		Term a = Terms.less(I, J);
		assertSame(Term.FALSE, Terms.not(Term.TRUE));
		assertEquals(a, Terms.not(Terms.not(a)));
		assertEquals(a, Terms.and(Term.TRUE, a, a));
		assertSame(Term.FALSE, Terms.and(a, Term.FALSE));
		assertSame(Term.TRUE, Terms.or(a, Term.TRUE));
		assertEquals(a, Terms.implies(Term.TRUE, a));
		assertEquals(Terms.not(a), Terms.implies(a, Term.FALSE));
	}

	@Test
	public void test_connectives_02() {
		Term a = Terms.less(I, J);
		Term b = Terms.eq(I, Terms.num(0, Sort.INT));
		Term c = Terms.and(Terms.and(a, b), a);
		assertTrue(c instanceof Term.And);
		assertEquals(2, ((Term.And) c).getOperands().size());
	}

	@Test
	public void test_snapshots_01() {
		Term c = Terms.combine(I, J);
		assertEquals(I, Terms.first(c));
		assertEquals(J, Terms.second(c));
		assertEquals(new Term.First(S), Terms.first(S));
	}

	@Test
	public void test_snapshots_02() {
		Term w = Terms.convert(I, Sort.SNAP);
		assertEquals(Sort.SNAP, w.getSort());
		assertEquals(I, Terms.convert(w, Sort.INT));
		assertSame(S, Terms.convert(S, Sort.SNAP));
	}
}
