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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import wysilicon.state.Term;
import wysilicon.state.Term.Sort;
import wysilicon.state.Terms;

public class ProverTests {
	private static final Term.Var I = new Term.Var("i", Sort.INT);
	private static final Term.Var N = new Term.Var("n", Sort.INT);
	private static final Term.Var K = new Term.Var("k", Sort.PERM);
	private static final Term.Var X = new Term.Var("x", Sort.REF);
	private static final Term.Var Y = new Term.Var("y", Sort.REF);
	private static final Term.Var Z = new Term.Var("z", Sort.REF);
	private static final Term.Var B = new Term.Var("b", Sort.BOOL);

	private static Term num(long n) {
		return Terms.num(n, Sort.INT);
	}

	private final Prover prover = new Prover(10000);

	@AfterEach
	public void close() {
		prover.close();
	}

	@Test
	public void test_arithmetic_01() {
		// 0 <= i && i + 1 <= 0
		assertTrue(prover.isUnsatisfiable(Arrays.asList(Terms.atMost(num(0), I), Terms.atMost(Terms.plus(I, num(1)), num(0)))));
	}

	@Test
	public void test_arithmetic_02() {
		assertTrue(prover.entails(Arrays.asList(Terms.atMost(num(0), I)), Terms.less(num(0), Terms.plus(I, num(1)))));
		assertFalse(prover.entails(Collections.emptyList(), Terms.less(num(0), I)));
	}

	@Test
	public void test_arithmetic_03() {
		// i < n on integers means i + 1 <= n
		assertTrue(prover.entails(Arrays.asList(Terms.less(I, N)), Terms.atMost(Terms.plus(I, num(1)), N)));
	}

	@Test
	public void test_arithmetic_04() {
		// 0 <= i && i <= n && !(i < n) ==> i == n
		assertTrue(prover.entails(
				Arrays.asList(Terms.atMost(num(0), I), Terms.atMost(I, N), Terms.not(Terms.less(I, N))),
				Terms.eq(I, N)));
		assertFalse(prover.entails(Arrays.asList(Terms.atMost(num(0), I), Terms.atMost(I, N)), Terms.eq(I, N)));
	}

	@Test
	public void test_arithmetic_05() {
		// Non-linear facts
		assertTrue(prover.entails(Collections.emptyList(), Terms.atMost(num(0), Terms.times(N, N))));
		assertFalse(prover.entails(Collections.emptyList(), Terms.less(num(0), Terms.times(N, N))));
	}

	@Test
	public void test_arithmetic_06() {
		// Division rounds towards negative infinity
		Term d = Terms.div(I, num(-2));
		assertTrue(prover.entails(Arrays.asList(Terms.eq(I, num(7))), Terms.eq(d, num(-4))));
		assertTrue(prover.entails(Arrays.asList(Terms.eq(I, num(7))), Terms.eq(Terms.div(I, num(2)), num(3))));
	}

	@Test
	public void test_scopes_01() {
		prover.assume(Terms.less(num(0), I));
		prover.push();
		prover.assume(Terms.less(I, num(0)));
		assertTrue(prover.isUnsatisfiable());
		prover.pop();
		assertFalse(prover.isUnsatisfiable());
		assertTrue(prover.entails(Terms.atMost(num(1), I)));
	}

	@Test
	public void test_permissions_01() {
		Term bounds = Terms.and(Terms.less(Terms.noPerm(), K), Terms.less(K, Terms.fullPerm()));
		assertTrue(prover.entails(Arrays.asList(bounds), Terms.atMost(K, Terms.fullPerm())));
		assertTrue(prover.entails(Arrays.asList(bounds), Terms.not(Terms.eq(K, Terms.noPerm()))));
		Term half = Terms.fraction(num(1), num(2));
		assertFalse(prover.entails(Arrays.asList(bounds), Terms.eq(K, half)));
	}

	@Test
	public void test_equality_01() {
		assertTrue(prover.entails(Arrays.asList(Terms.eq(X, Y), Terms.eq(Y, Z)), Terms.eq(X, Z)));
		assertTrue(prover.entails(Arrays.asList(Terms.eq(X, Y), Terms.neq(X, Z)), Terms.neq(Y, Z)));
		assertFalse(prover.entails(Arrays.asList(Terms.eq(X, Y)), Terms.eq(X, Z)));
	}

	@Test
	public void test_equality_02() {
		assertTrue(prover.isUnsatisfiable(
				Arrays.asList(Terms.eq(X, Term.NULL), Terms.eq(Y, X), Terms.neq(Y, Term.NULL))));
	}

	@Test
	public void test_disjunction_01() {
		Term either = Terms.or(Terms.eq(I, num(1)), Terms.eq(I, num(2)));
		assertTrue(prover.entails(Arrays.asList(either), Terms.less(num(0), I)));
		assertFalse(prover.entails(Arrays.asList(either), Terms.eq(I, num(1))));
	}

	@Test
	public void test_boolean_01() {
		assertTrue(prover.isUnsatisfiable(Arrays.asList(B, Terms.not(B))));
		assertTrue(prover.entails(Arrays.asList(Terms.implies(B, Terms.eq(X, Y)), B), Terms.eq(X, Y)));
		assertFalse(prover.isUnsatisfiable(Arrays.asList(B)));
	}
}
