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
package wysilicon.util;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

public class RationalTests {

	@Test
	public void test_01() {
		Rational half = Rational.valueOf(BigInteger.ONE, BigInteger.valueOf(2));
		Rational third = Rational.valueOf(BigInteger.ONE, BigInteger.valueOf(3));
		Rational r = half.add(third);
		assertEquals(Rational.valueOf(BigInteger.valueOf(5), BigInteger.valueOf(6)), r);
		assertEquals("5/6", r.toString());
	}

	@Test
	public void test_02() {
		// Sign moves to the numerator, common factors are removed
		Rational r = Rational.valueOf(BigInteger.valueOf(4), BigInteger.valueOf(-6));
		assertEquals(BigInteger.valueOf(-2), r.getNumerator());
		assertEquals(BigInteger.valueOf(3), r.getDenominator());
		assertEquals(-1, r.signum());
	}

	@Test
	public void test_03() {
		Rational r = Rational.valueOf(BigInteger.ZERO, BigInteger.valueOf(5));
		assertEquals(Rational.ZERO, r);
		assertTrue(r.isInteger());
		assertEquals("0", r.toString());
	}

	@Test
	public void test_04() {
		assertThrows(ArithmeticException.class, () -> Rational.valueOf(BigInteger.ONE, BigInteger.ZERO));
	}

	@Test
	public void test_05() {
		Rational a = Rational.valueOf(3);
		Rational b = Rational.valueOf(BigInteger.valueOf(7), BigInteger.valueOf(2));
		assertTrue(a.compareTo(b) < 0);
		assertEquals(Rational.valueOf(BigInteger.valueOf(21), BigInteger.valueOf(2)), a.multiply(b));
		assertEquals(Rational.valueOf(BigInteger.valueOf(6), BigInteger.valueOf(7)), a.divide(b));
		assertEquals(Rational.valueOf(BigInteger.valueOf(-1), BigInteger.valueOf(2)), a.subtract(b));
	}
}
