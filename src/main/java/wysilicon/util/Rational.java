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

import java.math.BigInteger;

/**
 * An exact rational number, kept in lowest terms with a positive denominator.
 * Permission amounts and the coefficients of linear constraints are
 * represented using this.
 */
public final class Rational implements Comparable<Rational> {
	public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
	public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

	private final BigInteger numerator;
	private final BigInteger denominator;

	private Rational(BigInteger numerator, BigInteger denominator) {
		this.numerator = numerator;
		this.denominator = denominator;
	}

	public static Rational valueOf(long value) {
		return valueOf(BigInteger.valueOf(value));
	}

	public static Rational valueOf(BigInteger value) {
		return new Rational(value, BigInteger.ONE);
	}

	public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
		if (denominator.signum() == 0) {
			throw new ArithmeticException("division by zero");
		} else if (denominator.signum() < 0) {
			numerator = numerator.negate();
			denominator = denominator.negate();
		}
		BigInteger gcd = numerator.gcd(denominator);
		if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
			numerator = numerator.divide(gcd);
			denominator = denominator.divide(gcd);
		}
		return new Rational(numerator, denominator);
	}

	public BigInteger getNumerator() {
		return numerator;
	}

	public BigInteger getDenominator() {
		return denominator;
	}

	public boolean isInteger() {
		return denominator.equals(BigInteger.ONE);
	}

	public int signum() {
		return numerator.signum();
	}

	public Rational add(Rational r) {
		return valueOf(numerator.multiply(r.denominator).add(r.numerator.multiply(denominator)),
				denominator.multiply(r.denominator));
	}

	public Rational subtract(Rational r) {
		return add(r.negate());
	}

	public Rational multiply(Rational r) {
		return valueOf(numerator.multiply(r.numerator), denominator.multiply(r.denominator));
	}

	public Rational divide(Rational r) {
		return valueOf(numerator.multiply(r.denominator), denominator.multiply(r.numerator));
	}

	public Rational negate() {
		return new Rational(numerator.negate(), denominator);
	}

	public Rational abs() {
		return signum() < 0 ? negate() : this;
	}

	@Override
	public int compareTo(Rational r) {
		return numerator.multiply(r.denominator).compareTo(r.numerator.multiply(denominator));
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Rational) {
			Rational r = (Rational) o;
			return numerator.equals(r.numerator) && denominator.equals(r.denominator);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return numerator.hashCode() ^ denominator.hashCode();
	}

	@Override
	public String toString() {
		if (isInteger()) {
			return numerator.toString();
		} else {
			return numerator + "/" + denominator;
		}
	}
}
