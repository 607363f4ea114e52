/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.fractions.data;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

import com.google.common.math.LongMath;
import static com.google.common.math.LongMath.checkedAdd;
import static com.google.common.math.LongMath.checkedMultiply;
import static com.google.common.math.LongMath.checkedSubtract;

/**
 * An exact rational number with {@code long} numerator and denominator.
 *
 * <p>Fractions are always kept in lowest terms with a positive denominator,
 * so the sign of the value is carried by the numerator and zero is
 * {@code 0/1}. Instances are immutable and may be shared freely between
 * threads.</p>
 *
 * <p>Arithmetic is exact. Intermediate results that overflow {@code long}
 * are recomputed with {@code BigInteger}, and an operation fails with
 * {@link FractionException.Overflow} only if its reduced result cannot be
 * represented. A wrapped value is never returned.</p>
 */
public final class Fraction extends Number implements Comparable<Fraction> {
    private static final long serialVersionUID = -3271960476843720523L;

    /**
     * The fraction represents ZERO (0/1).
     */
    public static final Fraction ZERO = new Fraction(0, 1);

    /**
     * The fraction represents ONE (1/1).
     */
    public static final Fraction ONE = new Fraction(1, 1);

    // the numerator and denominator components of this fraction.
    private final long numer, denom;

    /**
     * Construct a fraction from components already in canonical form.
     */
    Fraction(long numer, long denom) {
        this.numer = numer;
        this.denom = denom;
    }

    /**
     * Creates a fraction having the specified numerator and denominator,
     * reduced to lowest terms.
     *
     * @param numer the numerator component of the fraction.
     * @param denom the denominator component of the fraction.
     * @return the fraction.
     * @throws FractionException.InvalidFraction if {@code denom} is zero.
     * @throws FractionException.Overflow if the reduced fraction cannot be
     *         represented, e.g. {@code 1/Long.MIN_VALUE}.
     */
    public static Fraction valueOf(long numer, long denom) {
        try {
            return Normalizer.normalize(numer, denom);
        } catch (FractionException.Overflow ex) {
            return Normalizer.widen("valueOf", big(numer), big(denom));
        }
    }

    /**
     * Creates a fraction representing the given integer.
     *
     * @param val the integer value.
     * @return {@code val/1}
     */
    public static Fraction valueOf(long val) {
        if (val == 0)
            return ZERO;
        if (val == 1)
            return ONE;
        return new Fraction(val, 1);
    }

    /**
     * Creates a fraction from numerator and denominator given in
     * {@code BigInteger} type. The reduced components must fit in a
     * {@code long}.
     *
     * @throws FractionException.InvalidFraction if {@code denom} is zero.
     * @throws FractionException.Overflow if the reduced fraction cannot be
     *         represented.
     */
    public static Fraction valueOf(BigInteger numer, BigInteger denom) {
        return Normalizer.normalize("valueOf", numer, denom);
    }

    /**
     * Converts a double precision floating number into a fraction exactly,
     * without rounding.
     *
     * @param x a finite double value.
     * @return the fraction whose value is exactly {@code x}.
     * @throws FractionException.InvalidFraction if {@code x} is NaN or infinite.
     * @throws FractionException.Overflow if the exact value of {@code x}
     *         cannot be represented, e.g. {@code 1e300} or {@code Double.MIN_VALUE}.
     */
    public static Fraction valueOf(double x) {
        if (Double.isNaN(x) || Double.isInfinite(x))
            throw new FractionException.InvalidFraction(Double.toString(x));
        if (x == 0.0)
            return ZERO;

        // x = mantissa * 2^exponent
        long bits = Double.doubleToLongBits(x);
        int exponent = (int)((bits >>> 52) & 0x7ffL);
        long mantissa = bits & 0xfffffffffffffL;
        if (exponent == 0) {
            exponent = 1; // subnormal
        } else {
            mantissa |= 1L << 52;
        }
        exponent -= 1075;

        int zeros = Long.numberOfTrailingZeros(mantissa);
        mantissa >>= zeros;
        exponent += zeros;
        if (x < 0)
            mantissa = -mantissa;

        if (exponent >= 0)
            return Normalizer.normalize("valueOf", big(mantissa).shiftLeft(exponent), BigInteger.ONE);
        if (exponent < -62)
            throw new FractionException.Overflow("valueOf");
        return Normalizer.normalize(mantissa, 1L << -exponent);
    }

    /**
     * Parses a fraction literal of the form {@code <int>/<int>} or {@code <int>}.
     *
     * @param val the String representation of the fraction.
     * @return the fraction.
     * @throws FractionException.ParseError if the literal is malformed.
     */
    public static Fraction valueOf(String val) {
        return FractionFormat.parse(val, 10);
    }

    /**
     * Parses a fraction literal of the form {@code <int>/<int>} or {@code <int>}.
     *
     * @param val the String representation of the fraction.
     * @param radix radix to be used in interpreting {@code val}
     * @return the fraction.
     * @throws FractionException.ParseError if the literal is malformed.
     */
    public static Fraction valueOf(String val, int radix) {
        return FractionFormat.parse(val, radix);
    }

    private static BigInteger big(long val) {
        return BigInteger.valueOf(val);
    }

    /**
     * Returns the numerator of this fraction.
     *
     * @return the numerator of this fraction.
     */
    public long numerator() {
        return numer;
    }

    /**
     * Returns the denominator of this fraction, which is always positive.
     *
     * @return the denominator of this fraction.
     */
    public long denominator() {
        return denom;
    }

    /**
     * Returns the sum of this fraction with the one specified.
     *
     * @param that the fraction to be added.
     * @return {@code this + that}
     */
    public Fraction add(Fraction that) {
        try {
            return Normalizer.normalize(checkedAdd(checkedMultiply(this.numer, that.denom),
                                                   checkedMultiply(that.numer, this.denom)),
                                        checkedMultiply(this.denom, that.denom));
        } catch (ArithmeticException ex) {
            return Normalizer.widen("add",
                big(this.numer).multiply(big(that.denom)).add(big(that.numer).multiply(big(this.denom))),
                big(this.denom).multiply(big(that.denom)));
        }
    }

    /**
     * Returns the difference between this fraction and the one specified.
     *
     * @param that the fraction to be subtracted.
     * @return {@code this - that}
     */
    public Fraction subtract(Fraction that) {
        try {
            return Normalizer.normalize(checkedSubtract(checkedMultiply(this.numer, that.denom),
                                                        checkedMultiply(that.numer, this.denom)),
                                        checkedMultiply(this.denom, that.denom));
        } catch (ArithmeticException ex) {
            return Normalizer.widen("subtract",
                big(this.numer).multiply(big(that.denom)).subtract(big(that.numer).multiply(big(this.denom))),
                big(this.denom).multiply(big(that.denom)));
        }
    }

    /**
     * Returns the product of this fraction with the one specified.
     *
     * @param that the fraction multiplier.
     * @return {@code this * that}
     */
    public Fraction multiply(Fraction that) {
        try {
            return Normalizer.normalize(checkedMultiply(this.numer, that.numer),
                                        checkedMultiply(this.denom, that.denom));
        } catch (ArithmeticException ex) {
            return Normalizer.widen("multiply",
                big(this.numer).multiply(big(that.numer)),
                big(this.denom).multiply(big(that.denom)));
        }
    }

    /**
     * Returns this fraction divided by the one specified.
     *
     * @param that the fraction divisor.
     * @return {@code this / that}
     * @throws FractionException.DivisionByZero if {@code that} is zero.
     */
    public Fraction divide(Fraction that) {
        if (that.numer == 0)
            throw new FractionException.DivisionByZero(this);

        // the raw denominator takes the sign of the divisor
        try {
            return Normalizer.normalize(checkedMultiply(this.numer, that.denom),
                                        checkedMultiply(this.denom, that.numer));
        } catch (ArithmeticException ex) {
            return Normalizer.widen("divide",
                big(this.numer).multiply(big(that.denom)),
                big(this.denom).multiply(big(that.numer)));
        }
    }

    /**
     * Returns the negation of this fraction.
     *
     * @return {@code -this}
     * @throws FractionException.Overflow if the numerator is {@code Long.MIN_VALUE}.
     */
    public Fraction negate() {
        if (numer == Long.MIN_VALUE)
            throw new FractionException.Overflow("negate");
        return Normalizer.normalize(-numer, denom);
    }

    /**
     * Returns the reciprocal of this fraction.
     *
     * @return {@code 1/this}
     * @throws FractionException.DivisionByZero if this fraction is zero.
     * @throws FractionException.Overflow if the numerator is {@code Long.MIN_VALUE}.
     */
    public Fraction reciprocal() {
        if (numer == 0)
            throw new FractionException.DivisionByZero(ONE);
        return valueOf(denom, numer);
    }

    /**
     * Returns this fraction raised to the specified power. A negative
     * exponent raises the reciprocal.
     *
     * @param n the exponent.
     * @return {@code this^n}
     * @throws FractionException.DivisionByZero if this fraction is zero and
     *         {@code n} is negative.
     * @throws FractionException.Overflow if the result cannot be represented.
     */
    public Fraction pow(int n) {
        if (n < 0) {
            Fraction r = reciprocal();
            if (n == Integer.MIN_VALUE)
                return r.pow(Integer.MAX_VALUE).multiply(r);
            return r.pow(-n);
        }

        long a, b;
        try {
            a = LongMath.checkedPow(numer, n);
            b = LongMath.checkedPow(denom, n);
        } catch (ArithmeticException ex) {
            throw new FractionException.Overflow("pow", ex);
        }
        return Normalizer.normalize(a, b);
    }

    /**
     * Returns the signum of this fraction.
     *
     * @return -1, 0, or 1 as the value of this fraction is negative,
     *         zero or positive.
     */
    public int signum() {
        return Long.signum(numer);
    }

    /**
     * Returns the absolute value of this fraction.
     *
     * @return {@code abs(this)}
     * @throws FractionException.Overflow if the numerator is {@code Long.MIN_VALUE}.
     */
    public Fraction abs() {
        return numer >= 0 ? this : negate();
    }

    /**
     * Returns {@code true} if this fraction is proper, i.e. the absolute
     * value of its numerator is lower than its denominator.
     */
    public boolean isProper() {
        return numer != Long.MIN_VALUE && Math.abs(numer) < denom;
    }

    /**
     * Returns {@code true} if this fraction represents an integer.
     */
    public boolean isInteger() {
        return denom == 1;
    }

    /**
     * Returns the minimum of this fraction and the one specified.
     */
    public Fraction min(Fraction that) {
        return compareTo(that) <= 0 ? this : that;
    }

    /**
     * Returns the maximum of this fraction and the one specified.
     */
    public Fraction max(Fraction that) {
        return compareTo(that) >= 0 ? this : that;
    }

    /**
     * Converts this fraction to a {@code long}, failing if this fraction
     * is not an integer.
     *
     * @return the integer value of this fraction.
     * @throws FractionException.NotIntegral if the denominator is not one.
     */
    public long longValueExact() {
        if (denom != 1)
            throw new FractionException.NotIntegral(this);
        return numer;
    }

    /**
     * Converts this fraction to an {@code int}, failing if this fraction
     * is not an integer or is out of the range of {@code int}.
     *
     * @return the integer value of this fraction.
     * @throws FractionException.NotIntegral if the denominator is not one.
     * @throws FractionException.Overflow if the value does not fit in an {@code int}.
     */
    public int intValueExact() {
        long val = longValueExact();
        if ((int)val != val)
            throw new FractionException.Overflow("intValueExact");
        return (int)val;
    }

    /**
     * Converts this fraction to a {@code long} using the specified rounding
     * mode.
     *
     * @param mode the rounding mode.
     * @return this fraction rounded to an integer.
     * @throws FractionException.NotIntegral if {@code mode} is
     *         {@link RoundingMode#UNNECESSARY} and this fraction is not an integer.
     */
    public long toLong(RoundingMode mode) {
        if (mode == RoundingMode.UNNECESSARY)
            return longValueExact();
        return LongMath.divide(numer, denom, mode);
    }

    /**
     * Converts this fraction to a {@code long}. The fraction part is
     * truncated toward zero.
     *
     * @return this fraction converted to a {@code long}.
     */
    @Override
    public long longValue() {
        return numer / denom;
    }

    /**
     * Converts this fraction to an {@code int}. The fraction part is
     * truncated toward zero and if the result is too big to fit in an
     * {@code int}, only the low-order 32 bits are returned.
     *
     * @return this fraction converted to an {@code int}.
     */
    @Override
    public int intValue() {
        return (int)longValue();
    }

    /**
     * Converts this fraction to a {@code double} by floating division of
     * the numerator by the denominator. This conversion is an approximation
     * and can lose information about the precision of the fraction.
     *
     * @return this fraction converted to a {@code double}.
     */
    @Override
    public double doubleValue() {
        return (double)numer / (double)denom;
    }

    /**
     * Converts this fraction to a {@code float}. This conversion is an
     * approximation and can lose information about the precision of the
     * fraction.
     *
     * @return this fraction converted to a {@code float}.
     */
    @Override
    public float floatValue() {
        return (float)doubleValue();
    }

    /**
     * Converts this fraction to a {@code BigDecimal} rounded according to
     * the given context.
     *
     * @param mc the MathContext used for division.
     * @return this fraction converted to a {@code BigDecimal}.
     * @throws ArithmeticException if {@code mc} requests unlimited precision
     *         and the decimal expansion does not terminate.
     */
    public BigDecimal toBigDecimal(MathContext mc) {
        return new BigDecimal(numer).divide(new BigDecimal(denom), mc);
    }

    /**
     * Compares this fraction with the specified one. The comparison is exact
     * and never overflows.
     *
     * @param that Fraction to which this Fraction is to be compared.
     * @return -1, 0 or 1 as this Fraction is numerically less than, equal
     *         to, or greater than {@code that}.
     */
    @Override
    public int compareTo(Fraction that) {
        if (this.denom == that.denom)
            return Long.compare(this.numer, that.numer);
        if (this.signum() != that.signum())
            return Integer.compare(this.signum(), that.signum());

        try {
            return Long.compare(checkedMultiply(this.numer, that.denom),
                                checkedMultiply(that.numer, this.denom));
        } catch (ArithmeticException ex) {
            return big(this.numer).multiply(big(that.denom)).compareTo(
                   big(that.numer).multiply(big(this.denom)));
        }
    }

    /**
     * Compares this fraction with the specified Object for equality.
     *
     * @param obj Object to which this fraction is to be compared.
     * @return {@code true} if and only if the specified Object is a
     *         Fraction whose value is numerically equal to this Fraction.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (obj instanceof Fraction) {
            Fraction that = (Fraction)obj;
            return this.numer == that.numer && this.denom == that.denom;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(numer) + Long.hashCode(denom);
    }

    /**
     * Returns the String representation of this fraction, in the form
     * {@code numerator/denominator}, or the bare numerator if this
     * fraction is an integer.
     */
    @Override
    public String toString() {
        return FractionFormat.format(this, 10);
    }

    /**
     * Returns the String representation of this fraction in the given radix.
     */
    public String toString(int radix) {
        return FractionFormat.format(this, radix);
    }

    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        if (!Normalizer.isCanonical(numer, denom))
            throw new InvalidObjectException("fraction not in canonical form: " + numer + "/" + denom);
    }
}
