/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.fractions.data;

import java.math.BigInteger;
import java.util.logging.Logger;

/**
 * Reduces numerator/denominator pairs to the canonical form of a
 * {@link Fraction}: the denominator is positive, numerator and denominator
 * are coprime, and zero is always {@code 0/1}. Every computed fraction
 * passes through here; only integers ({@code k/1}) are built directly.
 */
final class Normalizer {
    private static final Logger logger = Logger.getLogger(Normalizer.class.getName());

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Normalizer() {}

    /**
     * Normalize a numerator/denominator pair in {@code long} arithmetic.
     *
     * @throws FractionException.InvalidFraction if the denominator is zero
     * @throws FractionException.Overflow if moving the sign to the numerator
     *         requires negating {@code Long.MIN_VALUE}
     */
    static Fraction normalize(long numer, long denom) {
        if (denom == 0)
            throw new FractionException.InvalidFraction(numer + "/0");

        if (denom < 0) {
            if (numer == Long.MIN_VALUE || denom == Long.MIN_VALUE)
                throw new FractionException.Overflow("normalize");
            numer = -numer;
            denom = -denom;
        }

        if (numer == 0)
            return Fraction.ZERO;

        long g = gcd(numer, denom);
        if (g != 1) {
            numer /= g;
            denom /= g;
        }

        return new Fraction(numer, denom);
    }

    /**
     * Normalize a numerator/denominator pair in {@code BigInteger} arithmetic
     * and narrow the reduced result to {@code long} components.
     *
     * @param operation the operation name reported on overflow
     * @throws FractionException.InvalidFraction if the denominator is zero
     * @throws FractionException.Overflow if the reduced numerator or
     *         denominator does not fit in a {@code long}
     */
    static Fraction normalize(String operation, BigInteger numer, BigInteger denom) {
        if (denom.signum() == 0)
            throw new FractionException.InvalidFraction(numer + "/0");

        if (denom.signum() < 0) {
            numer = numer.negate();
            denom = denom.negate();
        }

        if (numer.signum() == 0)
            return Fraction.ZERO;

        BigInteger g = numer.gcd(denom);
        if (!g.equals(BigInteger.ONE)) {
            numer = numer.divide(g);
            denom = denom.divide(g);
        }

        if (numer.compareTo(LONG_MIN) < 0 || numer.compareTo(LONG_MAX) > 0 || denom.compareTo(LONG_MAX) > 0)
            throw new FractionException.Overflow(operation);
        return new Fraction(numer.longValue(), denom.longValue());
    }

    /**
     * Retry an operation whose {@code long} computation overflowed, using
     * the operands widened to {@code BigInteger}.
     */
    static Fraction widen(String operation, BigInteger numer, BigInteger denom) {
        logger.finer(() -> operation + ": long arithmetic overflowed, retrying with BigInteger");
        return normalize(operation, numer, denom);
    }

    /**
     * Returns true if the given pair already satisfies the canonical form.
     */
    static boolean isCanonical(long numer, long denom) {
        if (denom <= 0)
            return false;
        if (numer == 0)
            return denom == 1;
        return gcd(numer, denom) == 1;
    }

    /**
     * Euclid's algorithm. The denominator must be positive; the numerator
     * may be any value including {@code Long.MIN_VALUE}, whose magnitude is
     * first reduced modulo the denominator.
     */
    private static long gcd(long numer, long denom) {
        long m = denom;
        long n = Math.abs(numer % denom);

        long r;
        while (n > 0) {
            r = m % n;
            m = n;
            n = r;
        }
        return m;
    }
}
