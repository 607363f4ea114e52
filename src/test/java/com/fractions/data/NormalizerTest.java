/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.fractions.data;

import java.math.BigInteger;
import java.util.Random;

import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NormalizerTest {
    private static final BigInteger TWO = BigInteger.valueOf(2);

    @Test
    public void reducesToLowestTerms() {
        assertComponents(9, 256, Normalizer.normalize(18, 512));
        assertComponents(3, 2, Normalizer.normalize(-6, -4));
        assertComponents(7, 1, Normalizer.normalize(21, 3));
    }

    @Test
    public void movesSignToNumerator() {
        assertComponents(-1, 5, Normalizer.normalize(1, -5));
        assertComponents(-2, 3, Normalizer.normalize(4, -6));
    }

    @Test
    public void zeroIsCanonical() {
        assertSame(Fraction.ZERO, Normalizer.normalize(0, 1));
        assertSame(Fraction.ZERO, Normalizer.normalize(0, -7));
        assertSame(Fraction.ZERO, Normalizer.normalize(0, Long.MAX_VALUE));
    }

    @Test
    public void reducesMinimumLong() {
        assertComponents(Long.MIN_VALUE, 1, Normalizer.normalize(Long.MIN_VALUE, 1));
        assertComponents(-(1L << 62), 1, Normalizer.normalize(Long.MIN_VALUE, 2));
        assertComponents(Long.MIN_VALUE, 3, Normalizer.normalize(Long.MIN_VALUE, 3));
        assertComponents(-2, 1, Normalizer.normalize(Long.MIN_VALUE, 1L << 62));
    }

    @Test
    public void signMigrationOverflows() {
        overflow(() -> Normalizer.normalize(1, Long.MIN_VALUE));
        overflow(() -> Normalizer.normalize(Long.MIN_VALUE, -1));
    }

    @Test(expected = FractionException.InvalidFraction.class)
    public void zeroDenominator() {
        Normalizer.normalize(5, 0);
    }

    @Test(expected = FractionException.InvalidFraction.class)
    public void zeroDenominatorWidened() {
        Normalizer.normalize("test", BigInteger.ONE, BigInteger.ZERO);
    }

    @Test
    public void widenedNormalization() {
        BigInteger min = BigInteger.valueOf(Long.MIN_VALUE);

        assertComponents(-1, 1L << 62, Normalizer.normalize("test", TWO, min));
        assertComponents(Long.MAX_VALUE, 1, Normalizer.normalize("test", min.negate().subtract(BigInteger.ONE), BigInteger.ONE));
        assertSame(Fraction.ZERO, Normalizer.normalize("test", BigInteger.ZERO, min));

        try {
            Normalizer.normalize("test", TWO.pow(64), TWO);
            fail("Overflow was not thrown");
        } catch (FractionException.Overflow ex) {
            assertEquals("test", ex.operation);
        }

        overflow(() -> Normalizer.normalize("test", BigInteger.ONE, min));
        overflow(() -> Normalizer.widen("test", BigInteger.ONE, TWO.pow(63)));
    }

    @Test
    public void canonicalCheck() {
        assertTrue(Normalizer.isCanonical(0, 1));
        assertTrue(Normalizer.isCanonical(-3, 4));
        assertTrue(Normalizer.isCanonical(Long.MIN_VALUE, Long.MAX_VALUE));
        assertFalse(Normalizer.isCanonical(0, 2));
        assertFalse(Normalizer.isCanonical(2, 4));
        assertFalse(Normalizer.isCanonical(1, -2));
        assertFalse(Normalizer.isCanonical(1, 0));
    }

    @Test
    public void canonicalFormAndIdempotence() {
        Random rnd = new Random(8675309);
        for (int i = 0; i < 10000; i++) {
            long n = randomLong(rnd);
            long d = randomLong(rnd);
            if (d == 0 || d == Long.MIN_VALUE || (d < 0 && n == Long.MIN_VALUE))
                continue;

            Fraction f = Normalizer.normalize(n, d);
            assertTrue(f.denominator() > 0);
            if (f.numerator() == 0) {
                assertEquals(1, f.denominator());
            } else {
                assertEquals(BigInteger.ONE, BigInteger.valueOf(f.numerator()).gcd(BigInteger.valueOf(f.denominator())));
            }

            // the reduced pair denotes the same value
            assertEquals(BigInteger.valueOf(n).multiply(BigInteger.valueOf(f.denominator())),
                         BigInteger.valueOf(d).multiply(BigInteger.valueOf(f.numerator())));

            assertEquals(f, Normalizer.normalize(f.numerator(), f.denominator()));
        }
    }

    static long randomLong(Random rnd) {
        // spread magnitudes so that small values with common factors are frequent
        return rnd.nextLong() >> rnd.nextInt(64);
    }

    static void assertComponents(long numer, long denom, Fraction f) {
        assertEquals(numer, f.numerator());
        assertEquals(denom, f.denominator());
    }

    static void overflow(Runnable action) {
        try {
            action.run();
            fail("Overflow was not thrown");
        } catch (FractionException.Overflow ex) {
            // ok
        }
    }
}
