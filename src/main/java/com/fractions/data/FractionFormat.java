/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.fractions.data;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.fractions.data.FractionException.ParseError;

/**
 * Reads and writes fraction literals of the form {@code <int>/<int>} or
 * {@code <int>}.
 */
final class FractionFormat {
    private static final Pattern LITERAL = Pattern.compile("([+-]?\\p{Alnum}+)(?:/([+-]?\\p{Alnum}+))?");

    private FractionFormat() {}

    static Fraction parse(String val, int radix) {
        checkNotNull(val, "val");
        checkRadix(radix);

        Matcher m = LITERAL.matcher(val);
        if (!m.matches())
            throw new ParseError(ParseError.Kind.INCORRECT_FORM, val);

        long numer = parseLong(m.group(1), radix, val);
        if (m.group(2) == null)
            return Fraction.valueOf(numer);

        long denom = parseLong(m.group(2), radix, val);
        if (denom == 0)
            throw new ParseError(ParseError.Kind.ZERO_DENOMINATOR, val);
        return Fraction.valueOf(numer, denom);
    }

    private static long parseLong(String digits, int radix, String input) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException ex) {
            throw new ParseError(ParseError.Kind.NUMBER_FORMAT, input, ex);
        }
    }

    static String format(Fraction x, int radix) {
        checkRadix(radix);
        if (x.denominator() == 1) {
            return Long.toString(x.numerator(), radix);
        } else {
            return Long.toString(x.numerator(), radix) +
                   "/" +
                   Long.toString(x.denominator(), radix);
        }
    }

    private static void checkRadix(int radix) {
        checkArgument(radix >= Character.MIN_RADIX && radix <= Character.MAX_RADIX,
                      "radix %s out of range", radix);
    }
}
