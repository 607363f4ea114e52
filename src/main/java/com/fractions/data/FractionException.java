/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.fractions.data;

/**
 * The base class of all failures raised by {@link Fraction} operations.
 * Catch this class to handle every kind of failure uniformly, or catch
 * one of the nested subclasses to handle a specific kind.
 */
@SuppressWarnings("serial")
public class FractionException extends ArithmeticException {
    public FractionException(String message) {
        super(message);
    }

    protected FractionException() {
    }

    @Override
    public String getMessage() {
        return getRawMessage();
    }

    protected String getRawMessage() {
        return super.getMessage();
    }

    /**
     * Raised when a fraction would be constructed with a zero denominator,
     * or from a value that has no rational representation.
     */
    public static class InvalidFraction extends FractionException {
        public final String value;

        public InvalidFraction(String value) {
            this.value = value;
        }

        @Override
        protected String getRawMessage() {
            return "invalid fraction: " + value;
        }
    }

    /**
     * Raised when dividing by a zero fraction.
     */
    public static class DivisionByZero extends FractionException {
        public final Fraction dividend;

        public DivisionByZero(Fraction dividend) {
            this.dividend = dividend;
        }

        @Override
        protected String getRawMessage() {
            return "division by zero: " + dividend + " / 0";
        }
    }

    /**
     * Raised when the exact result of an operation cannot be represented
     * with {@code long} numerator and denominator.
     */
    public static class Overflow extends FractionException {
        public final String operation;

        public Overflow(String operation) {
            this.operation = operation;
        }

        public Overflow(String operation, Throwable cause) {
            this.operation = operation;
            initCause(cause);
        }

        @Override
        protected String getRawMessage() {
            return "long overflow in " + operation;
        }
    }

    /**
     * Raised when an exact integer conversion is requested for a fraction
     * whose denominator is not one.
     */
    public static class NotIntegral extends FractionException {
        public final Fraction value;

        public NotIntegral(Fraction value) {
            this.value = value;
        }

        @Override
        protected String getRawMessage() {
            return "not an integer: " + value;
        }
    }

    /**
     * Raised when a fraction literal cannot be parsed.
     */
    public static class ParseError extends FractionException {
        public enum Kind {
            /** The text is not of the form {@code <int>} or {@code <int>/<int>}. */
            INCORRECT_FORM,
            /** The literal is well formed but its denominator is zero. */
            ZERO_DENOMINATOR,
            /** One of the integer parts is not a valid {@code long}. */
            NUMBER_FORMAT
        }

        public final Kind kind;
        public final String input;

        public ParseError(Kind kind, String input) {
            this.kind = kind;
            this.input = input;
        }

        public ParseError(Kind kind, String input, Throwable cause) {
            this(kind, input);
            initCause(cause);
        }

        @Override
        protected String getRawMessage() {
            switch (kind) {
              case INCORRECT_FORM:
                return "incorrectly formed fraction (expected <N>/<D>): \"" + input + "\"";
              case ZERO_DENOMINATOR:
                return "fraction denominator cannot be zero: \"" + input + "\"";
              default:
                Throwable cause = getCause();
                return cause == null
                    ? "error when parsing fraction \"" + input + "\""
                    : "error when parsing fraction \"" + input + "\": " + cause.getMessage();
            }
        }
    }
}
