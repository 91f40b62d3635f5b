package org.pragmatica.pascal.value;

import org.pragmatica.pascal.error.PascalError;

import java.util.function.LongSupplier;

/**
 * Numeric value with integer or real representation.
 * Any operation mixing the two promotes to real.
 */
public sealed interface Numeric {

    Numeric ZERO = new IntegerNumber(0);

    static Numeric of(long value) {
        return new IntegerNumber(value);
    }

    static Numeric of(double value) {
        return new RealNumber(value);
    }

    double asDouble();

    boolean isInteger();

    Numeric negate();

    /**
     * Textual form used by the notation translators.
     */
    String render();

    default Numeric add(Numeric other) {
        if (isInteger() && other.isInteger()) {
            return of(exact(() -> Math.addExact(asLong(), other.asLong()), "addition"));
        }
        return of(asDouble() + other.asDouble());
    }

    default Numeric subtract(Numeric other) {
        if (isInteger() && other.isInteger()) {
            return of(exact(() -> Math.subtractExact(asLong(), other.asLong()), "subtraction"));
        }
        return of(asDouble() - other.asDouble());
    }

    default Numeric multiply(Numeric other) {
        if (isInteger() && other.isInteger()) {
            return of(exact(() -> Math.multiplyExact(asLong(), other.asLong()), "multiplication"));
        }
        return of(asDouble() * other.asDouble());
    }

    /**
     * Pascal {@code div}: quotient truncated toward zero.
     * Integer operands give an integer, anything else a truncated real.
     */
    default Numeric integerDivide(Numeric other) {
        if (other.isZero()) {
            throw new PascalError.ArithmeticError("Division by zero");
        }
        if (isInteger() && other.isInteger()) {
            if (asLong() == Long.MIN_VALUE && other.asLong() == -1) {
                throw new PascalError.ArithmeticError("Integer overflow in division");
            }
            return of(asLong() / other.asLong());
        }
        var quotient = asDouble() / other.asDouble();
        return of(quotient < 0
                  ? Math.ceil(quotient)
                  : Math.floor(quotient));
    }

    /**
     * Pascal {@code /}: always a real quotient.
     */
    default Numeric floatDivide(Numeric other) {
        if (other.isZero()) {
            throw new PascalError.ArithmeticError("Division by zero");
        }
        return of(asDouble() / other.asDouble());
    }

    private long asLong() {
        return ((IntegerNumber) this).value();
    }

    private boolean isZero() {
        return asDouble() == 0.0;
    }

    private static long exact(LongSupplier operation, String what) {
        try {
            return operation.getAsLong();
        } catch (ArithmeticException e) {
            throw new PascalError.ArithmeticError("Integer overflow in " + what);
        }
    }

    record IntegerNumber(long value) implements Numeric {
        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean isInteger() {
            return true;
        }

        @Override
        public Numeric negate() {
            if (value == Long.MIN_VALUE) {
                throw new PascalError.ArithmeticError("Integer overflow in negation");
            }
            return Numeric.of(-value);
        }

        @Override
        public String render() {
            return Long.toString(value);
        }

        @Override
        public String toString() {
            return render();
        }
    }

    record RealNumber(double value) implements Numeric {
        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean isInteger() {
            return false;
        }

        @Override
        public Numeric negate() {
            return Numeric.of(-value);
        }

        @Override
        public String render() {
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return render();
        }
    }
}
