/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.range;

import lombok.Getter;
import lombok.NonNull;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * A variable-length counter in a fixed base, i.e. an odometer that grows a digit instead of wrapping around.
 * <p>
 * Incrementing adds one to the least significant digit and carries as usual. When the most significant digit
 * overflows, every digit becomes 0 and one more 0 is prepended:
 * <pre>
 *     base 2: [0, 0] -> [0, 1] -> [1, 0] -> [1, 1] -> [0, 0, 0]
 * </pre>
 * so that over the alphabet {@code a-z}, the word after {@code zz} is {@code aaa}.
 * <p>
 * Counters order by digit count first and by value second. Only counters of the same base can be compared, which
 * keeps the ordering consistent with {@link #equals}. Not thread-safe.
 */
public class PositionalCounter implements Comparable<PositionalCounter> {
    @Getter
    private final int base;
    // Least significant digit first
    private int[] digits;

    /**
     * @param digits the initial digits, most significant first
     * @param base   the base to count in, at least 1
     */
    public PositionalCounter(@NonNull int[] digits, int base) {
        if(digits.length == 0) {
            throw new IllegalArgumentException("List of digits must not be empty");
        }
        if(base < 1) {
            throw new IllegalArgumentException("Expected a positive base, got " + base);
        }
        this.base = base;
        this.digits = new int[digits.length];
        for(int i = 0; i < digits.length; i++) {
            int digit = digits[digits.length - 1 - i];
            if(digit < 0 || digit >= base) {
                throw new IllegalArgumentException("Digit " + digit + " is not in [0, " + base + ")");
            }
            this.digits[i] = digit;
        }
    }

    /**
     * Creates the counter with exactly {@code digitCount} digits whose value is {@code value}.
     */
    public static PositionalCounter of(@NonNull BigInteger value, int digitCount, int base) {
        if(digitCount < 1) {
            throw new IllegalArgumentException("List of digits must not be empty");
        }
        if(base < 1) {
            throw new IllegalArgumentException("Expected a positive base, got " + base);
        }
        if(value.signum() < 0 || value.compareTo(BigInteger.valueOf(base).pow(digitCount)) >= 0) {
            throw new IllegalArgumentException("Value " + value + " does not fit in " + digitCount
                    + " digits of base " + base);
        }
        int[] mostSignificantFirst = new int[digitCount];
        BigInteger bigBase = BigInteger.valueOf(base);
        BigInteger remaining = value;
        for(int i = digitCount - 1; i >= 0 && remaining.signum() > 0; i--) {
            BigInteger[] quotientAndRemainder = remaining.divideAndRemainder(bigBase);
            mostSignificantFirst[i] = quotientAndRemainder[1].intValueExact();
            remaining = quotientAndRemainder[0];
        }
        return new PositionalCounter(mostSignificantFirst, base);
    }

    public int digitCount() {
        return digits.length;
    }

    /**
     * Returns a digit, counting from the most significant one at position 0.
     */
    public int digitAt(int position) {
        if(position < 0 || position >= digits.length) {
            throw new IndexOutOfBoundsException("Position " + position + " is out of range for "
                    + digits.length + " digits");
        }
        return digits[digits.length - 1 - position];
    }

    /**
     * The digits, most significant first.
     */
    public int[] getDigits() {
        int[] result = new int[digits.length];
        for(int i = 0; i < digits.length; i++) {
            result[i] = digits[digits.length - 1 - i];
        }
        return result;
    }

    /**
     * The value of the digits read as a base-{@link #getBase()} integer. Leading zeros do not count, so
     * {@code [0, 1]} and {@code [1]} share a value; only {@link #compareTo} tells them apart.
     */
    public BigInteger toBigInteger() {
        BigInteger bigBase = BigInteger.valueOf(base);
        BigInteger total = BigInteger.ZERO;
        for(int i = digits.length - 1; i >= 0; i--) {
            total = total.multiply(bigBase).add(BigInteger.valueOf(digits[i]));
        }
        return total;
    }

    /**
     * Advances the counter by one, growing it by one digit if every digit was {@code base - 1}.
     *
     * @return this counter
     */
    public PositionalCounter increment() {
        for(int i = 0; i < digits.length; i++) {
            digits[i]++;
            if(digits[i] < base) {
                return this;
            }
            digits[i] = 0;
        }
        // All digits were reset to 0
        digits = new int[digits.length + 1];
        return this;
    }

    public PositionalCounter copy() {
        return new PositionalCounter(getDigits(), base);
    }

    /**
     * @throws IllegalArgumentException if {@code other} counts in a different base
     */
    @Override
    public int compareTo(PositionalCounter other) {
        if(other.base != base) {
            throw new IllegalArgumentException("Cannot compare counters of base " + base + " and " + other.base);
        }
        if(digits.length != other.digits.length) {
            return Integer.compare(digits.length, other.digits.length);
        }
        for(int i = digits.length - 1; i >= 0; i--) {
            if(digits[i] != other.digits[i]) {
                return Integer.compare(digits[i], other.digits[i]);
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PositionalCounter
                && ((PositionalCounter) other).base == base
                && Arrays.equals(((PositionalCounter) other).digits, digits);
    }

    @Override
    public int hashCode() {
        return 31 * base + Arrays.hashCode(digits);
    }

    @Override
    public String toString() {
        return "PositionalCounter(" + Arrays.toString(getDigits()) + ", base = " + base + ")";
    }
}
