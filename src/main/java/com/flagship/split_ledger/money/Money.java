package com.flagship.split_ledger.money;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Signed amount of indivisible base units (wei-like).
 *
 * All ledger arithmetic goes through this type. There is no floating point anywhere:
 * decimal display strings are converted once, at the boundary, by {@link #parse(String, int)}
 * and rejected when they carry more precision than the base unit allows.
 *
 * Instances are immutable.
 */
public final class Money implements Comparable<Money> {

    public static final Money ZERO = new Money(BigInteger.ZERO);

    private final BigInteger units;

    private Money(BigInteger units) {
        this.units = units;
    }

    public static Money ofUnits(BigInteger units) {
        Objects.requireNonNull(units, "units");
        return units.signum() == 0 ? ZERO : new Money(units);
    }

    public static Money ofUnits(long units) {
        return ofUnits(BigInteger.valueOf(units));
    }

    /**
     * Parses a plain base-unit integer string such as {@code "150000000000000000"}.
     *
     * @throws InvalidAmountException if the text is not an integer
     */
    public static Money parseUnits(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidAmountException("Amount is required");
        }
        try {
            return ofUnits(new BigInteger(text.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Amount is not an integer number of base units: " + text);
        }
    }

    /**
     * Converts a decimal display amount into base units, e.g. {@code parse("0.15", 18)}.
     *
     * @param decimals number of decimal places one whole unit is divided into
     * @throws InvalidAmountException if the text is malformed or finer than one base unit
     */
    public static Money parse(String text, int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative");
        }
        if (text == null || text.isBlank()) {
            throw new InvalidAmountException("Amount is required");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Malformed decimal amount: " + text);
        }
        BigDecimal scaled = value.movePointRight(decimals);
        try {
            return ofUnits(scaled.toBigIntegerExact());
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(
                String.format("Amount %s has more than %d decimal places", text, decimals));
        }
    }

    public BigInteger units() {
        return units;
    }

    public Money plus(Money other) {
        return ofUnits(units.add(other.units));
    }

    public Money minus(Money other) {
        return ofUnits(units.subtract(other.units));
    }

    public Money negate() {
        return ofUnits(units.negate());
    }

    public Money abs() {
        return units.signum() < 0 ? negate() : this;
    }

    public Money times(int factor) {
        return ofUnits(units.multiply(BigInteger.valueOf(factor)));
    }

    /**
     * Floor division by a positive count. Only defined for non-negative amounts, which is the
     * only way the ledger splits money.
     */
    public Money divideFloor(int parts) {
        requireSplittable(parts);
        return ofUnits(units.divide(BigInteger.valueOf(parts)));
    }

    /**
     * The part of this amount that {@link #divideFloor(int)} leaves undistributed.
     * Always in {@code [0, parts)}.
     */
    public Money remainder(int parts) {
        requireSplittable(parts);
        return ofUnits(units.mod(BigInteger.valueOf(parts)));
    }

    public static Money min(Money a, Money b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public int signum() {
        return units.signum();
    }

    public boolean isPositive() {
        return units.signum() > 0;
    }

    public boolean isNegative() {
        return units.signum() < 0;
    }

    public boolean isZero() {
        return units.signum() == 0;
    }

    /**
     * Returns this amount if it is strictly positive.
     *
     * @throws InvalidAmountException otherwise
     */
    public Money requirePositive() {
        if (!isPositive()) {
            throw new InvalidAmountException("Amount must be positive, got " + units);
        }
        return this;
    }

    private void requireSplittable(int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("Cannot split into " + parts + " parts");
        }
        if (units.signum() < 0) {
            throw new IllegalStateException("Cannot split a negative amount: " + units);
        }
    }

    @Override
    public int compareTo(Money other) {
        return units.compareTo(other.units);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money)) {
            return false;
        }
        return units.equals(((Money) o).units);
    }

    @Override
    public int hashCode() {
        return units.hashCode();
    }

    /**
     * Base units as a plain integer string; the wire format for amounts.
     */
    @Override
    public String toString() {
        return units.toString();
    }
}
