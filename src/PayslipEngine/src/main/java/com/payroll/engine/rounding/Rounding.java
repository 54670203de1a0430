package com.payroll.engine.rounding;

import java.util.Objects;

public final class Rounding {

    private Rounding() {}

    /**
     * Round an amount to a multiple of {@code precision} cents.
     * A precision of 1 rounds to the cent, 5 to the nearest five cents, 100 to the dollar.
     *
     * @throws IllegalArgumentException if precision is below 1
     */
    public static long round(double amount, RoundingMode mode, long precision) {
        Objects.requireNonNull(mode, "rounding mode");
        if (precision < 1) {
            throw new IllegalArgumentException("Rounding precision must be at least 1, was " + precision);
        }
        double scaled = amount / precision;
        double units = switch (mode) {
            case FLOOR -> Math.floor(scaled);
            case CEIL -> Math.ceil(scaled);
            case BANKER -> halfEven(scaled);
            case NEAREST -> halfAwayFromZero(scaled);
        };
        return (long) units * precision;
    }

    /** Round to the cent with {@link RoundingMode#NEAREST}. */
    public static long toCents(double amount) {
        return round(amount, RoundingMode.NEAREST, 1);
    }

    private static double halfAwayFromZero(double value) {
        double abs = Math.abs(value);
        double floor = Math.floor(abs);
        return Math.signum(value) * (abs - floor >= 0.5 ? floor + 1 : floor);
    }

    // Ties go to even only on an exact .5 fraction; anything else rounds as NEAREST.
    private static double halfEven(double value) {
        double floor = Math.floor(value);
        if (value - floor == 0.5) {
            return floor % 2 == 0 ? floor : floor + 1;
        }
        return halfAwayFromZero(value);
    }
}
