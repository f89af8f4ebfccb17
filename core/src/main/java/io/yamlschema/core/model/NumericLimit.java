package io.yamlschema.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An inclusive or exclusive numeric bound, shared by the integer and real node types.
 *
 * @param value     the bound itself
 * @param exclusive {@code true} if the bound value is not itself admitted
 * @param <T>       {@link Long} for integers, {@link Double} for reals
 */
public record NumericLimit<T extends Number & Comparable<T>>(T value, boolean exclusive) {

    /** Smallest step between two distinct integers. */
    public static final BigDecimal INTEGER_UNIT = BigDecimal.ONE;

    /** Smallest representable positive double. */
    public static final BigDecimal REAL_UNIT = new BigDecimal(Double.MIN_VALUE);

    public NumericLimit {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static <T extends Number & Comparable<T>> NumericLimit<T> inclusive(T value) {
        return new NumericLimit<>(value, false);
    }

    public static <T extends Number & Comparable<T>> NumericLimit<T> exclusive(T value) {
        return new NumericLimit<>(value, true);
    }

    /** Returns {@code true} if {@code candidate} lies on the admitted side of this lower bound. */
    public boolean admitsAbove(T candidate) {
        if (isNaN(candidate)) {
            return false;
        }
        int cmp = compareToValue(candidate);
        return exclusive ? cmp > 0 : cmp >= 0;
    }

    /** Returns {@code true} if {@code candidate} lies on the admitted side of this upper bound. */
    public boolean admitsBelow(T candidate) {
        if (isNaN(candidate)) {
            return false;
        }
        int cmp = compareToValue(candidate);
        return exclusive ? cmp < 0 : cmp <= 0;
    }

    // Numeric order: -0.0 and 0.0 are equal, unlike Double.compareTo.
    private int compareToValue(T candidate) {
        if (isIntegral(candidate) && isIntegral(value)) {
            return Long.compare(candidate.longValue(), value.longValue());
        }
        return Double.compare(candidate.doubleValue() + 0.0, value.doubleValue() + 0.0);
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer;
    }

    private static boolean isNaN(Number number) {
        return !isIntegral(number) && Double.isNaN(number.doubleValue());
    }

    /**
     * Decides whether a lower/upper pair leaves any room for a value. Inclusive-inclusive and mixed
     * pairs need {@code upper - lower >= 0}; exclusive-exclusive pairs need the span to exceed
     * {@code unit}.
     *
     * @param lower the lower bound
     * @param upper the upper bound
     * @param unit  {@link #INTEGER_UNIT} or {@link #REAL_UNIT}
     */
    public static <T extends Number & Comparable<T>> boolean describesRange(
            NumericLimit<T> lower, NumericLimit<T> upper, BigDecimal unit) {
        BigDecimal span = decimal(upper.value()).subtract(decimal(lower.value()));
        if (lower.exclusive() && upper.exclusive()) {
            return span.compareTo(unit) > 0;
        }
        return span.signum() >= 0;
    }

    private static BigDecimal decimal(Number number) {
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.doubleValue());
    }
}
