package com.example.librarysync.common.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Geometric mean over duration products that do not fit in a long. Partial products travel as
 * decimal strings between tasks; they are multiplied exactly and the root is taken with a
 * 64 significant digit context.
 */
public final class GeometricMeanUtil {

    public static final MathContext ROOT_CONTEXT = new MathContext(64, RoundingMode.HALF_EVEN);

    private static final int MAX_NEWTON_ITERATIONS = 200;
    private static final double LOG10_2 = Math.log10(2);

    private GeometricMeanUtil() {
    }

    public static BigInteger multiply(Collection<String> partialProducts) {
        BigInteger product = BigInteger.ONE;
        if (partialProducts == null) {
            return product;
        }
        for (String partial : partialProducts) {
            product = product.multiply(new BigInteger(partial.trim()));
        }
        return product;
    }

    /**
     * Returns {@code product ^ (1 / count)} rounded half-even to an integer. A count of zero or
     * less yields 0 without touching the product.
     */
    public static long roundedMean(BigInteger product, long count) {
        if (count <= 0) {
            return 0L;
        }
        if (product.signum() <= 0) {
            throw new IllegalArgumentException("Duration product must be positive: " + product);
        }
        if (count == 1) {
            return product.longValueExact();
        }
        return nthRoot(new BigDecimal(product), count)
                .setScale(0, RoundingMode.HALF_EVEN)
                .longValueExact();
    }

    /**
     * Newton iteration {@code x' = ((n - 1) x + a / x^(n-1)) / n}, seeded from a double estimate
     * of the logarithm so only a handful of steps are needed to reach full precision.
     */
    static BigDecimal nthRoot(BigDecimal value, long n) {
        if (n > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Root degree too large: " + n);
        }
        int degree = (int) n;
        BigDecimal degreeDecimal = BigDecimal.valueOf(degree);
        BigDecimal degreeMinusOne = BigDecimal.valueOf(degree - 1L);
        BigDecimal tolerance = BigDecimal.ONE.movePointLeft(ROOT_CONTEXT.getPrecision() - 2);

        BigDecimal x = initialEstimate(value.toBigInteger(), degree);
        for (int i = 0; i < MAX_NEWTON_ITERATIONS; i++) {
            BigDecimal power = x.pow(degree - 1, ROOT_CONTEXT);
            BigDecimal next = degreeMinusOne.multiply(x, ROOT_CONTEXT)
                    .add(value.divide(power, ROOT_CONTEXT), ROOT_CONTEXT)
                    .divide(degreeDecimal, ROOT_CONTEXT);
            BigDecimal delta = next.subtract(x).abs();
            x = next;
            if (delta.compareTo(tolerance.multiply(x, ROOT_CONTEXT)) <= 0) {
                break;
            }
        }
        return x;
    }

    private static BigDecimal initialEstimate(BigInteger value, int degree) {
        // log10 from the top 62 bits keeps the estimate within double precision of the root
        int shift = Math.max(0, value.bitLength() - 62);
        double log10 = Math.log10(value.shiftRight(shift).doubleValue()) + shift * LOG10_2;
        double rootLog10 = log10 / degree;
        int exponent = (int) Math.floor(rootLog10);
        double mantissa = Math.pow(10, rootLog10 - exponent);
        return new BigDecimal(mantissa, ROOT_CONTEXT).scaleByPowerOfTen(exponent);
    }
}
