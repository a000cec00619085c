package com.heist.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final int PRICE_SCALE = 12;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Token prices routinely sit far below a cent, so they keep twelve decimals.
     */
    public static BigDecimal price(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        }
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal price(double value) {
        return price(BigDecimal.valueOf(value));
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(left.multiply(right));
    }

    public static BigDecimal divide(BigDecimal left, BigDecimal right, int scale) {
        if (right == null || right.signum() == 0) {
            return BigDecimal.ZERO.setScale(scale, RoundingMode.HALF_UP);
        }
        return left.divide(right, scale, RoundingMode.HALF_UP);
    }

    /**
     * (current / reference - 1) * 100, zero when the reference is zero.
     */
    public static BigDecimal percentChange(BigDecimal current, BigDecimal reference) {
        if (reference == null || reference.signum() == 0 || current == null) {
            return ZERO;
        }
        BigDecimal ratio = current.divide(reference, PRICE_SCALE, RoundingMode.HALF_UP);
        return scale(ratio.subtract(BigDecimal.ONE).multiply(HUNDRED));
    }

    /**
     * (peak - current) / peak * 100, zero when the peak is zero.
     */
    public static BigDecimal drawdownPercent(BigDecimal peak, BigDecimal current) {
        if (peak == null || peak.signum() == 0 || current == null) {
            return ZERO;
        }
        BigDecimal drop = peak.subtract(current).divide(peak, PRICE_SCALE, RoundingMode.HALF_UP);
        return scale(drop.multiply(HUNDRED));
    }
}
