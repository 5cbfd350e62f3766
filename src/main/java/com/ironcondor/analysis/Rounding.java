package com.ironcondor.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Output rounding shared by the report builders. Values between steps stay unrounded. */
final class Rounding {

    private Rounding() {}

    static BigDecimal money(double value) {
        return scaled(value, 2);
    }

    static BigDecimal scaled(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
