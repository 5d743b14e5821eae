package com.herzen.obe.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Scores {
    static final double MAX_SCALE = 3.0;
    static final double EPSILON = 1e-9;

    private Scores() {}

    static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    /** 0-100 percentage to the 0-3 attainment scale. */
    static double toScale(double percentage) {
        return percentage * MAX_SCALE / 100.0;
    }

    /** 0-3 attainment value to a 0-100 percentage, for level classification. */
    static double toPercentage(double scaled) {
        return scaled / MAX_SCALE * 100.0;
    }
}
