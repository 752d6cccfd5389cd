package org.mides.delivery.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class Utils {

    private Utils() {
    }

    public static double round(double value, int places) {
        /* Half-up rounding for values shown to clients */
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
