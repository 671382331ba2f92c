package com.residualcarbon.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public abstract class Util {

    public static String human (double n, String units) {
        String prefix = "";
        if (n > 1024) {
            n /= 1024;
            prefix = "ki";
        }
        if (n > 1024) {
            n /= 1024;
            prefix = "Mi";
        }
        if (n > 1024) {
            n /= 1024;
            prefix = "Gi";
        }
        return String.format("%1.1f %s%s", n, prefix, units);
    }

    /** Round half-up to the given number of decimal places, going through the decimal string form of the double. */
    public static double round (double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /** Milliseconds since a System.currentTimeMillis() reading, as seconds for log lines. */
    public static String elapsed (long startMillis) {
        return String.format("%.2f s", (System.currentTimeMillis() - startMillis) / 1000.0);
    }
}
