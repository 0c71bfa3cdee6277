package com.metrics.insights.engine.stats;

import lombok.Value;

/**
 * Additive classical decomposition: value = trend + seasonal + residual at every index.
 *
 * The centered moving average is only defined on [validFrom, validTo]; outside
 * that range the trend repeats the nearest defined value, and those positions
 * carry no seasonal information.
 */
@Value
public class SeasonalDecomposition {
    int period;
    double[] trend;
    double[] seasonal;
    double[] residual;
    int validFrom;
    int validTo;

    public boolean isValid(int index) {
        return index >= validFrom && index <= validTo;
    }

    /**
     * Residuals inside the valid range.
     */
    public double[] validResiduals() {
        double[] out = new double[validTo - validFrom + 1];
        System.arraycopy(residual, validFrom, out, 0, out.length);
        return out;
    }
}
