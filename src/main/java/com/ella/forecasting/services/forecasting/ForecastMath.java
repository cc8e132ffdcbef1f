package com.ella.forecasting.services.forecasting;

import java.util.List;

public final class ForecastMath {

    private ForecastMath() {
    }

    public static double[] amounts(List<HistoricalPoint> points) {
        return points.stream().mapToDouble(HistoricalPoint::amount).toArray();
    }

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double populationStdDev(double[] values, double mean) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double acc = 0.0;
        for (double v : values) {
            double d = v - mean;
            acc += d * d;
        }
        return Math.sqrt(acc / values.length);
    }

    public static double rmse(double[] residuals) {
        if (residuals == null || residuals.length == 0) {
            return 0.0;
        }
        double acc = 0.0;
        for (double r : residuals) {
            acc += r * r;
        }
        return Math.sqrt(acc / residuals.length);
    }

    public static double mae(double[] residuals) {
        if (residuals == null || residuals.length == 0) {
            return 0.0;
        }
        double acc = 0.0;
        for (double r : residuals) {
            acc += Math.abs(r);
        }
        return acc / residuals.length;
    }

    /**
     * {@code 100 - mae / reference * 100}, kept within [0, 100]. A zero reference scores 100 only
     * for a perfect fit.
     */
    public static double accuracyScore(double mae, double reference) {
        if (reference == 0.0 || !Double.isFinite(reference)) {
            return mae == 0.0 ? 100.0 : 0.0;
        }
        return clamp(100.0 - (mae / reference * 100.0), 0.0, 100.0);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
