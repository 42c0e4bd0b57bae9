package com.oapce.sentinel.detection;

import com.oapce.sentinel.model.TimeSeriesPoint;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

final class SeriesStatistics {

    private SeriesStatistics() {
    }

    static double[] values(List<TimeSeriesPoint> series) {
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).value();
        }
        return values;
    }

    /**
     * Linear-interpolated percentile (the R-7 definition), {@code p} in [0, 100].
     */
    static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0d;
        }
        if (p <= 0) {
            return min(values);
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p);
    }

    /**
     * Zero mean, unit population variance. A constant input maps to all zeros.
     */
    static double[] standardize(double[] values) {
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation(false).evaluate(values);
        double scale = std > 0 && Double.isFinite(std) ? std : 1d;
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = (values[i] - mean) / scale;
        }
        return scaled;
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
        }
        return min;
    }
}
