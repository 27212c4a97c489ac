package ppi.ml;

/**
 * Error metrics over aligned actual/predicted sequences.
 * <p>
 * RMSE = sqrt(mean((y - ŷ)²)), MAE = mean(|y - ŷ|), MAPE = 100 · mean(|(y - ŷ) / y|),
 * R² = 1 - SS_res / SS_tot with SS_tot taken around the mean of the actuals.
 */
public final class MetricEvaluator {

    private MetricEvaluator() { }

    /** All four metrics; undefined MAPE or R² come back as {@code NaN} instead of failing. */
    public static Metrics evaluate(double[] actual, double[] predicted) {
        check(actual, predicted);
        double mape;
        try {
            mape = mape(actual, predicted);
        } catch (DivisionByZeroException e) {
            mape = Double.NaN;
        }
        double r2;
        try {
            r2 = rSquared(actual, predicted);
        } catch (DegenerateMetricException e) {
            r2 = Double.NaN;
        }
        return new Metrics(rmse(actual, predicted), mae(actual, predicted), mape, r2);
    }

    public static double rmse(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double e = actual[i] - predicted[i];
            sum += e * e;
        }
        return Math.sqrt(sum / actual.length);
    }

    public static double mae(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0;
        for (int i = 0; i < actual.length; i++) sum += Math.abs(actual[i] - predicted[i]);
        return sum / actual.length;
    }

    /** @throws DivisionByZeroException if any actual value is exactly zero */
    public static double mape(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] == 0.0) throw new DivisionByZeroException(i);
            sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
        }
        return 100.0 * sum / actual.length;
    }

    /** @throws DegenerateMetricException if the actual values are constant */
    public static double rSquared(double[] actual, double[] predicted) {
        check(actual, predicted);
        double mean = 0;
        for (double v : actual) mean += v;
        mean /= actual.length;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < actual.length; i++) {
            ssTot += (actual[i] - mean) * (actual[i] - mean);
            ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
        }
        if (ssTot == 0.0) throw new DegenerateMetricException("actual values are constant; R² undefined");
        return 1.0 - ssRes / ssTot;
    }

    private static void check(double[] actual, double[] predicted) {
        if (actual == null || predicted == null || actual.length != predicted.length || actual.length == 0) {
            throw new IllegalArgumentException("actual and predicted must be non-null, same length, and non-empty");
        }
    }
}
