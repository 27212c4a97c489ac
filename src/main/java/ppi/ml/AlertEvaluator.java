package ppi.ml;

/** Raises an alert when any forecast point lies strictly above the threshold. */
public final class AlertEvaluator {

    public static final String ALERT_MESSAGE = "Alert: Projected PPI exceeds threshold! Consider policy interventions.";
    public static final String CLEAR_MESSAGE = "No significant price volatility detected.";

    private AlertEvaluator() { }

    public static AlertState evaluate(double[] points, double threshold) {
        if (points == null) throw new IllegalArgumentException("points required");
        if (Double.isNaN(threshold)) throw new IllegalArgumentException("threshold must be a number");
        boolean triggered = false;
        for (double v : points) {
            if (v > threshold) {
                triggered = true;
                break;
            }
        }
        return new AlertState(threshold, triggered, triggered ? ALERT_MESSAGE : CLEAR_MESSAGE);
    }

    public static AlertState evaluate(Forecast forecast, double threshold) {
        return evaluate(forecast.getMean(), threshold);
    }
}
