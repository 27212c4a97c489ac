package ppi.ml;

import java.util.Optional;

/**
 * How one fitted model scored: metrics plus the predictions they were computed from.
 * Predictions are aligned index-by-index with the actuals.
 */
public final class EvaluationResult<M extends TrainedModel> {

    private final M model;
    private final Metrics metrics;
    private final double[] actual;
    private final double[] predictions;
    private final Forecast forecast;

    public EvaluationResult(M model, double[] actual, double[] predictions, Forecast forecast) {
        if (actual.length != predictions.length) {
            throw new IllegalArgumentException("predictions (" + predictions.length
                + ") and actuals (" + actual.length + ") differ in length");
        }
        this.model = model;
        this.actual = actual.clone();
        this.predictions = predictions.clone();
        this.metrics = MetricEvaluator.evaluate(actual, predictions);
        this.forecast = forecast;
    }

    public ModelFamily getFamily() { return model.getFamily(); }
    public M getModel() { return model; }
    public Metrics getMetrics() { return metrics; }
    public double[] getActual() { return actual.clone(); }
    public double[] getPredictions() { return predictions.clone(); }
    public Optional<Forecast> getForecast() { return Optional.ofNullable(forecast); }

    @Override
    public String toString() {
        return model.describe() + " " + metrics;
    }
}
