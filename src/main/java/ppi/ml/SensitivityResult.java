package ppi.ml;

/**
 * Test-partition actuals against predictions made from shocked inputs. Baseline
 * predictions from the unshocked inputs are kept alongside to measure the drift.
 */
public final class SensitivityResult {

    private final String predictor;
    private final double adjustmentPercent;
    private final double[] actual;
    private final double[] predicted;
    private final double[] baseline;

    public SensitivityResult(String predictor, double adjustmentPercent, double[] actual,
                             double[] predicted, double[] baseline) {
        if (actual.length != predicted.length || actual.length != baseline.length) {
            throw new IllegalArgumentException("actual, predicted and baseline must have equal length");
        }
        this.predictor = predictor;
        this.adjustmentPercent = adjustmentPercent;
        this.actual = actual.clone();
        this.predicted = predicted.clone();
        this.baseline = baseline.clone();
    }

    public String getPredictor() { return predictor; }
    public double getAdjustmentPercent() { return adjustmentPercent; }
    public double[] getActual() { return actual.clone(); }
    public double[] getPredicted() { return predicted.clone(); }
    public double[] getBaseline() { return baseline.clone(); }

    /** Mean of (shocked prediction - baseline prediction). */
    public double meanShift() {
        double sum = 0;
        for (int i = 0; i < predicted.length; i++) sum += predicted[i] - baseline[i];
        return predicted.length == 0 ? 0 : sum / predicted.length;
    }
}
