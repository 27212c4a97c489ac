package ppi.ml;

import ppi.data.TabularDataset;

/**
 * What-if scoring: scales one predictor column by (1 + δ/100) and re-predicts with the
 * unchanged fitted model. The model is never refit.
 */
public final class SensitivityAnalyzer {

    private SensitivityAnalyzer() { }

    /**
     * @param adjustmentPercent δ, negative for a decrease
     * @throws IllegalArgumentException if the model was not trained on {@code predictor}
     */
    public static SensitivityResult analyze(RegressionModel model, TabularDataset test,
                                            String predictor, double adjustmentPercent) {
        if (!model.getPredictors().contains(predictor)) {
            throw new IllegalArgumentException("model " + model.describe() + " does not use predictor '"
                + predictor + "'; available: " + model.getPredictors());
        }
        if (Double.isNaN(adjustmentPercent) || Double.isInfinite(adjustmentPercent)) {
            throw new IllegalArgumentException("adjustment must be finite");
        }
        double factor = 1 + adjustmentPercent / 100.0;
        double[] column = test.column(predictor);
        for (int i = 0; i < column.length; i++) column[i] *= factor;
        TabularDataset shocked = test.withColumn(predictor, column);
        return new SensitivityResult(predictor, adjustmentPercent, test.targetValues(),
            model.predict(shocked), model.predict(test));
    }
}
