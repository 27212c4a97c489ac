package ppi.ml;

import java.util.Collections;
import java.util.List;

/** Everything one pipeline run produced, for reporting and for reuse by recompute requests. */
public final class PipelineRun {

    private final BankResult<TimeSeriesModel> timeSeries;
    private final EvaluationResult<TimeSeriesModel> bestTimeSeries;
    private final FeatureRanking ranking;
    private final List<String> selectedPredictors;
    private final BankResult<RegressionModel> regression;
    private final EvaluationResult<RegressionModel> bestRegression;
    private final FittedModels fittedModels;

    public PipelineRun(BankResult<TimeSeriesModel> timeSeries, EvaluationResult<TimeSeriesModel> bestTimeSeries,
                       FeatureRanking ranking, List<String> selectedPredictors,
                       BankResult<RegressionModel> regression, EvaluationResult<RegressionModel> bestRegression,
                       FittedModels fittedModels) {
        this.timeSeries = timeSeries;
        this.bestTimeSeries = bestTimeSeries;
        this.ranking = ranking;
        this.selectedPredictors = Collections.unmodifiableList(selectedPredictors);
        this.regression = regression;
        this.bestRegression = bestRegression;
        this.fittedModels = fittedModels;
    }

    public BankResult<TimeSeriesModel> getTimeSeries() { return timeSeries; }
    public EvaluationResult<TimeSeriesModel> getBestTimeSeries() { return bestTimeSeries; }
    public FeatureRanking getRanking() { return ranking; }
    public List<String> getSelectedPredictors() { return selectedPredictors; }
    public BankResult<RegressionModel> getRegression() { return regression; }
    public EvaluationResult<RegressionModel> getBestRegression() { return bestRegression; }
    public FittedModels getFittedModels() { return fittedModels; }
}
