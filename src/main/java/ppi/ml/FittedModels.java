package ppi.ml;

import ppi.data.TabularDataset;

/**
 * The read-only models a pipeline run hands to every recompute request: the chosen
 * time-series model, the regression model used for what-if scoring, and the held-out
 * partition that scoring runs against.
 */
public final class FittedModels {

    private final TimeSeriesModel timeSeriesModel;
    private final RegressionModel regressionModel;
    private final TabularDataset testPartition;
    private final String sensitivityPredictor;

    public FittedModels(TimeSeriesModel timeSeriesModel, RegressionModel regressionModel,
                        TabularDataset testPartition, String sensitivityPredictor) {
        if (timeSeriesModel == null || regressionModel == null || testPartition == null) {
            throw new IllegalArgumentException("models and test partition required");
        }
        this.timeSeriesModel = timeSeriesModel;
        this.regressionModel = regressionModel;
        this.testPartition = testPartition;
        this.sensitivityPredictor = sensitivityPredictor;
    }

    public TimeSeriesModel getTimeSeriesModel() { return timeSeriesModel; }
    public RegressionModel getRegressionModel() { return regressionModel; }
    public TabularDataset getTestPartition() { return testPartition; }
    public String getSensitivityPredictor() { return sensitivityPredictor; }
}
