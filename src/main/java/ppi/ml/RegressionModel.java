package ppi.ml;

import ppi.data.TabularDataset;

import java.util.Collections;
import java.util.List;

/**
 * A regressor fit on a fixed predictor list. Inputs to {@link #predict(TabularDataset)}
 * must carry every predictor column; other columns are ignored.
 */
public abstract class RegressionModel extends TrainedModel {

    private final List<String> predictors;
    private final TabularDataset training;

    protected RegressionModel(ModelFamily family, TabularDataset training) {
        super(family);
        this.predictors = Collections.unmodifiableList(training.predictorNames());
        this.training = training;
        if (predictors.isEmpty()) throw new ModelFitException(family, "no predictor columns");
    }

    public List<String> getPredictors() { return predictors; }
    public TabularDataset getTraining() { return training; }

    protected abstract double predictRow(double[] x);

    public double[] predict(TabularDataset inputs) {
        double[][] x = inputs.matrix(predictors);
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) out[i] = predictRow(x[i]);
        return out;
    }
}
