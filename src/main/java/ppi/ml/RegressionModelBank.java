package ppi.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.TabularDataset;
import ppi.data.TrainTestSplit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trains each registered regressor on the same train partition and scores it on the
 * same held-out test partition. A family that fails is recorded and left out.
 */
public final class RegressionModelBank {

    private static final Logger LOG = LoggerFactory.getLogger(RegressionModelBank.class);

    private final List<Trainable<TabularDataset, RegressionModel>> families;

    public RegressionModelBank(List<Trainable<TabularDataset, RegressionModel>> families) {
        if (families == null || families.isEmpty()) throw new IllegalArgumentException("at least one family required");
        this.families = new ArrayList<>(families);
    }

    /**
     * Linear regression, random forest (1000 trees, sqrt mtry, leaf 5), gradient boosting
     * (2000 rounds, depth 4, rate 0.01) and 10-NN, in that registration order.
     */
    public static RegressionModelBank standard(long seed) {
        return new RegressionModelBank(Arrays.<Trainable<TabularDataset, RegressionModel>>asList(
            new LinearRegression.Trainer(),
            new RandomForest.Trainer(seed),
            new GradientBoostedTrees.Trainer(seed),
            new KNearestNeighbors.Trainer()));
    }

    public BankResult<RegressionModel> evaluate(TrainTestSplit split) {
        TabularDataset train = split.getTrain();
        TabularDataset test = split.getTest();
        double[] actual = test.targetValues();
        List<EvaluationResult<RegressionModel>> results = new ArrayList<>();
        Map<ModelFamily, ModelFitException> failures = new LinkedHashMap<>();
        for (Trainable<TabularDataset, RegressionModel> family : families) {
            try {
                RegressionModel model = family.fit(train);
                double[] predicted = model.predict(test);
                for (double v : predicted) {
                    if (Double.isNaN(v) || Double.isInfinite(v)) {
                        throw new ModelFitException(family.family(), "non-finite test prediction");
                    }
                }
                EvaluationResult<RegressionModel> result = new EvaluationResult<>(model, actual, predicted, null);
                LOG.info("{}: {}", family.family(), result.getMetrics());
                results.add(result);
            } catch (ModelFitException e) {
                LOG.warn("Dropping {}: {}", family.family(), e.getMessage());
                failures.put(family.family(), e);
            } catch (RuntimeException e) {
                LOG.warn("Dropping {} after unexpected failure", family.family(), e);
                failures.put(family.family(), new ModelFitException(family.family(), String.valueOf(e.getMessage()), e));
            }
        }
        return new BankResult<>(results, failures);
    }
}
