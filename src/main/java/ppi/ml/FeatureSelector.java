package ppi.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.TabularDataset;

/**
 * Ranks every predictor of a training partition by random-forest node-purity importance.
 * The ranking is computed once and the same reduced predictor list is then used for
 * every regression family.
 */
public final class FeatureSelector {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureSelector.class);

    public static final int DEFAULT_TREES = 500;
    public static final int DEFAULT_MTRY = 2;

    private final int trees;
    private final int mtry;
    private final long seed;

    public FeatureSelector(long seed) {
        this(DEFAULT_TREES, DEFAULT_MTRY, seed);
    }

    public FeatureSelector(int trees, int mtry, long seed) {
        this.trees = trees;
        this.mtry = mtry;
        this.seed = seed;
    }

    /** @throws ModelFitException if the ranking forest cannot be fit */
    public FeatureRanking rank(TabularDataset train) {
        RandomForest forest = new RandomForest(train, trees, mtry, RandomForest.DEFAULT_MIN_LEAF, seed);
        FeatureRanking ranking = new FeatureRanking(forest.importance());
        LOG.info("Feature ranking over {} predictors: {}", train.predictorNames().size(), ranking);
        return ranking;
    }
}
