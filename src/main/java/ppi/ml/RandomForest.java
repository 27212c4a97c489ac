package ppi.ml;

import ppi.data.TabularDataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Bagged regression trees with per-split feature subsampling. Importance of a predictor
 * is its total SSE reduction averaged over trees (node purity increase).
 */
public class RandomForest extends RegressionModel {

    public static final int DEFAULT_TREES = 1000;
    public static final int DEFAULT_MIN_LEAF = 5;

    private final List<RegressionTree> trees;
    private final double[] importance;
    private final int mtry;

    /**
     * @param mtry features tried per split; {@code <= 0} means floor(sqrt(predictors))
     */
    public RandomForest(TabularDataset train, int nTrees, int mtry, int minLeaf, long seed) {
        super(ModelFamily.RANDOM_FOREST, train);
        if (nTrees < 1) throw new IllegalArgumentException("nTrees must be positive");
        double[][] x = train.matrix(getPredictors());
        double[] y = train.targetValues();
        int n = x.length;
        int p = getPredictors().size();
        if (n < 2) throw new ModelFitException(getFamily(), "need at least 2 training rows");
        this.mtry = mtry <= 0 ? Math.max(1, (int) Math.floor(Math.sqrt(p))) : Math.min(mtry, p);

        Random rnd = new Random(seed);
        double[] purity = new double[p];
        List<RegressionTree> grown = new ArrayList<>(nTrees);
        for (int t = 0; t < nTrees; t++) {
            int[] bootstrap = new int[n];
            for (int i = 0; i < n; i++) bootstrap[i] = rnd.nextInt(n);
            grown.add(new RegressionTree(x, y, bootstrap, Integer.MAX_VALUE, minLeaf, this.mtry, rnd, purity));
        }
        for (int j = 0; j < p; j++) purity[j] /= nTrees;
        this.trees = Collections.unmodifiableList(grown);
        this.importance = purity;
    }

    @Override
    protected double predictRow(double[] x) {
        double sum = 0;
        for (RegressionTree tree : trees) sum += tree.predict(x);
        return sum / trees.size();
    }

    /** Predictor name to importance, in predictor order. */
    public Map<String, Double> importance() {
        Map<String, Double> out = new LinkedHashMap<>();
        List<String> predictors = getPredictors();
        for (int j = 0; j < predictors.size(); j++) out.put(predictors.get(j), importance[j]);
        return out;
    }

    public int getTreeCount() { return trees.size(); }
    public int getMtry() { return mtry; }

    public static final class Trainer implements Trainable<TabularDataset, RegressionModel> {

        private final int trees;
        private final int mtry;
        private final int minLeaf;
        private final long seed;

        public Trainer(long seed) {
            this(DEFAULT_TREES, 0, DEFAULT_MIN_LEAF, seed);
        }

        public Trainer(int trees, int mtry, int minLeaf, long seed) {
            this.trees = trees;
            this.mtry = mtry;
            this.minLeaf = minLeaf;
            this.seed = seed;
        }

        @Override
        public ModelFamily family() {
            return ModelFamily.RANDOM_FOREST;
        }

        @Override
        public RegressionModel fit(TabularDataset train) {
            return new RandomForest(train, trees, mtry, minLeaf, seed);
        }
    }
}
