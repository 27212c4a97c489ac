package ppi.ml;

import ppi.data.TabularDataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Squared-error gradient boosting: each round fits a shallow tree to the current
 * residuals on a random half of the rows and adds it scaled by the learning rate.
 */
public class GradientBoostedTrees extends RegressionModel {

    public static final int DEFAULT_ROUNDS = 2000;
    public static final int DEFAULT_MAX_DEPTH = 4;
    public static final double DEFAULT_LEARNING_RATE = 0.01;
    public static final double DEFAULT_BAG_FRACTION = 0.5;
    public static final int DEFAULT_MIN_LEAF = 10;

    private final double initial;
    private final double learningRate;
    private final List<RegressionTree> trees;

    public GradientBoostedTrees(TabularDataset train, int rounds, int maxDepth, double learningRate,
                                double bagFraction, int minLeaf, long seed) {
        super(ModelFamily.GRADIENT_BOOSTED_TREES, train);
        if (rounds < 1) throw new IllegalArgumentException("rounds must be positive");
        if (!(learningRate > 0)) throw new IllegalArgumentException("learningRate must be positive");
        double[][] x = train.matrix(getPredictors());
        double[] y = train.targetValues();
        int n = x.length;
        int p = getPredictors().size();
        if (n < 2) throw new ModelFitException(getFamily(), "need at least 2 training rows");
        int bagSize = Math.max(1, (int) Math.floor(n * bagFraction));

        this.learningRate = learningRate;
        double mean = 0;
        for (double v : y) mean += v;
        this.initial = mean / n;
        double[] current = new double[n];
        Arrays.fill(current, initial);
        double[] residual = new double[n];
        int[] all = new int[n];
        for (int i = 0; i < n; i++) all[i] = i;

        Random rnd = new Random(seed);
        List<RegressionTree> grown = new ArrayList<>(rounds);
        for (int r = 0; r < rounds; r++) {
            for (int i = 0; i < n; i++) residual[i] = y[i] - current[i];
            for (int i = 0; i < bagSize; i++) {
                int j = i + rnd.nextInt(n - i);
                int tmp = all[i];
                all[i] = all[j];
                all[j] = tmp;
            }
            int[] bag = Arrays.copyOf(all, bagSize);
            RegressionTree tree = new RegressionTree(x, residual.clone(), bag, maxDepth, minLeaf, p, rnd, null);
            for (int i = 0; i < n; i++) current[i] += learningRate * tree.predict(x[i]);
            grown.add(tree);
        }
        this.trees = Collections.unmodifiableList(grown);
    }

    @Override
    protected double predictRow(double[] x) {
        double sum = initial;
        for (RegressionTree tree : trees) sum += learningRate * tree.predict(x);
        return sum;
    }

    public int getRounds() { return trees.size(); }

    public static final class Trainer implements Trainable<TabularDataset, RegressionModel> {

        private final int rounds;
        private final int maxDepth;
        private final double learningRate;
        private final long seed;

        public Trainer(long seed) {
            this(DEFAULT_ROUNDS, DEFAULT_MAX_DEPTH, DEFAULT_LEARNING_RATE, seed);
        }

        public Trainer(int rounds, int maxDepth, double learningRate, long seed) {
            this.rounds = rounds;
            this.maxDepth = maxDepth;
            this.learningRate = learningRate;
            this.seed = seed;
        }

        @Override
        public ModelFamily family() {
            return ModelFamily.GRADIENT_BOOSTED_TREES;
        }

        @Override
        public RegressionModel fit(TabularDataset train) {
            return new GradientBoostedTrees(train, rounds, maxDepth, learningRate,
                DEFAULT_BAG_FRACTION, DEFAULT_MIN_LEAF, seed);
        }
    }
}
