package ppi.ml;

import ppi.data.TabularDataset;

import java.util.Arrays;
import java.util.Comparator;

/**
 * k-nearest-neighbour regression on standardized predictors. Each predictor is
 * centered and scaled by its training mean and standard deviation; the prediction
 * is the mean target of the k closest training rows (Euclidean distance, ties by row order).
 */
public class KNearestNeighbors extends RegressionModel {

    public static final int DEFAULT_K = 10;

    private final int k;
    private final double[] means;
    private final double[] scales;
    private final double[][] scaled;
    private final double[] y;

    public KNearestNeighbors(TabularDataset train, int k) {
        super(ModelFamily.KNN, train);
        if (k < 1) throw new IllegalArgumentException("k must be positive");
        double[][] x = train.matrix(getPredictors());
        int n = x.length;
        if (n < k) throw new ModelFitException(getFamily(), "k=" + k + " exceeds " + n + " training rows");
        int p = getPredictors().size();
        this.k = k;
        this.means = new double[p];
        this.scales = new double[p];
        for (int j = 0; j < p; j++) {
            double m = 0;
            for (double[] row : x) m += row[j];
            m /= n;
            double ss = 0;
            for (double[] row : x) ss += (row[j] - m) * (row[j] - m);
            double sd = n > 1 ? Math.sqrt(ss / (n - 1)) : 0;
            means[j] = m;
            scales[j] = sd > 0 ? sd : 1;
        }
        this.scaled = new double[n][];
        for (int i = 0; i < n; i++) scaled[i] = standardize(x[i]);
        this.y = train.targetValues();
    }

    private double[] standardize(double[] row) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) out[j] = (row[j] - means[j]) / scales[j];
        return out;
    }

    @Override
    protected double predictRow(double[] x) {
        double[] q = standardize(x);
        Integer[] order = new Integer[scaled.length];
        double[] dist = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            double dd = 0;
            for (int j = 0; j < q.length; j++) {
                double diff = scaled[i][j] - q[j];
                dd += diff * diff;
            }
            dist[i] = dd;
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> dist[i]));
        double sum = 0;
        for (int i = 0; i < k; i++) sum += y[order[i]];
        return sum / k;
    }

    public int getK() { return k; }

    public static final class Trainer implements Trainable<TabularDataset, RegressionModel> {

        private final int k;

        public Trainer() {
            this(DEFAULT_K);
        }

        public Trainer(int k) {
            this.k = k;
        }

        @Override
        public ModelFamily family() {
            return ModelFamily.KNN;
        }

        @Override
        public RegressionModel fit(TabularDataset train) {
            return new KNearestNeighbors(train, k);
        }
    }
}
