package ppi.ml;

import java.util.Arrays;
import java.util.Random;

/**
 * CART regression tree grown on a subset of rows, splitting on the variance reduction.
 * At each node only {@code mtry} randomly chosen features are considered.
 */
final class RegressionTree {

    private static final class Node {
        int feature = -1;
        double threshold;
        double value;
        Node left;
        Node right;
    }

    private final double[][] x;
    private final double[] y;
    private final int maxDepth;
    private final int minLeaf;
    private final int mtry;
    private final Random rnd;
    private final double[] importance;
    private final Node root;

    /**
     * @param importance per-feature accumulator of SSE reduction, or {@code null}
     */
    RegressionTree(double[][] x, double[] y, int[] rows, int maxDepth, int minLeaf, int mtry,
                   Random rnd, double[] importance) {
        this.x = x;
        this.y = y;
        this.maxDepth = maxDepth;
        this.minLeaf = Math.max(1, minLeaf);
        this.mtry = mtry;
        this.rnd = rnd;
        this.importance = importance;
        this.root = build(rows, 0);
    }

    double predict(double[] row) {
        Node node = root;
        while (node.feature >= 0) {
            node = row[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    private Node build(int[] rows, int depth) {
        Node node = new Node();
        int n = rows.length;
        double sum = 0, sumSq = 0;
        for (int r : rows) {
            sum += y[r];
            sumSq += y[r] * y[r];
        }
        node.value = sum / n;
        if (depth >= maxDepth || n < 2 * minLeaf) return node;
        double parentSse = sumSq - sum * sum / n;
        if (parentSse <= 1e-12) return node;

        int bestFeature = -1;
        double bestThreshold = 0;
        double bestGain = 1e-12;
        Integer[] order = new Integer[n];
        for (int f : sampleFeatures()) {
            for (int i = 0; i < n; i++) order[i] = rows[i];
            final int feat = f;
            Arrays.sort(order, (a, b) -> Double.compare(x[a][feat], x[b][feat]));
            double leftSum = 0, leftSq = 0;
            for (int i = 0; i < n - 1; i++) {
                double v = y[order[i]];
                leftSum += v;
                leftSq += v * v;
                int nl = i + 1;
                int nr = n - nl;
                if (nl < minLeaf) continue;
                if (nr < minLeaf) break;
                double xi = x[order[i]][f];
                double xNext = x[order[i + 1]][f];
                if (xi == xNext) continue;
                double rightSum = sum - leftSum;
                double rightSq = sumSq - leftSq;
                double sse = (leftSq - leftSum * leftSum / nl) + (rightSq - rightSum * rightSum / nr);
                double gain = parentSse - sse;
                if (gain > bestGain) {
                    bestGain = gain;
                    bestFeature = f;
                    bestThreshold = (xi + xNext) / 2;
                }
            }
        }
        if (bestFeature < 0) return node;
        if (importance != null) importance[bestFeature] += bestGain;

        int nLeft = 0;
        for (int r : rows) if (x[r][bestFeature] <= bestThreshold) nLeft++;
        int[] leftRows = new int[nLeft];
        int[] rightRows = new int[n - nLeft];
        int li = 0, ri = 0;
        for (int r : rows) {
            if (x[r][bestFeature] <= bestThreshold) leftRows[li++] = r;
            else rightRows[ri++] = r;
        }
        node.feature = bestFeature;
        node.threshold = bestThreshold;
        node.left = build(leftRows, depth + 1);
        node.right = build(rightRows, depth + 1);
        return node;
    }

    /** Partial Fisher-Yates draw of {@code mtry} distinct feature indices. */
    private int[] sampleFeatures() {
        int p = x[0].length;
        int[] idx = new int[p];
        for (int i = 0; i < p; i++) idx[i] = i;
        int m = Math.min(mtry, p);
        if (m == p) return idx;
        for (int i = 0; i < m; i++) {
            int j = i + rnd.nextInt(p - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
        }
        return Arrays.copyOf(idx, m);
    }
}
