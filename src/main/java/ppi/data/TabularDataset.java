package ppi.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Named numeric columns of equal length with one designated target column.
 * Rows are aligned by position. Instances never change after construction.
 */
public final class TabularDataset {

    private final Map<String, double[]> columns;
    private final String target;
    private final int rows;

    public TabularDataset(Map<String, double[]> columns, String target) {
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("columns required");
        if (target == null || !columns.containsKey(target)) {
            throw new IllegalArgumentException("target column '" + target + "' not present");
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        int n = -1;
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] col = e.getValue();
            if (col == null) throw new IllegalArgumentException("column '" + e.getKey() + "' is null");
            if (n < 0) n = col.length;
            else if (col.length != n) {
                throw new IllegalArgumentException("column '" + e.getKey() + "' has " + col.length + " rows, expected " + n);
            }
            copy.put(e.getKey(), col.clone());
        }
        this.columns = Collections.unmodifiableMap(copy);
        this.target = target;
        this.rows = n;
    }

    public int rowCount() { return rows; }
    public String getTarget() { return target; }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    /** Every column except the target, in insertion order. */
    public List<String> predictorNames() {
        List<String> out = new ArrayList<>(columns.keySet());
        out.remove(target);
        return out;
    }

    public double[] column(String name) {
        double[] col = columns.get(name);
        if (col == null) throw new IllegalArgumentException("unknown column '" + name + "'");
        return col.clone();
    }

    public double[] targetValues() {
        return column(target);
    }

    /** Row-major matrix over the given predictors. */
    public double[][] matrix(List<String> predictors) {
        double[][] x = new double[rows][predictors.size()];
        for (int j = 0; j < predictors.size(); j++) {
            double[] col = columns.get(predictors.get(j));
            if (col == null) throw new IllegalArgumentException("unknown column '" + predictors.get(j) + "'");
            for (int i = 0; i < rows; i++) x[i][j] = col[i];
        }
        return x;
    }

    /** Restrict to the given predictors plus the target. */
    public TabularDataset select(List<String> predictors) {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (String p : predictors) {
            if (p.equals(target)) throw new IllegalArgumentException("target cannot be a predictor");
            out.put(p, column(p));
        }
        out.put(target, targetValues());
        return new TabularDataset(out, target);
    }

    /** Copy with one column replaced; used for what-if inputs. */
    public TabularDataset withColumn(String name, double[] values) {
        if (!columns.containsKey(name)) throw new IllegalArgumentException("unknown column '" + name + "'");
        Map<String, double[]> out = new LinkedHashMap<>(columns);
        out.put(name, values);
        return new TabularDataset(out, target);
    }

    public TabularDataset rows(int[] indices) {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] src = e.getValue();
            double[] dst = new double[indices.length];
            for (int i = 0; i < indices.length; i++) dst[i] = src[indices[i]];
            out.put(e.getKey(), dst);
        }
        return new TabularDataset(out, target);
    }

    /**
     * Shuffle row indices with a seeded generator and cut at {@code trainFraction}.
     * The same seed always yields the same partitions.
     */
    public TrainTestSplit split(double trainFraction, long seed) {
        if (!(trainFraction > 0 && trainFraction < 1)) {
            throw new IllegalArgumentException("trainFraction must be in (0, 1): " + trainFraction);
        }
        int nTrain = (int) Math.floor(rows * trainFraction);
        if (nTrain < 1 || nTrain >= rows) {
            throw new IllegalArgumentException("cannot split " + rows + " rows at " + trainFraction);
        }
        List<Integer> order = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) order.add(i);
        Collections.shuffle(order, new Random(seed));
        int[] train = new int[nTrain];
        int[] test = new int[rows - nTrain];
        for (int i = 0; i < rows; i++) {
            if (i < nTrain) train[i] = order.get(i);
            else test[i - nTrain] = order.get(i);
        }
        Arrays.sort(train);
        Arrays.sort(test);
        return new TrainTestSplit(rows(train), rows(test));
    }
}
