package ppi.ml;

import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import ppi.data.Series;
import ppi.data.TabularDataset;

public class TestData {

    /** y = 5 + 3·strong + 0.5·weak + N(0, 0.5); "noise" is unrelated. */
    public static TabularDataset regression(int n, long seed) {
        Random rng = new Random(seed);
        double[] strong = new double[n];
        double[] weak = new double[n];
        double[] noise = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            strong[i] = rng.nextDouble() * 20;
            weak[i] = rng.nextDouble() * 20;
            noise[i] = rng.nextDouble() * 20;
            y[i] = 5 + 3 * strong[i] + 0.5 * weak[i] + rng.nextGaussian() * 0.5;
        }
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("noise", noise);
        cols.put("weak", weak);
        cols.put("strong", strong);
        cols.put("y", y);
        return new TabularDataset(cols, "y");
    }

    /** 100 + slope·t + N(0, sd), monthly from January 2019. */
    public static Series trend(int n, double slope, double sd, long seed) {
        Random rng = new Random(seed);
        double[] v = new double[n];
        for (int t = 0; t < n; t++) v[t] = 100 + slope * t + rng.nextGaussian() * sd;
        return new Series(YearMonth.of(2019, 1), v);
    }
}
