package ppi.data;

import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/** Synthetic monthly sector indices for demos and tests. */
public final class SampleData {

    public static final String TARGET = "agriculture";

    private SampleData() { }

    /**
     * Agriculture driven mostly by mining and manufacturing, weakly by energy,
     * not at all by construction; all with a mild yearly cycle.
     */
    public static IndexData generate(int months, long seed) {
        if (months < 24) throw new IllegalArgumentException("need at least 24 months");
        Random rnd = new Random(seed);
        double[] mining = new double[months];
        double[] manufacturing = new double[months];
        double[] energy = new double[months];
        double[] construction = new double[months];
        double[] agriculture = new double[months];
        double m = 95, f = 100, e = 90, c = 105;
        for (int t = 0; t < months; t++) {
            double season = Math.sin(2 * Math.PI * t / 12.0);
            m += 0.35 + rnd.nextGaussian() * 1.2;
            f += 0.25 + rnd.nextGaussian() * 0.6;
            e += 0.20 + rnd.nextGaussian() * 1.5;
            c += 0.15 + rnd.nextGaussian() * 0.8;
            mining[t] = m + 2 * season;
            manufacturing[t] = f;
            energy[t] = e + 3 * season;
            construction[t] = c;
            agriculture[t] = 10 + 0.55 * mining[t] + 0.35 * manufacturing[t] + 0.05 * energy[t]
                + 1.5 * season + rnd.nextGaussian() * 0.8;
        }
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put(TARGET, agriculture);
        cols.put("mining", mining);
        cols.put("manufacturing", manufacturing);
        cols.put("energy", energy);
        cols.put("construction", construction);
        return new IndexData(YearMonth.of(2010, 1), new TabularDataset(cols, TARGET));
    }
}
