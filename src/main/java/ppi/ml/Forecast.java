package ppi.ml;

import java.time.YearMonth;

/** Point forecasts with a symmetric prediction interval, one entry per future month. */
public final class Forecast {

    private final YearMonth firstMonth;
    private final double[] mean;
    private final double[] lower;
    private final double[] upper;
    private final double level;

    public Forecast(YearMonth firstMonth, double[] mean, double[] lower, double[] upper, double level) {
        if (mean == null || mean.length == 0) throw new InvalidHorizonException(mean == null ? 0 : mean.length);
        if (lower == null || upper == null || lower.length != mean.length || upper.length != mean.length) {
            throw new IllegalArgumentException("interval bounds must match the point forecast length");
        }
        this.firstMonth = firstMonth;
        this.mean = mean.clone();
        this.lower = lower.clone();
        this.upper = upper.clone();
        this.level = level;
    }

    public int getHorizon() { return mean.length; }
    public YearMonth getFirstMonth() { return firstMonth; }
    public YearMonth monthAt(int i) { return firstMonth.plusMonths(i); }
    public double getLevel() { return level; }

    public double[] getMean() { return mean.clone(); }
    public double[] getLower() { return lower.clone(); }
    public double[] getUpper() { return upper.clone(); }
}
