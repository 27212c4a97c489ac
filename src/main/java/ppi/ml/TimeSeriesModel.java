package ppi.ml;

import org.apache.commons.math3.distribution.NormalDistribution;
import ppi.data.Series;

import java.time.YearMonth;

/**
 * A model fit to the full history of one monthly series. Forecasts continue
 * from the month after the last observation and can be regenerated for any
 * horizon without refitting.
 */
public abstract class TimeSeriesModel extends TrainedModel {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private final Series history;

    protected TimeSeriesModel(ModelFamily family, Series history) {
        super(family);
        this.history = history;
    }

    public Series getHistory() { return history; }

    /** One-step-ahead in-sample reconstruction, aligned with {@link #getHistory()}. */
    public abstract double[] fittedValues();

    /** Information criterion used to choose between forms of the same family. */
    public abstract double aicc();

    protected abstract double[] pointForecast(int h);

    /** Forecast error variance for steps 1..h. */
    protected abstract double[] forecastVariance(int h);

    /**
     * @param h     number of months ahead, at least 1
     * @param level interval coverage in percent, e.g. 95
     */
    public Forecast forecast(int h, double level) {
        if (h < 1) throw new InvalidHorizonException(h);
        if (!(level > 0 && level < 100)) throw new IllegalArgumentException("level must be in (0, 100): " + level);
        double z = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + level / 200.0);
        double[] mean = pointForecast(h);
        double[] var = forecastVariance(h);
        double[] lower = new double[h];
        double[] upper = new double[h];
        for (int i = 0; i < h; i++) {
            double half = z * Math.sqrt(Math.max(var[i], 0));
            lower[i] = mean[i] - half;
            upper[i] = mean[i] + half;
        }
        YearMonth first = history.getEnd().plusMonths(1);
        return new Forecast(first, mean, lower, upper, level);
    }
}
