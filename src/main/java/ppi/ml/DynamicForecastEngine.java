package ppi.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.YearMonth;

/**
 * Regenerates forecasts from an already fitted time-series model for an arbitrary
 * future month. The horizon counts months from the current month to the target;
 * the forecast itself continues from the end of the model's history.
 */
public final class DynamicForecastEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DynamicForecastEngine.class);

    /** Twelve years of months. */
    public static final int DEFAULT_MAX_HORIZON = 144;

    private final double level;
    private final int maxHorizon;

    public DynamicForecastEngine(double level) {
        this(level, DEFAULT_MAX_HORIZON);
    }

    public DynamicForecastEngine(double level, int maxHorizon) {
        if (!(level > 0 && level < 100)) throw new IllegalArgumentException("level must be in (0, 100): " + level);
        if (maxHorizon < 1) throw new IllegalArgumentException("maxHorizon must be positive: " + maxHorizon);
        this.level = level;
        this.maxHorizon = maxHorizon;
    }

    /** (target year - current year)·12 + (target month - current month); may be zero or negative. */
    public static long horizon(YearMonth current, YearMonth target) {
        return ((long) target.getYear() - current.getYear()) * 12 + (target.getMonthValue() - current.getMonthValue());
    }

    public DynamicForecast forecast(TimeSeriesModel model, int targetYear, int targetMonth,
                                    YearMonth current, int historyPoints) {
        YearMonth target;
        try {
            target = YearMonth.of(targetYear, targetMonth);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid target month " + targetYear + "-" + targetMonth, e);
        }
        return forecast(model, target, current, historyPoints);
    }

    /**
     * @throws InvalidHorizonException  if {@code target} is not after {@code current}; nothing is computed
     * @throws IllegalArgumentException if {@code target} lies more than the maximum horizon ahead
     */
    public DynamicForecast forecast(TimeSeriesModel model, YearMonth target, YearMonth current, int historyPoints) {
        long months = horizon(current, target);
        if (months <= 0) throw new InvalidHorizonException((int) Math.max(months, Integer.MIN_VALUE));
        if (months > maxHorizon) {
            throw new IllegalArgumentException("Target date is " + months + " months ahead; at most " + maxHorizon + " allowed");
        }
        int h = (int) months;
        if (historyPoints < 1) throw new IllegalArgumentException("historyPoints must be positive: " + historyPoints);
        Forecast forecast = model.forecast(h, level);
        LOG.debug("{} forecast to {} (h={})", model.describe(), target, h);
        return new DynamicForecast(target, h, forecast, model.getHistory().tail(historyPoints));
    }

    public int getMaxHorizon() { return maxHorizon; }
}
