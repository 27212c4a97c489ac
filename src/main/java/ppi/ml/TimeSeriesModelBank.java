package ppi.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.Series;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fits each registered time-series family to the full history. Metrics are in-sample:
 * the series against its one-step fitted values. Each result carries a fixed-horizon forecast.
 * A family that fails is recorded and left out; the others still run.
 */
public final class TimeSeriesModelBank {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesModelBank.class);

    public static final int DEFAULT_STEPS = 12;

    private final List<Trainable<Series, TimeSeriesModel>> families;
    private final int steps;
    private final double level;

    public TimeSeriesModelBank(List<Trainable<Series, TimeSeriesModel>> families, int steps, double level) {
        if (families == null || families.isEmpty()) throw new IllegalArgumentException("at least one family required");
        if (steps < 1) throw new IllegalArgumentException("steps must be positive");
        this.families = new ArrayList<>(families);
        this.steps = steps;
        this.level = level;
    }

    /** ARIMA then ETS; registration order is the tie-break order. */
    public static TimeSeriesModelBank standard(int steps, double level) {
        return new TimeSeriesModelBank(
            Arrays.<Trainable<Series, TimeSeriesModel>>asList(new AutoArima(), new AutoEts()), steps, level);
    }

    public BankResult<TimeSeriesModel> evaluate(Series series) {
        List<EvaluationResult<TimeSeriesModel>> results = new ArrayList<>();
        Map<ModelFamily, ModelFitException> failures = new LinkedHashMap<>();
        double[] actual = series.values();
        for (Trainable<Series, TimeSeriesModel> family : families) {
            try {
                TimeSeriesModel model = family.fit(series);
                EvaluationResult<TimeSeriesModel> result =
                    new EvaluationResult<>(model, actual, model.fittedValues(), model.forecast(steps, level));
                LOG.info("{}: {}", family.family(), result);
                results.add(result);
            } catch (ModelFitException e) {
                LOG.warn("Dropping {}: {}", family.family(), e.getMessage());
                failures.put(family.family(), e);
            } catch (RuntimeException e) {
                LOG.warn("Dropping {} after unexpected failure", family.family(), e);
                failures.put(family.family(), new ModelFitException(family.family(), String.valueOf(e.getMessage()), e));
            }
        }
        return new BankResult<>(results, failures);
    }
}
