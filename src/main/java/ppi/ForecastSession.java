package ppi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.ml.AlertEvaluator;
import ppi.ml.AlertState;
import ppi.ml.DynamicForecast;
import ppi.ml.DynamicForecastEngine;
import ppi.ml.FittedModels;
import ppi.ml.SensitivityAnalyzer;
import ppi.ml.SensitivityResult;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Optional;

/**
 * Serves recompute requests against models fitted once at start-up. Requests run one
 * at a time; the last result is replaced only when a request succeeds completely.
 */
public final class ForecastSession {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastSession.class);

    private final FittedModels models;
    private final DynamicForecastEngine engine;
    private final Clock clock;
    private RecomputeResult last;

    public ForecastSession(FittedModels models, DynamicForecastEngine engine, Clock clock) {
        this.models = models;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * @throws ppi.ml.InvalidHorizonException if the target month is not in the future
     * @throws IllegalArgumentException       for other invalid parameters
     */
    public synchronized RecomputeResult recompute(RecomputeRequest request) {
        YearMonth current = YearMonth.now(clock);
        DynamicForecast forecast = engine.forecast(models.getTimeSeriesModel(),
            request.getYear(), request.getMonth(), current, request.getHistoryPoints());
        SensitivityResult sensitivity = SensitivityAnalyzer.analyze(models.getRegressionModel(),
            models.getTestPartition(), models.getSensitivityPredictor(), request.getAdjustmentPercent());
        AlertState alert = AlertEvaluator.evaluate(forecast.getForecast(), request.getThreshold());
        RecomputeResult result = new RecomputeResult(request, forecast, sensitivity, alert);
        last = result;
        LOG.info("Recomputed {} (h={}): {}", request, forecast.getHorizon(), alert.getMessage());
        return result;
    }

    public synchronized Optional<RecomputeResult> lastResult() {
        return Optional.ofNullable(last);
    }

    public FittedModels getModels() { return models; }
    public Clock getClock() { return clock; }
}
