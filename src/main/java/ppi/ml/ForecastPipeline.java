package ppi.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.IndexData;
import ppi.data.Series;
import ppi.data.TrainTestSplit;

import java.util.List;
import java.util.Optional;

/**
 * Runs the full evaluation once: time-series bank and selection on the target series,
 * feature ranking on the train partition, regression bank and selection on the
 * reduced partitions. The resulting models are then reused, never refit.
 */
public final class ForecastPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastPipeline.class);

    private final PipelineSettings settings;
    private final TimeSeriesModelBank timeSeriesBank;
    private final RegressionModelBank regressionBank;

    public ForecastPipeline(PipelineSettings settings) {
        this(settings,
            TimeSeriesModelBank.standard(settings.getForecastSteps(), settings.getLevel()),
            RegressionModelBank.standard(settings.getSeed()));
    }

    public ForecastPipeline(PipelineSettings settings, TimeSeriesModelBank timeSeriesBank,
                            RegressionModelBank regressionBank) {
        this.settings = settings;
        this.timeSeriesBank = timeSeriesBank;
        this.regressionBank = regressionBank;
    }

    /**
     * @throws EmptyModelBankException if every family of either bank failed
     * @throws ModelFitException       if the feature-ranking forest cannot be fit
     */
    public PipelineRun run(IndexData data) {
        Series series = data.targetSeries();
        LOG.info("Fitting time-series models on {}", series);
        BankResult<TimeSeriesModel> tsResults = timeSeriesBank.evaluate(series);
        EvaluationResult<TimeSeriesModel> bestTs = tsResults.best();
        LOG.info("Best time-series model: {}", bestTs);

        TrainTestSplit split = data.getTable().split(settings.getTrainFraction(), settings.getSeed());
        FeatureRanking ranking = new FeatureSelector(settings.getRankingTrees(), FeatureSelector.DEFAULT_MTRY,
            settings.getSeed()).rank(split.getTrain());
        List<String> selected = ranking.top(settings.getKeepFeatures());
        TrainTestSplit reduced = split.select(selected);
        LOG.info("Training regressors on {} ({} train / {} test rows)", selected,
            reduced.getTrain().rowCount(), reduced.getTest().rowCount());

        BankResult<RegressionModel> regResults = regressionBank.evaluate(reduced);
        EvaluationResult<RegressionModel> bestReg = regResults.best();
        LOG.info("Best regression model: {}", bestReg);

        RegressionModel whatIf = sensitivityModel(regResults, bestReg);
        String predictor = settings.getSensitivityPredictor();
        if (!selected.contains(predictor)) {
            LOG.warn("Sensitivity predictor '{}' was not selected {}; using '{}' instead",
                predictor, selected, selected.get(0));
            predictor = selected.get(0);
        }
        FittedModels fitted = new FittedModels(bestTs.getModel(), whatIf, reduced.getTest(), predictor);
        return new PipelineRun(tsResults, bestTs, ranking, selected, regResults, bestReg, fitted);
    }

    private RegressionModel sensitivityModel(BankResult<RegressionModel> results,
                                             EvaluationResult<RegressionModel> best) {
        String wanted = settings.getSensitivityModel();
        if (PipelineSettings.BEST.equals(wanted)) return best.getModel();
        Optional<EvaluationResult<RegressionModel>> designated = results.find(ModelFamily.valueOf(wanted));
        if (designated.isPresent()) return designated.get().getModel();
        LOG.warn("{} failed to fit; sensitivity analysis uses {}", wanted, best.getFamily());
        return best.getModel();
    }
}
