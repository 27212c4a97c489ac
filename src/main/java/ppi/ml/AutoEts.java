package ppi.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.Series;

/** Fits every additive-error ETS form and keeps the one with the lowest AICc. */
public final class AutoEts implements Trainable<Series, TimeSeriesModel> {

    private static final Logger LOG = LoggerFactory.getLogger(AutoEts.class);

    @Override
    public ModelFamily family() {
        return ModelFamily.ETS;
    }

    @Override
    public TimeSeriesModel fit(Series series) {
        ExponentialSmoothing best = null;
        for (ExponentialSmoothing.Form form : ExponentialSmoothing.Form.values()) {
            try {
                ExponentialSmoothing candidate = new ExponentialSmoothing(series, form);
                if (best == null || candidate.aicc() < best.aicc()) best = candidate;
            } catch (ModelFitException e) {
                LOG.debug("Skipping form: {}", e.getMessage());
            }
        }
        if (best == null) throw new ModelFitException(ModelFamily.ETS, "no ETS form could be fit");
        LOG.info("Selected {} (alpha={}, beta={}, phi={})", best.describe(),
            String.format("%.4f", best.getAlpha()), String.format("%.4f", best.getBeta()),
            String.format("%.3f", best.getPhi()));
        return best;
    }
}
