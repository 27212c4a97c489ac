package ppi.ml;

import java.util.List;

/**
 * Picks the result with the lowest RMSE. Equal RMSEs resolve to the earlier entry,
 * i.e. the family registered first in its bank.
 */
public final class ModelSelector {

    private ModelSelector() { }

    /** @throws EmptyModelBankException if {@code results} is empty */
    public static <M extends TrainedModel> EvaluationResult<M> select(List<EvaluationResult<M>> results) {
        if (results == null || results.isEmpty()) {
            throw new EmptyModelBankException("no successfully fitted model to select from");
        }
        EvaluationResult<M> best = null;
        for (EvaluationResult<M> r : results) {
            double rmse = r.getMetrics().getRmse();
            if (Double.isNaN(rmse)) continue;
            if (best == null || rmse < best.getMetrics().getRmse()) best = r;
        }
        return best != null ? best : results.get(0);
    }
}
