package ppi.ml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Outcome of one bank run: surviving results in registration order plus per-family failures. */
public final class BankResult<M extends TrainedModel> {

    private final List<EvaluationResult<M>> results;
    private final Map<ModelFamily, ModelFitException> failures;

    public BankResult(List<EvaluationResult<M>> results, Map<ModelFamily, ModelFitException> failures) {
        this.results = Collections.unmodifiableList(results);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public List<EvaluationResult<M>> getResults() { return results; }
    public Map<ModelFamily, ModelFitException> getFailures() { return failures; }

    public Optional<EvaluationResult<M>> find(ModelFamily family) {
        for (EvaluationResult<M> r : results) {
            if (r.getFamily() == family) return Optional.of(r);
        }
        return Optional.empty();
    }

    /** @throws EmptyModelBankException if every family failed */
    public EvaluationResult<M> best() {
        return ModelSelector.select(results);
    }
}
