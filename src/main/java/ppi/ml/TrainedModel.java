package ppi.ml;

/**
 * A fitted model artifact. Subclasses are immutable once constructed; refitting
 * always produces a new instance, so one instance may serve many requests.
 */
public abstract class TrainedModel {

    private final ModelFamily family;

    protected TrainedModel(ModelFamily family) {
        this.family = family;
    }

    public ModelFamily getFamily() { return family; }

    /** Short human-readable form, e.g. the chosen order of an ARIMA model. */
    public String describe() {
        return family.name();
    }

    @Override
    public String toString() {
        return describe();
    }
}
