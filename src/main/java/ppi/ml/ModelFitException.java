package ppi.ml;

/**
 * One model family could not be fit (optimizer did not converge, or the input
 * was unusable for it). Banks drop the family and carry on.
 */
public class ModelFitException extends ForecastException {

    private final ModelFamily family;

    public ModelFitException(ModelFamily family, String message) {
        super(family + ": " + message);
        this.family = family;
    }

    public ModelFitException(ModelFamily family, String message, Throwable cause) {
        super(family + ": " + message, cause);
        this.family = family;
    }

    public ModelFamily getFamily() { return family; }
}
