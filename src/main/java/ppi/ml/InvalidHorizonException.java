package ppi.ml;

/** The requested target month is not after the current month. */
public class InvalidHorizonException extends ForecastException {

    private final int horizon;

    public InvalidHorizonException(int horizon) {
        super("Target date must be in the future (horizon " + horizon + " months)");
        this.horizon = horizon;
    }

    public int getHorizon() { return horizon; }
}
