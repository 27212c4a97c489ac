package ppi.ml;

/** Base of every modelling failure raised by the evaluation and forecasting pipeline. */
public class ForecastException extends RuntimeException {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
