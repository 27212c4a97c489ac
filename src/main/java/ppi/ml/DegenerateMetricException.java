package ppi.ml;

/** R² is undefined because the actual values have zero variance. */
public class DegenerateMetricException extends ForecastException {

    public DegenerateMetricException(String message) {
        super(message);
    }
}
