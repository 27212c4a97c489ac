package ppi.ml;

/** No candidate survived fitting, so there is nothing to select from. */
public class EmptyModelBankException extends ForecastException {

    public EmptyModelBankException(String message) {
        super(message);
    }
}
