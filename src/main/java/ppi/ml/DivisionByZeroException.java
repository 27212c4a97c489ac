package ppi.ml;

/** MAPE is undefined because an actual value is exactly zero. */
public class DivisionByZeroException extends ForecastException {

    private final int index;

    public DivisionByZeroException(int index) {
        super("actual value at index " + index + " is zero; MAPE undefined");
        this.index = index;
    }

    public int getIndex() { return index; }
}
