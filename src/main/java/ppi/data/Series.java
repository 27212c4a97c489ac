package ppi.data;

import java.time.YearMonth;
import java.util.Arrays;

/**
 * Monthly index values, one per calendar month with no gaps.
 * <p>
 * Immutable: accessors hand out copies.
 */
public final class Series {

    private final YearMonth start;
    private final double[] values;

    public Series(YearMonth start, double[] values) {
        if (start == null) throw new IllegalArgumentException("start month required");
        if (values == null || values.length == 0) throw new IllegalArgumentException("values required");
        for (double v : values) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new IllegalArgumentException("series values must be finite");
            }
        }
        this.start = start;
        this.values = values.clone();
    }

    public int size() { return values.length; }
    public YearMonth getStart() { return start; }
    public YearMonth getEnd() { return start.plusMonths(values.length - 1L); }

    public double get(int i) { return values[i]; }
    public YearMonth monthAt(int i) { return start.plusMonths(i); }

    public double[] values() {
        return values.clone();
    }

    /** The last {@code count} observations, clamped to the series length. */
    public Series tail(int count) {
        int n = Math.max(1, Math.min(count, values.length));
        return new Series(monthAt(values.length - n), Arrays.copyOfRange(values, values.length - n, values.length));
    }

    @Override
    public String toString() {
        return "Series[" + start + ".." + getEnd() + ", n=" + values.length + "]";
    }
}
