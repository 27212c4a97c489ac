package ppi.data;

import java.time.YearMonth;

/**
 * A cleaned monthly table of sector indices: the table itself plus the
 * calendar month of its first row. Rows are consecutive months.
 */
public final class IndexData {

    private final YearMonth start;
    private final TabularDataset table;

    public IndexData(YearMonth start, TabularDataset table) {
        if (start == null || table == null) throw new IllegalArgumentException("start and table required");
        this.start = start;
        this.table = table;
    }

    public YearMonth getStart() { return start; }
    public TabularDataset getTable() { return table; }

    /** The target column as a monthly series. */
    public Series targetSeries() {
        return new Series(start, table.targetValues());
    }
}
