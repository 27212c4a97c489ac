package ppi.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.YearMonth;

import org.junit.jupiter.api.Test;

public class SeriesTest {

    private final Series series = new Series(YearMonth.of(2023, 11), new double[] {1, 2, 3, 4, 5});

    @Test
    public void testCalendar() {
        assertEquals(YearMonth.of(2024, 3), series.getEnd());
        assertEquals(YearMonth.of(2024, 1), series.monthAt(2));
    }

    @Test
    public void testTailIsClamped() {
        Series tail = series.tail(2);
        assertEquals(2, tail.size());
        assertEquals(YearMonth.of(2024, 2), tail.getStart());
        assertEquals(4.0, tail.get(0));
        assertEquals(5, series.tail(200).size());
    }

    @Test
    public void testValuesAreCopied() {
        series.values()[0] = 99;
        assertEquals(1.0, series.get(0));
    }

    @Test
    public void testRejectsNonFinite() {
        assertThrows(IllegalArgumentException.class,
            () -> new Series(YearMonth.of(2020, 1), new double[] {1, Double.NaN}));
    }
}
