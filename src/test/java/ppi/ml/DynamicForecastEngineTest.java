package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.YearMonth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import ppi.data.Series;

public class DynamicForecastEngineTest {

    private static final YearMonth CURRENT = YearMonth.of(2024, 1);

    private DynamicForecastEngine engine;
    private TimeSeriesModel model;
    private Series history;

    @BeforeEach
    public void setUp() {
        engine = new DynamicForecastEngine(95);
        history = TestData.trend(60, 0.5, 1.0, 11);
        model = mock(TimeSeriesModel.class);
        when(model.getHistory()).thenReturn(history);
        when(model.forecast(anyInt(), anyDouble())).thenAnswer(inv -> {
            int h = inv.getArgument(0);
            return new Forecast(history.getEnd().plusMonths(1), new double[h], new double[h], new double[h], 95);
        });
    }

    @ParameterizedTest
    @CsvSource({"2024,1,2025,12,23", "2024,1,2024,2,1", "2024,6,2025,1,7", "2024,1,2023,6,-7", "2024,3,2024,3,0"})
    public void testHorizon(int cy, int cm, int ty, int tm, int expected) {
        assertEquals(expected, DynamicForecastEngine.horizon(YearMonth.of(cy, cm), YearMonth.of(ty, tm)));
    }

    @Test
    public void testPastTargetFailsWithoutComputing() {
        InvalidHorizonException e = assertThrows(InvalidHorizonException.class,
            () -> engine.forecast(model, 2023, 6, CURRENT, 80));
        assertEquals(-7, e.getHorizon());
        verify(model, never()).forecast(anyInt(), anyDouble());
    }

    @Test
    public void testCurrentMonthIsNotInTheFuture() {
        assertThrows(InvalidHorizonException.class, () -> engine.forecast(model, 2024, 1, CURRENT, 80));
    }

    @Test
    public void testFutureTarget() {
        DynamicForecast result = engine.forecast(model, 2025, 12, CURRENT, 80);
        assertEquals(23, result.getHorizon());
        assertEquals(23, result.getForecast().getHorizon());
        assertEquals(YearMonth.of(2025, 12), result.getTarget());
        verify(model).forecast(23, 95.0);
    }

    @Test
    public void testHistoryWindowIsClamped() {
        assertEquals(24, engine.forecast(model, 2025, 12, CURRENT, 24).getHistory().size());
        Series all = engine.forecast(model, 2025, 12, CURRENT, 500).getHistory();
        assertEquals(60, all.size());
        assertEquals(history.getEnd(), all.getEnd());
    }

    @Test
    public void testInvalidMonthAndWindow() {
        assertThrows(IllegalArgumentException.class, () -> engine.forecast(model, 2025, 13, CURRENT, 10));
        assertThrows(IllegalArgumentException.class, () -> engine.forecast(model, 2025, 12, CURRENT, 0));
    }

    @Test
    public void testReusesSameModel() {
        engine.forecast(model, 2024, 6, CURRENT, 10);
        DynamicForecast second = engine.forecast(model, 2026, 1, CURRENT, 10);
        assertEquals(24, second.getHorizon());
        assertSame(history, model.getHistory());
    }

    @Test
    public void testHorizonBeyondMaximumFailsWithoutComputing() {
        assertThrows(IllegalArgumentException.class, () -> engine.forecast(model, 2036, 2, CURRENT, 10));
        assertThrows(IllegalArgumentException.class, () -> engine.forecast(model, 100_000_000, 1, CURRENT, 80));
        assertThrows(IllegalArgumentException.class, () -> engine.forecast(model, YearMonth.of(999_999_999, 12), CURRENT, 80));
        verify(model, never()).forecast(anyInt(), anyDouble());
        assertEquals(144, engine.forecast(model, 2036, 1, CURRENT, 10).getHorizon());
    }

    @Test
    public void testFarPastTargetDoesNotOverflow() {
        assertThrows(InvalidHorizonException.class,
            () -> engine.forecast(model, YearMonth.of(-999_999_999, 1), CURRENT, 80));
        assertEquals(12L * 999_997_976 - 1, DynamicForecastEngine.horizon(CURRENT, YearMonth.of(999_999_999, 12)));
    }

    @Test
    public void testConfiguredMaximum() {
        DynamicForecastEngine shortRange = new DynamicForecastEngine(95, 12);
        assertEquals(12, shortRange.getMaxHorizon());
        assertEquals(12, shortRange.forecast(model, 2025, 1, CURRENT, 10).getHorizon());
        assertThrows(IllegalArgumentException.class, () -> shortRange.forecast(model, 2025, 2, CURRENT, 10));
        assertThrows(IllegalArgumentException.class, () -> new DynamicForecastEngine(95, 0));
    }
}
