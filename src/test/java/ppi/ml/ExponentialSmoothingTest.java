package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.YearMonth;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import ppi.data.Series;

public class ExponentialSmoothingTest {

    @Test
    public void testHoltFollowsLinearTrend() {
        ExponentialSmoothing ets = new ExponentialSmoothing(TestData.trend(80, 2, 0.5, 3), ExponentialSmoothing.Form.HOLT);
        double[] mean = ets.forecast(12, 95).getMean();
        assertEquals(22, mean[11] - mean[0], 3);
        assertEquals(100 + 2 * 80, mean[0], 3);
        assertEquals(1.0, ets.getPhi(), 0);
        assertTrue(ets.getBeta() <= ets.getAlpha());
    }

    @Test
    public void testSimpleSmoothingForecastIsFlat() {
        ExponentialSmoothing ets = new ExponentialSmoothing(TestData.trend(50, 0, 1, 8), ExponentialSmoothing.Form.SIMPLE);
        double[] mean = ets.forecast(5, 80).getMean();
        for (double m : mean) assertEquals(mean[0], m, 1e-12);
        assertEquals("ETS(A,N,N)", ets.describe());
    }

    @Test
    public void testDampedTrendFlattens() {
        ExponentialSmoothing ets = new ExponentialSmoothing(TestData.trend(80, 1, 0.5, 6), ExponentialSmoothing.Form.DAMPED);
        double[] mean = ets.forecast(24, 95).getMean();
        assertTrue(ets.getPhi() < 1);
        assertTrue(mean[23] - mean[22] < mean[1] - mean[0]);
    }

    @Test
    public void testFittedValuesAlignWithHistory() {
        Series history = TestData.trend(30, 1, 0.2, 2);
        ExponentialSmoothing ets = new ExponentialSmoothing(history, ExponentialSmoothing.Form.HOLT);
        assertEquals(history.size(), ets.fittedValues().length);
        assertEquals(history.get(0), ets.fittedValues()[0], 1e-9);
    }

    @Test
    public void testTooShortSeriesFails() {
        Series tiny = new Series(YearMonth.of(2020, 1), new double[] {1, 2, 3, 4, 5});
        assertThrows(ModelFitException.class, () -> new ExponentialSmoothing(tiny, ExponentialSmoothing.Form.DAMPED));
    }

    @Test
    public void testAutoEtsPicksTrendedFormForTrend() {
        TimeSeriesModel model = new AutoEts().fit(TestData.trend(80, 2, 0.5, 12));
        assertTrue(model.describe().startsWith("ETS(A,A"), model.describe());
    }

    @Test
    public void testLongDampedHorizonIsLinearInLength() {
        ExponentialSmoothing ets = new ExponentialSmoothing(TestData.trend(60, 1, 1, 11), ExponentialSmoothing.Form.DAMPED);
        Forecast shortRun = ets.forecast(24, 95);
        Forecast longRun = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> ets.forecast(120_000, 95));
        assertArrayEquals(shortRun.getMean(), Arrays.copyOf(longRun.getMean(), 24), 1e-9);
        assertArrayEquals(shortRun.getUpper(), Arrays.copyOf(longRun.getUpper(), 24), 1e-9);
        double[] mean = longRun.getMean();
        assertEquals(mean[mean.length - 2], mean[mean.length - 1], 1e-9);
    }
}
