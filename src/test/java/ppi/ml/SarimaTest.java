package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.YearMonth;
import java.util.Random;

import org.junit.jupiter.api.Test;

import ppi.data.Series;

public class SarimaTest {

    private static Series ar1(int n, double phi, double mean, long seed) {
        Random rng = new Random(seed);
        double[] v = new double[n];
        double prev = 0;
        for (int t = 0; t < n; t++) {
            prev = phi * prev + rng.nextGaussian();
            v[t] = mean + prev;
        }
        return new Series(YearMonth.of(2000, 1), v);
    }

    @Test
    public void testRecoversAutoregressiveCoefficient() {
        Sarima model = new Sarima(ar1(400, 0.6, 50, 17), 1, 0, 0, 0, 0, 0, 1, true, 1);
        assertEquals(0.6, model.getAr()[0], 0.1);
        assertEquals(50, model.getMean(), 0.5);
        assertEquals(1.0, model.getSigma2(), 0.2);
        assertEquals("ARIMA(1,0,0) with non-zero mean", model.describe());
    }

    @Test
    public void testRandomWalkPsiWeightsAreOne() {
        Sarima model = new Sarima(TestData.trend(40, 0, 1, 5), 0, 1, 0, 0, 0, 0, 1, false, 0);
        for (double psi : model.psiWeights(10)) {
            assertEquals(1.0, psi, 1e-12);
        }
        double[] lastValues = model.getHistory().values();
        double[] mean = model.forecast(3, 95).getMean();
        for (double m : mean) {
            assertEquals(lastValues[lastValues.length - 1], m, 1e-12);
        }
    }

    @Test
    public void testForecastVarianceGrowsWithHorizon() {
        Sarima model = new Sarima(TestData.trend(60, 1, 1, 9), 0, 1, 0, 0, 0, 0, 1, true, 0);
        Forecast f = model.forecast(6, 95);
        double previousWidth = 0;
        for (int i = 0; i < 6; i++) {
            double width = f.getUpper()[i] - f.getLower()[i];
            assertTrue(width > previousWidth);
            previousWidth = width;
        }
        assertEquals(YearMonth.of(2024, 1), f.getFirstMonth());
    }

    @Test
    public void testTooShortSeriesFails() {
        Series tiny = new Series(YearMonth.of(2020, 1), new double[] {1, 2, 3, 4});
        assertThrows(ModelFitException.class, () -> new Sarima(tiny, 2, 1, 2, 0, 0, 0, 1, true, 0));
    }

    @Test
    public void testDifferencingOrderFromKpss() {
        double[] periodic = new double[120];
        for (int t = 0; t < periodic.length; t++) periodic[t] = 100 + 5 * Math.sin(2 * Math.PI * t / 6);
        assertEquals(0, AutoArima.differencingOrder(periodic, 2));
        assertEquals(1, AutoArima.differencingOrder(TestData.trend(60, 1, 1, 4).values(), 2));
    }

    @Test
    public void testAutoArimaForecastCoversTrend() {
        Series history = TestData.trend(60, 1, 1, 11);
        TimeSeriesModel model = new AutoArima().fit(history);
        Forecast next = model.forecast(1, 95);
        double expected = 100 + 60;
        assertEquals(YearMonth.of(2024, 1), next.getFirstMonth());
        assertTrue(next.getLower()[0] <= expected && expected <= next.getUpper()[0],
            model.describe() + " interval [" + next.getLower()[0] + ", " + next.getUpper()[0] + "]");
    }
}
