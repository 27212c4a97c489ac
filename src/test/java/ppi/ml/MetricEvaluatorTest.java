package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class MetricEvaluatorTest {

    private static final double EPSILON = 1e-9;

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 17, 99})
    public void testRmseBoundsMae(long seed) {
        Random rng = new Random(seed);
        int n = 5 + rng.nextInt(50);
        double[] actual = new double[n];
        double[] predicted = new double[n];
        for (int i = 0; i < n; i++) {
            actual[i] = 100 + rng.nextGaussian() * 10;
            predicted[i] = actual[i] + rng.nextGaussian() * 3;
        }
        double rmse = MetricEvaluator.rmse(actual, predicted);
        double mae = MetricEvaluator.mae(actual, predicted);
        assertTrue(mae >= 0);
        assertTrue(rmse >= mae - EPSILON);
    }

    @Test
    public void testPerfectPrediction() {
        double[] actual = {3, 5, 8, 13};
        assertEquals(0.0, MetricEvaluator.rmse(actual, actual));
        assertEquals(1.0, MetricEvaluator.rSquared(actual, actual));
        assertEquals(0.0, MetricEvaluator.mape(actual, actual));
    }

    @Test
    public void testKnownValues() {
        double[] actual = {10, 20, 30, 40};
        double[] predicted = {12, 18, 33, 40};
        assertEquals(Math.sqrt((4 + 4 + 9) / 4.0), MetricEvaluator.rmse(actual, predicted), EPSILON);
        assertEquals(7 / 4.0, MetricEvaluator.mae(actual, predicted), EPSILON);
        assertEquals(100 * (0.2 + 0.1 + 0.1) / 4, MetricEvaluator.mape(actual, predicted), EPSILON);
        assertEquals(1 - 17.0 / 500.0, MetricEvaluator.rSquared(actual, predicted), EPSILON);
    }

    @Test
    public void testMapeWithZeroActual() {
        DivisionByZeroException e = assertThrows(DivisionByZeroException.class,
            () -> MetricEvaluator.mape(new double[] {1, 0, 2}, new double[] {1, 1, 1}));
        assertEquals(1, e.getIndex());
    }

    @Test
    public void testRSquaredWithConstantActual() {
        assertThrows(DegenerateMetricException.class,
            () -> MetricEvaluator.rSquared(new double[] {5, 5, 5}, new double[] {4, 5, 6}));
    }

    @Test
    public void testEvaluateFlagsUndefinedMetrics() {
        Metrics m = MetricEvaluator.evaluate(new double[] {0, 0, 0}, new double[] {1, -1, 0});
        assertFalse(m.isMapeDefined());
        assertFalse(m.isRSquaredDefined());
        assertEquals(Math.sqrt(2 / 3.0), m.getRmse(), EPSILON);
        assertTrue(m.toString().contains("undefined"));
    }

    @Test
    public void testLengthMismatch() {
        assertThrows(IllegalArgumentException.class,
            () -> MetricEvaluator.evaluate(new double[] {1, 2}, new double[] {1}));
        assertThrows(IllegalArgumentException.class,
            () -> MetricEvaluator.rmse(new double[0], new double[0]));
    }
}
