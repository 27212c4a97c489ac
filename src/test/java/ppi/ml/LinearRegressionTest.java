package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ppi.data.TabularDataset;

public class LinearRegressionTest {

    private static final double EPSILON = 1e-8;

    @Test
    public void testRecoversExactCoefficients() {
        int n = 30;
        double[] a = new double[n];
        double[] b = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            a[i] = i;
            b[i] = (i * 7) % 11;
            y[i] = 1 + 2 * a[i] - 3 * b[i];
        }
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("a", a);
        cols.put("b", b);
        cols.put("y", y);
        LinearRegression lr = new LinearRegression(new TabularDataset(cols, "y"));
        assertEquals(1.0, lr.getIntercept(), EPSILON);
        assertEquals(2.0, lr.getCoefficient(0), EPSILON);
        assertEquals(-3.0, lr.getCoefficient(1), EPSILON);
        assertEquals(1.0, lr.getRSquared(), EPSILON);
        assertEquals(ModelFamily.LINEAR_REGRESSION, lr.getFamily());
    }

    @Test
    public void testSingularDesignFails() {
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("a", new double[] {1, 2, 3, 4, 5});
        cols.put("b", new double[] {2, 4, 6, 8, 10});
        cols.put("y", new double[] {1, 3, 2, 5, 4});
        assertThrows(ModelFitException.class, () -> new LinearRegression(new TabularDataset(cols, "y")));
    }

    @Test
    public void testTooFewRowsFails() {
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("a", new double[] {1, 2});
        cols.put("y", new double[] {1, 3});
        ModelFitException e = assertThrows(ModelFitException.class,
            () -> new LinearRegression.Trainer().fit(new TabularDataset(cols, "y")));
        assertEquals(ModelFamily.LINEAR_REGRESSION, e.getFamily());
    }
}
