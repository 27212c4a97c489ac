package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ppi.data.TabularDataset;
import ppi.data.TrainTestSplit;

public class SensitivityAnalyzerTest {

    private LinearRegression model;
    private TabularDataset test;

    @BeforeEach
    public void setUp() {
        TrainTestSplit split = TestData.regression(200, 5).split(0.8, 123).select(Arrays.asList("strong", "weak"));
        model = new LinearRegression(split.getTrain());
        test = split.getTest();
    }

    @Test
    public void testZeroAdjustmentReproducesPredictions() {
        SensitivityResult result = SensitivityAnalyzer.analyze(model, test, "strong", 0);
        assertArrayEquals(model.predict(test), result.getPredicted());
        assertArrayEquals(test.targetValues(), result.getActual());
        assertEquals(0.0, result.meanShift());
    }

    @Test
    public void testShockMovesPredictionsByCoefficient() {
        double[] strong = test.column("strong");
        SensitivityResult up = SensitivityAnalyzer.analyze(model, test, "strong", 10);
        SensitivityResult down = SensitivityAnalyzer.analyze(model, test, "strong", -10);
        double beta = model.getCoefficient(0);
        double[] base = up.getBaseline();
        for (int i = 0; i < strong.length; i++) {
            assertEquals(base[i] + beta * 0.1 * strong[i], up.getPredicted()[i], 1e-9);
            assertEquals(base[i] - beta * 0.1 * strong[i], down.getPredicted()[i], 1e-9);
        }
        assertEquals(-up.meanShift(), down.meanShift(), 1e-9);
    }

    @Test
    public void testTestPartitionIsNotModified() {
        double[] before = test.column("strong");
        SensitivityAnalyzer.analyze(model, test, "strong", 50);
        assertArrayEquals(before, test.column("strong"));
    }

    @Test
    public void testUnknownPredictor() {
        assertThrows(IllegalArgumentException.class, () -> SensitivityAnalyzer.analyze(model, test, "noise", 10));
    }
}
