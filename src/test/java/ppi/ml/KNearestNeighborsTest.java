package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ppi.data.TabularDataset;

public class KNearestNeighborsTest {

    private static TabularDataset dataset(double[] a, double[] b, double[] y) {
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("a", a);
        cols.put("b", b);
        cols.put("y", y);
        return new TabularDataset(cols, "y");
    }

    @Test
    public void testAveragesNearestTargets() {
        TabularDataset train = dataset(
            new double[] {0, 1, 2, 10, 11},
            new double[] {0, 0, 0, 0, 0},
            new double[] {1, 2, 3, 100, 200});
        KNearestNeighbors knn = new KNearestNeighbors(train, 2);
        double[] p = knn.predict(dataset(new double[] {0.4, 10.4}, new double[] {0, 0}, new double[] {0, 0}));
        assertEquals(1.5, p[0], 1e-12);
        assertEquals(150, p[1], 1e-12);
    }

    @Test
    public void testFeaturesAreScaled() {
        // raw distance puts the query next to the first row; scaled it is next to the second
        TabularDataset train = dataset(
            new double[] {0, 1},
            new double[] {1000, 2000},
            new double[] {5, 50});
        KNearestNeighbors knn = new KNearestNeighbors(train, 1);
        double[] p = knn.predict(dataset(new double[] {1}, new double[] {1100}, new double[] {0}));
        assertEquals(50, p[0], 1e-12);
    }

    @Test
    public void testKLargerThanTrainingSetFails() {
        TabularDataset train = dataset(new double[] {1, 2}, new double[] {1, 2}, new double[] {1, 2});
        assertThrows(ModelFitException.class, () -> new KNearestNeighbors.Trainer().fit(train));
    }
}
