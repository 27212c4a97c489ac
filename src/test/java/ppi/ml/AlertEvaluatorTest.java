package ppi.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.YearMonth;

import org.junit.jupiter.api.Test;

public class AlertEvaluatorTest {

    @Test
    public void testTriggeredWhenAnyPointAboveThreshold() {
        AlertState state = AlertEvaluator.evaluate(new double[] {170, 175, 190}, 180);
        assertTrue(state.isTriggered());
        assertEquals(AlertEvaluator.ALERT_MESSAGE, state.getMessage());
        assertEquals(180.0, state.getThreshold());
    }

    @Test
    public void testClearWhenAllPointsBelow() {
        AlertState state = AlertEvaluator.evaluate(new double[] {170, 175, 179}, 180);
        assertFalse(state.isTriggered());
        assertEquals(AlertEvaluator.CLEAR_MESSAGE, state.getMessage());
    }

    @Test
    public void testPointEqualToThresholdDoesNotTrigger() {
        assertFalse(AlertEvaluator.evaluate(new double[] {180}, 180).isTriggered());
    }

    @Test
    public void testUsesForecastMean() {
        Forecast forecast = new Forecast(YearMonth.of(2025, 1), new double[] {150, 181},
            new double[] {140, 170}, new double[] {160, 192}, 95);
        assertTrue(AlertEvaluator.evaluate(forecast, 180).isTriggered());
        assertFalse(AlertEvaluator.evaluate(forecast, 185).isTriggered());
    }
}
