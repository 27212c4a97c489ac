package ppi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import ppi.ml.PipelineSettings;

public class AppConfigTest {

    private static final Map<String, String> NO_ENV = Collections.emptyMap();

    @Test
    public void testDefaults() {
        AppConfig config = new AppConfig(new Properties(), NO_ENV);
        assertEquals(7000, config.getPort());
        assertFalse(config.getDataPath().isPresent());
        assertEquals("agriculture", config.getTarget());
        assertEquals(180, config.getAlertThreshold(), 0);
        assertEquals(144, config.getMaxHorizon());
        PipelineSettings settings = config.pipelineSettings();
        assertEquals(0.8, settings.getTrainFraction(), 0);
        assertEquals(123, settings.getSeed());
        assertEquals("mining", settings.getSensitivityPredictor());
        assertEquals("RANDOM_FOREST", settings.getSensitivityModel());
    }

    @Test
    public void testBundledPropertiesLoad() {
        AppConfig config = AppConfig.load();
        assertTrue(config.getPort() > 0);
        assertEquals(3, config.pipelineSettings().getKeepFeatures());
    }

    @Test
    public void testEnvironmentOverridesProperties() {
        Properties props = new Properties();
        props.setProperty("server.port", "8080");
        Map<String, String> env = new HashMap<>();
        env.put("PORT", "9090");
        env.put("PPI_DATA", "/data/ppi.csv");
        AppConfig config = new AppConfig(props, env);
        assertEquals(9090, config.getPort());
        assertEquals(Paths.get("/data/ppi.csv"), config.getDataPath().get());
    }

    @Test
    public void testInvalidValuesNameTheKey() {
        Properties props = new Properties();
        props.setProperty("split.train", "eighty");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new AppConfig(props, NO_ENV));
        assertTrue(e.getMessage().contains("split.train"));

        Properties badPort = new Properties();
        badPort.setProperty("server.port", "70000");
        assertThrows(IllegalArgumentException.class, () -> new AppConfig(badPort, NO_ENV));

        Properties badHorizon = new Properties();
        badHorizon.setProperty("forecast.maxHorizon", "0");
        IllegalArgumentException horizon = assertThrows(IllegalArgumentException.class,
            () -> new AppConfig(badHorizon, NO_ENV));
        assertTrue(horizon.getMessage().contains("forecast.maxHorizon"));

        Properties badModel = new Properties();
        badModel.setProperty("sensitivity.model", "ETS");
        assertThrows(IllegalArgumentException.class, () -> new AppConfig(badModel, NO_ENV));
    }
}
