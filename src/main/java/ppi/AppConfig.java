package ppi;

import ppi.ml.DynamicForecastEngine;
import ppi.ml.PipelineSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings from {@code ppi.properties} on the classpath, overridden by the
 * {@code PORT} and {@code PPI_DATA} environment variables.
 */
public final class AppConfig {

    static final String RESOURCE = "/ppi.properties";

    private final Properties props;

    AppConfig(Properties props, Map<String, String> env) {
        this.props = new Properties();
        this.props.putAll(props);
        String port = env.get("PORT");
        if (port != null && !port.isBlank()) this.props.setProperty("server.port", port.trim());
        String data = env.get("PPI_DATA");
        if (data != null && !data.isBlank()) this.props.setProperty("data.path", data.trim());
        validate();
    }

    public static AppConfig load() {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE, e);
        }
        return new AppConfig(props, System.getenv());
    }

    private void validate() {
        getPort();
        pipelineSettings();
        getAlertThreshold();
        getHistoryPoints();
        getAdjustmentPercent();
        getMaxHorizon();
    }

    public int getPort() {
        int port = getInt("server.port", 7000);
        if (port < 1 || port > 65535) throw new IllegalArgumentException("server.port out of range: " + port);
        return port;
    }

    /** Empty means: use generated sample data. */
    public Optional<Path> getDataPath() {
        String v = props.getProperty("data.path", "").trim();
        return v.isEmpty() ? Optional.empty() : Optional.of(Paths.get(v));
    }

    public String getTarget() {
        return props.getProperty("data.target", "agriculture").trim().toLowerCase();
    }

    public long getSeed() {
        return getLong("split.seed", 123);
    }

    public PipelineSettings pipelineSettings() {
        return new PipelineSettings()
            .trainFraction(getDouble("split.train", 0.8))
            .seed(getSeed())
            .keepFeatures(getInt("features.keep", 3))
            .rankingTrees(getInt("features.trees", 500))
            .forecastSteps(getInt("forecast.steps", 12))
            .level(getDouble("forecast.level", 95))
            .sensitivityPredictor(props.getProperty("sensitivity.predictor", "mining"))
            .sensitivityModel(props.getProperty("sensitivity.model", "RANDOM_FOREST"));
    }

    public double getAlertThreshold() {
        return getDouble("alert.threshold", 180);
    }

    public int getHistoryPoints() {
        int v = getInt("history.points", 80);
        if (v < 1) throw new IllegalArgumentException("history.points must be positive: " + v);
        return v;
    }

    /** Furthest target month a recompute may ask for, in months from now. */
    public int getMaxHorizon() {
        int v = getInt("forecast.maxHorizon", DynamicForecastEngine.DEFAULT_MAX_HORIZON);
        if (v < 1) throw new IllegalArgumentException("forecast.maxHorizon must be positive: " + v);
        return v;
    }

    public double getAdjustmentPercent() {
        return getDouble("sensitivity.adjustment", 10);
    }

    private int getInt(String key, int def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private long getLong(String key, long def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private double getDouble(String key, double def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + v, e);
        }
    }
}
