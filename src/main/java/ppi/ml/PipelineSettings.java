package ppi.ml;

/** Tunables of one pipeline run. Defaults reproduce the reference analysis. */
public final class PipelineSettings {

    /** Regression model used for what-if scoring: a family name, or {@link #BEST} for the selector's pick. */
    public static final String BEST = "BEST";

    private double trainFraction = 0.8;
    private long seed = 123;
    private int keepFeatures = 3;
    private int rankingTrees = FeatureSelector.DEFAULT_TREES;
    private int forecastSteps = TimeSeriesModelBank.DEFAULT_STEPS;
    private double level = 95;
    private String sensitivityPredictor = "mining";
    private String sensitivityModel = ModelFamily.RANDOM_FOREST.name();

    public double getTrainFraction() { return trainFraction; }
    public long getSeed() { return seed; }
    public int getKeepFeatures() { return keepFeatures; }
    public int getRankingTrees() { return rankingTrees; }
    public int getForecastSteps() { return forecastSteps; }
    public double getLevel() { return level; }
    public String getSensitivityPredictor() { return sensitivityPredictor; }
    public String getSensitivityModel() { return sensitivityModel; }

    public PipelineSettings trainFraction(double v) {
        if (!(v > 0 && v < 1)) throw new IllegalArgumentException("train fraction must be in (0, 1): " + v);
        trainFraction = v;
        return this;
    }

    public PipelineSettings seed(long v) {
        seed = v;
        return this;
    }

    public PipelineSettings keepFeatures(int v) {
        if (v < 1) throw new IllegalArgumentException("keepFeatures must be positive: " + v);
        keepFeatures = v;
        return this;
    }

    public PipelineSettings rankingTrees(int v) {
        if (v < 1) throw new IllegalArgumentException("rankingTrees must be positive: " + v);
        rankingTrees = v;
        return this;
    }

    public PipelineSettings forecastSteps(int v) {
        if (v < 1) throw new IllegalArgumentException("forecastSteps must be positive: " + v);
        forecastSteps = v;
        return this;
    }

    public PipelineSettings level(double v) {
        if (!(v > 0 && v < 100)) throw new IllegalArgumentException("level must be in (0, 100): " + v);
        level = v;
        return this;
    }

    public PipelineSettings sensitivityPredictor(String v) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException("sensitivity predictor required");
        sensitivityPredictor = v.trim().toLowerCase();
        return this;
    }

    public PipelineSettings sensitivityModel(String v) {
        String name = v == null ? "" : v.trim().toUpperCase();
        if (!BEST.equals(name)) {
            try {
                if (ModelFamily.valueOf(name).isTimeSeries()) {
                    throw new IllegalArgumentException(name + " is not a regression family");
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("sensitivity model must be BEST or a regression family: " + v, e);
            }
        }
        sensitivityModel = name;
        return this;
    }
}
