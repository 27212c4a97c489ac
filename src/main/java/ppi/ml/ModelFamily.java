package ppi.ml;

public enum ModelFamily {
    ARIMA(true),
    ETS(true),
    LINEAR_REGRESSION(false),
    RANDOM_FOREST(false),
    GRADIENT_BOOSTED_TREES(false),
    KNN(false);

    private final boolean timeSeries;

    ModelFamily(boolean timeSeries) {
        this.timeSeries = timeSeries;
    }

    public boolean isTimeSeries() { return timeSeries; }
}
