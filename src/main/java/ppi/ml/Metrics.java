package ppi.ml;

/**
 * Goodness-of-fit summary. MAPE and R² are {@code NaN} when undefined for the data;
 * check {@link #isMapeDefined()} and {@link #isRSquaredDefined()}.
 */
public final class Metrics {

    private final double rmse;
    private final double mae;
    private final double mape;
    private final double rSquared;

    public Metrics(double rmse, double mae, double mape, double rSquared) {
        this.rmse = rmse;
        this.mae = mae;
        this.mape = mape;
        this.rSquared = rSquared;
    }

    public double getRmse() { return rmse; }
    public double getMae() { return mae; }
    public double getMape() { return mape; }
    public double getRSquared() { return rSquared; }

    public boolean isMapeDefined() { return !Double.isNaN(mape); }
    public boolean isRSquaredDefined() { return !Double.isNaN(rSquared); }

    @Override
    public String toString() {
        return String.format("RMSE=%.4f MAE=%.4f MAPE=%s R2=%s", rmse, mae,
            isMapeDefined() ? String.format("%.3f%%", mape) : "undefined",
            isRSquaredDefined() ? String.format("%.4f", rSquared) : "undefined");
    }
}
