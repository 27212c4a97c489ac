package ppi;

/** Parameters of one user-triggered recompute. */
public final class RecomputeRequest {

    private final int year;
    private final int month;
    private final double adjustmentPercent;
    private final int historyPoints;
    private final double threshold;

    public RecomputeRequest(int year, int month, double adjustmentPercent, int historyPoints, double threshold) {
        if (month < 1 || month > 12) throw new IllegalArgumentException("month must be 1-12: " + month);
        if (historyPoints < 1) throw new IllegalArgumentException("historyPoints must be positive: " + historyPoints);
        if (Double.isNaN(adjustmentPercent) || Double.isInfinite(adjustmentPercent)) {
            throw new IllegalArgumentException("adjustment must be a finite number");
        }
        if (Double.isNaN(threshold)) throw new IllegalArgumentException("threshold must be a number");
        this.year = year;
        this.month = month;
        this.adjustmentPercent = adjustmentPercent;
        this.historyPoints = historyPoints;
        this.threshold = threshold;
    }

    public int getYear() { return year; }
    public int getMonth() { return month; }
    public double getAdjustmentPercent() { return adjustmentPercent; }
    public int getHistoryPoints() { return historyPoints; }
    public double getThreshold() { return threshold; }

    @Override
    public String toString() {
        return String.format("target=%d-%02d adjustment=%.1f%% history=%d threshold=%.1f",
            year, month, adjustmentPercent, historyPoints, threshold);
    }
}
