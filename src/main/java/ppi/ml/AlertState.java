package ppi.ml;

public final class AlertState {

    private final double threshold;
    private final boolean triggered;
    private final String message;

    public AlertState(double threshold, boolean triggered, String message) {
        this.threshold = threshold;
        this.triggered = triggered;
        this.message = message;
    }

    public double getThreshold() { return threshold; }
    public boolean isTriggered() { return triggered; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return message;
    }
}
