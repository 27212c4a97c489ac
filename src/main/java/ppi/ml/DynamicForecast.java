package ppi.ml;

import ppi.data.Series;

import java.time.YearMonth;

/** A forecast regenerated for a requested target month, plus the history window to show with it. */
public final class DynamicForecast {

    private final YearMonth target;
    private final int horizon;
    private final Forecast forecast;
    private final Series history;

    public DynamicForecast(YearMonth target, int horizon, Forecast forecast, Series history) {
        this.target = target;
        this.horizon = horizon;
        this.forecast = forecast;
        this.history = history;
    }

    public YearMonth getTarget() { return target; }
    public int getHorizon() { return horizon; }
    public Forecast getForecast() { return forecast; }

    /** Trailing observations requested for display, clamped to what exists. */
    public Series getHistory() { return history; }
}
