package ppi;

import ppi.ml.AlertState;
import ppi.ml.DynamicForecast;
import ppi.ml.SensitivityResult;

public final class RecomputeResult {

    private final RecomputeRequest request;
    private final DynamicForecast forecast;
    private final SensitivityResult sensitivity;
    private final AlertState alert;

    public RecomputeResult(RecomputeRequest request, DynamicForecast forecast,
                           SensitivityResult sensitivity, AlertState alert) {
        this.request = request;
        this.forecast = forecast;
        this.sensitivity = sensitivity;
        this.alert = alert;
    }

    public RecomputeRequest getRequest() { return request; }
    public DynamicForecast getForecast() { return forecast; }
    public SensitivityResult getSensitivity() { return sensitivity; }
    public AlertState getAlert() { return alert; }
}
