package ppi;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.Series;
import ppi.ml.BankResult;
import ppi.ml.EvaluationResult;
import ppi.ml.ExponentialSmoothing;
import ppi.ml.Forecast;
import ppi.ml.ForecastException;
import ppi.ml.GradientBoostedTrees;
import ppi.ml.InvalidHorizonException;
import ppi.ml.KNearestNeighbors;
import ppi.ml.LinearRegression;
import ppi.ml.Metrics;
import ppi.ml.ModelFamily;
import ppi.ml.ModelFitException;
import ppi.ml.PipelineRun;
import ppi.ml.RandomForest;
import ppi.ml.Sarima;
import ppi.ml.SensitivityResult;
import ppi.ml.TrainedModel;

import java.lang.reflect.Type;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON request/response mapping for the web front end. Kept free of the HTTP
 * server so each endpoint is a plain function of its input.
 */
public final class ForecastApi {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastApi.class);
    private static final Gson GSON = new Gson();

    /** Status code and JSON-ready body. */
    public static final class Response {
        private final int status;
        private final Object body;

        Response(int status, Object body) {
            this.status = status;
            this.body = body;
        }

        public int getStatus() { return status; }
        public Object getBody() { return body; }

        public String toJson() {
            return GSON.toJson(body);
        }
    }

    private final PipelineRun run;
    private final ForecastSession session;
    private final AppConfig config;

    public ForecastApi(PipelineRun run, ForecastSession session, AppConfig config) {
        this.run = run;
        this.session = session;
        this.config = config;
    }

    public Response recompute(String body) {
        RecomputeRequest request;
        try {
            request = parseRequest(body);
        } catch (IllegalArgumentException e) {
            return error(400, e.getMessage());
        }
        try {
            return new Response(200, toJson(session.recompute(request)));
        } catch (InvalidHorizonException | IllegalArgumentException e) {
            LOG.info("Rejected recompute {}: {}", request, e.getMessage());
            return error(400, e.getMessage());
        } catch (ForecastException e) {
            LOG.warn("Recompute failed for {}", request, e);
            return error(500, e.getMessage());
        }
    }

    public Response last() {
        return session.lastResult()
            .map(r -> new Response(200, toJson(r)))
            .orElseGet(() -> error(404, "No forecast has been generated yet"));
    }

    public Response models() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timeSeries", bankTable(run.getTimeSeries(), run.getBestTimeSeries().getFamily()));
        out.put("regression", bankTable(run.getRegression(), run.getBestRegression().getFamily()));
        out.put("ranking", run.getRanking().asMap());
        out.put("selectedPredictors", run.getSelectedPredictors());
        out.put("sensitivityModel", session.getModels().getRegressionModel().describe());
        out.put("sensitivityPredictor", session.getModels().getSensitivityPredictor());
        return new Response(200, out);
    }

    RecomputeRequest parseRequest(String body) {
        if (body == null || body.isBlank()) throw new IllegalArgumentException("Missing request body");
        Map<String, Object> req;
        try {
            Type type = new TypeToken<Map<String, Object>>() {}.getType();
            req = GSON.fromJson(body, type);
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Invalid JSON", e);
        }
        if (req == null) throw new IllegalArgumentException("Invalid JSON");
        YearMonth next = YearMonth.now(session.getClock()).plusYears(1);
        return new RecomputeRequest(
            getWholeNumber(req, "year", next.getYear()),
            getWholeNumber(req, "month", 12),
            getNumber(req, "adjustment", config.getAdjustmentPercent()),
            getWholeNumber(req, "historyPoints", config.getHistoryPoints()),
            getNumber(req, "threshold", config.getAlertThreshold()));
    }

    private static int getWholeNumber(Map<String, Object> m, String key, int def) {
        double v = getNumber(m, key, def);
        if (v != Math.rint(v) || v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("'" + key + "' must be a whole number");
        }
        return (int) v;
    }

    private static double getNumber(Map<String, Object> m, String key, double def) {
        Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Number) return ((Number) v).doubleValue();
        if (v instanceof String) {
            try {
                return Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' must be a number", e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' must be a number");
    }

    static Map<String, Object> toJson(RecomputeResult r) {
        Map<String, Object> out = new LinkedHashMap<>();
        Forecast f = r.getForecast().getForecast();
        Map<String, Object> forecast = new LinkedHashMap<>();
        List<String> months = new ArrayList<>();
        for (int i = 0; i < f.getHorizon(); i++) months.add(f.monthAt(i).toString());
        forecast.put("target", r.getForecast().getTarget().toString());
        forecast.put("horizon", r.getForecast().getHorizon());
        forecast.put("level", f.getLevel());
        forecast.put("months", months);
        forecast.put("mean", f.getMean());
        forecast.put("lower", f.getLower());
        forecast.put("upper", f.getUpper());
        out.put("forecast", forecast);

        Series h = r.getForecast().getHistory();
        List<String> historyMonths = new ArrayList<>();
        for (int i = 0; i < h.size(); i++) historyMonths.add(h.monthAt(i).toString());
        Map<String, Object> history = new LinkedHashMap<>();
        history.put("months", historyMonths);
        history.put("values", h.values());
        out.put("history", history);

        SensitivityResult s = r.getSensitivity();
        Map<String, Object> sensitivity = new LinkedHashMap<>();
        sensitivity.put("predictor", s.getPredictor());
        sensitivity.put("adjustment", s.getAdjustmentPercent());
        sensitivity.put("actual", s.getActual());
        sensitivity.put("predicted", s.getPredicted());
        sensitivity.put("baseline", s.getBaseline());
        sensitivity.put("meanShift", s.meanShift());
        out.put("sensitivity", sensitivity);

        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("threshold", r.getAlert().getThreshold());
        alert.put("triggered", r.getAlert().isTriggered());
        alert.put("message", r.getAlert().getMessage());
        out.put("alert", alert);
        return out;
    }

    private static <M extends TrainedModel> Map<String, Object> bankTable(BankResult<M> bank, ModelFamily selected) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (EvaluationResult<M> r : bank.getResults()) {
            Metrics m = r.getMetrics();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("family", r.getFamily().name());
            row.put("model", r.getModel().describe());
            row.put("rmse", m.getRmse());
            row.put("mae", m.getMae());
            row.put("mape", m.isMapeDefined() ? m.getMape() : null);
            row.put("r2", m.isRSquaredDefined() ? m.getRSquared() : null);
            row.put("parameters", parameters(r.getModel()));
            row.put("selected", r.getFamily() == selected);
            rows.add(row);
        }
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<ModelFamily, ModelFitException> e : bank.getFailures().entrySet()) {
            failures.put(e.getKey().name(), e.getValue().getMessage());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("results", rows);
        out.put("failures", failures);
        return out;
    }

    /** Fitted parameters of the families that have any worth reporting. */
    static Map<String, Object> parameters(TrainedModel model) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (model instanceof Sarima) {
            Sarima m = (Sarima) model;
            out.put("order", new int[] {m.getP(), m.getD(), m.getQ()});
            out.put("seasonalOrder", new int[] {m.getSeasonalP(), m.getSeasonalD(), m.getSeasonalQ()});
            out.put("seasonLength", m.getSeasonLength());
            out.put("constant", m.hasConstant());
            out.put("mean", m.getMean());
            out.put("ar", m.getAr());
            out.put("ma", m.getMa());
            out.put("sigma2", m.getSigma2());
        } else if (model instanceof ExponentialSmoothing) {
            ExponentialSmoothing m = (ExponentialSmoothing) model;
            out.put("form", m.getForm().name());
            out.put("alpha", m.getAlpha());
            out.put("beta", m.getBeta());
            out.put("phi", m.getPhi());
        } else if (model instanceof LinearRegression) {
            LinearRegression m = (LinearRegression) model;
            double[] beta = m.getCoefficients();
            Map<String, Double> coefficients = new LinkedHashMap<>();
            List<String> predictors = m.getPredictors();
            for (int i = 0; i < predictors.size(); i++) coefficients.put(predictors.get(i), beta[i + 1]);
            out.put("intercept", m.getIntercept());
            out.put("coefficients", coefficients);
            out.put("rSquared", m.getRSquared());
            out.put("adjustedRSquared", m.getAdjustedRSquared());
        } else if (model instanceof RandomForest) {
            RandomForest m = (RandomForest) model;
            out.put("trees", m.getTreeCount());
            out.put("mtry", m.getMtry());
        } else if (model instanceof GradientBoostedTrees) {
            out.put("rounds", ((GradientBoostedTrees) model).getRounds());
        } else if (model instanceof KNearestNeighbors) {
            out.put("k", ((KNearestNeighbors) model).getK());
        }
        return out;
    }

    static Response error(int status, String message) {
        Map<String, Object> err = new HashMap<>();
        err.put("error", message != null && !message.isEmpty() ? message : "Unexpected error");
        return new Response(status, err);
    }
}
