package ppi;

import ppi.data.CsvDatasetReader;
import ppi.data.IndexData;
import ppi.data.SampleData;
import ppi.ml.BankResult;
import ppi.ml.DynamicForecastEngine;
import ppi.ml.EvaluationResult;
import ppi.ml.ForecastException;
import ppi.ml.ForecastPipeline;
import ppi.ml.PipelineRun;
import ppi.ml.TrainedModel;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.YearMonth;

/**
 * Console run: fit and compare all models, then recompute one dynamic forecast.
 * Usage: Main [csv-path] [target-year target-month]
 */
public class Main {

    public static void main(String[] args) throws IOException {
        AppConfig config = AppConfig.load();
        IndexData data;
        if (args.length > 0 && !args[0].trim().isEmpty()) {
            data = new CsvDatasetReader(config.getTarget()).read(Paths.get(args[0].trim()));
        } else {
            data = SampleData.generate(180, config.getSeed());
        }

        PipelineRun run = new ForecastPipeline(config.pipelineSettings()).run(data);

        System.out.println("=== Time-series models (in-sample) ===");
        print(run.getTimeSeries(), run.getBestTimeSeries());
        System.out.println();
        System.out.println("=== Feature ranking ===");
        run.getRanking().asMap().forEach((k, v) -> System.out.printf("  %-15s %.2f%n", k, v));
        System.out.println("Selected: " + run.getSelectedPredictors());
        System.out.println();
        System.out.println("=== Regression models (held-out) ===");
        print(run.getRegression(), run.getBestRegression());
        System.out.println();

        YearMonth next = YearMonth.now().plusYears(1);
        int year = args.length > 2 ? Integer.parseInt(args[1].trim()) : next.getYear();
        int month = args.length > 2 ? Integer.parseInt(args[2].trim()) : 12;
        ForecastSession session = new ForecastSession(run.getFittedModels(),
            new DynamicForecastEngine(config.pipelineSettings().getLevel(), config.getMaxHorizon()), Clock.systemDefaultZone());
        try {
            RecomputeResult r = session.recompute(new RecomputeRequest(year, month,
                config.getAdjustmentPercent(), config.getHistoryPoints(), config.getAlertThreshold()));
            double[] mean = r.getForecast().getForecast().getMean();
            System.out.printf("=== Dynamic forecast to %s (h=%d) ===%n", r.getForecast().getTarget(), mean.length);
            System.out.println("Forecast: " + format(mean, 12));
            System.out.printf("Sensitivity (%s %+.0f%%): mean shift %.3f%n", r.getSensitivity().getPredictor(),
                r.getSensitivity().getAdjustmentPercent(), r.getSensitivity().meanShift());
            System.out.println(r.getAlert().getMessage());
        } catch (ForecastException | IllegalArgumentException e) {
            System.err.println("Error in forecast: " + e.getMessage());
        }
    }

    private static <M extends TrainedModel> void print(BankResult<M> bank, EvaluationResult<M> best) {
        for (EvaluationResult<M> r : bank.getResults()) {
            System.out.printf("%s %-28s %s%n", r == best ? "*" : " ", r.getModel().describe(), r.getMetrics());
        }
        bank.getFailures().forEach((family, e) -> System.out.println("  failed: " + e.getMessage()));
    }

    private static String format(double[] a, int max) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(a.length, max); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.2f", a[i]));
        }
        if (a.length > max) sb.append("...");
        sb.append("]");
        return sb.toString();
    }
}
