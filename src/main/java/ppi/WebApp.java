package ppi;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.staticfiles.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.CsvDatasetReader;
import ppi.data.IndexData;
import ppi.data.SampleData;
import ppi.ml.DynamicForecastEngine;
import ppi.ml.ForecastPipeline;
import ppi.ml.PipelineRun;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Web app for dynamic PPI prediction: all models are fit once at start-up, then every
 * "Generate" press recomputes the forecast, the sensitivity scores and the alert.
 * Run with: mvn exec:java -Dexec.mainClass="ppi.WebApp"
 * Open http://localhost:7000 (or http://127.0.0.1:7000)
 */
public class WebApp {

    private static final Logger LOG = LoggerFactory.getLogger(WebApp.class);

    public static void main(String[] args) throws IOException {
        AppConfig config = AppConfig.load();
        IndexData data = loadData(config);
        PipelineRun run = new ForecastPipeline(config.pipelineSettings()).run(data);
        ForecastSession session = new ForecastSession(run.getFittedModels(),
            new DynamicForecastEngine(config.pipelineSettings().getLevel(), config.getMaxHorizon()), Clock.systemDefaultZone());
        ForecastApi api = new ForecastApi(run, session, config);

        int port = config.getPort();
        Javalin app = Javalin.create(cfg -> {
            cfg.staticFiles.add("/public", Location.CLASSPATH);
        }).start("0.0.0.0", port);

        // Serve index from classpath so it always works (avoids static path issues)
        app.get("/", ctx -> ctx.contentType("text/html").result(loadIndexHtml()));

        app.post("/api/recompute", ctx -> send(ctx, api.recompute(ctx.body())));
        app.get("/api/last", ctx -> send(ctx, api.last()));
        app.get("/api/models", ctx -> send(ctx, api.models()));

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            send(ctx, new ForecastApi.Response(200, h));
        });

        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {}", ctx.path(), e);
            send(ctx, ForecastApi.error(500, e.getMessage()));
        });

        LOG.info("PPI forecast web app: http://localhost:{}", port);
    }

    static IndexData loadData(AppConfig config) throws IOException {
        Optional<Path> path = config.getDataPath();
        if (path.isPresent()) {
            LOG.info("Reading dataset from {}", path.get());
            return new CsvDatasetReader(config.getTarget()).read(path.get());
        }
        LOG.info("No data.path configured; using generated sample data");
        return SampleData.generate(180, config.getSeed());
    }

    private static void send(Context ctx, ForecastApi.Response response) {
        ctx.status(response.getStatus()).contentType("application/json").result(response.toJson());
    }

    private static String loadIndexHtml() {
        try (InputStream in = WebApp.class.getResourceAsStream("/public/index.html")) {
            if (in == null) throw new IllegalStateException("Missing /public/index.html on classpath");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Could not load index.html", e);
        }
    }
}
