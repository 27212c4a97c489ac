package ppi.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ppi.data.Series;

/**
 * Chooses an ARIMA order automatically: differencing by repeated KPSS tests, then
 * every (p,q)(P,Q) combination up to the configured maxima, lowest AICc wins.
 * Candidates that fail to converge are skipped.
 */
public final class AutoArima implements Trainable<Series, TimeSeriesModel> {

    private static final Logger LOG = LoggerFactory.getLogger(AutoArima.class);

    /** KPSS level-stationarity critical value at 5 %. */
    static final double KPSS_CRITICAL = 0.463;

    private final int maxP;
    private final int maxQ;
    private final int maxD;
    private final int seasonalPeriod;

    public AutoArima() {
        this(2, 2, 2, 12);
    }

    public AutoArima(int maxP, int maxQ, int maxD, int seasonalPeriod) {
        this.maxP = maxP;
        this.maxQ = maxQ;
        this.maxD = maxD;
        this.seasonalPeriod = seasonalPeriod;
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.ARIMA;
    }

    @Override
    public TimeSeriesModel fit(Series series) {
        double[] y = series.values();
        int d = differencingOrder(y, maxD);
        boolean seasonal = seasonalPeriod > 1 && y.length - d >= 3 * seasonalPeriod;
        int maxSeasonal = seasonal ? 1 : 0;
        int s = seasonal ? seasonalPeriod : 1;
        int conditioning = Math.max(maxP, maxQ) + s * maxSeasonal;
        boolean withConstant = d <= 1;

        Sarima best = null;
        int failed = 0;
        for (int p = 0; p <= maxP; p++) {
            for (int q = 0; q <= maxQ; q++) {
                for (int sp = 0; sp <= maxSeasonal; sp++) {
                    for (int sq = 0; sq <= maxSeasonal; sq++) {
                        try {
                            Sarima candidate = new Sarima(series, p, d, q, sp, 0, sq, s, withConstant, conditioning);
                            if (best == null || candidate.aicc() < best.aicc()) best = candidate;
                        } catch (ModelFitException e) {
                            failed++;
                            LOG.debug("Skipping candidate: {}", e.getMessage());
                        }
                    }
                }
            }
        }
        if (best == null) {
            throw new ModelFitException(ModelFamily.ARIMA, "no candidate order converged (" + failed + " tried)");
        }
        LOG.info("Selected {} (d from KPSS = {}, AICc {}, {} candidates skipped)",
            best.describe(), d, String.format("%.2f", best.aicc()), failed);
        return best;
    }

    /** Number of first differences needed before KPSS no longer rejects level stationarity. */
    static int differencingOrder(double[] y, int maxD) {
        double[] x = y;
        int d = 0;
        while (d < maxD && x.length > 3 && kpss(x) > KPSS_CRITICAL) {
            double[] next = new double[x.length - 1];
            for (int i = 1; i < x.length; i++) next[i - 1] = x[i] - x[i - 1];
            x = next;
            d++;
        }
        return d;
    }

    /** KPSS statistic for level stationarity with the short Bartlett lag truncation. */
    static double kpss(double[] x) {
        int n = x.length;
        double m = Sarima.mean(x);
        double partial = 0;
        double eta = 0;
        double gamma0 = 0;
        for (double v : x) {
            double e = v - m;
            partial += e;
            eta += partial * partial;
            gamma0 += e * e;
        }
        gamma0 /= n;
        int lags = (int) Math.floor(4 * Math.pow(n / 100.0, 0.25));
        double lrv = gamma0;
        for (int j = 1; j <= lags; j++) {
            double cov = 0;
            for (int t = j; t < n; t++) cov += (x[t] - m) * (x[t - j] - m);
            lrv += 2 * (1 - j / (lags + 1.0)) * cov / n;
        }
        if (lrv <= 0) return 0;
        return eta / ((double) n * n * lrv);
    }
}
