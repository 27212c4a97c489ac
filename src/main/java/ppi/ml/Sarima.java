package ppi.ml;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import ppi.data.Series;

import java.util.Arrays;

/**
 * Seasonal Autoregressive Integrated Moving Average (SARIMA) fit by conditional sum of squares.
 * <p>
 * Model: SARIMA(p,d,q)(P,D,Q)s
 * φ(B)Φ(B^s) (∇^d ∇_s^D y_t - μ) = θ(B)Θ(B^s) ε_t
 * <p>
 * - p,d,q: non-seasonal AR order, differencing, MA order
 * - P,D,Q: seasonal AR, seasonal differencing, seasonal MA
 * - s: season length (12 for monthly data with yearly seasonality)
 * - μ: mean of the differenced series (drift when d = 1), only when fit with a constant
 * <p>
 * Seasonal lags enter the recursion additively at s·k.
 */
public class Sarima extends TimeSeriesModel {

    static final double COEFFICIENT_BOUND = 0.98;
    static final int MAX_EVALUATIONS = 4000;

    private final int p, d, q, P, D, Q, s;
    private final boolean withConstant;
    private final int start;
    private final int[] lags;
    private final double[][] levels;
    private final double[] ar;
    private final double[] ma;
    private final double[] seasonalAr;
    private final double[] seasonalMa;
    private final double mu;
    private final double[] innovations;
    private final double sigma2;
    private final int effectiveObs;
    private final int nParams;
    private final double[] fitted;

    /**
     * @param conditioningLag first differenced observation whose innovation counts toward
     *                        the sum of squares; raised to the model's own maximum lag if smaller
     * @throws ModelFitException if the series is too short or the optimizer fails
     */
    public Sarima(Series history, int p, int d, int q, int P, int D, int Q, int s,
                  boolean withConstant, int conditioningLag) {
        super(ModelFamily.ARIMA, history);
        if (p < 0 || d < 0 || q < 0 || P < 0 || D < 0 || Q < 0 || s < 1) {
            throw new IllegalArgumentException("orders must be non-negative and s positive");
        }
        this.p = p;
        this.d = d;
        this.q = q;
        this.P = P;
        this.D = D;
        this.Q = Q;
        this.s = s;
        this.withConstant = withConstant;

        this.lags = new int[d + D];
        for (int i = 0; i < d; i++) lags[i] = 1;
        for (int i = 0; i < D; i++) lags[d + i] = s;
        this.levels = new double[lags.length + 1][];
        levels[0] = history.values();
        for (int k = 0; k < lags.length; k++) {
            levels[k + 1] = diff(levels[k], lags[k]);
        }
        double[] z = levels[lags.length];

        this.start = Math.max(conditioningLag, Math.max(p + s * P, q + s * Q));
        this.nParams = p + q + P + Q + (withConstant ? 1 : 0);
        this.effectiveObs = z.length - start;
        if (effectiveObs < nParams + 3) {
            throw new ModelFitException(ModelFamily.ARIMA, describe() + ": too few observations (" + z.length + ")");
        }

        double zMean = mean(z);
        double zScale = Math.max(stdDev(z, zMean), 1e-8);
        double[] theta = estimate(z, zMean, zScale);

        int idx = 0;
        this.ar = Arrays.copyOfRange(theta, idx, idx += p);
        this.ma = Arrays.copyOfRange(theta, idx, idx += q);
        this.seasonalAr = Arrays.copyOfRange(theta, idx, idx += P);
        this.seasonalMa = Arrays.copyOfRange(theta, idx, idx += Q);
        this.mu = withConstant ? zMean + zScale * theta[idx] : 0;

        this.innovations = new double[z.length];
        double css = recurse(z, ar, ma, seasonalAr, seasonalMa, mu, innovations);
        if (Double.isNaN(css) || Double.isInfinite(css)) {
            throw new ModelFitException(ModelFamily.ARIMA, describe() + ": non-finite sum of squares");
        }
        this.sigma2 = css / effectiveObs;
        this.fitted = reconstruct(z);
    }

    private static double[] diff(double[] x, int lag) {
        if (lag >= x.length) return new double[0];
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    /** Minimise the conditional sum of squares; returns [φ, θ, Φ, Θ, u] with μ = mean + scale·u. */
    private double[] estimate(double[] z, double zMean, double zScale) {
        double[] guess = new double[nParams];
        if (p > 0) guess[0] = Math.max(-0.5, Math.min(0.5, lagOneAutocorrelation(z, zMean)));
        if (nParams == 0) return guess;

        double[] lower = new double[nParams];
        double[] upper = new double[nParams];
        Arrays.fill(lower, -COEFFICIENT_BOUND);
        Arrays.fill(upper, COEFFICIENT_BOUND);
        if (withConstant) {
            lower[nParams - 1] = -5;
            upper[nParams - 1] = 5;
        }
        double[] work = new double[z.length];
        try {
            if (nParams == 1) {
                UnivariatePointValuePair result = new BrentOptimizer(1e-10, 1e-12).optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new UnivariateObjectiveFunction(x -> css(z, new double[] {x}, zMean, zScale, work)),
                    GoalType.MINIMIZE,
                    new SearchInterval(lower[0], upper[0], guess[0]));
                return new double[] {result.getPoint()};
            }
            BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * nParams + 1, 0.2, 1e-7);
            PointValuePair result = optimizer.optimize(
                new MaxEval(MAX_EVALUATIONS),
                new ObjectiveFunction(params -> css(z, params, zMean, zScale, work)),
                GoalType.MINIMIZE,
                new InitialGuess(guess),
                new SimpleBounds(lower, upper));
            return result.getPoint();
        } catch (TooManyEvaluationsException e) {
            throw new ModelFitException(ModelFamily.ARIMA,
                describe() + ": optimizer did not converge within " + MAX_EVALUATIONS + " evaluations", e);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new ModelFitException(ModelFamily.ARIMA, describe() + ": " + e.getMessage(), e);
        }
    }

    private double css(double[] z, double[] params, double zMean, double zScale, double[] work) {
        int idx = 0;
        double[] arP = Arrays.copyOfRange(params, idx, idx += p);
        double[] maP = Arrays.copyOfRange(params, idx, idx += q);
        double[] sarP = Arrays.copyOfRange(params, idx, idx += P);
        double[] smaP = Arrays.copyOfRange(params, idx, idx += Q);
        double m = withConstant ? zMean + zScale * params[idx] : 0;
        Arrays.fill(work, 0);
        return recurse(z, arP, maP, sarP, smaP, m, work);
    }

    /** Fills innovations from {@code start} onward and returns their sum of squares. */
    private double recurse(double[] z, double[] arP, double[] maP, double[] sarP, double[] smaP,
                           double m, double[] innov) {
        double rss = 0;
        for (int t = start; t < z.length; t++) {
            double pred = predictAt(z, t, arP, maP, sarP, smaP, m, innov);
            innov[t] = z[t] - pred;
            rss += innov[t] * innov[t];
        }
        return rss;
    }

    private double predictAt(double[] z, int t, double[] arP, double[] maP, double[] sarP, double[] smaP,
                             double m, double[] innov) {
        double pred = m;
        for (int i = 0; i < arP.length && t - 1 - i >= 0; i++) pred += arP[i] * (z[t - 1 - i] - m);
        for (int i = 0; i < sarP.length && t - s * (i + 1) >= 0; i++) pred += sarP[i] * (z[t - s * (i + 1)] - m);
        for (int i = 0; i < maP.length && t - 1 - i >= 0; i++) pred += maP[i] * innov[t - 1 - i];
        for (int i = 0; i < smaP.length && t - s * (i + 1) >= 0; i++) pred += smaP[i] * innov[t - s * (i + 1)];
        return pred;
    }

    /** One-step predictions mapped back to the original scale. */
    private double[] reconstruct(double[] z) {
        double[] y = levels[0];
        int offset = y.length - z.length;
        double[] out = y.clone();
        for (int t = offset; t < y.length; t++) {
            int zt = t - offset;
            double zHat = zt < start ? mu : z[zt] - innovations[zt];
            out[t] = zHat + (y[t] - z[zt]);
        }
        return out;
    }

    /** Forecast the next {@code steps} values of the differenced series. */
    public double[] forecastDifferenced(int steps) {
        double[] zObs = levels[lags.length];
        int T = zObs.length;
        double[] z = Arrays.copyOf(zObs, T + steps);
        double[] innov = Arrays.copyOf(innovations, T + steps);
        for (int t = T; t < T + steps; t++) {
            z[t] = predictAt(z, t, ar, ma, seasonalAr, seasonalMa, mu, innov);
            innov[t] = 0;
        }
        return Arrays.copyOfRange(z, T, T + steps);
    }

    @Override
    protected double[] pointForecast(int h) {
        double[] ext = forecastDifferenced(h);
        for (int k = lags.length - 1; k >= 0; k--) {
            double[] base = levels[k];
            int n = base.length;
            double[] full = Arrays.copyOf(base, n + h);
            for (int i = 0; i < h; i++) full[n + i] = ext[i] + full[n + i - lags[k]];
            ext = Arrays.copyOfRange(full, n, n + h);
        }
        return ext;
    }

    @Override
    protected double[] forecastVariance(int h) {
        double[] psi = psiWeights(h);
        double[] var = new double[h];
        double acc = 0;
        for (int j = 0; j < h; j++) {
            acc += psi[j] * psi[j];
            var[j] = sigma2 * acc;
        }
        return var;
    }

    /** MA(∞) weights of the integrated model, ψ₀ = 1. */
    double[] psiWeights(int h) {
        double[] poly = new double[p + s * P + 1];
        poly[0] = 1;
        for (int i = 0; i < p; i++) poly[i + 1] -= ar[i];
        for (int i = 0; i < P; i++) poly[s * (i + 1)] -= seasonalAr[i];
        for (int lag : lags) {
            double[] next = new double[poly.length + lag];
            for (int i = 0; i < poly.length; i++) {
                next[i] += poly[i];
                next[i + lag] -= poly[i];
            }
            poly = next;
        }
        double[] maPoly = new double[q + s * Q + 1];
        maPoly[0] = 1;
        for (int i = 0; i < q; i++) maPoly[i + 1] += ma[i];
        for (int i = 0; i < Q; i++) maPoly[s * (i + 1)] += seasonalMa[i];

        double[] psi = new double[h];
        for (int j = 0; j < h; j++) {
            double v = j < maPoly.length ? maPoly[j] : 0;
            if (j == 0) v = 1;
            for (int i = 1; i < poly.length && i <= j; i++) v -= poly[i] * psi[j - i];
            psi[j] = v;
        }
        return psi;
    }

    @Override
    public double[] fittedValues() {
        return fitted.clone();
    }

    @Override
    public double aicc() {
        int k = nParams + 1;
        double aic = effectiveObs * Math.log(sigma2) + 2.0 * k;
        double denom = effectiveObs - k - 1;
        return denom > 0 ? aic + 2.0 * k * (k + 1) / denom : Double.POSITIVE_INFINITY;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder("ARIMA(").append(p).append(',').append(d).append(',').append(q).append(')');
        if (P > 0 || D > 0 || Q > 0) {
            sb.append('(').append(P).append(',').append(D).append(',').append(Q).append(")[").append(s).append(']');
        }
        if (withConstant) sb.append(d + D == 0 ? " with non-zero mean" : " with drift");
        return sb.toString();
    }

    static double mean(double[] x) {
        double m = 0;
        for (double v : x) m += v;
        return x.length == 0 ? 0 : m / x.length;
    }

    private static double stdDev(double[] x, double m) {
        if (x.length < 2) return 0;
        double ss = 0;
        for (double v : x) ss += (v - m) * (v - m);
        return Math.sqrt(ss / (x.length - 1));
    }

    private static double lagOneAutocorrelation(double[] z, double m) {
        double num = 0, den = 0;
        for (int t = 0; t < z.length; t++) {
            den += (z[t] - m) * (z[t] - m);
            if (t > 0) num += (z[t] - m) * (z[t - 1] - m);
        }
        return den == 0 ? 0 : num / den;
    }

    public int getSeasonLength() { return s; }
    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }
    public int getSeasonalP() { return P; }
    public int getSeasonalD() { return D; }
    public int getSeasonalQ() { return Q; }
    public boolean hasConstant() { return withConstant; }
    public double getMean() { return mu; }
    public double getSigma2() { return sigma2; }
    public double[] getAr() { return ar.clone(); }
    public double[] getMa() { return ma.clone(); }
}
