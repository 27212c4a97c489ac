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

/**
 * Additive-error exponential smoothing, ETS(A,N,N), ETS(A,A,N) or ETS(A,Ad,N).
 * <p>
 * ŷ_t = l_{t-1} + φ b_{t-1},  e_t = y_t - ŷ_t
 * l_t = l_{t-1} + φ b_{t-1} + α e_t
 * b_t = φ b_{t-1} + β e_t
 * <p>
 * Smoothing parameters minimise the in-sample SSE; initial states come from the first year of data.
 */
public class ExponentialSmoothing extends TimeSeriesModel {

    public enum Form {
        SIMPLE("ETS(A,N,N)", 1, 1),
        HOLT("ETS(A,A,N)", 2, 2),
        DAMPED("ETS(A,Ad,N)", 3, 2);

        private final String label;
        private final int smoothingParams;
        private final int states;

        Form(String label, int smoothingParams, int states) {
            this.label = label;
            this.smoothingParams = smoothingParams;
            this.states = states;
        }
    }

    static final double MIN_SMOOTHING = 1e-4;
    static final double MAX_SMOOTHING = 0.9999;
    static final double MIN_DAMPING = 0.8;
    static final double MAX_DAMPING = 0.98;
    static final int MAX_EVALUATIONS = 4000;

    private final Form form;
    private final double[] y;
    private final double initialLevel;
    private final double initialTrend;
    private final double alpha;
    private final double beta;
    private final double phi;
    private final double level;
    private final double trend;
    private final double sse;
    private final double[] fitted;

    public ExponentialSmoothing(Series history, Form form) {
        super(ModelFamily.ETS, history);
        this.form = form;
        this.y = history.values();
        if (y.length < form.smoothingParams + form.states + 3) {
            throw new ModelFitException(ModelFamily.ETS, form.label + ": too few observations (" + y.length + ")");
        }
        int window = Math.min(12, y.length - 1);
        this.initialTrend = form == Form.SIMPLE ? 0 : (y[window] - y[0]) / window;
        this.initialLevel = y[0] - initialTrend;

        double[] params = estimate();
        this.alpha = params[0];
        this.beta = form == Form.SIMPLE ? 0 : params[0] * params[1];
        this.phi = form == Form.DAMPED ? params[2] : 1;

        this.fitted = new double[y.length];
        double[] finalStates = new double[2];
        this.sse = run(alpha, beta, phi, fitted, finalStates);
        if (Double.isNaN(sse) || Double.isInfinite(sse)) {
            throw new ModelFitException(ModelFamily.ETS, form.label + ": non-finite sum of squares");
        }
        this.level = finalStates[0];
        this.trend = finalStates[1];
    }

    /** Returns [α, β/α, φ] trimmed to the form's parameter count; β is kept below α. */
    private double[] estimate() {
        try {
            if (form == Form.SIMPLE) {
                UnivariatePointValuePair result = new BrentOptimizer(1e-10, 1e-12).optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new UnivariateObjectiveFunction(a -> run(a, 0, 1, null, null)),
                    GoalType.MINIMIZE,
                    new SearchInterval(MIN_SMOOTHING, MAX_SMOOTHING, 0.5));
                return new double[] {result.getPoint()};
            }
            boolean damped = form == Form.DAMPED;
            double[] guess = damped ? new double[] {0.5, 0.2, 0.9} : new double[] {0.5, 0.2};
            double[] lower = damped
                ? new double[] {MIN_SMOOTHING, MIN_SMOOTHING, MIN_DAMPING}
                : new double[] {MIN_SMOOTHING, MIN_SMOOTHING};
            double[] upper = damped
                ? new double[] {MAX_SMOOTHING, MAX_SMOOTHING, MAX_DAMPING}
                : new double[] {MAX_SMOOTHING, MAX_SMOOTHING};
            BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * guess.length + 1, 0.05, 1e-8);
            PointValuePair result = optimizer.optimize(
                new MaxEval(MAX_EVALUATIONS),
                new ObjectiveFunction(v -> run(v[0], v[0] * v[1], damped ? v[2] : 1, null, null)),
                GoalType.MINIMIZE,
                new InitialGuess(guess),
                new SimpleBounds(lower, upper));
            return result.getPoint();
        } catch (TooManyEvaluationsException e) {
            throw new ModelFitException(ModelFamily.ETS,
                form.label + ": optimizer did not converge within " + MAX_EVALUATIONS + " evaluations", e);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new ModelFitException(ModelFamily.ETS, form.label + ": " + e.getMessage(), e);
        }
    }

    /** Runs the recursions; optionally records one-step predictions and the final (level, trend). */
    private double run(double a, double b, double damping, double[] oneStep, double[] finalStates) {
        double l = initialLevel;
        double t = initialTrend;
        double sum = 0;
        for (int i = 0; i < y.length; i++) {
            double pred = l + damping * t;
            double e = y[i] - pred;
            if (oneStep != null) oneStep[i] = pred;
            sum += e * e;
            l = pred + a * e;
            t = damping * t + b * e;
        }
        if (finalStates != null) {
            finalStates[0] = l;
            finalStates[1] = t;
        }
        return sum;
    }

    /** Entry i holds φ + φ² + ... + φ^(i+1), accumulated in one pass. */
    private double[] dampedSums(int h) {
        double[] sums = new double[h];
        double acc = 0;
        double pow = 1;
        for (int i = 0; i < h; i++) {
            pow *= phi;
            acc += pow;
            sums[i] = acc;
        }
        return sums;
    }

    @Override
    protected double[] pointForecast(int h) {
        double[] sums = dampedSums(h);
        double[] out = new double[h];
        for (int i = 0; i < h; i++) out[i] = level + sums[i] * trend;
        return out;
    }

    @Override
    protected double[] forecastVariance(int h) {
        double[] sums = dampedSums(h);
        double sigma2 = sse / y.length;
        double[] var = new double[h];
        double acc = 1;
        var[0] = sigma2;
        for (int j = 1; j < h; j++) {
            double c = alpha + beta * sums[j - 1];
            acc += c * c;
            var[j] = sigma2 * acc;
        }
        return var;
    }

    @Override
    public double[] fittedValues() {
        return fitted.clone();
    }

    @Override
    public double aicc() {
        int n = y.length;
        int k = form.smoothingParams + form.states + 1;
        double aic = n * Math.log(sse / n) + 2.0 * k;
        double denom = n - k - 1;
        return denom > 0 ? aic + 2.0 * k * (k + 1) / denom : Double.POSITIVE_INFINITY;
    }

    @Override
    public String describe() {
        return form.label;
    }

    public Form getForm() { return form; }
    public double getAlpha() { return alpha; }
    public double getBeta() { return beta; }
    public double getPhi() { return phi; }
}
