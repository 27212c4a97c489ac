package ppi.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import ppi.data.TabularDataset;

/**
 * Ordinary Least Squares (OLS) linear regression.
 * <p>
 * Model: y = β₀ + β₁x₁ + β₂x₂ + ... + βₙxₙ
 * <p>
 * Closed-form solution (normal equation): β = (X'X)⁻¹X'y
 * where X is the design matrix (with column of 1s for intercept) and y is the response vector.
 */
public class LinearRegression extends RegressionModel {

    private final double[] coefficients;  // β₀, β₁, ..., βₙ
    private final double rSquared;
    private final double adjustedRSquared;

    /**
     * Fit the model on every predictor column of {@code train} against its target.
     *
     * @throws ModelFitException if there are too few rows or X'X is singular
     */
    public LinearRegression(TabularDataset train) {
        super(ModelFamily.LINEAR_REGRESSION, train);
        double[][] x = train.matrix(getPredictors());
        double[] y = train.targetValues();
        int n = x.length;
        int features = getPredictors().size();
        int p = features + 1; // +1 for intercept
        if (n <= p) {
            throw new ModelFitException(getFamily(), n + " rows cannot determine " + p + " coefficients");
        }

        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            System.arraycopy(x[i], 0, design[i], 1, features);
        }

        RealMatrix xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);

        // β = (X'X)⁻¹ X' y
        RealMatrix xt = xm.transpose();
        DecompositionSolver solver = new LUDecomposition(xt.multiply(xm)).getSolver();
        if (!solver.isNonSingular()) {
            throw new ModelFitException(getFamily(), "design matrix X'X is singular");
        }
        coefficients = solver.solve(xt.operate(yv)).toArray();

        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            double fitted = predictRow(x[i]);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += (y[i] - fitted) * (y[i] - fitted);
        }
        rSquared = (ssTot > 0) ? 1.0 - (ssRes / ssTot) : 0;
        adjustedRSquared = 1.0 - (1.0 - rSquared) * (n - 1) / (n - p);
    }

    /** Intercept β₀ */
    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient βᵢ for predictor i (0-based, in {@link #getPredictors()} order). */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    /** All coefficients [β₀, β₁, ..., βₙ] */
    public double[] getCoefficients() {
        return coefficients.clone();
    }

    /** Training-set R². */
    public double getRSquared() { return rSquared; }
    public double getAdjustedRSquared() { return adjustedRSquared; }

    @Override
    protected double predictRow(double[] x) {
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) {
            y += coefficients[i + 1] * x[i];
        }
        return y;
    }

    public static final class Trainer implements Trainable<TabularDataset, RegressionModel> {

        @Override
        public ModelFamily family() {
            return ModelFamily.LINEAR_REGRESSION;
        }

        @Override
        public RegressionModel fit(TabularDataset train) {
            return new LinearRegression(train);
        }
    }
}
