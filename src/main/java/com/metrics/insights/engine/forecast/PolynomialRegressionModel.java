package com.metrics.insights.engine.forecast;

/**
 * Least-squares polynomial fit through the normal equations, solved by
 * Gaussian elimination with partial pivoting.
 */
public class PolynomialRegressionModel {

    private static final double PIVOT_EPSILON = 1e-10;

    private final int degree;
    private double[] coefficients;

    public PolynomialRegressionModel() {
        this(2);
    }

    public PolynomialRegressionModel(int degree) {
        if (degree < 1) {
            throw new IllegalArgumentException("degree must be >= 1, was " + degree);
        }
        this.degree = degree;
    }

    /**
     * @return R² of the fit on the training data
     */
    public double train(double[] x, double[] y) {
        if (x == null || y == null || x.length != y.length || x.length <= degree) {
            throw new IllegalArgumentException(
                    "Polynomial regression of degree " + degree + " needs more than " + degree + " paired observations");
        }
        int terms = degree + 1;
        double[][] xtx = new double[terms][terms];
        double[] xty = new double[terms];
        for (int i = 0; i < x.length; i++) {
            double[] powers = powers(x[i]);
            for (int r = 0; r < terms; r++) {
                xty[r] += powers[r] * y[i];
                for (int c = 0; c < terms; c++) {
                    xtx[r][c] += powers[r] * powers[c];
                }
            }
        }
        this.coefficients = solve(xtx, xty);

        double[] fitted = predict(x);
        double mean = 0.0;
        for (double v : y) mean += v;
        mean /= y.length;
        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < y.length; i++) {
            ssRes += (y[i] - fitted[i]) * (y[i] - fitted[i]);
            ssTot += (y[i] - mean) * (y[i] - mean);
        }
        return ssTot == 0 ? 0.0 : 1 - ssRes / ssTot;
    }

    public double[] predict(double[] x) {
        if (coefficients == null) {
            throw new IllegalStateException("Model not trained, call train() first");
        }
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double[] powers = powers(x[i]);
            for (int j = 0; j <= degree; j++) {
                out[i] += coefficients[j] * powers[j];
            }
        }
        return out;
    }

    public double[] getCoefficients() {
        return coefficients == null ? null : coefficients.clone();
    }

    public int getDegree() {
        return degree;
    }

    private double[] powers(double x) {
        double[] powers = new double[degree + 1];
        powers[0] = 1.0;
        for (int j = 1; j <= degree; j++) powers[j] = powers[j - 1] * x;
        return powers;
    }

    /**
     * Singular columns (pivot below 1e-10) are skipped and their coefficient stays 0.
     */
    static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        double[][] augmented = new double[n][n + 1];
        for (int i = 0; i < n; i++) {
            System.arraycopy(a[i], 0, augmented[i], 0, n);
            augmented[i][n] = b[i];
        }
        boolean[] skipped = new boolean[n];

        for (int i = 0; i < n; i++) {
            int maxRow = i;
            for (int k = i + 1; k < n; k++) {
                if (Math.abs(augmented[k][i]) > Math.abs(augmented[maxRow][i])) maxRow = k;
            }
            double[] swap = augmented[i];
            augmented[i] = augmented[maxRow];
            augmented[maxRow] = swap;

            double pivot = augmented[i][i];
            if (Math.abs(pivot) < PIVOT_EPSILON) {
                skipped[i] = true;
                continue;
            }
            for (int j = i; j <= n; j++) augmented[i][j] /= pivot;
            for (int k = i + 1; k < n; k++) {
                double factor = augmented[k][i];
                for (int j = i; j <= n; j++) augmented[k][j] -= factor * augmented[i][j];
            }
        }

        double[] solution = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            if (skipped[i]) continue;
            double value = augmented[i][n];
            for (int j = i + 1; j < n; j++) value -= augmented[i][j] * solution[j];
            solution[i] = value;
        }
        return solution;
    }
}
