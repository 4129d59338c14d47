package com.gridfolio.engine.service.optimizer;

/**
 * {@code min 0.5 xᵀGx + cᵀx} subject to {@code E x = e} and {@code A x >= b}.
 */
public record QuadraticProgram(
        double[][] hessian,
        double[] linear,
        double[][] equalityMatrix,
        double[] equalityValues,
        double[][] inequalityMatrix,
        double[] inequalityValues
) {

    public int dimension() {
        return linear.length;
    }

    public double objective(double[] x) {
        double value = 0.0;
        for (int i = 0; i < x.length; i++) {
            double row = 0.0;
            for (int j = 0; j < x.length; j++) {
                row += hessian[i][j] * x[j];
            }
            value += 0.5 * x[i] * row + linear[i] * x[i];
        }
        return value;
    }
}
