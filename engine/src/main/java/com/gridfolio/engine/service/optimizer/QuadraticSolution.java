package com.gridfolio.engine.service.optimizer;

public record QuadraticSolution(double[] x, double objective, int iterations) {

    public QuadraticSolution {
        x = x.clone();
    }

    @Override
    public double[] x() {
        return x.clone();
    }
}
