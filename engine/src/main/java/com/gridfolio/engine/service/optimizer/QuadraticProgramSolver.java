package com.gridfolio.engine.service.optimizer;

/**
 * Solves convex quadratic programs from a feasible starting point.
 */
public interface QuadraticProgramSolver {

    QuadraticSolution solve(QuadraticProgram program, double[] feasibleStart);
}
