package com.gridfolio.engine.service.optimizer;

import com.gridfolio.engine.exception.InfeasibleConstraintsException;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.model.PortfolioConstraints;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Linear-programming checks over the weight polytope {@code sum w = 1, lb <= w <= ub}.
 */
@Slf4j
@Service
public class FeasibilityService {

    private static final double BOUND_TOLERANCE = 1e-9;

    /**
     * Cheap bound checks, run before any LP.
     */
    public void checkBounds(PortfolioConstraints constraints) {
        double lowerSum = 0.0;
        double upperSum = 0.0;
        for (int i = 0; i < constraints.size(); i++) {
            double lower = constraints.lower(i);
            double upper = constraints.upper(i);
            if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
                throw new InvalidConfigurationException("Weight bounds of asset " + i + " must be finite");
            }
            if (lower < 0.0) {
                throw new InvalidConfigurationException("Weights are long-only, lower bound of asset " + i + " is " + lower);
            }
            if (lower > upper) {
                throw new InfeasibleConstraintsException(
                        "Lower bound " + lower + " exceeds upper bound " + upper + " for asset " + i);
            }
            lowerSum += lower;
            upperSum += upper;
        }
        if (lowerSum > 1.0 + BOUND_TOLERANCE) {
            throw new InfeasibleConstraintsException("Minimum weights sum to " + lowerSum + " > 1");
        }
        if (upperSum < 1.0 - BOUND_TOLERANCE) {
            throw new InfeasibleConstraintsException("Maximum weights sum to " + upperSum + " < 1");
        }
    }

    /**
     * Vertex of the weight polytope maximizing {@code rᵀw}.
     */
    public double[] maxReturnWeights(double[] expectedReturns, PortfolioConstraints constraints) {
        checkBounds(constraints);
        int n = constraints.size();
        List<LinearConstraint> linear = new ArrayList<>();
        double[] ones = new double[n];
        Arrays.fill(ones, 1.0);
        linear.add(new LinearConstraint(ones, Relationship.EQ, 1.0));
        for (int i = 0; i < n; i++) {
            double[] unit = new double[n];
            unit[i] = 1.0;
            linear.add(new LinearConstraint(unit, Relationship.GEQ, constraints.lower(i)));
            linear.add(new LinearConstraint(unit, Relationship.LEQ, constraints.upper(i)));
        }
        try {
            PointValuePair solution = new SimplexSolver().optimize(
                    new MaxIter(1000),
                    new LinearObjectiveFunction(expectedReturns, 0.0),
                    new LinearConstraintSet(linear),
                    GoalType.MAXIMIZE,
                    new NonNegativeConstraint(true));
            log.debug("Max-return vertex {} with return {}", Arrays.toString(solution.getPoint()), solution.getValue());
            return clampToPolytope(solution.getPoint(), constraints);
        } catch (NoFeasibleSolutionException e) {
            throw new InfeasibleConstraintsException("No weight vector satisfies the bounds and sums to 1", e);
        }
    }

    /**
     * Removes LP round-off: clamps to the bounds and puts the residual on the asset with
     * the most room.
     */
    public double[] clampToPolytope(double[] weights, PortfolioConstraints constraints) {
        double[] clamped = weights.clone();
        double sum = 0.0;
        for (int i = 0; i < clamped.length; i++) {
            clamped[i] = Math.min(constraints.upper(i), Math.max(constraints.lower(i), clamped[i]));
            sum += clamped[i];
        }
        double residual = 1.0 - sum;
        if (residual != 0.0) {
            int target = -1;
            double room = 0.0;
            for (int i = 0; i < clamped.length; i++) {
                double available = residual > 0 ? constraints.upper(i) - clamped[i] : clamped[i] - constraints.lower(i);
                if (available > room) {
                    room = available;
                    target = i;
                }
            }
            if (target >= 0) {
                clamped[target] += residual > 0 ? Math.min(residual, room) : -Math.min(-residual, room);
            }
        }
        return clamped;
    }
}
