package com.gridfolio.engine.service.optimizer;

import com.gridfolio.engine.config.PortfolioProperties;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.exception.ModelFitException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class CovarianceConditionerTest {

    private final CovarianceConditioner conditioner = new CovarianceConditioner(new PortfolioProperties());

    @Test
    void leavesWellConditionedMatrixUntouched() {
        double[][] covariance = {{0.04, 0.01}, {0.01, 0.09}};

        CovarianceConditioner.Conditioned conditioned = conditioner.condition(covariance);

        assertThat(conditioned.regularized()).isFalse();
        assertThat(conditioned.loading()).isZero();
        assertThat(conditioned.covariance()).isDeepEqualTo(covariance);
    }

    @Test
    void loadsDiagonalOfSingularMatrix() {
        CovarianceConditioner.Conditioned conditioned = conditioner.condition(new double[][]{{0.04, 0.04}, {0.04, 0.04}});

        assertThat(conditioned.regularized()).isTrue();
        assertThat(conditioned.loading()).isCloseTo(1e-8 * 0.08, offset(1e-12));
        assertThat(conditioned.covariance()[0][0]).isGreaterThan(0.04);
        assertThat(conditioned.covariance()[0][1]).isEqualTo(0.04);
    }

    @Test
    void rejectsIndefiniteMatrix() {
        assertThatThrownBy(() -> conditioner.condition(new double[][]{{0.04, 0.1}, {0.1, 0.04}}))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("positive semi-definite");
    }

    @Test
    void rejectsZeroAndNonFiniteMatrices() {
        assertThatThrownBy(() -> conditioner.condition(new double[][]{{0.0, 0.0}, {0.0, 0.0}}))
                .isInstanceOf(ModelFitException.class);
        assertThatThrownBy(() -> conditioner.condition(new double[][]{{Double.NaN, 0.0}, {0.0, 1.0}}))
                .isInstanceOf(ModelFitException.class);
    }
}
