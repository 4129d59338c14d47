package com.gridfolio.engine.service.optimizer;

import com.gridfolio.engine.exception.InfeasibleConstraintsException;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.model.PortfolioConstraints;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class FeasibilityServiceTest {

    private final FeasibilityService service = new FeasibilityService();

    @Test
    void maxReturnVertexFillsBestAssetFirst() {
        double[] weights = service.maxReturnWeights(new double[]{0.10, 0.05, 0.02}, PortfolioConstraints.uniform(3, 0.2, 0.6));

        assertThat(weights[0]).isCloseTo(0.6, offset(1e-12));
        assertThat(weights[1]).isCloseTo(0.2, offset(1e-12));
        assertThat(weights[2]).isCloseTo(0.2, offset(1e-12));
    }

    @Test
    void rejectsInfeasibleOrInvalidBounds() {
        assertThatThrownBy(() -> service.checkBounds(PortfolioConstraints.uniform(2, 0.6, 1.0)))
                .isInstanceOf(InfeasibleConstraintsException.class);
        assertThatThrownBy(() -> service.checkBounds(PortfolioConstraints.uniform(3, 0.0, 0.3)))
                .isInstanceOf(InfeasibleConstraintsException.class);
        assertThatThrownBy(() -> service.checkBounds(new PortfolioConstraints(new double[]{0.5, 0.0}, new double[]{0.4, 1.0})))
                .isInstanceOf(InfeasibleConstraintsException.class);
        assertThatThrownBy(() -> service.checkBounds(PortfolioConstraints.uniform(2, -0.1, 1.0)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void clampMovesResidualToAssetWithMostRoom() {
        double[] clamped = service.clampToPolytope(new double[]{0.65, 0.2 - 1e-13, 0.15}, PortfolioConstraints.uniform(3, 0.2, 0.6));

        assertThat(clamped[0]).isEqualTo(0.6);
        assertThat(clamped[1]).isCloseTo(0.2, offset(1e-15));
        assertThat(clamped[0] + clamped[1] + clamped[2]).isCloseTo(1.0, offset(1e-15));
    }
}
