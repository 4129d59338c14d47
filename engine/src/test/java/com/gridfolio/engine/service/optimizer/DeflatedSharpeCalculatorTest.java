package com.gridfolio.engine.service.optimizer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeflatedSharpeCalculatorTest {

    @Test
    void penalizesSharpeForMultipleTrials() {
        DeflatedSharpeCalculator calculator = new DeflatedSharpeCalculator();
        double sharpe = 1.2;
        double standardError = Math.sqrt((1.0 + 0.5 * sharpe * sharpe) / 99.0);
        double expectedPenalty = standardError * calculator.expectedMaximum(50);

        double deflated = calculator.calculate(sharpe, 100, 50);

        assertThat(deflated).isCloseTo(sharpe - expectedPenalty, org.assertj.core.data.Offset.offset(1e-12));
        assertThat(deflated).isLessThan(sharpe);
    }

    @Test
    void moreTrialsMeanLargerPenalty() {
        DeflatedSharpeCalculator calculator = new DeflatedSharpeCalculator();

        assertThat(calculator.expectedMaximum(1000)).isGreaterThan(calculator.expectedMaximum(10));
        // E[max of 2 normals] = 1/sqrt(pi) ~ 0.564; the approximation is close
        assertThat(calculator.expectedMaximum(2)).isBetween(0.4, 0.7);
    }

    @Test
    void leavesSharpeUnchangedWithoutEnoughInformation() {
        DeflatedSharpeCalculator calculator = new DeflatedSharpeCalculator();

        assertThat(calculator.calculate(0.8, 1, 50)).isEqualTo(0.8);
        assertThat(calculator.calculate(0.8, 100, 1)).isEqualTo(0.8);
    }
}
