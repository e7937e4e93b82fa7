package com.ryuqq.swarm.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void jitter가_없으면_재시도마다_지연이_두배가_됨() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 300000, 0.0);

        // when / then
        assertThat(calculator.calculate(1)).isEqualTo(1000);
        assertThat(calculator.calculate(2)).isEqualTo(2000);
        assertThat(calculator.calculate(3)).isEqualTo(4000);
        assertThat(calculator.calculate(9)).isEqualTo(256000);
    }

    @Test
    void 지연은_maxDelay를_넘지_않음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 300000, 0.0);

        // when / then
        assertThat(calculator.calculate(10)).isEqualTo(300000);
        assertThat(calculator.calculate(64)).isEqualTo(300000);
        assertThat(calculator.calculate(Integer.MAX_VALUE)).isEqualTo(300000);
    }

    @Test
    void jitter는_지수_지연에_비례하여_더해짐() {
        // given: random 항상 0.5
        BackoffCalculator calculator = new BackoffCalculator(1000, 300000, 0.1, () -> 0.5);

        // when
        long delay = calculator.calculate(2);

        // then: 2000 + 2000 * 0.1 * 0.5
        assertThat(delay).isEqualTo(2100);
    }

    @Test
    void jitter를_더해도_maxDelay로_제한됨() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 300000, 1.0, () -> 0.99);

        // when / then
        assertThat(calculator.calculate(20)).isEqualTo(300000);
    }

    @Test
    void 기본값은_1초_300초_10퍼센트() {
        // when
        BackoffCalculator calculator = new BackoffCalculator();

        // then
        assertThat(calculator.getBaseDelayMs()).isEqualTo(1000);
        assertThat(calculator.getMaxDelayMs()).isEqualTo(300000);
        assertThat(calculator.getJitterFactor()).isEqualTo(0.1);
    }

    @Test
    void 잘못된_파라미터는_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 1000, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(1000, 999, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(1000, 2000, 1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retryCount");
    }
}
