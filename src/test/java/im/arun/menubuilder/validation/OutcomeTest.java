package im.arun.menubuilder.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeTest {

    @Test
    void successCarriesAValue() {
        Outcome<Long> outcome = Outcome.success(7L);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue()).isEqualTo(7L);
        assertThat(outcome.getViolation()).isEmpty();
        assertThat(Outcome.done().isFailure()).isFalse();
    }

    @Test
    void failureCarriesTheRule() {
        Outcome<Long> outcome = Outcome.failure(RuleViolation.CYCLIC_MOVE);

        assertThat(outcome.getViolation()).contains(RuleViolation.CYCLIC_MOVE);
        assertThat(outcome.getDetail()).isEqualTo(RuleViolation.CYCLIC_MOVE.getDescription());
        assertThatThrownBy(outcome::getValue).isInstanceOf(IllegalStateException.class);

        Outcome<Void> retyped = outcome.asFailure();
        assertThat(retyped.failedWith(RuleViolation.CYCLIC_MOVE)).isTrue();
        assertThatThrownBy(() -> Outcome.success(1).asFailure()).isInstanceOf(IllegalStateException.class);
    }
}
