package com.riskledger.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.model.Fill;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.exception.ErrorCode;
import com.riskledger.exception.FillValidationException;
import com.riskledger.exception.SignalValidationException;
import com.riskledger.pipeline.MessageValidator;
import com.riskledger.unit.support.MutableClock;
import com.riskledger.unit.support.TestData;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MessageValidatorTest {

    private final MessageValidator validator = new MessageValidator(new MutableClock(TestData.NOW));

    @Nested
    @DisplayName("Signals")
    class Signals {

        @Test
        @DisplayName("Complete signal is returned unchanged")
        void complete_unchanged() {
            TradeSignal signal = TestData.buy("AAPL", 10, "150");

            assertThat(validator.validateSignal(signal)).isSameAs(signal);
        }

        @Test
        @DisplayName("Every structural problem is reported at once")
        void allErrorsReported() {
            TradeSignal signal = TradeSignal.builder().symbol(" ").quantity(-5).price(BigDecimal.ZERO).build();

            assertThatThrownBy(() -> validator.validateSignal(signal))
                    .isInstanceOfSatisfying(SignalValidationException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                        assertThat(e.getDetails()).containsOnlyKeys("symbol", "action", "quantity", "price");
                    });
        }

        @Test
        @DisplayName("Null payload is refused")
        void nullPayload_refused() {
            assertThatThrownBy(() -> validator.validateSignal(null))
                    .isInstanceOf(SignalValidationException.class)
                    .hasMessage("Signal payload is empty");
        }
    }

    @Nested
    @DisplayName("Fills")
    class Fills {

        @Test
        @DisplayName("Fill without an id is refused")
        void missingId_refused() {
            Fill fill = TestData.fill(null, TradeAction.BUY, "AAPL", 10, "150", null);

            assertThatThrownBy(() -> validator.validateFill(fill))
                    .isInstanceOfSatisfying(FillValidationException.class,
                            e -> assertThat(e.getDetails()).containsOnlyKeys("fillId"));
        }

        @Test
        @DisplayName("Negative commission is refused, zero is fine")
        void commission_checked() {
            assertThatThrownBy(() -> validator.validateFill(TestData.fill("f1", TradeAction.SELL, "AAPL", 10, "150", "-0.5")))
                    .isInstanceOf(FillValidationException.class)
                    .hasMessageContaining("commission");

            Fill zero = TestData.fill("f2", TradeAction.SELL, "AAPL", 10, "150", "0");
            assertThat(validator.validateFill(zero)).isSameAs(zero);
        }
    }
}
