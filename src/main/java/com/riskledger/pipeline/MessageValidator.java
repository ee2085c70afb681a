package com.riskledger.pipeline;

import com.riskledger.domain.model.Fill;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.exception.FillValidationException;
import com.riskledger.exception.SignalValidationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Structural validation of inbound signals and fills. Runs before any rule or ledger
 * access; a message that fails here never touches session state.
 */
@Component
public class MessageValidator {

    private final Clock clock;

    public MessageValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validates the signal and returns it with a generated id and receive time stamped
     * where the sender left them out.
     */
    public TradeSignal validateSignal(TradeSignal signal) {
        if (signal == null) {
            throw new SignalValidationException("Signal payload is empty");
        }
        Map<String, Object> errors = new LinkedHashMap<>();
        if (isBlank(signal.getSymbol())) {
            errors.put("symbol", "is required");
        }
        if (signal.getAction() == null) {
            errors.put("action", "must be BUY or SELL");
        }
        if (signal.getQuantity() == null || signal.getQuantity() <= 0) {
            errors.put("quantity", "must be positive");
        }
        if (!isPositive(signal.getPrice())) {
            errors.put("price", "must be positive");
        }
        if (!errors.isEmpty()) {
            throw new SignalValidationException("Invalid signal: " + errors, errors);
        }

        if (signal.getSignalId() != null && signal.getTimestamp() != null) {
            return signal;
        }
        return signal.toBuilder()
                .signalId(signal.getSignalId() != null ? signal.getSignalId() : UUID.randomUUID().toString())
                .timestamp(signal.getTimestamp() != null ? signal.getTimestamp() : clock.instant())
                .build();
    }

    public Fill validateFill(Fill fill) {
        if (fill == null) {
            throw new FillValidationException("Fill payload is empty");
        }
        Map<String, Object> errors = new LinkedHashMap<>();
        if (isBlank(fill.getFillId())) {
            errors.put("fillId", "is required");
        }
        if (isBlank(fill.getSymbol())) {
            errors.put("symbol", "is required");
        }
        if (fill.getAction() == null) {
            errors.put("action", "must be BUY or SELL");
        }
        if (fill.getQuantity() == null || fill.getQuantity() <= 0) {
            errors.put("quantity", "must be positive");
        }
        if (!isPositive(fill.getPrice())) {
            errors.put("price", "must be positive");
        }
        if (fill.getCommission() != null && fill.getCommission().signum() < 0) {
            errors.put("commission", "must not be negative");
        }
        if (!errors.isEmpty()) {
            throw new FillValidationException("Invalid fill: " + errors, errors);
        }
        return fill;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
