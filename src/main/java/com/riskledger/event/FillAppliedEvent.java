package com.riskledger.event;

import com.riskledger.domain.model.Fill;
import com.riskledger.domain.model.FillResult;
import org.springframework.context.ApplicationEvent;

/** Published after a fill has been applied to its session ledger. */
public class FillAppliedEvent extends ApplicationEvent {

    private final Fill fill;
    private final FillResult result;

    public FillAppliedEvent(Object source, Fill fill, FillResult result) {
        super(source);
        this.fill = fill;
        this.result = result;
    }

    public Fill getFill() {
        return fill;
    }

    public FillResult getResult() {
        return result;
    }
}
