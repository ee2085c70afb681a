package com.riskledger.event;

import com.riskledger.domain.model.AdmissionDecision;
import org.springframework.context.ApplicationEvent;

/** Published once per evaluated signal, after the decision is final. */
public class AdmissionEvent extends ApplicationEvent {

    private final AdmissionDecision decision;

    public AdmissionEvent(Object source, AdmissionDecision decision) {
        super(source);
        this.decision = decision;
    }

    public AdmissionDecision getDecision() {
        return decision;
    }
}
