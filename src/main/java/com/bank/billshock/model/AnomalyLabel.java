package com.bank.billshock.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyLabel {
    NORMAL("Normal"),
    BILL_SHOCK("Bill Shock");

    private final String label;

    AnomalyLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static AnomalyLabel fromScore(double anomalyScore, double threshold) {
        return anomalyScore >= threshold ? BILL_SHOCK : NORMAL;
    }
}
