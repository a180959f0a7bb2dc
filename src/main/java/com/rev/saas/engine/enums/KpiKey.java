package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * KPIs that can be tracked on a measurable outcome.
 */
public enum KpiKey {
    MRR("MRR", KpiUnit.EUR),
    ARR("ARR", KpiUnit.EUR),
    REVENUE("Revenue", KpiUnit.PERCENT),
    CONVERSION("Conversion", KpiUnit.PERCENT),
    CHURN("Churn", KpiUnit.PERCENT),
    ARPA("ARPA", KpiUnit.EUR),
    CAC("CAC", KpiUnit.EUR),
    ACTIVATION("Activation", KpiUnit.PERCENT),
    RETENTION("Retention", KpiUnit.PERCENT),
    NPS("NPS", KpiUnit.COUNT),
    LTV("LTV", KpiUnit.EUR),
    OTHER("Other", KpiUnit.PERCENT);

    private final String value;
    private final KpiUnit defaultUnit;

    KpiKey(String value, KpiUnit defaultUnit) {
        this.value = value;
        this.defaultUnit = defaultUnit;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public KpiUnit getDefaultUnit() {
        return defaultUnit;
    }

    public static Optional<KpiKey> fromValue(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values()).filter(k -> k.value.equalsIgnoreCase(v)).findFirst();
    }

    /**
     * Maps the primary KPI recorded in a decision context (e.g. "mrr_growth") to the KPI tracked for it.
     */
    public static KpiKey fromPrimaryKpi(String primaryKpi) {
        if (primaryKpi == null) return MRR;
        switch (primaryKpi) {
            case "churn_reduction":
                return CHURN;
            case "activation":
                return ACTIVATION;
            case "arpu":
                return ARPA;
            case "nrr":
                return RETENTION;
            case "cvr":
                return CONVERSION;
            default:
                return MRR;
        }
    }
}
