package com.rev.saas.engine.common.constants;

public final class DecisionConsts {

    private DecisionConsts() {
    }

    // Collections
    public static final String COLLECTION_DECISIONS = "decisions";
    public static final String COLLECTION_MEASURABLE_OUTCOMES = "measurable_outcomes";
    public static final String COLLECTION_SCENARIO_SETS = "scenario_sets";
    public static final String COLLECTION_SCENARIO_DELTAS = "scenario_deltas";

    // Shared field names
    public static final String F_ID = "_id";
    public static final String F_USER_ID = "userId";
    public static final String F_DELETED = "isDeleted";
    public static final String F_DELETED_AT = "deletedAt";
    public static final String F_CREATED_AT = "createdAt";
    public static final String F_UPDATED_AT = "updatedAt";

    // Baseline used when the user has not chosen a scenario
    public static final String BALANCED_SCENARIO_ID = "balanced";
    public static final String BALANCED_SCENARIO_LABEL = "Balanced (Recommended)";

    public static final String INITIAL_CONTEXT_REASON = "Initial context from creation";
    public static final String INITIAL_VERDICT_REASON = "Initial verdict from analysis";
    public static final String INITIAL_STATUS_REASON = "Decision created";
}
