package com.rev.saas.engine.service.scenario;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.documents.ScenarioSet;
import com.rev.saas.engine.model.dto.BaselineRef;

import java.util.Optional;

/**
 * The chosen scenario is the baseline; without a choice it is "balanced".
 */
public final class BaselineResolver {

    private BaselineResolver() {
    }

    public static BaselineRef resolve(Decision decision, ScenarioSet current) {
        String chosen = decision.getChosenScenarioId();
        if (chosen == null || chosen.isBlank()) {
            return new BaselineRef(DecisionConsts.BALANCED_SCENARIO_ID, DecisionConsts.BALANCED_SCENARIO_LABEL);
        }
        String name = ScenarioKey.fromValue(chosen)
                .flatMap(key -> current == null ? Optional.<ScenarioItem>empty() : current.find(key))
                .map(ScenarioItem::getTitle)
                .filter(t -> !t.isBlank())
                .orElse(chosen);
        return new BaselineRef(chosen, name);
    }
}
