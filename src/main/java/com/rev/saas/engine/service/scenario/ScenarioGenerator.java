package com.rev.saas.engine.service.scenario;

import com.rev.saas.engine.model.ModelMeta;
import com.rev.saas.engine.model.documents.Decision;

/**
 * External producer of scenario payloads (an AI model behind some transport). The engine only consumes the raw
 * JSON it returns.
 */
public interface ScenarioGenerator {

    GeneratedPayload generate(Decision decision);

    /**
     * @param rawJson   scenario response, possibly wrapped in a markdown code fence
     * @param modelMeta provenance recorded on the scenario set
     */
    record GeneratedPayload(String rawJson, ModelMeta modelMeta) {
    }
}
