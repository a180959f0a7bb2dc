package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.model.documents.ScenarioDelta;

public interface ScenarioDeltaRepoCustom {

    /**
     * Stores the row only when its key is absent and returns whatever is stored for the key afterwards,
     * so a concurrent first writer is never overwritten.
     */
    ScenarioDelta insertIfAbsent(ScenarioDelta delta);
}
