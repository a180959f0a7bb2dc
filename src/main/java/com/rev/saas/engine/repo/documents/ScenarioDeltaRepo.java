package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.model.documents.ScenarioDelta;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScenarioDeltaRepo extends MongoRepository<ScenarioDelta, String>, ScenarioDeltaRepoCustom {

    Optional<ScenarioDelta> findByVerdictIdAndBaselineScenarioIdAndCandidateScenarioId(
            String verdictId, String baselineScenarioId, String candidateScenarioId);

    long deleteByVerdictId(String verdictId);
}
