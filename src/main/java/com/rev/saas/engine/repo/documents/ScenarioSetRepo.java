package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.model.documents.ScenarioSet;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScenarioSetRepo extends MongoRepository<ScenarioSet, String>, ScenarioSetRepoCustom {

    Optional<ScenarioSet> findByIdAndUserId(String id, String userId);

    long deleteByDecisionId(String decisionId);
}
