package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.model.documents.MeasurableOutcome;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MeasurableOutcomeRepo extends MongoRepository<MeasurableOutcome, String>, MeasurableOutcomeRepoCustom {

    Optional<MeasurableOutcome> findByVerdictIdAndUserId(String verdictId, String userId);

    Optional<MeasurableOutcome> findByIdAndUserId(String id, String userId);

    long countByUserId(String userId);

    long deleteByIdAndUserId(String id, String userId);

    long deleteByVerdictId(String verdictId);
}
