package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.model.documents.Decision;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Decisions, always scoped by owner. "Active" means not soft-deleted.
 */
@Repository
public interface DecisionRepo extends MongoRepository<Decision, String>, DecisionRepoCustom {

    @Query("{'_id': ?0, 'userId': ?1, 'isDeleted': {$ne: true}}")
    Optional<Decision> findActive(String id, String userId);

    @Query("{'_id': {$in: ?0}, 'userId': ?1, 'isDeleted': {$ne: true}}")
    List<Decision> findActiveByIds(Collection<String> ids, String userId);

    @Query(value = "{'_id': ?0, 'userId': ?1, 'isDeleted': {$ne: true}}", exists = true)
    boolean existsActive(String id, String userId);

    @Query(value = "{'userId': ?0, 'isDeleted': true}", fields = "{'_id': 1}")
    List<Decision> findDeletedIds(String userId);

    // Admin path: soft-deleted rows included
    Optional<Decision> findByIdAndUserId(String id, String userId);
}
