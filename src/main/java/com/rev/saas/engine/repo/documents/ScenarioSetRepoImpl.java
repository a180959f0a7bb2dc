package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.model.documents.ScenarioSet;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Optional;

@RequiredArgsConstructor
public class ScenarioSetRepoImpl implements ScenarioSetRepoCustom {

    private static final Sort VERSION_DESC = Sort.by(Sort.Direction.DESC, "version");

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<ScenarioSet> findCurrent(String decisionId, String userId) {
        Query q = new Query(pair(decisionId, userId).and(DecisionConsts.F_DELETED).ne(true))
                .with(VERSION_DESC)
                .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(q, ScenarioSet.class));
    }

    @Override
    public int maxVersion(String decisionId, String userId) {
        Query q = new Query(pair(decisionId, userId)).with(VERSION_DESC).limit(1);
        q.fields().include("version");
        ScenarioSet top = mongoTemplate.findOne(q, ScenarioSet.class);
        return top == null ? 0 : top.getVersion();
    }

    @Override
    public boolean softDelete(String id, String userId, Instant now) {
        Query q = new Query(Criteria.where(DecisionConsts.F_ID).is(id)
                .and(DecisionConsts.F_USER_ID).is(userId)
                .and(DecisionConsts.F_DELETED).ne(true));
        Update u = new Update()
                .set(DecisionConsts.F_DELETED, true)
                .set(DecisionConsts.F_DELETED_AT, now)
                .set(DecisionConsts.F_UPDATED_AT, now);
        return mongoTemplate.updateFirst(q, u, ScenarioSet.class).getMatchedCount() > 0;
    }

    private static Criteria pair(String decisionId, String userId) {
        return Criteria.where("decisionId").is(decisionId).and(DecisionConsts.F_USER_ID).is(userId);
    }
}
