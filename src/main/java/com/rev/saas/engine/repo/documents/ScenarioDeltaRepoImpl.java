package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.model.documents.ScenarioDelta;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

@RequiredArgsConstructor
public class ScenarioDeltaRepoImpl implements ScenarioDeltaRepoCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public ScenarioDelta insertIfAbsent(ScenarioDelta delta) {
        Query q = new Query(Criteria.where("verdictId").is(delta.getVerdictId())
                .and("baselineScenarioId").is(delta.getBaselineScenarioId())
                .and("candidateScenarioId").is(delta.getCandidateScenarioId()));
        Update u = new Update()
                .setOnInsert("deltas", delta.getDeltas())
                .setOnInsert("createdAt", delta.getCreatedAt());
        FindAndModifyOptions opts = FindAndModifyOptions.options().upsert(true).returnNew(true);
        try {
            return mongoTemplate.findAndModify(q, u, opts, ScenarioDelta.class);
        } catch (DuplicateKeyException race) {
            // both upserts missed and one insert lost on the unique index; the winner's row is there now
            return mongoTemplate.findOne(q, ScenarioDelta.class);
        }
    }
}
