package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.enums.KpiKey;
import com.rev.saas.engine.enums.OutcomeStatus;
import com.rev.saas.engine.model.OutcomeKpi;
import com.rev.saas.engine.model.documents.MeasurableOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RequiredArgsConstructor
public class MeasurableOutcomeRepoImpl implements MeasurableOutcomeRepoCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public MeasurableOutcome upsertForVerdict(String userId, String verdictId, String chosenScenarioId,
                                              List<OutcomeKpi> kpis, int horizonDays, Instant now) {
        Query q = new Query(Criteria.where(DecisionConsts.F_USER_ID).is(userId).and("verdictId").is(verdictId));
        Update u = new Update()
                .set("chosenScenarioId", chosenScenarioId)
                .set("status", OutcomeStatus.PENDING)
                .set("horizonDays", horizonDays)
                .set("kpis", kpis)
                .set(DecisionConsts.F_UPDATED_AT, now)
                .setOnInsert(DecisionConsts.F_CREATED_AT, now);
        return mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().upsert(true).returnNew(true),
                MeasurableOutcome.class);
    }

    @Override
    public Optional<MeasurableOutcome> updateStatus(String id, String userId, OutcomeStatus status, Instant now) {
        return patch(id, userId, Map.of("status", status), now);
    }

    @Override
    public Optional<MeasurableOutcome> patch(String id, String userId, Map<String, Object> sets, Instant now) {
        Update u = new Update().set(DecisionConsts.F_UPDATED_AT, now);
        sets.forEach(u::set);
        return Optional.ofNullable(mongoTemplate.findAndModify(new Query(owned(id, userId)), u, RETURN_NEW,
                MeasurableOutcome.class));
    }

    @Override
    public Optional<MeasurableOutcome> setKpiActual(String id, String userId, KpiKey key, Double expectedBaseline,
                                                    Double actual, Double delta, Double deltaPct, Instant now) {
        Criteria kpi = Criteria.where("key").is(key).and("baseline").is(expectedBaseline);
        Query q = new Query(owned(id, userId).and("kpis").elemMatch(kpi));
        Update u = new Update()
                .set("kpis.$.actual", actual)
                .set("kpis.$.delta", delta)
                .set("kpis.$.deltaPct", deltaPct)
                .set(DecisionConsts.F_UPDATED_AT, now);
        return Optional.ofNullable(mongoTemplate.findAndModify(q, u, RETURN_NEW, MeasurableOutcome.class));
    }

    @Override
    public List<MeasurableOutcome> listByUser(String userId, Collection<String> excludedVerdictIds, int limit,
                                              int offset) {
        Criteria c = Criteria.where(DecisionConsts.F_USER_ID).is(userId);
        if (excludedVerdictIds != null && !excludedVerdictIds.isEmpty()) {
            c = c.and("verdictId").nin(excludedVerdictIds);
        }
        Query q = new Query(c)
                .with(Sort.by(Sort.Direction.DESC, DecisionConsts.F_CREATED_AT))
                .skip(offset)
                .limit(limit);
        return mongoTemplate.find(q, MeasurableOutcome.class);
    }

    private static Criteria owned(String id, String userId) {
        return Criteria.where(DecisionConsts.F_ID).is(id).and(DecisionConsts.F_USER_ID).is(userId);
    }
}
