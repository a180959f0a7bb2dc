package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.model.DecisionOutcome;
import com.rev.saas.engine.model.StatusEvent;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.dto.DecisionListParams;
import com.rev.saas.engine.model.versioning.VersionEntry;
import com.rev.saas.engine.model.versioning.VersionedField;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@RequiredArgsConstructor
public class DecisionRepoImpl implements DecisionRepoCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public <T> Optional<Decision> appendVersion(String id, String userId, VersionedField<T> field, int expectedVersion,
                                                VersionEntry<T> entry, Map<String, Object> extraSets, Instant now) {
        Query q = new Query(activeOwned(id, userId).and(field.getCounterPath()).is(expectedVersion));
        Update u = new Update()
                .set(field.getValuePath(), entry.getValue())
                .set(field.getCounterPath(), entry.getVersion())
                .set(DecisionConsts.F_UPDATED_AT, now)
                .push(field.getHistoryPath(), entry);
        if (extraSets != null) {
            extraSets.forEach(u::set);
        }
        return modify(q, u);
    }

    @Override
    public Optional<Decision> pushStatusEvent(String id, String userId, StatusEvent event,
                                              Map<String, Object> sideEffects, Instant now) {
        Update u = new Update()
                .set("status", event.getStatus())
                .set(DecisionConsts.F_UPDATED_AT, now)
                .push("statusEvents", event);
        if (sideEffects != null) {
            sideEffects.forEach(u::set);
        }
        return modify(new Query(activeOwned(id, userId)), u);
    }

    @Override
    public Optional<Decision> pushOutcome(String id, String userId, DecisionOutcome outcome, Instant now) {
        Update u = new Update()
                .push("outcomes", outcome)
                .set(DecisionConsts.F_UPDATED_AT, now);
        return modify(new Query(activeOwned(id, userId)), u);
    }

    @Override
    public Optional<Decision> setChosenScenario(String id, String userId, String scenarioId, Instant now) {
        Update u = new Update()
                .set("chosenScenarioId", scenarioId)
                .set("chosenScenarioAt", now)
                .set("episodeStatus", EpisodeStatus.PATH_CHOSEN)
                .set(DecisionConsts.F_UPDATED_AT, now);
        return modify(new Query(activeOwned(id, userId)), u);
    }

    @Override
    public Optional<Decision> linkScenarioSet(String id, String userId, String scenarioSetId, Instant now) {
        Optional<Decision> linked = modify(new Query(activeOwned(id, userId)), new Update()
                .set("scenariosId", scenarioSetId)
                .set(DecisionConsts.F_UPDATED_AT, now));
        if (linked.isEmpty()) return linked;

        // only a draft (or legacy unset) episode moves forward; later stages are kept
        Query draft = new Query(activeOwned(id, userId)
                .orOperator(Criteria.where("episodeStatus").is(EpisodeStatus.DRAFT),
                        Criteria.where("episodeStatus").exists(false)));
        Optional<Decision> explored = modify(draft, new Update().set("episodeStatus", EpisodeStatus.EXPLORED));
        return explored.isPresent() ? explored : linked;
    }

    @Override
    public Optional<Decision> clearScenarioSet(String id, String userId, Instant now) {
        return modify(new Query(activeOwned(id, userId)), new Update()
                .unset("scenariosId")
                .set(DecisionConsts.F_UPDATED_AT, now));
    }

    @Override
    public Optional<Decision> linkOutcome(String id, String userId, String outcomeId, Instant now) {
        return modify(new Query(activeOwned(id, userId)), new Update()
                .set("outcomeId", outcomeId)
                .set(DecisionConsts.F_UPDATED_AT, now));
    }

    @Override
    public Optional<Decision> updateEpisodeStatus(String id, String userId, EpisodeStatus status, Instant now) {
        return modify(new Query(activeOwned(id, userId)), new Update()
                .set("episodeStatus", status)
                .set(DecisionConsts.F_UPDATED_AT, now));
    }

    @Override
    public boolean softDelete(String id, String userId, Instant now) {
        UpdateResult r = mongoTemplate.updateFirst(new Query(activeOwned(id, userId)), softDeleteUpdate(now), Decision.class);
        return r.getMatchedCount() > 0;
    }

    @Override
    public long softDeleteAllForUser(String userId, Instant now) {
        Query q = new Query(Criteria.where(DecisionConsts.F_USER_ID).is(userId)
                .and(DecisionConsts.F_DELETED).ne(true));
        return mongoTemplate.updateMulti(q, softDeleteUpdate(now), Decision.class).getModifiedCount();
    }

    @Override
    public Page<Decision> findPage(String userId, DecisionListParams params, Pageable pageable) {
        Query q = new Query(listCriteria(userId, params));
        long total = mongoTemplate.count(q, Decision.class);

        q.with(Sort.by(Sort.Direction.DESC, DecisionConsts.F_CREATED_AT))
                .skip(pageable.getOffset())
                .limit(pageable.getPageSize());
        List<Decision> rows = mongoTemplate.find(q, Decision.class);
        return new PageImpl<>(rows, pageable, total);
    }

    static Criteria listCriteria(String userId, DecisionListParams p) {
        Criteria c = Criteria.where(DecisionConsts.F_USER_ID).is(userId).and(DecisionConsts.F_DELETED).ne(true);
        if (p == null) return c;

        if (notBlank(p.getStatus())) {
            Optional<DecisionStatus> status = DecisionStatus.fromValue(p.getStatus());
            if (status.isPresent()) {
                c = c.and("status").is(status.get());
            }
        }
        if (notBlank(p.getSegment())) {
            c = c.and("context.market.segment").is(p.getSegment());
        }
        if (notBlank(p.getPrimaryKpi())) {
            c = c.and("context.primaryKpi.value").is(p.getPrimaryKpi());
        }
        if (p.getMinConfidence() != null) {
            c = c.and("verdict.confidenceScore").gte(p.getMinConfidence());
        }
        if (p.getFrom() != null || p.getTo() != null) {
            Criteria created = c.and(DecisionConsts.F_CREATED_AT);
            if (p.getFrom() != null) created = created.gte(p.getFrom());
            if (p.getTo() != null) created = created.lte(p.getTo());
            c = created;
        }
        if (notBlank(p.getSearch())) {
            Pattern rx = Pattern.compile(Pattern.quote(p.getSearch().trim()), Pattern.CASE_INSENSITIVE);
            List<Criteria> any = new ArrayList<>();
            any.add(Criteria.where("companyName").regex(rx));
            any.add(Criteria.where("websiteUrl").regex(rx));
            any.add(Criteria.where("verdict.headline").regex(rx));
            c = c.orOperator(any.toArray(new Criteria[0]));
        }
        return c;
    }

    private Optional<Decision> modify(Query q, Update u) {
        return Optional.ofNullable(mongoTemplate.findAndModify(q, u, RETURN_NEW, Decision.class));
    }

    private static Criteria activeOwned(String id, String userId) {
        return Criteria.where(DecisionConsts.F_ID).is(id)
                .and(DecisionConsts.F_USER_ID).is(userId)
                .and(DecisionConsts.F_DELETED).ne(true);
    }

    private static Update softDeleteUpdate(Instant now) {
        return new Update()
                .set(DecisionConsts.F_DELETED, true)
                .set(DecisionConsts.F_DELETED_AT, now)
                .set(DecisionConsts.F_UPDATED_AT, now);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
