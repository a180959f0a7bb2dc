package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.enums.KpiKey;
import com.rev.saas.engine.enums.OutcomeStatus;
import com.rev.saas.engine.model.OutcomeKpi;
import com.rev.saas.engine.model.documents.MeasurableOutcome;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface MeasurableOutcomeRepoCustom {

    /**
     * Insert-or-update of the single outcome for {@code (userId, verdictId)}. Creation fields are only written on
     * insert. May throw {@link org.springframework.dao.DuplicateKeyException} when two first inserts race.
     */
    MeasurableOutcome upsertForVerdict(String userId, String verdictId, String chosenScenarioId,
                                       List<OutcomeKpi> kpis, int horizonDays, Instant now);

    Optional<MeasurableOutcome> updateStatus(String id, String userId, OutcomeStatus status, Instant now);

    /**
     * Sets the given top-level fields on an owned outcome and bumps {@code updatedAt}.
     */
    Optional<MeasurableOutcome> patch(String id, String userId, Map<String, Object> sets, Instant now);

    /**
     * Positional update of one KPI. Matches only while that KPI still has {@code expectedBaseline}.
     */
    Optional<MeasurableOutcome> setKpiActual(String id, String userId, KpiKey key, Double expectedBaseline,
                                             Double actual, Double delta, Double deltaPct, Instant now);

    /**
     * Newest first, skipping outcomes whose verdict id is in {@code excludedVerdictIds}.
     */
    List<MeasurableOutcome> listByUser(String userId, Collection<String> excludedVerdictIds, int limit, int offset);
}
