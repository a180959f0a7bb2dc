package com.rev.saas.engine.service.outcome;

import com.rev.saas.engine.enums.OutcomeStatus;
import com.rev.saas.engine.model.DecisionOutcome;
import com.rev.saas.engine.model.OutcomeKpi;
import com.rev.saas.engine.model.documents.MeasurableOutcome;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure outcome rules: delta arithmetic and correction-chain resolution.
 */
public final class OutcomeResolver {

    private OutcomeResolver() {
    }

    /**
     * {@code (after - before) / before * 100}; null when either side is missing or the baseline is zero.
     */
    public static Double computeDeltaPercent(Double before, Double after) {
        if (before == null || after == null || before == 0d) return null;
        double pct = (after - before) / before * 100d;
        return Double.isFinite(pct) ? pct : null;
    }

    /**
     * Outcomes that no correction supersedes, latest first.
     * <p>
     * A correction stands in for the record it replaces, so it takes that record's place on the timeline
     * (following chains of corrections). A correction that arrives late for an old record therefore does not
     * outrank measurements taken after that record.
     */
    public static List<DecisionOutcome> effectiveOutcomes(List<DecisionOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) return List.of();

        Map<String, DecisionOutcome> byId = new HashMap<>();
        Set<String> superseded = new HashSet<>();
        for (DecisionOutcome o : outcomes) {
            if (o.getId() != null) byId.put(o.getId(), o);
            if (o.isCorrection() && o.getCorrectsOutcomeId() != null) superseded.add(o.getCorrectsOutcomeId());
        }

        Comparator<DecisionOutcome> latestFirst = Comparator
                .comparing((DecisionOutcome o) -> timelinePosition(o, byId))
                .thenComparing(o -> createdAt(o))
                .reversed();
        return outcomes.stream()
                .filter(o -> o.getId() == null || !superseded.contains(o.getId()))
                .sorted(latestFirst)
                .collect(Collectors.toList());
    }

    public static Optional<DecisionOutcome> effectiveOutcome(List<DecisionOutcome> outcomes) {
        return effectiveOutcomes(outcomes).stream().findFirst();
    }

    /**
     * "+12.5% (30d)" for the effective outcome; empty when there is none or it carries no delta.
     */
    public static String summary(List<DecisionOutcome> outcomes) {
        return effectiveOutcome(outcomes)
                .filter(o -> o.getDeltaPercent() != null)
                .map(o -> String.format(Locale.ROOT, "%s%.1f%% (%dd)",
                        o.getDeltaPercent() < 0 ? "" : "+", o.getDeltaPercent(), o.getTimeframeDays()))
                .orElse("");
    }

    /**
     * Recomputes {@code delta} and {@code deltaPct} from baseline and actual. Both are cleared without an actual.
     */
    public static OutcomeKpi withDeltas(OutcomeKpi kpi) {
        OutcomeKpi out = kpi.toBuilder().delta(null).deltaPct(null).build();
        if (kpi.getActual() == null) return out;
        double base = kpi.getBaseline() == null ? 0d : kpi.getBaseline();
        out.setDelta(kpi.getActual() - base);
        out.setDeltaPct(computeDeltaPercent(base, kpi.getActual()));
        return out;
    }

    /**
     * Achieved or missed, or at least one KPI has an actual.
     */
    public static boolean isComplete(MeasurableOutcome outcome) {
        OutcomeStatus status = outcome.getStatus();
        if (status != null && status.isFinal()) return true;
        return outcome.getKpis() != null && outcome.getKpis().stream().anyMatch(k -> k.getActual() != null);
    }

    private static Instant timelinePosition(DecisionOutcome o, Map<String, DecisionOutcome> byId) {
        Set<String> seen = new HashSet<>();
        DecisionOutcome current = o;
        while (current.isCorrection() && current.getCorrectsOutcomeId() != null && seen.add(current.getCorrectsOutcomeId())) {
            DecisionOutcome target = byId.get(current.getCorrectsOutcomeId());
            if (target == null) break;
            current = target;
        }
        return createdAt(current);
    }

    private static Instant createdAt(DecisionOutcome o) {
        return o.getCreatedAt() == null ? Instant.EPOCH : o.getCreatedAt();
    }
}
