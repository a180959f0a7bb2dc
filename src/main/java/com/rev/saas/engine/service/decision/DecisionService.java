package com.rev.saas.engine.service.decision;

import com.rev.saas.engine.common.RequestValidator;
import com.rev.saas.engine.common.Result;
import com.rev.saas.engine.common.ServiceCalls;
import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.config.DecisionEngineConfig;
import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.ExpectedImpact;
import com.rev.saas.engine.model.Verdict;
import com.rev.saas.engine.model.WhatToExpect;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.dto.CreateDecisionRequest;
import com.rev.saas.engine.model.dto.DecisionCompareItem;
import com.rev.saas.engine.model.dto.DecisionListItem;
import com.rev.saas.engine.model.dto.DecisionListParams;
import com.rev.saas.engine.model.dto.DecisionPage;
import com.rev.saas.engine.model.dto.RegenerateVerdictRequest;
import com.rev.saas.engine.model.dto.StatusUpdateRequest;
import com.rev.saas.engine.model.dto.UpdateContextRequest;
import com.rev.saas.engine.model.versioning.VersionEntry;
import com.rev.saas.engine.model.versioning.VersionedField;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import com.rev.saas.engine.service.outcome.OutcomeResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for the decision aggregate: creation, versioned context/verdict updates, status transitions,
 * listing and comparison. Every operation is scoped to the owning user and never sees soft-deleted decisions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionService {

    private final DecisionRepo decisionRepo;
    private final DecisionAccess decisionAccess;
    private final VersionedRecordStore versionedRecordStore;
    private final StatusStateMachine statusStateMachine;
    private final RequestValidator requestValidator;
    private final DecisionEngineConfig config;

    // ---------- create / read ----------

    public Result<Decision> createDecision(String userId, CreateDecisionRequest request) {
        return ServiceCalls.capture("decision.create", () -> {
            DecisionAccess.requireUser(userId);
            requestValidator.validate(request, "decision");

            Instant now = Instant.now();
            String websiteUrl = request.getWebsiteUrl().trim();
            String companyName = isBlank(request.getCompanyName())
                    ? CompanyNames.fromUrl(websiteUrl)
                    : request.getCompanyName().trim();
            Verdict verdict = withDerivedLabels(request.getVerdict());

            List<VersionEntry<DecisionContext>> contextVersions = new ArrayList<>();
            contextVersions.add(VersionEntry.next(0, request.getContext(), userId,
                    DecisionConsts.INITIAL_CONTEXT_REASON, now));
            List<VersionEntry<Verdict>> verdictVersions = new ArrayList<>();
            verdictVersions.add(VersionEntry.next(0, verdict, userId, DecisionConsts.INITIAL_VERDICT_REASON, now));

            Decision decision = Decision.builder()
                    .userId(userId)
                    .companyName(companyName)
                    .websiteUrl(websiteUrl)
                    .context(request.getContext())
                    .contextVersion(1)
                    .contextVersions(contextVersions)
                    .verdict(verdict)
                    .verdictVersion(1)
                    .verdictVersions(verdictVersions)
                    .modelMeta(request.getModelMeta())
                    .expectedImpact(ExpectedImpact.from(verdict))
                    .status(DecisionStatus.PROPOSED)
                    .statusEvents(new ArrayList<>(List.of(StatusStateMachine.initialEvent(userId, now))))
                    .episodeStatus(EpisodeStatus.DRAFT)
                    .deleted(false)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            Decision saved = decisionRepo.insert(decision);
            log.info("Created decision {} for {} ({})", saved.getId(), companyName, websiteUrl);
            return saved;
        });
    }

    public Result<Decision> getDecision(String decisionId, String userId) {
        return ServiceCalls.capture("decision.get", () -> decisionAccess.requireOwned(decisionId, userId));
    }

    // ---------- versioned updates ----------

    public Result<Decision> updateContext(String decisionId, String userId, UpdateContextRequest request) {
        return ServiceCalls.capture("decision.updateContext", () -> {
            requestValidator.validate(request, "context update");
            DecisionAccess.requireIds(decisionId, userId);
            return versionedRecordStore.append(decisionId, userId, VersionedField.CONTEXT, request.getContext(),
                    userId, trimToNull(request.getReason()));
        });
    }

    /**
     * Appends a verdict version; {@code modelMeta} and {@code expectedImpact} are refreshed in the same write.
     */
    public Result<Decision> regenerateVerdict(String decisionId, String userId, RegenerateVerdictRequest request) {
        return ServiceCalls.capture("decision.regenerateVerdict", () -> {
            requestValidator.validate(request, "verdict update");
            DecisionAccess.requireIds(decisionId, userId);
            Verdict verdict = withDerivedLabels(request.getVerdict());

            Map<String, Object> extras = new HashMap<>();
            extras.put("expectedImpact", ExpectedImpact.from(verdict));
            if (request.getModelMeta() != null) {
                extras.put("modelMeta", request.getModelMeta());
            }
            return versionedRecordStore.append(decisionId, userId, VersionedField.VERDICT, verdict, userId,
                    trimToNull(request.getReason()), extras);
        });
    }

    public Result<Decision> updateStatus(String decisionId, String userId, StatusUpdateRequest request) {
        return ServiceCalls.capture("decision.updateStatus", () -> {
            requestValidator.validate(request, "status update");
            return statusStateMachine.transition(decisionId, userId, request);
        });
    }

    // ---------- queries ----------

    /**
     * Newest first. Page is 1-based; page size defaults to {@code decision.engine.default-page-size} and is
     * capped at {@code decision.engine.max-page-size}.
     */
    public Result<DecisionPage> listDecisions(String userId, DecisionListParams params) {
        return ServiceCalls.capture("decision.list", () -> {
            DecisionAccess.requireUser(userId);
            DecisionListParams p = params == null ? new DecisionListParams() : params;
            if (!isBlank(p.getStatus())) {
                StatusStateMachine.parseStatus(p.getStatus());
            }
            if (p.getFrom() != null && p.getTo() != null && p.getFrom().isAfter(p.getTo())) {
                throw new ValidationException("from must not be after to");
            }

            int page = p.getPage() == null || p.getPage() < 1 ? 1 : p.getPage();
            int size = pageSize(p.getPageSize());
            Page<Decision> rows = decisionRepo.findPage(userId, p, PageRequest.of(page - 1, size));

            return DecisionPage.builder()
                    .items(rows.getContent().stream().map(DecisionService::toListItem).collect(Collectors.toList()))
                    .total(rows.getTotalElements())
                    .page(page)
                    .pageSize(size)
                    .totalPages(rows.getTotalPages())
                    .build();
        });
    }

    /**
     * Side-by-side view of 2..3 decisions, in request order. Decisions the user cannot see are left out.
     */
    public Result<List<DecisionCompareItem>> compareDecisions(String userId, List<String> ids) {
        return ServiceCalls.capture("decision.compare", () -> {
            DecisionAccess.requireUser(userId);
            Set<String> unique = ids == null ? Set.of() : ids.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (unique.size() < config.getCompareMin() || unique.size() > config.getCompareMax()) {
                throw new ValidationException(String.format("compare needs %d to %d decision ids, got %d",
                        config.getCompareMin(), config.getCompareMax(), unique.size()));
            }

            Map<String, Decision> found = decisionRepo.findActiveByIds(unique, userId).stream()
                    .collect(Collectors.toMap(Decision::getId, Function.identity()));
            return unique.stream()
                    .map(found::get)
                    .filter(Objects::nonNull)
                    .map(DecisionService::toCompareItem)
                    .collect(Collectors.toList());
        });
    }

    // ---------- deletion ----------

    public Result<Void> deleteDecision(String decisionId, String userId) {
        return ServiceCalls.run("decision.delete", () -> {
            DecisionAccess.requireIds(decisionId, userId);
            if (!decisionRepo.softDelete(decisionId, userId, Instant.now())) {
                throw new EntityNotFoundException(DecisionAccess.ENTITY, decisionId);
            }
            log.info("Soft-deleted decision {}", decisionId);
        });
    }

    public Result<Long> deleteUserDecisions(String userId) {
        return ServiceCalls.capture("decision.deleteAll", () -> {
            DecisionAccess.requireUser(userId);
            long n = decisionRepo.softDeleteAllForUser(userId, Instant.now());
            log.info("Soft-deleted {} decisions of user {}", n, userId);
            return n;
        });
    }

    // ---------- mapping ----------

    static DecisionListItem toListItem(Decision d) {
        Verdict v = d.getVerdict();
        DecisionContext c = d.getContext();
        return DecisionListItem.builder()
                .id(d.getId())
                .companyName(d.getCompanyName())
                .websiteUrl(d.getWebsiteUrl())
                .verdictHeadline(v == null ? null : v.getHeadline())
                .confidenceScore(v == null ? null : v.getConfidenceScore())
                .confidenceLabel(v == null ? null : v.getConfidenceLabel())
                .status(d.getStatus())
                .segment(c == null ? null : c.segmentValue())
                .primaryKpi(c == null ? null : c.primaryKpiValue())
                .outcomeSummary(OutcomeResolver.summary(d.getOutcomes()))
                .hasScenarios(d.getScenariosId() != null)
                .chosenScenarioId(d.getChosenScenarioId())
                .episodeStatus(d.getEpisodeStatus())
                .createdAt(d.getCreatedAt())
                .build();
    }

    static DecisionCompareItem toCompareItem(Decision d) {
        Verdict v = d.getVerdict();
        WhatToExpect w = v == null ? null : v.getWhatToExpect();
        return DecisionCompareItem.builder()
                .id(d.getId())
                .companyName(d.getCompanyName())
                .websiteUrl(d.getWebsiteUrl())
                .verdictHeadline(v == null ? null : v.getHeadline())
                .verdictSummary(v == null ? null : v.getSummary())
                .confidenceScore(v == null ? null : v.getConfidenceScore())
                .confidenceLabel(v == null ? null : v.getConfidenceLabel())
                .riskScore(w == null ? null : w.getRiskScore())
                .riskLabel(w == null ? null : w.getRiskLabel())
                .status(d.getStatus())
                .context(d.getContext())
                .expectedImpact(d.getExpectedImpact())
                .latestOutcome(OutcomeResolver.effectiveOutcome(d.getOutcomes()).orElse(null))
                .verdict(v)
                .createdAt(d.getCreatedAt())
                .build();
    }

    /**
     * Fills missing confidence/risk labels from their scores.
     */
    static Verdict withDerivedLabels(Verdict verdict) {
        Verdict v = verdict.toBuilder().build();
        if (isBlank(v.getConfidenceLabel()) && v.getConfidenceScore() != null) {
            v.setConfidenceLabel(Verdict.confidenceLabelFor(v.getConfidenceScore()));
        }
        WhatToExpect w = v.getWhatToExpect();
        if (w != null && isBlank(w.getRiskLabel()) && w.getRiskScore() != null) {
            v.setWhatToExpect(WhatToExpect.builder()
                    .riskScore(w.getRiskScore())
                    .riskLabel(Verdict.riskLabelFor(w.getRiskScore()))
                    .description(w.getDescription())
                    .build());
        }
        return v;
    }

    private int pageSize(Integer requested) {
        if (requested == null || requested <= 0) return config.getDefaultPageSize();
        return Math.min(requested, config.getMaxPageSize());
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static String trimToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
