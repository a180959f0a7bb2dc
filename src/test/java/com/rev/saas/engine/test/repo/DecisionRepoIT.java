package com.rev.saas.engine.test.repo;

import com.rev.saas.engine.config.DecisionEngineConfig;
import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.jobs.MongoIndexConfig;
import com.rev.saas.engine.model.ContextField;
import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.MarketContext;
import com.rev.saas.engine.model.StatusEvent;
import com.rev.saas.engine.model.Verdict;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.dto.DecisionListParams;
import com.rev.saas.engine.model.versioning.VersionEntry;
import com.rev.saas.engine.model.versioning.VersionedField;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import com.rev.saas.engine.service.decision.VersionedRecordStore;
import com.rev.saas.engine.test.BaseContainers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@ActiveProfiles("test")
class DecisionRepoIT extends BaseContainers {

    @Autowired
    DecisionRepo decisionRepo;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        decisionRepo.deleteAll();
        MongoIndexConfig.ensureIndexes(mongoTemplate);
    }

    private static DecisionContext context(String stage) {
        return DecisionContext.builder()
                .companyStage(ContextField.builder().value(stage).build())
                .primaryKpi(ContextField.builder().value("mrr_growth").build())
                .market(MarketContext.builder().segment("smb").build())
                .build();
    }

    private Decision insert(String userId, String company, DecisionStatus status, Instant createdAt) {
        Instant at = createdAt.truncatedTo(ChronoUnit.MILLIS);
        List<VersionEntry<DecisionContext>> history = new ArrayList<>();
        history.add(VersionEntry.next(0, context("seed"), userId, "Initial context from creation", at));
        return decisionRepo.insert(Decision.builder()
                .userId(userId)
                .companyName(company)
                .websiteUrl("https://" + company.toLowerCase() + ".io")
                .context(context("seed"))
                .contextVersion(1)
                .contextVersions(history)
                .verdict(Verdict.builder().headline("Raise " + company + " prices").confidenceScore(0.7).build())
                .verdictVersion(1)
                .status(status)
                .episodeStatus(EpisodeStatus.DRAFT)
                .createdAt(at)
                .updatedAt(at)
                .build());
    }

    @Test
    void concurrentAppendsEachGetTheirOwnVersion() throws Exception {
        Decision d = insert("u1", "Acme", DecisionStatus.PROPOSED, Instant.now());
        DecisionEngineConfig config = new DecisionEngineConfig();
        config.setVersionAppendMaxAttempts(50);
        VersionedRecordStore store = new VersionedRecordStore(decisionRepo, config);

        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Decision>> results = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String stage = "stage-" + i;
            results.add(pool.submit(() -> {
                start.await();
                return store.append(d.getId(), "u1", VersionedField.CONTEXT, context(stage), "u1", stage);
            }));
        }
        start.countDown();
        for (Future<Decision> f : results) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        Decision after = decisionRepo.findActive(d.getId(), "u1").orElseThrow();
        assertThat(after.getContextVersion()).isEqualTo(writers + 1);
        assertThat(after.getContextVersions()).hasSize(writers + 1);
        assertThat(after.getContextVersions()).extracting(VersionEntry::getVersion)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, writers + 1).boxed().toList());
        VersionEntry<DecisionContext> last = after.getContextVersions().get(writers);
        assertThat(after.getContext()).isEqualTo(last.getValue());
    }

    @Test
    void softDeletedAndForeignDecisionsAreInvisible() {
        Decision d = insert("u1", "Acme", DecisionStatus.PROPOSED, Instant.now());

        assertThat(decisionRepo.findActive(d.getId(), "intruder")).isEmpty();
        assertThat(decisionRepo.softDelete(d.getId(), "intruder", Instant.now())).isFalse();

        assertThat(decisionRepo.softDelete(d.getId(), "u1", Instant.now())).isTrue();
        assertThat(decisionRepo.softDelete(d.getId(), "u1", Instant.now())).isFalse();
        assertThat(decisionRepo.findActive(d.getId(), "u1")).isEmpty();
        assertThat(decisionRepo.existsActive(d.getId(), "u1")).isFalse();
        assertThat(decisionRepo.findByIdAndUserId(d.getId(), "u1"))
                .hasValueSatisfying(x -> assertThat(x.isDeleted()).isTrue());
        assertThat(decisionRepo.pushStatusEvent(d.getId(), "u1",
                StatusEvent.builder().status(DecisionStatus.APPROVED).build(), Map.of(), Instant.now())).isEmpty();
    }

    @Test
    void statusEventIsAppendedWithSideEffects() {
        Decision d = insert("u1", "Acme", DecisionStatus.PROPOSED, Instant.now());
        Instant at = Instant.parse("2024-02-01T00:00:00Z");

        Decision after = decisionRepo.pushStatusEvent(d.getId(), "u1",
                StatusEvent.builder().id("e1").status(DecisionStatus.IMPLEMENTED).implementedAt(at).createdBy("u1").build(),
                Map.of("implementedAt", at), Instant.now()).orElseThrow();

        assertThat(after.getStatus()).isEqualTo(DecisionStatus.IMPLEMENTED);
        assertThat(after.getImplementedAt()).isEqualTo(at);
        assertThat(after.getStatusEvents()).extracting(StatusEvent::getId).containsExactly("e1");
    }

    @Test
    void episodeOnlyMovesForwardFromDraft() {
        Decision d = insert("u1", "Acme", DecisionStatus.PROPOSED, Instant.now());

        assertThat(decisionRepo.linkScenarioSet(d.getId(), "u1", "s1", Instant.now()).orElseThrow().getEpisodeStatus())
                .isEqualTo(EpisodeStatus.EXPLORED);
        decisionRepo.setChosenScenario(d.getId(), "u1", "aggressive", Instant.now());
        Decision relinked = decisionRepo.linkScenarioSet(d.getId(), "u1", "s2", Instant.now()).orElseThrow();

        assertThat(relinked.getEpisodeStatus()).isEqualTo(EpisodeStatus.PATH_CHOSEN);
        assertThat(relinked.getScenariosId()).isEqualTo("s2");
        assertThat(relinked.getChosenScenarioId()).isEqualTo("aggressive");
    }

    @Test
    void pageIsNewestFirstAndFiltered() {
        Instant now = Instant.now();
        insert("u1", "Acme", DecisionStatus.PROPOSED, now.minusSeconds(300));
        insert("u1", "Globex", DecisionStatus.IMPLEMENTED, now.minusSeconds(200));
        Decision newest = insert("u1", "Initech", DecisionStatus.PROPOSED, now.minusSeconds(100));
        insert("u2", "Umbrella", DecisionStatus.PROPOSED, now);

        Page<Decision> all = decisionRepo.findPage("u1", new DecisionListParams(), PageRequest.of(0, 2));
        assertThat(all.getTotalElements()).isEqualTo(3);
        assertThat(all.getContent()).hasSize(2);
        assertThat(all.getContent().get(0).getId()).isEqualTo(newest.getId());

        Page<Decision> proposed = decisionRepo.findPage("u1",
                DecisionListParams.builder().status("proposed").build(), PageRequest.of(0, 20));
        assertThat(proposed.getContent()).extracting(Decision::getCompanyName).containsExactly("Initech", "Acme");

        Page<Decision> search = decisionRepo.findPage("u1",
                DecisionListParams.builder().search("GLOBEX").build(), PageRequest.of(0, 20));
        assertThat(search.getContent()).extracting(Decision::getCompanyName).containsExactly("Globex");

        Page<Decision> window = decisionRepo.findPage("u1",
                DecisionListParams.builder().from(now.minusSeconds(250)).to(now.minusSeconds(50)).build(),
                PageRequest.of(0, 20));
        assertThat(window.getTotalElements()).isEqualTo(2);

        DecisionListParams allParams = DecisionListParams.builder().build();
        assertThat(decisionRepo.findPage("u1", allParams, PageRequest.of(0, 20)).getTotalElements()).isEqualTo(3);
        assertThat(decisionRepo.softDeleteAllForUser("u1", now)).isEqualTo(3);
        assertThat(decisionRepo.findPage("u1", allParams, PageRequest.of(0, 20)).getTotalElements()).isZero();
        assertThat(decisionRepo.findPage("u2", allParams, PageRequest.of(0, 20)).getTotalElements()).isEqualTo(1);
        assertThat(decisionRepo.findDeletedIds("u1")).hasSize(3);
        assertThat(decisionRepo.findDeletedIds("u2")).isEmpty();
    }
}
