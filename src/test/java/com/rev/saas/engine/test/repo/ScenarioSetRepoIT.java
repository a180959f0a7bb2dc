package com.rev.saas.engine.test.repo;

import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.jobs.MongoIndexConfig;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.documents.ScenarioSet;
import com.rev.saas.engine.repo.documents.ScenarioSetRepo;
import com.rev.saas.engine.test.BaseContainers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest
@ActiveProfiles("test")
class ScenarioSetRepoIT extends BaseContainers {

    @Autowired
    ScenarioSetRepo scenarioSetRepo;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        scenarioSetRepo.deleteAll();
        MongoIndexConfig.ensureIndexes(mongoTemplate);
    }

    private ScenarioSet insert(String decisionId, int version) {
        return scenarioSetRepo.insert(ScenarioSet.builder()
                .decisionId(decisionId)
                .userId("u1")
                .version(version)
                .scenarios(List.of(ScenarioItem.builder().scenarioId(ScenarioKey.BALANCED).baseline(true).build()))
                .createdAt(Instant.now())
                .build());
    }

    @Test
    void currentSkipsDeletedButVersionsNeverRepeat() {
        assertThat(scenarioSetRepo.maxVersion("d1", "u1")).isZero();
        assertThat(scenarioSetRepo.findCurrent("d1", "u1")).isEmpty();

        ScenarioSet v1 = insert("d1", 1);
        ScenarioSet v2 = insert("d1", 2);
        insert("d2", 7);

        assertThat(scenarioSetRepo.findCurrent("d1", "u1")).hasValueSatisfying(s -> assertThat(s.getId()).isEqualTo(v2.getId()));

        assertThat(scenarioSetRepo.softDelete(v2.getId(), "u1", Instant.now())).isTrue();
        assertThat(scenarioSetRepo.softDelete(v2.getId(), "u1", Instant.now())).isFalse();

        assertThat(scenarioSetRepo.findCurrent("d1", "u1")).hasValueSatisfying(s -> assertThat(s.getId()).isEqualTo(v1.getId()));
        assertThat(scenarioSetRepo.maxVersion("d1", "u1")).isEqualTo(2);
        assertThat(scenarioSetRepo.findByIdAndUserId(v2.getId(), "u1")).hasValueSatisfying(s -> assertThat(s.isDeleted()).isTrue());
        assertThat(scenarioSetRepo.findCurrent("d1", "intruder")).isEmpty();
    }

    @Test
    void versionIsUniquePerDecisionAndUser() {
        insert("d1", 1);

        assertThatThrownBy(() -> insert("d1", 1)).isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void baselineFlagRoundTrips() {
        ScenarioSet saved = insert("d1", 1);

        ScenarioSet loaded = scenarioSetRepo.findByIdAndUserId(saved.getId(), "u1").orElseThrow();
        assertThat(loaded.find(ScenarioKey.BALANCED)).hasValueSatisfying(i -> assertThat(i.isBaseline()).isTrue());
        assertThat(loaded.find(ScenarioKey.AGGRESSIVE)).isEmpty();
    }
}
