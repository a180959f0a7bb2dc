package com.rev.saas.engine.jobs;

import com.rev.saas.engine.common.constants.DecisionConsts;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * MongoDB index bootstrap for the decision engine collections.
 * <p>
 * Unique indexes back the idempotency rules:
 * - scenario_deltas: (verdictId, baselineScenarioId, candidateScenarioId)
 * - measurable_outcomes: (userId, verdictId)
 * - scenario_sets: (decisionId, userId, version)
 * <p>
 * Toggle with decision.mongo.indexes.init=true|false
 */
@Slf4j
@Configuration
public class MongoIndexConfig {

    @Bean
    @ConfigurationProperties(prefix = "decision.mongo.indexes")
    public MongoIndexProps mongoIndexProps() {
        return new MongoIndexProps();
    }

    @Bean
    public ApplicationRunner mongoIndexBootstrap(MongoTemplate mongoTemplate, MongoIndexProps p) {
        return args -> {
            if (!p.isInit()) {
                log.info("Mongo index bootstrap disabled (decision.mongo.indexes.init=false). Skipping.");
                return;
            }
            ensureIndexes(mongoTemplate);
            log.info("Mongo index bootstrap complete.");
        };
    }

    public static void ensureIndexes(MongoTemplate template) {
        IndexOperations decisions = template.indexOps(DecisionConsts.COLLECTION_DECISIONS);
        decisions.ensureIndex(new Index()
                .on(DecisionConsts.F_USER_ID, Sort.Direction.ASC)
                .on(DecisionConsts.F_DELETED, Sort.Direction.ASC)
                .on(DecisionConsts.F_CREATED_AT, Sort.Direction.DESC)
                .named("user_deleted_created"));
        decisions.ensureIndex(new Index()
                .on(DecisionConsts.F_USER_ID, Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named("user_status"));

        template.indexOps(DecisionConsts.COLLECTION_MEASURABLE_OUTCOMES).ensureIndex(new Index()
                .on(DecisionConsts.F_USER_ID, Sort.Direction.ASC)
                .on("verdictId", Sort.Direction.ASC)
                .unique()
                .named("user_verdict_unique"));

        IndexOperations sets = template.indexOps(DecisionConsts.COLLECTION_SCENARIO_SETS);
        sets.ensureIndex(new Index()
                .on("decisionId", Sort.Direction.ASC)
                .on(DecisionConsts.F_USER_ID, Sort.Direction.ASC)
                .on("version", Sort.Direction.ASC)
                .unique()
                .named("decision_user_version_unique"));
        sets.ensureIndex(new Index()
                .on(DecisionConsts.F_USER_ID, Sort.Direction.ASC)
                .on("decisionId", Sort.Direction.ASC)
                .on("version", Sort.Direction.DESC)
                .named("user_decision_version_desc"));

        template.indexOps(DecisionConsts.COLLECTION_SCENARIO_DELTAS).ensureIndex(new Index()
                .on("verdictId", Sort.Direction.ASC)
                .on("baselineScenarioId", Sort.Direction.ASC)
                .on("candidateScenarioId", Sort.Direction.ASC)
                .unique()
                .named("verdict_baseline_candidate_unique"));

        log.debug("Ensured indexes on {}, {}, {}, {}",
                DecisionConsts.COLLECTION_DECISIONS, DecisionConsts.COLLECTION_MEASURABLE_OUTCOMES,
                DecisionConsts.COLLECTION_SCENARIO_SETS, DecisionConsts.COLLECTION_SCENARIO_DELTAS);
    }

    @Data
    public static class MongoIndexProps {
        private boolean init = true;
    }
}
