package com.rev.saas.engine.service.scenario;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.ScenarioMetrics;
import com.rev.saas.engine.model.dto.ScenarioPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decodes an externally generated scenario response into exactly four scenario items.
 */
@Slf4j
@Component
public class ScenarioPayloadParser {

    static final int EXPECTED_SCENARIOS = 4;
    static final int TRADEOFF_COUNT = 3;
    static final String TRADEOFF_PLACEHOLDER = "Trade-off to be determined";

    private final ObjectReader reader;

    public ScenarioPayloadParser(ObjectMapper mapper) {
        this.reader = mapper.readerFor(ScenarioPayload.class)
                .with(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature());
    }

    public List<ScenarioItem> parse(String raw) {
        String json = stripCodeFence(raw);
        if (json.isEmpty()) {
            throw new ValidationException("Scenario payload is empty");
        }

        ScenarioPayload payload;
        try {
            payload = reader.readValue(json);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable scenario payload: {}", e.getOriginalMessage());
            throw new ValidationException("Failed to parse scenarios JSON", e);
        }

        List<ScenarioPayload.Item> items = payload == null || payload.getScenarios() == null
                ? List.of() : payload.getScenarios();
        if (items.size() != EXPECTED_SCENARIOS) {
            throw new ValidationException("Expected " + EXPECTED_SCENARIOS + " scenarios, got " + items.size());
        }

        Set<ScenarioKey> seen = EnumSet.noneOf(ScenarioKey.class);
        List<ScenarioItem> out = new ArrayList<>(items.size());
        for (ScenarioPayload.Item item : items) {
            ScenarioKey key = ScenarioKey.fromValue(item.getScenarioId())
                    .orElseThrow(() -> new ValidationException("Invalid scenario_id: " + item.getScenarioId()));
            if (!seen.add(key)) {
                throw new ValidationException("Duplicate scenario_id: " + key.getValue());
            }
            out.add(toItem(key, item));
        }
        log.debug("Parsed {} scenarios", out.size());
        return out;
    }

    static String stripCodeFence(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        if (s.startsWith("```json")) s = s.substring(7);
        else if (s.startsWith("```")) s = s.substring(3);
        if (s.endsWith("```")) s = s.substring(0, s.length() - 3);
        return s.trim();
    }

    private static ScenarioItem toItem(ScenarioKey key, ScenarioPayload.Item item) {
        ScenarioPayload.Metrics m = item.getMetrics() == null ? new ScenarioPayload.Metrics() : item.getMetrics();
        return ScenarioItem.builder()
                .scenarioId(key)
                .title(item.getTitle())
                .summary(item.getSummary())
                .positioning(item.getPositioning())
                .bestWhen(item.getBestWhen())
                .metrics(ScenarioMetrics.builder()
                        .revenueImpactRange(m.getRevenueImpactRange())
                        .churnImpactRange(m.getChurnImpactRange())
                        .riskLabel(lower(m.getRiskLabel()))
                        .timeToImpact(m.getTimeToImpact())
                        .executionEffort(lower(m.getExecutionEffort()))
                        .build())
                .tradeoffs(exactlyThree(item.getTradeoffs()))
                .comparedToRecommended(item.getComparedToRecommended())
                .baseline(key == ScenarioKey.BALANCED)
                .build();
    }

    private static List<String> exactlyThree(List<String> tradeoffs) {
        List<String> out = new ArrayList<>(tradeoffs == null ? List.of() : tradeoffs);
        while (out.size() < TRADEOFF_COUNT) out.add(TRADEOFF_PLACEHOLDER);
        return new ArrayList<>(out.subList(0, TRADEOFF_COUNT));
    }

    private static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
