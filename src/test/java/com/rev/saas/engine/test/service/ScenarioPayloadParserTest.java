package com.rev.saas.engine.test.service;

import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.config.CustomConfig;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.service.scenario.ScenarioPayloadParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioPayloadParserTest {

    private final ScenarioPayloadParser parser = new ScenarioPayloadParser(CustomConfig.newMapper());

    private static String item(String id, String tradeoffs) {
        return "{\"scenario_id\": \"" + id + "\", \"title\": \"" + id + " path\", \"summary\": \"s\","
                + " \"metrics\": {\"revenue_impact_range\": \"+10-20%\", \"churn_impact_range\": \"+1-2%\","
                + " \"risk_label\": \"HIGH\", \"time_to_impact\": \"30-60 days\", \"execution_effort\": \"Medium\"},"
                + " \"tradeoffs\": " + tradeoffs + ", \"compared_to_recommended\": \"c\", \"unknown_field\": 1}";
    }

    private static String payload(String... items) {
        return "{\"scenarios\": [" + String.join(",", items) + "]}";
    }

    @Test
    void parsesFencedPayload() {
        String json = "```json\n" + payload(
                item("aggressive", "[\"a\", \"b\", \"c\"]"),
                item("balanced", "[\"a\"]"),
                item("conservative", "[\"a\", \"b\", \"c\", \"d\"]"),
                item("do_nothing", "[]")) + "\n```";

        List<ScenarioItem> items = parser.parse(json);

        assertThat(items).extracting(ScenarioItem::getScenarioId).containsExactly(
                ScenarioKey.AGGRESSIVE, ScenarioKey.BALANCED, ScenarioKey.CONSERVATIVE, ScenarioKey.DO_NOTHING);
        assertThat(items).allSatisfy(i -> assertThat(i.getTradeoffs()).hasSize(3));
        assertThat(items.get(1).getTradeoffs()).containsExactly("a", "Trade-off to be determined", "Trade-off to be determined");
        assertThat(items.get(2).getTradeoffs()).containsExactly("a", "b", "c");
        assertThat(items).filteredOn(ScenarioItem::isBaseline).extracting(ScenarioItem::getScenarioId)
                .containsExactly(ScenarioKey.BALANCED);
        assertThat(items.get(0).getMetrics().getRiskLabel()).isEqualTo("high");
        assertThat(items.get(0).getMetrics().getExecutionEffort()).isEqualTo("medium");
        assertThat(items.get(0).getMetrics().getRevenueImpactRange()).isEqualTo("+10-20%");
    }

    @Test
    void toleratesTrailingCommas() {
        String json = "{\"scenarios\": [" + item("aggressive", "[\"a\",]") + "," + item("balanced", "[]") + ","
                + item("conservative", "[]") + "," + item("do_nothing", "[]") + ",]}";

        assertThat(parser.parse(json)).hasSize(4);
    }

    @Test
    void requiresExactlyFourScenarios() {
        String json = payload(item("aggressive", "[]"), item("balanced", "[]"), item("conservative", "[]"));

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Expected 4 scenarios, got 3");
    }

    @Test
    void rejectsUnknownOrRepeatedIds() {
        String unknown = payload(item("aggressive", "[]"), item("balanced", "[]"), item("conservative", "[]"),
                item("yolo", "[]"));
        assertThatThrownBy(() -> parser.parse(unknown)).hasMessageContaining("Invalid scenario_id: yolo");

        String repeated = payload(item("aggressive", "[]"), item("balanced", "[]"), item("balanced", "[]"),
                item("do_nothing", "[]"));
        assertThatThrownBy(() -> parser.parse(repeated)).hasMessageContaining("Duplicate scenario_id: balanced");
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> parser.parse("not json")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> parser.parse("```\n```")).hasMessageContaining("empty");
    }
}
