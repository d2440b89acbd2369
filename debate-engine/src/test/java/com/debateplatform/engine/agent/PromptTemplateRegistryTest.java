package com.debateplatform.engine.agent;

import com.debateplatform.common.exception.DebateConfigurationException;
import com.debateplatform.common.model.AgentRole;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptTemplateRegistryTest {

    private final PromptTemplateRegistry registry = new PromptTemplateRegistry();

    private static Map<String, String> debaterValues() {
        Map<String, String> values = new HashMap<>();
        values.put("kind", "lp_match");
        values.put("primary_id", "fund-1");
        values.put("secondary_id", "lp-9");
        values.put("primary_profile", "{\"name\": \"Fund One\"}");
        values.put("secondary_profile", "{\"name\": \"LP Nine\"}");
        values.put("round", "1");
        values.put("output_schema", "{}");
        values.put("cross_feedback", "");
        return values;
    }

    @Test
    void rendersEveryPlaceholder() {
        String prompt = registry.render("default", AgentRole.BEAR, debaterValues());

        assertThat(prompt).contains("fund-1", "lp-9", "Fund One", "LP Nine");
        assertThat(prompt).doesNotContain("{{");
    }

    @Test
    void valuesAreInsertedLiterally() {
        Map<String, String> values = debaterValues();
        values.put("primary_profile", "{\"fee\": \"$2 and 20%\"}");

        assertThat(registry.render("default", AgentRole.BULL, values)).contains("$2 and 20%");
    }

    @Test
    void missingValueFailsTheRender() {
        Map<String, String> values = debaterValues();
        values.remove("round");

        assertThatThrownBy(() -> registry.render("default", AgentRole.BULL, values))
            .isInstanceOf(DebateConfigurationException.class)
            .hasMessageContaining("{{round}}");
    }

    @Test
    void unknownTemplateSetFails() {
        assertThatThrownBy(() -> registry.render("nonexistent", AgentRole.BULL, debaterValues()))
            .isInstanceOf(DebateConfigurationException.class)
            .hasMessageContaining("prompts/nonexistent/bull.txt");
    }
}
