package com.debateplatform.engine.agent;

import com.debateplatform.common.exception.DebateConfigurationException;
import com.debateplatform.common.model.AgentRole;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * JSON schemas of the structured agent outputs: one shared by both debaters, one for the
 * synthesizer. Loaded once at construction; a missing schema fails startup.
 */
@Component
public class AgentSchemaRegistry {

    static final String DEBATER_SCHEMA   = "schemas/debater-output.json";
    static final String SYNTHESIS_SCHEMA = "schemas/synthesis-output.json";

    private final JsonSchema debaterSchema;
    private final JsonSchema synthesisSchema;
    private final String debaterSchemaText;
    private final String synthesisSchemaText;

    public AgentSchemaRegistry(ObjectMapper objectMapper) {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        JsonNode debater   = read(objectMapper, DEBATER_SCHEMA);
        JsonNode synthesis = read(objectMapper, SYNTHESIS_SCHEMA);
        this.debaterSchema       = factory.getSchema(debater);
        this.synthesisSchema     = factory.getSchema(synthesis);
        this.debaterSchemaText   = debater.toPrettyString();
        this.synthesisSchemaText = synthesis.toPrettyString();
    }

    /** @return violation messages, empty when the payload conforms */
    public List<String> validate(AgentRole role, JsonNode payload) {
        Set<ValidationMessage> messages = schemaFor(role).validate(payload);
        return messages.stream()
            .map(ValidationMessage::getMessage)
            .sorted(Comparator.naturalOrder())
            .toList();
    }

    /** Schema text embedded into the role's prompt. */
    public String schemaText(AgentRole role) {
        return role == AgentRole.SYNTHESIZER ? synthesisSchemaText : debaterSchemaText;
    }

    private JsonSchema schemaFor(AgentRole role) {
        return role == AgentRole.SYNTHESIZER ? synthesisSchema : debaterSchema;
    }

    private static JsonNode read(ObjectMapper objectMapper, String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new DebateConfigurationException("output schema not loadable: " + path, e);
        }
    }
}
