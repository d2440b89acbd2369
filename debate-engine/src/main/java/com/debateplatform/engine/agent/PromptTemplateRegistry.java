package com.debateplatform.engine.agent;

import com.debateplatform.common.exception.DebateConfigurationException;
import com.debateplatform.common.model.AgentRole;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Role prompt templates, loaded from {@code prompts/<templateSet>/<role>.txt} on the classpath
 * and cached per set and role.
 *
 * <p>Templates use {@code {{name}}} placeholders. A placeholder left without a value fails the
 * render with {@link DebateConfigurationException} instead of reaching the provider.
 */
@Component
public class PromptTemplateRegistry {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([a-z_]+)}}");

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public String render(String templateSet, AgentRole role, Map<String, String> values) {
        String template = templates.computeIfAbsent(templateSet + "/" + role.code(), this::load);

        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            if (value == null) {
                throw new DebateConfigurationException("unresolved placeholder {{" + m.group(1)
                    + "}} in template " + templateSet + "/" + role.code());
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String load(String key) {
        ClassPathResource resource = new ClassPathResource("prompts/" + key + ".txt");
        if (!resource.exists()) {
            throw new DebateConfigurationException("prompt template not found: prompts/" + key + ".txt");
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DebateConfigurationException("prompt template unreadable: prompts/" + key + ".txt", e);
        }
    }
}
