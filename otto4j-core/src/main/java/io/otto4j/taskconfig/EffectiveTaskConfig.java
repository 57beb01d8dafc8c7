package io.otto4j.taskconfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway config after layering base, lane overlay and profile override.
 */
public record EffectiveTaskConfig(ObjectNode opencodeConfig) {

    public static final String ASSISTANT_AGENT = "assistant";

    /**
     * @return {@code agent.assistant.prompt}, or null when absent or blank
     */
    public String assistantPrompt() {
        JsonNode prompt = opencodeConfig.path("agent").path(ASSISTANT_AGENT).path("prompt");
        if (!prompt.isTextual() || prompt.asText().isBlank()) {
            return null;
        }
        return prompt.asText();
    }

    /**
     * @return the boolean entries of {@code agent.assistant.tools}; other values are ignored
     */
    public Map<String, Boolean> assistantTools() {
        JsonNode tools = opencodeConfig.path("agent").path(ASSISTANT_AGENT).path("tools");
        Map<String, Boolean> result = new LinkedHashMap<>();
        if (!tools.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = tools.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isBoolean()) {
                result.put(field.getKey(), field.getValue().booleanValue());
            }
        }
        return result;
    }
}
