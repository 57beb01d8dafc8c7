package io.otto4j.spi;

import java.util.Map;

/**
 * @param systemPrompt optional system prompt for the session turn
 * @param tools        tool allowlist; {@code false} entries disable a tool
 * @param agent        name of the gateway agent to route the prompt to
 */
public record PromptOptions(
        String systemPrompt,
        Map<String, Boolean> tools,
        String agent
) {
    public PromptOptions {
        tools = tools == null ? Map.of() : Map.copyOf(tools);
    }
}
