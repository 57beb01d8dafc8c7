package io.otto4j.spi;

/**
 * External execution gateway that runs prompts inside durable conversation sessions.
 *
 * <p>Calls may take arbitrarily long; applying a timeout is the implementation's concern.
 */
public interface SessionGateway {

    /**
     * Returns {@code existingSessionId} when that session is still usable, otherwise creates a new one.
     *
     * @param existingSessionId previously bound session id, may be null
     */
    String ensureSession(String existingSessionId) throws Exception;

    /**
     * Sends one prompt and returns the assistant's raw reply text. The reply is untrusted free text.
     */
    String promptSession(String sessionId, String text, PromptOptions options) throws Exception;
}
