package io.otto4j.spi;

/**
 * Chat transport used by the outbound queue. Every method may throw; a thrown exception counts as a
 * failed delivery attempt.
 */
public interface TransportSender {

    void sendMessage(long chatId, String text) throws Exception;

    void sendDocument(long chatId, MediaAttachment document) throws Exception;

    void sendPhoto(long chatId, MediaAttachment photo) throws Exception;
}
