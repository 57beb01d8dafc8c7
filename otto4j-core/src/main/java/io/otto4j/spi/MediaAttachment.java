package io.otto4j.spi;

/**
 * A file to deliver as a document or photo.
 */
public record MediaAttachment(
        String filePath,
        String filename,
        String mimeType,
        String caption
) {
}
