package com.eainde.dealflow.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A deal document whose text has already been extracted upstream.
 */
public record SourceDocument(
        String id,
        String filename,
        String title,
        String category,
        String extractedText,
        long fileSize,
        boolean processed,
        Instant createdAt
) implements Serializable {

    public String displayTitle() {
        return title != null && !title.isBlank() ? title : filename;
    }
}
