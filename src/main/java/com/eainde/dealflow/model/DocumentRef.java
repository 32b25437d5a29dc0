package com.eainde.dealflow.model;

import java.io.Serializable;

/**
 * Metadata of a document that went into the qualification text.
 */
public record DocumentRef(String id, String filename, String category) implements Serializable {

    public static DocumentRef of(SourceDocument document) {
        return new DocumentRef(document.id(), document.filename(), document.category());
    }
}
