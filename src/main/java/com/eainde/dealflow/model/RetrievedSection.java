package com.eainde.dealflow.model;

import java.io.Serializable;

/**
 * Supporting context returned by the retrieval collaborator, ranked by relevance.
 */
public record RetrievedSection(String text, String source, double relevance) implements Serializable {
}
