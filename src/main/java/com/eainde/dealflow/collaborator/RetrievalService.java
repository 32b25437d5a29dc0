package com.eainde.dealflow.collaborator;

import com.eainde.dealflow.model.RetrievedSection;

import java.util.List;

/**
 * Similarity search over earlier proposals and uploaded material.
 */
public interface RetrievalService {

    /**
     * @return up to {@code limit} sections, most relevant first
     */
    List<RetrievedSection> retrieve(String contextText, List<String> requirementTexts, int limit);
}
