package com.eainde.dealflow.reasoning;

/**
 * Blocking text generation: one prompt in, raw text out. No structure is
 * guaranteed; callers interpret the answer themselves.
 */
public interface ReasoningPort {

    /**
     * @param prompt          full prompt text
     * @param maxOutputTokens upper bound for the generated answer
     * @return the raw answer, never {@code null}
     * @throws ReasoningException when the service cannot be reached or fails
     */
    String submit(String prompt, int maxOutputTokens);
}
