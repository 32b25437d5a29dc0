package com.eainde.dealflow.nodes;

import com.eainde.dealflow.extraction.Extraction;
import com.eainde.dealflow.extraction.ExtractionShape;
import com.eainde.dealflow.extraction.ResilientExtractor;
import com.eainde.dealflow.reasoning.ReasoningException;
import com.eainde.dealflow.reasoning.ReasoningPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Prompt in, typed record out. Transport failures and unparseable answers both
 * end in the shape's fallback; the returned {@link Extraction} says which.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredReasoning {

    private final ReasoningPort reasoningPort;
    private final ResilientExtractor extractor;

    public <T> Extraction<T> ask(String prompt, int maxOutputTokens, ExtractionShape<T> shape) {
        String raw;
        try {
            raw = reasoningPort.submit(prompt, maxOutputTokens);
        } catch (ReasoningException e) {
            log.warn("Reasoning call for {} failed: {}", shape.name(), e.getMessage());
            return extractor.unavailable(shape,
                    "Reasoning service unavailable for " + shape.name() + ": " + e.getMessage());
        }
        return extractor.extract(raw, shape);
    }
}
